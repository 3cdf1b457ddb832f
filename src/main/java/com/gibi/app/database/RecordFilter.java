package com.gibi.app.database;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.gibi.app.model.MetadataValue;
import com.gibi.app.model.ScanState;

/**
 * Filtro de consulta sobre o índice. Sem critérios, devolve tudo (ordenado por path).
 */
public final class RecordFilter {

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z0-9_]+");

    public record FieldMatch(String field, MetadataValue value, boolean listContains) {}

    private final String pathPrefix;
    private final ScanState state;
    private final List<FieldMatch> fields;
    private final int limit;

    private RecordFilter(String pathPrefix, ScanState state, List<FieldMatch> fields, int limit) {
        this.pathPrefix = pathPrefix;
        this.state = state;
        this.fields = List.copyOf(fields);
        this.limit = limit;
    }

    public static RecordFilter all() {
        return new RecordFilter(null, null, List.of(), 0);
    }

    public RecordFilter under(Path dir) {
        String prefix = IndexStore.key(dir);
        if (!prefix.endsWith(dir.getFileSystem().getSeparator())) {
            prefix = prefix + dir.getFileSystem().getSeparator();
        }
        return new RecordFilter(prefix, state, fields, limit);
    }

    public RecordFilter inState(ScanState s) {
        return new RecordFilter(pathPrefix, s, fields, limit);
    }

    public RecordFilter where(String field, MetadataValue value) {
        return withField(new FieldMatch(checkField(field), Objects.requireNonNull(value, "value"), false));
    }

    public RecordFilter whereText(String field, String value) {
        return where(field, MetadataValue.text(value));
    }

    public RecordFilter whereNumber(String field, long value) {
        return where(field, MetadataValue.number(value));
    }

    /** Campo do tipo lista contendo o valor (ex.: tags). */
    public RecordFilter whereListContains(String field, String value) {
        return withField(new FieldMatch(checkField(field), MetadataValue.text(value), true));
    }

    public RecordFilter limit(int max) {
        return new RecordFilter(pathPrefix, state, fields, Math.max(0, max));
    }

    public String pathPrefix() { return pathPrefix; }
    public ScanState state() { return state; }
    public List<FieldMatch> fields() { return fields; }
    public int limit() { return limit; }

    private RecordFilter withField(FieldMatch m) {
        List<FieldMatch> next = new ArrayList<>(fields);
        next.add(m);
        return new RecordFilter(pathPrefix, state, next, limit);
    }

    private static String checkField(String field) {
        if (field == null || !FIELD_NAME.matcher(field).matches()) {
            throw new IllegalArgumentException("Nome de campo inválido: " + field);
        }
        return field;
    }
}
