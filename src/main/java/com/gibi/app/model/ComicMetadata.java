package com.gibi.app.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Metadados extraídos do descritor embutido (ComicInfo.xml).
 * <p>
 * Esquema aberto: qualquer campo encontrado é mantido; os nomes conhecidos abaixo são só atalhos.
 */
public final class ComicMetadata {

    public static final String TITLE = "title";
    public static final String SERIES = "series";
    public static final String NUMBER = "number";
    public static final String VOLUME = "volume";
    public static final String YEAR = "year";
    public static final String PUBLISHER = "publisher";
    public static final String TAGS = "tags";

    private static final ComicMetadata EMPTY = new ComicMetadata(Map.of());

    private final Map<String, MetadataValue> fields;

    private ComicMetadata(Map<String, MetadataValue> fields) {
        this.fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public static ComicMetadata empty() {
        return EMPTY;
    }

    public static ComicMetadata of(Map<String, MetadataValue> fields) {
        if (fields == null || fields.isEmpty()) return EMPTY;
        return new ComicMetadata(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, MetadataValue> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Optional<MetadataValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> text(String name) {
        return get(name).map(MetadataValue::asText);
    }

    public OptionalLong number(String name) {
        MetadataValue v = fields.get(name);
        if (v == null || v.kind() != MetadataValue.Kind.NUMBER) return OptionalLong.empty();
        return OptionalLong.of(v.number());
    }

    public List<String> list(String name) {
        MetadataValue v = fields.get(name);
        if (v == null) return List.of();
        return switch (v.kind()) {
            case LIST -> v.list();
            case TEXT -> List.of(v.text());
            case NUMBER -> List.of(Long.toString(v.number()));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComicMetadata other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "ComicMetadata" + fields;
    }

    public static final class Builder {
        private final Map<String, MetadataValue> fields = new TreeMap<>();

        private Builder() {}

        public Builder put(String name, MetadataValue value) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder text(String name, String value) {
            return put(name, MetadataValue.text(value));
        }

        public Builder number(String name, long value) {
            return put(name, MetadataValue.number(value));
        }

        public Builder list(String name, List<String> values) {
            return put(name, MetadataValue.list(values));
        }

        public ComicMetadata build() {
            return ComicMetadata.of(fields);
        }
    }
}
