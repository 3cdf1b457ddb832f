package com.gibi.app.model;

import java.util.List;
import java.util.Objects;

/**
 * Valor tipado de um campo de metadados: texto, número inteiro ou lista de textos.
 */
public record MetadataValue(Kind kind, String text, Long number, List<String> list) {

    public enum Kind { TEXT, NUMBER, LIST }

    public MetadataValue {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case TEXT -> {
                Objects.requireNonNull(text, "text");
                number = null;
                list = null;
            }
            case NUMBER -> {
                Objects.requireNonNull(number, "number");
                text = null;
                list = null;
            }
            case LIST -> {
                list = List.copyOf(Objects.requireNonNull(list, "list"));
                text = null;
                number = null;
            }
        }
    }

    public static MetadataValue text(String value) {
        return new MetadataValue(Kind.TEXT, value, null, null);
    }

    public static MetadataValue number(long value) {
        return new MetadataValue(Kind.NUMBER, null, value, null);
    }

    public static MetadataValue list(List<String> values) {
        return new MetadataValue(Kind.LIST, null, null, values);
    }

    /** Representação textual usada em filtros e logs. */
    public String asText() {
        return switch (kind) {
            case TEXT -> text;
            case NUMBER -> Long.toString(number);
            case LIST -> String.join(", ", list);
        };
    }
}
