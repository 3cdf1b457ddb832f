package com.gibi.app.database;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gibi.app.model.ComicMetadata;
import com.gibi.app.model.MetadataValue;

/**
 * Codifica {@link ComicMetadata} na coluna metadata_json.
 * Texto vira string JSON, número vira inteiro JSON, lista vira array de strings.
 */
final class MetadataJson {

    private static final Logger logger = LoggerFactory.getLogger(MetadataJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MetadataJson() {}

    static String encode(ComicMetadata metadata) {
        ObjectNode root = MAPPER.createObjectNode();
        for (Map.Entry<String, MetadataValue> e : metadata.fields().entrySet()) {
            MetadataValue v = e.getValue();
            switch (v.kind()) {
                case TEXT -> root.put(e.getKey(), v.text());
                case NUMBER -> root.put(e.getKey(), v.number());
                case LIST -> {
                    ArrayNode arr = root.putArray(e.getKey());
                    v.list().forEach(arr::add);
                }
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar metadados", e);
        }
    }

    /**
     * Leitura tolerante: coluna nula, JSON quebrado ou tipos inesperados nunca derrubam a leitura.
     */
    static ComicMetadata decode(String json) {
        if (json == null || json.isBlank()) return ComicMetadata.empty();
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            logger.warn("metadata_json ilegível, tratando como vazio: {}", e.getOriginalMessage());
            return ComicMetadata.empty();
        }
        if (root == null || !root.isObject()) return ComicMetadata.empty();

        Map<String, MetadataValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            MetadataValue v = toValue(e.getValue());
            if (v != null) fields.put(e.getKey(), v);
        }
        return ComicMetadata.of(fields);
    }

    private static MetadataValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isIntegralNumber() && node.canConvertToLong()) return MetadataValue.number(node.asLong());
        if (node.isArray()) {
            List<String> items = new ArrayList<>(node.size());
            node.forEach(n -> items.add(n.isValueNode() ? n.asText() : n.toString()));
            return MetadataValue.list(items);
        }
        if (node.isValueNode()) return MetadataValue.text(node.asText());
        return MetadataValue.text(node.toString());
    }
}
