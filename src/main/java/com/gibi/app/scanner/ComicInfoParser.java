package com.gibi.app.scanner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.gibi.app.model.ComicMetadata;

/**
 * Converte ComicInfo.xml em {@link ComicMetadata}.
 * <p>
 * Cada elemento filho vira um campo (nome em lowerCamel: {@code Series} → {@code series}).
 * Contagens e datas viram NUMBER; créditos, gêneros e tags separados por vírgula viram LIST.
 * Elementos aninhados (ex.: {@code Pages}) são ignorados. Campos desconhecidos entram como texto.
 */
public final class ComicInfoParser {

    private static final Set<String> NUMBER_FIELDS = Set.of(
            "Volume", "Year", "Month", "Day", "PageCount", "Count", "AlternateCount");

    private static final Set<String> LIST_FIELDS = Set.of(
            "Writer", "Penciller", "Inker", "Colorist", "Letterer", "CoverArtist", "Editor",
            "Genre", "Tags", "Characters", "Teams", "Locations", "StoryArc");

    private final XmlMapper mapper = new XmlMapper();

    public ComicMetadata parse(byte[] xml) throws DescriptorParseException {
        if (xml == null || xml.length == 0) return ComicMetadata.empty();
        JsonNode root;
        try {
            root = mapper.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new DescriptorParseException("ComicInfo.xml malformado: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DescriptorParseException("ComicInfo.xml ilegível: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) return ComicMetadata.empty();

        ComicMetadata.Builder b = ComicMetadata.builder();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String element = e.getKey();
            List<String> texts = texts(e.getValue());
            if (texts.isEmpty()) continue;

            String field = StringUtils.uncapitalize(element);
            if (LIST_FIELDS.contains(element)) {
                List<String> items = new ArrayList<>();
                for (String t : texts) {
                    for (String part : StringUtils.split(t, ',')) {
                        String p = part.trim();
                        if (!p.isEmpty() && !items.contains(p)) items.add(p);
                    }
                }
                if (!items.isEmpty()) b.list(field, items);
            } else if (NUMBER_FIELDS.contains(element)) {
                String t = texts.get(0);
                try {
                    b.number(field, Long.parseLong(t));
                } catch (NumberFormatException nfe) {
                    b.text(field, t);
                }
            } else {
                b.text(field, texts.get(0));
            }
        }
        return b.build();
    }

    /** Texto(s) não vazios de um elemento; elementos repetidos chegam como array. */
    private static List<String> texts(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null) return out;
        if (node.isArray()) {
            node.forEach(n -> {
                if (n.isValueNode()) addIfPresent(out, n.asText());
            });
        } else if (node.isValueNode()) {
            addIfPresent(out, node.asText());
        }
        return out;
    }

    private static void addIfPresent(List<String> out, String raw) {
        String t = StringUtils.trimToNull(raw);
        if (t != null) out.add(t);
    }
}
