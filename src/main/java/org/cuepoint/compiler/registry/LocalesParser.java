package org.cuepoint.compiler.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads labels files.
 * <p>
 * Two shapes are accepted. The locales shape is an object keyed by locale code whose nested
 * objects hold the translations; a string leaf at {@code nav.home} defines the label
 * {@code nav.home}. The older list shape is an array of {@code {"id": ..., "labels": [{"languageCode": ...}]}}.
 * Keys starting with {@code $} are metadata and skipped.
 */
public final class LocalesParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LocalesParser() {
        // Static utility
    }

    /**
     * Parses a labels file.
     *
     * @param json The file content.
     * @return The locale codes and label summaries.
     * @throws LabelsParseException if the content is not JSON or has neither supported shape.
     */
    public static ParsedLocales parse(String json) throws LabelsParseException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LabelsParseException("Labels file is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new LabelsParseException("Labels file is empty", null);
        }
        if (root.isObject()) {
            return parseLocalesShape(root);
        }
        if (root.isArray()) {
            return parseListShape(root);
        }
        throw new LabelsParseException("Labels file must contain a JSON object or array", null);
    }

    private static ParsedLocales parseLocalesShape(JsonNode root) throws LabelsParseException {
        List<String> locales = new ArrayList<>();
        Map<String, Set<String>> codesById = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> locale = fields.next();
            if (locale.getKey().startsWith("$")) continue;
            if (!locale.getValue().isObject()) {
                throw new LabelsParseException("Translations of locale '" + locale.getKey() + "' must be an object", null);
            }
            locales.add(locale.getKey());
            collectLeaves(locale.getValue(), "", locale.getKey(), codesById);
        }
        return new ParsedLocales(locales, toMetadata(codesById));
    }

    private static void collectLeaves(JsonNode node, String prefix, String locale, Map<String, Set<String>> codesById) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("$")) continue;
            String id = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            if (field.getValue().isTextual()) {
                codesById.computeIfAbsent(id, k -> new TreeSet<>()).add(locale);
            } else if (field.getValue().isObject()) {
                collectLeaves(field.getValue(), id, locale, codesById);
            }
        }
    }

    private static ParsedLocales parseListShape(JsonNode root) throws LabelsParseException {
        Set<String> locales = new LinkedHashSet<>();
        Map<String, Set<String>> codesById = new TreeMap<>();
        for (JsonNode entry : root) {
            String id = entry.path("id").asText(null);
            if (id == null) {
                throw new LabelsParseException("Label entry without 'id'", null);
            }
            Set<String> codes = codesById.computeIfAbsent(id, k -> new TreeSet<>());
            for (JsonNode translation : entry.path("labels")) {
                String code = translation.path("languageCode").asText(null);
                if (code != null) {
                    codes.add(code);
                    locales.add(code);
                }
            }
        }
        return new ParsedLocales(new ArrayList<>(locales), toMetadata(codesById));
    }

    private static List<LabelGroupMetadata> toMetadata(Map<String, Set<String>> codesById) {
        List<LabelGroupMetadata> out = new ArrayList<>(codesById.size());
        for (Map.Entry<String, Set<String>> e : codesById.entrySet()) {
            out.add(new LabelGroupMetadata(e.getKey(), e.getValue().size(), new ArrayList<>(e.getValue())));
        }
        return out;
    }
}
