package com.poc.salesingest.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Shared prompt/response plumbing for model calls that work on a table preview.
 */
public final class ModelPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelPayloads() {
    }

    /**
     * The preview as a split-orientation table: {@code {"columns":["col0",...],"index":[0,...],"data":[[...]]}}.
     */
    public static String previewAsSplitJson(List<List<String>> preview) {
        int maxCols = 0;
        for (List<String> row : preview) {
            maxCols = Math.max(maxCols, row.size());
        }
        ObjectNode split = MAPPER.createObjectNode();
        ArrayNode columns = split.putArray("columns");
        for (int i = 0; i < maxCols; i++) {
            columns.add("col" + i);
        }
        ArrayNode index = split.putArray("index");
        for (int i = 0; i < preview.size(); i++) {
            index.add(i);
        }
        ArrayNode data = split.putArray("data");
        for (List<String> row : preview) {
            ArrayNode cells = data.addArray();
            row.forEach(cells::add);
        }
        try {
            return MAPPER.writeValueAsString(split);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Preview serialisation failed", e);
        }
    }

    /**
     * Removes a surrounding markdown code fence ({@code ```json ... ```}) if the model added one.
     */
    public static String stripFences(String text) {
        String t = text == null ? "" : text.trim();
        if (t.startsWith("```json")) {
            t = t.substring("```json".length());
        } else if (t.startsWith("```")) {
            t = t.substring(3);
        }
        if (t.endsWith("```")) {
            t = t.substring(0, t.length() - 3);
        }
        return t.trim();
    }
}
