package com.phillippitts.routineengine.service.vision;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts detections from detection-service JSON responses.
 * Entries without a label are skipped; a missing score counts as 0.
 */
final class VisionJsonParser {

    private VisionJsonParser() {}

    /**
     * Parses an array of objects, reading the first present score key in order.
     */
    static List<Detection> parse(JSONArray items, String labelKey, String... scoreKeys) {
        if (items == null) {
            return List.of();
        }
        List<Detection> out = new ArrayList<>();
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String label = item.optString(labelKey, "");
            if (label.isBlank()) {
                continue;
            }
            out.add(new Detection(label, score(item, scoreKeys)));
        }
        return List.copyOf(out);
    }

    /**
     * Parses {@code {"<arrayKey>": [...]}}; a body without that array yields no detections.
     */
    static List<Detection> parseField(String json, String arrayKey, String labelKey, String... scoreKeys) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONObject obj = new JSONObject(json);
        return parse(obj.optJSONArray(arrayKey), labelKey, scoreKeys);
    }

    private static double score(JSONObject item, String... keys) {
        for (String key : keys) {
            if (key.contains(".")) {
                String[] parts = key.split("\\.", 2);
                JSONObject nested = item.optJSONObject(parts[0]);
                if (nested != null && nested.has(parts[1]) && !nested.isNull(parts[1])) {
                    return nested.optDouble(parts[1], 0.0);
                }
            } else if (item.has(key) && !item.isNull(key)) {
                return item.optDouble(key, 0.0);
            }
        }
        return 0.0;
    }
}
