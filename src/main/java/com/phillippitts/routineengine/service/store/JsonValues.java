package com.phillippitts.routineengine.service.store;

import com.phillippitts.routineengine.domain.PayloadValues;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between plain Java values (maps, lists, scalars) and org.json trees.
 *
 * <p>Nulls survive in both directions. Numbers come back in {@link PayloadValues} form: whole values
 * as {@link Long}, others as {@link Double}. org.json writes {@code 80.0} as {@code 80}.
 */
final class JsonValues {

    private JsonValues() {}

    static Object toJson(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            JSONObject obj = new JSONObject();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                obj.put(String.valueOf(e.getKey()), toJson(e.getValue()));
            }
            return obj;
        }
        if (value instanceof Collection<?> items) {
            JSONArray arr = new JSONArray();
            for (Object item : items) {
                arr.put(toJson(item));
            }
            return arr;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return value.toString();
    }

    static Object fromJson(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof JSONObject obj) {
            return toMap(obj);
        }
        if (value instanceof JSONArray arr) {
            return toList(arr);
        }
        if (value instanceof Number n) {
            return PayloadValues.normalizeValue(n);
        }
        return value;
    }

    static Map<String, Object> toMap(JSONObject obj) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : obj.keySet()) {
            map.put(key, fromJson(obj.opt(key)));
        }
        return map;
    }

    static List<Object> toList(JSONArray arr) {
        List<Object> list = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            list.add(fromJson(arr.opt(i)));
        }
        return list;
    }

    static String optText(JSONObject obj, String key) {
        if (obj == null || !obj.has(key) || obj.isNull(key)) {
            return null;
        }
        return String.valueOf(obj.get(key));
    }
}
