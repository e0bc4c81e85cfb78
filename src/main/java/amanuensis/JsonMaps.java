package amanuensis;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reading and writing of flat {@code key -> string | [string, ...]} JSON objects,
 * the shape shared by the abbreviation dictionary and both solution stores.
 */
final class JsonMaps {

    private JsonMaps() {
    }

    static Map<String, List<String>> read(InputStream in) throws IOException {
        byte[] bytes = in.readAllBytes();
        if (new String(bytes, java.nio.charset.StandardCharsets.UTF_8).trim().isEmpty()) {
            return new LinkedHashMap<>();
        }
        JsonNode root = AtomicJsonWriter.mapper().readTree(bytes);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new IOException("Expected a JSON object but found " + root.getNodeType());
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> values = toValues(field.getValue());
            if (!values.isEmpty()) {
                out.put(field.getKey(), values);
            }
        }
        return out;
    }

    /**
     * Single values are written back as plain strings so files stay in the
     * shape people edit by hand.
     */
    static Map<String, Object> toJson(Map<String, List<String>> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : map.entrySet()) {
            List<String> v = e.getValue();
            out.put(e.getKey(), v.size() == 1 ? v.get(0) : new ArrayList<>(v));
        }
        return out;
    }

    static List<String> toValues(JsonNode node) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.asText().isEmpty()) {
                    values.add(item.asText());
                }
            }
            return values;
        }
        String text = node.asText();
        return text.isEmpty() ? Collections.emptyList() : Collections.singletonList(text);
    }
}
