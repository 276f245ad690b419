package org.masmtext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a label map from a JSON object: {@code {"0x401000": "main", "4198400": "start"}}.
 */
public final class LabelMapLoader {
    private static final ObjectMapper OM = new ObjectMapper();

    private LabelMapLoader() {}

    public static LabelMap load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static LabelMap read(InputStream in) throws IOException {
        return fromJson(OM.readTree(in));
    }

    public static LabelMap fromJson(JsonNode root) {
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("label map must be a JSON object");
        LabelMap.Builder b = LabelMap.builder();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isTextual())
                throw new IllegalArgumentException("label for " + e.getKey() + " is not a string");
            b.put(JsonNumbers.parseUnsigned(e.getKey()), e.getValue().asText());
        }
        return b.build();
    }
}
