package io.formrules.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formrules.core.error.FormReadException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes JSON request bodies into mutable forms: {@code LinkedHashMap} objects, {@code ArrayList}
 * arrays, and {@code String}, {@code Integer}/{@code Long}/{@code BigInteger}, {@code Double},
 * {@code Boolean} or {@code null} scalars.
 *
 * <p>Thread-safe.
 */
public final class FormReader {

    private static final TypeReference<LinkedHashMap<String, Object>> FORM_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public FormReader() {
        this(new ObjectMapper());
    }

    public FormReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decodes a JSON object.
     *
     * @throws FormReadException if the text is not JSON or its root is not an object
     */
    public Map<String, Object> read(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FormReadException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return toForm(root);
    }

    /**
     * Converts an already parsed JSON tree.
     *
     * @throws FormReadException if the root is not an object
     */
    public Map<String, Object> toForm(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FormReadException("Request body must be a JSON object, got: "
                    + (root == null ? "nothing" : root.getNodeType()));
        }
        return mapper.convertValue(root, FORM_TYPE);
    }
}
