package com.trellis.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.util.Map;

/**
 * Shared Jackson mapper for response bodies and request parsing. Output is compact so that
 * serialized bodies are byte-stable.
 */
public class JsonUtil {
    private static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private JsonUtil() {
    }

    /**
     * Converts an object to a compact JSON string.
     *
     * @param obj the object to convert
     * @return the JSON string
     * @throws JsonProcessingException if the conversion fails
     */
    public static String toJson(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsString(obj);
    }

    public static <T> T fromJson(String json, Class<T> clazz) throws IOException {
        return mapper.readValue(json, clazz);
    }

    public static Map<String, Object> fromJsonMap(String json) throws IOException {
        return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Parses a JSON string into a tree.
     *
     * @param json the JSON string
     * @return the parsed node
     * @throws IOException if the parsing fails
     */
    public static JsonNode parseJson(String json) throws IOException {
        return mapper.readTree(json);
    }

    public static ObjectMapper getMapper() {
        return mapper;
    }
}
