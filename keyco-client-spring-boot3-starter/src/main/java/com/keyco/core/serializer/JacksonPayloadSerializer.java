package com.keyco.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyco.core.spi.PayloadSerializer;

import java.util.LinkedHashMap;
import java.util.Map;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(new ObjectMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Map<String, Object> readObject(String body) {
        if (body == null) {
            return null;
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON response body", e);
        }
        // 数组/标量/空白体
        if (root == null || !root.isObject()) {
            return null;
        }
        return mapper.convertValue(root, FIELDS);
    }

    @Override
    public String writeBody(Map<String, Object> fields) {
        Map<String, Object> present = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (v != null) {
                present.put(k, v);
            }
        });
        try {
            return mapper.writeValueAsString(present);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request body", e);
        }
    }
}
