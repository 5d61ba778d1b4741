package com.freightplatform.loadservice.core.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores free-form status details as a JSON object in a text column.
 * Hibernate resolves the converter through Spring, so it shares the application's mapper.
 */
@Component
@Converter
@RequiredArgsConstructor
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @Override
    public String convertToDatabaseColumn(Map<String, Object> attribute) {
        Map<String, Object> value = attribute == null ? Collections.emptyMap() : attribute;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new SerializationFailedException("Could not write status details as JSON", e);
        }
    }

    @Override
    public Map<String, Object> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(dbData, MAP_TYPE);
        } catch (JacksonException e) {
            throw new SerializationFailedException("Could not read status details from JSON", e);
        }
    }
}
