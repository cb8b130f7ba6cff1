package junie.email.intel.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import junie.email.intel.model.DigestContent;

@Converter
public class DigestContentConverter implements AttributeConverter<DigestContent, String> {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(DigestContent content) {
        if (content == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize digest content", e);
        }
    }

    @Override
    public DigestContent convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, DigestContent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read digest content", e);
        }
    }
}
