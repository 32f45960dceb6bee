package com.example.transfersim.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * SettlementMetadata 與 JSON 字串之間的轉換
 */
@Converter
public class SettlementMetadataConverter implements AttributeConverter<SettlementMetadata, String> {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    @Override
    public String convertToDatabaseColumn(SettlementMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settlement metadata", e);
        }
    }

    @Override
    public SettlementMetadata convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, SettlementMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize settlement metadata", e);
        }
    }
}
