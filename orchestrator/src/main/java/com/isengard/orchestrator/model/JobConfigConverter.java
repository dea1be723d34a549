package com.isengard.orchestrator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Maps {@link JobConfig} to the TEXT column jobs.config_json.
 */
@Converter
public class JobConfigConverter implements AttributeConverter<JobConfig, String> {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(JobConfig config) {
        if (config == null) return "{}";
        try {
            return JSON.writeValueAsString(config.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job config is not serialisable", e);
        }
    }

    @Override
    public JobConfig convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return JobConfig.empty();
        try {
            return new JobConfig(JSON.readValue(column, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job config is not valid JSON", e);
        }
    }
}
