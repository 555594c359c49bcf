package com.concord.core.knowledge;

import com.concord.core.model.Resolution;
import com.concord.core.model.TaskPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of plans and resolutions as kept by the knowledge stores.
 */
public final class PlanCodec {

    private final ObjectMapper objectMapper;

    public PlanCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(TaskPlan plan) {
        return write(plan);
    }

    public TaskPlan decode(String json) {
        try {
            return objectMapper.readValue(json, TaskPlan.class);
        } catch (JsonProcessingException e) {
            throw new KnowledgeStoreException("Failed to deserialize plan", e);
        }
    }

    public String encode(Resolution resolution) {
        return write(resolution);
    }

    public Resolution decodeResolution(String json) {
        try {
            return objectMapper.readValue(json, Resolution.class);
        } catch (JsonProcessingException e) {
            throw new KnowledgeStoreException("Failed to deserialize resolution", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new KnowledgeStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
