package com.talewright.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.springframework.stereotype.Component;

/**
 * JSON codec for {@link RunState} and {@link RunSnapshot}.
 * <p>
 * Used for shutdown snapshots and for the deep copies taken at checkpoints.
 */
@Component
public class RunStateCodec {

    private final ObjectMapper mapper;

    public RunStateCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String toJson(RunState state) {
        return write(state);
    }

    public RunState fromJson(String json) {
        return read(json, RunState.class);
    }

    public String snapshotToJson(RunSnapshot snapshot) {
        return write(snapshot);
    }

    public RunSnapshot snapshotFromJson(String json) {
        return read(json, RunSnapshot.class);
    }

    /**
     * Deep copy through JSON, so the copy shares no mutable structure with the original.
     */
    public RunState copy(RunState state) {
        synchronized (state) {
            return fromJson(toJson(state));
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
