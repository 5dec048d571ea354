package com.incidentsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.incidentsentinel.core.model.Incident;

/**
 * Jackson codec shared by the incident store, the metrics file adapter and
 * the HTTP API.
 *
 * <p>
 * Instants are written as ISO-8601 strings and unknown properties are
 * ignored on read, so records written by older builds stay readable.
 * </p>
 */
public final class IncidentJson {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private IncidentJson() {
    }

    /**
     * @return the shared, fully configured mapper (thread-safe once configured)
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Create a new mapper with the service's settings.
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Serialize one incident as a single-line JSON document.
     */
    public static String toJsonLine(Incident incident) throws JsonProcessingException {
        return MAPPER.writeValueAsString(incident);
    }

    /**
     * Parse one JSON document into an {@link Incident}.
     *
     * @throws JsonProcessingException if the line is not valid JSON or lacks
     *                                 a required field
     */
    public static Incident fromJsonLine(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, Incident.class);
    }
}
