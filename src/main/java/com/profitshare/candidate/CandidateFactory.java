package com.profitshare.candidate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.profitshare.exception.MalformedValueException;

import java.util.Map;

/**
 * Factory for creating Candidate records from a field map or a JSON object.
 * Decimal JSON numbers are read as BigDecimal so salaries stay exact.
 */
public class CandidateFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /**
     * Create a Candidate from a field map.
     *
     * @param fields Field values keyed by name, null values are dropped
     * @return Immutable Candidate
     */
    public static Candidate fromMap(Map<String, ?> fields) {
        return Candidate.builder().fields(fields).build();
    }

    /**
     * Create a Candidate from a JSON object.
     *
     * @param json JSON string with top-level field keys
     * @return Immutable Candidate
     */
    public static Candidate fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Candidate.builder().build();
        }
        return fromMap(parseJson(json));
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new MalformedValueException("$", json, "JSON object", e);
        }
    }
}
