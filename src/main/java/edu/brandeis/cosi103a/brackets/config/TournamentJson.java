package edu.brandeis.cosi103a.brackets.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.brandeis.cosi103a.brackets.model.Match;

import java.util.List;

/**
 * JSON shape of the engine's inputs and outputs, for the store and for observers.
 */
public final class TournamentJson {

    private static final ObjectMapper MAPPER = ObjectMapperFactory.create()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private TournamentJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes any engine value (match list, progression result, standings).
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " JSON", e);
        }
    }

    public static List<Match> readMatches(String json) {
        try {
            return MAPPER.readValue(json, new TypeReference<List<Match>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed match list JSON", e);
        }
    }
}
