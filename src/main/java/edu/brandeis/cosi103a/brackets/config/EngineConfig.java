package edu.brandeis.cosi103a.brackets.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Engine-wide tuning, loaded from the {@code format-engine.json} classpath resource.
 *
 * @param defaultMatchDurationMinutes base duration of one match for estimates
 * @param shortFormFactor             duration multiplier for short-form tournaments
 * @param selfReportFactor            duration multiplier when players report their own scores
 * @param manualCourtFactor           duration multiplier when courts are assigned by hand
 * @param recentResultsWindow         how many recent results a standing keeps
 * @param pairingSearchBudget         Swiss pairing search steps before rematches are allowed
 */
public record EngineConfig(
    @JsonProperty("defaultMatchDurationMinutes") int defaultMatchDurationMinutes,
    @JsonProperty("shortFormFactor") double shortFormFactor,
    @JsonProperty("selfReportFactor") double selfReportFactor,
    @JsonProperty("manualCourtFactor") double manualCourtFactor,
    @JsonProperty("recentResultsWindow") int recentResultsWindow,
    @JsonProperty("pairingSearchBudget") int pairingSearchBudget
) {
    static final String RESOURCE = "/format-engine.json";

    public EngineConfig {
        if (defaultMatchDurationMinutes <= 0) {
            throw new IllegalArgumentException("defaultMatchDurationMinutes must be positive");
        }
        if (recentResultsWindow <= 0) {
            throw new IllegalArgumentException("recentResultsWindow must be positive");
        }
        if (pairingSearchBudget <= 0) {
            throw new IllegalArgumentException("pairingSearchBudget must be positive");
        }
    }

    /**
     * The bundled configuration.
     */
    public static EngineConfig defaults() {
        ObjectMapper mapper = ObjectMapperFactory.create();
        try (InputStream in = EngineConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return mapper.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Reads overrides; fields missing from the stream keep their bundled values.
     *
     * @param overrides JSON object with any subset of the fields
     * @return the merged configuration
     * @throws IOException if the stream is not a JSON object
     */
    public static EngineConfig load(InputStream overrides) throws IOException {
        ObjectMapper mapper = ObjectMapperFactory.create();
        ObjectNode merged = mapper.valueToTree(defaults());
        JsonNode patch = mapper.readTree(overrides);
        if (patch == null || !patch.isObject()) {
            throw new IOException("Engine configuration must be a JSON object");
        }
        merged.setAll((ObjectNode) patch);
        return mapper.treeToValue(merged, EngineConfig.class);
    }
}
