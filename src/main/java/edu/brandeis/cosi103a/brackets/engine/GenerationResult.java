package edu.brandeis.cosi103a.brackets.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.brackets.format.BracketResult;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;

import java.util.Optional;

/**
 * Outcome of a generate request: the validation report, plus the bracket when the
 * field was legal. Warnings ride along with a successful bracket.
 */
public record GenerationResult(
    @JsonProperty("validation") ValidatorResult validation,
    @JsonProperty("bracket") Optional<BracketResult> bracket
) {
    public static GenerationResult rejected(ValidatorResult validation) {
        return new GenerationResult(validation, Optional.empty());
    }

    public static GenerationResult generated(ValidatorResult validation, BracketResult bracket) {
        return new GenerationResult(validation, Optional.of(bracket));
    }

    public boolean succeeded() {
        return bracket.isPresent();
    }
}
