package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;

/**
 * Thrown when a format is asked to generate a bracket for a field that fails validation.
 */
public class InvalidTournamentInputException extends RuntimeException {
    private final ValidatorResult validation;

    public InvalidTournamentInputException(ValidatorResult validation) {
        super("Invalid tournament input: " + String.join("; ", validation.errors()));
        this.validation = validation;
    }

    public ValidatorResult getValidation() {
        return validation;
    }
}
