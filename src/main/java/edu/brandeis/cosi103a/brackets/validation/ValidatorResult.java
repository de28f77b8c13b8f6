package edu.brandeis.cosi103a.brackets.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of checking a field against a format. Errors block generation;
 * warnings and suggestions do not.
 */
public record ValidatorResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("suggestions") List<String> suggestions
) {
    public ValidatorResult {
        errors = errors == null ? ImmutableList.of() : ImmutableList.copyOf(errors);
        warnings = warnings == null ? ImmutableList.of() : ImmutableList.copyOf(warnings);
        suggestions = suggestions == null ? ImmutableList.of() : ImmutableList.copyOf(suggestions);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A result with errors cannot be valid");
        }
    }

    /**
     * Builds a result whose validity is derived from whether there are errors.
     */
    public static ValidatorResult of(List<String> errors, List<String> warnings, List<String> suggestions) {
        return new ValidatorResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    public static ValidatorResult ok() {
        return of(List.of(), List.of(), List.of());
    }

    public static ValidatorResult error(String message) {
        return of(List.of(message), List.of(), List.of());
    }

    /**
     * Combines two results; the combination is valid only if both are.
     */
    public ValidatorResult merge(ValidatorResult other) {
        return of(
            ImmutableList.<String>builder().addAll(errors).addAll(other.errors).build(),
            ImmutableList.<String>builder().addAll(warnings).addAll(other.warnings).build(),
            ImmutableList.<String>builder().addAll(suggestions).addAll(other.suggestions).build());
    }

    public ValidatorResult withWarning(String warning) {
        return merge(of(List.of(), List.of(warning), List.of()));
    }
}
