package edu.brandeis.cosi103a.brackets.model;

/**
 * Who enters match scores. Self-reported scoring takes longer per match.
 */
public enum ScoringMode {
    OFFICIAL,
    SELF_REPORT
}
