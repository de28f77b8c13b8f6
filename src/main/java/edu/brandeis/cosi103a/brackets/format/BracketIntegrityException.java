package edu.brandeis.cosi103a.brackets.format;

/**
 * Thrown when a progression step finds the supplied bracket state inconsistent:
 * the match is not completed, its links point nowhere, or the slot it feeds was
 * already resolved. The caller has to reconcile its stored matches; changing the
 * input will not help.
 */
public class BracketIntegrityException extends RuntimeException {
    private final String matchId;

    public BracketIntegrityException(String matchId, String message) {
        super("Match " + matchId + ": " + message);
        this.matchId = matchId;
    }

    public String getMatchId() {
        return matchId;
    }
}
