package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.CourtAssignmentMode;
import edu.brandeis.cosi103a.brackets.model.ScoringMode;
import edu.brandeis.cosi103a.brackets.model.Tournament;

/**
 * Estimates tournament length from the number of matches to be played.
 */
public final class DurationEstimator {

    private DurationEstimator() {}

    /**
     * matches x per-match minutes, scaled down for short form and up for
     * self-reported scoring and manual court assignment.
     *
     * @param tournament   descriptor with the short-form flag and settings
     * @param matchesToPlay matches that need a court (byes excluded)
     * @param config       per-match minutes and scaling factors
     * @return estimated minutes, rounded
     */
    public static long estimateMinutes(Tournament tournament, int matchesToPlay, EngineConfig config) {
        double minutes = (double) matchesToPlay * config.defaultMatchDurationMinutes();
        double factor = 1.0;
        if (tournament.shortForm()) {
            factor *= config.shortFormFactor();
        }
        if (tournament.settings().scoringMode() == ScoringMode.SELF_REPORT) {
            factor *= config.selfReportFactor();
        }
        if (tournament.settings().courtAssignmentMode() == CourtAssignmentMode.MANUAL) {
            factor *= config.manualCourtFactor();
        }
        return Math.round(minutes * factor);
    }
}
