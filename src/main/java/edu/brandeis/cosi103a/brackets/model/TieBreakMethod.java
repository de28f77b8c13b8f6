package edu.brandeis.cosi103a.brackets.model;

/**
 * Secondary ranking rules applied, in configured order, to teams level on wins.
 */
public enum TieBreakMethod {
    /** Winner of the meeting between exactly two tied teams ranks first. */
    HEAD_TO_HEAD("Head-to-head result"),
    POINTS_DIFFERENTIAL("Points differential"),
    /** Fewer points conceded ranks first. */
    POINTS_AGAINST("Points against"),
    /** Sum of opponents' win counts. */
    BUCHHOLZ("Buchholz score"),
    /** Sum of win counts of opponents this team defeated. */
    SONNEBORN_BERGER("Sonneborn-Berger score"),
    /** Average win percentage of opponents faced. */
    STRENGTH_OF_SCHEDULE("Strength of schedule");

    private final String description;

    TieBreakMethod(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
