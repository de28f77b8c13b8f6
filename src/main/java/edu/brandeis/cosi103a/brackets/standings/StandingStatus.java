package edu.brandeis.cosi103a.brackets.standings;

public enum StandingStatus {
    ACTIVE,
    /** Certain to finish inside the tournament's qualifying places. */
    QUALIFIED,
    ELIMINATED,
    CHAMPION
}
