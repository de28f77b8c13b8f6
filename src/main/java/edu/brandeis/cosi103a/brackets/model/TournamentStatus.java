package edu.brandeis.cosi103a.brackets.model;

public enum TournamentStatus {
    SETUP,
    REGISTRATION,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
