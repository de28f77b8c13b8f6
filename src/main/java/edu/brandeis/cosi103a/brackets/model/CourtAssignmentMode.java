package edu.brandeis.cosi103a.brackets.model;

public enum CourtAssignmentMode {
    AUTOMATIC,
    MANUAL
}
