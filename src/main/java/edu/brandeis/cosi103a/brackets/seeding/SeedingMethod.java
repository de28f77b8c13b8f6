package edu.brandeis.cosi103a.brackets.seeding;

public enum SeedingMethod {
    RANKED,
    RANDOM,
    CLUB_BALANCED,
    GEOGRAPHIC,
    SKILL_BALANCED
}
