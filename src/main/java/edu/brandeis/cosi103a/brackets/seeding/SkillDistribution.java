package edu.brandeis.cosi103a.brackets.seeding;

/**
 * How skill-balanced seeding spreads the ranked field.
 */
public enum SkillDistribution {
    /** Serpentine fill across a bracket width of ceil(sqrt(n)). */
    SNAKE,
    /** Modulo assignment into ceil(n / 4) groups. */
    EVEN,
    /** Shuffle inside each of four skill tiers, keeping tier order. */
    RANDOM
}
