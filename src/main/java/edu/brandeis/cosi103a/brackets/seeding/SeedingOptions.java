package edu.brandeis.cosi103a.brackets.seeding;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Seeding strategy and its parameters.
 *
 * @param randomSeed makes random shuffles reproducible; null uses the seeder's own source
 */
public record SeedingOptions(
    @JsonProperty("method") SeedingMethod method,
    @JsonProperty("skillDistribution") SkillDistribution skillDistribution,
    @JsonProperty("randomSeed") Long randomSeed
) {
    public SeedingOptions {
        method = method == null ? SeedingMethod.RANKED : method;
        skillDistribution = skillDistribution == null ? SkillDistribution.EVEN : skillDistribution;
    }

    public static SeedingOptions ranked() {
        return new SeedingOptions(SeedingMethod.RANKED, null, null);
    }

    public static SeedingOptions random(long seed) {
        return new SeedingOptions(SeedingMethod.RANDOM, null, seed);
    }

    public static SeedingOptions random() {
        return new SeedingOptions(SeedingMethod.RANDOM, null, null);
    }

    public static SeedingOptions clubBalanced() {
        return new SeedingOptions(SeedingMethod.CLUB_BALANCED, null, null);
    }

    public static SeedingOptions geographic() {
        return new SeedingOptions(SeedingMethod.GEOGRAPHIC, null, null);
    }

    public static SeedingOptions skillBalanced(SkillDistribution distribution) {
        return new SeedingOptions(SeedingMethod.SKILL_BALANCED, distribution, null);
    }

    public SeedingOptions withRandomSeed(long seed) {
        return new SeedingOptions(method, skillDistribution, seed);
    }
}
