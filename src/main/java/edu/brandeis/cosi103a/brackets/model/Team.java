package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A competing team. Teams are compared by {@link #id()} wherever identity matters;
 * {@code seed} and {@code branch} change as the engine seeds and advances them.
 *
 * <p>{@code club} and {@code region} override the values derived from the members
 * when set.
 */
public record Team(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("members") List<Member> members,
    @JsonProperty("club") String club,
    @JsonProperty("region") String region,
    @JsonProperty("seed") Integer seed,
    @JsonProperty("branch") BracketBranch branch
) {
    private static final Map<String, List<String>> REGION_KEYWORDS = regionKeywords();

    public Team {
        members = members == null ? ImmutableList.of() : ImmutableList.copyOf(members);
        branch = branch == null ? BracketBranch.WINNER : branch;
    }

    /**
     * Constructor for an unseeded team with no explicit club or region.
     */
    public Team(String id, String name, List<Member> members) {
        this(id, name, members, null, null, null, BracketBranch.WINNER);
    }

    /**
     * Average member ranking, unranked members counting as {@link Member#UNRANKED}.
     * Lower is better.
     */
    public double compositeRanking() {
        if (members.isEmpty()) {
            return Member.UNRANKED;
        }
        return members.stream().mapToInt(Member::effectiveRanking).average().orElse(Member.UNRANKED);
    }

    public double averageWinPercentage() {
        return members.stream().mapToDouble(Member::winPercentage).average().orElse(0.0);
    }

    public double averagePointsDifferential() {
        return members.stream().mapToInt(Member::pointsDifferential).average().orElse(0.0);
    }

    /**
     * The team's club: the explicit value, else the most common club among members,
     * else null.
     */
    public String effectiveClub() {
        if (club != null && !club.isBlank()) {
            return club;
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Member m : members) {
            if (m.club() != null && !m.club().isBlank()) {
                counts.merge(m.club(), 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    /**
     * The team's region: the explicit value, else one guessed from keywords in the
     * club name ("Other" if none match), else null when there is no club at all.
     */
    public String effectiveRegion() {
        if (region != null && !region.isBlank()) {
            return region;
        }
        String c = effectiveClub();
        if (c == null) {
            return null;
        }
        String lower = c.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : REGION_KEYWORDS.entrySet()) {
            for (String keyword : e.getValue()) {
                if (lower.contains(keyword)) {
                    return e.getKey();
                }
            }
        }
        return "Other";
    }

    public Team withSeed(int newSeed) {
        return new Team(id, name, members, club, region, newSeed, branch);
    }

    public Team withBranch(BracketBranch newBranch) {
        return new Team(id, name, members, club, region, seed, newBranch);
    }

    public Team withMembers(List<Member> newMembers) {
        return new Team(id, name, newMembers, club, region, seed, branch);
    }

    private static Map<String, List<String>> regionKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("North", List.of("north", "northern"));
        keywords.put("South", List.of("south", "southern"));
        keywords.put("East", List.of("east", "eastern"));
        keywords.put("West", List.of("west", "western"));
        keywords.put("Central", List.of("central", "center"));
        return keywords;
    }
}
