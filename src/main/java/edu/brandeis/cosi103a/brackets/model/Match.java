package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single pairing. {@code winnerTo} and {@code loserTo} link elimination matches
 * to the placeholder slots they feed; both are null when the team simply leaves
 * the bracket (or in Swiss and round-robin, which have no links).
 */
public record Match(
    @JsonProperty("id") String id,
    @JsonProperty("tournamentId") String tournamentId,
    @JsonProperty("round") int round,
    @JsonProperty("roundName") String roundName,
    @JsonProperty("branch") BracketBranch branch,
    @JsonProperty("position") int position,
    @JsonProperty("slot1") Slot slot1,
    @JsonProperty("slot2") Slot slot2,
    @JsonProperty("result") MatchResult result,
    @JsonProperty("status") MatchStatus status,
    @JsonProperty("winnerTo") Advancement winnerTo,
    @JsonProperty("loserTo") Advancement loserTo
) {
    public Match {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(slot1, "slot1");
        Objects.requireNonNull(slot2, "slot2");
        Objects.requireNonNull(status, "status");
    }

    public Slot slot(int index) {
        return switch (index) {
            case 1 -> slot1;
            case 2 -> slot2;
            default -> throw new IllegalArgumentException("Slot must be 1 or 2, got " + index);
        };
    }

    /**
     * Copy with one slot replaced. Status moves from PENDING to SCHEDULED once
     * both slots hold teams.
     */
    public Match withSlot(int index, Slot slot) {
        Slot s1 = index == 1 ? slot : slot1;
        Slot s2 = index == 2 ? slot : slot2;
        if (index != 1 && index != 2) {
            throw new IllegalArgumentException("Slot must be 1 or 2, got " + index);
        }
        MatchStatus next = status;
        if (status == MatchStatus.PENDING && s1.isResolved() && s2.isResolved()) {
            next = MatchStatus.SCHEDULED;
        }
        return new Match(id, tournamentId, round, roundName, branch, position, s1, s2, result, next, winnerTo, loserTo);
    }

    public Match withResult(MatchResult newResult) {
        return new Match(id, tournamentId, round, roundName, branch, position, slot1, slot2,
            newResult, MatchStatus.COMPLETED, winnerTo, loserTo);
    }

    public Match withStatus(MatchStatus newStatus) {
        return new Match(id, tournamentId, round, roundName, branch, position, slot1, slot2,
            result, newStatus, winnerTo, loserTo);
    }

    public Match withLinks(Advancement newWinnerTo, Advancement newLoserTo) {
        return new Match(id, tournamentId, round, roundName, branch, position, slot1, slot2,
            result, status, newWinnerTo, newLoserTo);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == MatchStatus.COMPLETED;
    }

    /**
     * A bye match has one real team and a bye marker; it counts as a win for the team.
     */
    @JsonIgnore
    public boolean isBye() {
        return slot1 instanceof Slot.Bye || slot2 instanceof Slot.Bye;
    }

    /**
     * Ids of the concrete teams currently in this match's slots.
     */
    public List<String> participantIds() {
        List<String> ids = new ArrayList<>(2);
        slot1.occupant().ifPresent(t -> ids.add(t.id()));
        slot2.occupant().ifPresent(t -> ids.add(t.id()));
        return ids;
    }

    public boolean involves(String teamId) {
        return participantIds().contains(teamId);
    }

    /**
     * Slot index (1 or 2) of the given team, or 0 if it is not in this match.
     */
    public int slotOf(String teamId) {
        if (slot1.occupant().map(t -> t.id().equals(teamId)).orElse(false)) {
            return 1;
        }
        if (slot2.occupant().map(t -> t.id().equals(teamId)).orElse(false)) {
            return 2;
        }
        return 0;
    }

    public Optional<Team> winner() {
        if (result == null || result.winnerId() == null) {
            return Optional.empty();
        }
        int idx = slotOf(result.winnerId());
        return idx == 0 ? Optional.empty() : slot(idx).occupant();
    }

    public Optional<Team> loser() {
        if (result == null || result.winnerId() == null || isBye()) {
            return Optional.empty();
        }
        int idx = slotOf(result.winnerId());
        return idx == 0 ? Optional.empty() : slot(3 - idx).occupant();
    }

    public Optional<String> opponentOf(String teamId) {
        int idx = slotOf(teamId);
        if (idx == 0) {
            return Optional.empty();
        }
        return slot(3 - idx).occupant().map(Team::id);
    }

    /**
     * Points scored by the team in the given slot.
     */
    public int scoreFor(int slotIndex) {
        if (result == null) {
            return 0;
        }
        return slotIndex == 1 ? result.score1() : result.score2();
    }
}
