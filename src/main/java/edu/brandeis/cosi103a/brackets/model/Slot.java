package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * One participant position of a match: a concrete team, a reference to the
 * winner or loser of another match, or a bye.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Slot.Occupied.class, name = "team"),
    @JsonSubTypes.Type(value = Slot.WinnerOf.class, name = "winnerOf"),
    @JsonSubTypes.Type(value = Slot.LoserOf.class, name = "loserOf"),
    @JsonSubTypes.Type(value = Slot.Bye.class, name = "bye")
})
public sealed interface Slot permits Slot.Occupied, Slot.WinnerOf, Slot.LoserOf, Slot.Bye {

    record Occupied(@JsonProperty("team") Team team) implements Slot {}

    record WinnerOf(@JsonProperty("matchId") String matchId) implements Slot {}

    record LoserOf(@JsonProperty("matchId") String matchId) implements Slot {}

    record Bye() implements Slot {}

    static Slot of(Team team) {
        return new Occupied(team);
    }

    static Slot winnerOf(String matchId) {
        return new WinnerOf(matchId);
    }

    static Slot loserOf(String matchId) {
        return new LoserOf(matchId);
    }

    static Slot bye() {
        return new Bye();
    }

    /**
     * The team in this slot, if one has been decided.
     */
    default Optional<Team> occupant() {
        return this instanceof Occupied o ? Optional.of(o.team()) : Optional.empty();
    }

    @JsonIgnore
    default boolean isResolved() {
        return this instanceof Occupied;
    }

    /**
     * Whether this slot is waiting on the given match.
     */
    default boolean awaits(String matchId) {
        if (this instanceof WinnerOf w) {
            return w.matchId().equals(matchId);
        }
        if (this instanceof LoserOf l) {
            return l.matchId().equals(matchId);
        }
        return false;
    }
}
