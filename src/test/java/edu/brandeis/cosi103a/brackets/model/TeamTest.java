package edu.brandeis.cosi103a.brackets.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TeamTest {

    @Test
    void compositeRanking_averagesMembersAndCountsUnrankedAsLast() {
        Team pair = new Team("d1", "Pair", List.of(new Member("a", "A", 10), new Member("b", "B", null)));

        assertEquals((10 + Member.UNRANKED) / 2.0, pair.compositeRanking(), 1e-9);
        assertEquals(Member.UNRANKED, new Team("e", "Empty", List.of()).compositeRanking(), 1e-9);
    }

    @Test
    void effectiveClub_prefersExplicitThenMostCommonMemberClub() {
        Team triple = new Team("t", "Triple", List.of(
            new Member("a", "A", 1, "Lakeside"),
            new Member("b", "B", 2, "Riverside"),
            new Member("c", "C", 3, "Riverside")));

        assertEquals("Riverside", triple.effectiveClub());
        Team explicit = new Team("t", "Triple", triple.members(), "Home Club", null, null, null);
        assertEquals("Home Club", explicit.effectiveClub());
        assertNull(new Team("x", "X", List.of(new Member("a", "A", 1))).effectiveClub());
    }

    @Test
    void effectiveRegion_guessesFromClubName() {
        Team north = new Team("n", "N", List.of(new Member("a", "A", 1, "Northern Boules")));
        Team central = new Team("c", "C", List.of(new Member("b", "B", 1, "City Center Club")));
        Team other = new Team("o", "O", List.of(new Member("c", "C", 1, "Harbour")));

        assertEquals("North", north.effectiveRegion());
        assertEquals("Central", central.effectiveRegion());
        assertEquals("Other", other.effectiveRegion());
        assertNull(new Team("x", "X", List.of(new Member("d", "D", 1))).effectiveRegion());
    }

    @Test
    void constructor_defaultsBranchToWinner() {
        Team team = new Team("a", "A", List.of());

        assertEquals(BracketBranch.WINNER, team.branch());
        assertEquals(BracketBranch.LOSER, team.withBranch(BracketBranch.LOSER).branch());
        assertEquals(3, team.withSeed(3).seed());
    }
}
