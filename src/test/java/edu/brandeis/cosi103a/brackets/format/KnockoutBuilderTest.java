package edu.brandeis.cosi103a.brackets.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KnockoutBuilderTest {

    @Test
    void seedOrder_eightTeamBracket() {
        assertEquals(List.of(1, 8, 4, 5, 2, 7, 3, 6), KnockoutBuilder.seedOrder(8));
        assertEquals(List.of(1, 2), KnockoutBuilder.seedOrder(2));
    }

    @Test
    void seedOrder_firstRoundSeedsSumToSizePlusOne() {
        List<Integer> order = KnockoutBuilder.seedOrder(64);

        assertEquals(64, order.size());
        for (int i = 0; i < order.size(); i += 2) {
            assertEquals(65, order.get(i) + order.get(i + 1), "Pair at " + i);
        }
        assertEquals(2, order.get(32), "Seed 2 should open the bottom half");
    }

    @Test
    void bracketSize_roundsUpToPowerOfTwo() {
        assertEquals(2, KnockoutBuilder.bracketSize(1));
        assertEquals(2, KnockoutBuilder.bracketSize(2));
        assertEquals(8, KnockoutBuilder.bracketSize(5));
        assertEquals(16, KnockoutBuilder.bracketSize(16));
        assertEquals(4, KnockoutBuilder.roundsFor(16));
    }
}
