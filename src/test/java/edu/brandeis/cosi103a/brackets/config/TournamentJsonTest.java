package edu.brandeis.cosi103a.brackets.config;

import com.fasterxml.jackson.databind.JsonNode;
import edu.brandeis.cosi103a.brackets.Fixtures;
import edu.brandeis.cosi103a.brackets.format.SingleEliminationFormat;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TournamentJsonTest {

    private static List<Match> fiveTeamBracket() {
        SingleEliminationFormat format = new SingleEliminationFormat(EngineConfig.defaults(), new Seeder());
        return format.generate(Fixtures.tournament(TournamentType.SINGLE_ELIMINATION), Fixtures.teams(5),
            SeedingOptions.ranked()).matches();
    }

    @Test
    void write_tagsSlotsByKind() throws Exception {
        List<Match> matches = fiveTeamBracket();

        JsonNode tree = TournamentJson.mapper().readTree(TournamentJson.write(matches));

        JsonNode semi = tree.get(1);
        assertEquals("t1-W2-1", semi.get("id").asText());
        assertEquals("team", semi.get("slot1").get("kind").asText());
        assertEquals("T1", semi.get("slot1").get("team").get("id").asText());
        assertEquals("winnerOf", semi.get("slot2").get("kind").asText());
        assertEquals("t1-W1-2", semi.get("slot2").get("matchId").asText());
        assertEquals("PENDING", semi.get("status").asText());
        assertFalse(semi.has("completed"), "Derived flags are not serialized");
    }

    @Test
    void readMatches_restoresStoredBracket() {
        List<Match> matches = fiveTeamBracket();

        List<Match> restored = TournamentJson.readMatches(TournamentJson.write(matches));

        assertEquals(matches, restored);
        assertEquals(Slot.winnerOf("t1-W1-2"), restored.get(1).slot2());
    }

    @Test
    void read_rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> TournamentJson.read("{not json", Match.class));
    }
}
