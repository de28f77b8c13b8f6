package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class FormatEnginesTest {

    @Test
    void forType_returnsFormatOfThatType() {
        EngineConfig config = EngineConfig.defaults();
        for (TournamentType type : TournamentType.values()) {
            FormatEngine format = FormatEngines.forType(type, config, new Seeder());

            assertEquals(type, format.type());
            assertFalse(format.description().isBlank(), type + " needs a description");
            assertFalse(format.defaultTieBreaks().isEmpty(), type + " needs a default tie-break chain");
        }
    }

    @Test
    void all_listsEveryFormat() {
        List<FormatEngine> formats = FormatEngines.all(EngineConfig.defaults(), new Seeder());

        assertEquals(TournamentType.values().length, formats.size());
    }

    @Test
    void recommend_followsFieldSizeAndBudget() {
        assertEquals(TournamentType.ROUND_ROBIN, FormatEngines.recommend(4, null));
        assertEquals(TournamentType.ROUND_ROBIN, FormatEngines.recommend(6, null));
        assertEquals(TournamentType.SINGLE_ELIMINATION, FormatEngines.recommend(6, 90));
        assertEquals(TournamentType.SWISS, FormatEngines.recommend(12, null));
        assertEquals(TournamentType.SINGLE_ELIMINATION, FormatEngines.recommend(12, 150));
        assertEquals(TournamentType.SWISS, FormatEngines.recommend(40, 60));
    }
}
