package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;

import java.util.List;

/**
 * One match in the bracket tree. {@code feederIds} are the matches whose
 * outcome fills this match's slots; {@code parentId} is where the winner goes.
 */
public record BracketNode(
    @JsonProperty("matchId") String matchId,
    @JsonProperty("round") int round,
    @JsonProperty("position") int position,
    @JsonProperty("branch") BracketBranch branch,
    @JsonProperty("feederIds") List<String> feederIds,
    @JsonProperty("parentId") String parentId
) {
    public BracketNode {
        feederIds = ImmutableList.copyOf(feederIds);
    }
}
