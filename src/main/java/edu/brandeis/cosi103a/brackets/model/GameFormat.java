package edu.brandeis.cosi103a.brackets.model;

/**
 * How many members make up one team.
 */
public enum GameFormat {
    SINGLES(1),
    DOUBLES(2),
    TRIPLES(3);

    private final int membersPerTeam;

    GameFormat(int membersPerTeam) {
        this.membersPerTeam = membersPerTeam;
    }

    public int membersPerTeam() {
        return membersPerTeam;
    }
}
