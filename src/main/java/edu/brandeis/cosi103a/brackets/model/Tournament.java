package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptor of the tournament being run, as read from the persistence layer.
 *
 * @param maxPoints  points needed to win a game; recorded on bye results
 * @param shortForm  whether matches are played to a shortened format
 * @param maxPlayers registration cap, or null when uncapped
 */
public record Tournament(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("type") TournamentType type,
    @JsonProperty("format") GameFormat format,
    @JsonProperty("status") TournamentStatus status,
    @JsonProperty("maxPoints") int maxPoints,
    @JsonProperty("shortForm") boolean shortForm,
    @JsonProperty("maxPlayers") Integer maxPlayers,
    @JsonProperty("settings") TournamentSettings settings
) {
    public Tournament {
        settings = settings == null ? TournamentSettings.defaults() : settings;
        status = status == null ? TournamentStatus.SETUP : status;
    }

    /**
     * Convenience constructor for a tournament in setup with default settings,
     * games to 13 and no registration cap.
     */
    public Tournament(String id, String name, TournamentType type, GameFormat format) {
        this(id, name, type, format, TournamentStatus.SETUP, 13, false, null, TournamentSettings.defaults());
    }

    public Tournament withType(TournamentType newType) {
        return new Tournament(id, name, newType, format, status, maxPoints, shortForm, maxPlayers, settings);
    }

    public Tournament withSettings(TournamentSettings newSettings) {
        return new Tournament(id, name, type, format, status, maxPoints, shortForm, maxPlayers, newSettings);
    }

    public Tournament withStatus(TournamentStatus newStatus) {
        return new Tournament(id, name, type, format, newStatus, maxPoints, shortForm, maxPlayers, settings);
    }

    public Tournament withMaxPlayers(Integer cap) {
        return new Tournament(id, name, type, format, status, maxPoints, shortForm, cap, settings);
    }

    public Tournament withShortForm(boolean isShortForm) {
        return new Tournament(id, name, type, format, status, maxPoints, isShortForm, maxPlayers, settings);
    }
}
