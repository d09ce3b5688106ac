package com.bracketeer.preview;

import com.bracketeer.model.Participant;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * JSON request read by the preview runner.
 */
public record BracketPreviewRequest(
        @JsonProperty("tournament")
        Tournament tournament,

        @JsonProperty("stage")
        Stage stage,

        @JsonProperty("participants")
        List<Team> participants,

        @JsonProperty("seeding_method")
        String seedingMethod,

        @JsonProperty("random_seed")
        Long randomSeed,

        @JsonProperty("manual_seeds")
        Map<Long, Integer> manualSeeds
) {

    public record Tournament(
            @JsonProperty("id") Long id,
            @JsonProperty("name") String name,
            @JsonProperty("game_slug") String gameSlug,
            @JsonProperty("stage") String stage,
            @JsonProperty("team_size") Integer teamSize,
            @JsonProperty("max_teams") Integer maxTeams,
            @JsonProperty("status") String status,
            @JsonProperty("start_time") OffsetDateTime startTime,
            @JsonProperty("format_hint") String formatHint
    ) {
        public TournamentDescriptor toDescriptor() {
            return new TournamentDescriptor(id, name, gameSlug, stage, teamSize, maxTeams, status, startTime, formatHint);
        }
    }

    public record Stage(
            @JsonProperty("id") Long id,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("order") Integer order,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("metadata") Map<String, Object> metadata
    ) {
        public StageDescriptor toDescriptor() {
            return new StageDescriptor(id, name, type, order, config, metadata);
        }
    }

    public record Team(
            @JsonProperty("id") Long id,
            @JsonProperty("name") String name
    ) {
        public Participant toParticipant() {
            return new Participant(id, name);
        }
    }
}
