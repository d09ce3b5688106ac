package com.bracketeer.generator;

import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.MatchState;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;

import java.util.List;
import java.util.Map;

final class MatchRecords {

    static final String META_BRACKET_TYPE = "bracket_type";
    static final String META_ROUND_NAME = "round_name";
    static final String META_HAS_BYE = "has_bye";
    static final String META_BYE_ADVANCES = "bye_advances";
    static final String META_BRACKET_SIZE = "bracket_size";
    static final String META_PARTICIPANT_COUNT = "participant_count";

    private MatchRecords() {
    }

    static MatchRecord pending(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            int roundNumber,
            int matchNumber,
            BracketSegment segment,
            MatchSlot teamA,
            MatchSlot teamB,
            Map<String, Object> metadata
    ) {
        return new MatchRecord(
                null,
                tournament == null ? null : tournament.id(),
                stage == null ? null : stage.id(),
                roundNumber,
                matchNumber,
                segment,
                teamA,
                teamB,
                MatchState.PENDING,
                metadata
        );
    }

    static void checkParticipantBounds(List<String> errors, String formatLabel, int count, int min, int max) {
        if (count < min) {
            errors.add(formatLabel + " requires at least " + min + " participants (got " + count + ")");
        }
        if (count > max) {
            errors.add(formatLabel + " supports at most " + max + " participants (got " + count + ")");
        }
    }
}
