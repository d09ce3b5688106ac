package com.bracketeer.generator;

import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.DoubleEliminationConfig;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;
import com.bracketeer.model.StageConfigCodec;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Winners bracket, losers bracket and grand finals, with an optional conditional reset match.
 *
 * <p>The losers bracket has {@code 2 * (winnersRounds - 1)} rounds. Odd losers rounds are played
 * only between losers-bracket survivors (round 1 between winners-round-1 losers); each even round
 * pits those survivors against the players dropping out of the next winners round, so its match
 * count equals the previous round's. The count halves after every even round.
 */
@Component
@RequiredArgsConstructor
public class DoubleEliminationGenerator implements BracketGenerator {

    public static final String FORMAT_KEY = "double_elim";
    static final String RESET_CONDITION =
            "Only played if the losers bracket champion wins the first grand finals match";
    static final String META_IS_CONDITIONAL = "is_conditional";
    static final String META_CONDITION = "condition";
    static final String META_LOSERS_ROUND_TYPE = "losers_round_type";
    static final String META_DROP_IN_FROM_WINNERS_ROUND = "drop_in_from_winners_round";

    private static final Logger log = LoggerFactory.getLogger(DoubleEliminationGenerator.class);

    private final BracketeerEngineProperties properties;

    @Override
    public String formatKey() {
        return FORMAT_KEY;
    }

    @Override
    public List<String> aliases() {
        return List.of("double_elimination");
    }

    @Override
    public ValidationResult validate(TournamentDescriptor tournament, StageDescriptor stage, int participantCount) {
        BracketeerEngineProperties.DoubleElimination bounds = properties.getDoubleElimination();
        List<String> errors = new ArrayList<>();
        MatchRecords.checkParticipantBounds(
                errors,
                "Double elimination",
                participantCount,
                bounds.getMinParticipants(),
                bounds.getMaxParticipants()
        );
        if (stage != null) {
            try {
                StageConfigCodec.doubleElimination(stage, bounds.isGrandFinalsReset());
            } catch (IllegalArgumentException ex) {
                errors.add(ex.getMessage());
            }
        }
        return ValidationResult.of(errors);
    }

    @Override
    public List<MatchRecord> generate(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            List<Participant> participants
    ) {
        DoubleEliminationConfig config =
                StageConfigCodec.doubleElimination(stage, properties.getDoubleElimination().isGrandFinalsReset());
        int participantCount = participants.size();
        int winnersRounds = EliminationRounds.roundCount(participantCount);

        List<MatchRecord> matches = new ArrayList<>(EliminationRounds.build(
                tournament,
                stage,
                participants,
                BracketSegment.WINNERS,
                FORMAT_KEY,
                "Winners "
        ));
        int winnersMatches = matches.size();

        List<MatchRecord> losersMatches = buildLosersBracket(tournament, stage, participantCount, winnersRounds);
        matches.addAll(losersMatches);

        Map<String, Object> grandFinalsMetadata = metadata("Grand Finals");
        matches.add(MatchRecords.pending(
                tournament,
                stage,
                winnersRounds + 1,
                1,
                BracketSegment.GRAND_FINALS,
                MatchSlot.unresolved(),
                MatchSlot.unresolved(),
                grandFinalsMetadata
        ));

        if (config.grandFinalsReset()) {
            Map<String, Object> resetMetadata = metadata("Grand Finals Reset");
            resetMetadata.put(META_IS_CONDITIONAL, true);
            resetMetadata.put(META_CONDITION, RESET_CONDITION);
            matches.add(MatchRecords.pending(
                    tournament,
                    stage,
                    winnersRounds + 2,
                    1,
                    BracketSegment.GRAND_FINALS_RESET,
                    MatchSlot.unresolved(),
                    MatchSlot.unresolved(),
                    resetMetadata
            ));
        }

        log.debug(
                "Double elimination bracket: participants={}, winnersMatches={}, losersMatches={}, reset={}",
                participantCount,
                winnersMatches,
                losersMatches.size(),
                config.grandFinalsReset()
        );
        return matches;
    }

    static int losersRoundCount(int winnersRounds) {
        return 2 * (winnersRounds - 1);
    }

    static int losersFirstRoundMatchCount(int participantCount) {
        return Math.max(1, participantCount / 4);
    }

    private List<MatchRecord> buildLosersBracket(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            int participantCount,
            int winnersRounds
    ) {
        int losersRounds = losersRoundCount(winnersRounds);
        List<MatchRecord> matches = new ArrayList<>();
        int matchesInRound = losersFirstRoundMatchCount(participantCount);

        for (int round = 1; round <= losersRounds; round++) {
            boolean dropInRound = round % 2 == 0;
            for (int match = 1; match <= matchesInRound; match++) {
                Map<String, Object> metadata = metadata("Losers Round " + round);
                metadata.put(META_LOSERS_ROUND_TYPE, dropInRound ? "major" : "minor");
                if (dropInRound) {
                    metadata.put(META_DROP_IN_FROM_WINNERS_ROUND, round / 2 + 1);
                } else if (round == 1) {
                    metadata.put(META_DROP_IN_FROM_WINNERS_ROUND, 1);
                }
                matches.add(MatchRecords.pending(
                        tournament,
                        stage,
                        round,
                        match,
                        BracketSegment.LOSERS,
                        MatchSlot.unresolved(),
                        MatchSlot.unresolved(),
                        metadata
                ));
            }
            if (dropInRound) {
                matchesInRound = Math.max(1, matchesInRound / 2);
            }
        }
        return matches;
    }

    private static Map<String, Object> metadata(String roundName) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MatchRecords.META_BRACKET_TYPE, FORMAT_KEY);
        metadata.put(MatchRecords.META_ROUND_NAME, roundName);
        return metadata;
    }
}
