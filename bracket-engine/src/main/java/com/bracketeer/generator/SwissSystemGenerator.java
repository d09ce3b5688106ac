package com.bracketeer.generator;

import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;
import com.bracketeer.model.StageConfigCodec;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.SwissConfig;
import com.bracketeer.model.SwissPairing;
import com.bracketeer.model.SwissStanding;
import com.bracketeer.model.TournamentDescriptor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Swiss stages. {@link #generate} seeds round 1 only (top half against bottom half); later rounds
 * are paired on demand from standings through {@link #generateSubsequentRound}.
 */
@Component
@RequiredArgsConstructor
public class SwissSystemGenerator implements BracketGenerator {

    public static final String FORMAT_KEY = "swiss";
    static final String META_ROUNDS_COUNT = "rounds_count";
    static final String META_IS_BYE = "is_bye";
    static final String META_IS_REMATCH = "is_rematch";

    private static final Logger log = LoggerFactory.getLogger(SwissSystemGenerator.class);

    private final BracketeerEngineProperties properties;
    private final SwissPairingPlanner swissPairingPlanner;

    @Override
    public String formatKey() {
        return FORMAT_KEY;
    }

    @Override
    public ValidationResult validate(TournamentDescriptor tournament, StageDescriptor stage, int participantCount) {
        BracketeerEngineProperties.Swiss bounds = properties.getSwiss();
        List<String> errors = new ArrayList<>();
        MatchRecords.checkParticipantBounds(
                errors,
                "Swiss system",
                participantCount,
                bounds.getMinParticipants(),
                bounds.getMaxParticipants()
        );
        if (stage == null) {
            errors.add("Swiss system requires stage config field '" + StageConfigCodec.FIELD_ROUNDS_COUNT + "'");
        } else {
            try {
                resolveConfig(stage);
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
        SwissConfig config = resolveConfig(stage);
        int participantCount = participants.size();
        int topHalfSize = (participantCount + 1) / 2;
        int pairedMatches = participantCount / 2;

        List<MatchRecord> matches = new ArrayList<>(topHalfSize);
        int matchNumber = 1;
        for (int i = 0; i < pairedMatches; i++) {
            matches.add(MatchRecords.pending(
                    tournament,
                    stage,
                    1,
                    matchNumber++,
                    BracketSegment.MAIN,
                    MatchSlot.resolved(participants.get(i)),
                    MatchSlot.resolved(participants.get(i + topHalfSize)),
                    metadata(1, config, false)
            ));
        }
        if (participantCount % 2 != 0) {
            matches.add(byeMatch(tournament, stage, 1, matchNumber, participants.get(topHalfSize - 1), config));
        }

        log.debug("Swiss round 1: participants={}, roundsCount={}, matches={}",
                participantCount, config.roundsCount(), matches.size());
        return matches;
    }

    /**
     * Pairs a round after the first from current standings, avoiding rematches where possible.
     *
     * @param previousPairings every pairing already played in this stage, byes included
     * @return matches in board order, bye match last; empty when there are no standings
     */
    public List<MatchRecord> generateSubsequentRound(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            int roundNumber,
            List<SwissStanding> standings,
            Collection<SwissPairing> previousPairings
    ) {
        Objects.requireNonNull(stage, "stage is required");
        SwissConfig config = resolveConfig(stage);
        if (roundNumber < 2 || roundNumber > config.roundsCount()) {
            throw new IllegalArgumentException(
                    "Swiss round number must be between 2 and " + config.roundsCount() + " (got " + roundNumber + ")"
            );
        }
        if (standings == null || standings.isEmpty()) {
            return List.of();
        }

        List<SwissPairing> pairings = swissPairingPlanner.plan(standings, previousPairings);
        List<MatchRecord> matches = new ArrayList<>(pairings.size());
        int matchNumber = 1;
        for (SwissPairing pairing : pairings) {
            if (pairing.isBye()) {
                matches.add(byeMatch(tournament, stage, roundNumber, matchNumber++, pairing.first(), config));
                continue;
            }
            matches.add(MatchRecords.pending(
                    tournament,
                    stage,
                    roundNumber,
                    matchNumber++,
                    BracketSegment.MAIN,
                    MatchSlot.resolved(pairing.first()),
                    MatchSlot.resolved(pairing.second()),
                    metadata(roundNumber, config, SwissPairingPlanner.isRematch(pairing, previousPairings))
            ));
        }

        log.debug("Swiss round {}: standings={}, matches={}", roundNumber, standings.size(), matches.size());
        return matches;
    }

    private SwissConfig resolveConfig(StageDescriptor stage) {
        BracketeerEngineProperties.Swiss bounds = properties.getSwiss();
        return StageConfigCodec.swiss(stage, bounds.getMinRounds(), bounds.getMaxRounds());
    }

    private static MatchRecord byeMatch(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            int roundNumber,
            int matchNumber,
            Participant participant,
            SwissConfig config
    ) {
        Map<String, Object> metadata = metadata(roundNumber, config, false);
        metadata.put(META_IS_BYE, true);
        metadata.put(MatchRecords.META_HAS_BYE, true);
        metadata.put(MatchRecords.META_BYE_ADVANCES, participant.id());
        return MatchRecords.pending(
                tournament,
                stage,
                roundNumber,
                matchNumber,
                BracketSegment.MAIN,
                MatchSlot.resolved(participant),
                MatchSlot.bye(),
                metadata
        );
    }

    private static Map<String, Object> metadata(int roundNumber, SwissConfig config, boolean rematch) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MatchRecords.META_BRACKET_TYPE, FORMAT_KEY);
        metadata.put(MatchRecords.META_ROUND_NAME, "Round " + roundNumber);
        metadata.put(META_ROUNDS_COUNT, config.roundsCount());
        if (rematch) {
            metadata.put(META_IS_REMATCH, true);
        }
        return metadata;
    }
}
