package com.bracketeer.generator;

import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;
import com.bracketeer.model.SingleEliminationConfig;
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

@Component
@RequiredArgsConstructor
public class SingleEliminationGenerator implements BracketGenerator {

    public static final String FORMAT_KEY = "single_elim";
    static final String THIRD_PLACE_ROUND_NAME = "Third Place Match";
    static final String META_THIRD_PLACE_MATCH = "is_third_place_match";

    private static final Logger log = LoggerFactory.getLogger(SingleEliminationGenerator.class);

    private final BracketeerEngineProperties properties;

    @Override
    public String formatKey() {
        return FORMAT_KEY;
    }

    @Override
    public List<String> aliases() {
        return List.of("single_elimination");
    }

    @Override
    public boolean supportsThirdPlace() {
        return true;
    }

    @Override
    public ValidationResult validate(TournamentDescriptor tournament, StageDescriptor stage, int participantCount) {
        BracketeerEngineProperties.SingleElimination bounds = properties.getSingleElimination();
        List<String> errors = new ArrayList<>();
        MatchRecords.checkParticipantBounds(
                errors,
                "Single elimination",
                participantCount,
                bounds.getMinParticipants(),
                bounds.getMaxParticipants()
        );
        if (stage != null) {
            try {
                StageConfigCodec.singleElimination(stage, bounds.isThirdPlaceMatch());
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
        SingleEliminationConfig config =
                StageConfigCodec.singleElimination(stage, properties.getSingleElimination().isThirdPlaceMatch());
        int totalRounds = EliminationRounds.roundCount(participants.size());

        List<MatchRecord> matches = new ArrayList<>(EliminationRounds.build(
                tournament,
                stage,
                participants,
                BracketSegment.MAIN,
                FORMAT_KEY,
                ""
        ));

        if (config.thirdPlaceMatch() && totalRounds >= 2) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(MatchRecords.META_BRACKET_TYPE, FORMAT_KEY);
            metadata.put(MatchRecords.META_ROUND_NAME, THIRD_PLACE_ROUND_NAME);
            metadata.put(META_THIRD_PLACE_MATCH, true);
            matches.add(MatchRecords.pending(
                    tournament,
                    stage,
                    totalRounds + 1,
                    1,
                    BracketSegment.MAIN,
                    MatchSlot.unresolved(),
                    MatchSlot.unresolved(),
                    metadata
            ));
        }

        log.debug(
                "Single elimination bracket: participants={}, rounds={}, thirdPlace={}, matches={}",
                participants.size(),
                totalRounds,
                config.thirdPlaceMatch(),
                matches.size()
        );
        return matches;
    }
}
