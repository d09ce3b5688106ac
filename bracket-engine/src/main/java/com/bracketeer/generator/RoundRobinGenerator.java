package com.bracketeer.generator;

import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;
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
 * Circle-method schedule: the first seed stays fixed while everyone else rotates one seat per round.
 * Odd fields get an empty seat, and whoever faces it rests that round.
 */
@Component
@RequiredArgsConstructor
public class RoundRobinGenerator implements BracketGenerator {

    public static final String FORMAT_KEY = "round_robin";
    static final String META_RESTING_PARTICIPANT_ID = "resting_participant_id";

    private static final Logger log = LoggerFactory.getLogger(RoundRobinGenerator.class);

    private final BracketeerEngineProperties properties;

    @Override
    public String formatKey() {
        return FORMAT_KEY;
    }

    @Override
    public ValidationResult validate(TournamentDescriptor tournament, StageDescriptor stage, int participantCount) {
        BracketeerEngineProperties.RoundRobin bounds = properties.getRoundRobin();
        List<String> errors = new ArrayList<>();
        MatchRecords.checkParticipantBounds(
                errors,
                "Round robin",
                participantCount,
                bounds.getMinParticipants(),
                bounds.getMaxParticipants()
        );
        return ValidationResult.of(errors);
    }

    @Override
    public List<MatchRecord> generate(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            List<Participant> participants
    ) {
        List<Participant> seats = new ArrayList<>(participants);
        if (seats.size() % 2 != 0) {
            seats.add(null);
        }
        int seatCount = seats.size();
        int rounds = seatCount - 1;

        List<MatchRecord> matches = new ArrayList<>(participants.size() * (participants.size() - 1) / 2);
        for (int round = 1; round <= rounds; round++) {
            List<Participant[]> pairings = new ArrayList<>(seatCount / 2);
            Participant resting = null;
            for (int seat = 0; seat < seatCount / 2; seat++) {
                Participant home = seats.get(seat);
                Participant away = seats.get(seatCount - 1 - seat);
                if (seat == 0 && round % 2 == 0) {
                    Participant swap = home;
                    home = away;
                    away = swap;
                }
                if (home == null || away == null) {
                    resting = home == null ? away : home;
                    continue;
                }
                pairings.add(new Participant[]{home, away});
            }

            int matchNumber = 1;
            for (Participant[] pairing : pairings) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put(MatchRecords.META_BRACKET_TYPE, FORMAT_KEY);
                metadata.put(MatchRecords.META_ROUND_NAME, "Round " + round);
                if (resting != null) {
                    metadata.put(META_RESTING_PARTICIPANT_ID, resting.id());
                }
                matches.add(MatchRecords.pending(
                        tournament,
                        stage,
                        round,
                        matchNumber++,
                        BracketSegment.MAIN,
                        MatchSlot.resolved(pairing[0]),
                        MatchSlot.resolved(pairing[1]),
                        metadata
                ));
            }

            rotate(seats);
        }

        log.debug("Round robin schedule: participants={}, rounds={}, matches={}",
                participants.size(), rounds, matches.size());
        return matches;
    }

    private static void rotate(List<Participant> seats) {
        Participant last = seats.remove(seats.size() - 1);
        seats.add(1, last);
    }
}
