package com.bracketeer.generator;

import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;
import com.bracketeer.seeding.BracketSeeding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Round and match skeleton of a seeded knockout tree. Round 1 pairs consecutive seeded slots;
 * later rounds halve the match count and stay unresolved until results come in.
 */
final class EliminationRounds {

    private EliminationRounds() {
    }

    static int roundCount(int participantCount) {
        return BracketSeeding.log2(BracketSeeding.nextPowerOfTwo(participantCount));
    }

    static List<MatchRecord> build(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            List<Participant> participants,
            BracketSegment segment,
            String bracketType,
            String roundNamePrefix
    ) {
        int participantCount = participants.size();
        int bracketSize = BracketSeeding.nextPowerOfTwo(participantCount);
        int totalRounds = BracketSeeding.log2(bracketSize);
        List<MatchSlot> slots = BracketSeeding.seedWithByes(participants, bracketSize - participantCount);

        List<MatchRecord> matches = new ArrayList<>(bracketSize - 1);
        int matchNumber = 1;
        for (int i = 0; i < slots.size(); i += 2) {
            MatchSlot teamA = slots.get(i);
            MatchSlot teamB = slots.get(i + 1);
            if (teamA.isBye() && teamB.isBye()) {
                continue;
            }

            Map<String, Object> metadata = roundMetadata(bracketType, roundNamePrefix, 1, totalRounds);
            metadata.put(MatchRecords.META_BRACKET_SIZE, bracketSize);
            metadata.put(MatchRecords.META_PARTICIPANT_COUNT, participantCount);
            if (teamA.isBye() || teamB.isBye()) {
                MatchSlot advancing = teamA.isBye() ? teamB : teamA;
                metadata.put(MatchRecords.META_HAS_BYE, true);
                metadata.put(MatchRecords.META_BYE_ADVANCES, advancing.participantId());
            }
            matches.add(MatchRecords.pending(tournament, stage, 1, matchNumber++, segment, teamA, teamB, metadata));
        }

        int matchesInRound = bracketSize / 2;
        for (int round = 2; round <= totalRounds; round++) {
            matchesInRound /= 2;
            for (int match = 1; match <= matchesInRound; match++) {
                matches.add(MatchRecords.pending(
                        tournament,
                        stage,
                        round,
                        match,
                        segment,
                        MatchSlot.unresolved(),
                        MatchSlot.unresolved(),
                        roundMetadata(bracketType, roundNamePrefix, round, totalRounds)
                ));
            }
        }
        return matches;
    }

    private static Map<String, Object> roundMetadata(String bracketType, String prefix, int round, int totalRounds) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MatchRecords.META_BRACKET_TYPE, bracketType);
        metadata.put(MatchRecords.META_ROUND_NAME, prefix + BracketSeeding.roundName(round, totalRounds));
        return metadata;
    }
}
