package com.bracketeer.generator;

import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.model.BracketSegment;
import com.bracketeer.model.MatchRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.bracketeer.BracketFixtures.byRound;
import static com.bracketeer.BracketFixtures.matchNumbersContiguous;
import static com.bracketeer.BracketFixtures.participants;
import static com.bracketeer.BracketFixtures.stage;
import static com.bracketeer.BracketFixtures.tournament;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DoubleEliminationGeneratorTest {

    private final DoubleEliminationGenerator generator =
            new DoubleEliminationGenerator(new BracketeerEngineProperties());

    @Test
    void eightParticipantsBuildAllThreeSegments() {
        List<MatchRecord> matches = generator.generate(tournament(), stage("double_elim"), participants(8));

        List<MatchRecord> winners = segment(matches, BracketSegment.WINNERS);
        assertEquals(7, winners.size());
        assertEquals(3, byRound(winners).size());
        assertEquals("Winners Finals", winners.get(winners.size() - 1).metadata().get("round_name"));
        assertTrue(matchNumbersContiguous(winners));

        List<MatchRecord> losers = segment(matches, BracketSegment.LOSERS);
        Map<Integer, List<MatchRecord>> losersRounds = byRound(losers);
        assertEquals(4, losersRounds.size());
        assertEquals(2, losersRounds.get(1).size());
        assertEquals(2, losersRounds.get(2).size());
        assertEquals(1, losersRounds.get(3).size());
        assertEquals(1, losersRounds.get(4).size());
        assertTrue(matchNumbersContiguous(losers));

        MatchRecord grandFinals = segment(matches, BracketSegment.GRAND_FINALS).get(0);
        assertEquals(4, grandFinals.roundNumber());
        assertEquals(1, grandFinals.matchNumber());
        assertEquals("Grand Finals", grandFinals.metadata().get("round_name"));

        List<MatchRecord> reset = segment(matches, BracketSegment.GRAND_FINALS_RESET);
        assertEquals(1, reset.size());
        assertEquals(5, reset.get(0).roundNumber());
        assertEquals(true, reset.get(0).metadata().get("is_conditional"));
        assertEquals(DoubleEliminationGenerator.RESET_CONDITION, reset.get(0).metadata().get("condition"));

        assertEquals(15, matches.size());
    }

    @Test
    void losersRoundsAlternateMinorAndMajor() {
        List<MatchRecord> losers =
                segment(generator.generate(tournament(), stage("double_elim"), participants(8)), BracketSegment.LOSERS);
        Map<Integer, List<MatchRecord>> rounds = byRound(losers);

        MatchRecord roundOne = rounds.get(1).get(0);
        assertEquals("Losers Round 1", roundOne.metadata().get("round_name"));
        assertEquals("minor", roundOne.metadata().get("losers_round_type"));
        assertEquals(1, roundOne.metadata().get("drop_in_from_winners_round"));

        MatchRecord roundTwo = rounds.get(2).get(0);
        assertEquals("major", roundTwo.metadata().get("losers_round_type"));
        assertEquals(2, roundTwo.metadata().get("drop_in_from_winners_round"));

        MatchRecord roundThree = rounds.get(3).get(0);
        assertEquals("minor", roundThree.metadata().get("losers_round_type"));
        assertFalse(roundThree.metadata().containsKey("drop_in_from_winners_round"));

        assertEquals(3, rounds.get(4).get(0).metadata().get("drop_in_from_winners_round"));
        assertTrue(losers.stream().allMatch(match -> "TBD".equals(match.teamAName())));
    }

    @Test
    void resetCanBeDisabledPerStage() {
        List<MatchRecord> matches = generator.generate(
                tournament(),
                stage("double_elim", Map.of("grand_finals_reset", false)),
                participants(8)
        );

        assertEquals(14, matches.size());
        assertTrue(segment(matches, BracketSegment.GRAND_FINALS_RESET).isEmpty());
    }

    @Test
    void sixteenParticipantsScaleTheLosersBracket() {
        List<MatchRecord> matches = generator.generate(tournament(), stage("double_elim"), participants(16));

        assertEquals(15, segment(matches, BracketSegment.WINNERS).size());
        List<MatchRecord> losers = segment(matches, BracketSegment.LOSERS);
        assertEquals(6, byRound(losers).size());
        assertEquals(4, byRound(losers).get(1).size());
        assertEquals(14, losers.size());
        assertEquals(5, segment(matches, BracketSegment.GRAND_FINALS).get(0).roundNumber());
    }

    @Test
    void unevenFieldStillGetsAtLeastOneLosersMatchPerRound() {
        List<MatchRecord> matches = generator.generate(tournament(), stage("double_elim"), participants(6));

        List<MatchRecord> winners = segment(matches, BracketSegment.WINNERS);
        assertEquals(7, winners.size());
        assertEquals(2, byRound(winners).get(1).stream().filter(MatchRecord::hasBye).count());
        assertEquals(1, byRound(segment(matches, BracketSegment.LOSERS)).get(1).size());
    }

    @Test
    void losersBracketSizing() {
        assertEquals(2, DoubleEliminationGenerator.losersRoundCount(2));
        assertEquals(4, DoubleEliminationGenerator.losersRoundCount(3));
        assertEquals(1, DoubleEliminationGenerator.losersFirstRoundMatchCount(4));
        assertEquals(1, DoubleEliminationGenerator.losersFirstRoundMatchCount(7));
        assertEquals(4, DoubleEliminationGenerator.losersFirstRoundMatchCount(16));
    }

    @Test
    void validateChecksParticipantBounds() {
        assertTrue(generator.validate(tournament(), stage("double_elim"), 4).valid());
        assertTrue(generator.validate(tournament(), stage("double_elim"), 128).valid());
        assertEquals(
                List.of("Double elimination requires at least 4 participants (got 3)"),
                generator.validate(tournament(), stage("double_elim"), 3).errors()
        );
        assertFalse(generator.validate(tournament(), stage("double_elim"), 129).valid());
        assertFalse(generator.validate(
                tournament(), stage("double_elim", Map.of("grand_finals_reset", "sometimes")), 8).valid());
    }

    @Test
    void doesNotSupportThirdPlace() {
        assertFalse(generator.supportsThirdPlace());
        assertEquals(List.of("double_elimination"), generator.aliases());
    }

    private static List<MatchRecord> segment(List<MatchRecord> matches, BracketSegment segment) {
        return matches.stream().filter(match -> match.segment() == segment).toList();
    }
}
