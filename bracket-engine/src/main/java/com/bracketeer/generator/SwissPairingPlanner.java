package com.bracketeer.generator;

import com.bracketeer.model.Participant;
import com.bracketeer.model.SwissPairing;
import com.bracketeer.model.SwissStanding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs a Swiss round after the first from current standings.
 *
 * <p>Standings are ranked by wins, points and Buchholz, all descending, with input order breaking
 * remaining ties. Each participant is paired with the nearest-ranked opponent it has not met yet,
 * so players with the same record meet first and an odd player out floats to the next score
 * group. A depth-first search backs out of choices that would force a rematch further down.
 */
@Component
public class SwissPairingPlanner {

    static final Comparator<SwissStanding> RANKING = Comparator
            .comparingInt(SwissStanding::wins).reversed()
            .thenComparing(Comparator.comparingInt(SwissStanding::points).reversed())
            .thenComparing(Comparator.comparingInt(SwissStanding::buchholz).reversed());

    private static final Logger log = LoggerFactory.getLogger(SwissPairingPlanner.class);
    private static final int SEARCH_BUDGET = 200_000;

    /**
     * @param standings        current standings; order breaks ties the ranking leaves open
     * @param previousPairings every pairing played so far, byes included
     * @return pairings in board order, the bye (if any) last
     */
    public List<SwissPairing> plan(List<SwissStanding> standings, Collection<SwissPairing> previousPairings) {
        Objects.requireNonNull(standings, "standings are required");
        if (standings.isEmpty()) {
            return List.of();
        }

        List<Participant> ranked = rank(standings);
        Set<PairKey> played = new HashSet<>();
        Set<Long> hadBye = new HashSet<>();
        if (previousPairings != null) {
            for (SwissPairing pairing : previousPairings) {
                if (pairing.isBye()) {
                    hadBye.add(pairing.first().id());
                } else {
                    played.add(PairKey.of(pairing.first(), pairing.second()));
                }
            }
        }

        SearchBudget budget = new SearchBudget(SEARCH_BUDGET);
        for (Participant byeRecipient : byeCandidates(ranked, hadBye)) {
            List<Participant> pool = new ArrayList<>(ranked);
            if (byeRecipient != null) {
                pool.remove(byeRecipient);
            }
            List<SwissPairing> pairings = pairWithoutRematches(pool, played, budget);
            if (pairings != null) {
                return withBye(pairings, byeRecipient);
            }
            if (budget.exhausted()) {
                break;
            }
        }

        log.warn("No rematch-free Swiss pairing found for {} participants; allowing rematches", ranked.size());
        Participant byeRecipient = byeCandidates(ranked, hadBye).get(0);
        List<Participant> pool = new ArrayList<>(ranked);
        if (byeRecipient != null) {
            pool.remove(byeRecipient);
        }
        return withBye(pairGreedily(pool, played), byeRecipient);
    }

    static boolean isRematch(SwissPairing pairing, Collection<SwissPairing> previousPairings) {
        if (pairing.isBye() || previousPairings == null) {
            return false;
        }
        PairKey key = PairKey.of(pairing.first(), pairing.second());
        return previousPairings.stream()
                .filter(previous -> !previous.isBye())
                .anyMatch(previous -> PairKey.of(previous.first(), previous.second()).equals(key));
    }

    private static List<Participant> rank(List<SwissStanding> standings) {
        Set<Long> seen = new HashSet<>();
        for (SwissStanding standing : standings) {
            if (!seen.add(standing.participantId())) {
                throw new IllegalArgumentException("Duplicate participant in standings: " + standing.participantId());
            }
        }
        return standings.stream()
                .sorted(RANKING)
                .map(SwissStanding::participant)
                .toList();
    }

    /**
     * Bye candidates from the bottom of the standings, those without an earlier bye first.
     * A list holding only {@code null} means the field is even and nobody sits out.
     */
    private static List<Participant> byeCandidates(List<Participant> ranked, Set<Long> hadBye) {
        List<Participant> candidates = new ArrayList<>();
        if (ranked.size() % 2 == 0) {
            candidates.add(null);
            return candidates;
        }
        for (int i = ranked.size() - 1; i >= 0; i--) {
            if (!hadBye.contains(ranked.get(i).id())) {
                candidates.add(ranked.get(i));
            }
        }
        for (int i = ranked.size() - 1; i >= 0; i--) {
            if (hadBye.contains(ranked.get(i).id())) {
                candidates.add(ranked.get(i));
            }
        }
        return candidates;
    }

    private static List<SwissPairing> pairWithoutRematches(
            List<Participant> pool,
            Set<PairKey> played,
            SearchBudget budget
    ) {
        if (pool.isEmpty()) {
            return new ArrayList<>();
        }
        if (!budget.spend()) {
            return null;
        }

        Participant first = pool.get(0);
        for (int i = 1; i < pool.size(); i++) {
            Participant candidate = pool.get(i);
            if (played.contains(PairKey.of(first, candidate))) {
                continue;
            }
            List<Participant> remaining = new ArrayList<>(pool.size() - 2);
            for (int j = 1; j < pool.size(); j++) {
                if (j != i) {
                    remaining.add(pool.get(j));
                }
            }
            List<SwissPairing> rest = pairWithoutRematches(remaining, played, budget);
            if (rest != null) {
                rest.add(0, new SwissPairing(first, candidate));
                return rest;
            }
            if (budget.exhausted()) {
                return null;
            }
        }
        return null;
    }

    private static List<SwissPairing> pairGreedily(List<Participant> pool, Set<PairKey> played) {
        List<Participant> remaining = new ArrayList<>(pool);
        List<SwissPairing> pairings = new ArrayList<>();
        while (remaining.size() >= 2) {
            Participant first = remaining.remove(0);
            int opponentIndex = 0;
            for (int i = 0; i < remaining.size(); i++) {
                if (!played.contains(PairKey.of(first, remaining.get(i)))) {
                    opponentIndex = i;
                    break;
                }
            }
            pairings.add(new SwissPairing(first, remaining.remove(opponentIndex)));
        }
        return pairings;
    }

    private static List<SwissPairing> withBye(List<SwissPairing> pairings, Participant byeRecipient) {
        List<SwissPairing> result = new ArrayList<>(pairings);
        if (byeRecipient != null) {
            result.add(SwissPairing.bye(byeRecipient));
        }
        return List.copyOf(result);
    }

    private record PairKey(Long low, Long high) {

        static PairKey of(Participant a, Participant b) {
            Long first = a.id();
            Long second = b.id();
            return first.compareTo(second) <= 0 ? new PairKey(first, second) : new PairKey(second, first);
        }
    }

    private static final class SearchBudget {

        private int remaining;

        SearchBudget(int remaining) {
            this.remaining = remaining;
        }

        boolean spend() {
            if (remaining <= 0) {
                return false;
            }
            remaining--;
            return true;
        }

        boolean exhausted() {
            return remaining <= 0;
        }
    }
}
