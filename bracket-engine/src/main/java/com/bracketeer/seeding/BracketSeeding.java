package com.bracketeer.seeding;

import com.bracketeer.model.MatchSlot;
import com.bracketeer.model.Participant;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bracket sizing and seed placement helpers shared by the elimination generators.
 *
 * <p>Slots are laid out in standard seeded-bracket order: for a bracket of size {@code S} the
 * first-round pairs are (seed {@code k}, seed {@code S + 1 - k}), arranged so seeds 1 and 2 land
 * in opposite halves, seeds 1 to 4 in different quarters, and so on. Seeds greater than the
 * participant count are byes, which means the top seeds are the ones drawn against byes.
 */
public final class BracketSeeding {

    public static final int MAX_BRACKET_SIZE = 1 << 30;

    private BracketSeeding() {
    }

    public static int nextPowerOfTwo(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be at least 1 (got " + n + ")");
        }
        if (n > MAX_BRACKET_SIZE) {
            throw new IllegalArgumentException("n must not exceed " + MAX_BRACKET_SIZE + " (got " + n + ")");
        }
        int size = 1;
        while (size < n) {
            size <<= 1;
        }
        return size;
    }

    public static int byeCount(int n) {
        return nextPowerOfTwo(n) - n;
    }

    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    public static int log2(int powerOfTwo) {
        if (!isPowerOfTwo(powerOfTwo)) {
            throw new IllegalArgumentException(powerOfTwo + " is not a power of two");
        }
        return Integer.numberOfTrailingZeros(powerOfTwo);
    }

    /**
     * Seed numbers (1-based) in slot order for a bracket of the given size.
     * Size 8 yields {@code [1, 8, 4, 5, 2, 7, 3, 6]}.
     */
    public static List<Integer> seedOrder(int bracketSize) {
        if (!isPowerOfTwo(bracketSize)) {
            throw new IllegalArgumentException("Bracket size must be a power of two (got " + bracketSize + ")");
        }
        List<Integer> order = new ArrayList<>(bracketSize);
        order.add(1);
        while (order.size() < bracketSize) {
            int doubled = order.size() * 2;
            List<Integer> next = new ArrayList<>(doubled);
            for (int seed : order) {
                next.add(seed);
                next.add(doubled + 1 - seed);
            }
            order = next;
        }
        return order;
    }

    /**
     * Places participants into a full bracket, filling the remaining slots with byes.
     * Consecutive slot pairs {@code (0,1), (2,3), ...} form the first-round matches and no pair
     * ever holds two byes.
     *
     * @param participants seeded participants, best seed first
     * @param byeCount     number of bye slots; participant count plus byes must be a power of two
     */
    public static List<MatchSlot> seedWithByes(List<Participant> participants, int byeCount) {
        Objects.requireNonNull(participants, "participants are required");
        int participantCount = participants.size();
        if (participantCount == 0) {
            throw new IllegalArgumentException("At least one participant is required");
        }
        if (byeCount < 0) {
            throw new IllegalArgumentException("byeCount must not be negative (got " + byeCount + ")");
        }
        if (byeCount > participantCount) {
            throw new IllegalArgumentException(
                    "byeCount " + byeCount + " exceeds participant count " + participantCount
            );
        }
        int bracketSize = participantCount + byeCount;
        if (!isPowerOfTwo(bracketSize)) {
            throw new IllegalArgumentException(
                    "Participants plus byes must form a power-of-two bracket (got " + bracketSize + ")"
            );
        }

        List<MatchSlot> slots = new ArrayList<>(bracketSize);
        for (int seed : seedOrder(bracketSize)) {
            slots.add(seed <= participantCount
                    ? MatchSlot.resolved(participants.get(seed - 1))
                    : MatchSlot.bye());
        }
        return slots;
    }

    public static String roundName(int roundNumber, int totalRounds) {
        int roundsFromEnd = totalRounds - roundNumber;
        return switch (roundsFromEnd) {
            case 0 -> "Finals";
            case 1 -> "Semi Finals";
            case 2 -> "Quarter Finals";
            case 3 -> "Round of 16";
            case 4 -> "Round of 32";
            default -> "Round " + roundNumber;
        };
    }
}
