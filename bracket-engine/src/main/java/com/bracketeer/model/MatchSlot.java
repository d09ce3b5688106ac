package com.bracketeer.model;

import java.util.Objects;

/**
 * One side of a match: a known participant, a participant still to be decided by an earlier match,
 * or a bye.
 */
public record MatchSlot(MatchSlotStatus status, Participant participant) {

    public static final String TBD_NAME = "TBD";
    public static final String BYE_NAME = "BYE";

    private static final MatchSlot UNRESOLVED = new MatchSlot(MatchSlotStatus.UNRESOLVED, null);
    private static final MatchSlot BYE = new MatchSlot(MatchSlotStatus.BYE, null);

    public MatchSlot {
        Objects.requireNonNull(status, "slot status is required");
        if (status == MatchSlotStatus.RESOLVED && participant == null) {
            throw new IllegalArgumentException("Resolved slot requires a participant");
        }
        if (status != MatchSlotStatus.RESOLVED && participant != null) {
            throw new IllegalArgumentException(status + " slot cannot carry a participant");
        }
    }

    public static MatchSlot resolved(Participant participant) {
        return new MatchSlot(MatchSlotStatus.RESOLVED, Objects.requireNonNull(participant, "participant is required"));
    }

    public static MatchSlot unresolved() {
        return UNRESOLVED;
    }

    public static MatchSlot bye() {
        return BYE;
    }

    public boolean isResolved() {
        return status == MatchSlotStatus.RESOLVED;
    }

    public boolean isBye() {
        return status == MatchSlotStatus.BYE;
    }

    public Long participantId() {
        return participant == null ? null : participant.id();
    }

    public String displayName() {
        return switch (status) {
            case RESOLVED -> participant.name();
            case UNRESOLVED -> TBD_NAME;
            case BYE -> BYE_NAME;
        };
    }
}
