package com.bracketeer.model;

import java.util.Objects;

/**
 * A participant's Swiss record after the rounds played so far.
 *
 * @param buchholz sum of the opponents' scores, used as the last ranking tiebreaker
 */
public record SwissStanding(Participant participant, int wins, int losses, int points, int buchholz) {

    public SwissStanding {
        Objects.requireNonNull(participant, "participant is required");
    }

    public Long participantId() {
        return participant.id();
    }
}
