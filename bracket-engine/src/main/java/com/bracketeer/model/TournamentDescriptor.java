package com.bracketeer.model;

import java.time.OffsetDateTime;

/**
 * Read-only view of a tournament as supplied by the persistence layer.
 *
 * @param formatHint declared tournament format, used only when the stage type does not resolve
 */
public record TournamentDescriptor(
        Long id,
        String name,
        String gameSlug,
        String stage,
        Integer teamSize,
        Integer maxTeams,
        String status,
        OffsetDateTime startTime,
        String formatHint
) {
}
