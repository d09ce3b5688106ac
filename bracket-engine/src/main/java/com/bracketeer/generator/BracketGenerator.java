package com.bracketeer.generator;

import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.Participant;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;

import java.util.List;

/**
 * A bracket format. Implementations are stateless: the same inputs always produce the same matches.
 */
public interface BracketGenerator {

    /**
     * Lowercase, underscore-separated key the engine registers this generator under.
     */
    String formatKey();

    /**
     * Additional keys that resolve to this generator.
     */
    default List<String> aliases() {
        return List.of();
    }

    ValidationResult validate(TournamentDescriptor tournament, StageDescriptor stage, int participantCount);

    /**
     * Builds the full match skeleton for a stage. Only called after {@link #validate} succeeded.
     *
     * @param participants participants in seed order, best seed first
     */
    List<MatchRecord> generate(TournamentDescriptor tournament, StageDescriptor stage, List<Participant> participants);

    default boolean supportsThirdPlace() {
        return false;
    }
}
