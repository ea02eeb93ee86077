package org.javai.randomization;

/**
 * Thrown when a participant has no entry in a required side mapping (a covariate map),
 * or when a stratum or cluster names a participant the engine does not know.
 */
public class ParticipantLookupException extends RandomizationException {

    private final Object participant;

    public ParticipantLookupException(String name, Object participant, String message) {
        super(ErrorCode.of("lookup", name), message);
        this.participant = participant;
    }

    /**
     * The participant that could not be resolved.
     */
    public Object participant() {
        return participant;
    }
}
