package eu.fbk.aaer;

/**
 * Thrown when an anchor sequence is absent and no fallback is defined for it.
 */
public final class SequenceNotFoundException extends SegmentationException {

    private static final long serialVersionUID = 1L;

    private final String sequence;

    public SequenceNotFoundException(final String sequence, final String message) {
        super(message);
        this.sequence = sequence;
    }

    public SequenceNotFoundException(final String sequence, final String message,
            final Throwable cause) {
        super(message, cause);
        this.sequence = sequence;
    }

    public String getSequence() {
        return this.sequence;
    }

}
