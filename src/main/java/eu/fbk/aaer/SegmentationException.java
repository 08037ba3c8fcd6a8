package eu.fbk.aaer;

/**
 * Signals that a region of a document could not be located. Subclasses distinguish a missing
 * anchor sequence from a missing bold-span key.
 */
public abstract class SegmentationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    SegmentationException(final String message) {
        super(message);
    }

    SegmentationException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
