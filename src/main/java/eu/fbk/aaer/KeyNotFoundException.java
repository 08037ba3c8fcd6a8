package eu.fbk.aaer;

/**
 * Thrown when a key is missing from a {@link BoldSpanIndex} and every fallback strategy
 * applicable to it failed.
 */
public final class KeyNotFoundException extends SegmentationException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public KeyNotFoundException(final String key) {
        this(key, "Bold key '" + key + "' not found");
    }

    public KeyNotFoundException(final String key, final String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return this.key;
    }

}
