package eu.fbk.aaer;

import java.util.Objects;

/**
 * A fragment of a document text, identified by a half-open offset interval. An end offset of
 * {@link #TO_END} means that the fragment extends to the end of the document. A span is
 * <i>degraded</i> when it was produced by a fallback that is known to be imprecise.
 */
public final class TextSpan {

    public static final int TO_END = -1;

    private final String text;

    private final int startOffset;

    private final int endOffset;

    private final boolean degraded;

    private TextSpan(final String text, final int startOffset, final int endOffset,
            final boolean degraded) {
        this.text = text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.degraded = degraded;
    }

    public static TextSpan create(final String text, final int startOffset,
            final int endOffset) {
        return create(text, startOffset, endOffset, false);
    }

    public static TextSpan create(final String text, final int startOffset, final int endOffset,
            final boolean degraded) {
        Objects.requireNonNull(text);
        if (startOffset < 0 || endOffset != TO_END && endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "Invalid span offsets " + startOffset + ", " + endOffset);
        }
        return new TextSpan(text, startOffset, endOffset, degraded);
    }

    public String getText() {
        return this.text;
    }

    public int getStartOffset() {
        return this.startOffset;
    }

    public int getEndOffset() {
        return this.endOffset;
    }

    public boolean isToEnd() {
        return this.endOffset == TO_END;
    }

    public boolean isDegraded() {
        return this.degraded;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TextSpan)) {
            return false;
        }
        final TextSpan other = (TextSpan) object;
        return this.startOffset == other.startOffset && this.endOffset == other.endOffset
                && this.degraded == other.degraded && this.text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.text, this.startOffset, this.endOffset, this.degraded);
    }

    @Override
    public String toString() {
        return "[" + this.startOffset + ", " + (isToEnd() ? "end" : this.endOffset) + ")"
                + (this.degraded ? " (degraded)" : "");
    }

}
