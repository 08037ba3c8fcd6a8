package eu.fbk.aaer;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import com.google.common.base.CharMatcher;

/**
 * Locates the header section of a document, i.e., the text between two bold anchors. In
 * enforcement documents the header begins with "In the Matter of" and ends right before the
 * first numbered section "I.".
 */
public final class SectionLocator {

    public static final String DEFAULT_START = "in";

    public static final String DEFAULT_END = "i.";

    private final String start;

    private final String end;

    private SectionLocator(final String start, final String end) {
        this.start = start;
        this.end = end;
    }

    public static SectionLocator create() {
        return create(DEFAULT_START, DEFAULT_END);
    }

    public static SectionLocator create(final String start, final String end) {
        return new SectionLocator(Objects.requireNonNull(start).toLowerCase(Locale.ROOT),
                Objects.requireNonNull(end).toLowerCase(Locale.ROOT));
    }

    /**
     * Returns a {@code SectionLocator} configured by the {@code section.start} and
     * {@code section.end} properties found under the prefix supplied.
     *
     * @param properties
     *            the configuration properties
     * @param prefix
     *            the prefix to prepend to the property names
     * @return the configured locator
     */
    public static SectionLocator create(final Properties properties, String prefix) {
        prefix = prefix.endsWith(".") ? prefix : prefix + ".";
        return create(properties.getProperty(prefix + "section.start", DEFAULT_START),
                properties.getProperty(prefix + "section.end", DEFAULT_END));
    }

    /**
     * Locates the section in the indexed text supplied. The returned span starts at the first
     * occurrence of the start anchor and ends right before the first occurrence of the end
     * anchor; its text is trimmed.
     *
     * @param text
     *            the full document text
     * @param index
     *            the bold words of the document
     * @return the section span
     * @throws SequenceNotFoundException
     *             if an anchor is missing, or the end anchor precedes the start one
     */
    public TextSpan locate(final String text, final BoldSpanIndex index) {

        final int startOffset = firstOffset(index, this.start);
        final int endOffset = firstOffset(index, this.end) - 1;

        if (endOffset < startOffset) {
            throw new SequenceNotFoundException(this.end, "End sequence: " + this.end
                    + " could not be found after the start sequence with index " + startOffset);
        }

        final String section = text.substring(startOffset, endOffset);
        return TextSpan.create(CharMatcher.whitespace().trimFrom(section), startOffset,
                endOffset);
    }

    private static int firstOffset(final BoldSpanIndex index, final String anchor) {
        try {
            return index.getFirstOffset(anchor);
        } catch (final KeyNotFoundException ex) {
            throw new SequenceNotFoundException(anchor,
                    "Sequence: " + anchor + " could not be found among bold words", ex);
        }
    }

    public String getStart() {
        return this.start;
    }

    public String getEnd() {
        return this.end;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.start + " .. " + this.end + ")";
    }

}
