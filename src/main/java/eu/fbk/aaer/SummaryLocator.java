package eu.fbk.aaer;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

/**
 * Locates the narrative summary of a document. The summary starts at the bold "Summary"
 * heading (or, lacking it, at a fixed marker phrase) and ends right before the bold
 * "Respondent(s)" heading that follows it or, lacking that, at the next bold word.
 */
public final class SummaryLocator {

    public static final String DEFAULT_START = "summary";

    public static final String DEFAULT_END = "respondent";

    public static final String DEFAULT_MARKER = "on the basis of this order and";

    private final String start;

    private final String end;

    private final Pattern marker;

    private SummaryLocator(final String start, final String end, final Pattern marker) {
        this.start = start;
        this.end = end;
        this.marker = marker;
    }

    public static SummaryLocator create() {
        return create(DEFAULT_START, DEFAULT_END, DEFAULT_MARKER);
    }

    public static SummaryLocator create(final String start, final String end,
            final String marker) {
        return new SummaryLocator(Objects.requireNonNull(start).toLowerCase(Locale.ROOT),
                Objects.requireNonNull(end).toLowerCase(Locale.ROOT),
                Pattern.compile(Pattern.quote(marker),
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    /**
     * Returns a {@code SummaryLocator} configured by the {@code summary.start},
     * {@code summary.end} and {@code summary.marker} properties found under the prefix supplied.
     *
     * @param properties
     *            the configuration properties
     * @param prefix
     *            the prefix to prepend to the property names
     * @return the configured locator
     */
    public static SummaryLocator create(final Properties properties, String prefix) {
        prefix = prefix.endsWith(".") ? prefix : prefix + ".";
        return create(properties.getProperty(prefix + "summary.start", DEFAULT_START),
                properties.getProperty(prefix + "summary.end", DEFAULT_END),
                properties.getProperty(prefix + "summary.marker", DEFAULT_MARKER));
    }

    /**
     * Locates the summary in the indexed text supplied. If the summary appears to start
     * before the section, the heuristic is assumed to have failed and a degraded span covering
     * everything after the section is returned.
     *
     * @param text
     *            the full document text
     * @param index
     *            the bold words of the document
     * @param section
     *            the section previously located in the same document
     * @return the summary span, possibly degraded
     * @throws KeyNotFoundException
     *             if neither the start anchor nor the marker phrase can be found
     */
    public TextSpan locate(final String text, final BoldSpanIndex index,
            final TextSpan section) {

        final int startOffset = locateStart(text, index);

        if (startOffset < section.getStartOffset()) {
            final int from = Math.min(section.getEndOffset() + 1, text.length());
            return TextSpan.create(text.substring(from), from, TextSpan.TO_END, true);
        }

        Integer endOffset = locateEnd(index, this.end, startOffset);
        if (endOffset == null) {
            endOffset = locateEnd(index, this.end + "s", startOffset);
        }
        if (endOffset == null) {
            endOffset = index.getNextOffset(startOffset);
            if (endOffset == null) {
                return TextSpan.create(text.substring(startOffset), startOffset,
                        TextSpan.TO_END);
            }
        }

        return TextSpan.create(text.substring(startOffset, endOffset), startOffset, endOffset);
    }

    private int locateStart(final String text, final BoldSpanIndex index) {
        if (index.contains(this.start)) {
            return index.getFirstOffset(this.start);
        }
        final Matcher matcher = this.marker.matcher(text);
        if (matcher.find()) {
            return matcher.start();
        }
        throw new KeyNotFoundException(this.start, "Bold key '" + this.start
                + "' not found and summary marker absent from text");
    }

    @Nullable
    private static Integer locateEnd(final BoldSpanIndex index, final String anchor,
            final int startOffset) {
        for (final int offset : index.getOffsets(anchor)) {
            if (offset - 1 >= startOffset) {
                return offset - 1;
            }
        }
        return null;
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
