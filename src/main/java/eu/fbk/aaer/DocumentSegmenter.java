package eu.fbk.aaer;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Splits an indexed document into its header section and its narrative summary.
 */
public final class DocumentSegmenter {

    public static final String DEFAULT_RISK_MARKER = "21c";

    private final SectionLocator sectionLocator;

    private final SummaryLocator summaryLocator;

    private final String riskMarker;

    private DocumentSegmenter(final SectionLocator sectionLocator,
            final SummaryLocator summaryLocator, final String riskMarker) {
        this.sectionLocator = sectionLocator;
        this.summaryLocator = summaryLocator;
        this.riskMarker = riskMarker;
    }

    public static DocumentSegmenter create() {
        return create(SectionLocator.create(), SummaryLocator.create(), DEFAULT_RISK_MARKER);
    }

    public static DocumentSegmenter create(final SectionLocator sectionLocator,
            final SummaryLocator summaryLocator, final String riskMarker) {
        return new DocumentSegmenter(Objects.requireNonNull(sectionLocator),
                Objects.requireNonNull(summaryLocator),
                Objects.requireNonNull(riskMarker).toLowerCase(Locale.ROOT));
    }

    /**
     * Returns a {@code DocumentSegmenter} based on the configuration properties supplied. The
     * properties currently supported, looked up under the prefix supplied, are:
     * <ul>
     * <li>{@code section.start}, {@code section.end} - the bold anchors delimiting the
     * section;</li>
     * <li>{@code summary.start}, {@code summary.end} - the bold anchors delimiting the
     * summary;</li>
     * <li>{@code summary.marker} - the phrase starting the summary when its heading is
     * missing;</li>
     * <li>{@code riskmarker} - the string whose presence in the section is reported.</li>
     * </ul>
     *
     * @param properties
     *            the configuration properties
     * @param prefix
     *            an optional prefix to prepend to supported properties
     * @return the configured segmenter
     */
    public static DocumentSegmenter create(final Properties properties, String prefix) {
        prefix = prefix.endsWith(".") ? prefix : prefix + ".";
        return create(SectionLocator.create(properties, prefix),
                SummaryLocator.create(properties, prefix),
                properties.getProperty(prefix + "riskmarker", DEFAULT_RISK_MARKER));
    }

    public Segmentation segmentDocument(final IndexedText document) {
        return segmentDocument(document.getText(), document.getIndex());
    }

    /**
     * Locates section and summary of a document.
     *
     * @param text
     *            the full document text
     * @param index
     *            the bold words of the document
     * @return the located regions
     * @throws SequenceNotFoundException
     *             if the section anchors are missing
     * @throws KeyNotFoundException
     *             if the start of the summary cannot be determined
     */
    public Segmentation segmentDocument(final String text, final BoldSpanIndex index) {
        final TextSpan section = this.sectionLocator.locate(text, index);
        final TextSpan summary = this.summaryLocator.locate(text, index, section);
        final boolean risk = section.getText().toLowerCase(Locale.ROOT).contains(this.riskMarker);
        return Segmentation.create(section, summary, risk);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.sectionLocator + ", "
                + this.summaryLocator + ", risk marker " + this.riskMarker + ")";
    }

}
