package eu.fbk.aaer;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Infers the period of time a text is about, by collecting its temporal mentions and reducing
 * them to an interval.
 */
public final class DocumentParser {

    private final TemporalExtractor extractor;

    private final IntervalAggregator aggregator;

    @Nullable
    private final DependencyParser parser;

    private DocumentParser(final TemporalExtractor extractor,
            final IntervalAggregator aggregator, @Nullable final DependencyParser parser) {
        this.extractor = extractor;
        this.aggregator = aggregator;
        this.parser = parser;
    }

    public static DocumentParser create(final Lexicon lexicon) {
        return create(lexicon, null);
    }

    /**
     * Creates a {@code DocumentParser} using the lexicon and, optionally, the dependency parser
     * supplied.
     *
     * @param lexicon
     *            the tables used to recognize temporal mentions
     * @param parser
     *            the parser used by {@link #parse(String)}; if null, only already parsed token
     *            sequences can be processed
     * @return the created parser
     */
    public static DocumentParser create(final Lexicon lexicon,
            @Nullable final DependencyParser parser) {
        Objects.requireNonNull(lexicon);
        return new DocumentParser(TemporalExtractor.create(lexicon),
                IntervalAggregator.create(lexicon), parser);
    }

    public TemporalMentions extract(final Iterable<? extends Token> tokens) {
        return this.extractor.extract(tokens);
    }

    /**
     * Infers the interval described by a parsed text. The result is {@link Interval#EMPTY}
     * when no usable mention is found; callers should check {@link Interval#isEmpty()} or
     * {@link Interval#getMentions()}.
     *
     * @param tokens
     *            the tokens of the text, in text order
     * @return the inferred interval
     */
    public Interval inferInterval(final Iterable<? extends Token> tokens) {
        return this.aggregator.aggregate(this.extractor.extract(tokens));
    }

    /**
     * Parses the text supplied with the configured dependency parser and infers the interval
     * it describes.
     *
     * @param text
     *            the text to analyze
     * @return the inferred interval
     * @throws IllegalStateException
     *             if no dependency parser was configured
     */
    public Interval parse(final String text) {
        if (this.parser == null) {
            throw new IllegalStateException("No dependency parser configured");
        }
        return inferInterval(this.parser.parse(text));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.extractor + ", " + this.aggregator
                + (this.parser != null ? ", " + this.parser : "") + ")";
    }

}
