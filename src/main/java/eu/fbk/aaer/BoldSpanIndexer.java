package eu.fbk.aaer;

import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/**
 * Rebuilds the full text of a document from its character stream and indexes the words typeset
 * in bold, which are later used as anchors for locating the regions of the document.
 * <p>
 * Bold characters are accumulated into a word until a break character (whitespace, digits and
 * the punctuation in {@code .,'"}) or a non-bold whitespace is met, at which point the word is
 * recorded at the offset where it started. Section numbers (Roman numerals) are recorded with a
 * trailing period, as they appear in section headings (e.g., {@code I.}). A word still pending
 * at the end of a page is dropped.
 * </p>
 */
public final class BoldSpanIndexer {

    public static final Set<String> DEFAULT_NUMERALS = ImmutableSet.of("i", "ii", "iii", "iv",
            "v", "vi", "vii", "viii", "ix", "x", "xi", "xii", "xiii", "xiv", "xv", "xvi", "xvii",
            "xviii", "xix", "xx", "xxi", "xxii", "xxiii", "xxiv", "xxv", "xxvi", "xxvii",
            "xxviii", "xxix", "xxx");

    private static final CharMatcher BREAK_MATCHER = CharMatcher.anyOf(".,'\"")
            .or(CharMatcher.inRange('0', '9'));

    private final Set<String> numerals;

    private BoldSpanIndexer(final Set<String> numerals) {
        this.numerals = numerals;
    }

    public static BoldSpanIndexer create() {
        return new BoldSpanIndexer(DEFAULT_NUMERALS);
    }

    public static BoldSpanIndexer create(final Iterable<String> numerals) {
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (final String numeral : numerals) {
            builder.add(numeral.toLowerCase(Locale.ROOT));
        }
        return new BoldSpanIndexer(builder.build());
    }

    /**
     * Returns a {@code BoldSpanIndexer} configured by the {@code numerals} property (a
     * space-separated list of section numbers to be suffixed with a period) found under the
     * prefix supplied; the default Roman numerals I-XXX are used if the property is missing.
     *
     * @param properties
     *            the configuration properties
     * @param prefix
     *            the prefix to prepend to the property names
     * @return the configured indexer
     */
    public static BoldSpanIndexer create(final Properties properties, String prefix) {
        prefix = prefix.endsWith(".") ? prefix : prefix + ".";
        final String numerals = properties.getProperty(prefix + "numerals");
        return numerals == null ? create()
                : create(Splitter.onPattern("[\\s,;]+").trimResults().omitEmptyStrings()
                        .split(numerals));
    }

    /**
     * Indexes the characters supplied, in their reading order.
     *
     * @param chars
     *            the characters of the document, grouped by page
     * @return the full text of the document with the index of its bold words
     */
    public IndexedText index(final Iterable<PositionedChar> chars) {

        final StringBuilder text = new StringBuilder();
        final StringBuilder word = new StringBuilder();
        final BoldSpanIndex.Builder builder = BoldSpanIndex.builder();

        int start = 0;
        int page = -1;
        for (final PositionedChar ch : chars) {

            // A pending bold word never spans two pages
            if (ch.getPage() != page) {
                word.setLength(0);
                start = text.length();
                page = ch.getPage();
            }

            final String s = ch.getText();
            text.append(s);

            final boolean whitespace = CharMatcher.whitespace().trimFrom(s).isEmpty();
            if (ch.isBold() || whitespace) {
                if (whitespace || isBreak(s)) {
                    if (word.length() > 0) {
                        builder.add(normalize(word.toString()), start);
                    }
                    word.setLength(0);
                    start = text.length();
                } else {
                    word.append(s.toLowerCase(Locale.ROOT));
                }
            } else {
                start = text.length();
            }
        }

        return IndexedText.create(text.toString(), builder.build());
    }

    private String normalize(final String word) {
        return this.numerals.contains(word) ? word + "." : word;
    }

    private static boolean isBreak(final String s) {
        return s.length() == 1 && BREAK_MATCHER.matches(s.charAt(0));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.numerals.size() + " numerals)";
    }

}
