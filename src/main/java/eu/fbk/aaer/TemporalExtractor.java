package eu.fbk.aaer;

import java.util.Locale;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Collects the year, quarter and month mentions of a dependency-parsed text.
 * <p>
 * Every token is examined on its own and may contribute to several collections:
 * </p>
 * <ul>
 * <li>a four-digit token is a year if it modifies a misreporting verb ("restated 2015"), if
 * it depends on a fiscal year marker ("FY 2015", "FYs 2014 2015"), or if it is the object of a
 * preposition ("in 2015"); a four-digit object of a preposition followed by one or two decimals
 * is a year too, the decimals coming from a citation;</li>
 * <li>a four-digit numeric modifier of a month name is the year of that month;</li>
 * <li>a token with lemma "quarter" is a quarter mention if a year can be found below it, e.g.,
 * "the first quarter of fiscal year 2016".</li>
 * </ul>
 */
public final class TemporalExtractor {

    private static final String QUARTER = "quarter";

    private static final String YEAR = "year";

    private final Lexicon lexicon;

    private TemporalExtractor(final Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public static TemporalExtractor create(final Lexicon lexicon) {
        return new TemporalExtractor(Objects.requireNonNull(lexicon));
    }

    public TemporalMentions extract(final Iterable<? extends Token> tokens) {

        final TemporalMentions.Builder builder = TemporalMentions.builder();

        for (final Token token : tokens) {

            final String shape = token.getShape();
            final Token head = token.getHead();

            if (TokenShapes.isYear(shape)) {
                final Integer value = TokenShapes.year(token);
                if (value != null) {
                    if (isYear(token, head)) {
                        builder.addYear(value);
                    }
                    if (head != null && this.lexicon.isNumericModifier(token)) {
                        final Integer month = this.lexicon.getMonth(head.getText());
                        if (month != null) {
                            builder.addMonth(value, month);
                        }
                    }
                }

            } else if (TokenShapes.isYearWithDecimals(shape)
                    && this.lexicon.isPrepositionalObject(token)) {
                final Integer value = TokenShapes.year(token);
                if (value != null) {
                    builder.addYear(value);
                }
            }

            if (QUARTER.equals(token.getLemma().toLowerCase(Locale.ROOT))) {
                final Integer year = findYear(token);
                if (year != null) {
                    builder.addQuarter(findQuarter(token, year));
                }
            }
        }

        return builder.build();
    }

    private boolean isYear(final Token token, @Nullable final Token head) {
        if (this.lexicon.isPrepositionalObject(token)) {
            return true;
        }
        if (head == null) {
            return false;
        }
        if (this.lexicon.isNumericModifier(token)
                && this.lexicon.isMisreportingLemma(head.getLemma())) {
            return true;
        }
        if (this.lexicon.isFiscalMarker(head.getText())) {
            return true;
        }
        final Token headOfHead = head.getHead();
        return TokenShapes.isYear(head.getShape()) && headOfHead != null
                && this.lexicon.isFiscalMarker(headOfHead.getText());
    }

    /**
     * Looks for the year of a quarter among the grandchildren of the quarter token, descending
     * one more level below "year" and fiscal year markers. The last year found wins.
     */
    @Nullable
    private Integer findYear(final Token quarter) {
        Integer year = null;
        for (final Token child : quarter.getChildren()) {
            for (final Token grandChild : child.getChildren()) {
                final String lemma = grandChild.getLemma();
                if (YEAR.equals(lemma.toLowerCase(Locale.ROOT))
                        || this.lexicon.isFiscalMarker(lemma)) {
                    for (final Token greatGrandChild : grandChild.getChildren()) {
                        final Integer candidate = yearOf(greatGrandChild);
                        if (candidate != null) {
                            year = candidate;
                        }
                    }
                } else {
                    final Integer candidate = yearOf(grandChild);
                    if (candidate != null) {
                        year = candidate;
                    }
                }
            }
        }
        return year;
    }

    @Nullable
    private Integer yearOf(final Token token) {
        if (this.lexicon.isPrepositionalObject(token) || this.lexicon.isNumericModifier(token)) {
            return TokenShapes.year(token);
        }
        return null;
    }

    /**
     * Extracts the ordinal (location) and numeric modifier (quantity) of a quarter token. An
     * ordinal attached to the quantity, as in "the first two quarters", takes precedence.
     */
    private QuarterMention findQuarter(final Token quarter, final int year) {
        Token quantity = null;
        String location = null;
        for (final Token child : quarter.getChildren()) {
            if (this.lexicon.isNumericModifier(child)) {
                quantity = child;
            } else if (this.lexicon.isAdjectivalModifier(child)) {
                location = child.getText();
            }
        }
        if (quantity != null) {
            for (final Token child : quantity.getChildren()) {
                if (this.lexicon.isAdjectivalModifier(child)) {
                    location = child.getText();
                }
            }
        }
        return QuarterMention.create(year, location, quantity);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.lexicon + ")";
    }

}
