package eu.fbk.aaer;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import eu.fbk.aaer.util.Util;

/**
 * The static tables used to recognize temporal mentions: month names, the representative month
 * of each quarter ordinal, the verbs denoting misreporting, the fiscal year markers and the
 * labels of the dependency relations the heuristics look at. Instances are immutable and meant
 * to be loaded once and shared.
 */
public final class Lexicon {

    public static final Map<String, Integer> DEFAULT_MONTHS = ImmutableMap
            .<String, Integer>builder().put("january", 1).put("february", 2).put("march", 3)
            .put("april", 4).put("may", 5).put("june", 6).put("july", 7).put("august", 8)
            .put("september", 9).put("october", 10).put("november", 11).put("december", 12)
            .put("jan", 1).put("feb", 2).put("mar", 3).put("apr", 4).put("jun", 6)
            .put("jul", 7).put("aug", 8).put("sep", 9).put("sept", 9).put("oct", 10)
            .put("nov", 11).put("dec", 12).build();

    // A quarter is approximated by its first month
    public static final Map<String, Integer> DEFAULT_QUARTERS = ImmutableMap.of("first", 1,
            "second", 4, "third", 7, "fourth", 10, "last", 10);

    public static final Set<String> DEFAULT_MISREPORTING = ImmutableSet.of("restate", "file",
            "report", "misstate", "overstate", "understate", "inflate");

    public static final Set<String> DEFAULT_FISCAL_MARKERS = ImmutableSet.of("fy", "fys");

    public static final String DEFAULT_POBJ = "pobj";

    public static final String DEFAULT_NUMMOD = "nummod";

    public static final String DEFAULT_AMOD = "amod";

    public static final Lexicon DEFAULT = new Lexicon(DEFAULT_MONTHS, DEFAULT_QUARTERS,
            DEFAULT_MISREPORTING, DEFAULT_FISCAL_MARKERS, DEFAULT_POBJ, DEFAULT_NUMMOD,
            DEFAULT_AMOD);

    private final Map<String, Integer> months;

    private final Map<String, Integer> quarters;

    private final Set<String> misreportingLemmas;

    private final Set<String> fiscalMarkers;

    private final String prepositionalObject;

    private final String numericModifier;

    private final String adjectivalModifier;

    private Lexicon(final Map<String, Integer> months, final Map<String, Integer> quarters,
            final Set<String> misreportingLemmas, final Set<String> fiscalMarkers,
            final String prepositionalObject, final String numericModifier,
            final String adjectivalModifier) {
        this.months = ImmutableMap.copyOf(months);
        this.quarters = ImmutableMap.copyOf(quarters);
        this.misreportingLemmas = ImmutableSet.copyOf(misreportingLemmas);
        this.fiscalMarkers = ImmutableSet.copyOf(fiscalMarkers);
        this.prepositionalObject = Objects.requireNonNull(prepositionalObject);
        this.numericModifier = Objects.requireNonNull(numericModifier);
        this.adjectivalModifier = Objects.requireNonNull(adjectivalModifier);
    }

    /**
     * Returns a {@code Lexicon} based on the configuration properties supplied, falling back to
     * the default tables for missing properties. The properties currently supported, looked up
     * under the prefix supplied, are:
     * <ul>
     * <li>{@code months} - month names and their number, e.g., {@code january:1 jan:1};</li>
     * <li>{@code quarters} - quarter ordinals and their representative month, e.g.,
     * {@code first:1 second:4};</li>
     * <li>{@code misreporting} - a space-separated list of verb lemmas whose numeric modifiers
     * are reliable years;</li>
     * <li>{@code fiscalmarkers} - a space-separated list of fiscal year abbreviations;</li>
     * <li>{@code relation.pobj}, {@code relation.nummod}, {@code relation.amod} - the labels the
     * parser uses for objects of prepositions, numeric modifiers and adjectival modifiers.</li>
     * </ul>
     *
     * @param properties
     *            the configuration properties
     * @param prefix
     *            an optional prefix to prepend to supported properties
     * @return the configured lexicon
     * @throws IllegalArgumentException
     *             if a table is malformed or maps to an invalid month
     */
    public static Lexicon create(final Properties properties, String prefix) {

        // Normalize prefix, ensuring it ends with '.'
        prefix = prefix.endsWith(".") ? prefix : prefix + ".";

        final String monthsProp = properties.getProperty(prefix + "months");
        final String quartersProp = properties.getProperty(prefix + "quarters");
        final String misreportingProp = properties.getProperty(prefix + "misreporting");
        final String fiscalProp = properties.getProperty(prefix + "fiscalmarkers");

        return create(
                monthsProp == null ? DEFAULT_MONTHS : Util.parseMap(monthsProp, Integer.class),
                quartersProp == null ? DEFAULT_QUARTERS
                        : Util.parseMap(quartersProp, Integer.class),
                misreportingProp == null ? DEFAULT_MISREPORTING
                        : Util.parseSet(misreportingProp),
                fiscalProp == null ? DEFAULT_FISCAL_MARKERS : Util.parseSet(fiscalProp),
                properties.getProperty(prefix + "relation.pobj", DEFAULT_POBJ).trim(),
                properties.getProperty(prefix + "relation.nummod", DEFAULT_NUMMOD).trim(),
                properties.getProperty(prefix + "relation.amod", DEFAULT_AMOD).trim());
    }

    public static Lexicon create(final Map<String, Integer> months,
            final Map<String, Integer> quarters, final Iterable<String> misreportingLemmas,
            final Iterable<String> fiscalMarkers, final String prepositionalObject,
            final String numericModifier, final String adjectivalModifier) {
        return new Lexicon(checkMonths(months), checkMonths(quarters),
                lowercase(misreportingLemmas), lowercase(fiscalMarkers), prepositionalObject,
                numericModifier, adjectivalModifier);
    }

    private static Map<String, Integer> checkMonths(final Map<String, Integer> table) {
        final ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
        for (final Map.Entry<String, Integer> entry : table.entrySet()) {
            final int month = entry.getValue();
            if (month < 1 || month > 12) {
                throw new IllegalArgumentException(
                        "Invalid month " + month + " for '" + entry.getKey() + "'");
            }
            builder.put(entry.getKey().toLowerCase(Locale.ROOT), month);
        }
        return builder.build();
    }

    private static Set<String> lowercase(final Iterable<String> words) {
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (final String word : words) {
            builder.add(word.toLowerCase(Locale.ROOT));
        }
        return builder.build();
    }

    /**
     * Returns the number of the month named by the word supplied.
     *
     * @param word
     *            the word, case is ignored
     * @return the month number in 1..12, null if the word is not a month name
     */
    @Nullable
    public Integer getMonth(final String word) {
        return this.months.get(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the representative month of the quarter denoted by an ordinal word.
     *
     * @param ordinal
     *            the ordinal word (e.g., "first"), case is ignored
     * @return the month number in 1..12, null if the ordinal is unknown
     */
    @Nullable
    public Integer getQuarterMonth(final String ordinal) {
        return this.quarters.get(ordinal.toLowerCase(Locale.ROOT));
    }

    public boolean isMisreportingLemma(final String lemma) {
        return this.misreportingLemmas.contains(lemma.toLowerCase(Locale.ROOT));
    }

    public boolean isFiscalMarker(final String word) {
        return this.fiscalMarkers.contains(word.toLowerCase(Locale.ROOT));
    }

    public boolean isPrepositionalObject(final Token token) {
        return this.prepositionalObject.equals(token.getRelation());
    }

    public boolean isNumericModifier(final Token token) {
        return this.numericModifier.equals(token.getRelation());
    }

    public boolean isAdjectivalModifier(final Token token) {
        return this.adjectivalModifier.equals(token.getRelation());
    }

    public Map<String, Integer> getMonths() {
        return this.months;
    }

    public Map<String, Integer> getQuarters() {
        return this.quarters;
    }

    public Set<String> getMisreportingLemmas() {
        return this.misreportingLemmas;
    }

    public Set<String> getFiscalMarkers() {
        return this.fiscalMarkers;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("months", this.months.size())
                .add("quarters", this.quarters.keySet())
                .add("misreporting", this.misreportingLemmas)
                .add("fiscal", this.fiscalMarkers)
                .add("relations", this.prepositionalObject + "/" + this.numericModifier + "/"
                        + this.adjectivalModifier)
                .toString();
    }

}
