package eu.fbk.aaer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Range;
import com.google.common.primitives.Doubles;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Reduces the temporal mentions of a text to the interval they most likely describe.
 * <p>
 * When more than one year is mentioned, mentions are accepted only within two (population)
 * standard deviations from the mean year, which discards outliers such as the year of a cited
 * regulation. Quarters are translated into their representative month and merged with the
 * months; each accepted {@code (year, month)} pair is placed on a continuous time line as
 * {@code year + month / 12} and the interval spans from the earliest to the latest of them.
 * Lacking months, the interval spans the accepted bare years.
 * </p>
 */
public final class IntervalAggregator {

    private static final double SIGMAS = 2.0;

    private final Lexicon lexicon;

    private IntervalAggregator(final Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public static IntervalAggregator create(final Lexicon lexicon) {
        return new IntervalAggregator(Objects.requireNonNull(lexicon));
    }

    /**
     * Computes the acceptance window for the years supplied: the open range within two
     * standard deviations from their mean if there are at least two years that are not all
     * equal, the closed range spanning the months of that year if they are all equal, the
     * unbounded range if fewer than two years are supplied.
     *
     * @param years
     *            the mentioned years
     * @return the acceptance window, on the {@code year + month / 12} time line
     */
    public static Range<Double> window(final List<Integer> years) {
        if (years.size() <= 1) {
            return Range.all();
        }
        final double[] values = Doubles.toArray(years);
        final double mean = new Mean().evaluate(values);
        final double deviation = new StandardDeviation(false).evaluate(values);
        if (deviation == 0.0) {
            return Range.closed(mean, mean + 1.0);
        }
        return Range.open(mean - SIGMAS * deviation, mean + SIGMAS * deviation);
    }

    /**
     * Merges quarter mentions into month mentions. Quarters whose ordinal is missing or
     * unknown cannot be placed within their year and are skipped.
     *
     * @param mentions
     *            the collected mentions
     * @return the months of each year, quarters included
     */
    public ListMultimap<Integer, Integer> months(final TemporalMentions mentions) {
        final ListMultimap<Integer, Integer> months = ArrayListMultimap
                .create(mentions.getMonths());
        for (final Map.Entry<Integer, QuarterMention> entry : mentions.getQuarters().entries()) {
            final String location = entry.getValue().getLocation();
            final Integer month = location == null ? null
                    : this.lexicon.getQuarterMonth(location);
            if (month != null) {
                months.put(entry.getKey(), month);
            }
        }
        return months;
    }

    public Interval aggregate(final TemporalMentions mentions) {

        final Range<Double> window = window(mentions.getYears());

        // Track the earliest and latest accepted months, as year * 12 + month - 1
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        int accepted = 0;
        for (final Map.Entry<Integer, Integer> entry : months(mentions).entries()) {
            final int year = entry.getKey();
            final int month = entry.getValue();
            if (window.contains(year + month / 12.0)) {
                final int ordinal = year * 12 + month - 1;
                min = Math.min(min, ordinal);
                max = Math.max(max, ordinal);
                ++accepted;
            }
        }
        if (accepted > 0) {
            return Interval.create(Math.floorDiv(min, 12), Math.floorMod(min, 12) + 1,
                    Math.floorDiv(max, 12), Math.floorMod(max, 12) + 1, accepted,
                    Interval.Precision.MONTH);
        }

        // Fall back to bare years
        final List<Integer> years = mentions.getYears();
        min = Integer.MAX_VALUE;
        max = Integer.MIN_VALUE;
        for (final int year : years) {
            if (window.contains((double) year)) {
                min = Math.min(min, year);
                max = Math.max(max, year);
                ++accepted;
            }
        }
        if (accepted > 0) {
            return Interval.create(min, 1, max, 12, accepted, Interval.Precision.YEAR);
        }

        return Interval.EMPTY;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.lexicon.getQuarters() + ")";
    }

}
