package eu.fbk.aaer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import org.junit.Assert;
import org.junit.Test;

public class IntervalAggregatorTest {

    private static final IntervalAggregator AGGREGATOR = IntervalAggregator
            .create(Lexicon.DEFAULT);

    @Test
    public void testWindow() {
        Assert.assertEquals(Range.<Double>all(), IntervalAggregator.window(ImmutableList.of()));
        Assert.assertEquals(Range.<Double>all(),
                IntervalAggregator.window(ImmutableList.of(2015)));
        Assert.assertEquals(Range.closed(2015.0, 2016.0),
                IntervalAggregator.window(ImmutableList.of(2015, 2015)));

        // mean 2015.5, population deviation 0.5
        final Range<Double> window = IntervalAggregator.window(ImmutableList.of(2015, 2016));
        Assert.assertEquals(2014.5, window.lowerEndpoint(), 1e-9);
        Assert.assertEquals(2016.5, window.upperEndpoint(), 1e-9);
        Assert.assertFalse(window.contains(2016.5));
    }

    @Test
    public void testOutlierYearRejected() {
        final TemporalMentions.Builder builder = TemporalMentions.builder();
        for (final int year : new int[] { 2015, 2015, 2016, 2016, 2016, 2017, 2017, 2099 }) {
            builder.addYear(year);
        }
        final Interval years = AGGREGATOR.aggregate(builder.build());
        Assert.assertEquals(Interval.Precision.YEAR, years.getPrecision());
        Assert.assertEquals(2015, years.getYearStart());
        Assert.assertEquals(1, years.getMonthStart());
        Assert.assertEquals(2017, years.getYearEnd());
        Assert.assertEquals(12, years.getMonthEnd());
        Assert.assertEquals(7, years.getMentions());

        builder.addMonth(2016, 6).addMonth(2099, 1);
        final Interval months = AGGREGATOR.aggregate(builder.build());
        Assert.assertEquals(Interval.Precision.MONTH, months.getPrecision());
        Assert.assertEquals(2016, months.getYearStart());
        Assert.assertEquals(6, months.getMonthStart());
        Assert.assertEquals(2016, months.getYearEnd());
        Assert.assertEquals(6, months.getMonthEnd());
        Assert.assertEquals(1, months.getMentions());
    }

    @Test
    public void testQuarter() {
        final TemporalMentions mentions = TemporalMentions.builder().addYear(2019)
                .addQuarter(QuarterMention.create(2019, "first", null)).build();
        final Interval interval = AGGREGATOR.aggregate(mentions);
        Assert.assertEquals(Interval.create(2019, 1, 2019, 1, 1, Interval.Precision.MONTH),
                interval);
    }

    @Test
    public void testUnknownQuarterSkipped() {
        final TemporalMentions mentions = TemporalMentions.builder()
                .addQuarter(QuarterMention.create(2019, null, null))
                .addQuarter(QuarterMention.create(2019, "middle", null)).build();
        Assert.assertTrue(AGGREGATOR.months(mentions).isEmpty());
        Assert.assertSame(Interval.EMPTY, AGGREGATOR.aggregate(mentions));
    }

    @Test
    public void testMonthsAndQuarters() {
        final TemporalMentions mentions = TemporalMentions.builder().addYear(2014)
                .addYear(2015).addMonth(2014, 3)
                .addQuarter(QuarterMention.create(2015, "Third", null)).build();
        // window (2014, 2015) on the year + month / 12 line: July 2015 falls outside
        final Interval interval = AGGREGATOR.aggregate(mentions);
        Assert.assertEquals(2014, interval.getYearStart());
        Assert.assertEquals(3, interval.getMonthStart());
        Assert.assertEquals(2014, interval.getYearEnd());
        Assert.assertEquals(3, interval.getMonthEnd());
    }

    @Test
    public void testIdenticalYears() {
        final TemporalMentions mentions = TemporalMentions.builder().addYear(2020)
                .addYear(2020).addMonth(2020, 9).addMonth(2020, 3).build();
        Assert.assertEquals(Interval.create(2020, 3, 2020, 9, 2, Interval.Precision.MONTH),
                AGGREGATOR.aggregate(mentions));
    }

    @Test
    public void testIdenticalYearsRejectFarMonth() {
        final TemporalMentions mentions = TemporalMentions.builder().addYear(2015)
                .addYear(2015).addMonth(2015, 3).addMonth(2030, 6).build();
        Assert.assertEquals(Interval.create(2015, 3, 2015, 3, 1, Interval.Precision.MONTH),
                AGGREGATOR.aggregate(mentions));

        final TemporalMentions years = TemporalMentions.builder().addYear(2015).addYear(2015)
                .build();
        Assert.assertEquals(Interval.create(2015, 1, 2015, 12, 2, Interval.Precision.YEAR),
                AGGREGATOR.aggregate(years));
    }

    @Test
    public void testSingleYear() {
        final Interval interval = AGGREGATOR
                .aggregate(TemporalMentions.builder().addYear(2018).build());
        Assert.assertEquals(Interval.create(2018, 1, 2018, 12, 1, Interval.Precision.YEAR),
                interval);
        Assert.assertFalse(interval.isEmpty());
    }

    @Test
    public void testEmpty() {
        final Interval interval = AGGREGATOR.aggregate(TemporalMentions.EMPTY);
        Assert.assertSame(Interval.EMPTY, interval);
        Assert.assertTrue(interval.isEmpty());
        Assert.assertEquals(0, interval.getMentions());
        Assert.assertEquals(Interval.Precision.NONE, interval.getPrecision());
        try {
            interval.getYearStart();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidInterval() {
        Interval.create(2016, 5, 2016, 4, 1, Interval.Precision.MONTH);
    }

}
