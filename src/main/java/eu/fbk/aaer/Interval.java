package eu.fbk.aaer;

import java.util.Objects;

/**
 * A period of time described by a text, with month granularity. The interval records how many
 * mentions supported it and how precise it is; the {@link #EMPTY} interval, returned when no
 * mention could be used, has no bounds at all.
 */
public final class Interval {

    public enum Precision {

        /** Bounds derived from month (or quarter) mentions. */
        MONTH,

        /** Bounds derived from bare years only; months span the whole years. */
        YEAR,

        /** No usable mention: the interval is empty. */
        NONE

    }

    public static final Interval EMPTY = new Interval(0, 0, 0, 0, 0, Precision.NONE);

    private final int yearStart;

    private final int monthStart;

    private final int yearEnd;

    private final int monthEnd;

    private final int mentions;

    private final Precision precision;

    private Interval(final int yearStart, final int monthStart, final int yearEnd,
            final int monthEnd, final int mentions, final Precision precision) {
        this.yearStart = yearStart;
        this.monthStart = monthStart;
        this.yearEnd = yearEnd;
        this.monthEnd = monthEnd;
        this.mentions = mentions;
        this.precision = precision;
    }

    public static Interval create(final int yearStart, final int monthStart, final int yearEnd,
            final int monthEnd, final int mentions, final Precision precision) {
        Objects.requireNonNull(precision);
        if (precision == Precision.NONE) {
            throw new IllegalArgumentException("Use Interval.EMPTY for an empty interval");
        }
        if (monthStart < 1 || monthStart > 12 || monthEnd < 1 || monthEnd > 12) {
            throw new IllegalArgumentException(
                    "Invalid months " + monthStart + ", " + monthEnd);
        }
        if (yearStart > yearEnd || yearStart == yearEnd && monthStart > monthEnd) {
            throw new IllegalArgumentException("Interval start " + yearStart + "-" + monthStart
                    + " follows end " + yearEnd + "-" + monthEnd);
        }
        if (mentions <= 0) {
            throw new IllegalArgumentException("Invalid number of mentions " + mentions);
        }
        return new Interval(yearStart, monthStart, yearEnd, monthEnd, mentions, precision);
    }

    public boolean isEmpty() {
        return this.precision == Precision.NONE;
    }

    public int getYearStart() {
        checkNotEmpty();
        return this.yearStart;
    }

    public int getMonthStart() {
        checkNotEmpty();
        return this.monthStart;
    }

    public int getYearEnd() {
        checkNotEmpty();
        return this.yearEnd;
    }

    public int getMonthEnd() {
        checkNotEmpty();
        return this.monthEnd;
    }

    /**
     * Returns the number of mentions that fell within the interval bounds and determined them.
     *
     * @return the number of supporting mentions, 0 for the empty interval
     */
    public int getMentions() {
        return this.mentions;
    }

    public Precision getPrecision() {
        return this.precision;
    }

    private void checkNotEmpty() {
        if (this.precision == Precision.NONE) {
            throw new IllegalStateException("Empty interval has no bounds");
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Interval)) {
            return false;
        }
        final Interval other = (Interval) object;
        return this.yearStart == other.yearStart && this.monthStart == other.monthStart
                && this.yearEnd == other.yearEnd && this.monthEnd == other.monthEnd
                && this.mentions == other.mentions && this.precision == other.precision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.yearStart, this.monthStart, this.yearEnd, this.monthEnd,
                this.mentions, this.precision);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[empty]";
        }
        return String.format("[%d-%02d, %d-%02d] (%d mentions, %s)", this.yearStart,
                this.monthStart, this.yearEnd, this.monthEnd, this.mentions,
                this.precision.name().toLowerCase());
    }

}
