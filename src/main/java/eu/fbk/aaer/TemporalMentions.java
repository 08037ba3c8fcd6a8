package eu.fbk.aaer;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * The year, quarter and month mentions collected from a text. Quarters and months are keyed by
 * the year they belong to; duplicates are kept.
 */
public final class TemporalMentions {

    public static final TemporalMentions EMPTY = builder().build();

    private final ImmutableList<Integer> years;

    private final ImmutableListMultimap<Integer, QuarterMention> quarters;

    private final ImmutableListMultimap<Integer, Integer> months;

    private TemporalMentions(final ImmutableList<Integer> years,
            final ImmutableListMultimap<Integer, QuarterMention> quarters,
            final ImmutableListMultimap<Integer, Integer> months) {
        this.years = years;
        this.quarters = quarters;
        this.months = months;
    }

    public List<Integer> getYears() {
        return this.years;
    }

    public ImmutableListMultimap<Integer, QuarterMention> getQuarters() {
        return this.quarters;
    }

    public ImmutableListMultimap<Integer, Integer> getMonths() {
        return this.months;
    }

    public boolean isEmpty() {
        return this.years.isEmpty() && this.quarters.isEmpty() && this.months.isEmpty();
    }

    public int size() {
        return this.years.size() + this.quarters.size() + this.months.size();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("years", this.years)
                .add("quarters", this.quarters).add("months", this.months).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final ImmutableList.Builder<Integer> years = ImmutableList.builder();

        private final ImmutableListMultimap.Builder<Integer, QuarterMention> quarters = //
                ImmutableListMultimap.builder();

        private final ImmutableListMultimap.Builder<Integer, Integer> months = //
                ImmutableListMultimap.builder();

        Builder() {
        }

        public Builder addYear(final int year) {
            this.years.add(year);
            return this;
        }

        public Builder addQuarter(final QuarterMention quarter) {
            this.quarters.put(quarter.getYear(), quarter);
            return this;
        }

        public Builder addMonth(final int year, final int month) {
            if (month < 1 || month > 12) {
                throw new IllegalArgumentException("Invalid month " + month);
            }
            this.months.put(year, month);
            return this;
        }

        public TemporalMentions build() {
            return new TemporalMentions(this.years.build(), this.quarters.build(),
                    this.months.build());
        }

    }

}
