package eu.fbk.aaer;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A mention of a quarter of a given year, e.g., "the first quarter of 2019". The location is
 * the ordinal word qualifying the quarter, if any; the quantity is the numeric modifier of the
 * quarter, as in "the first two quarters".
 */
public final class QuarterMention {

    private final int year;

    @Nullable
    private final String location;

    @Nullable
    private final Token quantity;

    private QuarterMention(final int year, @Nullable final String location,
            @Nullable final Token quantity) {
        this.year = year;
        this.location = location;
        this.quantity = quantity;
    }

    public static QuarterMention create(final int year, @Nullable final String location,
            @Nullable final Token quantity) {
        return new QuarterMention(year, location, quantity);
    }

    public int getYear() {
        return this.year;
    }

    @Nullable
    public String getLocation() {
        return this.location;
    }

    @Nullable
    public Token getQuantity() {
        return this.quantity;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof QuarterMention)) {
            return false;
        }
        final QuarterMention other = (QuarterMention) object;
        return this.year == other.year && Objects.equals(this.location, other.location)
                && this.quantity == other.quantity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.year, this.location);
    }

    @Override
    public String toString() {
        return (this.location != null ? this.location + " " : "")
                + (this.quantity != null ? this.quantity.getText() + " " : "") + "quarter(s) of "
                + this.year;
    }

}
