package eu.fbk.aaer;

import java.util.Objects;

/**
 * The regions located in a document: its header section and its narrative summary, plus
 * whether the section carries the risk marker.
 */
public final class Segmentation {

    private final TextSpan section;

    private final TextSpan summary;

    private final boolean riskMarker;

    private Segmentation(final TextSpan section, final TextSpan summary,
            final boolean riskMarker) {
        this.section = section;
        this.summary = summary;
        this.riskMarker = riskMarker;
    }

    public static Segmentation create(final TextSpan section, final TextSpan summary,
            final boolean riskMarker) {
        return new Segmentation(Objects.requireNonNull(section), Objects.requireNonNull(summary),
                riskMarker);
    }

    public TextSpan getSection() {
        return this.section;
    }

    public TextSpan getSummary() {
        return this.summary;
    }

    public boolean containsRiskMarker() {
        return this.riskMarker;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Segmentation)) {
            return false;
        }
        final Segmentation other = (Segmentation) object;
        return this.riskMarker == other.riskMarker && this.section.equals(other.section)
                && this.summary.equals(other.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.section, this.summary, this.riskMarker);
    }

    @Override
    public String toString() {
        return "section " + this.section + ", summary " + this.summary
                + (this.riskMarker ? ", risk marker" : "");
    }

}
