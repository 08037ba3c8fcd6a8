package eu.fbk.aaer;

import java.util.Objects;

/**
 * A character of a document, in reading order, together with the font information needed to
 * recognize bold headings.
 */
public final class PositionedChar {

    private final String text;

    private final boolean bold;

    private final int page;

    private final int offset;

    private PositionedChar(final String text, final boolean bold, final int page,
            final int offset) {
        this.text = text;
        this.bold = bold;
        this.page = page;
        this.offset = offset;
    }

    public static PositionedChar create(final String text, final boolean bold, final int page,
            final int offset) {
        Objects.requireNonNull(text);
        if (page < 0 || offset < 0) {
            throw new IllegalArgumentException(
                    "Invalid page/offset " + page + "/" + offset + " for '" + text + "'");
        }
        return new PositionedChar(text, bold, page, offset);
    }

    public String getText() {
        return this.text;
    }

    public boolean isBold() {
        return this.bold;
    }

    public int getPage() {
        return this.page;
    }

    public int getOffset() {
        return this.offset;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof PositionedChar)) {
            return false;
        }
        final PositionedChar other = (PositionedChar) object;
        return this.bold == other.bold && this.page == other.page && this.offset == other.offset
                && this.text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.text, this.bold, this.page, this.offset);
    }

    @Override
    public String toString() {
        return "'" + this.text + "'" + (this.bold ? "/b" : "") + "@" + this.page + ":"
                + this.offset;
    }

}
