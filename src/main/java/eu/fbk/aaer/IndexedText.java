package eu.fbk.aaer;

import java.util.Objects;

/**
 * The full text of a document together with the index of its bold words.
 */
public final class IndexedText {

    private final String text;

    private final BoldSpanIndex index;

    private IndexedText(final String text, final BoldSpanIndex index) {
        this.text = text;
        this.index = index;
    }

    public static IndexedText create(final String text, final BoldSpanIndex index) {
        return new IndexedText(Objects.requireNonNull(text), Objects.requireNonNull(index));
    }

    public String getText() {
        return this.text;
    }

    public BoldSpanIndex getIndex() {
        return this.index;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof IndexedText)) {
            return false;
        }
        final IndexedText other = (IndexedText) object;
        return this.text.equals(other.text) && this.index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.text, this.index);
    }

    @Override
    public String toString() {
        return this.text.length() + " chars, " + this.index.size() + " bold words";
    }

}
