package eu.fbk.aaer;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableListMultimap;

/**
 * Maps each normalized (lowercase) bold word of a document to the offsets where it starts in
 * the document text. Offsets of the same word are kept in encounter order, duplicates included.
 */
public final class BoldSpanIndex {

    public static final BoldSpanIndex EMPTY = new BoldSpanIndex(ImmutableListMultimap.of());

    private final ImmutableListMultimap<String, Integer> offsets;

    private BoldSpanIndex(final ImmutableListMultimap<String, Integer> offsets) {
        this.offsets = offsets;
    }

    public boolean isEmpty() {
        return this.offsets.isEmpty();
    }

    public int size() {
        return this.offsets.size();
    }

    public Set<String> getWords() {
        return this.offsets.keySet();
    }

    public boolean contains(final String word) {
        return this.offsets.containsKey(word);
    }

    /**
     * Returns the start offsets of the word supplied, in encounter order.
     *
     * @param word
     *            the normalized bold word
     * @return the offsets, empty if the word was never seen in bold
     */
    public List<Integer> getOffsets(final String word) {
        return this.offsets.get(word);
    }

    /**
     * Returns the offset of the first occurrence of the word supplied.
     *
     * @param word
     *            the normalized bold word
     * @return the first start offset
     * @throws KeyNotFoundException
     *             if the word is not in the index
     */
    public int getFirstOffset(final String word) {
        final List<Integer> list = this.offsets.get(word);
        if (list.isEmpty()) {
            throw new KeyNotFoundException(word);
        }
        return list.get(0);
    }

    /**
     * Returns the smallest offset of any bold word that is strictly greater than the offset
     * supplied, i.e., where the next bold heading after that offset starts.
     *
     * @param offset
     *            the reference offset
     * @return the next bold offset, null if there is none
     */
    @Nullable
    public Integer getNextOffset(final int offset) {
        Integer next = null;
        for (final Integer candidate : this.offsets.values()) {
            if (candidate > offset && (next == null || candidate < next)) {
                next = candidate;
            }
        }
        return next;
    }

    public ImmutableListMultimap<String, Integer> asMultimap() {
        return this.offsets;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof BoldSpanIndex)) {
            return false;
        }
        return this.offsets.equals(((BoldSpanIndex) object).offsets);
    }

    @Override
    public int hashCode() {
        return this.offsets.hashCode();
    }

    @Override
    public String toString() {
        return this.offsets.asMap().toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public final static class Builder {

        private final ImmutableListMultimap.Builder<String, Integer> offsets;

        Builder() {
            this.offsets = ImmutableListMultimap.builder();
        }

        public Builder add(final String word, final int offset) {
            Objects.requireNonNull(word);
            if (offset < 0) {
                throw new IllegalArgumentException("Negative offset " + offset + " for " + word);
            }
            this.offsets.put(word, offset);
            return this;
        }

        public BoldSpanIndex build() {
            return new BoldSpanIndex(this.offsets.build());
        }

    }

}
