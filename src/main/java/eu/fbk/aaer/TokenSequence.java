package eu.fbk.aaer;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An immutable sequence of parsed tokens, in text order, whose head and children links form
 * the dependency tree of the text. Instances are assembled by parser adapters through a
 * {@link Builder}.
 */
public final class TokenSequence extends AbstractList<Token> {

    public static final String ROOT = "ROOT";

    public static final TokenSequence EMPTY = builder().build();

    private final List<SequenceToken> tokens;

    private TokenSequence(final Builder builder) {
        final int size = builder.texts.size();
        final List<List<Integer>> children = new ArrayList<>(size);
        for (int i = 0; i < size; ++i) {
            children.add(new ArrayList<>());
        }
        for (int i = 0; i < size; ++i) {
            final int head = builder.heads.get(i);
            if (head >= 0) {
                children.get(head).add(i);
            }
        }
        final ImmutableList.Builder<SequenceToken> list = ImmutableList.builder();
        for (int i = 0; i < size; ++i) {
            list.add(new SequenceToken(this, builder.texts.get(i), builder.lemmas.get(i),
                    builder.shapes.get(i), builder.relations.get(i), builder.heads.get(i),
                    ImmutableList.copyOf(children.get(i))));
        }
        this.tokens = list.build();
    }

    @Override
    public Token get(final int index) {
        return this.tokens.get(index);
    }

    @Override
    public int size() {
        return this.tokens.size();
    }

    @Override
    public String toString() {
        return Joiner.on(' ').join(this.tokens);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<String> texts = new ArrayList<>();

        private final List<String> lemmas = new ArrayList<>();

        private final List<String> shapes = new ArrayList<>();

        private final List<String> relations = new ArrayList<>();

        private final List<Integer> heads = new ArrayList<>();

        Builder() {
        }

        /**
         * Appends a token, whose shape is computed from its text.
         *
         * @param text
         *            the token text
         * @param lemma
         *            the token lemma; if null, the lowercase text is used
         * @return the index of the added token
         */
        public int addToken(final String text, @Nullable final String lemma) {
            return addToken(text, lemma, TokenShapes.shape(text));
        }

        public int addToken(final String text, @Nullable final String lemma,
                final String shape) {
            Objects.requireNonNull(text);
            this.texts.add(text);
            this.lemmas.add(lemma != null ? lemma : text.toLowerCase(Locale.ROOT));
            this.shapes.add(Objects.requireNonNull(shape));
            this.relations.add(ROOT);
            this.heads.add(-1);
            return this.texts.size() - 1;
        }

        /**
         * Links a dependent token to its head. A token has at most one head: a later call for
         * the same dependent replaces the earlier link.
         *
         * @param head
         *            the index of the head token
         * @param dependent
         *            the index of the dependent token
         * @param relation
         *            the dependency label
         * @return this builder, for call chaining
         */
        public Builder addDependency(final int head, final int dependent,
                final String relation) {
            Objects.requireNonNull(relation);
            checkIndex(head);
            checkIndex(dependent);
            if (head == dependent) {
                throw new IllegalArgumentException("Token " + head + " cannot be its own head");
            }
            this.heads.set(dependent, head);
            this.relations.set(dependent, relation);
            return this;
        }

        private void checkIndex(final int index) {
            if (index < 0 || index >= this.texts.size()) {
                throw new IndexOutOfBoundsException(
                        "Invalid token index " + index + " (" + this.texts.size() + " tokens)");
            }
        }

        public TokenSequence build() {
            return new TokenSequence(this);
        }

    }

    private static final class SequenceToken implements Token {

        private final TokenSequence sequence;

        private final String text;

        private final String lemma;

        private final String shape;

        private final String relation;

        private final int head;

        private final List<Integer> children;

        SequenceToken(final TokenSequence sequence, final String text, final String lemma,
                final String shape, final String relation, final int head,
                final List<Integer> children) {
            this.sequence = sequence;
            this.text = text;
            this.lemma = lemma;
            this.shape = shape;
            this.relation = relation;
            this.head = head;
            this.children = children;
        }

        @Override
        public String getText() {
            return this.text;
        }

        @Override
        public String getLemma() {
            return this.lemma;
        }

        @Override
        public String getShape() {
            return this.shape;
        }

        @Override
        public String getRelation() {
            return this.relation;
        }

        @Nullable
        @Override
        public Token getHead() {
            return this.head < 0 ? null : this.sequence.tokens.get(this.head);
        }

        @Override
        public List<Token> getChildren() {
            final ImmutableList.Builder<Token> builder = ImmutableList.builder();
            for (final int child : this.children) {
                builder.add(this.sequence.tokens.get(child));
            }
            return builder.build();
        }

        @Override
        public String toString() {
            return this.text + "/" + this.lemma + "/" + this.relation;
        }

    }

}
