package eu.fbk.aaer;

import java.util.List;

import javax.annotation.Nullable;

/**
 * A node of the dependency tree produced by an external parser. Tokens are read-only: the
 * tree is owned by the parser and only navigated through head and children links.
 */
public interface Token {

    /**
     * Returns the surface text of the token.
     *
     * @return the token text, not null
     */
    String getText();

    /**
     * Returns the lemma of the token, as assigned by the parser.
     *
     * @return the lemma, not null
     */
    String getLemma();

    /**
     * Returns the shape code of the token text, e.g., {@code dddd} for a four-digit number.
     *
     * @return the shape code, not null
     * @see TokenShapes
     */
    String getShape();

    /**
     * Returns the label of the dependency linking the token to its head.
     *
     * @return the dependency relation, not null
     */
    String getRelation();

    /**
     * Returns the head of the token in the dependency tree.
     *
     * @return the head, null if the token is a root
     */
    @Nullable
    Token getHead();

    /**
     * Returns the dependents of the token, in text order.
     *
     * @return an immutable list of children, possibly empty
     */
    List<Token> getChildren();

}
