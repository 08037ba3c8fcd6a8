package eu.fbk.aaer;

/**
 * An external dependency parser, turning raw text into a sequence of tokens linked by
 * dependency relations.
 */
public interface DependencyParser {

    /**
     * Parses the text supplied.
     *
     * @param text
     *            the text to parse
     * @return the tokens of the text, in text order
     */
    TokenSequence parse(String text);

}
