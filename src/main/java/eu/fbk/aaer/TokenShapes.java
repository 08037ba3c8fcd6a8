package eu.fbk.aaer;

import javax.annotation.Nullable;

import com.google.common.primitives.Ints;

/**
 * Computes shape codes: letters are mapped to {@code X} / {@code x} depending on case, digits
 * to {@code d}, other characters are kept, and runs of the same code are cut after four
 * occurrences (so {@code 2019} and {@code 201903} are both {@code dddd}).
 */
public final class TokenShapes {

    public static final String FOUR_DIGITS = "dddd";

    public static final String FOUR_DIGITS_ONE_DECIMAL = "dddd.d";

    public static final String FOUR_DIGITS_TWO_DECIMALS = "dddd.dd";

    private static final int MAX_RUN = 4;

    public static String shape(final String text) {
        final StringBuilder builder = new StringBuilder(Math.min(text.length(), 16));
        char last = 0;
        int run = 0;
        for (int i = 0; i < text.length(); ++i) {
            final char c = text.charAt(i);
            final char code;
            if (Character.isLetter(c)) {
                code = Character.isUpperCase(c) ? 'X' : 'x';
            } else if (Character.isDigit(c)) {
                code = 'd';
            } else {
                code = c;
            }
            run = code == last ? run + 1 : 0;
            last = code;
            if (run < MAX_RUN) {
                builder.append(code);
            }
        }
        return builder.toString();
    }

    public static boolean isYear(final String shape) {
        return FOUR_DIGITS.equals(shape);
    }

    public static boolean isYearWithDecimals(final String shape) {
        return FOUR_DIGITS_ONE_DECIMAL.equals(shape) || FOUR_DIGITS_TWO_DECIMALS.equals(shape);
    }

    /**
     * Returns the year denoted by a token shaped as a four-digit number, optionally followed by
     * a period and one or two digits (e.g., a citation such as {@code 2014.12}).
     *
     * @param token
     *            the token
     * @return the year, null if the token does not denote a year
     */
    @Nullable
    public static Integer year(final Token token) {
        final String shape = token.getShape();
        final String text = token.getText();
        if (isYear(shape)) {
            return Ints.tryParse(text);
        } else if (isYearWithDecimals(shape)) {
            return Ints.tryParse(text.substring(0, text.indexOf('.')));
        }
        return null;
    }

    private TokenShapes() {
    }

}
