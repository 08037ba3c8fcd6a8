package eu.fbk.aaer;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/**
 * Guesses the respondent company of an enforcement document from the title in its section,
 * i.e., the text between "In the Matter of" and "Respondent".
 */
public final class CompanyNames {

    public static final String TITLE_START = "In the Matter of";

    public static final String TITLE_END = "Respondent";

    public static final Set<String> INDICATORS = ImmutableSet.of("LLP", "LLC", "CORP", "INC");

    private static final Splitter AND_SPLITTER = Splitter.onPattern("\\band\\b").trimResults()
            .omitEmptyStrings();

    /**
     * Returns the company named in the title of the section supplied, if any. When the title
     * names several respondents joined by "and", the first one that looks like a company is
     * returned.
     *
     * @param section
     *            the section text
     * @return the company name, null if the title does not name a company
     * @throws SequenceNotFoundException
     *             if the title delimiters cannot be found in the section
     */
    @Nullable
    public static String fromSection(final String section) {

        final int[] bounds = find(section, TITLE_START, TITLE_END);
        final String title = CharMatcher.whitespace().or(CharMatcher.is(','))
                .trimFrom(section.substring(bounds[0] + TITLE_START.length(), bounds[1]));

        if (!isCompany(title)) {
            return null;
        }

        final List<String> parts = AND_SPLITTER.splitToList(title);
        if (parts.size() <= 1) {
            return title;
        }
        for (final String part : parts) {
            if (isCompany(part)) {
                return part;
            }
        }
        return null;
    }

    /**
     * Finds, ignoring case, the start sequence and then the end sequence after it.
     *
     * @return the offsets where the start and the end sequences begin
     */
    static int[] find(final String text, final String start, final String end) {

        final int startIndex = indexOf(text, start, 0);
        if (startIndex < 0) {
            throw new SequenceNotFoundException(start,
                    "Start sequence: " + start + " could not be found in the text");
        }

        final int endIndex = indexOf(text, end, startIndex);
        if (endIndex < 0) {
            throw new SequenceNotFoundException(end, "End sequence: " + end
                    + " could not be found in the text after the start sequence with index "
                    + startIndex);
        }

        return new int[] { startIndex, endIndex };
    }

    private static int indexOf(final String text, final String sequence, final int from) {
        final Matcher matcher = Pattern
                .compile(Pattern.quote(sequence), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                .matcher(text);
        return matcher.find(from) ? matcher.start() : -1;
    }

    private static boolean isCompany(final String name) {
        final String upper = name.toUpperCase(Locale.ROOT);
        for (final String indicator : INDICATORS) {
            if (upper.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    private CompanyNames() {
    }

}
