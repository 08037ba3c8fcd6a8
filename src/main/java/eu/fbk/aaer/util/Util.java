package eu.fbk.aaer.util;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

public final class Util {

    private static final Splitter SPLITTER = Splitter.onPattern("[\\s;]+").trimResults()
            .omitEmptyStrings();

    /**
     * Parses a map written as a list of {@code key:value} (or {@code key=value}) entries
     * separated by whitespace or semicolons. Keys are lowercased.
     *
     * @param string
     *            the string to parse, possibly null
     * @param valueClass
     *            the class of values, either {@code Integer} or {@code Double}
     * @return the parsed map, in the order of the entries
     */
    public static <T> Map<String, T> parseMap(@Nullable final String string,
            final Class<T> valueClass) {
        final Map<String, T> map = Maps.newLinkedHashMap();
        if (string != null) {
            for (final String entry : SPLITTER.split(string)) {
                final int index = Math.max(entry.indexOf(':'), entry.indexOf('='));
                if (index <= 0) {
                    throw new IllegalArgumentException("Invalid map entry '" + entry + "'");
                }
                final String key = entry.substring(0, index).trim().toLowerCase(Locale.ROOT);
                final String valueString = entry.substring(index + 1);
                Object value;
                if (valueClass.isAssignableFrom(Double.class)) {
                    value = Double.valueOf(valueString);
                } else if (valueClass.isAssignableFrom(Integer.class)) {
                    value = Integer.valueOf(valueString);
                } else {
                    throw new Error(valueClass.getName());
                }
                map.put(key, valueClass.cast(value));
            }
        }
        return map;
    }

    /**
     * Parses a set of lowercase words separated by whitespace or semicolons.
     *
     * @param string
     *            the string to parse, possibly null
     * @return the parsed set, in the order of the words
     */
    public static Set<String> parseSet(@Nullable final String string) {
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        if (string != null) {
            for (final String word : SPLITTER.split(string)) {
                builder.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return builder.build();
    }

    private Util() {
    }

}
