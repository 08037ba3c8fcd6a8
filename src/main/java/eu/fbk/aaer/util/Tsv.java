package eu.fbk.aaer.util;

import java.io.IOException;
import java.io.Writer;

import javax.annotation.Nullable;

/**
 * Writes rows of tab-separated values. Tabs, newlines and backslashes inside a value are
 * escaped as {@code \t}, {@code \n}, {@code \r} and {@code \\}; null values are written as
 * empty fields.
 */
public final class Tsv {

    private Tsv() {
    }

    public static void writeRow(final Writer writer, final Object... values) throws IOException {
        for (int i = 0; i < values.length; ++i) {
            if (i > 0) {
                writer.write('\t');
            }
            writeEscaped(writer, values[i]);
        }
        writer.write('\n');
    }

    public static String escape(@Nullable final Object value) {
        final StringBuilder builder = new StringBuilder();
        escape(builder, value);
        return builder.toString();
    }

    private static void writeEscaped(final Writer writer, @Nullable final Object value)
            throws IOException {
        final StringBuilder builder = new StringBuilder();
        escape(builder, value);
        writer.write(builder.toString());
    }

    private static void escape(final StringBuilder out, @Nullable final Object value) {
        if (value == null) {
            return;
        }
        final String string = value.toString();
        final int len = string.length();
        for (int i = 0; i < len; ++i) {
            final char c = string.charAt(i);
            if (c == '\t') {
                out.append("\\t");
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\\') {
                out.append("\\\\");
            } else {
                out.append(c);
            }
        }
    }

}
