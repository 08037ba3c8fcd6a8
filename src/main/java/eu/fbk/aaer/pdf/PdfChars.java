package eu.fbk.aaer.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.annotation.Nullable;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import eu.fbk.aaer.PositionedChar;

/**
 * Extracts the characters of a PDF document, in reading order, with their page and bold flag.
 * Word and line separators inserted by the text extraction are emitted as non-bold whitespace;
 * a newline closes every page.
 */
public final class PdfChars {

    private PdfChars() {
    }

    public static List<PositionedChar> extract(final Path path) throws IOException {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            return extract(document);
        }
    }

    public static List<PositionedChar> extract(final byte[] bytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            return extract(document);
        }
    }

    public static List<PositionedChar> extract(final PDDocument document) throws IOException {
        final Stripper stripper = new Stripper();
        stripper.setSortByPosition(true);
        stripper.getText(document);
        return stripper.chars;
    }

    // Bold is decided by the font name alone
    static boolean isBold(@Nullable final PDFont font) {
        if (font == null) {
            return false;
        }
        final String name = font.getName();
        return name != null && name.toLowerCase(Locale.ROOT).contains("bold");
    }

    private static final class Stripper extends PDFTextStripper {

        final List<PositionedChar> chars = new ArrayList<>();

        private int page;

        private int offset;

        @Override
        protected void startPage(final PDPage page) throws IOException {
            this.page = getCurrentPageNo() - 1;
        }

        @Override
        protected void endPage(final PDPage page) throws IOException {
            emit("\n", false);
        }

        @Override
        protected void writeString(final String text, final List<TextPosition> positions)
                throws IOException {
            for (final TextPosition position : positions) {
                final boolean bold = isBold(position.getFont());
                final String unicode = position.getUnicode();
                if (unicode == null) {
                    continue;
                }
                for (int i = 0; i < unicode.length(); ++i) {
                    emit(String.valueOf(unicode.charAt(i)), bold);
                }
            }
        }

        @Override
        protected void writeWordSeparator() throws IOException {
            emit(getWordSeparator(), false);
        }

        @Override
        protected void writeLineSeparator() throws IOException {
            emit(getLineSeparator(), false);
        }

        private void emit(final String text, final boolean bold) {
            for (int i = 0; i < text.length(); ++i) {
                this.chars.add(PositionedChar.create(String.valueOf(text.charAt(i)), bold,
                        this.page, this.offset++));
            }
        }

    }

}
