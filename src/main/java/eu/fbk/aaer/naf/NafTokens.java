package eu.fbk.aaer.naf;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.aaer.TokenSequence;

import ixa.kaflib.Dep;
import ixa.kaflib.KAFDocument;
import ixa.kaflib.Term;

/**
 * Converts the term and dependency layers of NAF documents, as produced by an external NLP
 * pipeline, into {@link TokenSequence}s. Each NAF term becomes a token; each dependency links
 * its {@code from} term (the head) to its {@code to} term (the dependent).
 */
public final class NafTokens {

    private static final Logger LOGGER = LoggerFactory.getLogger(NafTokens.class);

    private NafTokens() {
    }

    /**
     * Reads a NAF file, possibly gzipped (extension {@code .gz}).
     *
     * @param path
     *            the NAF file
     * @return the tokens of the document
     * @throws IOException
     *             on failure to read the file or if it is not a valid NAF document
     */
    public static TokenSequence read(final Path path) throws IOException {
        try (InputStream stream = Files.newInputStream(path)) {
            final InputStream in = path.getFileName().toString().endsWith(".gz")
                    ? new GZIPInputStream(stream) : stream;
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    public static TokenSequence read(final Reader reader) throws IOException {
        final KAFDocument document;
        try {
            document = KAFDocument.createFromStream(reader);
        } catch (final IOException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new IOException("Invalid NAF document", ex);
        }
        return convert(document);
    }

    public static TokenSequence convert(final KAFDocument document) {

        final TokenSequence.Builder builder = TokenSequence.builder();
        final Map<String, Integer> indexes = new HashMap<>();
        for (final Term term : document.getTerms()) {
            final int index = builder.addToken(term.getStr(), term.getLemma());
            indexes.put(term.getId(), index);
        }

        for (final Dep dep : document.getDeps()) {
            final Integer head = indexes.get(dep.getFrom().getId());
            final Integer dependent = indexes.get(dep.getTo().getId());
            if (head == null || dependent == null || head.equals(dependent)) {
                LOGGER.debug("Skipping dependency {} -> {}", dep.getFrom().getId(),
                        dep.getTo().getId());
                continue;
            }
            builder.addDependency(head, dependent, dep.getRfunc());
        }

        return builder.build();
    }

}
