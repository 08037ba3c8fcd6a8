package eu.fbk.aaer;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableSet;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AAERMinerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaultProperties() throws IOException {
        final Properties properties = AAERMiner.loadProperties(null);
        Assert.assertEquals("docs/pdf", properties.getProperty("aaer.docs.pdf"));
        Assert.assertEquals("21c", properties.getProperty("aaer.segmenter.riskmarker"));
        Assert.assertEquals(Lexicon.DEFAULT_MONTHS, Lexicon.create(properties, "aaer.lexicon")
                .getMonths());
        Assert.assertTrue(BoldSpanIndexer.create(properties, "aaer.indexer").index(
                Docs.builder().bold("XXX").plain(" ").build()).getIndex().contains("xxx."));
    }

    @Test
    public void testPropertiesOverride() throws IOException {
        final Path path = this.folder.getRoot().toPath().resolve("aaer.properties");
        Files.write(path, "aaer.results = out\n".getBytes(StandardCharsets.UTF_8));
        final Properties properties = AAERMiner.loadProperties(path);
        Assert.assertEquals("out", properties.getProperty("aaer.results"));
        Assert.assertEquals("docs/naf", properties.getProperty("aaer.docs.naf"));
    }

    @Test
    public void testIdOf() {
        final Path dir = this.folder.getRoot().toPath();
        Assert.assertEquals("aaer-1", AAERMiner.idOf(dir.resolve("aaer-1.PDF"),
                AAERMiner.PDF_PATTERN));
        Assert.assertEquals("aaer-2", AAERMiner.idOf(dir.resolve("aaer-2.txt.naf.gz"),
                AAERMiner.NAF_PATTERN));
        Assert.assertEquals("aaer-3", AAERMiner.idOf(dir.resolve("aaer-3.naf"),
                AAERMiner.NAF_PATTERN));
    }

    @Test
    public void testWriteInterval() throws IOException {
        final StringWriter writer = new StringWriter();
        AAERMiner.writeInterval(writer, "a",
                Interval.create(2015, 3, 2016, 12, 4, Interval.Precision.MONTH));
        AAERMiner.writeInterval(writer, "b", Interval.EMPTY);
        Assert.assertEquals("a\t2015\t3\t2016\t12\t4\tmonth\nb\t\t\t\t\t0\tnone\n",
                writer.toString());
    }

    @Test
    public void testFailingFileDoesNotStopOthers() throws IOException {
        final Path dir = this.folder.getRoot().toPath();
        for (final String name : new String[] { "a.pdf", "b.pdf", "c.pdf", "notes.txt" }) {
            Files.write(dir.resolve(name), new byte[0]);
        }
        final Set<String> processed = ConcurrentHashMap.newKeySet();
        final long failed = AAERMiner.forEachFile(dir, AAERMiner.PDF_PATTERN,
                (final Path path) -> {
                    if (path.endsWith("b.pdf")) {
                        throw new IllegalStateException("malformed");
                    }
                    processed.add(path.getFileName().toString());
                });
        Assert.assertEquals(1L, failed);
        Assert.assertEquals(ImmutableSet.of("a.pdf", "c.pdf"), processed);
    }

    @Test(expected = UncheckedIOException.class)
    public void testOutputFailureAborts() throws IOException {
        final Path dir = this.folder.getRoot().toPath();
        Files.write(dir.resolve("a.pdf"), new byte[0]);
        AAERMiner.forEachFile(dir, AAERMiner.PDF_PATTERN, (final Path path) -> {
            throw new UncheckedIOException(new IOException("disk full"));
        });
    }

    @Test
    public void testSegmentAndInfer() throws IOException {
        final Path root = this.folder.getRoot().toPath();
        final Path pdfDir = Files.createDirectories(root.resolve("docs/pdf"));
        final Path nafDir = Files.createDirectories(root.resolve("docs/naf"));
        writeRelease(pdfDir.resolve("aaer-1.pdf"));
        Files.write(pdfDir.resolve("broken.pdf"), "not a pdf".getBytes(StandardCharsets.UTF_8));
        try (InputStream in = AAERMinerTest.class.getResourceAsStream("naf/summary.naf")) {
            Files.copy(in, nafDir.resolve("aaer-1.naf"), StandardCopyOption.REPLACE_EXISTING);
        }

        final AAERMiner miner = new AAERMiner(root, AAERMiner.loadProperties(null), "aaer");
        miner.segment();
        miner.infer();

        final List<String> segments = Files.readAllLines(root.resolve("results/segments.tsv"),
                StandardCharsets.UTF_8);
        Assert.assertEquals(2, segments.size());
        Assert.assertEquals(String.join("\t", AAERMiner.SEGMENTS_HEADER), segments.get(0));
        final String[] row = segments.get(1).split("\t", -1);
        Assert.assertEquals("aaer-1", row[0]);
        Assert.assertEquals("Acme Corp.", row[1]);
        Assert.assertEquals("false", row[6]);
        Assert.assertEquals("true", row[7]);

        final String summary = new String(
                Files.readAllBytes(root.resolve("docs/summaries/aaer-1.txt")),
                StandardCharsets.UTF_8);
        Assert.assertTrue(summary.startsWith("SUMMARY"));
        Assert.assertTrue(summary.contains("misstated"));
        Assert.assertFalse(summary.contains("Ohio"));

        final List<String> intervals = Files.readAllLines(
                root.resolve("results/intervals.tsv"), StandardCharsets.UTF_8);
        Assert.assertEquals(2, intervals.size());
        Assert.assertEquals("aaer-1\t2016\t1\t2016\t1\t1\tmonth", intervals.get(1));
    }

    private static void writeRelease(final Path path) throws IOException {
        final PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        final PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        final String[][] lines = { { "IN THE MATTER OF", "Acme Corp., Respondent." },
                { "", "Proceedings pursuant to Section 21C of the Exchange Act." },
                { "SUMMARY", "Acme misstated its revenues." },
                { "RESPONDENT", "Acme is based in Ohio." }, { "I.", "Findings." } };
        try (PDDocument document = new PDDocument()) {
            final PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.newLineAtOffset(72, 700);
                for (final String[] line : lines) {
                    if (!line[0].isEmpty()) {
                        stream.setFont(bold, 12);
                        stream.showText(line[0] + " ");
                    }
                    stream.setFont(regular, 12);
                    stream.showText(line[1]);
                    stream.newLineAtOffset(0, -20);
                }
                stream.endText();
            }
            document.save(path.toFile());
        }
    }

}
