package eu.fbk.aaer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.io.MoreFiles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.aaer.naf.NafTokens;
import eu.fbk.aaer.pdf.PdfChars;
import eu.fbk.aaer.util.CommandLine;
import eu.fbk.aaer.util.Tsv;

public class AAERMiner {

    private static final Logger LOGGER = LoggerFactory.getLogger(AAERMiner.class);

    static final String DEFAULT_PROPERTIES = "aaer-default.properties";

    static final Pattern PDF_PATTERN = Pattern.compile("\\.pdf$", Pattern.CASE_INSENSITIVE);

    static final Pattern NAF_PATTERN = Pattern.compile("\\.(txt\\.)?naf(\\.gz)?$");

    static final List<String> SEGMENTS_HEADER = ImmutableList.of("id", "company",
            "section_start", "section_end", "summary_start", "summary_end", "summary_degraded",
            "risk_marker");

    static final List<String> INTERVALS_HEADER = ImmutableList.of("id", "year_start",
            "month_start", "year_end", "month_end", "mentions", "precision");

    private final Path pathDocsPdf;

    private final Path pathDocsSummaries;

    private final Path pathDocsNaf;

    private final Path pathResults;

    private final BoldSpanIndexer indexer;

    private final DocumentSegmenter segmenter;

    private final DocumentParser parser;

    public static void main(final String... args) {

        try {
            // Parse command line
            final CommandLine cmd = CommandLine.parser().withName("aaer-miner")
                    .withOption("p", "properties", "specifies the configuration properties file",
                            "PATH", CommandLine.Type.FILE_EXISTING, true, false, false)
                    .withOption("s", "segment",
                            "extracts section and summary from the PDF documents")
                    .withOption("i", "infer",
                            "infers the misreporting period from the parsed (NAF) summaries")
                    .withHeader("mines accounting enforcement releases: locates the summary "
                            + "of each document and infers the period it is about")
                    .parse(args);

            // Extract options
            final Path propertiesPath = Paths.get(cmd.getOptionValue("p", String.class,
                    System.getProperty("user.dir") + "/aaer.properties"));
            boolean segment = cmd.hasOption("s");
            boolean infer = cmd.hasOption("i");

            // Abort if properties file does not exist
            if (!Files.exists(propertiesPath)) {
                throw new CommandLine.Exception(
                        "Properties file '" + propertiesPath + "' does not exist");
            }

            // Read properties, on top of the bundled defaults
            final long ts = System.currentTimeMillis();
            final Properties properties = loadProperties(propertiesPath);

            // Force certain actions if specified in properties file
            final String pr = "aaer.forcecmd.";
            segment |= Boolean.parseBoolean(properties.getProperty(pr + "segment", "false"));
            infer |= Boolean.parseBoolean(properties.getProperty(pr + "infer", "false"));

            // Initialize the main object
            final Path root = propertiesPath.toAbsolutePath().getParent();
            final AAERMiner miner = new AAERMiner(root, properties, "aaer.");
            LOGGER.info("Initialized in {} ms", System.currentTimeMillis() - ts);

            // Perform the requested operations
            if (segment) {
                miner.segment();
            }
            if (infer) {
                miner.infer();
            }
            if (!segment && !infer) {
                LOGGER.warn("No operation requested (use -s and/or -i)");
            }

        } catch (final Throwable ex) {
            // Display error information and terminate
            CommandLine.fail(ex);
        }
    }

    static Properties loadProperties(@Nullable final Path path) throws IOException {
        final Properties defaults = new Properties();
        try (InputStream stream = AAERMiner.class
                .getResourceAsStream("/" + DEFAULT_PROPERTIES)) {
            if (stream == null) {
                throw new IOException("Missing resource " + DEFAULT_PROPERTIES);
            }
            defaults.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
        }
        final Properties properties = new Properties(defaults);
        if (path != null) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        }
        return properties;
    }

    public AAERMiner(final Path root, final Properties properties, final String prefix) {

        // Normalize prefix, ensuring it ends with '.'
        final String pr = prefix.endsWith(".") ? prefix : prefix + ".";

        // Retrieve paths
        this.pathDocsPdf = root.resolve(properties.getProperty(pr + "docs.pdf", "docs/pdf"));
        this.pathDocsSummaries = root.resolve(properties.getProperty( //
                pr + "docs.summaries", "docs/summaries"));
        this.pathDocsNaf = root.resolve(properties.getProperty(pr + "docs.naf", "docs/naf"));
        this.pathResults = root.resolve(properties.getProperty(pr + "results", "results"));

        // Build the components
        this.indexer = BoldSpanIndexer.create(properties, pr + "indexer.");
        this.segmenter = DocumentSegmenter.create(properties, pr + "segmenter.");
        this.parser = DocumentParser.create(Lexicon.create(properties, pr + "lexicon."));

        // Report configuration
        LOGGER.info("Using indexer: {}", this.indexer);
        LOGGER.info("Using segmenter: {}", this.segmenter);
        LOGGER.info("Using parser: {}", this.parser);
    }

    /**
     * Segments all the PDF documents, writing their summaries (one text file per document) and
     * a {@code segments.tsv} table with the located regions. Documents that cannot be
     * segmented are reported and skipped.
     *
     * @throws IOException
     *             on failure to write the results
     */
    public void segment() throws IOException {

        final long ts = System.currentTimeMillis();
        final AtomicLong succeeded = new AtomicLong(0L);
        final AtomicLong failed = new AtomicLong(0L);

        LOGGER.info("=== Segmenting documents ===");

        initDir(this.pathDocsSummaries);
        Files.createDirectories(this.pathResults);
        final Path tsvPath = this.pathResults.resolve("segments.tsv");

        try (Writer writer = Files.newBufferedWriter(tsvPath, StandardCharsets.UTF_8)) {
            Tsv.writeRow(writer, SEGMENTS_HEADER.toArray());
            final long crashed = forEachFile(this.pathDocsPdf, PDF_PATTERN, (final Path path) -> {
                final String id = idOf(path, PDF_PATTERN);
                try {
                    final IndexedText text = this.indexer.index(PdfChars.extract(path));
                    final Segmentation segmentation = this.segmenter.segmentDocument(text);
                    final TextSpan section = segmentation.getSection();
                    final TextSpan summary = segmentation.getSummary();
                    if (summary.isDegraded()) {
                        LOGGER.warn("Summary of {} located before the section; using the rest "
                                + "of the document", id);
                    }
                    final String company = guessCompany(id, section);
                    Files.write(this.pathDocsSummaries.resolve(id + ".txt"),
                            summary.getText().getBytes(StandardCharsets.UTF_8));
                    synchronized (writer) {
                        Tsv.writeRow(writer, id, company, section.getStartOffset(),
                                section.getEndOffset(), summary.getStartOffset(),
                                summary.getEndOffset(), summary.isDegraded(),
                                segmentation.containsRiskMarker());
                    }
                    succeeded.incrementAndGet();
                    LOGGER.debug("Segmented {}: {}", id, segmentation);
                } catch (final SegmentationException | IOException ex) {
                    failed.incrementAndGet();
                    LOGGER.warn("Could not segment {}: {}", path, ex.getMessage());
                }
            });
            failed.addAndGet(crashed);
        }

        LOGGER.info("{} documents segmented, {} failed, in {} ms", succeeded, failed,
                System.currentTimeMillis() - ts);
    }

    /**
     * Infers the interval described by each parsed summary, writing them to an
     * {@code intervals.tsv} table. Documents without usable temporal mentions are reported
     * with empty bounds.
     *
     * @throws IOException
     *             on failure to write the results
     */
    public void infer() throws IOException {

        final long ts = System.currentTimeMillis();
        final AtomicLong inferred = new AtomicLong(0L);
        final AtomicLong empty = new AtomicLong(0L);
        final AtomicLong failed = new AtomicLong(0L);

        LOGGER.info("=== Inferring intervals ===");

        Files.createDirectories(this.pathResults);
        final Path tsvPath = this.pathResults.resolve("intervals.tsv");

        try (Writer writer = Files.newBufferedWriter(tsvPath, StandardCharsets.UTF_8)) {
            Tsv.writeRow(writer, INTERVALS_HEADER.toArray());
            final long crashed = forEachFile(this.pathDocsNaf, NAF_PATTERN, (final Path path) -> {
                final String id = idOf(path, NAF_PATTERN);
                final Interval interval;
                try {
                    interval = this.parser.inferInterval(NafTokens.read(path));
                } catch (final IOException ex) {
                    failed.incrementAndGet();
                    LOGGER.warn("Could not read {}: {}", path, ex.getMessage());
                    return;
                }
                try {
                    synchronized (writer) {
                        writeInterval(writer, id, interval);
                    }
                } catch (final IOException ex) {
                    throw new UncheckedIOException("Could not write " + tsvPath, ex);
                }
                if (interval.isEmpty()) {
                    empty.incrementAndGet();
                    LOGGER.warn("No temporal mention found in {}", id);
                } else {
                    inferred.incrementAndGet();
                    LOGGER.debug("Inferred {} for {}", interval, id);
                }
            });
            failed.addAndGet(crashed);
        }

        LOGGER.info("{} intervals inferred, {} documents without mentions, {} failed, in {} ms",
                inferred, empty, failed, System.currentTimeMillis() - ts);
    }

    static void writeInterval(final Writer writer, final String id, final Interval interval)
            throws IOException {
        if (interval.isEmpty()) {
            Tsv.writeRow(writer, id, null, null, null, null, 0,
                    interval.getPrecision().name().toLowerCase(Locale.ROOT));
        } else {
            Tsv.writeRow(writer, id, interval.getYearStart(), interval.getMonthStart(),
                    interval.getYearEnd(), interval.getMonthEnd(), interval.getMentions(),
                    interval.getPrecision().name().toLowerCase(Locale.ROOT));
        }
    }

    @Nullable
    private static String guessCompany(final String id, final TextSpan section) {
        try {
            final String company = CompanyNames.fromSection(section.getText());
            if (company == null) {
                LOGGER.debug("No company indicator in the title of {}", id);
            }
            return company;
        } catch (final SequenceNotFoundException ex) {
            LOGGER.warn("Could not find the title of {}: {}", id, ex.getMessage());
            return null;
        }
    }

    static String idOf(final Path path, final Pattern pattern) {
        final String name = path.getFileName().toString();
        final Matcher matcher = pattern.matcher(name);
        return matcher.find() ? name.substring(0, matcher.start()) : name;
    }

    /**
     * Applies the consumer to the files below the path whose names match the pattern, in
     * parallel. A runtime failure on one file is logged and counted, and the remaining files are
     * still processed; failures to write the results ({@code UncheckedIOException}) abort the
     * whole run.
     *
     * @return the number of files whose processing failed
     */
    static long forEachFile(final Path path, final Pattern pattern,
            final Consumer<Path> consumer) {

        final List<Path> files = Ordering.<Path>natural().sortedCopy(
                MoreFiles.fileTraverser().depthFirstPreOrder(path)).stream()
                .filter((final Path file) -> Files.isRegularFile(file)
                        && pattern.matcher(file.getFileName().toString()).find())
                .collect(ImmutableList.toImmutableList());

        LOGGER.info("Processing {} files", files.size());

        final AtomicLong failed = new AtomicLong(0L);
        files.parallelStream().forEach((final Path file) -> {
            try {
                consumer.accept(file);
            } catch (final UncheckedIOException ex) {
                throw ex;
            } catch (final RuntimeException ex) {
                failed.incrementAndGet();
                LOGGER.warn("Could not process " + file, ex);
            }
        });
        return failed.get();
    }

    private static void initDir(final Path path) throws IOException {
        Files.createDirectories(path);
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException exc)
                    throws IOException {
                if (!dir.equals(path)) {
                    Files.delete(dir);
                }
                return FileVisitResult.CONTINUE;
            }

        });
    }

}
