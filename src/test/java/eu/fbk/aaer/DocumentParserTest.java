package eu.fbk.aaer;

import org.junit.Assert;
import org.junit.Test;

public class DocumentParserTest {

    // "restated revenues for fiscal years 2015 and 2016, and the first quarter of 2017"
    private static TokenSequence sentence() {
        final TokenSequence.Builder builder = TokenSequence.builder();
        final int restated = builder.addToken("restated", "restate");
        final int revenues = builder.addToken("revenues", "revenue");
        final int forPrep = builder.addToken("for", null);
        final int fiscal = builder.addToken("fiscal", null);
        final int years = builder.addToken("years", "year");
        final int y2015 = builder.addToken("2015", null);
        final int and = builder.addToken("and", null);
        final int y2016 = builder.addToken("2016", null);
        final int the = builder.addToken("the", null);
        final int first = builder.addToken("first", null);
        final int quarter = builder.addToken("quarter", null);
        final int of = builder.addToken("of", null);
        final int y2017 = builder.addToken("2017", null);
        builder.addDependency(restated, revenues, "dobj")
                .addDependency(restated, forPrep, "prep").addDependency(forPrep, years, "pobj")
                .addDependency(years, fiscal, "amod").addDependency(years, y2015, "nummod")
                .addDependency(y2015, and, "cc").addDependency(y2015, y2016, "conj")
                .addDependency(restated, quarter, "conj").addDependency(quarter, the, "det")
                .addDependency(quarter, first, "amod").addDependency(quarter, of, "prep")
                .addDependency(of, y2017, "pobj");
        return builder.build();
    }

    @Test
    public void testInferInterval() {
        final DocumentParser parser = DocumentParser.create(Lexicon.DEFAULT);
        final TemporalMentions mentions = parser.extract(sentence());
        // "years" is no fiscal marker: only the object of "of" is a year
        Assert.assertEquals(1, mentions.getYears().size());
        Assert.assertEquals(Integer.valueOf(2017), mentions.getYears().get(0));

        final Interval interval = parser.inferInterval(sentence());
        Assert.assertEquals(Interval.create(2017, 1, 2017, 1, 1, Interval.Precision.MONTH),
                interval);
    }

    @Test
    public void testParse() {
        final DependencyParser dependencyParser = (final String text) -> {
            Assert.assertEquals("restated 2015", text);
            final TokenSequence.Builder builder = TokenSequence.builder();
            builder.addToken("restated", "restate");
            builder.addToken("2015", null);
            builder.addDependency(0, 1, "nummod");
            return builder.build();
        };
        final DocumentParser parser = DocumentParser.create(Lexicon.DEFAULT, dependencyParser);
        Assert.assertEquals(Interval.create(2015, 1, 2015, 12, 1, Interval.Precision.YEAR),
                parser.parse("restated 2015"));
    }

    @Test(expected = IllegalStateException.class)
    public void testParseWithoutParser() {
        DocumentParser.create(Lexicon.DEFAULT).parse("restated 2015");
    }

    @Test
    public void testNoMentions() {
        final TokenSequence.Builder builder = TokenSequence.builder();
        builder.addToken("nothing", null);
        Assert.assertTrue(DocumentParser.create(Lexicon.DEFAULT).inferInterval(builder.build())
                .isEmpty());
    }

}
