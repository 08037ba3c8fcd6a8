package eu.fbk.aaer;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

public class BoldSpanIndexerTest {

    @Test
    public void testWordsAndOffsets() {
        final List<PositionedChar> chars = Docs.builder().bold("IN THE MATTER OF")
                .plain(" Acme Corp. ").bold("SUMMARY").plain(" text").build();
        final IndexedText indexed = BoldSpanIndexer.create().index(chars);

        Assert.assertEquals("IN THE MATTER OF Acme Corp. SUMMARY text", indexed.getText());
        Assert.assertEquals(ImmutableList.of(0), indexed.getIndex().getOffsets("in"));
        Assert.assertEquals(ImmutableList.of(3), indexed.getIndex().getOffsets("the"));
        Assert.assertEquals(ImmutableList.of(7), indexed.getIndex().getOffsets("matter"));
        Assert.assertEquals(ImmutableList.of(14), indexed.getIndex().getOffsets("of"));
        Assert.assertEquals(ImmutableList.of(28), indexed.getIndex().getOffsets("summary"));
        Assert.assertFalse(indexed.getIndex().contains("acme"));
        Assert.assertFalse(indexed.getIndex().contains("text"));
    }

    @Test
    public void testOffsetsPointToWords() {
        final IndexedText indexed = BoldSpanIndexer.create()
                .index(Docs.release("Acme Holdings, Inc.", "Section 21C proceedings."));
        final String text = indexed.getText();
        for (final Map.Entry<String, Integer> entry : indexed.getIndex().asMultimap()
                .entries()) {
            final String word = entry.getKey();
            final int offset = entry.getValue();
            Assert.assertTrue(offset >= 0 && offset + word.length() <= text.length());
            Assert.assertEquals(word,
                    text.substring(offset, offset + word.length()).toLowerCase());
        }
    }

    @Test
    public void testIdempotent() {
        final List<PositionedChar> chars = Docs.release("Acme LLC", "Body.");
        final BoldSpanIndexer indexer = BoldSpanIndexer.create();
        Assert.assertEquals(indexer.index(chars), indexer.index(chars));
    }

    @Test
    public void testNumerals() {
        final List<PositionedChar> chars = Docs.builder().bold("I.").plain(" Facts ")
                .bold("IV").plain(" more ").bold("IXX").plain(" end ").bold("Summary")
                .plain(" x").build();
        final BoldSpanIndex index = BoldSpanIndexer.create().index(chars).getIndex();

        Assert.assertEquals(ImmutableList.of(0), index.getOffsets("i."));
        Assert.assertTrue(index.contains("iv."));
        Assert.assertFalse(index.contains("iv"));
        // Not a numeral of the configured list: no period appended
        Assert.assertTrue(index.contains("ixx"));
        Assert.assertFalse(index.contains("ixx."));
        Assert.assertTrue(index.contains("summary"));
    }

    @Test
    public void testBreakCharacters() {
        final List<PositionedChar> chars = Docs.builder().bold("Respondent's 2015,Summary\"X")
                .plain(" ").build();
        final BoldSpanIndex index = BoldSpanIndexer.create().index(chars).getIndex();

        Assert.assertEquals(ImmutableList.of(0), index.getOffsets("respondent"));
        Assert.assertEquals(ImmutableList.of(11), index.getOffsets("s"));
        Assert.assertEquals(ImmutableList.of(18), index.getOffsets("summary"));
        // x is also a section numeral
        Assert.assertEquals(ImmutableList.of(26), index.getOffsets("x."));
        Assert.assertTrue(index.getOffsets("x").isEmpty());
    }

    @Test
    public void testPageResetsPendingWord() {
        final List<PositionedChar> chars = Docs.builder().bold("SUM").newPage().bold("MARY")
                .plain(" rest").build();
        final IndexedText indexed = BoldSpanIndexer.create().index(chars);

        Assert.assertFalse(indexed.getIndex().contains("summary"));
        Assert.assertFalse(indexed.getIndex().contains("sum"));
        Assert.assertEquals(ImmutableList.of(3), indexed.getIndex().getOffsets("mary"));
    }

    @Test
    public void testPendingWordAtEndIsDropped() {
        final BoldSpanIndex index = BoldSpanIndexer.create()
                .index(Docs.builder().plain("text ").bold("TAIL").build()).getIndex();
        Assert.assertTrue(index.isEmpty());
    }

    @Test
    public void testProperties() {
        final Properties properties = new Properties();
        properties.setProperty("aaer.indexer.numerals", "A, B");
        final BoldSpanIndex index = BoldSpanIndexer.create(properties, "aaer.indexer")
                .index(Docs.builder().bold("A I").plain(" ").build()).getIndex();
        Assert.assertTrue(index.contains("a."));
        Assert.assertTrue(index.contains("i"));
    }

}
