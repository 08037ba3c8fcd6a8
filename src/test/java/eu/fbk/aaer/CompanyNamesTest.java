package eu.fbk.aaer;

import org.junit.Assert;
import org.junit.Test;

public class CompanyNamesTest {

    @Test
    public void testSingleCompany() {
        Assert.assertEquals("Widget Corp.",
                CompanyNames.fromSection("In the Matter of\nWidget Corp.\nRespondent."));
        Assert.assertEquals("ACME LLP", CompanyNames
                .fromSection("ADMINISTRATIVE PROCEEDING IN THE MATTER OF ACME LLP, RESPONDENT"));
    }

    @Test
    public void testSeveralRespondents() {
        Assert.assertEquals("Widget LLC", CompanyNames
                .fromSection("In the Matter of John Doe and Widget LLC, Respondents."));
    }

    @Test
    public void testNoCompany() {
        Assert.assertNull(CompanyNames.fromSection("In the Matter of John Doe, Respondent."));
    }

    @Test
    public void testMissingTitle() {
        try {
            CompanyNames.fromSection("Order instituting proceedings against Widget Corp.");
            Assert.fail();
        } catch (final SequenceNotFoundException ex) {
            Assert.assertEquals(CompanyNames.TITLE_START, ex.getSequence());
        }
        try {
            CompanyNames.fromSection("In the Matter of Widget Corp.");
            Assert.fail();
        } catch (final SequenceNotFoundException ex) {
            Assert.assertEquals(CompanyNames.TITLE_END, ex.getSequence());
        }
    }

}
