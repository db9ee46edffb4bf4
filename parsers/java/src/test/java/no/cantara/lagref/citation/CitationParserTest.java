package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentType;
import no.cantara.lagref.model.ProvisionRef;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CitationParserTest {

    // -----------------------------------------------------------------------
    // Statutes
    // -----------------------------------------------------------------------

    @Test
    void parsesDocumentLevelStatute() {
        ParsedCitation c = CitationParser.parse("SFS 2018:218");

        assertTrue(c.valid());
        assertEquals(DocumentType.STATUTE, c.type());
        assertEquals("2018:218", c.documentId());
        assertTrue(c.chapter().isEmpty());
        assertTrue(c.section().isEmpty());
        assertTrue(c.provisionRef().isEmpty());
        assertTrue(c.error().isEmpty());
    }

    @Test
    void parsesChapterAndSection() {
        ParsedCitation c = CitationParser.parse("SFS 2018:218 3 kap. 5 §");

        assertEquals("2018:218", c.documentId());
        assertEquals(Optional.of("3"), c.chapter());
        assertEquals(Optional.of("5"), c.section());
        assertEquals(Optional.of(ProvisionRef.of("3", "5")), c.provisionRef());
    }

    @Test
    void parsesShortForm() {
        ParsedCitation c = CitationParser.parse("2018:218 3:5");

        assertTrue(c.valid());
        assertEquals("2018:218", c.documentId());
        assertEquals(Optional.of("3"), c.chapter());
        assertEquals(Optional.of("5"), c.section());
    }

    @Test
    void parsesFlatSectionWithLetter() {
        ParsedCitation c = CitationParser.parse("2018:218 5 a §");

        assertTrue(c.chapter().isEmpty());
        assertEquals(Optional.of("5 a"), c.section());
        assertEquals("5 a", c.provisionRef().orElseThrow().key());
    }

    @Test
    void lowerCasesSectionLetter() {
        assertEquals(Optional.of("5 a"), CitationParser.parse("SFS 2018:218 5 A §").section());
    }

    @Test
    void parsesChapterOnly() {
        ParsedCitation c = CitationParser.parse("SFS 2018:218 3 kap.");

        assertEquals(Optional.of("3"), c.chapter());
        assertTrue(c.section().isEmpty());
        assertTrue(c.provisionRef().isEmpty());
    }

    @Test
    void parsesProvisionFirstForm() {
        ParsedCitation c = CitationParser.parse("3 kap. 5 § lag (2018:218)");

        assertTrue(c.valid());
        assertEquals(DocumentType.STATUTE, c.type());
        assertEquals("2018:218", c.documentId());
        assertEquals(Optional.of("3"), c.chapter());
        assertEquals(Optional.of("5"), c.section());

        ParsedCitation flat = CitationParser.parse("5 § dataskyddslagen (2018:218)");
        assertTrue(flat.chapter().isEmpty());
        assertEquals(Optional.of("5"), flat.section());
    }

    @Test
    void prefixIsCaseInsensitive() {
        assertTrue(CitationParser.parse("sfs 2018:218").valid());
    }

    @Test
    void keepsRawInput() {
        assertEquals("  SFS 2018:218 ", CitationParser.parse("  SFS 2018:218 ").raw());
    }

    // -----------------------------------------------------------------------
    // Preparatory works and case law
    // -----------------------------------------------------------------------

    @Test
    void parsesBill() {
        ParsedCitation c = CitationParser.parse("Prop. 2017/18:105");

        assertEquals(DocumentType.BILL, c.type());
        assertEquals("2017/18:105", c.documentId());
    }

    @Test
    void parsesSouAndDs() {
        ParsedCitation sou = CitationParser.parse("SOU 2023:45");
        assertEquals(DocumentType.SOU, sou.type());
        assertEquals("2023:45", sou.documentId());

        ParsedCitation ds = CitationParser.parse("Ds 2022:10");
        assertEquals(DocumentType.DS, ds.type());
        assertEquals("2022:10", ds.documentId());
    }

    @Test
    void parsesSupremeCourtReport() {
        ParsedCitation c = CitationParser.parse("NJA 2020 s. 45");

        assertEquals(DocumentType.CASE_LAW, c.type());
        assertEquals("NJA 2020", c.documentId());
        assertEquals(Optional.of("45"), c.page());
    }

    @Test
    void parsesAdministrativeAndSpecialCourts() {
        ParsedCitation hfd = CitationParser.parse("HFD 2019 ref. 12");
        assertEquals("HFD 2019", hfd.documentId());
        assertEquals(Optional.of("12"), hfd.page());

        ParsedCitation ad = CitationParser.parse("AD 2020 nr 5");
        assertEquals("AD 2020", ad.documentId());
        assertEquals(Optional.of("5"), ad.page());

        ParsedCitation mig = CitationParser.parse("MIG 2019 ref. 3");
        assertEquals("MIG 2019", mig.documentId());
        assertEquals(Optional.of("3"), mig.page());
    }

    // -----------------------------------------------------------------------
    // Failures
    // -----------------------------------------------------------------------

    @Test
    void emptyInputIsInvalid() {
        ParsedCitation c = CitationParser.parse("   ");

        assertFalse(c.valid());
        assertEquals(Optional.of("Empty citation"), c.error());
    }

    @Test
    void unrecognisedInputIsInvalid() {
        ParsedCitation c = CitationParser.parse("Brottsbalken");

        assertFalse(c.valid());
        assertEquals(Optional.of("Unrecognized citation format: \"Brottsbalken\""), c.error());
        assertEquals("", c.documentId());
    }

    @Test
    void nullInputIsRejected() {
        assertThrows(NullPointerException.class, () -> CitationParser.parse(null));
    }

    // -----------------------------------------------------------------------
    // Type detection
    // -----------------------------------------------------------------------

    @Test
    void detectsDocumentType() {
        assertEquals(Optional.of(DocumentType.BILL), CitationParser.detectDocumentType("Prop. 2017/18:105"));
        assertEquals(Optional.of(DocumentType.SOU), CitationParser.detectDocumentType("SOU 2023:45"));
        assertEquals(Optional.of(DocumentType.DS), CitationParser.detectDocumentType("Ds 2022:10"));
        assertEquals(Optional.of(DocumentType.CASE_LAW), CitationParser.detectDocumentType("NJA 2020 s. 45"));
        assertEquals(Optional.of(DocumentType.CASE_LAW), CitationParser.detectDocumentType("MIG 2019 ref. 3"));
        assertEquals(Optional.of(DocumentType.STATUTE), CitationParser.detectDocumentType("SFS 2018:218"));
        assertEquals(Optional.of(DocumentType.STATUTE), CitationParser.detectDocumentType("2018:218 3:5"));
        assertEquals(Optional.of(DocumentType.STATUTE), CitationParser.detectDocumentType("3 kap. 5 § lag (2018:218)"));
        assertTrue(CitationParser.detectDocumentType("Brottsbalken").isEmpty());
        assertTrue(CitationParser.detectDocumentType(null).isEmpty());
    }
}
