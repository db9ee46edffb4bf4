package no.cantara.lagref.statute;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AmendmentExtractorTest {

    // -----------------------------------------------------------------------
    // Amendment markers
    // -----------------------------------------------------------------------

    @Test
    void readsAmendmentSuffix() {
        List<AmendmentReference> refs = AmendmentExtractor.extract("Lagen gäller alla. Lag (2021:1174).");

        assertEquals(1, refs.size());
        AmendmentReference ref = refs.get(0);
        assertEquals("2021:1174", ref.amendedBySfs());
        assertEquals(AmendmentReference.Kind.AMENDED, ref.kind());
        assertEquals(AmendmentReference.Position.SUFFIX, ref.position());
        assertEquals("ändrad", ref.kind().label());
    }

    @Test
    void suffixIsDefinitive() {
        List<AmendmentReference> refs = AmendmentExtractor.extract(
                "Införd genom lag (2019:100). Lag (2021:1174).");

        assertEquals(1, refs.size());
        assertEquals("2021:1174", refs.get(0).amendedBySfs());
    }

    @Test
    void readsInlineMarkers() {
        List<AmendmentReference> refs = AmendmentExtractor.extract(
                "Upphävd genom lag (2020:5). Tidigare införd genom lag (2019:100). Har upphävts genom lag (2020:6)");

        assertEquals(3, refs.size());
        assertEquals(AmendmentReference.Kind.REPEALED, refs.get(0).kind());
        assertEquals("2020:5", refs.get(0).amendedBySfs());
        assertEquals(AmendmentReference.Kind.INTRODUCED, refs.get(1).kind());
        assertEquals(AmendmentReference.Kind.REPEALED, refs.get(2).kind());
        assertEquals("2020:6", refs.get(2).amendedBySfs());
        assertTrue(refs.stream().allMatch(r -> r.position() == AmendmentReference.Position.INLINE));
    }

    @Test
    void entryIntoForceAddsUnseenNumbers() {
        List<AmendmentReference> refs = AmendmentExtractor.extract(
                "Införd genom lag (2019:100). Ändringarna i lag (2021:200) träder i kraft den 1 juli 2021.");

        assertEquals(2, refs.size());
        assertEquals(AmendmentReference.Kind.INTRODUCED, refs.get(0).kind());
        assertEquals("2021:200", refs.get(1).amendedBySfs());
        assertEquals(AmendmentReference.Kind.ENTRY_INTO_FORCE, refs.get(1).kind());
        assertEquals(AmendmentReference.Position.TRANSITION, refs.get(1).position());
    }

    @Test
    void numbersWithoutEntryIntoForceAreNotAmendments() {
        assertTrue(AmendmentExtractor.extract("Se offentlighets- och sekretesslagen (2009:400).").isEmpty());
    }

    // -----------------------------------------------------------------------
    // Effective date
    // -----------------------------------------------------------------------

    @Test
    void readsSwedishEffectiveDate() {
        assertEquals(Optional.of(LocalDate.of(2021, 7, 1)),
                AmendmentExtractor.extractEffectiveDate("Denna lag träder i kraft den 1 juli 2021."));
        assertEquals(Optional.of(LocalDate.of(2018, 5, 25)),
                AmendmentExtractor.extractEffectiveDate("Lagen Träder i kraft den 25 Maj 2018."));
    }

    @Test
    void fallsBackToIsoDate() {
        assertEquals(Optional.of(LocalDate.of(2020, 1, 1)),
                AmendmentExtractor.extractEffectiveDate("Ikraftträdande 2020-01-01."));
    }

    @Test
    void impossibleDateIsAbsent() {
        assertTrue(AmendmentExtractor.extractEffectiveDate("träder i kraft den 31 februari 2021").isEmpty());
        assertTrue(AmendmentExtractor.extractEffectiveDate("träder i kraft den 1 smörjul 2021").isEmpty());
        assertTrue(AmendmentExtractor.extractEffectiveDate(null).isEmpty());
    }

    // -----------------------------------------------------------------------
    // SFS numbers
    // -----------------------------------------------------------------------

    @Test
    void validatesSfsNumbers() {
        assertTrue(SfsNumbers.isValid("2018:218"));
        assertFalse(SfsNumbers.isValid("SFS 2018:218"));
        assertFalse(SfsNumbers.isValid("18:218"));
        assertFalse(SfsNumbers.isValid(null));
    }

    @Test
    void normalizesSfsNumbers() {
        assertEquals(Optional.of("2018:218"), SfsNumbers.normalize("SFS 2018:218 "));
        assertTrue(SfsNumbers.normalize("Prop.").isEmpty());
    }
}
