package no.cantara.lagref.temporal;

import no.cantara.lagref.corpus.InMemoryLegalCorpus;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionRef;
import no.cantara.lagref.model.ProvisionVersion;
import no.cantara.lagref.model.ValidityInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TemporalResolverTest {

    private static final String DSL = "2018:218";
    private static final LocalDate ENACTED = LocalDate.of(2018, 5, 25);
    private static final LocalDate AMENDED = LocalDate.of(2021, 1, 1);

    private InMemoryLegalCorpus corpus;
    private TemporalResolver resolver;

    @BeforeEach
    void setUp() {
        corpus = new InMemoryLegalCorpus();
        resolver = new TemporalResolver(corpus);
        version("3:5", "Ursprunglig lydelse.", ENACTED, AMENDED);
        version("3:5", "Ny lydelse.", AMENDED, null);
        corpus.saveProvision(DSL, new Provision(ProvisionRef.parse("3:5"), null, "Ny lydelse."));
        corpus.addAmendment(DSL, "3:5", new AmendmentRecord("2020:1234", AMENDED, "ändrad", "Ny lydelse"));
        corpus.addAmendment(DSL, "3:5", new AmendmentRecord("2018:218", ENACTED, "införd", null));
    }

    private ProvisionVersion version(String ref, String content, LocalDate from, LocalDate to) {
        return corpus.appendVersion(DSL, ProvisionRef.parse(ref), null, content, ValidityInterval.of(from, to));
    }

    // -----------------------------------------------------------------------
    // Point-in-time resolution
    // -----------------------------------------------------------------------

    @Test
    void resolvesHistoricalWording() {
        Resolution r = resolver.resolve(DSL, "3:5", LocalDate.of(2020, 6, 15));

        Resolution.Versioned v = assertInstanceOf(Resolution.Versioned.class, r);
        assertEquals("Ursprunglig lydelse.", v.version().content());
        assertEquals("historical", r.status());
        assertTrue(r.isFound());
    }

    @Test
    void newWordingAppliesFromItsStartDate() {
        Resolution r = resolver.resolve(DSL, "3:5", AMENDED);

        assertEquals(Optional.of("Ny lydelse."), r.content());
        assertEquals("current", r.status());
    }

    @Test
    void dayBeforeAmendmentStillHasOldWording() {
        assertEquals(Optional.of("Ursprunglig lydelse."), resolver.resolve(DSL, "3:5", AMENDED.minusDays(1)).content());
    }

    @Test
    void dateBeforeFirstVersionIsNotInForce() {
        Resolution r = resolver.resolve(DSL, "3:5", LocalDate.of(2017, 1, 1));

        Resolution.NotInForce n = assertInstanceOf(Resolution.NotInForce.class, r);
        assertEquals(Optional.of(ENACTED), n.firstValidFrom());
        assertTrue(n.notYetEnacted());
        assertEquals("future", r.status());
        assertFalse(r.isFound());
    }

    @Test
    void dateAfterRepealIsNotInForceButNotFuture() {
        version("4:1", "Upphävd paragraf.", ENACTED, AMENDED);

        Resolution.NotInForce n = assertInstanceOf(Resolution.NotInForce.class,
                resolver.resolve(DSL, "4:1", LocalDate.of(2022, 1, 1)));
        assertFalse(n.notYetEnacted());
        assertEquals("not_in_force", n.status());
    }

    @Test
    void unknownProvisionIsNotFound() {
        assertInstanceOf(Resolution.NotFound.class, resolver.resolve(DSL, "9:9", LocalDate.of(2020, 1, 1)));
        assertInstanceOf(Resolution.NotFound.class, resolver.resolve(DSL, "9:9"));
        assertEquals("not_found", resolver.resolve("2099:1", "1").status());
    }

    @Test
    void noDateReadsCurrentTable() {
        Resolution r = resolver.resolve(DSL, "3:5");

        assertInstanceOf(Resolution.Current.class, r);
        assertEquals(Optional.of("Ny lydelse."), r.content());
    }

    // -----------------------------------------------------------------------
    // Tie-breaking
    // -----------------------------------------------------------------------

    @Test
    void latestStartDateWins() {
        version("1:1", "Utan startdatum.", null, null);
        version("1:1", "Med startdatum.", ENACTED, null);

        assertEquals(Optional.of("Med startdatum."), resolver.resolve(DSL, "1:1", AMENDED).content());
    }

    @Test
    void highestSequenceIdBreaksEqualStartDates() {
        version("1:2", "Först inlagd.", ENACTED, null);
        ProvisionVersion later = version("1:2", "Senare inlagd.", ENACTED, null);

        Resolution.Versioned v = (Resolution.Versioned) resolver.resolve(DSL, "1:2", AMENDED);
        assertEquals(later.sequenceId(), v.version().sequenceId());
    }

    @Test
    void versionWithoutStartAppliesFromInception() {
        version("1:3", "Alltid.", null, null);
        assertTrue(resolver.resolve(DSL, "1:3", LocalDate.of(1900, 1, 1)).isFound());
    }

    // -----------------------------------------------------------------------
    // History and comparison
    // -----------------------------------------------------------------------

    @Test
    void historyIsOrderedByStartDate() {
        List<ProvisionVersion> history = resolver.history(DSL, "3:5");

        assertEquals(2, history.size());
        assertEquals(Optional.of(ENACTED), history.get(0).validity().from());
        assertEquals(Optional.of(AMENDED), history.get(1).validity().from());
        assertTrue(history.get(1).isCurrent());
    }

    @Test
    void comparesTwoDates() {
        ProvisionComparison c = resolver.compare(DSL, "3:5", LocalDate.of(2020, 1, 1), LocalDate.of(2021, 6, 1));

        assertTrue(c.changed());
        assertEquals(Optional.of("Ursprunglig lydelse."), c.before().content());
        assertEquals(Optional.of("Ny lydelse."), c.after().content());
        assertEquals(1, c.amendments().size());
        assertEquals("2020:1234", c.amendments().get(0).amendedBySfs());
    }

    @Test
    void comparisonWithinOneVersionIsUnchanged() {
        ProvisionComparison c = resolver.compare(DSL, "3:5", LocalDate.of(2019, 1, 1), LocalDate.of(2020, 1, 1));

        assertFalse(c.changed());
        assertTrue(c.amendments().isEmpty());
    }

    @Test
    void comparisonIncludesAmendmentOnEndDate() {
        ProvisionComparison c = resolver.compare(DSL, "3:5", LocalDate.of(2020, 1, 1), AMENDED);
        assertEquals(1, c.amendments().size());
    }

    @Test
    void comparisonDatesMustBeOrdered() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.compare(DSL, "3:5", LocalDate.of(2021, 1, 1), LocalDate.of(2020, 1, 1)));
    }

    @Test
    void amendmentsAfterSkipUndated() {
        corpus.addAmendment(DSL, "3:5", new AmendmentRecord("2022:1", null, "ändrad", null));

        List<AmendmentRecord> after = resolver.amendmentsAfter(DSL, "3:5", ENACTED);
        assertEquals(List.of("2020:1234"), after.stream().map(AmendmentRecord::amendedBySfs).toList());
    }

    // -----------------------------------------------------------------------
    // Preconditions
    // -----------------------------------------------------------------------

    @Test
    void rejectsBlankIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(" ", "3:5", AMENDED));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(DSL, "", AMENDED));
        assertThrows(NullPointerException.class, () -> resolver.resolve(null, "3:5"));
    }

    @Test
    void parsesIsoDates() {
        assertEquals(LocalDate.of(2020, 6, 15), TemporalResolver.parseIsoDate("2020-06-15"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TemporalResolver.parseIsoDate("2020-6-15"));
        assertEquals("Invalid date format: 2020-6-15. Expected YYYY-MM-DD.", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> TemporalResolver.parseIsoDate("2021-02-30"));
    }

    @Test
    void rejectsInvertedValidity() {
        assertThrows(IllegalArgumentException.class, () -> ValidityInterval.of(AMENDED, ENACTED));
        assertThrows(IllegalArgumentException.class, () -> ValidityInterval.of(AMENDED, AMENDED));
    }
}
