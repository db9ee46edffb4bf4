package no.cantara.lagref.corpus;

import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.DocumentType;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionRef;
import no.cantara.lagref.model.ProvisionVersion;
import no.cantara.lagref.model.ValidityInterval;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLegalCorpusTest {

    private final InMemoryLegalCorpus corpus = new InMemoryLegalCorpus();

    private static LegalDocument statute(String id, DocumentStatus status) {
        return new LegalDocument(id, DocumentType.STATUTE, "Lag " + id, null, status, null, null, null);
    }

    @Test
    void looksUpDocumentsThroughCitationContract() {
        corpus.saveDocument(statute("2018:218", DocumentStatus.AMENDED));

        assertTrue(corpus.documentExists("2018:218"));
        assertFalse(corpus.documentExists("2018:219"));
        assertEquals(Optional.of(DocumentStatus.AMENDED), corpus.getDocumentStatus("2018:218"));
        assertEquals(Optional.of("Lag 2018:218"), corpus.getDocumentTitle("2018:218"));
        assertTrue(corpus.getDocumentStatus("2018:219").isEmpty());
        assertEquals(1, corpus.documentCount());
    }

    @Test
    void savesAndReplacesCurrentProvision() {
        corpus.saveProvision("2018:218", new Provision(ProvisionRef.of("3", "5"), null, "Gammal"));
        corpus.saveProvision("2018:218", new Provision(ProvisionRef.of("3", "5"), null, "Ny"));

        assertTrue(corpus.provisionExists("2018:218", "3:5"));
        assertFalse(corpus.provisionExists("2018:218", "5"));
        assertEquals("Ny", corpus.findProvision("2018:218", "3:5").orElseThrow().content());
    }

    @Test
    void versionsGetIncreasingSequenceIds() {
        ProvisionVersion first = corpus.appendVersion("2018:218", ProvisionRef.parse("3:5"), null, "A",
                ValidityInterval.of(LocalDate.of(2018, 5, 25), LocalDate.of(2021, 1, 1)));
        ProvisionVersion second = corpus.appendVersion("2018:218", ProvisionRef.parse("3:5"), null, "B",
                ValidityInterval.of(LocalDate.of(2021, 1, 1), null));

        assertTrue(second.sequenceId() > first.sequenceId());
        assertEquals(List.of(first, second), corpus.findVersions("2018:218", "3:5"));
        assertTrue(corpus.findVersions("2018:218", "1:1").isEmpty());
    }

    @Test
    void returnedListsAreSnapshots() {
        corpus.addAmendment("2018:218", "3:5", new AmendmentRecord("2021:1174", null, "ändrad", null));
        List<AmendmentRecord> amendments = corpus.findAmendments("2018:218", "3:5");

        assertThrows(UnsupportedOperationException.class, () -> amendments.add(null));
        corpus.addAmendment("2018:218", "3:5", new AmendmentRecord("2022:1", null, "ändrad", null));
        assertEquals(1, amendments.size());
        assertEquals(2, corpus.findAmendments("2018:218", "3:5").size());
    }
}
