package no.cantara.lagref.corpus;

import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.eu.EuReferenceExtractor;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.statute.AmendmentExtractor;
import no.cantara.lagref.statute.AmendmentReference;
import no.cantara.lagref.statute.CrossReferenceExtractor;
import no.cantara.lagref.statute.ExtractedReference;
import no.cantara.lagref.statute.ProvisionSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw statute text into corpus rows: provisions, {@code references} edges, EU act
 * references and amendment-derived {@code amended_by} edges.
 */
public class StatuteIngestor {

    private static final Logger log = LoggerFactory.getLogger(StatuteIngestor.class);

    private final CorpusWriter writer;
    private final EuReferenceExtractor euExtractor;

    /**
     * Counts of rows written for one document.
     */
    public record IngestionSummary(String documentId, int provisions, int crossReferences, int euReferences,
                                   int amendments) {}

    public StatuteIngestor(CorpusWriter writer) {
        this(writer, new EuReferenceExtractor());
    }

    public StatuteIngestor(CorpusWriter writer, EuReferenceExtractor euExtractor) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.euExtractor = Objects.requireNonNull(euExtractor, "euExtractor");
    }

    public IngestionSummary ingest(LegalDocument document, String rawText) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(rawText, "rawText");
        String documentId = document.id();
        writer.saveDocument(document);

        List<Provision> provisions = ProvisionSegmenter.segment(rawText);
        int crossRefs = 0;
        int euRefs = 0;
        int amendmentCount = 0;

        for (Provision provision : provisions) {
            writer.saveProvision(documentId, provision);
            Optional<String> source = Optional.of(provision.provisionRef());
            String content = provision.content();

            for (ExtractedReference ref : CrossReferenceExtractor.extract(content)) {
                writer.addCrossReference(ref.toCrossReference(documentId, source));
                crossRefs++;
            }

            for (EuReference ref : euExtractor.extract(content)) {
                writer.addEuReference(documentId, source, ref);
                euRefs++;
            }

            LocalDate effective = AmendmentExtractor.extractEffectiveDate(content).orElse(null);
            for (AmendmentReference amendment : AmendmentExtractor.extract(content)) {
                writer.addCrossReference(new CrossReference(documentId, source, amendment.amendedBySfs(),
                        Optional.empty(), CrossReference.Type.AMENDED_BY));
                writer.addAmendment(documentId, provision.provisionRef(), new AmendmentRecord(
                        amendment.amendedBySfs(), effective, amendment.kind().label(), amendment.rawText()));
                amendmentCount++;
            }
        }

        IngestionSummary summary = new IngestionSummary(documentId, provisions.size(), crossRefs, euRefs, amendmentCount);
        log.info("Ingested {}: {} provisions, {} cross references, {} EU references, {} amendments",
                documentId, summary.provisions(), summary.crossReferences(), summary.euReferences(), summary.amendments());
        return summary;
    }
}
