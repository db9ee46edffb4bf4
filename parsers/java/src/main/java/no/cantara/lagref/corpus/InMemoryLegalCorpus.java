package no.cantara.lagref.corpus;

import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionRef;
import no.cantara.lagref.model.ProvisionVersion;
import no.cantara.lagref.model.ValidityInterval;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Corpus held in concurrent maps. Suitable for tests and for a corpus loaded once at startup.
 */
public class InMemoryLegalCorpus implements LegalCorpus, CorpusWriter {

    private final Map<String, LegalDocument> documents = new ConcurrentHashMap<>();
    private final Map<String, Provision> provisions = new ConcurrentHashMap<>();
    private final Map<String, List<ProvisionVersion>> versions = new ConcurrentHashMap<>();
    private final Map<String, List<AmendmentRecord>> amendments = new ConcurrentHashMap<>();
    private final Map<String, List<CrossReference>> crossReferences = new ConcurrentHashMap<>();
    private final Map<String, List<EuReferenceLink>> euReferences = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    // --- LegalCorpus

    @Override
    public Optional<LegalDocument> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public Optional<Provision> findProvision(String documentId, String provisionRef) {
        return Optional.ofNullable(provisions.get(key(documentId, provisionRef)));
    }

    @Override
    public List<ProvisionVersion> findVersions(String documentId, String provisionRef) {
        return List.copyOf(versions.getOrDefault(key(documentId, provisionRef), List.of()));
    }

    @Override
    public List<AmendmentRecord> findAmendments(String documentId, String provisionRef) {
        return List.copyOf(amendments.getOrDefault(key(documentId, provisionRef), List.of()));
    }

    @Override
    public List<CrossReference> findCrossReferences(String documentId) {
        return List.copyOf(crossReferences.getOrDefault(documentId, List.of()));
    }

    @Override
    public List<EuReferenceLink> findEuReferences(String documentId) {
        return List.copyOf(euReferences.getOrDefault(documentId, List.of()));
    }

    // --- CorpusWriter

    @Override
    public void saveDocument(LegalDocument document) {
        Objects.requireNonNull(document, "document");
        documents.put(document.id(), document);
    }

    @Override
    public void saveProvision(String documentId, Provision provision) {
        Objects.requireNonNull(provision, "provision");
        provisions.put(key(documentId, provision.provisionRef()), provision);
    }

    @Override
    public ProvisionVersion appendVersion(String documentId, ProvisionRef ref, String title, String content,
                                          ValidityInterval validity) {
        ProvisionVersion version = new ProvisionVersion(sequence.incrementAndGet(), documentId, ref, title, content, validity);
        append(versions, key(documentId, ref.key()), version);
        return version;
    }

    @Override
    public void addCrossReference(CrossReference reference) {
        Objects.requireNonNull(reference, "reference");
        append(crossReferences, reference.sourceDocumentId(), reference);
    }

    @Override
    public void addEuReference(String documentId, Optional<String> provisionRef, EuReference reference) {
        append(euReferences, documentId, new EuReferenceLink(documentId, provisionRef, reference));
    }

    @Override
    public void addAmendment(String documentId, String provisionRef, AmendmentRecord amendment) {
        Objects.requireNonNull(amendment, "amendment");
        append(amendments, key(documentId, provisionRef), amendment);
    }

    public int documentCount() {
        return documents.size();
    }

    private static <T> void append(Map<String, List<T>> table, String key, T value) {
        table.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
    }

    private static String key(String documentId, String provisionRef) {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(provisionRef, "provisionRef");
        return documentId + "#" + provisionRef;
    }
}
