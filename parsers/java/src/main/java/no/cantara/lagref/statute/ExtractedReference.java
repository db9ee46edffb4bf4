package no.cantara.lagref.statute;

import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.ProvisionRef;

import java.util.Objects;
import java.util.Optional;

/**
 * A reference found in provision text, either to another statute by SFS number or to a
 * provision of the same statute.
 */
public sealed interface ExtractedReference
        permits ExtractedReference.StatuteReference, ExtractedReference.ProvisionReference {

    /** The matched text, e.g. {@code "(2018:218)"}. */
    String rawText();

    /**
     * Turns the hit into a {@code references} edge from the given source.
     */
    CrossReference toCrossReference(String sourceDocumentId, Optional<String> sourceProvisionRef);

    record StatuteReference(String sfsNumber, String rawText) implements ExtractedReference {
        public StatuteReference {
            Objects.requireNonNull(sfsNumber, "sfsNumber");
        }

        @Override
        public CrossReference toCrossReference(String sourceDocumentId, Optional<String> sourceProvisionRef) {
            return new CrossReference(sourceDocumentId, sourceProvisionRef, sfsNumber, Optional.empty(),
                    CrossReference.Type.REFERENCES);
        }
    }

    record ProvisionReference(ProvisionRef target, String rawText) implements ExtractedReference {
        public ProvisionReference {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public CrossReference toCrossReference(String sourceDocumentId, Optional<String> sourceProvisionRef) {
            return new CrossReference(sourceDocumentId, sourceProvisionRef, sourceDocumentId, Optional.of(target.key()),
                    CrossReference.Type.REFERENCES);
        }
    }
}
