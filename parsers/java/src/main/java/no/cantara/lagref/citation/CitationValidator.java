package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.DocumentType;
import no.cantara.lagref.model.ProvisionRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks citations against the corpus so that no citation is returned that the corpus cannot
 * back up.
 *
 * <p>A citation is valid when it parses, the document exists and, if a provision was cited,
 * that provision exists. Status warnings (repealed, amended) are advisory.
 */
public class CitationValidator {

    private final CitationLookup lookup;

    public CitationValidator(CitationLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * @param citation        the parsed citation
     * @param documentExists  whether the cited document is in the corpus
     * @param provisionExists whether the cited provision is in the corpus; true when none was cited
     * @param warnings        advisory messages, including the reason for any failed check
     */
    public record ValidationResult(
            ParsedCitation citation,
            boolean documentExists,
            boolean provisionExists,
            Optional<DocumentStatus> status,
            Optional<String> documentTitle,
            List<String> warnings
    ) {
        public ValidationResult {
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() {
            return citation.valid() && documentExists && provisionExists;
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    public ValidationResult validate(String citation) {
        return validate(CitationParser.parse(citation));
    }

    public ValidationResult validate(ParsedCitation parsed) {
        Objects.requireNonNull(parsed, "parsed");
        if (!parsed.valid()) {
            return new ValidationResult(parsed, false, false, Optional.empty(), Optional.empty(),
                    List.of(parsed.error().orElse("Invalid citation format")));
        }

        String documentId = parsed.documentId();
        if (!lookup.documentExists(documentId)) {
            return new ValidationResult(parsed, false, false, Optional.empty(), Optional.empty(),
                    List.of("Document \"" + documentId + "\" not found in corpus"));
        }

        List<String> warnings = new ArrayList<>();
        Optional<DocumentStatus> status = lookup.getDocumentStatus(documentId);
        if (status.isPresent() && status.get() == DocumentStatus.REPEALED) {
            warnings.add("Document \"" + documentId + "\" has been repealed (upphävd)");
        } else if (status.isPresent() && status.get() == DocumentStatus.AMENDED) {
            warnings.add("Document \"" + documentId + "\" has been amended since ingestion");
        }

        boolean provisionExists = true;
        Optional<ProvisionRef> pinpoint = parsed.type() == DocumentType.STATUTE ? parsed.provisionRef() : Optional.empty();
        if (pinpoint.isPresent()) {
            String ref = pinpoint.get().key();
            provisionExists = lookup.provisionExists(documentId, ref);
            if (!provisionExists) {
                warnings.add("Provision \"" + ref + "\" not found in document \"" + documentId + "\"");
            }
        }

        return new ValidationResult(parsed, true, provisionExists, status, lookup.getDocumentTitle(documentId), warnings);
    }
}
