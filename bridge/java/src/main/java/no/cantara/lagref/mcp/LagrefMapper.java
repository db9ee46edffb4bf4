package no.cantara.lagref.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.lagref.citation.CitationFormatter;
import no.cantara.lagref.citation.CitationValidator;
import no.cantara.lagref.citation.ParsedCitation;
import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.eu.EuReferences;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.ProvisionVersion;
import no.cantara.lagref.temporal.CurrencyReport;
import no.cantara.lagref.temporal.Resolution;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Pure mapping functions: lagref results → JSON tool output and MCP schema types.
 * No I/O.
 */
public final class LagrefMapper {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private LagrefMapper() {}

    // ── Tool results ──────────────────────────────────────────────────────────────

    public static McpSchema.CallToolResult success(ObjectNode body) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(toJson(body))), false);
    }

    public static McpSchema.CallToolResult error(String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", message);
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(toJson(body))), true);
    }

    // ── Citations ─────────────────────────────────────────────────────────────────

    public static ObjectNode formattedCitation(String input, ParsedCitation parsed, String formatted) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("input", input);
        node.put("formatted", formatted);
        node.put("type", parsed.valid() ? parsed.type().id() : "unknown");
        node.put("valid", parsed.valid());
        parsed.error().ifPresent(e -> node.put("error", e));
        return node;
    }

    public static ObjectNode validation(String input, CitationValidator.ValidationResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("citation", input);
        node.put("formatted_citation", result.citation().valid() ? CitationFormatter.format(result.citation()) : "");
        node.put("valid", result.isValid());
        node.put("document_exists", result.documentExists());
        node.put("provision_exists", result.provisionExists());
        result.documentTitle().ifPresent(t -> node.put("document_title", t));
        result.status().ifPresent(s -> node.put("status", s.id()));
        node.set("warnings", strings(result.warnings()));
        return node;
    }

    // ── Temporal ──────────────────────────────────────────────────────────────────

    public static ObjectNode resolution(Resolution resolution) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("document_id", resolution.documentId());
        node.put("provision_ref", resolution.provisionRef());
        node.put("status", resolution.status());

        if (resolution instanceof Resolution.Versioned v) {
            ProvisionVersion version = v.version();
            version.ref().chapter().ifPresent(c -> node.put("chapter", c));
            node.put("section", version.ref().section());
            if (version.title() != null) node.put("title", version.title());
            node.put("content", version.content());
            putDate(node, "valid_from", version.validity().from());
            putDate(node, "valid_to", version.validity().to());
        } else if (resolution instanceof Resolution.Current c) {
            c.provision().chapter().ifPresent(ch -> node.put("chapter", ch));
            node.put("section", c.provision().section());
            c.provision().titleIfAny().ifPresent(t -> node.put("title", t));
            node.put("content", c.provision().content());
        } else if (resolution instanceof Resolution.NotInForce n) {
            node.put("as_of_date", n.asOf().toString());
            putDate(node, "valid_from", n.firstValidFrom());
        }
        return node;
    }

    public static ArrayNode amendments(Collection<AmendmentRecord> amendments) {
        ArrayNode array = MAPPER.createArrayNode();
        for (AmendmentRecord a : amendments) {
            ObjectNode node = array.addObject();
            node.put("amended_by_sfs", a.amendedBySfs());
            if (a.amendmentDate() != null) node.put("amendment_date", a.amendmentDate().toString());
            node.put("amendment_type", a.amendmentType());
            if (a.changeSummary() != null) node.put("change_summary", a.changeSummary());
        }
        return array;
    }

    public static ObjectNode currency(CurrencyReport report) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("document_id", report.documentId());
        node.put("title", report.title());
        node.put("status", report.status().id());
        node.put("type", report.type().id());
        putDate(node, "issued_date", report.issuedDate());
        putDate(node, "in_force_date", report.inForceDate());
        node.put("is_current", report.isCurrent());
        report.asOf().ifPresent(d -> node.put("as_of_date", d.toString()));
        report.statusAsOf().ifPresent(s -> node.put("status_as_of", s.id()));
        report.isInForceAsOf().ifPresent(b -> node.put("is_in_force_as_of", b));
        report.provisionExists().ifPresent(b -> node.put("provision_exists", b));
        node.set("warnings", strings(report.warnings()));
        return node;
    }

    // ── References ────────────────────────────────────────────────────────────────

    public static ObjectNode crossReference(CrossReference ref, String rawText) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("raw_text", rawText);
        node.put("target_document_id", ref.targetDocumentId());
        ref.targetProvisionRef().ifPresent(p -> node.put("target_provision_ref", p));
        node.put("ref_type", ref.refType().id());
        return node;
    }

    public static ObjectNode euReference(EuReference ref) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", ref.type().id());
        node.put("id", ref.id());
        node.put("year", ref.year());
        node.put("number", ref.number());
        ref.community().ifPresent(c -> node.put("community", c.label()));
        ref.issuingBody().ifPresent(b -> node.put("issuing_body", b));
        ref.article().ifPresent(a -> node.put("article", a));
        node.put("celex_number", ref.celexNumber());
        node.put("lookup_key", ref.lookupKey());
        node.put("citation", EuReferences.format(ref, EuReferences.Style.FULL));
        ref.referenceType().ifPresent(t -> node.put("reference_type", t.id()));
        ref.implementationKeyword().ifPresent(k -> node.put("implementation_keyword", k));
        node.put("context", ref.context());
        return node;
    }

    // ── Tool input schemas ────────────────────────────────────────────────────────

    /** One property of a tool's input schema. */
    public record Property(String name, String type, String description) {
        public static Property string(String name, String description) {
            return new Property(name, "string", description);
        }
    }

    public static String inputSchema(List<String> required, Property... properties) {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        for (Property p : properties) {
            ObjectNode property = props.putObject(p.name());
            property.put("type", p.type());
            property.put("description", p.description());
        }
        schema.set("required", strings(required));
        return toJson(schema);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ArrayNode strings(Collection<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private static void putDate(ObjectNode node, String field, Optional<LocalDate> date) {
        if (date.isPresent()) {
            node.put(field, date.get().toString());
        } else {
            node.putNull(field);
        }
    }
}
