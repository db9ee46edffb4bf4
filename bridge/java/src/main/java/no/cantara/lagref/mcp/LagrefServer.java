package no.cantara.lagref.mcp;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.lagref.citation.CitationFormatter;
import no.cantara.lagref.citation.CitationParser;
import no.cantara.lagref.citation.CitationStyle;
import no.cantara.lagref.citation.CitationValidator;
import no.cantara.lagref.citation.ParsedCitation;
import no.cantara.lagref.corpus.LegalCorpus;
import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.eu.EuReferenceExtractor;
import no.cantara.lagref.mcp.LagrefMapper.Property;
import no.cantara.lagref.statute.AmendmentExtractor;
import no.cantara.lagref.statute.AmendmentReference;
import no.cantara.lagref.statute.CrossReferenceExtractor;
import no.cantara.lagref.statute.ExtractedReference;
import no.cantara.lagref.temporal.CurrencyChecker;
import no.cantara.lagref.temporal.CurrencyReport;
import no.cantara.lagref.temporal.Resolution;
import no.cantara.lagref.temporal.TemporalResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and returns a configured MCP server exposing citation and statute tools over a corpus.
 */
public final class LagrefServer {

    private static final Logger log = LoggerFactory.getLogger(LagrefServer.class);

    static final String VERSION = "0.1.0";

    private LagrefServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the tool list and per-name call handlers built over a corpus.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ToolSet(
        List<McpSchema.Tool> tools,
        Map<String, ToolHandler> handlers
    ) {}

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> arguments);
    }

    /**
     * Builds all tools and their handlers. Precondition failures in a handler become error
     * results rather than exceptions.
     */
    static ToolSet buildTools(LegalCorpus corpus) {
        CitationValidator validator = new CitationValidator(corpus);
        TemporalResolver resolver = new TemporalResolver(corpus);
        CurrencyChecker currencyChecker = new CurrencyChecker(corpus);
        EuReferenceExtractor euExtractor = new EuReferenceExtractor();

        List<McpSchema.Tool> tools = new ArrayList<>();
        Map<String, ToolHandler> handlers = new LinkedHashMap<>();

        // ── format_citation ──────────────────────────────────────────────────────
        register(tools, handlers, new McpSchema.Tool(
                "format_citation",
                "Format a Swedish legal citation (SFS, Prop., SOU, Ds, NJA, HFD, AD) in standard form.",
                LagrefMapper.inputSchema(List.of("citation"),
                        Property.string("citation", "Citation to format, e.g. \"2018:218 3:5\""),
                        Property.string("format", "full (default), short or pinpoint"))),
            args -> formatCitation(args));

        // ── validate_citation ────────────────────────────────────────────────────
        register(tools, handlers, new McpSchema.Tool(
                "validate_citation",
                "Check that a cited document and provision exist in the corpus and report repeal or amendment status.",
                LagrefMapper.inputSchema(List.of("citation"),
                        Property.string("citation", "Citation to validate, e.g. \"SFS 2018:218 3 kap. 5 §\""))),
            args -> {
                String citation = optionalString(args, "citation").orElse("");
                return LagrefMapper.success(LagrefMapper.validation(citation, validator.validate(citation)));
            });

        // ── get_provision_at_date ────────────────────────────────────────────────
        register(tools, handlers, new McpSchema.Tool(
                "get_provision_at_date",
                "Retrieve a statute provision as it read on a given date.",
                LagrefMapper.inputSchema(List.of("sfs", "provision_ref", "date"),
                        Property.string("sfs", "SFS number, e.g. \"2018:218\""),
                        Property.string("provision_ref", "Provision reference, e.g. \"3:5\" or \"5\""),
                        Property.string("date", "ISO date (YYYY-MM-DD)"),
                        new Property("include_amendments", "boolean", "Include amendments after the returned version"))),
            args -> {
                String sfs = requireString(args, "sfs");
                String ref = requireString(args, "provision_ref");
                LocalDate date = TemporalResolver.parseIsoDate(requireString(args, "date"));
                Resolution resolution = resolver.resolve(sfs, ref, date);
                ObjectNode body = LagrefMapper.resolution(resolution);
                if (Boolean.TRUE.equals(args.get("include_amendments")) && resolution.isFound()) {
                    LocalDate since = resolution instanceof Resolution.Versioned v
                            ? v.version().validity().from().orElse(LocalDate.MIN)
                            : LocalDate.MIN;
                    body.set("amendments", LagrefMapper.amendments(resolver.amendmentsAfter(sfs, ref, since)));
                }
                return LagrefMapper.success(body);
            });

        // ── check_currency ───────────────────────────────────────────────────────
        register(tools, handlers, new McpSchema.Tool(
                "check_currency",
                "Check whether a statute, or one of its provisions, is in force now or on a given date.",
                LagrefMapper.inputSchema(List.of("document_id"),
                        Property.string("document_id", "SFS number, e.g. \"2018:218\""),
                        Property.string("provision_ref", "Optional provision reference"),
                        Property.string("as_of_date", "Optional ISO date (YYYY-MM-DD)"))),
            args -> {
                String documentId = requireString(args, "document_id");
                LocalDate asOf = optionalString(args, "as_of_date").map(TemporalResolver::parseIsoDate).orElse(null);
                Optional<CurrencyReport> report = currencyChecker.check(
                        documentId, optionalString(args, "provision_ref").orElse(null), asOf);
                if (report.isEmpty()) {
                    return LagrefMapper.error("Document \"" + documentId + "\" not found in corpus");
                }
                return LagrefMapper.success(LagrefMapper.currency(report.get()));
            });

        // ── extract_references ───────────────────────────────────────────────────
        register(tools, handlers, new McpSchema.Tool(
                "extract_references",
                "Find statute, provision, EU act and amendment references in a piece of Swedish legal text.",
                LagrefMapper.inputSchema(List.of("text"),
                        Property.string("text", "Provision or statute text"),
                        Property.string("document_id", "SFS number of the statute the text belongs to"))),
            args -> {
                String text = requireString(args, "text");
                String documentId = optionalString(args, "document_id").orElse("");
                ObjectNode body = LagrefMapper.MAPPER.createObjectNode();

                ArrayNode crossRefs = body.putArray("cross_references");
                for (ExtractedReference ref : CrossReferenceExtractor.extract(text)) {
                    crossRefs.add(LagrefMapper.crossReference(ref.toCrossReference(documentId, Optional.empty()), ref.rawText()));
                }
                ArrayNode euRefs = body.putArray("eu_references");
                for (EuReference ref : euExtractor.extract(text)) {
                    euRefs.add(LagrefMapper.euReference(ref));
                }
                ArrayNode amendments = body.putArray("amendments");
                for (AmendmentReference ref : AmendmentExtractor.extract(text)) {
                    ObjectNode node = amendments.addObject();
                    node.put("amended_by_sfs", ref.amendedBySfs());
                    node.put("amendment_type", ref.kind().label());
                    node.put("raw_text", ref.rawText());
                }
                AmendmentExtractor.extractEffectiveDate(text).ifPresent(d -> body.put("effective_date", d.toString()));
                return LagrefMapper.success(body);
            });

        return new ToolSet(tools, handlers);
    }

    static McpSchema.CallToolResult formatCitation(Map<String, Object> args) {
        String citation = optionalString(args, "citation").orElse("");
        CitationStyle style = CitationStyle.FULL;
        Optional<String> format = optionalString(args, "format");
        if (format.isPresent()) {
            style = CitationStyle.fromId(format.get())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown format '" + format.get() + "'"));
        }
        ParsedCitation parsed = CitationParser.parse(citation);
        return LagrefMapper.success(LagrefMapper.formattedCitation(citation, parsed, CitationFormatter.format(parsed, style)));
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Loads the corpus at {@code corpusPath} and returns a configured MCP sync server ready to
     * accept connections.
     *
     * @param corpusPath path to corpus.yaml
     * @param transport  MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(Path corpusPath, McpServerTransportProvider transport) throws IOException {
        LegalCorpus corpus = CorpusLoader.load(corpusPath);
        ToolSet ts = buildTools(corpus);

        log.info("Serving {} tools over {}", ts.tools().size(), corpusPath);

        List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
        for (McpSchema.Tool tool : ts.tools()) {
            ToolHandler handler = ts.handlers().get(tool.name());
            specifications.add(new McpServerFeatures.SyncToolSpecification(
                tool,
                (exchange, arguments) -> handler.handle(arguments)
            ));
        }

        return McpServer.sync(transport)
            .serverInfo("lagref", VERSION)
            .capabilities(McpSchema.ServerCapabilities.builder()
                .tools(false)
                .build())
            .tools(specifications)
            .build();
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static void register(List<McpSchema.Tool> tools, Map<String, ToolHandler> handlers,
                                 McpSchema.Tool tool, ToolHandler handler) {
        tools.add(tool);
        handlers.put(tool.name(), arguments -> {
            Map<String, Object> args = arguments != null ? arguments : Map.of();
            try {
                return handler.handle(args);
            } catch (IllegalArgumentException | NullPointerException e) {
                log.debug("Tool {} rejected arguments {}: {}", tool.name(), args, e.getMessage());
                return LagrefMapper.error(e.getMessage());
            }
        });
    }

    static String requireString(Map<String, Object> args, String key) {
        return optionalString(args, key)
                .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
    }

    static Optional<String> optionalString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) return Optional.empty();
        String s = value.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }
}
