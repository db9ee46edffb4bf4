package no.cantara.lagref.mcp;

import no.cantara.lagref.corpus.InMemoryLegalCorpus;
import no.cantara.lagref.corpus.StatuteIngestor;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.DocumentType;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.ProvisionRef;
import no.cantara.lagref.model.ValidityInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Loads a corpus.yaml file into an {@link InMemoryLegalCorpus}.
 *
 * <pre>
 * documents:
 *   - id: "2018:218"
 *     type: statute
 *     title: Lag (2018:218) med kompletterande bestämmelser till EU:s dataskyddsförordning
 *     status: in_force
 *     in_force_date: 2018-05-25
 *     text_file: statutes/2018-218.txt     # or inline: text: |
 * versions:
 *   - document_id: "2018:218"
 *     provision_ref: "3:5"
 *     content: ...
 *     valid_from: 2018-05-25
 *     valid_to: 2021-01-01
 * amendments:
 *   - document_id: "2018:218"
 *     provision_ref: "3:5"
 *     amended_by_sfs: "2020:1234"
 *     amendment_date: 2021-01-01
 *     amendment_type: ändrad
 * </pre>
 * Ids and provision refs must be quoted: YAML 1.1 reads {@code 3:5} as a base-60 integer.
 */
public final class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private CorpusLoader() {}

    public static InMemoryLegalCorpus load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.toAbsolutePath().getParent());
        }
    }

    /**
     * @param baseDir directory {@code text_file} entries resolve against
     */
    public static InMemoryLegalCorpus load(InputStream is, Path baseDir) throws IOException {
        Map<String, Object> data = YAML.load(is);
        InMemoryLegalCorpus corpus = new InMemoryLegalCorpus();
        if (data == null) {
            return corpus;
        }
        StatuteIngestor ingestor = new StatuteIngestor(corpus);

        for (Map<String, Object> d : list(data, "documents")) {
            LegalDocument document = parseDocument(d);
            String text = text(d, baseDir);
            if (text != null) {
                ingestor.ingest(document, text);
            } else {
                corpus.saveDocument(document);
            }
        }

        List<Map<String, Object>> versions = list(data, "versions");
        for (Map<String, Object> v : versions) {
            corpus.appendVersion(
                    string(v, "document_id"),
                    ProvisionRef.parse(string(v, "provision_ref")),
                    (String) v.get("title"),
                    string(v, "content"),
                    ValidityInterval.of(parseDate(v.get("valid_from")), parseDate(v.get("valid_to"))));
        }

        List<Map<String, Object>> amendments = list(data, "amendments");
        for (Map<String, Object> a : amendments) {
            corpus.addAmendment(string(a, "document_id"), string(a, "provision_ref"), new AmendmentRecord(
                    string(a, "amended_by_sfs"),
                    parseDate(a.get("amendment_date")),
                    (String) a.getOrDefault("amendment_type", "ändrad"),
                    (String) a.get("change_summary")));
        }

        log.info("Loaded corpus: {} documents, {} provision versions, {} amendments",
                corpus.documentCount(), versions.size(), amendments.size());
        return corpus;
    }

    static LegalDocument parseDocument(Map<String, Object> d) {
        String id = string(d, "id");
        String typeId = (String) d.getOrDefault("type", "statute");
        String statusId = (String) d.getOrDefault("status", "in_force");
        return new LegalDocument(
                id,
                DocumentType.fromId(typeId)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown document type '" + typeId + "' for " + id)),
                (String) d.get("title"),
                (String) d.get("short_name"),
                DocumentStatus.fromId(statusId)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown status '" + statusId + "' for " + id)),
                parseDate(d.get("issued_date")),
                parseDate(d.get("in_force_date")),
                parseDate(d.get("repealed_date")));
    }

    /**
     * Resolves a statute text file, rejecting paths that leave the corpus directory.
     */
    static Path resolveTextFile(Path baseDir, String rawPath) {
        if (rawPath.startsWith("/") || rawPath.startsWith("\\")) {
            throw new IllegalArgumentException("Text file path must be relative: " + rawPath);
        }
        try {
            Path normalised = Path.of(rawPath).normalize();
            if (normalised.startsWith("..")) {
                throw new IllegalArgumentException("Text file path escapes corpus directory: " + rawPath);
            }
            return baseDir.resolve(normalised);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid text file path: " + rawPath, e);
        }
    }

    private static String text(Map<String, Object> d, Path baseDir) throws IOException {
        if (d.get("text") != null) {
            return string(d, "text");
        }
        Object file = d.get("text_file");
        if (file == null) {
            return null;
        }
        if (baseDir == null) {
            throw new IllegalArgumentException("text_file given but no corpus directory to resolve it against");
        }
        return Files.readString(resolveTextFile(baseDir, file.toString()), StandardCharsets.UTF_8);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Map<String, Object> data, String key) {
        return (List<Map<String, Object>>) data.getOrDefault(key, List.of());
    }

    private static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required field '" + key + "'");
        }
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("Field '" + key + "' must be a quoted string, got " + value);
        }
        return s;
    }

    private static LocalDate parseDate(Object value) {
        if (value == null) return null;
        if (value instanceof java.util.Date d) return d.toInstant().atZone(java.time.ZoneOffset.UTC).toLocalDate();
        return LocalDate.parse(value.toString());
    }
}
