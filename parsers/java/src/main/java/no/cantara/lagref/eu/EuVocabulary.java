package no.cantara.lagref.eu;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only lookup tables for EU reference extraction, loaded once from
 * {@code lagref/eu-vocabulary.yaml}.
 */
public final class EuVocabulary {

    static final String DEFAULT_RESOURCE = "lagref/eu-vocabulary.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final EuVocabulary DEFAULTS = loadResource(DEFAULT_RESOURCE);

    /** An implementation phrase and the relationship it signals. */
    public record ImplementationKeyword(String phrase, ReferenceType referenceType) {}

    /** An act habitually cited by name, e.g. "dataskyddsförordningen". */
    public record NamedAct(String name, Pattern pattern, EuActType type, int year, int number, Community community) {}

    private final Pattern issuingBodyPattern;
    private final Pattern articleTailPattern;
    private final List<ImplementationKeyword> implementationKeywords;
    private final List<NamedAct> namedActs;

    private EuVocabulary(List<String> issuingBodyMarkers, List<String> articleTailMarkers,
                         List<ImplementationKeyword> implementationKeywords, List<NamedAct> namedActs) {
        this.issuingBodyPattern = Pattern.compile(alternation(issuingBodyMarkers), FLAGS);
        this.articleTailPattern = Pattern.compile("\\s+i\\s+(?:" + alternation(articleTailMarkers) + ")\\b", FLAGS);
        this.implementationKeywords = List.copyOf(implementationKeywords);
        this.namedActs = List.copyOf(namedActs);
    }

    public static EuVocabulary defaults() {
        return DEFAULTS;
    }

    public static EuVocabulary parse(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        if (data == null) {
            throw new IllegalArgumentException("EU vocabulary is empty");
        }
        return fromMap(data);
    }

    @SuppressWarnings("unchecked")
    static EuVocabulary fromMap(Map<String, Object> data) {
        List<String> bodies = (List<String>) data.getOrDefault("issuing_body_markers", List.of());
        List<String> tails = (List<String>) data.getOrDefault("article_tail_markers", List.of());
        if (bodies.isEmpty() || tails.isEmpty()) {
            throw new IllegalArgumentException("EU vocabulary needs issuing_body_markers and article_tail_markers");
        }

        List<Map<String, Object>> keywordMaps =
                (List<Map<String, Object>>) data.getOrDefault("implementation_keywords", List.of());
        List<ImplementationKeyword> keywords = keywordMaps.stream().map(EuVocabulary::parseKeyword).toList();

        List<Map<String, Object>> actMaps = (List<Map<String, Object>>) data.getOrDefault("named_acts", List.of());
        List<NamedAct> acts = actMaps.stream().map(EuVocabulary::parseNamedAct).toList();

        return new EuVocabulary(bodies, tails, keywords, acts);
    }

    /** True if the text names an issuing body such as "rådets" or "kommissionens". */
    public boolean isIssuingBody(String text) {
        return text != null && issuingBodyPattern.matcher(text).find();
    }

    public Pattern articleTailPattern() {
        return articleTailPattern;
    }

    public List<ImplementationKeyword> implementationKeywords() {
        return implementationKeywords;
    }

    public List<NamedAct> namedActs() {
        return namedActs;
    }

    private static ImplementationKeyword parseKeyword(Map<String, Object> k) {
        String phrase = (String) k.get("phrase");
        String type = (String) k.get("reference_type");
        ReferenceType referenceType = ReferenceType.fromId(type)
                .orElseThrow(() -> new IllegalArgumentException("unknown reference_type '" + type + "' for '" + phrase + "'"));
        return new ImplementationKeyword(phrase, referenceType);
    }

    private static NamedAct parseNamedAct(Map<String, Object> a) {
        String name = (String) a.get("name");
        String type = (String) a.get("type");
        EuActType actType = EuActType.fromId(type)
                .orElseThrow(() -> new IllegalArgumentException("unknown act type '" + type + "' for '" + name + "'"));
        return new NamedAct(
                name,
                Pattern.compile((String) a.get("pattern"), FLAGS),
                actType,
                ((Number) a.get("year")).intValue(),
                ((Number) a.get("number")).intValue(),
                Community.parse((String) a.get("community")));
    }

    private static String alternation(List<String> words) {
        return words.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    }

    private static EuVocabulary loadResource(String resource) {
        try (InputStream is = EuVocabulary.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("EU vocabulary resource not found: " + resource);
            }
            return parse(is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
