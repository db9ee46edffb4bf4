package no.cantara.lagref.eu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * Extracts EU directive and regulation citations from Swedish legal text.
 *
 * <p>Directive grammars run first, then regulation grammars, then the named-act aliases. A
 * reference is reported once per {@code id:community}. Every surviving reference is then
 * classified from its context window: article pinpoints, implementation keyword and the
 * relationship type.
 */
public final class EuReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(EuReferenceExtractor.class);

    static final int CONTEXT_RADIUS = 100;

    private final EuVocabulary vocabulary;

    public EuReferenceExtractor() {
        this(EuVocabulary.defaults());
    }

    public EuReferenceExtractor(EuVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    public List<EuReference> extract(String text) {
        Objects.requireNonNull(text, "text");
        List<EuReference> references = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (EuCitationGrammar grammar : EuCitationGrammar.values()) {
            Matcher m = grammar.pattern().matcher(text);
            while (m.find()) {
                parseMatch(grammar.actType(), m.toMatchResult(), text)
                        .filter(ref -> seen.add(ref.dedupeKey()))
                        .ifPresent(references::add);
            }
        }

        for (EuVocabulary.NamedAct act : vocabulary.namedActs()) {
            Matcher m = act.pattern().matcher(text);
            while (m.find()) {
                EuReference ref = EuReference.found(act.type(), act.year(), act.number(), act.community(), null,
                        m.group(), context(text, m.start(), m.end()));
                if (seen.add(ref.dedupeKey())) {
                    references.add(ref);
                }
            }
        }

        return references.stream().map(this::classify).toList();
    }

    /**
     * Two-digit years are read as 19xx from 50 upwards and 20xx below; longer years are kept.
     */
    public static int normalizeYear(int year) {
        if (year >= 100) return year;
        return year < 50 ? 2000 + year : 1900 + year;
    }

    Optional<EuReference> parseMatch(EuActType type, MatchResult m, String text) {
        Optional<EuCitationForm.Parts> parts = EuCitationForm.classify(m, vocabulary).flatMap(form -> form.read(m));
        if (parts.isEmpty()) {
            log.debug("Unreadable {} citation '{}'", type.id(), m.group());
            return Optional.empty();
        }

        int year;
        int number;
        try {
            year = normalizeYear(Integer.parseInt(parts.get().year()));
            number = Integer.parseInt(parts.get().number());
        } catch (NumberFormatException e) {
            log.debug("Discarding {} citation '{}': {}", type.id(), m.group(), e.getMessage());
            return Optional.empty();
        }

        String community = parts.get().community();
        return Optional.of(EuReference.found(type, year, number,
                community != null ? Community.parse(community) : Community.EU,
                parts.get().issuingBody(), m.group(), context(text, m.start(), m.end())));
    }

    EuReference classify(EuReference ref) {
        Optional<String> article = Optional.empty();
        Optional<ReferenceType> type = Optional.empty();
        Optional<String> keyword = Optional.empty();

        List<String> articles = ArticleReferences.extractInline(ref.context(), vocabulary);
        if (!articles.isEmpty()) {
            article = Optional.of(String.join(",", articles));
            type = Optional.of(ReferenceType.CITES_ARTICLE);
        }

        String lowerContext = ref.context().toLowerCase(Locale.ROOT);
        for (EuVocabulary.ImplementationKeyword k : vocabulary.implementationKeywords()) {
            if (lowerContext.contains(k.phrase())) {
                keyword = Optional.of(k.phrase());
                if (type.isEmpty()) {
                    type = Optional.of(k.referenceType());
                }
                break;
            }
        }

        if (type.isEmpty()) {
            type = Optional.of(ref.type() == EuActType.DIRECTIVE ? ReferenceType.IMPLEMENTS : ReferenceType.APPLIES);
        }
        return ref.withClassification(article, type, keyword);
    }

    static String context(String text, int start, int end) {
        int from = Math.max(0, start - CONTEXT_RADIUS);
        int to = Math.min(text.length(), end + CONTEXT_RADIUS);
        return text.substring(from, to).replaceAll("\\s+", " ").trim();
    }
}
