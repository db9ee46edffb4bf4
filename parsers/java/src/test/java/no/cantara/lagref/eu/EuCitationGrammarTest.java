package no.cantara.lagref.eu;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

import static org.junit.jupiter.api.Assertions.*;

class EuCitationGrammarTest {

    private static final Map<EuCitationGrammar, String> SAMPLES = new EnumMap<>(EuCitationGrammar.class);

    static {
        SAMPLES.put(EuCitationGrammar.DIRECTIVE_COMMUNITY_PREFIX, "direktiv (EU) 2019/1152");
        SAMPLES.put(EuCitationGrammar.DIRECTIVE_COMMUNITY_SUFFIX, "direktiv 95/46/EG");
        SAMPLES.put(EuCitationGrammar.DIRECTIVE_ISSUING_BODY, "Europaparlamentets och rådets direktiv (EU) 2016/680");
        SAMPLES.put(EuCitationGrammar.REGULATION_COMMUNITY_PREFIX, "förordning (EG) nr 1907/2006");
        SAMPLES.put(EuCitationGrammar.REGULATION_ISSUING_BODY, "Kommissionens genomförandeförordning (EU) 2019/947");
    }

    private final EuVocabulary vocabulary = EuVocabulary.defaults();

    private static Matcher match(EuCitationGrammar grammar, String text) {
        Matcher m = grammar.pattern().matcher(text);
        assertTrue(m.find(), () -> grammar + " does not match '" + text + "'");
        return m;
    }

    @Test
    void everyGrammarHasASample() {
        assertEquals(EuCitationGrammar.values().length, SAMPLES.size());
    }

    @Test
    void classifiedFormMatchesGrammar() {
        for (Map.Entry<EuCitationGrammar, String> e : SAMPLES.entrySet()) {
            Matcher m = match(e.getKey(), e.getValue());
            assertEquals(Optional.of(e.getKey().expectedForm()), EuCitationForm.classify(m.toMatchResult(), vocabulary),
                    e.getKey().name());
        }
    }

    @Test
    void communityFormsAreTriedBeforeIssuingBodyForms() {
        List<EuCitationGrammar> order = List.of(EuCitationGrammar.values());

        assertTrue(order.indexOf(EuCitationGrammar.DIRECTIVE_COMMUNITY_PREFIX)
                < order.indexOf(EuCitationGrammar.DIRECTIVE_COMMUNITY_SUFFIX));
        assertTrue(order.indexOf(EuCitationGrammar.DIRECTIVE_COMMUNITY_SUFFIX)
                < order.indexOf(EuCitationGrammar.DIRECTIVE_ISSUING_BODY));
        assertTrue(order.indexOf(EuCitationGrammar.REGULATION_COMMUNITY_PREFIX)
                < order.indexOf(EuCitationGrammar.REGULATION_ISSUING_BODY));
        assertTrue(order.indexOf(EuCitationGrammar.DIRECTIVE_ISSUING_BODY)
                < order.indexOf(EuCitationGrammar.REGULATION_COMMUNITY_PREFIX));
    }

    @Test
    void issuingBodyGrammarReadsTheBody() {
        String text = "Europaparlamentets och rådets direktiv (EU) 2016/680";
        EuReference ref = new EuReferenceExtractor()
                .parseMatch(EuActType.DIRECTIVE, match(EuCitationGrammar.DIRECTIVE_ISSUING_BODY, text).toMatchResult(), text)
                .orElseThrow();

        assertEquals(Optional.of("Europaparlamentets och rådets"), ref.issuingBody());
        assertEquals(Optional.of(Community.EU), ref.community());
        assertEquals("2016/680", ref.id());
        assertEquals(text, ref.fullText());
        assertEquals("Europaparlamentets och rådets direktiv (EU) 2016/680", EuReferences.format(ref, EuReferences.Style.FULL));
    }

    @Test
    void issuingBodyGrammarReadsTrailingCommunity() {
        String text = "Rådets direktiv 93/13/EEG";
        EuReference ref = new EuReferenceExtractor()
                .parseMatch(EuActType.DIRECTIVE, match(EuCitationGrammar.DIRECTIVE_ISSUING_BODY, text).toMatchResult(), text)
                .orElseThrow();

        assertEquals(Optional.of("Rådets"), ref.issuingBody());
        assertEquals(Optional.of(Community.EEG), ref.community());
        assertEquals("1993/13", ref.id());
    }
}
