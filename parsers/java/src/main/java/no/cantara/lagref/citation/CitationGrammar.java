package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sub-grammars of Swedish legal citations, declared in the order they are tried. The first
 * grammar whose pattern matches the start of the input decides the result.
 */
enum CitationGrammar {

    /** {@code 2018:218 3:5} */
    STATUTE_SHORT("^(?:SFS\\s+)?(\\d{4}:\\d+)\\s+(\\d+):(\\d+\\s*[a-z]?)\\s*$") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.statute(raw, m.group(1), m.group(2), section(m.group(3)));
        }
    },

    /** {@code SFS 2018:218}, {@code SFS 2018:218 3 kap. 5 §}, {@code 2018:218 5 a §} */
    STATUTE("^(?:SFS\\s+)?(\\d{4}:\\d+)\\s*(?:(\\d+)\\s*kap\\.\\s*)?(?:(\\d+\\s*[a-z]?)\\s*§)?") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.statute(raw, m.group(1), m.group(2), section(m.group(3)));
        }
    },

    /** {@code Prop. 2017/18:105} */
    BILL("^Prop\\.\\s*(\\d{4}/\\d{2}:\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.document(raw, DocumentType.BILL, m.group(1));
        }
    },

    /** {@code SOU 2023:45} */
    SOU("^SOU\\s+(\\d{4}:\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.document(raw, DocumentType.SOU, m.group(1));
        }
    },

    /** {@code Ds 2022:10} */
    DS("^Ds\\s+(\\d{4}:\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.document(raw, DocumentType.DS, m.group(1));
        }
    },

    /** Supreme Court reporter: {@code NJA 2020 s. 45} */
    CASE_NJA("^(NJA)\\s+(\\d{4})\\s+s\\.\\s*(\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return caseLaw(raw, m);
        }
    },

    /** Supreme Administrative Court: {@code HFD 2019 ref. 12} */
    CASE_HFD("^(HFD)\\s+(\\d{4})\\s+ref\\.\\s*(\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return caseLaw(raw, m);
        }
    },

    /** Labour Court, Market Court, Migration Court of Appeal: {@code AD 2020 nr 5} */
    CASE_NUMBERED("^(AD|MD|MIG)\\s+(\\d{4})\\s+(?:nr|ref\\.?)\\s*(\\d+)") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return caseLaw(raw, m);
        }
    },

    /** {@code 3 kap. 5 § lag (2018:218)} */
    STATUTE_PROVISION_FIRST("^(?:(\\d+)\\s*kap\\.\\s*)?(\\d+\\s*[a-z]?)\\s*§\\s+.+\\((\\d{4}:\\d+)\\)\\s*$") {
        @Override
        ParsedCitation interpret(String raw, Matcher m) {
            return ParsedCitation.statute(raw, m.group(3), m.group(1), section(m.group(2)));
        }
    };

    private final Pattern pattern;

    CitationGrammar(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    Pattern pattern() {
        return pattern;
    }

    abstract ParsedCitation interpret(String raw, Matcher m);

    static String section(String token) {
        if (token == null) return null;
        return token.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    static ParsedCitation caseLaw(String raw, Matcher m) {
        return ParsedCitation.caseLaw(raw, m.group(1).toUpperCase(Locale.ROOT) + " " + m.group(2), m.group(3));
    }
}
