package no.cantara.lagref.eu;

import java.util.regex.Pattern;

/**
 * The citation grammars for EU acts, in the order they are tried. The community forms of each act
 * type run before its issuing-body form, so a citation reported by both keeps the shorter text
 * and no issuing body. Reordering the constants changes how existing references are read.
 */
public enum EuCitationGrammar {

    DIRECTIVE_COMMUNITY_PREFIX(EuActType.DIRECTIVE, EuCitationForm.COMMUNITY_IN_PARENTHESES,
            "direktiv\\s+\\(([^)]+)\\)\\s+(\\d{2,4})/(\\d+)"),

    DIRECTIVE_COMMUNITY_SUFFIX(EuActType.DIRECTIVE, EuCitationForm.YEAR_NUMBER,
            "direktiv\\s+(\\d{2,4})/(\\d+)(?:/([A-Z]+))?"),

    DIRECTIVE_ISSUING_BODY(EuActType.DIRECTIVE, EuCitationForm.ISSUING_BODY,
            "(rådets|kommissionens|Europaparlamentets och rådets)\\s+direktiv\\s+(?:\\(([^)]+)\\)\\s+)?"
                    + "(\\d{2,4})/(\\d+)(?:/([A-Z]+))?"),

    REGULATION_COMMUNITY_PREFIX(EuActType.REGULATION, EuCitationForm.COMMUNITY_IN_PARENTHESES,
            "förordning\\s+\\(([^)]+)\\)\\s+(?:nr\\s+)?(\\d{2,4})/(\\d+)"),

    REGULATION_ISSUING_BODY(EuActType.REGULATION, EuCitationForm.ISSUING_BODY,
            "(Europaparlamentets och rådets|kommissionens|rådets)\\s+(?:genomförande|delegerade\\s+)?förordning\\s+"
                    + "\\(([^)]+)\\)\\s+(?:nr\\s+)?(\\d{2,4})/(\\d+)");

    private final EuActType actType;
    private final EuCitationForm expectedForm;
    private final Pattern pattern;

    EuCitationGrammar(EuActType actType, EuCitationForm expectedForm, String regex) {
        this.actType = actType;
        this.expectedForm = expectedForm;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public EuActType actType() {
        return actType;
    }

    /** The form {@link EuCitationForm#classify} is expected to assign to this grammar's matches. */
    public EuCitationForm expectedForm() {
        return expectedForm;
    }

    public Pattern pattern() {
        return pattern;
    }
}
