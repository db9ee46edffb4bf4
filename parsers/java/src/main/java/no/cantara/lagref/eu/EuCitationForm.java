package no.cantara.lagref.eu;

import java.util.Optional;
import java.util.regex.MatchResult;

/**
 * Surface shapes an EU directive or regulation citation can take, and how each shape maps
 * capture groups to year, number, community and issuing body.
 */
public enum EuCitationForm {

    /** {@code "Europaparlamentets och rådets direktiv (EU) 2016/680"}. */
    ISSUING_BODY {
        @Override
        Optional<Parts> read(MatchResult m) {
            String community = group(m, 2) != null ? group(m, 2) : group(m, 5);
            return Parts.of(group(m, 3), group(m, 4), community, group(m, 1));
        }
    },

    /** {@code "direktiv (EU) 2019/1152"}, {@code "förordning (EG) nr 765/2008"}. */
    COMMUNITY_IN_PARENTHESES {
        @Override
        Optional<Parts> read(MatchResult m) {
            return Parts.of(group(m, 2), group(m, 3), group(m, 1), null);
        }
    },

    /** {@code "direktiv 95/46/EG"}, {@code "direktiv 2016/680"}. */
    YEAR_NUMBER {
        @Override
        Optional<Parts> read(MatchResult m) {
            return Parts.of(group(m, 1), group(m, 2), group(m, 3), null);
        }
    };

    /**
     * Raw group values of a citation before numeric validation.
     */
    record Parts(String year, String number, String community, String issuingBody) {
        static Optional<Parts> of(String year, String number, String community, String issuingBody) {
            if (year == null || number == null) return Optional.empty();
            return Optional.of(new Parts(year, number, community, issuingBody));
        }
    }

    abstract Optional<Parts> read(MatchResult m);

    /**
     * Decides which shape a match has from its first capture group: an issuing-body word makes it
     * {@link #ISSUING_BODY}; otherwise a non-numeric group is a community in parentheses and a
     * numeric one a year. A match with an empty first group cannot be read.
     */
    public static Optional<EuCitationForm> classify(MatchResult m, EuVocabulary vocabulary) {
        String first = group(m, 1);
        if (first == null || first.isEmpty()) return Optional.empty();
        if (vocabulary.isIssuingBody(first)) return Optional.of(ISSUING_BODY);
        if (!Character.isDigit(first.charAt(0))) {
            return group(m, 2) != null && group(m, 3) != null
                    ? Optional.of(COMMUNITY_IN_PARENTHESES)
                    : Optional.empty();
        }
        return group(m, 2) != null ? Optional.of(YEAR_NUMBER) : Optional.empty();
    }

    static String group(MatchResult m, int index) {
        return index <= m.groupCount() ? m.group(index) : null;
    }
}
