package no.cantara.lagref.statute;

/**
 * An amendment marker found in provision text.
 *
 * @param amendedBySfs SFS number of the amending statute
 * @param rawText      text fragment the marker was read from
 */
public record AmendmentReference(String amendedBySfs, Kind kind, Position position, String rawText) {

    public enum Kind {
        AMENDED("ändrad"),
        NEW_WORDING("ny_lydelse"),
        INTRODUCED("införd"),
        REPEALED("upphävd"),
        ENTRY_INTO_FORCE("ikraftträdande");

        private final String label;

        Kind(String label) { this.label = label; }

        /** Swedish label as used in amendment tables. */
        public String label() { return label; }
    }

    public enum Position { SUFFIX, INLINE, TRANSITION }
}
