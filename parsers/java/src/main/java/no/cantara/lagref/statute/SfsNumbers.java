package no.cantara.lagref.statute;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for SFS numbers ({@code yyyy:nnn}).
 */
public final class SfsNumbers {

    private static final Pattern EXACT = Pattern.compile("^\\d{4}:\\d+$");
    private static final Pattern EMBEDDED = Pattern.compile("(\\d{4}:\\d+)");

    private SfsNumbers() {}

    public static boolean isValid(String sfs) {
        return sfs != null && EXACT.matcher(sfs).matches();
    }

    /** Pulls the first SFS number out of e.g. {@code "SFS 2018:218 "}. */
    public static Optional<String> normalize(String sfs) {
        if (sfs == null) return Optional.empty();
        Matcher m = EMBEDDED.matcher(sfs);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
