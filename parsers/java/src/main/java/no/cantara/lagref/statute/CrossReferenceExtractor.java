package no.cantara.lagref.statute;

import no.cantara.lagref.model.ProvisionRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds references to other statutes ({@code "lagen (2018:218)"}) and to provisions of the same
 * statute ({@code "3 kap. 5 §"}) in provision text.
 *
 * <p>Output order is fixed: every SFS reference in text order, then every provision reference
 * in text order. Each distinct target is reported once.
 */
public final class CrossReferenceExtractor {

    private static final Pattern SFS_REF_PATTERN = Pattern.compile("\\((\\d{4}:\\d+)\\)");
    private static final Pattern PROVISION_REF_PATTERN =
            Pattern.compile("(\\d+)\\s*kap\\.\\s*(\\d+\\s*[a-z]?)\\s*§");

    private CrossReferenceExtractor() {}

    public static List<ExtractedReference> extract(String text) {
        Objects.requireNonNull(text, "text");
        List<ExtractedReference> refs = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        Matcher sfs = SFS_REF_PATTERN.matcher(text);
        while (sfs.find()) {
            if (seen.add("sfs:" + sfs.group(1))) {
                refs.add(new ExtractedReference.StatuteReference(sfs.group(1), sfs.group()));
            }
        }

        Matcher provision = PROVISION_REF_PATTERN.matcher(text);
        while (provision.find()) {
            ProvisionRef target = ProvisionRef.of(provision.group(1), provision.group(2));
            if (seen.add("prov:" + target.key())) {
                refs.add(new ExtractedReference.ProvisionReference(target, provision.group()));
            }
        }

        return List.copyOf(refs);
    }
}
