package no.cantara.lagref.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One provision (paragraf) of a statute as segmented from raw text.
 *
 * @param title heading line (rubrik) preceding the body, or {@code null}
 */
public record Provision(ProvisionRef ref, String title, String content) {

    public Provision {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(content, "content");
    }

    public String provisionRef() {
        return ref.key();
    }

    public Optional<String> chapter() {
        return ref.chapter();
    }

    public String section() {
        return ref.section();
    }

    public Optional<String> titleIfAny() {
        return Optional.ofNullable(title);
    }
}
