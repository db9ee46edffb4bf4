package no.cantara.lagref.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open validity window {@code [from, to)}. An absent {@code from} means "since the
 * document's inception", an absent {@code to} means "still current".
 */
public record ValidityInterval(Optional<LocalDate> from, Optional<LocalDate> to) {

    public ValidityInterval {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isPresent() && to.isPresent() && !to.get().isAfter(from.get())) {
            throw new IllegalArgumentException("valid_to " + to.get() + " must be after valid_from " + from.get());
        }
    }

    public static ValidityInterval of(LocalDate from, LocalDate to) {
        return new ValidityInterval(Optional.ofNullable(from), Optional.ofNullable(to));
    }

    public boolean contains(LocalDate date) {
        Objects.requireNonNull(date, "date");
        boolean started = from.map(f -> !f.isAfter(date)).orElse(true);
        boolean notEnded = to.map(t -> t.isAfter(date)).orElse(true);
        return started && notEnded;
    }

    public boolean isOpenEnded() {
        return to.isEmpty();
    }
}
