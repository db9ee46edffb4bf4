package no.cantara.lagref;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertNotNull;

public final class Fixtures {

    private Fixtures() {}

    public static String read(String name) {
        try (InputStream is = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            assertNotNull(is, "fixture not found: " + name);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
