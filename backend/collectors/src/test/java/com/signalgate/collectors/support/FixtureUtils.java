package com.signalgate.collectors.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FixtureUtils {
    private FixtureUtils() {
    }

    public static Path fixturePath(String relativePath) {
        URL resource = FixtureUtils.class.getClassLoader().getResource(relativePath);
        if (resource == null) {
            throw new IllegalArgumentException("Fixture not found: " + relativePath);
        }
        try {
            return Path.of(resource.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid fixture URI: " + relativePath, e);
        }
    }

    public static String readFixture(String relativePath) {
        try {
            return Files.readString(fixturePath(relativePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read fixture " + relativePath, e);
        }
    }
}
