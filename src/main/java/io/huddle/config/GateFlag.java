package io.huddle.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persisted on/off switch. The file holds {@code 1} when enabled; anything else means disabled.
 */
public final class GateFlag {
    private GateFlag() {
    }

    public static boolean read(Path flagFile) {
        if (flagFile == null || !Files.isRegularFile(flagFile)) {
            return false;
        }
        try {
            return "1".equals(Files.readString(flagFile, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read gate flag file: " + flagFile, e);
        }
    }

    public static void write(Path flagFile, boolean enabled) {
        try {
            Path parent = flagFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(flagFile, enabled ? "1" : "0", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write gate flag file: " + flagFile, e);
        }
    }
}
