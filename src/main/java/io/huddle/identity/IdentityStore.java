package io.huddle.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.huddle.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Remembers which instance the current session acts as, across CLI invocations.
 */
public final class IdentityStore {
    private final Path file;

    public IdentityStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void save(String instanceId, String project) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be blank");
        }
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("instance_id", instanceId);
        root.put("project", project == null ? "" : project);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Jsons.mapper().writeValue(file.toFile(), root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write identity file: " + file, e);
        }
    }

    public Optional<Identity> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            String id = root.path("instance_id").asText("").trim();
            if (id.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Identity(id, root.path("project").asText("")));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read identity file: " + file, e);
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove identity file: " + file, e);
        }
    }
}
