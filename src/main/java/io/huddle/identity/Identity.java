package io.huddle.identity;

public record Identity(String instanceId, String project) {
}
