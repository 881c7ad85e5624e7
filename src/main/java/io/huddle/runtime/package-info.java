/**
 * Coordination operations.
 *
 * <p>{@link io.huddle.runtime.HuddleRuntime} is the single entry point used by the CLI: it resolves the
 * caller's identity, runs one focused store operation, applies the presence side effects that follow a
 * claim or completion, and writes the audit trail.
 */
package io.huddle.runtime;
