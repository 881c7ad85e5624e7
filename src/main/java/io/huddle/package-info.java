/**
 * Huddle source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.huddle.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.huddle.cli.HuddleCommand} maps commands to runtime operations and applies the gate.</li>
 *   <li>{@code io.huddle.runtime.HuddleRuntime} runs one operation per invocation and writes the audit trail.</li>
 *   <li>{@code io.huddle.storage.TaskStore} holds the conditional-update claim protocol.</li>
 * </ul>
 */
package io.huddle;
