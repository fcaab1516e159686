package io.surfworks.todome.resolve;

/**
 * A task node together with its effective attributes.
 */
public record ResolvedTask(int nodeId, int line, String body, ResolvedAttributes attributes) {
}
