package com.craftsman.coordinator.tool;

/**
 * Identity and classification contract for an external tool operation.
 *
 * @param kind         The capability this operation requires; also its lookup key.
 * @param version      Semantic version of the collaborator.
 * @param description  One-sentence summary, surfaced in role summaries and logs.
 * @param idempotent   true if re-running the operation after a failure is safe;
 *                     only idempotent failures are eligible for router retries.
 * @param pathArgument Name of the argument holding the target path, checked
 *                     against the role's PathScope; null if the operation has none.
 */
public record ToolManifest(
        OperationKind kind,
        String        version,
        String        description,
        boolean       idempotent,
        String        pathArgument) {

    public static ToolManifest readOnly(OperationKind kind, String description) {
        return new ToolManifest(kind, "1.0.0", description, true, "path");
    }

    public static ToolManifest mutating(OperationKind kind, String description) {
        return new ToolManifest(kind, "1.0.0", description, false, "path");
    }
}
