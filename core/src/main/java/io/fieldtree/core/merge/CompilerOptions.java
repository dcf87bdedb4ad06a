package io.fieldtree.core.merge;

import java.util.Map;
import java.util.Objects;

/**
 * Knobs of the tree compiler.
 *
 * Supports:
 *  - addTypename:            prepend {@code __typename} to polymorphic selections that lack it,
 *                            so every polymorphic value carries its discriminator
 *  - warnOnDeprecatedUsages: log a warning for each selected deprecated field
 *  - failOnWarnings:         turn any warning into a compile failure
 *  - deferDirectiveName:     name of the directive that marks deferred delivery
 *  - customScalarsMapping:   custom scalar name -> Java class name, consumed by the codec
 */
public record CompilerOptions(
        boolean addTypename,
        boolean warnOnDeprecatedUsages,
        boolean failOnWarnings,
        String deferDirectiveName,
        Map<String, String> customScalarsMapping
) {
    public CompilerOptions {
        Objects.requireNonNull(deferDirectiveName, "deferDirectiveName");
        if (deferDirectiveName.isBlank()) throw new IllegalArgumentException("deferDirectiveName must not be blank");
        customScalarsMapping = Map.copyOf(customScalarsMapping == null ? Map.of() : customScalarsMapping);
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, true, false, "defer", Map.of());
    }

    public CompilerOptions withAddTypename(boolean value) {
        return new CompilerOptions(value, warnOnDeprecatedUsages, failOnWarnings, deferDirectiveName, customScalarsMapping);
    }

    public CompilerOptions withFailOnWarnings(boolean value) {
        return new CompilerOptions(addTypename, warnOnDeprecatedUsages, value, deferDirectiveName, customScalarsMapping);
    }
}
