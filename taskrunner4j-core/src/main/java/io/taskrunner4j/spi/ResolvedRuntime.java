package io.taskrunner4j.spi;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a command runs: {@code binDir} is prefixed to the child's PATH, {@code workingDir} (nullable) becomes
 * its working directory.
 */
public record ResolvedRuntime(Path binDir, Path workingDir) {
    public ResolvedRuntime {
        Objects.requireNonNull(binDir, "binDir must not be null");
    }
}
