package io.taskrunner4j.spi;

public interface RuntimeResolver {

    /**
     * Resolve an opaque runtime handle.
     *
     * @throws IllegalArgumentException if {@code runtimeRef} is unknown
     */
    ResolvedRuntime resolve(String runtimeRef);
}
