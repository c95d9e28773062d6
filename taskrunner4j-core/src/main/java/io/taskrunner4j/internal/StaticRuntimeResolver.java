package io.taskrunner4j.internal;

import io.taskrunner4j.config.TaskRunnerProperties;
import io.taskrunner4j.spi.ResolvedRuntime;
import io.taskrunner4j.spi.RuntimeResolver;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RuntimeResolver} over a fixed table, by default the {@code taskrunner.runtimes} settings.
 */
public final class StaticRuntimeResolver implements RuntimeResolver {

    private final Map<String, ResolvedRuntime> runtimes;

    public StaticRuntimeResolver(Map<String, ResolvedRuntime> runtimes) {
        this.runtimes = Map.copyOf(Objects.requireNonNull(runtimes, "runtimes must not be null"));
    }

    public static StaticRuntimeResolver fromProperties(TaskRunnerProperties props) {
        Map<String, ResolvedRuntime> table = new LinkedHashMap<>();
        props.getRuntimes().forEach((ref, rt) -> {
            if (rt == null || rt.getBinDir() == null || rt.getBinDir().isBlank()) {
                throw new IllegalArgumentException("taskrunner.runtimes." + ref + ".binDir must not be blank");
            }
            Path workingDir = rt.getWorkingDir() == null || rt.getWorkingDir().isBlank()
                    ? null
                    : Path.of(rt.getWorkingDir());
            table.put(ref, new ResolvedRuntime(Path.of(rt.getBinDir()), workingDir));
        });
        return new StaticRuntimeResolver(table);
    }

    @Override
    public ResolvedRuntime resolve(String runtimeRef) {
        ResolvedRuntime runtime = runtimes.get(runtimeRef);
        if (runtime == null) {
            throw new IllegalArgumentException("unknown runtime: " + runtimeRef);
        }
        return runtime;
    }
}
