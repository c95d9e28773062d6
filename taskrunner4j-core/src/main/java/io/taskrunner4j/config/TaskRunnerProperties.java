package io.taskrunner4j.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime configuration for the task engine.
 */
public class TaskRunnerProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private List<String> shell = defaultShell();
    private Duration defaultGracePeriod = Duration.ofSeconds(5);
    private Duration killTimeout = Duration.ofSeconds(5);
    private Duration outputDrainTimeout = Duration.ofSeconds(2);
    private Duration misfireThreshold = Duration.ofMinutes(1);
    private int subscriberBufferSize = 1000;
    private int logBatchSize = 200;
    private String logCharset = StandardCharsets.UTF_8.name();
    private boolean terminateOnShutdown = true;
    private boolean ensureIndexesOnStartup = false;
    private Map<String, Runtime> runtimes = new LinkedHashMap<>();

    /**
     * Fail fast on settings the engine cannot run with.
     */
    public void validate() {
        if (shell == null || shell.isEmpty() || shell.stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new IllegalArgumentException("taskrunner.shell must not be empty");
        }
        requirePositive(defaultGracePeriod, "taskrunner.defaultGracePeriod");
        requirePositive(killTimeout, "taskrunner.killTimeout");
        requirePositive(outputDrainTimeout, "taskrunner.outputDrainTimeout");
        requirePositive(misfireThreshold, "taskrunner.misfireThreshold");
        if (subscriberBufferSize < 1) {
            throw new IllegalArgumentException("taskrunner.subscriberBufferSize must be at least 1");
        }
        if (logBatchSize < 1) {
            throw new IllegalArgumentException("taskrunner.logBatchSize must be at least 1");
        }
        charset();
    }

    public Charset charset() {
        try {
            return Charset.forName(logCharset);
        } catch (Exception ex) {
            throw new IllegalArgumentException("taskrunner.logCharset is not supported: " + logCharset);
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private static List<String> defaultShell() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") ? List.of("cmd.exe", "/c") : List.of("/bin/sh", "-c");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public List<String> getShell() {
        return shell;
    }

    public void setShell(List<String> shell) {
        this.shell = shell;
    }

    public Duration getDefaultGracePeriod() {
        return defaultGracePeriod;
    }

    public void setDefaultGracePeriod(Duration defaultGracePeriod) {
        this.defaultGracePeriod = defaultGracePeriod;
    }

    public Duration getKillTimeout() {
        return killTimeout;
    }

    public void setKillTimeout(Duration killTimeout) {
        this.killTimeout = killTimeout;
    }

    public Duration getOutputDrainTimeout() {
        return outputDrainTimeout;
    }

    public void setOutputDrainTimeout(Duration outputDrainTimeout) {
        this.outputDrainTimeout = outputDrainTimeout;
    }

    public Duration getMisfireThreshold() {
        return misfireThreshold;
    }

    public void setMisfireThreshold(Duration misfireThreshold) {
        this.misfireThreshold = misfireThreshold;
    }

    public int getSubscriberBufferSize() {
        return subscriberBufferSize;
    }

    public void setSubscriberBufferSize(int subscriberBufferSize) {
        this.subscriberBufferSize = subscriberBufferSize;
    }

    public int getLogBatchSize() {
        return logBatchSize;
    }

    public void setLogBatchSize(int logBatchSize) {
        this.logBatchSize = logBatchSize;
    }

    public String getLogCharset() {
        return logCharset;
    }

    public void setLogCharset(String logCharset) {
        this.logCharset = logCharset;
    }

    public boolean isTerminateOnShutdown() {
        return terminateOnShutdown;
    }

    public void setTerminateOnShutdown(boolean terminateOnShutdown) {
        this.terminateOnShutdown = terminateOnShutdown;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Map<String, Runtime> getRuntimes() {
        return runtimes;
    }

    public void setRuntimes(Map<String, Runtime> runtimes) {
        this.runtimes = runtimes;
    }

    /**
     * Static mapping for one runtime handle.
     */
    public static class Runtime {
        private String binDir;
        private String workingDir;

        public String getBinDir() {
            return binDir;
        }

        public void setBinDir(String binDir) {
            this.binDir = binDir;
        }

        public String getWorkingDir() {
            return workingDir;
        }

        public void setWorkingDir(String workingDir) {
            this.workingDir = workingDir;
        }
    }
}
