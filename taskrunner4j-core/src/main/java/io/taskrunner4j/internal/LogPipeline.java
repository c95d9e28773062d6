package io.taskrunner4j.internal;

import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.core.LogSubscription;
import io.taskrunner4j.spi.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Persists captured output and fans it out to live subscribers.
 *
 * <p>{@link #append} never blocks on storage: lines are numbered and queued under the execution's channel lock,
 * and a single writer thread persists them in batches. Subscribers replay stored history up to a recorded
 * sequence and then read live lines after it, so one subscription sees neither duplicates nor gaps at the seam.
 */
public final class LogPipeline {
    private static final Logger log = LoggerFactory.getLogger(LogPipeline.class);

    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final LogStore logStore;
    private final int subscriberBufferSize;
    private final int batchSize;

    private final ConcurrentHashMap<String, LogChannel> channels = new ConcurrentHashMap<>();
    private final BlockingQueue<LogLine> writeQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopping;
    private Thread writerThread;

    public LogPipeline(LogStore logStore, int subscriberBufferSize, int batchSize) {
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        if (subscriberBufferSize < 1) {
            throw new IllegalArgumentException("subscriberBufferSize must be at least 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.subscriberBufferSize = subscriberBufferSize;
        this.batchSize = batchSize;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        stopping = false;
        writerThread = new Thread(this::writeLoop);
        writerThread.setName("taskrunner.log-writer");
        writerThread.setDaemon(true);
        writerThread.start();
    }

    /**
     * Flush queued lines and stop the writer, waiting at most {@code timeout}.
     */
    public void stop(Duration timeout) {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        stopping = true;
        Thread t = writerThread;
        writerThread = null;
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("log writer did not finish within {}; {} lines not persisted", timeout, writeQueue.size());
            t.interrupt();
        }
    }

    /**
     * Prepare a channel for an execution about to produce output.
     */
    public void open(String executionId) {
        channels.putIfAbsent(executionId, new LogChannel(executionId));
    }

    /**
     * Number, queue for persistence and fan out one captured line.
     *
     * @return the line with its assigned sequence
     * @throws IllegalStateException if the execution has no open channel
     */
    public LogLine append(LogLine captured) {
        LogChannel channel = channels.get(captured.executionId());
        if (channel == null) {
            throw new IllegalStateException("no open log channel for execution " + captured.executionId());
        }
        return channel.append(captured, writeQueue::add);
    }

    /**
     * No more lines will be appended for this execution; live subscribers end after draining their buffer.
     */
    public void complete(String executionId) {
        LogChannel channel = channels.get(executionId);
        if (channel == null) {
            return;
        }
        channel.close();
        removeIfDrained(channel);
    }

    public boolean isOpen(String executionId) {
        return channels.containsKey(executionId);
    }

    public LogSubscription subscribe(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        BufferedLogSubscription subscription = new BufferedLogSubscription(executionId, subscriberBufferSize,
                this::unsubscribe);

        LogChannel channel = channels.get(executionId);
        if (channel == null) {
            subscription.end();
            subscription.replay(logStore.find(executionId, LogQuery.all()));
            return subscription;
        }

        LogChannel.Seam seam = channel.register(subscription);

        // a line up to the seam is either still unpersisted in the snapshot or already in the store
        TreeMap<Long, LogLine> history = new TreeMap<>();
        for (LogLine line : logStore.find(executionId, LogQuery.all())) {
            if (line.sequence() <= seam.sequence()) {
                history.put(line.sequence(), line);
            }
        }
        for (LogLine line : seam.unpersisted()) {
            if (line.sequence() <= seam.sequence()) {
                history.putIfAbsent(line.sequence(), line);
            }
        }
        subscription.replay(history.values());
        return subscription;
    }

    /**
     * Stored lines matching {@code query}. Waits briefly for queued lines of a live execution to be persisted.
     */
    public List<LogLine> history(String executionId, LogQuery query) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(query, "query must not be null");
        LogChannel channel = channels.get(executionId);
        if (channel != null) {
            try {
                if (!channel.awaitPersisted(TimeUnit.SECONDS.toMillis(5))) {
                    log.warn("log history for execution={} read before all queued lines were persisted", executionId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return logStore.find(executionId, query);
    }

    private void unsubscribe(BufferedLogSubscription subscription) {
        LogChannel channel = channels.get(subscription.executionId());
        if (channel != null) {
            channel.unregister(subscription);
        }
    }

    private void writeLoop() {
        while (!stopping || !writeQueue.isEmpty()) {
            LogLine first;
            try {
                first = writeQueue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (first == null) {
                continue;
            }
            List<LogLine> batch = new ArrayList<>(Math.min(batchSize, 256));
            batch.add(first);
            writeQueue.drainTo(batch, batchSize - 1);
            persist(batch);
        }
    }

    private void persist(List<LogLine> batch) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                logStore.appendAll(batch);
                break;
            } catch (Exception e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    log.error("log write failed permanently lines={} msg={}", batch.size(), e.getMessage(), e);
                    break;
                }
                log.warn("log write failed attempt={} lines={} msg={}", attempt, batch.size(), e.getMessage());
                try {
                    Thread.sleep(backoff(attempt).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        Map<String, Long> highest = new LinkedHashMap<>();
        for (LogLine line : batch) {
            highest.merge(line.executionId(), line.sequence(), Math::max);
        }
        highest.forEach((executionId, sequence) -> {
            LogChannel channel = channels.get(executionId);
            if (channel != null) {
                channel.markPersisted(sequence);
                removeIfDrained(channel);
            }
        });
    }

    private void removeIfDrained(LogChannel channel) {
        if (channel.isDrained()) {
            channels.remove(channel.executionId(), channel);
        }
    }

    // Exponential backoff for repeated store failures.
    private static Duration backoff(int attempt) {
        int exp = Math.max(0, Math.min(attempt - 1, 10));
        return Duration.ofMillis(Math.min(100L * (1L << exp), 5_000L));
    }
}
