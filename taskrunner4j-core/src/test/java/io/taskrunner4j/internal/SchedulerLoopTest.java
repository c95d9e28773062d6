package io.taskrunner4j.internal;

import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static io.taskrunner4j.support.WaitUtils.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;

class SchedulerLoopTest {

    private final List<String> fired = new CopyOnWriteArrayList<>();
    private SchedulerLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.stop();
        }
    }

    @Test
    void intervalTaskShouldFireRepeatedly() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));

        loop.addOrReplace(task("t1", ScheduleSpec.every(Duration.ofMillis(200)), true));

        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> fired.size() >= 3)).isTrue();
        assertThat(fired).containsOnly("t1");
    }

    @Test
    void removedTaskShouldStopFiring() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));
        loop.addOrReplace(task("t1", ScheduleSpec.every(Duration.ofMillis(100)), true));
        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> !fired.isEmpty())).isTrue();

        loop.remove("t1").get(1, TimeUnit.SECONDS);
        int count = fired.size();
        Thread.sleep(400);

        assertThat(fired).hasSize(count);
        assertThat(loop.nextFireTime("t1").get(1, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void overdueOneTimeShouldFireOnceThenRetire() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));

        loop.addOrReplace(task("t1", ScheduleSpec.at(Instant.now().minus(Duration.ofHours(2))), true));

        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> fired.size() == 1)).isTrue();
        Thread.sleep(300);
        assertThat(fired).hasSize(1);
        assertThat(loop.nextFireTime("t1").get(1, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void overdueIntervalShouldFireOnceNotCatchUp() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));
        Instant lastFired = Instant.now().minus(Duration.ofMinutes(10));

        loop.addOrReplace(task("t1", ScheduleSpec.every(Duration.ofMinutes(1)), true).withLastFiredAt(lastFired));

        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> fired.size() == 1)).isTrue();
        Thread.sleep(300);
        assertThat(fired).hasSize(1);
        Optional<Instant> next = loop.nextFireTime("t1").get(1, TimeUnit.SECONDS);
        assertThat(next).isPresent();
        assertThat(next.get()).isAfter(Instant.now());
    }

    @Test
    void inactiveTaskShouldNotBeScheduled() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));

        loop.addOrReplace(task("t1", ScheduleSpec.every(Duration.ofMillis(50)), false));
        Thread.sleep(300);

        assertThat(fired).isEmpty();
        assertThat(loop.nextFireTime("t1").get(1, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void failingHandlerShouldNotStopTheLoop() throws Exception {
        loop = started((task, at) -> {
            fired.add(task.id());
            throw new IllegalStateException("boom");
        });

        loop.addOrReplace(task("t1", ScheduleSpec.every(Duration.ofMillis(100)), true));

        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> fired.size() >= 3)).isTrue();
    }

    @Test
    void cronTaskShouldBeArmedForItsNextOccurrence() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));

        loop.addOrReplace(task("t1", ScheduleSpec.cron("0 0 1 1 *", "UTC"), true));

        Optional<Instant> next = loop.nextFireTime("t1").get(1, TimeUnit.SECONDS);
        assertThat(next).isPresent();
        assertThat(next.get().toString()).endsWith("-01-01T00:00:00Z");
        assertThat(fired).isEmpty();
    }

    @Test
    void replacingTaskShouldUseNewSchedule() throws Exception {
        loop = started((task, at) -> fired.add(task.command()));
        loop.addOrReplace(task("t1", ScheduleSpec.cron("0 0 1 1 *", "UTC"), true));

        Task replaced = new Task("t1", "t1", null, "replaced", null, ScheduleSpec.every(Duration.ofMillis(100)),
                1, true, Instant.now(), Instant.now(), null);
        loop.addOrReplace(replaced);

        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> !fired.isEmpty())).isTrue();
        assertThat(fired).containsOnly("replaced");
    }

    @Test
    void restartedLoopShouldBeginWithEmptySchedule() throws Exception {
        loop = started((task, at) -> fired.add(task.id()));
        loop.addOrReplace(task("t1", ScheduleSpec.cron("0 3 * * *"), true));
        assertThat(loop.nextFireTime("t1").get(1, TimeUnit.SECONDS)).isPresent();

        loop.stop();
        assertThat(loop.isRunning()).isFalse();
        loop.start();

        assertThat(loop.nextFireTime("t1").get(1, TimeUnit.SECONDS)).isEmpty();
        loop.addOrReplace(task("t2", ScheduleSpec.every(Duration.ofMillis(100)), true));
        assertThat(waitUntil(3, TimeUnit.SECONDS, () -> fired.contains("t2"))).isTrue();
        assertThat(fired).doesNotContain("t1");
    }

    private static SchedulerLoop started(SchedulerLoop.FireHandler handler) {
        SchedulerLoop l = new SchedulerLoop(handler, Clock.systemUTC(), Duration.ofSeconds(1));
        l.start();
        return l;
    }

    private static Task task(String id, ScheduleSpec schedule, boolean active) {
        Instant now = Instant.now();
        return new Task(id, id, null, "cmd-" + id, null, schedule, 1, active, now, now, null);
    }
}
