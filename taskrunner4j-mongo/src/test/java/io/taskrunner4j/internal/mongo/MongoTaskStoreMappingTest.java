package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MongoTaskStoreMappingTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void subMillisecondIntervalShouldSurviveMapping() {
        Task task = Task.from(new TaskDefinition("fast", null, "true", null,
                ScheduleSpec.every(Duration.ofNanos(1_500_500)), 1, true), T0).withId("t1");

        TaskDocument doc = MongoTaskStore.toDocument(task);

        assertEquals("PT0.0015005S", doc.getInterval());
        assertEquals(task, MongoTaskStore.toTask(doc));
    }

    @Test
    void intervalDocumentWithoutPeriodShouldBeReported() {
        Task task = Task.from(new TaskDefinition("broken", null, "true", null,
                ScheduleSpec.every(Duration.ofMinutes(5)), 1, true), T0).withId("t2");
        TaskDocument doc = MongoTaskStore.toDocument(task);
        doc.setInterval(null);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> MongoTaskStore.toTask(doc));
        assertEquals("task t2 of type INTERVAL is missing interval", ex.getMessage());
    }
}
