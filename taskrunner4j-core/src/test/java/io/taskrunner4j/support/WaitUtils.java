package io.taskrunner4j.support;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

public final class WaitUtils {

    private WaitUtils() {
    }

    public static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }
}
