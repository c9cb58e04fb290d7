package com.lux032.trackresolver.service;

import com.lux032.trackresolver.model.RunOutcome;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * 批处理的取消标志与截止时间
 * 在曲目之间和替换尝试之间检查,正在进行的请求不会被打断
 */
public class RunControl {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final LongSupplier clock;
    private final long deadline;
    private volatile boolean cancelled;

    public RunControl(LongSupplier clock, long deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * 不限时,只能手动取消
     */
    public static RunControl none() {
        return new RunControl(System::currentTimeMillis, NO_DEADLINE);
    }

    public static RunControl withTimeout(Duration timeout) {
        return withTimeout(timeout, System::currentTimeMillis);
    }

    public static RunControl withTimeout(Duration timeout, LongSupplier clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new RunControl(clock, NO_DEADLINE);
        }
        return new RunControl(clock, clock.getAsLong() + timeout.toMillis());
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isTimedOut() {
        return deadline != NO_DEADLINE && clock.getAsLong() >= deadline;
    }

    public boolean shouldStop() {
        return isCancelled() || isTimedOut();
    }

    /**
     * 停止原因,取消优先于超时
     */
    public RunOutcome stopOutcome() {
        if (isCancelled()) {
            return RunOutcome.CANCELLED;
        }
        return isTimedOut() ? RunOutcome.TIMED_OUT : RunOutcome.COMPLETED;
    }
}
