/**
 * CancellableTimer.java
 *
 * 可取消、只触发一次的延迟任务，用于尾部防抖：每次 arm 都会取消前一次尚未触发的任务。
 * 每次 arm 对应一个代号，触发时代号已经过期的任务不会执行动作，
 * 因此即使已经开始执行的 tick 与 cancel 并发，被取消的动作也不会生效。
 * 动作在计时器锁内执行，cancel 返回时不会再有动作在运行。
 */
package club.ppmc.testrunner.service.watcher;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CancellableTimer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CancellableTimer.class);

    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();
    private long generation;
    private ScheduledFuture<?> pending;

    public CancellableTimer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void arm(long delayMillis, Runnable action) {
        synchronized (lock) {
            cancelPending();
            long armedGeneration = generation;
            pending = scheduler.schedule(() -> fire(armedGeneration, action), delayMillis, TimeUnit.MILLISECONDS);
        }
    }

    public void cancel() {
        synchronized (lock) {
            cancelPending();
        }
    }

    public boolean isArmed() {
        synchronized (lock) {
            return pending != null;
        }
    }

    private void cancelPending() {
        generation++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire(long armedGeneration, Runnable action) {
        synchronized (lock) {
            if (armedGeneration != generation) {
                return;
            }
            pending = null;
            generation++;
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.error("防抖任务执行失败", e);
            }
        }
    }
}
