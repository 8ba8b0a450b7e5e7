package com.minisessiondb.storage.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MaintenanceTicker - 周期性维护任务调度
 *
 * 不持有线程和定时器,由调用方的运行循环驱动:
 * <pre>
 * MaintenanceTicker ticker = manager.maintenanceTicker();
 * while (running) {
 *     ticker.tick(clock.millis());
 *     Thread.sleep(60_000);
 * }
 * </pre>
 *
 * 规则:
 * - 任务首次tick时即到期(lastRun未设置)
 * - 同一次tick中按注册顺序执行
 * - 任务抛出异常只记录日志,不影响其他任务,下次照常调度
 */
public class MaintenanceTicker {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceTicker.class);

    /** 维护任务 */
    @FunctionalInterface
    public interface Task {
        void run(long now) throws Exception;
    }

    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();

    /**
     * 注册任务,同名任务会被替换
     */
    public synchronized void register(String name, Duration interval, Task task) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        tasks.put(name, new ScheduledTask(name, interval.toMillis(), task));
        logger.debug("注册维护任务: {} (间隔 {})", name, interval);
    }

    public synchronized boolean unregister(String name) {
        return tasks.remove(name) != null;
    }

    public synchronized List<String> getTaskNames() {
        return new ArrayList<>(tasks.keySet());
    }

    /**
     * 执行所有到期的任务
     *
     * @param now 当前时间(毫秒)
     * @return 本次实际执行的任务名
     */
    public synchronized List<String> tick(long now) {
        List<String> executed = new ArrayList<>();
        for (ScheduledTask scheduled : tasks.values()) {
            if (!scheduled.isDue(now)) {
                continue;
            }
            scheduled.lastRun = now;
            executed.add(scheduled.name);
            try {
                scheduled.task.run(now);
            } catch (Exception e) {
                logger.warn("维护任务 {} 执行失败: {}", scheduled.name, e.getMessage(), e);
            }
        }
        return executed;
    }

    /**
     * 任务下次到期时间,从未执行过返回 Long.MIN_VALUE
     */
    public synchronized long nextDue(String name) {
        ScheduledTask scheduled = tasks.get(name);
        if (scheduled == null) {
            throw new IllegalArgumentException("Unknown maintenance task: " + name);
        }
        return scheduled.lastRun == null ? Long.MIN_VALUE : scheduled.lastRun + scheduled.intervalMillis;
    }

    private static final class ScheduledTask {
        private final String name;
        private final long intervalMillis;
        private final Task task;
        private Long lastRun;

        private ScheduledTask(String name, long intervalMillis, Task task) {
            this.name = name;
            this.intervalMillis = intervalMillis;
            this.task = task;
        }

        private boolean isDue(long now) {
            return lastRun == null || now - lastRun >= intervalMillis;
        }
    }
}
