package com.minisessiondb.storage.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MaintenanceTicker测试
 */
@DisplayName("MaintenanceTicker - 维护任务调度测试")
class MaintenanceTickerTest {

    private MaintenanceTicker ticker;

    private List<String> runs;

    @BeforeEach
    void setUp() {
        ticker = new MaintenanceTicker();
        runs = new ArrayList<>();
    }

    @Test
    @DisplayName("首次tick时所有任务到期,按注册顺序执行")
    void testFirstTickRunsAll() {
        ticker.register("a", Duration.ofMinutes(10), now -> runs.add("a@" + now));
        ticker.register("b", Duration.ofMinutes(1), now -> runs.add("b@" + now));

        assertEquals(List.of("a", "b"), ticker.tick(1000));
        assertEquals(List.of("a@1000", "b@1000"), runs);
    }

    @Test
    @DisplayName("未到间隔的任务不执行")
    void testIntervalRespected() {
        ticker.register("fast", Duration.ofMillis(100), now -> runs.add("fast"));
        ticker.register("slow", Duration.ofMillis(1000), now -> runs.add("slow"));

        ticker.tick(0);
        assertEquals(List.of("fast"), ticker.tick(100));
        assertTrue(ticker.tick(150).isEmpty());
        assertEquals(List.of("fast", "slow"), ticker.tick(1000));
        assertEquals(1000 + 1000, ticker.nextDue("slow"));
    }

    @Test
    @DisplayName("任务异常不影响其他任务,下次照常调度")
    void testFailingTaskIsolated() {
        ticker.register("broken", Duration.ofMillis(10), now -> {
            throw new IllegalStateException("boom");
        });
        ticker.register("ok", Duration.ofMillis(10), now -> runs.add("ok"));

        assertEquals(List.of("broken", "ok"), ticker.tick(0));
        assertEquals(List.of("broken", "ok"), ticker.tick(10));
        assertEquals(2, runs.size());
    }

    @Test
    @DisplayName("注册校验、替换和注销")
    void testRegistration() {
        assertThrows(IllegalArgumentException.class, () -> ticker.register("x", Duration.ZERO, now -> { }));

        ticker.register("x", Duration.ofMillis(10), now -> runs.add("first"));
        ticker.register("x", Duration.ofMillis(10), now -> runs.add("second"));
        assertEquals(List.of("x"), ticker.getTaskNames());
        assertEquals(Long.MIN_VALUE, ticker.nextDue("x"));

        ticker.tick(0);
        assertEquals(List.of("second"), runs);

        assertTrue(ticker.unregister("x"));
        assertFalse(ticker.unregister("x"));
        assertThrows(IllegalArgumentException.class, () -> ticker.nextDue("x"));
    }
}
