package bridge.runtime.dispatch;

import bridge.runtime.Insight;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.TypeRegistry;
import bridge.runtime.dispatch.cache.CacheStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OverloadCache 单元测试
 */
class OverloadCacheTest {

    private OverloadCache cache;
    private OverloadedSet set;
    private TypeOfArgument[] types;
    private Insight[] insights;

    @BeforeEach
    void setUp() {
        TypeRegistry registry = new TypeRegistry();
        cache = new OverloadCache(64);
        set = new OverloadedSet(DispatchContext.builder()
                .detector(new ClassTypeDetector(registry))
                .router(new FakeConversionRouter())
                .cache(cache)
                .build());
        types = new TypeOfArgument[]{registry.intern("int"), registry.intern("string")};
        insights = new Insight[]{Insight.of(4), Insight.NONE};
    }

    @Test
    @DisplayName("未记录时返回 MISSED")
    void testMiss() {
        assertEquals(OverloadCache.MISSED, cache.recall(set, 2, types, insights));
    }

    @Test
    @DisplayName("记录后可以取回候选下标")
    void testRememberRecall() {
        cache.remember(set, 2, types, insights, 3);
        assertEquals(3, cache.recall(set, 2, types, insights));
        assertEquals(1L, cache.size());
    }

    @Test
    @DisplayName("记录后修改调用方数组不影响已存的键")
    void testCallerArraysNotAliased() {
        cache.remember(set, 2, types, insights, 1);
        TypeOfArgument[] reused = types.clone();
        Insight[] reusedInsights = insights.clone();
        types[1] = types[0];
        insights[0] = Insight.of(40);

        assertEquals(1, cache.recall(set, 2, reused, reusedInsights));
        assertEquals(OverloadCache.MISSED, cache.recall(set, 2, types, insights));
    }

    @Test
    @DisplayName("flush 丢弃全部条目并推进代数")
    void testFlush() {
        cache.remember(set, 2, types, insights, 0);
        long before = cache.generation();

        cache.flush();
        assertEquals(OverloadCache.MISSED, cache.recall(set, 2, types, insights));
        assertEquals(0L, cache.size());
        assertEquals(before + 1, cache.generation());
    }

    @Test
    @DisplayName("刷新之前开始的决议不会在刷新之后写回")
    void testGenerationGuard() {
        long observed = cache.generation();
        cache.flush();

        assertFalse(cache.remember(observed, set, 2, types, insights, 0));
        assertEquals(OverloadCache.MISSED, cache.recall(set, 2, types, insights));
        assertTrue(cache.remember(cache.generation(), set, 2, types, insights, 0));
    }

    @Test
    @DisplayName("拒绝负的候选下标")
    void testNegativeIndex() {
        assertThrows(IllegalArgumentException.class,
                () -> cache.remember(set, 2, types, insights, OverloadCache.MISSED));
    }

    @Test
    @DisplayName("统计命中与未命中")
    void testStats() {
        cache.recall(set, 2, types, insights);
        cache.remember(set, 2, types, insights, 0);
        cache.recall(set, 2, types, insights);

        CacheStats stats = cache.getStats();
        assertEquals(1L, stats.getHitCount());
        assertEquals(1L, stats.getMissCount());
        assertEquals(0.5, stats.getHitRate(), 0.01);
        assertEquals(64L, stats.getMaximumSize());
    }

    @Test
    @DisplayName("进程级共享缓存只有一个实例")
    void testShared() {
        assertSame(OverloadCache.shared(), OverloadCache.shared());
    }
}
