package bridge.runtime.dispatch;

import bridge.runtime.Insight;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.dispatch.cache.BoundedCache;
import bridge.runtime.dispatch.cache.CacheStats;
import bridge.runtime.dispatch.cache.CaffeineCache;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 重载决议缓存
 *
 * <p>对"某个集合 + 某种实参形态"记住上次选中的候选下标，
 * 下一次相同形态的调用就不必再遍历全部候选。它只是优化：
 * 命中后仍会针对当前实参重新计算转换路线。</p>
 *
 * <p>一个实例可被任意多个 {@link OverloadedSet} 共享，键中包含集合本身，
 * 因此一次 {@link #flush()} 就能清空所有集合的决议。</p>
 *
 * <p>线程安全：存储由 Caffeine 保证并发安全；{@code remember} 与 {@code flush}
 * 之间用读写锁和代数计数协调，在刷新之前开始的决议不会在刷新之后被写回。</p>
 */
public final class OverloadCache {

    private static final Logger LOG = Logger.getLogger(OverloadCache.class.getName());

    /** recall 未命中 */
    public static final int MISSED = -1;

    /** 默认容量 */
    public static final long DEFAULT_MAXIMUM_SIZE = 4096;

    private static volatile OverloadCache shared;

    private final BoundedCache<CacheKey, Integer> store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong generation = new AtomicLong();

    public OverloadCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public OverloadCache(long maximumSize) {
        this(new CaffeineCache<CacheKey, Integer>(maximumSize));
    }

    OverloadCache(BoundedCache<CacheKey, Integer> store) {
        this.store = store;
    }

    /**
     * 进程级共享缓存，首次使用时创建
     */
    public static OverloadCache shared() {
        OverloadCache cache = shared;
        if (cache == null) {
            synchronized (OverloadCache.class) {
                cache = shared;
                if (cache == null) {
                    cache = new OverloadCache();
                    shared = cache;
                }
            }
        }
        return cache;
    }

    // ============ 查找 / 记录 ============

    /**
     * 查找之前为该调用形态选中的候选下标
     *
     * @return 候选下标，未命中返回 {@link #MISSED}
     */
    public int recall(OverloadedSet set, int nargs, TypeOfArgument[] types, Insight[] insights) {
        Integer chosen = store.get(CacheKey.probe(set, nargs, types, insights));
        return chosen != null ? chosen : MISSED;
    }

    /**
     * 记录选中的候选下标；键数据被复制，调用方之后可以随意复用自己的数组
     */
    public void remember(OverloadedSet set, int nargs, TypeOfArgument[] types, Insight[] insights,
                         int chosenAlternative) {
        remember(generation(), set, nargs, types, insights, chosenAlternative);
    }

    /**
     * 仅当缓存自 {@code observedGeneration} 以来没有被刷新过时才记录
     *
     * @param observedGeneration 决议开始前通过 {@link #generation()} 读到的代数
     * @return 是否真的写入
     */
    public boolean remember(long observedGeneration, OverloadedSet set, int nargs,
                            TypeOfArgument[] types, Insight[] insights, int chosenAlternative) {
        if (chosenAlternative < 0) {
            throw new IllegalArgumentException("invalid alternative index: " + chosenAlternative);
        }
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            if (observedGeneration != generation.get()) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Discarding resolution from before flush: set#" + set.getId());
                }
                return false;
            }
            store.put(CacheKey.owned(set, nargs, types, insights), chosenAlternative);
            return true;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 丢弃全部条目
     */
    public void flush() {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            generation.incrementAndGet();
            store.clear();
        } finally {
            writeLock.unlock();
        }
        LOG.fine("Overload cache flushed");
    }

    // ============ 状态 ============

    /** 当前代数，每次 flush 加一 */
    public long generation() {
        return generation.get();
    }

    public long size() {
        return store.size();
    }

    public CacheStats getStats() {
        return store.getStats();
    }

    @Override
    public String toString() {
        return "OverloadCache(" + getStats() + ")";
    }
}
