package bridge.runtime.dispatch.cache;

/**
 * 有界缓存接口
 *
 * <p>重载决议缓存的存储抽象。条目可能因容量被淘汰，
 * 调用方只能把它当作优化，不能依赖某个条目一直存在。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 读取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 写入缓存（覆盖同键旧值）
     */
    void put(K key, V value);

    /**
     * 当前条目数（估计值）
     */
    long size();

    /**
     * 丢弃全部条目
     */
    void clear();

    /**
     * 命中/未命中等统计
     */
    CacheStats getStats();
}
