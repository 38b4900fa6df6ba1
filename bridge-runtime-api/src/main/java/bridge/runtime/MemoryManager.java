package bridge.runtime;

/**
 * 值的释放
 *
 * <p>转换中途产生、已被替代的中间值交由它释放。</p>
 */
@FunctionalInterface
public interface MemoryManager {

    /** 什么也不做的实现，适用于完全由 JVM 回收的值 */
    MemoryManager NO_OP = value -> { };

    void release(Object value);
}
