package bridge.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单次调用的临时对象登记表
 *
 * <p>转换实参时产生的临时值登记在这里，调用结束（无论成功还是失败）时统一释放。
 * 只属于一次正在进行的调用，不可跨线程共享。</p>
 *
 * <pre>
 * try (GarbageCollection gc = new GarbageCollection(memoryManager)) {
 *     Object converted = route.apply(value, gc);
 *     ...
 * }
 * </pre>
 */
public final class GarbageCollection implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(GarbageCollection.class.getName());

    private final MemoryManager memoryManager;
    private final List<Object> temporaries = new ArrayList<>();

    public GarbageCollection(MemoryManager memoryManager) {
        this.memoryManager = memoryManager != null ? memoryManager : MemoryManager.NO_OP;
    }

    /**
     * 登记一个临时值
     *
     * @return 原样返回，便于链式使用
     */
    public <T> T add(T temporary) {
        if (temporary != null) {
            temporaries.add(temporary);
        }
        return temporary;
    }

    /** 尚未释放的临时值个数 */
    public int size() {
        return temporaries.size();
    }

    /**
     * 按登记的逆序释放全部临时值
     *
     * <p>某个值释放失败不影响其余值的释放；全部处理完后抛出第一个失败，
     * 后续失败作为 suppressed 附加。</p>
     */
    public void cleanUp() {
        RuntimeException failure = null;
        for (int i = temporaries.size() - 1; i >= 0; i--) {
            Object temporary = temporaries.get(i);
            try {
                memoryManager.release(temporary);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to release temporary: " + temporary, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        temporaries.clear();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() {
        cleanUp();
    }
}
