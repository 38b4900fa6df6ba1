package bridge.runtime.dispatch;

import bridge.runtime.ConversionRouter;
import bridge.runtime.MemoryManager;
import bridge.runtime.TypeDetector;

/**
 * 分派所需协作者的不可变组合
 *
 * <p>使用示例：</p>
 * <pre>
 * DispatchContext context = DispatchContext.builder()
 *     .detector(frontend)
 *     .router(conversionTable)
 *     .memoryManager(memoryManager)
 *     .cacheMaximumSize(1024)
 *     .build();
 * OverloadedSet set = new OverloadedSet(context);
 * </pre>
 *
 * <p>用同一个上下文创建的集合共享同一个 {@link OverloadCache}。</p>
 */
public final class DispatchContext {

    private final TypeDetector detector;
    private final ConversionRouter router;
    private final MemoryManager memoryManager;
    private final OverloadCache cache;

    private DispatchContext(Builder builder) {
        this.detector = builder.detector;
        this.router = builder.router;
        this.memoryManager = builder.memoryManager;
        this.cache = builder.cache != null ? builder.cache : new OverloadCache(builder.cacheMaximumSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TypeDetector getDetector() {
        return detector;
    }

    public ConversionRouter getRouter() {
        return router;
    }

    public MemoryManager getMemoryManager() {
        return memoryManager;
    }

    public OverloadCache getCache() {
        return cache;
    }

    /**
     * 复制当前配置到新的构建器（缓存实例保持共享）
     */
    public Builder toBuilder() {
        return new Builder()
                .detector(detector)
                .router(router)
                .memoryManager(memoryManager)
                .cache(cache);
    }

    // ============ Builder ============

    public static final class Builder {
        private TypeDetector detector;
        private ConversionRouter router;
        private MemoryManager memoryManager = MemoryManager.NO_OP;
        private OverloadCache cache;
        private long cacheMaximumSize = OverloadCache.DEFAULT_MAXIMUM_SIZE;

        private Builder() {}

        public Builder detector(TypeDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder router(ConversionRouter router) {
            this.router = router;
            return this;
        }

        public Builder memoryManager(MemoryManager memoryManager) {
            this.memoryManager = memoryManager != null ? memoryManager : MemoryManager.NO_OP;
            return this;
        }

        /** 使用指定的缓存实例，优先于 {@link #cacheMaximumSize(long)} */
        public Builder cache(OverloadCache cache) {
            this.cache = cache;
            return this;
        }

        /** 使用进程级共享缓存 */
        public Builder sharedCache() {
            return cache(OverloadCache.shared());
        }

        public Builder cacheMaximumSize(long maximumSize) {
            if (maximumSize <= 0) {
                throw new IllegalArgumentException("cache maximum size must be positive: " + maximumSize);
            }
            this.cacheMaximumSize = maximumSize;
            return this;
        }

        public DispatchContext build() {
            if (detector == null) {
                throw new IllegalStateException("type detector is required");
            }
            if (router == null) {
                throw new IllegalStateException("conversion router is required");
            }
            return new DispatchContext(this);
        }
    }
}
