package bridge.runtime;

/**
 * 单步值转换
 *
 * <p>用于调用结束后对返回值做"出口"转换（edge conversion）。</p>
 */
@FunctionalInterface
public interface Conversion {

    /**
     * 转换一个值
     *
     * @param value 原始值
     * @return 转换后的新值
     */
    Object apply(Object value);

    /** 该转换的代价，默认视为精确匹配 */
    default Weight getWeight() {
        return Weight.ZERO;
    }
}
