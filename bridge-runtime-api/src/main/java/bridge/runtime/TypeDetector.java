package bridge.runtime;

/**
 * 前端类型探测器
 *
 * <p>由动态语言前端实现，对每个实参给出运行时类型和辅助信息。
 * 逻辑上相同的类型必须返回同一个 {@link TypeOfArgument} 实例。</p>
 */
public interface TypeDetector {

    TypeOfArgument detectType(Object value);

    Insight detectInsight(Object value);
}
