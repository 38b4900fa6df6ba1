package bridge.runtime;

/**
 * 从某个实参类型到某个形参类型的转换链
 *
 * <p>由转换路由器给出，重载解析只通过 {@link #totalWeight(Insight)} 读取它的代价，
 * 选定候选后再通过 {@link #apply(Object, GarbageCollection)} 真正转换实参。</p>
 */
public interface ConversionRoute {

    /**
     * 在给定辅助信息下整条链的总代价
     */
    Weight totalWeight(Insight insight);

    /**
     * 沿转换链转换实参
     *
     * @param value 调用方传入的原始值
     * @param gc 本次调用的临时对象登记表，转换过程中产生的中间值登记到这里
     * @return 可直接传给原生函数的值
     */
    Object apply(Object value, GarbageCollection gc);
}
