package bridge.runtime;

import java.util.List;

/**
 * 转换路由器
 *
 * <p>在转换图中为每个实参寻找到对应形参的最便宜转换链。转换图本身由实现方定义。</p>
 */
public interface ConversionRouter {

    /**
     * 为整组实参寻找到目标签名的最佳路线
     *
     * @param actualTypes 实参类型（驻留后的描述符）
     * @param insights 与实参一一对应的辅助信息
     * @param signature 候选函数的形参类型
     * @return 找到时每个实参一条路线；任一实参无可用转换时返回 {@link RouteResult#none(String)}
     */
    RouteResult bestSequenceRoute(List<TypeOfArgument> actualTypes, List<Insight> insights,
                                  List<TypeOfArgument> signature);

    /**
     * 返回值类型对应的出口转换
     *
     * @return 不需要转换时返回 null
     */
    Conversion edgeConversion(TypeOfArgument returnType);
}
