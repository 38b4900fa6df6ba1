package bridge.runtime.dispatch;

import bridge.runtime.Alternative;
import bridge.runtime.ConversionRoute;
import bridge.runtime.Insight;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.Weight;

import java.util.Arrays;
import java.util.List;

/**
 * 重载候选之间的代价比较
 *
 * <p>实参列表的代价是逐位置比较的向量，而不是求和后的标量：
 * 只要有一个位置不可转换，其余位置再便宜也无济于事。
 * 比较在存在歧义时不满足传递性，所以解析过程只保留一个"当前最优"加一个歧义标记。</p>
 */
final class ResolutionComparator {

    private ResolutionComparator() {}

    /**
     * 比较新候选的转换路线与已知最优代价
     *
     * @param known 已知最优候选的代价，每个实参一个
     * @param suggested 新候选的转换路线，与 known 等长
     * @param insights 实参的辅助信息，与 known 等长
     */
    static Relationship compare(Weight[] known, List<ConversionRoute> suggested, Insight[] insights) {
        if (known.length != suggested.size() || known.length != insights.length) {
            throw new IllegalArgumentException("argument vectors differ in length: "
                    + known.length + ", " + suggested.size() + ", " + insights.length);
        }
        return compare(known, weigh(suggested, insights));
    }

    /**
     * 比较两个等长的代价向量（suggested 相对 known）
     */
    static Relationship compare(Weight[] known, Weight[] suggested) {
        if (known.length != suggested.length) {
            throw new IllegalArgumentException("argument vectors differ in length: "
                    + known.length + ", " + suggested.length);
        }
        // 空实参列表：没有可比较的位置，第一个零元候选直接胜出
        if (known.length == 0) return Relationship.BETTER;

        boolean worseWitness = false;   // 有位置说明 known 更好
        boolean betterWitness = false;  // 有位置说明 suggested 更好
        for (int i = 0; i < known.length; i++) {
            if (known[i].isLessThan(suggested[i])) {
                worseWitness = true;
            } else if (suggested[i].isLessThan(known[i])) {
                betterWitness = true;
            }
        }

        if (worseWitness != betterWitness) {
            return betterWitness ? Relationship.BETTER : Relationship.WORSE;
        }
        return betterWitness ? Relationship.AMBIGUOUS : Relationship.EQUIVALENT;
    }

    /**
     * 计算每条路线在对应辅助信息下的总代价
     */
    static Weight[] weigh(List<ConversionRoute> routes, Insight[] insights) {
        Weight[] weights = new Weight[routes.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = routes.get(i).totalWeight(insights[i]);
        }
        return weights;
    }

    /** 长度为 n、全部为 INFINITE 的代价向量 */
    static Weight[] infinite(int n) {
        Weight[] weights = new Weight[n];
        Arrays.fill(weights, Weight.INFINITE);
        return weights;
    }

    /**
     * 向量中每个位置是否都可转换
     */
    static boolean conversionPossible(Weight[] weights) {
        for (Weight weight : weights) {
            if (!weight.isPossible()) return false;
        }
        return true;
    }

    /**
     * 两个候选的形参是否完全一致（例如 const/非 const 成对重载）。
     * 按描述符引用逐个比较；任一为 null 视为不一致。
     */
    static boolean identicalAlternatives(Alternative a, Alternative b) {
        if (a == null || b == null) return false;
        if (a == b) return true;
        List<TypeOfArgument> args1 = a.signature();
        List<TypeOfArgument> args2 = b.signature();
        if (args1.size() != args2.size()) return false;
        for (int i = 0; i < args1.size(); i++) {
            if (args1.get(i) != args2.get(i)) return false;
        }
        return true;
    }
}
