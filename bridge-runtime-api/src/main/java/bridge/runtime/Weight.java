package bridge.runtime;

/**
 * 单个实参的转换代价
 *
 * <p>包含四个分量：{@code epsilon}（平凡调整）、{@code promotion}（提升）、
 * {@code upcast}（向上转型）、{@code userDefined}（用户自定义转换），
 * 从 {@code userDefined} 到 {@code epsilon} 依次比较：任意次用户自定义转换都比任意次提升更贵。</p>
 *
 * <p>{@link #INFINITE} 表示"不可转换"，大于一切可行代价，且只等于自身。
 * 代价之间只做逐位比较，从不求和比较整个实参列表。</p>
 */
public final class Weight implements Comparable<Weight> {

    /** 精确匹配 */
    public static final Weight ZERO = new Weight(0, 0, 0, 0, true);

    /** 不可能的转换，也用作"尚未找到候选"的初始值 */
    public static final Weight INFINITE = new Weight(0, 0, 0, 0, false);

    private final int epsilon;
    private final int promotion;
    private final int upcast;
    private final int userDefined;
    private final boolean possible;

    private Weight(int epsilon, int promotion, int upcast, int userDefined, boolean possible) {
        this.epsilon = epsilon;
        this.promotion = promotion;
        this.upcast = upcast;
        this.userDefined = userDefined;
        this.possible = possible;
    }

    public static Weight of(int epsilon, int promotion, int upcast, int userDefined) {
        if (epsilon < 0 || promotion < 0 || upcast < 0 || userDefined < 0) {
            throw new IllegalArgumentException("weight components must be non-negative");
        }
        if ((epsilon | promotion | upcast | userDefined) == 0) return ZERO;
        return new Weight(epsilon, promotion, upcast, userDefined, true);
    }

    public static Weight epsilon(int n) { return of(n, 0, 0, 0); }
    public static Weight promotion(int n) { return of(0, n, 0, 0); }
    public static Weight upcast(int n) { return of(0, 0, n, 0); }
    public static Weight userDefined(int n) { return of(0, 0, 0, n); }

    /** 该转换是否可行 */
    public boolean isPossible() {
        return possible;
    }

    /**
     * 串联两段转换的代价，任一不可行则结果不可行
     */
    public Weight plus(Weight other) {
        if (!possible || !other.possible) return INFINITE;
        return of(epsilon + other.epsilon, promotion + other.promotion,
                upcast + other.upcast, userDefined + other.userDefined);
    }

    /** 严格小于 */
    public boolean isLessThan(Weight other) {
        return compareTo(other) < 0;
    }

    public int getEpsilon() { return epsilon; }
    public int getPromotion() { return promotion; }
    public int getUpcast() { return upcast; }
    public int getUserDefined() { return userDefined; }

    @Override
    public int compareTo(Weight other) {
        if (possible != other.possible) return possible ? -1 : 1;
        if (!possible) return 0;
        int c = Integer.compare(userDefined, other.userDefined);
        if (c != 0) return c;
        c = Integer.compare(upcast, other.upcast);
        if (c != 0) return c;
        c = Integer.compare(promotion, other.promotion);
        if (c != 0) return c;
        return Integer.compare(epsilon, other.epsilon);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Weight)) return false;
        return compareTo((Weight) o) == 0;
    }

    @Override
    public int hashCode() {
        if (!possible) return -1;
        int h = userDefined;
        h = 31 * h + upcast;
        h = 31 * h + promotion;
        return 31 * h + epsilon;
    }

    @Override
    public String toString() {
        if (!possible) return "Weight(INFINITE)";
        return "Weight(" + epsilon + "," + promotion + "," + upcast + "," + userDefined + ")";
    }
}
