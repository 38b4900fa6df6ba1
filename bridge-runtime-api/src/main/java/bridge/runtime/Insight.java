package bridge.runtime;

/**
 * 实参的辅助分类信息
 *
 * <p>细化探测到的类型，例如整数字面量实际需要的位宽，使转换代价能区分
 * "放得下 byte 的 int" 与普通 int。按值比较，并具有自然顺序，可作为缓存键的一部分。</p>
 */
public final class Insight implements Comparable<Insight> {

    /** 无附加信息 */
    public static final Insight NONE = new Insight(0L);

    private final long value;

    private Insight(long value) {
        this.value = value;
    }

    public static Insight of(long value) {
        return value == 0L ? NONE : new Insight(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(Insight other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Insight)) return false;
        return value == ((Insight) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Insight(" + value + ")";
    }
}
