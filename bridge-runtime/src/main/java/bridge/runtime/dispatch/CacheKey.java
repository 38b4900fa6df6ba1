package bridge.runtime.dispatch;

import bridge.runtime.Insight;
import bridge.runtime.TypeOfArgument;

import java.util.Arrays;

/**
 * 重载决议缓存的键：(所属集合, 实参个数, 实参类型, 辅助信息)
 *
 * <p>集合与类型按引用比较，辅助信息按值比较。
 * 查找用的探测键直接引用调用方的数组；存入缓存的键持有自己的副本。</p>
 */
final class CacheKey implements Comparable<CacheKey> {

    private final OverloadedSet owner;
    private final int nargs;
    private final TypeOfArgument[] types;
    private final Insight[] insights;
    private final int hash;

    private CacheKey(OverloadedSet owner, int nargs, TypeOfArgument[] types, Insight[] insights) {
        if (types.length < nargs || insights.length < nargs) {
            throw new IllegalArgumentException("key arrays shorter than argument count " + nargs);
        }
        this.owner = owner;
        this.nargs = nargs;
        this.types = types;
        this.insights = insights;
        this.hash = computeHash();
    }

    /**
     * 查找用：不复制数组，只在本次查找期间有效
     */
    static CacheKey probe(OverloadedSet owner, int nargs, TypeOfArgument[] types, Insight[] insights) {
        return new CacheKey(owner, nargs, types, insights);
    }

    /**
     * 存储用：复制前 nargs 个元素，与调用方数组再无关联
     */
    static CacheKey owned(OverloadedSet owner, int nargs, TypeOfArgument[] types, Insight[] insights) {
        return new CacheKey(owner, nargs, Arrays.copyOf(types, nargs), Arrays.copyOf(insights, nargs));
    }

    OverloadedSet getOwner() {
        return owner;
    }

    int getArgumentCount() {
        return nargs;
    }

    private int computeHash() {
        int h = System.identityHashCode(owner);
        h = 31 * h + nargs;
        for (int i = 0; i < nargs; i++) {
            h = 31 * h + System.identityHashCode(types[i]);
            h = 31 * h + insights[i].hashCode();
        }
        return h;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        CacheKey other = (CacheKey) o;
        if (owner != other.owner) return false;
        if (nargs != other.nargs) return false;
        for (int i = 0; i < nargs; i++) {
            if (types[i] != other.types[i]) return false;
            if (!insights[i].equals(other.insights[i])) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * 字典序：集合、实参个数，然后逐位置的 (类型, 辅助信息)
     */
    @Override
    public int compareTo(CacheKey other) {
        int c = Long.compare(owner.getId(), other.owner.getId());
        if (c != 0) return c;
        c = Integer.compare(nargs, other.nargs);
        if (c != 0) return c;
        for (int i = 0; i < nargs; i++) {
            c = compareTypes(types[i], other.types[i]);
            if (c != 0) return c;
            c = insights[i].compareTo(other.insights[i]);
            if (c != 0) return c;
        }
        return 0;
    }

    private static int compareTypes(TypeOfArgument a, TypeOfArgument b) {
        if (a == b) return 0;
        int c = Long.compare(a.getRegistry().getId(), b.getRegistry().getId());
        if (c != 0) return c;
        return Integer.compare(a.getHandle(), b.getHandle());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CacheKey(set#").append(owner.getId()).append(", [");
        for (int i = 0; i < nargs; i++) {
            if (i > 0) sb.append(", ");
            sb.append(types[i]).append('/').append(insights[i].getValue());
        }
        return sb.append("])").toString();
    }
}
