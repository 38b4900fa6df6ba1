package bridge.runtime.dispatch;

import bridge.runtime.Alternative;
import bridge.runtime.ArgumentLimitExceededException;
import bridge.runtime.Conversion;
import bridge.runtime.ConversionRoute;
import bridge.runtime.DispatchInvocationException;
import bridge.runtime.GarbageCollection;
import bridge.runtime.Insight;
import bridge.runtime.OverloadingAmbiguityException;
import bridge.runtime.OverloadingNoMatchException;
import bridge.runtime.RouteResult;
import bridge.runtime.StaleCacheException;
import bridge.runtime.TypeDetector;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.Weight;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 重载函数集合
 *
 * <p>持有按注册顺序排列的若干候选原生函数。调用时根据实参的运行时类型，
 * 在元数相同的候选中选出转换代价最小的一个，转换实参、调用，并对返回值做出口转换。</p>
 *
 * <p>候选只能追加不能删除，下标因此稳定，可以作为缓存值。
 * 向已经被调用过的集合追加候选后，应调用 {@link #forceRecompute()}。</p>
 */
public class OverloadedSet {

    private static final Logger LOG = Logger.getLogger(OverloadedSet.class.getName());

    /** 实参个数上限 */
    public static final int ARGUMENT_ARRAY_LIMIT = 12;

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final DispatchContext context;
    private final List<Alternative> alternatives = new CopyOnWriteArrayList<>();

    public OverloadedSet(DispatchContext context) {
        if (context == null) {
            throw new IllegalArgumentException("dispatch context must not be null");
        }
        this.context = context;
    }

    // ============ 注册 ============

    /**
     * 追加一个候选。注册后无法移除。
     */
    public void addAlternative(Alternative alt) {
        if (alt == null) {
            throw new IllegalArgumentException("alternative must not be null");
        }
        alternatives.add(alt);
    }

    /**
     * 追加另一个集合的全部候选（复制引用），另一个集合保持不变、仍可使用
     */
    public void addAlternatives(OverloadedSet more) {
        alternatives.addAll(more.alternatives);
    }

    /**
     * 查找签名与 prototype 完全一致（无需任何转换）的候选
     *
     * @return 匹配的候选，没有则返回 null
     */
    public Alternative seekAlternative(List<TypeOfArgument> prototype) {
        for (Alternative alt : alternatives) {
            if (sameSignature(alt.signature(), prototype)) {
                return alt;
            }
        }
        return null;
    }

    /**
     * 丢弃缓存中的全部决议（共享缓存中其它集合的决议也一并丢弃）
     */
    public void forceRecompute() {
        context.getCache().flush();
    }

    // ============ 调用 ============

    public Object call(Object... args) {
        return call(Arrays.asList(args));
    }

    /**
     * 以动态类型的实参调用本集合
     *
     * @throws ArgumentLimitExceededException 实参个数超过 {@link #ARGUMENT_ARRAY_LIMIT}
     * @throws OverloadingNoMatchException 没有候选能接受这些实参
     * @throws OverloadingAmbiguityException 最优候选不唯一
     */
    public Object call(List<?> args) {
        final int nargs = args.size();
        if (nargs > ARGUMENT_ARRAY_LIMIT) {
            throw new ArgumentLimitExceededException(nargs, ARGUMENT_ARRAY_LIMIT);
        }

        OverloadCache cache = context.getCache();
        long generation = cache.generation();

        // 探测实参类型与辅助信息
        TypeOfArgument[] actualTypes = new TypeOfArgument[nargs];
        Insight[] actualInsights = new Insight[nargs];
        TypeDetector detector = context.getDetector();
        for (int i = 0; i < nargs; i++) {
            Object arg = args.get(i);
            actualTypes[i] = detector.detectType(arg);
            actualInsights[i] = detector.detectInsight(arg);
        }

        try (GarbageCollection gc = new GarbageCollection(context.getMemoryManager())) {
            Alternative match;
            List<ConversionRoute> routes;
            int cachedAlt = cache.recall(this, nargs, actualTypes, actualInsights);
            boolean hit = cachedAlt != OverloadCache.MISSED;

            if (hit) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("set#" + id + ": cache hit, running alternative #" + cachedAlt);
                }
                match = cachedAlternative(cachedAlt);
                RouteResult result = context.getRouter().bestSequenceRoute(
                        Arrays.asList(actualTypes), Arrays.asList(actualInsights), match.signature());
                if (!result.isFound()) {
                    throw new StaleCacheException("cached alternative #" + cachedAlt + " of set#" + id
                            + " no longer accepts " + Arrays.toString(actualTypes) + ": " + result.getReason());
                }
                routes = result.getRoutes();
            } else {
                Resolution resolution = resolve(nargs, actualTypes, actualInsights);
                cachedAlt = resolution.index;
                match = resolution.alternative;
                routes = resolution.routes;
            }

            Object[] converted = convertSequence(args, routes, gc);
            if (!hit) {
                cache.remember(generation, this, nargs, actualTypes, actualInsights, cachedAlt);
            }

            Object result = invoke(match, converted);
            return applyEdgeConversion(match.returnType(), result);
        }
    }

    /**
     * 完整的重载决议：遍历元数相同的候选，保留一个当前最优和一个歧义标记
     */
    private Resolution resolve(int nargs, TypeOfArgument[] actualTypes, Insight[] actualInsights) {
        List<TypeOfArgument> typeList = Arrays.asList(actualTypes);
        List<Insight> insightList = Arrays.asList(actualInsights);
        boolean trace = LOG.isLoggable(Level.FINEST);

        boolean ambiguityAlert = false;
        Alternative lightest = null;
        int lightestIndex = OverloadCache.MISSED;
        List<ConversionRoute> lightRoutes = null;
        Weight[] lightWeight = ResolutionComparator.infinite(nargs);

        int index = 0;
        for (Alternative alt : alternatives) {
            int current = index++;
            if (alt.arity() != nargs) continue;
            if (trace) LOG.finest("set#" + id + ": trying alternative #" + current);

            RouteResult result = context.getRouter().bestSequenceRoute(typeList, insightList, alt.signature());
            if (!result.isFound()) {
                if (trace) LOG.finest("set#" + id + ": #" + current + " impossible: " + result.getReason());
                continue;
            }

            List<ConversionRoute> needed = result.getRoutes();
            Weight[] weights = ResolutionComparator.weigh(needed, actualInsights);
            switch (ResolutionComparator.compare(lightWeight, weights)) {
                case BETTER:
                    lightest = alt;
                    lightestIndex = current;
                    lightRoutes = needed;
                    lightWeight = weights;
                    ambiguityAlert = false;
                    if (trace) LOG.finest("set#" + id + ": #" + current + " better " + Arrays.toString(weights));
                    break;
                case EQUIVALENT:
                case AMBIGUOUS:
                    // 签名完全一致的候选（如 const/非 const 成对）不构成歧义
                    if (!ResolutionComparator.identicalAlternatives(lightest, alt)) {
                        ambiguityAlert = true;
                    }
                    break;
                case WORSE:
                default:
                    break;
            }
        }

        if (lightest == null || !ResolutionComparator.conversionPossible(lightWeight)) {
            throw new OverloadingNoMatchException("argument types: " + Arrays.toString(actualTypes));
        }
        if (ambiguityAlert) {
            throw new OverloadingAmbiguityException("argument types: " + Arrays.toString(actualTypes));
        }
        if (trace) LOG.finest("set#" + id + ": chose alternative #" + lightestIndex);
        return new Resolution(lightestIndex, lightest, lightRoutes);
    }

    private Alternative cachedAlternative(int index) {
        if (index >= alternatives.size()) {
            throw new StaleCacheException("cached alternative #" + index + " out of range for set#" + id
                    + " with " + alternatives.size() + " alternatives");
        }
        return alternatives.get(index);
    }

    /**
     * 沿各自的路线转换每个实参
     */
    private static Object[] convertSequence(List<?> original, List<ConversionRoute> conversions,
                                            GarbageCollection gc) {
        Object[] converted = new Object[original.size()];
        for (int i = 0; i < converted.length; i++) {
            converted[i] = conversions.get(i).apply(original.get(i), gc);
        }
        return converted;
    }

    private static Object invoke(Alternative match, Object[] converted) {
        try {
            return match.invoke(converted);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DispatchInvocationException("native call failed: " + e.getMessage(), e);
        }
    }

    /**
     * 按声明的返回类型做出口转换；确实转换了就释放原值
     */
    private Object applyEdgeConversion(TypeOfArgument returnType, Object value) {
        if (returnType == null) return value;
        Conversion exit = context.getRouter().edgeConversion(returnType);
        if (exit == null) return value;
        Object newValue = exit.apply(value);
        context.getMemoryManager().release(value);
        return newValue;
    }

    private static boolean sameSignature(List<TypeOfArgument> a, List<TypeOfArgument> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }

    // ============ 访问器 ============

    /** 集合序号，在进程内唯一 */
    public long getId() {
        return id;
    }

    public DispatchContext getContext() {
        return context;
    }

    /** 候选的只读视图，按注册顺序 */
    public List<Alternative> getAlternatives() {
        return Collections.unmodifiableList(alternatives);
    }

    public int size() {
        return alternatives.size();
    }

    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    @Override
    public String toString() {
        return "OverloadedSet#" + id + "(" + alternatives.size() + " alternatives)";
    }

    /** 一次完整决议的结果 */
    private static final class Resolution {
        final int index;
        final Alternative alternative;
        final List<ConversionRoute> routes;

        Resolution(int index, Alternative alternative, List<ConversionRoute> routes) {
            this.index = index;
            this.alternative = alternative;
            this.routes = routes;
        }
    }
}
