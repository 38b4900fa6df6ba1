package bridge.runtime.dispatch;

import bridge.runtime.Conversion;
import bridge.runtime.ConversionRoute;
import bridge.runtime.ConversionRouter;
import bridge.runtime.GarbageCollection;
import bridge.runtime.Insight;
import bridge.runtime.RouteResult;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.Weight;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 测试用的内存转换表：显式登记 (源类型, 目标类型) → 代价 + 转换函数。
 * 源与目标相同且未显式登记时视为零代价的恒等转换。
 */
final class FakeConversionRouter implements ConversionRouter {

    private final Map<TypeOfArgument, Map<TypeOfArgument, Edge>> edges = new HashMap<>();
    private final Map<TypeOfArgument, Conversion> exits = new HashMap<>();
    private final AtomicInteger routeRequests = new AtomicInteger();

    FakeConversionRouter allow(TypeOfArgument from, TypeOfArgument to, Weight weight) {
        return allow(from, to, weight, Function.identity());
    }

    FakeConversionRouter allow(TypeOfArgument from, TypeOfArgument to, Weight weight,
                               Function<Object, Object> converter) {
        return put(from, to, new Edge(insight -> weight, converter, false));
    }

    /** 代价随辅助信息变化 */
    FakeConversionRouter allowWeighted(TypeOfArgument from, TypeOfArgument to, Function<Insight, Weight> weight) {
        return put(from, to, new Edge(weight, Function.identity(), false));
    }

    /** 转换结果登记为本次调用的临时值 */
    FakeConversionRouter allowTemporary(TypeOfArgument from, TypeOfArgument to, Weight weight,
                                        Function<Object, Object> converter) {
        return put(from, to, new Edge(insight -> weight, converter, true));
    }

    /** 移除某条转换（包括恒等转换） */
    FakeConversionRouter forbid(TypeOfArgument from, TypeOfArgument to) {
        return put(from, to, null);
    }

    FakeConversionRouter exit(TypeOfArgument returnType, Conversion conversion) {
        exits.put(returnType, conversion);
        return this;
    }

    int getRouteRequests() {
        return routeRequests.get();
    }

    void resetCounters() {
        routeRequests.set(0);
    }

    private FakeConversionRouter put(TypeOfArgument from, TypeOfArgument to, Edge edge) {
        edges.computeIfAbsent(from, k -> new HashMap<>()).put(to, edge);
        return this;
    }

    @Override
    public RouteResult bestSequenceRoute(List<TypeOfArgument> actualTypes, List<Insight> insights,
                                         List<TypeOfArgument> signature) {
        routeRequests.incrementAndGet();
        List<ConversionRoute> routes = new ArrayList<>(actualTypes.size());
        for (int i = 0; i < actualTypes.size(); i++) {
            TypeOfArgument from = actualTypes.get(i);
            TypeOfArgument to = signature.get(i);
            Map<TypeOfArgument, Edge> out = edges.get(from);
            Edge edge;
            if (out != null && out.containsKey(to)) {
                edge = out.get(to);
            } else {
                edge = from == to ? Edge.IDENTITY : null;
            }
            if (edge == null) {
                return RouteResult.none("no conversion from " + from + " to " + to);
            }
            routes.add(edge);
        }
        return RouteResult.found(routes);
    }

    @Override
    public Conversion edgeConversion(TypeOfArgument returnType) {
        return exits.get(returnType);
    }

    private static final class Edge implements ConversionRoute {
        static final Edge IDENTITY = new Edge(insight -> Weight.ZERO, Function.identity(), false);

        private final Function<Insight, Weight> weight;
        private final Function<Object, Object> converter;
        private final boolean temporary;

        Edge(Function<Insight, Weight> weight, Function<Object, Object> converter, boolean temporary) {
            this.weight = weight;
            this.converter = converter;
            this.temporary = temporary;
        }

        @Override
        public Weight totalWeight(Insight insight) {
            return weight.apply(insight);
        }

        @Override
        public Object apply(Object value, GarbageCollection gc) {
            Object converted = converter.apply(value);
            return temporary ? gc.add(converted) : converted;
        }
    }
}
