package bridge.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 转换路由的结果：要么为每个实参找到了一条路线，要么不存在可用转换
 */
public final class RouteResult {

    private final List<ConversionRoute> routes;
    private final String reason;

    private RouteResult(List<ConversionRoute> routes, String reason) {
        this.routes = routes;
        this.reason = reason;
    }

    /**
     * 找到路线（每个实参一条，顺序与实参一致）
     */
    public static RouteResult found(List<ConversionRoute> routes) {
        if (routes == null) {
            throw new IllegalArgumentException("routes must not be null");
        }
        return new RouteResult(Collections.unmodifiableList(new ArrayList<>(routes)), null);
    }

    /**
     * 某个实参没有可用转换
     */
    public static RouteResult none(String reason) {
        return new RouteResult(null, reason == null ? "no applicable conversion" : reason);
    }

    public boolean isFound() {
        return routes != null;
    }

    /**
     * @throws IllegalStateException 结果为 none 时
     */
    public List<ConversionRoute> getRoutes() {
        if (routes == null) {
            throw new IllegalStateException("no routes: " + reason);
        }
        return routes;
    }

    /** 无可用转换的原因，found 时为 null */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isFound() ? "RouteResult.found(" + routes.size() + ")" : "RouteResult.none(" + reason + ")";
    }
}
