package bridge.runtime;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteResultTest {

    private static final ConversionRoute IDENTITY = new ConversionRoute() {
        @Override
        public Weight totalWeight(Insight insight) {
            return Weight.ZERO;
        }

        @Override
        public Object apply(Object value, GarbageCollection gc) {
            return value;
        }
    };

    @Test
    void testFound() {
        List<ConversionRoute> routes = new ArrayList<>();
        routes.add(IDENTITY);
        RouteResult result = RouteResult.found(routes);
        routes.clear();

        assertTrue(result.isFound());
        assertEquals(1, result.getRoutes().size());
        assertNull(result.getReason());
        assertThrows(UnsupportedOperationException.class, () -> result.getRoutes().add(IDENTITY));
    }

    @Test
    void testNone() {
        RouteResult result = RouteResult.none("int -> string");

        assertFalse(result.isFound());
        assertEquals("int -> string", result.getReason());
        assertThrows(IllegalStateException.class, result::getRoutes);
        assertEquals("no applicable conversion", RouteResult.none(null).getReason());
    }
}
