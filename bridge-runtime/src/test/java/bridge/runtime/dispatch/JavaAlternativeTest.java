package bridge.runtime.dispatch;

import bridge.runtime.TypeOfArgument;
import bridge.runtime.TypeRegistry;
import bridge.runtime.Weight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JavaAlternative 单元测试 — 签名推导 / 调用 / 与 OverloadedSet 联用
 */
class JavaAlternativeTest {

    // ============ 测试辅助类 ============

    public static class MathHelper {
        public static String describe(int v) { return "int:" + v; }
        public static String describe(float v) { return "float:" + v; }
        public static String describe(String s, int times) { return s.repeat(times); }
        public static void nothing() { }
        public String instance(int v) { return "instance"; }
        public static String fail(int v) throws Exception { throw new Exception("failed " + v); }
    }

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    @Nested
    @DisplayName("签名推导")
    class SignatureTests {

        @Test
        @DisplayName("形参与返回类型按类名驻留")
        void testSignatureFromMethod() throws Exception {
            Method m = MathHelper.class.getMethod("describe", String.class, int.class);
            JavaAlternative alt = JavaAlternative.of(m, registry);

            assertEquals(Arrays.asList(registry.intern("java.lang.String"), registry.intern("int")),
                    alt.signature());
            assertSame(registry.forClass(String.class), alt.returnType());
            assertEquals(2, alt.arity());
        }

        @Test
        @DisplayName("拒绝实例方法")
        void testRejectsInstanceMethod() throws Exception {
            Method m = MathHelper.class.getMethod("instance", int.class);
            assertThrows(IllegalArgumentException.class, () -> JavaAlternative.of(m, registry));
        }

        @Test
        @DisplayName("allNamed 按元数和参数类型稳定排序")
        void testAllNamed() {
            List<JavaAlternative> alts = JavaAlternative.allNamed(MathHelper.class, "describe", registry);

            assertThat(alts).hasSize(3);
            assertSame(registry.forClass(float.class), alts.get(0).signature().get(0));
            assertSame(registry.forClass(int.class), alts.get(1).signature().get(0));
            assertEquals(2, alts.get(2).arity());
        }

        @Test
        @DisplayName("由 MethodHandle 直接构造")
        void testFromHandle() throws Exception {
            JavaAlternative alt = new JavaAlternative("max",
                    MethodHandles.publicLookup().findStatic(Math.class, "max",
                            MethodType.methodType(int.class, int.class, int.class)),
                    registry);

            assertEquals(9, alt.invoke(new Object[]{4, 9}));
            assertSame(registry.intern("int"), alt.returnType());
        }
    }

    @Nested
    @DisplayName("调用")
    class InvokeTests {

        @Test
        @DisplayName("调用静态方法并返回结果")
        void testInvoke() throws Exception {
            JavaAlternative alt = JavaAlternative.of(MathHelper.class.getMethod("describe", int.class), registry);
            assertEquals("int:7", alt.invoke(new Object[]{7}));
        }

        @Test
        @DisplayName("void 方法返回 null")
        void testVoid() throws Exception {
            JavaAlternative alt = JavaAlternative.of(MathHelper.class.getMethod("nothing"), registry);
            assertNull(alt.invoke(new Object[0]));
            assertSame(registry.intern("void"), alt.returnType());
        }

        @Test
        @DisplayName("实参个数不符时拒绝")
        void testArityMismatch() throws Exception {
            JavaAlternative alt = JavaAlternative.of(MathHelper.class.getMethod("describe", int.class), registry);
            assertThrows(IllegalArgumentException.class, () -> alt.invoke(new Object[]{1, 2}));
        }

        @Test
        @DisplayName("原生方法的受检异常原样抛出")
        void testCheckedException() throws Exception {
            JavaAlternative alt = JavaAlternative.of(MathHelper.class.getMethod("fail", int.class), registry);
            Exception e = assertThrows(Exception.class, () -> alt.invoke(new Object[]{3}));
            assertEquals("failed 3", e.getMessage());
        }
    }

    @Nested
    @DisplayName("与重载集合联用")
    class DispatchTests {

        @Test
        @DisplayName("整数选中 int 重载，浮点选中 float 重载")
        void testDispatchThroughSet() {
            TypeOfArgument boxedInt = registry.forClass(Integer.class);
            TypeOfArgument boxedFloat = registry.forClass(Float.class);
            TypeOfArgument primInt = registry.forClass(int.class);
            TypeOfArgument primFloat = registry.forClass(float.class);

            FakeConversionRouter router = new FakeConversionRouter()
                    .allow(boxedInt, primInt, Weight.ZERO)
                    .allow(boxedInt, primFloat, Weight.promotion(1), v -> ((Integer) v).floatValue())
                    .allow(boxedFloat, primFloat, Weight.ZERO);
            OverloadedSet set = new OverloadedSet(DispatchContext.builder()
                    .detector(new ClassTypeDetector(registry))
                    .router(router)
                    .build());
            for (JavaAlternative alt : JavaAlternative.allNamed(MathHelper.class, "describe", registry)) {
                set.addAlternative(alt);
            }

            assertEquals("int:5", set.call(5));
            assertEquals("float:2.5", set.call(2.5f));
            assertEquals("abab", set.call("ab", 2));
        }
    }
}
