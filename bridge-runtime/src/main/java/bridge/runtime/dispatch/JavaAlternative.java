package bridge.runtime.dispatch;

import bridge.runtime.Alternative;
import bridge.runtime.TypeOfArgument;
import bridge.runtime.TypeRegistry;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 以 Java 静态方法作为原生函数的候选
 *
 * <p>通过 MethodHandle 调用，签名与返回类型由方法的参数/返回类驻留到 {@link TypeRegistry} 得到。
 * 实参必须已经转换为方法要求的类型（基本类型以包装类传入）。</p>
 */
public final class JavaAlternative implements Alternative {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

    private final String name;
    private final MethodHandle handle;
    private final List<TypeOfArgument> signature;
    private final TypeOfArgument returnType;

    /**
     * @param name 用于诊断的名称
     * @param handle 目标句柄，不能是变参收集器
     * @param registry 签名中的类型从这里驻留
     */
    public JavaAlternative(String name, MethodHandle handle, TypeRegistry registry) {
        this.name = name;
        this.handle = handle.asFixedArity();
        MethodType type = this.handle.type();
        List<TypeOfArgument> params = new ArrayList<>(type.parameterCount());
        for (Class<?> param : type.parameterList()) {
            params.add(registry.forClass(param));
        }
        this.signature = Collections.unmodifiableList(params);
        this.returnType = registry.forClass(type.returnType());
    }

    /**
     * 由静态方法创建
     *
     * @throws IllegalArgumentException 不是静态方法或无法访问
     */
    public static JavaAlternative of(Method method, TypeRegistry registry) {
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("not a static method: " + method);
        }
        try {
            method.setAccessible(true);
            return new JavaAlternative(method.getDeclaringClass().getSimpleName() + "." + method.getName(),
                    LOOKUP.unreflect(method), registry);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new IllegalArgumentException("cannot access method: " + method, e);
        }
    }

    /**
     * 收集类中某个名字的全部公共静态方法，按参数个数和参数类型名排序以保证注册顺序稳定
     */
    public static List<JavaAlternative> allNamed(Class<?> clazz, String methodName, TypeRegistry registry) {
        List<Method> methods = new ArrayList<>();
        for (Method m : clazz.getMethods()) {
            if (m.getName().equals(methodName) && Modifier.isStatic(m.getModifiers()) && !m.isVarArgs()) {
                methods.add(m);
            }
        }
        methods.sort(Comparator.<Method>comparingInt(Method::getParameterCount)
                .thenComparing(m -> Arrays.toString(m.getParameterTypes())));
        List<JavaAlternative> result = new ArrayList<>(methods.size());
        for (Method m : methods) {
            result.add(of(m, registry));
        }
        return result;
    }

    @Override
    public List<TypeOfArgument> signature() {
        return signature;
    }

    @Override
    public TypeOfArgument returnType() {
        return returnType;
    }

    @Override
    public Object invoke(Object[] args) throws Exception {
        if (args.length != signature.size()) {
            throw new IllegalArgumentException(name + " expects " + signature.size()
                    + " arguments, got " + args.length);
        }
        try {
            return handle.invokeWithArguments(args);
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("unexpected throwable from " + name, t);
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + signature;
    }
}
