package bridge.runtime;

/**
 * 实参/形参的类型描述符
 *
 * <p>实例只能由 {@link TypeRegistry} 创建，同一逻辑类型在同一注册表中
 * 只有一个实例。重载缓存与签名比较都依赖引用相等（{@code ==}），
 * 因此本类刻意不覆盖 {@code equals}/{@code hashCode}。</p>
 */
public final class TypeOfArgument {

    private final String name;
    private final int handle;
    private final TypeRegistry registry;

    TypeOfArgument(String name, int handle, TypeRegistry registry) {
        this.name = name;
        this.handle = handle;
        this.registry = registry;
    }

    /** 逻辑类型名 */
    public String getName() {
        return name;
    }

    /** 注册表中的下标（句柄） */
    public int getHandle() {
        return handle;
    }

    /** 所属注册表 */
    public TypeRegistry getRegistry() {
        return registry;
    }

    @Override
    public String toString() {
        return name;
    }
}
