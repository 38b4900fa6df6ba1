package bridge.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 类型描述符驻留表
 *
 * <p>把逻辑类型名映射为唯一的 {@link TypeOfArgument} 实例（名称 → 句柄），
 * 保证"同一类型即同一引用"。类型探测器必须经由注册表获取描述符，
 * 不允许临时构造。</p>
 *
 * <p>线程安全：驻留操作可被多个线程并发调用。</p>
 */
public final class TypeRegistry {

    private static final AtomicLong IDS = new AtomicLong();
    private static final TypeRegistry GLOBAL = new TypeRegistry();

    private final long id = IDS.incrementAndGet();

    private final Map<String, TypeOfArgument> byName = new ConcurrentHashMap<>();
    private final List<TypeOfArgument> byHandle = new ArrayList<>();

    /** 进程级共享注册表 */
    public static TypeRegistry global() {
        return GLOBAL;
    }

    /**
     * 获取（必要时创建）指定名称的唯一描述符
     */
    public TypeOfArgument intern(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("type name must not be empty");
        }
        TypeOfArgument existing = byName.get(name);
        if (existing != null) return existing;
        return byName.computeIfAbsent(name, this::allocate);
    }

    /**
     * 按 Java 类驻留；基本类型使用关键字名（int、double ...），其余使用类的全名
     */
    public TypeOfArgument forClass(Class<?> clazz) {
        return intern(clazz.getName());
    }

    /**
     * 查找已驻留的描述符，不存在返回 null
     */
    public TypeOfArgument lookup(String name) {
        return byName.get(name);
    }

    /**
     * 按句柄取回描述符
     */
    public TypeOfArgument get(int handle) {
        synchronized (byHandle) {
            return byHandle.get(handle);
        }
    }

    /** 注册表序号，用于在多个注册表之间给描述符排序 */
    public long getId() {
        return id;
    }

    public int size() {
        return byName.size();
    }

    /** 按句柄顺序返回全部描述符的快照 */
    public List<TypeOfArgument> snapshot() {
        synchronized (byHandle) {
            return Collections.unmodifiableList(new ArrayList<>(byHandle));
        }
    }

    // computeIfAbsent 内调用，同一名称只会分配一次
    private TypeOfArgument allocate(String name) {
        synchronized (byHandle) {
            TypeOfArgument type = new TypeOfArgument(name, byHandle.size(), this);
            byHandle.add(type);
            return type;
        }
    }
}
