package bridge.runtime;

import java.util.List;

/**
 * 重载集合中的一个候选原生函数
 *
 * <p>注册后不可变：固定元数的形参签名、返回类型和调用能力。</p>
 */
public interface Alternative {

    /**
     * 形参类型列表（签名），元数即列表长度
     */
    List<TypeOfArgument> signature();

    /**
     * 声明的返回类型
     */
    TypeOfArgument returnType();

    /**
     * 以已转换好的实参调用原生函数
     *
     * @param args 与签名等长的实参
     * @return 原生返回值
     * @throws Exception 原生函数执行出错
     */
    Object invoke(Object[] args) throws Exception;

    default int arity() {
        return signature().size();
    }
}
