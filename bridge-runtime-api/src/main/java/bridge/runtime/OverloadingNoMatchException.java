package bridge.runtime;

/**
 * 没有任何候选能接受给定的实参类型
 *
 * <p>可恢复：调用方可以改用其它重载集合，或向用户报告类型错误。</p>
 */
public class OverloadingNoMatchException extends DispatchException {

    public OverloadingNoMatchException() {
        super("no overloaded member matches arguments.");
    }

    public OverloadingNoMatchException(String detail) {
        super("no overloaded member matches arguments. " + detail);
    }
}
