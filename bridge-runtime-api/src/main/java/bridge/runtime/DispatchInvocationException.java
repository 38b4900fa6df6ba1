package bridge.runtime;

/**
 * 原生函数抛出了受检异常
 */
public class DispatchInvocationException extends DispatchException {

    public DispatchInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
