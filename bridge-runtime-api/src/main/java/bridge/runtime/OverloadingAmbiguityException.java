package bridge.runtime;

/**
 * 两个以上互不相同的候选同样好，且谁也不占优
 */
public class OverloadingAmbiguityException extends DispatchException {

    public OverloadingAmbiguityException() {
        super("call is ambiguous with given arguments.");
    }

    public OverloadingAmbiguityException(String detail) {
        super("call is ambiguous with given arguments. " + detail);
    }
}
