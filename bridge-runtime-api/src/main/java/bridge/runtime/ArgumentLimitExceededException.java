package bridge.runtime;

/**
 * 实参个数超过固定上限，调用方必须调整调用方式
 */
public class ArgumentLimitExceededException extends DispatchException {

    private final int argumentCount;
    private final int limit;

    public ArgumentLimitExceededException(int argumentCount, int limit) {
        super("argument limit exceeded: " + argumentCount + " > " + limit);
        this.argumentCount = argumentCount;
        this.limit = limit;
    }

    public int getArgumentCount() {
        return argumentCount;
    }

    public int getLimit() {
        return limit;
    }
}
