package bridge.runtime;

/**
 * 缓存命中的候选已无法使用
 *
 * <p>属于逻辑不变式被破坏（例如修改了候选却没有刷新缓存），不是普通的用户错误。</p>
 */
public class StaleCacheException extends DispatchException {

    public StaleCacheException(String message) {
        super(message);
    }
}
