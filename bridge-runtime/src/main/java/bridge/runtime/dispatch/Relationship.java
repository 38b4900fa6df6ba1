package bridge.runtime.dispatch;

/**
 * 新候选相对于当前最优候选的关系
 */
enum Relationship {
    /** 每个位置都不差，且至少一个位置更便宜 */
    BETTER,
    /** 每个位置都不好于已知，且至少一个位置更贵 */
    WORSE,
    /** 所有位置代价相同 */
    EQUIVALENT,
    /** 有的位置更好、有的更差，谁也不占优 */
    AMBIGUOUS
}
