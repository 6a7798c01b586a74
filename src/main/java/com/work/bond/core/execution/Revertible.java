package com.work.bond.core.execution;

/**
 * 参与事务回滚的状态持有者（teller、depository、内存账本、lock vault）。
 */
@FunctionalInterface
public interface Revertible {

    /**
     * 记录当前状态。
     *
     * @return 回滚动作：执行后状态恢复到调用 checkpoint 时的样子
     */
    Runnable checkpoint();
}
