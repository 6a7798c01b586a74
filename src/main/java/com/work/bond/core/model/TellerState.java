package com.work.bond.core.model;

/**
 * teller 生命周期状态。时间窗口（开始/结束）不在这里体现，每次调用时按当前时间检查。
 */
public enum TellerState {
    /**
     * 尚未 initialize
     */
    UNINITIALIZED,
    /**
     * 已初始化，但治理方还没有设置条款
     */
    TERMS_UNSET,
    /**
     * 可报价、可存款
     */
    ACTIVE,
    /**
     * 暂停存款；领取不受影响
     */
    PAUSED
}
