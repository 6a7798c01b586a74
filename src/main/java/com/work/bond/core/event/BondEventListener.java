package com.work.bond.core.event;

import java.math.BigInteger;

/**
 * 事件端口：teller / depository / governance 在状态变更成功后回调。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体实现（日志、消息队列、链上索引均可接入）
 * - 所有方法默认空实现，接入方只覆盖关心的事件
 *
 * 注意：回调发生在事务内部，实现方不应抛异常，否则整次调用会被回滚。
 */
public interface BondEventListener {

    default void bondCreated(String teller, long bondId, BigInteger principalPaid, BigInteger payoutAmount,
                             long vestingStart, long localVestingTerm) {
    }

    default void bondRedeemed(String teller, long bondId, String recipient, BigInteger finalAmount) {
    }

    default void lockCreated(String teller, long lockId, String owner, BigInteger amount, long end) {
    }

    default void termsSet(String teller) {
    }

    default void feesSet(String teller, int protocolFeeBps) {
    }

    default void addressesSet(String teller) {
    }

    default void paused(String teller) {
    }

    default void unpaused(String teller) {
    }

    default void tellerAdded(String depository, String teller) {
    }

    default void tellerRemoved(String depository, String teller) {
    }

    default void tellerCreated(String depository, String name, String teller) {
    }

    default void paramsSet(String depository) {
    }

    default void governancePending(String contract, String pendingGovernance) {
    }

    default void governanceTransferred(String contract, String oldGovernance, String newGovernance) {
    }

    default void governanceLocked(String contract) {
    }
}
