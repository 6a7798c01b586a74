package com.work.bond.core.model;

import java.math.BigInteger;

/**
 * 一次存款的结果：bond 模式下 id 为 bondId，stake 模式下为锁仓 lockId。
 */
public final class DepositResult {

    private final long id;
    private final boolean stake;
    private final BigInteger principalPaid;
    private final BigInteger payout;

    public DepositResult(long id, boolean stake, BigInteger principalPaid, BigInteger payout) {
        this.id = id;
        this.stake = stake;
        this.principalPaid = principalPaid;
        this.payout = payout;
    }

    public long getId() {
        return id;
    }

    public boolean isStake() {
        return stake;
    }

    public BigInteger getPrincipalPaid() {
        return principalPaid;
    }

    public BigInteger getPayout() {
        return payout;
    }

    @Override
    public String toString() {
        return "DepositResult{" +
                "id=" + id +
                ", stake=" + stake +
                ", principalPaid=" + principalPaid +
                ", payout=" + payout +
                '}';
    }
}
