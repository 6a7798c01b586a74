package com.work.bond.core.ledger;

import java.math.BigInteger;

/**
 * 锁仓头寸（不可变）。
 */
public class LockPosition {

    private final long lockId;
    private final String owner;
    private final BigInteger amount;
    private final long end;

    public LockPosition(long lockId, String owner, BigInteger amount, long end) {
        this.lockId = lockId;
        this.owner = owner;
        this.amount = amount;
        this.end = end;
    }

    public long getLockId() {
        return lockId;
    }

    public String getOwner() {
        return owner;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public long getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "LockPosition{" +
                "lockId=" + lockId +
                ", owner='" + owner + '\'' +
                ", amount=" + amount +
                ", end=" + end +
                '}';
    }
}
