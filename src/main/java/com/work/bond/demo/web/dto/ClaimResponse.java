package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * 领取结果。
 */
public class ClaimResponse {

    private long bondId;

    private BigInteger amount;

    private boolean burned;

    public long getBondId() {
        return bondId;
    }

    public void setBondId(long bondId) {
        this.bondId = bondId;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public boolean isBurned() {
        return burned;
    }

    public void setBurned(boolean burned) {
        this.burned = burned;
    }
}
