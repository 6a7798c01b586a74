package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * 存款结果：stake=false 时 id 为 bondId，否则为 lockId。
 */
public class DepositResponse {

    private long id;

    private boolean stake;

    private BigInteger principalPaid;

    private BigInteger payout;

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public boolean isStake() {
        return stake;
    }

    public void setStake(boolean stake) {
        this.stake = stake;
    }

    public BigInteger getPrincipalPaid() {
        return principalPaid;
    }

    public void setPrincipalPaid(BigInteger principalPaid) {
        this.principalPaid = principalPaid;
    }

    public BigInteger getPayout() {
        return payout;
    }

    public void setPayout(BigInteger payout) {
        this.payout = payout;
    }
}
