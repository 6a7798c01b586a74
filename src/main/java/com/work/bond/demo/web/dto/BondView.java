package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * 债券快照。
 */
public class BondView {

    private long id;

    private String owner;

    private BigInteger principalPaid;

    private BigInteger payoutAmount;

    private BigInteger payoutAlreadyClaimed;

    private BigInteger claimable;

    private long vestingStart;

    private long localVestingTerm;

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public BigInteger getPrincipalPaid() {
        return principalPaid;
    }

    public void setPrincipalPaid(BigInteger principalPaid) {
        this.principalPaid = principalPaid;
    }

    public BigInteger getPayoutAmount() {
        return payoutAmount;
    }

    public void setPayoutAmount(BigInteger payoutAmount) {
        this.payoutAmount = payoutAmount;
    }

    public BigInteger getPayoutAlreadyClaimed() {
        return payoutAlreadyClaimed;
    }

    public void setPayoutAlreadyClaimed(BigInteger payoutAlreadyClaimed) {
        this.payoutAlreadyClaimed = payoutAlreadyClaimed;
    }

    public BigInteger getClaimable() {
        return claimable;
    }

    public void setClaimable(BigInteger claimable) {
        this.claimable = claimable;
    }

    public long getVestingStart() {
        return vestingStart;
    }

    public void setVestingStart(long vestingStart) {
        this.vestingStart = vestingStart;
    }

    public long getLocalVestingTerm() {
        return localVestingTerm;
    }

    public void setLocalVestingTerm(long localVestingTerm) {
        this.localVestingTerm = localVestingTerm;
    }
}
