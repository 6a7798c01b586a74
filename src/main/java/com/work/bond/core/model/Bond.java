package com.work.bond.core.model;

import java.math.BigInteger;

/**
 * 一张债券：按线性归属释放 payoutAmount 的可转让凭证。
 * 所有权不在这里，由 {@link com.work.bond.core.registry.BondRegistry} 记录。
 */
public class Bond {

    private final long id;
    private final BigInteger principalPaid;
    private final BigInteger payoutAmount;
    private BigInteger payoutAlreadyClaimed;
    private final long vestingStart;
    private final long localVestingTerm;

    public Bond(long id, BigInteger principalPaid, BigInteger payoutAmount, long vestingStart, long localVestingTerm) {
        this(id, principalPaid, payoutAmount, BigInteger.ZERO, vestingStart, localVestingTerm);
    }

    private Bond(long id, BigInteger principalPaid, BigInteger payoutAmount, BigInteger payoutAlreadyClaimed,
                 long vestingStart, long localVestingTerm) {
        this.id = id;
        this.principalPaid = principalPaid;
        this.payoutAmount = payoutAmount;
        this.payoutAlreadyClaimed = payoutAlreadyClaimed;
        this.vestingStart = vestingStart;
        this.localVestingTerm = localVestingTerm;
    }

    public Bond copy() {
        return new Bond(id, principalPaid, payoutAmount, payoutAlreadyClaimed, vestingStart, localVestingTerm);
    }

    /**
     * 截至 now 已归属的数量：到期后为全部，否则按经过时间线性折算（向下取整）。
     */
    public BigInteger vestedAmount(long now) {
        if (localVestingTerm <= 0 || now >= vestingStart + localVestingTerm) {
            return payoutAmount;
        }
        if (now <= vestingStart) {
            return BigInteger.ZERO;
        }
        return payoutAmount.multiply(BigInteger.valueOf(now - vestingStart))
                .divide(BigInteger.valueOf(localVestingTerm));
    }

    public BigInteger claimableAmount(long now) {
        BigInteger claimable = vestedAmount(now).subtract(payoutAlreadyClaimed);
        return claimable.signum() < 0 ? BigInteger.ZERO : claimable;
    }

    public boolean isFullyClaimed() {
        return payoutAlreadyClaimed.compareTo(payoutAmount) >= 0;
    }

    public long getId() {
        return id;
    }

    public BigInteger getPrincipalPaid() {
        return principalPaid;
    }

    public BigInteger getPayoutAmount() {
        return payoutAmount;
    }

    public BigInteger getPayoutAlreadyClaimed() {
        return payoutAlreadyClaimed;
    }

    public void setPayoutAlreadyClaimed(BigInteger payoutAlreadyClaimed) {
        this.payoutAlreadyClaimed = payoutAlreadyClaimed;
    }

    public long getVestingStart() {
        return vestingStart;
    }

    public long getLocalVestingTerm() {
        return localVestingTerm;
    }

    @Override
    public String toString() {
        return "Bond{" +
                "id=" + id +
                ", principalPaid=" + principalPaid +
                ", payoutAmount=" + payoutAmount +
                ", payoutAlreadyClaimed=" + payoutAlreadyClaimed +
                ", vestingStart=" + vestingStart +
                ", localVestingTerm=" + localVestingTerm +
                '}';
    }
}
