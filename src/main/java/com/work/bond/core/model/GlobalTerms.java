package com.work.bond.core.model;

import java.math.BigInteger;

/**
 * 一期债券销售的全局条款（不可变），由治理方通过 setTerms 整体替换。
 * <p>价格单位：每一个完整奖励代币（10^18 基本单位）对应的本金基本单位数。</p>
 */
public final class GlobalTerms {

    private final BigInteger startPrice;
    private final BigInteger minimumPrice;
    private final BigInteger maxPayout;
    private final BigInteger priceAdjNum;
    private final BigInteger priceAdjDenom;
    private final BigInteger capacity;
    private final boolean capacityIsPayout;
    private final long startTime;
    private final long endTime;
    private final long globalVestingTerm;
    private final long halfLife;

    private GlobalTerms(Builder builder) {
        this.startPrice = builder.startPrice;
        this.minimumPrice = builder.minimumPrice;
        this.maxPayout = builder.maxPayout;
        this.priceAdjNum = builder.priceAdjNum;
        this.priceAdjDenom = builder.priceAdjDenom;
        this.capacity = builder.capacity;
        this.capacityIsPayout = builder.capacityIsPayout;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.globalVestingTerm = builder.globalVestingTerm;
        this.halfLife = builder.halfLife;
    }

    public static Builder builder() {
        return new Builder();
    }

    public BigInteger getStartPrice() {
        return startPrice;
    }

    public BigInteger getMinimumPrice() {
        return minimumPrice;
    }

    public BigInteger getMaxPayout() {
        return maxPayout;
    }

    public BigInteger getPriceAdjNum() {
        return priceAdjNum;
    }

    public BigInteger getPriceAdjDenom() {
        return priceAdjDenom;
    }

    public BigInteger getCapacity() {
        return capacity;
    }

    public boolean isCapacityIsPayout() {
        return capacityIsPayout;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getGlobalVestingTerm() {
        return globalVestingTerm;
    }

    public long getHalfLife() {
        return halfLife;
    }

    @Override
    public String toString() {
        return "GlobalTerms{" +
                "startPrice=" + startPrice +
                ", minimumPrice=" + minimumPrice +
                ", maxPayout=" + maxPayout +
                ", priceAdj=" + priceAdjNum + "/" + priceAdjDenom +
                ", capacity=" + capacity +
                ", capacityIsPayout=" + capacityIsPayout +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", globalVestingTerm=" + globalVestingTerm +
                ", halfLife=" + halfLife +
                '}';
    }

    public static final class Builder {

        private BigInteger startPrice = BigInteger.ZERO;
        private BigInteger minimumPrice = BigInteger.ZERO;
        private BigInteger maxPayout = BigInteger.ZERO;
        private BigInteger priceAdjNum = BigInteger.ZERO;
        private BigInteger priceAdjDenom = BigInteger.ONE;
        private BigInteger capacity = BigInteger.ZERO;
        private boolean capacityIsPayout;
        private long startTime;
        private long endTime;
        private long globalVestingTerm;
        private long halfLife;

        private Builder() {
        }

        public Builder startPrice(BigInteger startPrice) {
            this.startPrice = startPrice;
            return this;
        }

        public Builder minimumPrice(BigInteger minimumPrice) {
            this.minimumPrice = minimumPrice;
            return this;
        }

        public Builder maxPayout(BigInteger maxPayout) {
            this.maxPayout = maxPayout;
            return this;
        }

        public Builder priceAdjNum(BigInteger priceAdjNum) {
            this.priceAdjNum = priceAdjNum;
            return this;
        }

        public Builder priceAdjDenom(BigInteger priceAdjDenom) {
            this.priceAdjDenom = priceAdjDenom;
            return this;
        }

        public Builder capacity(BigInteger capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder capacityIsPayout(boolean capacityIsPayout) {
            this.capacityIsPayout = capacityIsPayout;
            return this;
        }

        public Builder startTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder globalVestingTerm(long globalVestingTerm) {
            this.globalVestingTerm = globalVestingTerm;
            return this;
        }

        public Builder halfLife(long halfLife) {
            this.halfLife = halfLife;
            return this;
        }

        public GlobalTerms build() {
            return new GlobalTerms(this);
        }
    }
}
