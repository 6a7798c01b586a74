package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * 条款快照。
 */
public class TermsView {

    private BigInteger startPrice;

    private BigInteger minimumPrice;

    private BigInteger maxPayout;

    private BigInteger priceAdjNum;

    private BigInteger priceAdjDenom;

    private BigInteger capacity;

    private boolean capacityIsPayout;

    private long startTime;

    private long endTime;

    private long globalVestingTerm;

    private long halfLife;

    public BigInteger getStartPrice() {
        return startPrice;
    }

    public void setStartPrice(BigInteger startPrice) {
        this.startPrice = startPrice;
    }

    public BigInteger getMinimumPrice() {
        return minimumPrice;
    }

    public void setMinimumPrice(BigInteger minimumPrice) {
        this.minimumPrice = minimumPrice;
    }

    public BigInteger getMaxPayout() {
        return maxPayout;
    }

    public void setMaxPayout(BigInteger maxPayout) {
        this.maxPayout = maxPayout;
    }

    public BigInteger getPriceAdjNum() {
        return priceAdjNum;
    }

    public void setPriceAdjNum(BigInteger priceAdjNum) {
        this.priceAdjNum = priceAdjNum;
    }

    public BigInteger getPriceAdjDenom() {
        return priceAdjDenom;
    }

    public void setPriceAdjDenom(BigInteger priceAdjDenom) {
        this.priceAdjDenom = priceAdjDenom;
    }

    public BigInteger getCapacity() {
        return capacity;
    }

    public void setCapacity(BigInteger capacity) {
        this.capacity = capacity;
    }

    public boolean isCapacityIsPayout() {
        return capacityIsPayout;
    }

    public void setCapacityIsPayout(boolean capacityIsPayout) {
        this.capacityIsPayout = capacityIsPayout;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getGlobalVestingTerm() {
        return globalVestingTerm;
    }

    public void setGlobalVestingTerm(long globalVestingTerm) {
        this.globalVestingTerm = globalVestingTerm;
    }

    public long getHalfLife() {
        return halfLife;
    }

    public void setHalfLife(long halfLife) {
        this.halfLife = halfLife;
    }
}
