package com.work.bond.demo.web.dto;

import java.math.BigInteger;
import javax.validation.constraints.NotNull;

/**
 * 设置条款请求。价格单位：每个完整奖励代币对应的本金基本单位。
 */
public class TermsRequest {

    @NotNull(message = "startPrice 不能为空")
    private BigInteger startPrice;

    @NotNull(message = "minimumPrice 不能为空")
    private BigInteger minimumPrice;

    @NotNull(message = "maxPayout 不能为空")
    private BigInteger maxPayout;

    @NotNull(message = "priceAdjNum 不能为空")
    private BigInteger priceAdjNum;

    @NotNull(message = "priceAdjDenom 不能为空")
    private BigInteger priceAdjDenom;

    @NotNull(message = "capacity 不能为空")
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
