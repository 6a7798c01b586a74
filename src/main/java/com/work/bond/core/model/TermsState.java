package com.work.bond.core.model;

import java.math.BigInteger;

/**
 * teller 当前生效的条款与随交易变化的部分：剩余容量、价格锚点及其更新时间。
 * 只在执行模板的事务内修改。
 */
public class TermsState {

    private final GlobalTerms terms;
    private BigInteger capacity;
    private BigInteger nextPrice;
    private long lastPriceUpdate;

    public TermsState(GlobalTerms terms, long now) {
        this(terms, terms.getCapacity(), terms.getStartPrice(), now);
    }

    private TermsState(GlobalTerms terms, BigInteger capacity, BigInteger nextPrice, long lastPriceUpdate) {
        this.terms = terms;
        this.capacity = capacity;
        this.nextPrice = nextPrice;
        this.lastPriceUpdate = lastPriceUpdate;
    }

    public TermsState copy() {
        return new TermsState(terms, capacity, nextPrice, lastPriceUpdate);
    }

    public GlobalTerms getTerms() {
        return terms;
    }

    public BigInteger getCapacity() {
        return capacity;
    }

    public void setCapacity(BigInteger capacity) {
        this.capacity = capacity;
    }

    public BigInteger getNextPrice() {
        return nextPrice;
    }

    public void setNextPrice(BigInteger nextPrice) {
        this.nextPrice = nextPrice;
    }

    public long getLastPriceUpdate() {
        return lastPriceUpdate;
    }

    public void setLastPriceUpdate(long lastPriceUpdate) {
        this.lastPriceUpdate = lastPriceUpdate;
    }
}
