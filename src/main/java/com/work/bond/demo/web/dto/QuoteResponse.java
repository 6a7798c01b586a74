package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * 报价结果。
 */
public class QuoteResponse {

    private BigInteger amountIn;

    private BigInteger amountOut;

    private BigInteger price;

    private boolean stake;

    public BigInteger getAmountIn() {
        return amountIn;
    }

    public void setAmountIn(BigInteger amountIn) {
        this.amountIn = amountIn;
    }

    public BigInteger getAmountOut() {
        return amountOut;
    }

    public void setAmountOut(BigInteger amountOut) {
        this.amountOut = amountOut;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }

    public boolean isStake() {
        return stake;
    }

    public void setStake(boolean stake) {
        this.stake = stake;
    }
}
