package com.work.bond.core.pricing;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.model.GlobalTerms;
import com.work.bond.core.model.TermsState;

import java.math.BigInteger;

/**
 * 价格与数量换算（纯函数，无状态）。
 *
 * 价格 = 每一个完整奖励代币（{@link #ONE_PAYOUT} 个基本单位）需要的本金基本单位数。
 * 全部为整数运算并向下取整，保证 in(out(x)) <= x 与 out(in(y)) <= y。
 */
public final class BondPricing {

    public static final BigInteger ONE_PAYOUT = BigInteger.TEN.pow(18);

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private BondPricing() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 当前价格：锚点价格高于底价时，超出底价的部分按半衰期衰减；否则直接返回底价。
     */
    public static BigInteger currentPrice(TermsState state, long now) {
        GlobalTerms terms = state.getTerms();
        BigInteger minimumPrice = terms.getMinimumPrice();
        BigInteger nextPrice = state.getNextPrice();
        if (nextPrice.compareTo(minimumPrice) <= 0) {
            return minimumPrice;
        }
        long elapsed = Math.max(0L, now - state.getLastPriceUpdate());
        return minimumPrice.add(decay(nextPrice.subtract(minimumPrice), elapsed, terms.getHalfLife()));
    }

    /**
     * 每经过一个完整半衰期右移一位，区间内再线性扣减最多一半：
     * {@code (v >> (t/h)) - (v >> (t/h)) * (t % h) / h / 2}。
     * 对 t 单调不增。
     */
    public static BigInteger decay(BigInteger value, long elapsed, long halfLife) {
        if (halfLife <= 0) {
            throw new BondException(BondErrorCode.INVALID_HALF_LIFE);
        }
        long halvings = elapsed / halfLife;
        if (halvings >= value.bitLength()) {
            return BigInteger.ZERO;
        }
        BigInteger halved = value.shiftRight((int) halvings);
        BigInteger linear = halved.multiply(BigInteger.valueOf(elapsed % halfLife))
                .divide(BigInteger.valueOf(halfLife))
                .divide(TWO);
        return halved.subtract(linear);
    }

    /**
     * amountIn 本金可以买到的奖励数量。
     */
    public static BigInteger amountOut(BigInteger amountIn, BigInteger price) {
        requirePositivePrice(price);
        return amountIn.multiply(ONE_PAYOUT).divide(price);
    }

    /**
     * 买到 amountOut 奖励所需的本金数量。
     */
    public static BigInteger amountIn(BigInteger amountOut, BigInteger price) {
        requirePositivePrice(price);
        return amountOut.multiply(price).divide(ONE_PAYOUT);
    }

    /**
     * 成交后的新价格锚点：在衰减后的价格上按成交量加价，
     * {@code decayed + decayed * payout * num / (denom * ONE)}。
     * 这是价格唯一会上涨的地方。
     */
    public static BigInteger adjustedPrice(BigInteger decayedPrice, BigInteger payout, GlobalTerms terms) {
        BigInteger markup = decayedPrice.multiply(payout).multiply(terms.getPriceAdjNum())
                .divide(terms.getPriceAdjDenom().multiply(ONE_PAYOUT));
        return decayedPrice.add(markup);
    }

    private static void requirePositivePrice(BigInteger price) {
        if (price == null || price.signum() <= 0) {
            throw new BondException(BondErrorCode.ZERO_PRICE);
        }
    }
}
