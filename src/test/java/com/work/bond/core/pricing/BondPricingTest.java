package com.work.bond.core.pricing;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.model.GlobalTerms;
import com.work.bond.core.model.TermsState;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BondPricingTest {

    private static final long H = 1_000L;

    @Test
    public void decay_halves_once_per_half_life() {
        BigInteger v = BigInteger.valueOf(1_000_000);
        assertEquals(v, BondPricing.decay(v, 0, H));
        assertEquals(BigInteger.valueOf(500_000), BondPricing.decay(v, H, H));
        assertEquals(BigInteger.valueOf(250_000), BondPricing.decay(v, 2 * H, H));
    }

    @Test
    public void decay_is_linear_inside_interval() {
        BigInteger v = BigInteger.valueOf(1_000_000);
        // 半个区间：扣掉一半的一半
        assertEquals(BigInteger.valueOf(750_000), BondPricing.decay(v, H / 2, H));
        // 第二个区间的一半：500000 - 500000/4
        assertEquals(BigInteger.valueOf(375_000), BondPricing.decay(v, H + H / 2, H));
    }

    @Test
    public void decay_is_monotone_and_reaches_zero() {
        BigInteger v = BigInteger.TEN.pow(20);
        BigInteger previous = v;
        for (long t = 0; t <= 80 * H; t += 37) {
            BigInteger current = BondPricing.decay(v, t, H);
            assertTrue(current.compareTo(previous) <= 0, "t=" + t);
            previous = current;
        }
        assertEquals(BigInteger.ZERO, BondPricing.decay(v, 1_000 * H, H));
        assertEquals(BigInteger.ZERO, BondPricing.decay(v, Long.MAX_VALUE, H));
    }

    @Test
    public void current_price_never_below_minimum() {
        GlobalTerms terms = terms(100, 40);
        TermsState state = new TermsState(terms, 0L);
        assertEquals(BigInteger.valueOf(100), BondPricing.currentPrice(state, 0L));
        assertEquals(BigInteger.valueOf(70), BondPricing.currentPrice(state, H));
        assertEquals(BigInteger.valueOf(40), BondPricing.currentPrice(state, 100 * H));
    }

    @Test
    public void current_price_is_minimum_when_anchor_at_or_below_floor() {
        // minimumPrice > startPrice 不做校验，直接取底价
        TermsState state = new TermsState(terms(10, 50), 0L);
        assertEquals(BigInteger.valueOf(50), BondPricing.currentPrice(state, 0L));
        assertEquals(BigInteger.valueOf(50), BondPricing.currentPrice(state, 10 * H));
    }

    @Test
    public void amount_conversion_truncates_and_round_trip_never_gains() {
        BigInteger price = BigInteger.valueOf(3);
        BigInteger in = BigInteger.valueOf(10);
        BigInteger out = BondPricing.amountOut(in, price);
        assertEquals(new BigInteger("3333333333333333333"), out);
        assertTrue(BondPricing.amountIn(out, price).compareTo(in) <= 0);

        BigInteger wantOut = new BigInteger("1000000000000000001");
        BigInteger needIn = BondPricing.amountIn(wantOut, price);
        assertTrue(BondPricing.amountOut(needIn, price).compareTo(wantOut) <= 0);
    }

    @Test
    public void zero_price_is_rejected() {
        BondException ex = assertThrows(BondException.class,
                () -> BondPricing.amountOut(BigInteger.ONE, BigInteger.ZERO));
        assertEquals(BondErrorCode.ZERO_PRICE, ex.getCode());
    }

    @Test
    public void adjusted_price_marks_up_by_payout_in_whole_tokens() {
        GlobalTerms terms = GlobalTerms.builder()
                .startPrice(BigInteger.valueOf(1_000))
                .priceAdjNum(BigInteger.ONE)
                .priceAdjDenom(BigInteger.valueOf(100))
                .halfLife(H)
                .build();
        // 10 个完整代币，每个加价 1%
        BigInteger payout = BondPricing.ONE_PAYOUT.multiply(BigInteger.TEN);
        assertEquals(BigInteger.valueOf(1_100), BondPricing.adjustedPrice(BigInteger.valueOf(1_000), payout, terms));
        assertEquals(BigInteger.valueOf(1_000), BondPricing.adjustedPrice(BigInteger.valueOf(1_000), BigInteger.ZERO, terms));
    }

    private static GlobalTerms terms(long startPrice, long minimumPrice) {
        return GlobalTerms.builder()
                .startPrice(BigInteger.valueOf(startPrice))
                .minimumPrice(BigInteger.valueOf(minimumPrice))
                .priceAdjDenom(BigInteger.ONE)
                .halfLife(H)
                .build();
    }
}
