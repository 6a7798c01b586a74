package com.work.bond.core.teller;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.support.BondTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.work.bond.core.support.BondTestFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class BondTellerQuoteTest {

    private BondTestFixture fixture;
    private BondTeller teller;

    @BeforeEach
    public void setUp() {
        fixture = new BondTestFixture();
        teller = fixture.createTeller(false);
    }

    @Test
    public void quote_before_terms_fails_not_initialized() {
        assertCode(BondErrorCode.NOT_INITIALIZED, () -> teller.calculateAmountOut(BigInteger.ONE, false));
        assertCode(BondErrorCode.NOT_INITIALIZED, () -> teller.calculateAmountIn(BigInteger.ONE, false));
        assertCode(BondErrorCode.NOT_INITIALIZED, teller::bondPrice);
    }

    @Test
    public void quotes_at_start_price() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());

        assertEquals(BigInteger.valueOf(2), teller.bondPrice());
        assertEquals(tokens("1.5"), teller.calculateAmountOut(BigInteger.valueOf(3), false));
        assertEquals(BigInteger.valueOf(3), teller.calculateAmountIn(tokens("1.5"), false));
        // 单一费率模型下 stake 不影响报价
        assertEquals(teller.calculateAmountOut(BigInteger.valueOf(3), false),
                teller.calculateAmountOut(BigInteger.valueOf(3), true));
    }

    @Test
    public void quote_follows_decayed_price() {
        teller.setTerms(GOVERNANCE, scenarioTerms().startPrice(BigInteger.valueOf(4)).build());
        fixture.clock.advance(HALF_LIFE);

        assertEquals(BigInteger.valueOf(2), teller.bondPrice());
        assertEquals(tokens("1.5"), teller.calculateAmountOut(BigInteger.valueOf(3), false));
    }

    @Test
    public void round_trip_never_gains() {
        teller.setTerms(GOVERNANCE, scenarioTerms()
                .startPrice(BigInteger.valueOf(7))
                .capacity(BigInteger.valueOf(1_000_000))
                .build());
        for (long x = 1; x < 500; x += 13) {
            BigInteger in = BigInteger.valueOf(x);
            BigInteger out = teller.calculateAmountOut(in, false);
            assertTrue(teller.calculateAmountIn(out, false).compareTo(in) <= 0);
        }
    }

    @Test
    public void capacity_checked_in_principal_or_payout_units() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        assertCode(BondErrorCode.BOND_AT_CAPACITY, () -> teller.calculateAmountOut(BigInteger.valueOf(11), false));
        assertEquals(tokens("5"), teller.calculateAmountOut(BigInteger.TEN, false));

        teller.setTerms(GOVERNANCE, scenarioTerms().capacityIsPayout(true).capacity(tokens("1")).build());
        assertCode(BondErrorCode.BOND_AT_CAPACITY, () -> teller.calculateAmountOut(BigInteger.valueOf(3), false));
        assertEquals(tokens("1"), teller.calculateAmountOut(BigInteger.valueOf(2), false));
    }

    @Test
    public void max_payout_rejects_large_quotes_after_capacity() {
        teller.setTerms(GOVERNANCE, scenarioTerms().maxPayout(tokens("1")).build());

        assertCode(BondErrorCode.BOND_TOO_LARGE, () -> teller.calculateAmountOut(BigInteger.valueOf(3), false));
        assertCode(BondErrorCode.BOND_TOO_LARGE, () -> teller.calculateAmountIn(tokens("2"), false));
        // 同时超容量与超上限时先报容量
        assertCode(BondErrorCode.BOND_AT_CAPACITY, () -> teller.calculateAmountOut(BigInteger.valueOf(11), false));
    }

    @Test
    public void fully_decayed_price_fails_zero_price() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.clock.advance(2 * HALF_LIFE);

        assertEquals(BigInteger.ZERO, teller.bondPrice());
        assertCode(BondErrorCode.ZERO_PRICE, () -> teller.calculateAmountOut(BigInteger.ONE, false));
        assertCode(BondErrorCode.ZERO_PRICE, () -> teller.calculateAmountIn(BigInteger.ONE, false));
    }

    private static void assertCode(BondErrorCode expected, Runnable call) {
        BondException ex = assertThrows(BondException.class, call::run);
        assertEquals(expected, ex.getCode());
    }
}
