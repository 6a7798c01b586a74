package com.work.bond.core.teller;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.model.GlobalTerms;
import com.work.bond.core.model.TellerConfig;
import com.work.bond.core.model.TellerState;
import com.work.bond.core.support.BondTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.work.bond.core.support.BondTestFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class BondTellerAdminTest {

    private static final String ZERO = "0x0000000000000000000000000000000000000000";

    private BondTestFixture fixture;
    private BondTeller teller;

    @BeforeEach
    public void setUp() {
        fixture = new BondTestFixture();
        teller = fixture.createTeller(false);
    }

    @Test
    public void state_moves_from_uninitialized_to_active() {
        BondTeller raw = new BondTeller("0x9000000000000000000000000000000000000009", fixture.context);
        assertEquals(TellerState.UNINITIALIZED, raw.state());

        assertEquals(TellerState.TERMS_UNSET, teller.state());
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        assertEquals(TellerState.ACTIVE, teller.state());
        teller.pause(GOVERNANCE);
        teller.pause(GOVERNANCE);
        assertEquals(TellerState.PAUSED, teller.state());
        verify(fixture.listener, times(2)).paused(teller.getAddress());
        teller.unpause(GOVERNANCE);
        assertEquals(TellerState.ACTIVE, teller.state());
    }

    @Test
    public void initialize_only_once() {
        TellerConfig config = teller.getConfig();
        assertCode(BondErrorCode.ALREADY_INITIALIZED, () -> teller.initialize("again", BOB, config));
        assertEquals(GOVERNANCE, teller.getGovernance());
    }

    @Test
    public void set_terms_validation_order() {
        assertCode(BondErrorCode.INVALID_PRICE, () -> teller.setTerms(GOVERNANCE, scenarioTerms()
                .startPrice(BigInteger.ZERO).priceAdjDenom(BigInteger.ZERO).build()));
        assertCode(BondErrorCode.DIVIDE_BY_ZERO, () -> teller.setTerms(GOVERNANCE, scenarioTerms()
                .priceAdjDenom(BigInteger.ZERO).startTime(START + 1).endTime(START).build()));
        assertCode(BondErrorCode.INVALID_DATES, () -> teller.setTerms(GOVERNANCE, scenarioTerms()
                .startTime(START + 1).endTime(START).halfLife(0).build()));
        assertCode(BondErrorCode.INVALID_HALF_LIFE, () -> teller.setTerms(GOVERNANCE, scenarioTerms()
                .halfLife(0).build()));
        assertCode(BondErrorCode.INVALID_TERMS, () -> teller.setTerms(GOVERNANCE, scenarioTerms()
                .capacity(BigInteger.valueOf(-1)).build()));
        assertFalse(teller.isTermsSet());
    }

    @Test
    public void set_terms_resets_price_anchor_and_capacity() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.fund(ALICE, teller.getAddress(), 10);
        teller.deposit(ALICE, BigInteger.valueOf(3), BigInteger.ZERO, ALICE, false);
        fixture.clock.advance(50);

        GlobalTerms fresh = scenarioTerms().startPrice(BigInteger.valueOf(5)).capacity(BigInteger.valueOf(20)).build();
        teller.setTerms(GOVERNANCE, fresh);

        assertEquals(BigInteger.valueOf(20), teller.getCapacity());
        assertEquals(BigInteger.valueOf(5), teller.getNextPrice());
        assertEquals(START + 50, teller.getLastPriceUpdate());
        assertEquals(BigInteger.valueOf(5), teller.getTerms().getStartPrice());
        verify(fixture.listener, times(2)).termsSet(teller.getAddress());
    }

    @Test
    public void minimum_above_start_price_is_accepted() {
        teller.setTerms(GOVERNANCE, scenarioTerms().minimumPrice(BigInteger.valueOf(3)).build());
        assertEquals(BigInteger.valueOf(3), teller.bondPrice());
    }

    @Test
    public void admin_calls_require_governance() {
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.setTerms(ALICE, scenarioTerms().build()));
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.setFees(ALICE, 10));
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.pause(ALICE));
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.unpause(ALICE));
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.setAddresses(ALICE, teller.getConfig()));
        assertEquals(TellerState.TERMS_UNSET, teller.state());
    }

    @Test
    public void fees_are_bounded_by_ten_thousand_bps() {
        teller.setFees(GOVERNANCE, 10_000);
        assertEquals(10_000, teller.getProtocolFeeBps());
        assertCode(BondErrorCode.INVALID_PROTOCOL_FEE, () -> teller.setFees(GOVERNANCE, 10_001));
        assertEquals(10_000, teller.getProtocolFeeBps());
        verify(fixture.listener).feesSet(teller.getAddress(), 10_000);
    }

    @Test
    public void set_addresses_rejects_zero_and_replaces_config() {
        assertCode(BondErrorCode.ZERO_ADDRESS_DAO,
                () -> new TellerConfig(REWARD, LOCK_VAULT, POOL, ZERO, PRINCIPAL, false, DEPOSITORY));
        assertCode(BondErrorCode.ZERO_ADDRESS_REWARD,
                () -> new TellerConfig(ZERO, LOCK_VAULT, POOL, DAO, PRINCIPAL, false, DEPOSITORY));

        TellerConfig updated = new TellerConfig(REWARD, LOCK_VAULT, POOL, CAROL, PRINCIPAL, true, DEPOSITORY);
        teller.setAddresses(GOVERNANCE, updated);

        assertEquals(CAROL, teller.getConfig().getDao());
        assertTrue(teller.getConfig().isPermittable());
    }

    @Test
    public void governance_transfer_and_lock() {
        teller.setPendingGovernance(GOVERNANCE, BOB);
        teller.acceptGovernance(BOB);
        assertEquals(BOB, teller.getGovernance());
        assertCode(BondErrorCode.NOT_GOVERNANCE, () -> teller.pause(GOVERNANCE));

        teller.lockGovernance(BOB);
        assertTrue(teller.isGovernanceLocked());
        assertCode(BondErrorCode.GOVERNANCE_LOCKED, () -> teller.pause(BOB));
    }

    private static void assertCode(BondErrorCode expected, Runnable call) {
        BondException ex = assertThrows(BondException.class, call::run);
        assertEquals(expected, ex.getCode());
    }
}
