package com.work.bond.core.teller;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.ledger.LockPosition;
import com.work.bond.core.ledger.PermitDigest;
import com.work.bond.core.ledger.PermitSignature;
import com.work.bond.core.model.Bond;
import com.work.bond.core.model.DepositResult;
import com.work.bond.core.support.BondTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.Collections;

import static com.work.bond.core.support.BondTestFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class BondTellerDepositTest {

    private static final String ZERO = "0x0000000000000000000000000000000000000000";

    private BondTestFixture fixture;
    private BondTeller teller;

    @BeforeEach
    public void setUp() {
        fixture = new BondTestFixture();
        teller = fixture.createTeller(false);
        fixture.fund(ALICE, teller.getAddress(), 100);
    }

    @Test
    public void deposit_mints_bond_and_consumes_capacity() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());

        DepositResult result = teller.deposit(ALICE, BigInteger.valueOf(3), BigInteger.ZERO, ALICE, false);

        assertEquals(1L, result.getId());
        assertFalse(result.isStake());
        assertEquals(tokens("1.5"), result.getPayout());
        assertEquals(BigInteger.valueOf(7), teller.getCapacity());

        Bond bond = teller.getBond(1L);
        assertEquals(BigInteger.valueOf(3), bond.getPrincipalPaid());
        assertEquals(tokens("1.5"), bond.getPayoutAmount());
        assertEquals(START, bond.getVestingStart());
        assertEquals(VESTING_TERM, bond.getLocalVestingTerm());
        assertEquals(ALICE, teller.ownerOf(1L));

        // 奖励留在 teller 名下等待归属，本金全部进入承保池（费率为 0）
        assertEquals(tokens("1.5"), fixture.ledger.balanceOf(REWARD, teller.getAddress()));
        assertEquals(BigInteger.valueOf(3), fixture.ledger.balanceOf(PRINCIPAL, POOL));
        assertEquals(BigInteger.valueOf(97), fixture.ledger.balanceOf(PRINCIPAL, ALICE));
        verify(fixture.listener).bondCreated(teller.getAddress(), 1L, BigInteger.valueOf(3), tokens("1.5"), START, VESTING_TERM);
    }

    @Test
    public void protocol_fee_splits_principal_between_dao_and_pool() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        teller.setFees(GOVERNANCE, 1_000);

        teller.deposit(ALICE, BigInteger.TEN, BigInteger.ZERO, ALICE, false);

        assertEquals(BigInteger.ONE, fixture.ledger.balanceOf(PRINCIPAL, DAO));
        assertEquals(BigInteger.valueOf(9), fixture.ledger.balanceOf(PRINCIPAL, POOL));
        assertEquals(BigInteger.ZERO, teller.getCapacity());
    }

    @Test
    public void stake_deposit_opens_lock_instead_of_bond() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());

        DepositResult result = teller.deposit(ALICE, BigInteger.valueOf(4), BigInteger.ZERO, BOB, true);

        assertTrue(result.isStake());
        assertEquals(0L, teller.getNumBonds());
        assertEquals(0L, teller.totalSupply());
        LockPosition lock = fixture.vault.getLock(result.getId()).orElseThrow(IllegalStateException::new);
        assertEquals(BOB, lock.getOwner());
        assertEquals(tokens("2"), lock.getAmount());
        assertEquals(START + VESTING_TERM, lock.getEnd());
        assertEquals(tokens("2"), fixture.ledger.balanceOf(REWARD, LOCK_VAULT));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(REWARD, teller.getAddress()));
        verify(fixture.listener).lockCreated(teller.getAddress(), result.getId(), BOB, tokens("2"), START + VESTING_TERM);
        verify(fixture.listener, never()).bondCreated(anyString(), anyLong(), any(), any(), anyLong(), anyLong());
    }

    @Test
    public void receive_treats_direct_transfer_as_deposit_for_sender() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.ledger.credit(PRINCIPAL, BOB, BigInteger.valueOf(4));

        DepositResult result = teller.receive(BOB, BigInteger.valueOf(4));

        assertEquals(BOB, teller.ownerOf(result.getId()));
        assertEquals(tokens("2"), result.getPayout());
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(PRINCIPAL, BOB));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(PRINCIPAL, teller.getAddress()));
        assertEquals(BigInteger.valueOf(4), fixture.ledger.balanceOf(PRINCIPAL, POOL));
    }

    @Test
    public void signed_deposit_applies_permit_then_pulls_from_depositor() {
        BondTestFixture permitFixture = new BondTestFixture();
        BondTeller permitTeller = permitFixture.createTeller(true);
        permitFixture.ledger.enablePermit(PRINCIPAL);
        permitTeller.setTerms(GOVERNANCE, scenarioTerms().build());

        ECKeyPair key = ECKeyPair.create(new BigInteger("4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16));
        String depositor = "0x" + Keys.getAddress(key);
        permitFixture.ledger.credit(PRINCIPAL, depositor, BigInteger.valueOf(3));
        long deadline = START + 60;
        byte[] digest = PermitDigest.digest(PRINCIPAL, depositor, permitTeller.getAddress(),
                BigInteger.valueOf(3), BigInteger.ZERO, deadline);
        PermitSignature signature = PermitSignature.from(Sign.signMessage(digest, key, false));

        DepositResult result = permitTeller.depositSigned(CAROL, BigInteger.valueOf(3), BigInteger.ZERO,
                depositor, false, deadline, signature);

        assertEquals(depositor, permitTeller.ownerOf(result.getId()));
        assertEquals(BigInteger.ZERO, permitFixture.ledger.balanceOf(PRINCIPAL, depositor));
        assertEquals(BigInteger.ONE, permitFixture.ledger.nonces(PRINCIPAL, depositor));
    }

    @Test
    public void signed_deposit_requires_permittable_principal() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        PermitSignature signature = PermitSignature.of(27, "0x01", "0x02");

        assertCode(BondErrorCode.PERMIT_NOT_SUPPORTED, () -> teller.depositSigned(ALICE, BigInteger.ONE, BigInteger.ZERO,
                ALICE, false, START + 60, signature));
    }

    @Test
    public void paused_teller_rejects_signed_deposit_before_permit() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        teller.pause(GOVERNANCE);
        PermitSignature signature = PermitSignature.of(27, "0x01", "0x02");

        // principal 不支持 permit，但暂停检查先生效
        assertCode(BondErrorCode.PAUSED, () -> teller.depositSigned(ALICE, BigInteger.ONE, BigInteger.ZERO,
                ALICE, false, START + 60, signature));
        assertEquals(BigInteger.ZERO, fixture.ledger.nonces(PRINCIPAL, ALICE));
    }

    @Test
    public void paused_teller_rejects_receive_before_transfer() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        teller.pause(GOVERNANCE);

        // BOB 没有本金：若先转账会报余额不足
        assertCode(BondErrorCode.PAUSED, () -> teller.receive(BOB, BigInteger.valueOf(4)));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(PRINCIPAL, teller.getAddress()));
        assertEquals(BigInteger.TEN, teller.getCapacity());
    }

    @Test
    public void slippage_failure_leaves_no_trace() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        BigInteger quote = teller.calculateAmountOut(BigInteger.valueOf(3), false);

        assertCode(BondErrorCode.SLIPPAGE, () -> teller.deposit(ALICE, BigInteger.valueOf(3),
                quote.add(BigInteger.ONE), ALICE, false));

        assertEquals(BigInteger.TEN, teller.getCapacity());
        assertEquals(BigInteger.valueOf(2), teller.getNextPrice());
        assertEquals(0L, teller.getNumBonds());
        assertEquals(BigInteger.valueOf(100), fixture.ledger.balanceOf(PRINCIPAL, ALICE));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(REWARD, teller.getAddress()));
    }

    @Test
    public void deposit_over_capacity_is_rejected_not_capped() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        teller.deposit(ALICE, BigInteger.valueOf(3), BigInteger.ZERO, ALICE, false);

        assertCode(BondErrorCode.BOND_AT_CAPACITY, () -> teller.deposit(ALICE, BigInteger.valueOf(8),
                BigInteger.ZERO, ALICE, false));

        assertEquals(BigInteger.valueOf(7), teller.getCapacity());
        assertEquals(1L, teller.getNumBonds());
        teller.deposit(ALICE, BigInteger.valueOf(7), BigInteger.ZERO, ALICE, false);
        assertEquals(BigInteger.ZERO, teller.getCapacity());
    }

    @Test
    public void validation_order_paused_then_window_then_price() {
        teller.setTerms(GOVERNANCE, scenarioTerms().startTime(START + 10).build());
        teller.pause(GOVERNANCE);
        assertCode(BondErrorCode.PAUSED, () -> deposit(3));

        teller.unpause(GOVERNANCE);
        assertCode(BondErrorCode.BOND_NOT_STARTED, () -> deposit(3));

        fixture.clock.advance(100_011L);
        assertCode(BondErrorCode.BOND_CONCLUDED, () -> deposit(3));
    }

    @Test
    public void deposit_before_terms_fails_not_initialized() {
        assertCode(BondErrorCode.NOT_INITIALIZED, () -> deposit(3));
    }

    @Test
    public void fully_decayed_price_rejects_deposit() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.clock.advance(2 * HALF_LIFE);
        assertCode(BondErrorCode.ZERO_PRICE, () -> deposit(3));
    }

    @Test
    public void max_payout_and_zero_recipient_are_rejected() {
        teller.setTerms(GOVERNANCE, scenarioTerms().maxPayout(tokens("1")).build());
        assertCode(BondErrorCode.BOND_TOO_LARGE, () -> deposit(3));
        assertCode(BondErrorCode.INVALID_ADDRESS, () -> teller.deposit(ALICE, BigInteger.valueOf(2),
                BigInteger.ZERO, ZERO, false));
    }

    @Test
    public void ledger_failure_rolls_back_capacity_and_bond() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.ledger.approve(PRINCIPAL, ALICE, teller.getAddress(), BigInteger.ONE);

        assertCode(BondErrorCode.INSUFFICIENT_ALLOWANCE, () -> deposit(3));

        assertEquals(BigInteger.TEN, teller.getCapacity());
        assertEquals(0L, teller.getNumBonds());
        assertFalse(teller.exists(1L));
    }

    @Test
    public void depository_must_authorize_teller_and_hold_minter_role() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        fixture.ledger.removeMinter(REWARD, DEPOSITORY);
        assertCode(BondErrorCode.NOT_MINTER, () -> deposit(3));

        fixture.ledger.addMinter(REWARD, DEPOSITORY);
        fixture.depository.removeTeller(GOVERNANCE, teller.getAddress());
        assertCode(BondErrorCode.NOT_TELLER, () -> deposit(3));

        assertEquals(BigInteger.TEN, teller.getCapacity());
        assertEquals(BigInteger.valueOf(100), fixture.ledger.balanceOf(PRINCIPAL, ALICE));
    }

    @Test
    public void deposit_marks_up_price_and_resets_decay_anchor() {
        teller.setTerms(GOVERNANCE, scenarioTerms()
                .startPrice(BigInteger.valueOf(1_000))
                .priceAdjNum(BigInteger.ONE)
                .priceAdjDenom(BigInteger.TEN)
                .capacity(BigInteger.valueOf(1_000_000))
                .build());
        fixture.fund(ALICE, teller.getAddress(), 10_000);
        fixture.clock.advance(5);

        teller.deposit(ALICE, BigInteger.valueOf(10_000), BigInteger.ZERO, ALICE, false);

        // 衰减后价格 998（1000 - 1000*5/1000/2 取整），成交 10000/998 个代币，加价 10%/代币
        BigInteger decayed = BigInteger.valueOf(998);
        BigInteger payout = BigInteger.valueOf(10_000).multiply(BigInteger.TEN.pow(18)).divide(decayed);
        BigInteger expected = decayed.add(decayed.multiply(payout).divide(BigInteger.TEN.multiply(BigInteger.TEN.pow(18))));
        assertEquals(expected, teller.getNextPrice());
        assertEquals(START + 5, teller.getLastPriceUpdate());
        assertTrue(teller.bondPrice().compareTo(decayed) > 0);
    }

    @Test
    public void reentrant_claim_during_deposit_is_rejected_and_rolled_back() {
        teller.setTerms(GOVERNANCE, scenarioTerms().build());
        doAnswer(invocation -> teller.claimPayout(ALICE, 1L))
                .when(fixture.listener).bondCreated(anyString(), anyLong(), any(), any(), anyLong(), anyLong());

        assertCode(BondErrorCode.REENTRANT_CALL, () -> deposit(3));

        assertEquals(0L, teller.getNumBonds());
        assertEquals(Collections.emptyList(), teller.listBondsOfOwner(ALICE));
        assertEquals(BigInteger.TEN, teller.getCapacity());
    }

    private DepositResult deposit(long amountIn) {
        return teller.deposit(ALICE, BigInteger.valueOf(amountIn), BigInteger.ZERO, ALICE, false);
    }

    private static void assertCode(BondErrorCode expected, Runnable call) {
        BondException ex = assertThrows(BondException.class, call::run);
        assertEquals(expected, ex.getCode());
    }
}
