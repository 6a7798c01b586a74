package com.work.bond.core.support;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.ledger.LockPosition;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryLockVaultTest {

    private static final String VAULT = "0x4000000000000000000000000000000000000004";
    private static final String REWARD = "0x3000000000000000000000000000000000000003";
    private static final String FUNDER = "0xd000000000000000000000000000000000000004";
    private static final String OWNER = "0xa000000000000000000000000000000000000001";
    private static final String OTHER = "0xb000000000000000000000000000000000000002";

    private final MutableClock clock = new MutableClock(1_000L);
    private final BondExecutionTemplate template = new BondExecutionTemplate();
    private final InMemoryAssetLedger ledger = new InMemoryAssetLedger(clock, template);
    private final InMemoryLockVault vault = new InMemoryLockVault(VAULT, REWARD, ledger, clock, template);

    @Test
    public void create_lock_pulls_funds_from_approved_funder() {
        ledger.credit(REWARD, FUNDER, BigInteger.TEN);
        assertThrows(BondException.class, () -> vault.createLock(FUNDER, OWNER, BigInteger.TEN, 2_000L));

        ledger.approve(REWARD, FUNDER, VAULT, BigInteger.TEN);
        long lockId = vault.createLock(FUNDER, OWNER, BigInteger.TEN, 2_000L);

        assertEquals(1L, lockId);
        assertEquals(BigInteger.TEN, ledger.balanceOf(REWARD, VAULT));
        LockPosition lock = vault.getLock(lockId).orElseThrow(IllegalStateException::new);
        assertEquals(OWNER, lock.getOwner());
        assertEquals(2_000L, lock.getEnd());
        assertEquals(1, vault.listLocksOfOwner(OWNER).size());
    }

    @Test
    public void withdraw_only_by_owner_after_end() {
        ledger.credit(REWARD, FUNDER, BigInteger.TEN);
        ledger.approve(REWARD, FUNDER, VAULT, BigInteger.TEN);
        long lockId = vault.createLock(FUNDER, OWNER, BigInteger.TEN, 2_000L);

        assertCode(BondErrorCode.LOCK_NOT_OWNER, () -> vault.withdraw(OTHER, lockId, OTHER));
        assertCode(BondErrorCode.LOCKED, () -> vault.withdraw(OWNER, lockId, OWNER));

        clock.set(2_000L);
        assertEquals(BigInteger.TEN, vault.withdraw(OWNER, lockId, OWNER));
        assertEquals(BigInteger.TEN, ledger.balanceOf(REWARD, OWNER));
        assertCode(BondErrorCode.LOCK_NOT_FOUND, () -> vault.withdraw(OWNER, lockId, OWNER));
    }

    private static void assertCode(BondErrorCode expected, Runnable call) {
        BondException ex = assertThrows(BondException.class, call::run);
        assertEquals(expected, ex.getCode());
    }
}
