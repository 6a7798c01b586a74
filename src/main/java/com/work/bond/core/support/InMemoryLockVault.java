package com.work.bond.core.support;

import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.exception.BondNotFoundException;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.execution.Revertible;
import com.work.bond.core.ledger.AssetLedger;
import com.work.bond.core.ledger.LockPosition;
import com.work.bond.core.ledger.LockVault;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonNegative;
import static com.work.bond.core.support.ValidationUtils.requireNonNull;
import static com.work.bond.core.support.ValidationUtils.requireNonZeroAddress;

/**
 * 纯内存锁仓金库：锁仓期间资产由金库地址持有，到期后 owner 可提取。
 * 注意：该实现仅用于 demo 与测试。
 */
public class InMemoryLockVault implements LockVault, Revertible {

    private final String address;
    private final String lockedAsset;
    private final AssetLedger ledger;
    private final Clock clock;
    private final BondExecutionTemplate executionTemplate;

    private Map<Long, LockPosition> locks = new LinkedHashMap<>();
    private long totalNumLocks;

    public InMemoryLockVault(String address, String lockedAsset, AssetLedger ledger, Clock clock,
                             BondExecutionTemplate executionTemplate) {
        this.address = requireNonZeroAddress(address, BondErrorCode.ZERO_ADDRESS_LOCK_VAULT);
        this.lockedAsset = requireNonZeroAddress(lockedAsset, BondErrorCode.ZERO_ADDRESS_REWARD);
        this.ledger = requireNonNull(ledger, "ledger");
        this.clock = requireNonNull(clock, "clock");
        this.executionTemplate = requireNonNull(executionTemplate, "executionTemplate");
        executionTemplate.register(this);
    }

    @Override
    public String getAddress() {
        return address;
    }

    public String getLockedAsset() {
        return lockedAsset;
    }

    @Override
    public long createLock(String funder, String owner, BigInteger amount, long end) {
        requireNonNegative(amount, "amount");
        return executionTemplate.execute(() -> {
            String lockOwner = requireNonZeroAddress(owner, BondErrorCode.INVALID_ADDRESS);
            // 与链上金库一致：funder 需要事先 approve 金库
            ledger.transferFrom(lockedAsset, address, funder, address, amount);
            long lockId = ++totalNumLocks;
            locks.put(lockId, new LockPosition(lockId, lockOwner, amount, end));
            return lockId;
        });
    }

    public Optional<LockPosition> getLock(long lockId) {
        return executionTemplate.read(() -> Optional.ofNullable(locks.get(lockId)));
    }

    public List<LockPosition> listLocksOfOwner(String owner) {
        String normalized = normalizeAddress(owner);
        return executionTemplate.read(() -> {
            List<LockPosition> result = new ArrayList<>();
            for (LockPosition lock : locks.values()) {
                if (lock.getOwner().equals(normalized)) {
                    result.add(lock);
                }
            }
            return Collections.unmodifiableList(result);
        });
    }

    public long getTotalNumLocks() {
        return executionTemplate.read(() -> totalNumLocks);
    }

    /**
     * 到期后提取锁仓资产到 recipient，锁仓随即删除。
     */
    public BigInteger withdraw(String caller, long lockId, String recipient) {
        return executionTemplate.execute(() -> {
            LockPosition lock = locks.get(lockId);
            if (lock == null) {
                throw new BondNotFoundException(BondErrorCode.LOCK_NOT_FOUND, String.valueOf(lockId));
            }
            if (!lock.getOwner().equals(normalizeAddress(caller))) {
                throw new BondAuthorizationException(BondErrorCode.LOCK_NOT_OWNER);
            }
            if (clock.instant().getEpochSecond() < lock.getEnd()) {
                throw new BondException(BondErrorCode.LOCKED);
            }
            locks.remove(lockId);
            ledger.transfer(lockedAsset, address, requireNonZeroAddress(recipient, BondErrorCode.INVALID_ADDRESS),
                    lock.getAmount());
            return lock.getAmount();
        });
    }

    @Override
    public Runnable checkpoint() {
        Map<Long, LockPosition> savedLocks = new LinkedHashMap<>(locks);
        long savedTotal = totalNumLocks;
        return () -> {
            locks = savedLocks;
            totalNumLocks = savedTotal;
        };
    }
}
