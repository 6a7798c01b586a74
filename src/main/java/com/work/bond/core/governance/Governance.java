package com.work.bond.core.governance;

import com.work.bond.core.event.BondEventListener;
import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.execution.Revertible;

import static com.work.bond.core.support.ValidationUtils.isZeroAddress;
import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonNull;
import static com.work.bond.core.support.ValidationUtils.requireNonZeroAddress;

/**
 * 两阶段治理权记录，嵌入在 teller 与 depository 中使用。
 *
 * 1. 当前治理地址提名 pending，pending 本人 accept 后才生效
 * 2. 锁定后所有受治理保护的调用永久失败
 */
public class Governance implements Revertible {

    private final String contract;
    private final BondEventListener listener;

    private String governance;
    private String pendingGovernance;
    private boolean locked;

    public Governance(String contract, String governance, BondEventListener listener) {
        this.contract = normalizeAddress(contract);
        this.governance = requireNonZeroAddress(governance, BondErrorCode.ZERO_ADDRESS_GOVERNANCE);
        this.listener = requireNonNull(listener, "listener");
    }

    /**
     * 受保护调用的统一入口：先检查锁定，再检查调用方。
     */
    public void requireGovernance(String caller) {
        if (locked) {
            throw new BondAuthorizationException(BondErrorCode.GOVERNANCE_LOCKED);
        }
        if (caller == null || !governance.equalsIgnoreCase(caller)) {
            throw new BondAuthorizationException(BondErrorCode.NOT_GOVERNANCE);
        }
    }

    public void setPendingGovernance(String caller, String newGovernance) {
        requireGovernance(caller);
        pendingGovernance = normalizeAddress(newGovernance);
        listener.governancePending(contract, pendingGovernance);
    }

    public void acceptGovernance(String caller) {
        if (locked) {
            throw new BondAuthorizationException(BondErrorCode.GOVERNANCE_LOCKED);
        }
        if (isZeroAddress(pendingGovernance)) {
            throw new BondException(BondErrorCode.ZERO_ADDRESS_GOVERNANCE);
        }
        if (caller == null || !pendingGovernance.equalsIgnoreCase(caller)) {
            throw new BondAuthorizationException(BondErrorCode.NOT_PENDING_GOVERNANCE);
        }
        String oldGovernance = governance;
        governance = pendingGovernance;
        pendingGovernance = null;
        listener.governanceTransferred(contract, oldGovernance, governance);
    }

    public void lockGovernance(String caller) {
        requireGovernance(caller);
        locked = true;
        pendingGovernance = null;
        listener.governanceLocked(contract);
    }

    public String getGovernance() {
        return governance;
    }

    public String getPendingGovernance() {
        return pendingGovernance;
    }

    public boolean isLocked() {
        return locked;
    }

    @Override
    public Runnable checkpoint() {
        String savedGovernance = governance;
        String savedPending = pendingGovernance;
        boolean savedLocked = locked;
        return () -> {
            governance = savedGovernance;
            pendingGovernance = savedPending;
            locked = savedLocked;
        };
    }
}
