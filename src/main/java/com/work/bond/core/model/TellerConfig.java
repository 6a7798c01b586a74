package com.work.bond.core.model;

import com.work.bond.core.exception.BondErrorCode;

import static com.work.bond.core.support.ValidationUtils.requireNonZeroAddress;

/**
 * teller 依赖的外部地址（不可变）。构造时逐项拒绝零地址。
 */
public final class TellerConfig {

    private final String reward;
    private final String lockVault;
    private final String underwritingPool;
    private final String dao;
    private final String principal;
    private final boolean permittable;
    private final String depository;

    public TellerConfig(String reward, String lockVault, String underwritingPool, String dao,
                        String principal, boolean permittable, String depository) {
        this.reward = requireNonZeroAddress(reward, BondErrorCode.ZERO_ADDRESS_REWARD);
        this.lockVault = requireNonZeroAddress(lockVault, BondErrorCode.ZERO_ADDRESS_LOCK_VAULT);
        this.underwritingPool = requireNonZeroAddress(underwritingPool, BondErrorCode.ZERO_ADDRESS_POOL);
        this.dao = requireNonZeroAddress(dao, BondErrorCode.ZERO_ADDRESS_DAO);
        this.principal = requireNonZeroAddress(principal, BondErrorCode.ZERO_ADDRESS_PRINCIPAL);
        this.permittable = permittable;
        this.depository = requireNonZeroAddress(depository, BondErrorCode.ZERO_ADDRESS_DEPOSITORY);
    }

    public String getReward() {
        return reward;
    }

    public String getLockVault() {
        return lockVault;
    }

    public String getUnderwritingPool() {
        return underwritingPool;
    }

    public String getDao() {
        return dao;
    }

    public String getPrincipal() {
        return principal;
    }

    public boolean isPermittable() {
        return permittable;
    }

    public String getDepository() {
        return depository;
    }

    @Override
    public String toString() {
        return "TellerConfig{" +
                "reward='" + reward + '\'' +
                ", lockVault='" + lockVault + '\'' +
                ", underwritingPool='" + underwritingPool + '\'' +
                ", dao='" + dao + '\'' +
                ", principal='" + principal + '\'' +
                ", permittable=" + permittable +
                ", depository='" + depository + '\'' +
                '}';
    }
}
