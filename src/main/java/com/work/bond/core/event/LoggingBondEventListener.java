package com.work.bond.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 把事件写入日志，demo 环境下代替链上事件索引。
 */
public class LoggingBondEventListener implements BondEventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingBondEventListener.class);

    @Override
    public void bondCreated(String teller, long bondId, BigInteger principalPaid, BigInteger payoutAmount,
                            long vestingStart, long localVestingTerm) {
        LOGGER.info("[bond] CreateBond teller={}, bondId={}, principalPaid={}, payoutAmount={}, vestingStart={}, vestingTerm={}",
                teller, bondId, principalPaid, payoutAmount, vestingStart, localVestingTerm);
    }

    @Override
    public void bondRedeemed(String teller, long bondId, String recipient, BigInteger finalAmount) {
        LOGGER.info("[bond] RedeemBond teller={}, bondId={}, recipient={}, amount={}",
                teller, bondId, recipient, finalAmount);
    }

    @Override
    public void lockCreated(String teller, long lockId, String owner, BigInteger amount, long end) {
        LOGGER.info("[bond] LockCreated teller={}, lockId={}, owner={}, amount={}, end={}",
                teller, lockId, owner, amount, end);
    }

    @Override
    public void termsSet(String teller) {
        LOGGER.info("[bond] TermsSet teller={}", teller);
    }

    @Override
    public void feesSet(String teller, int protocolFeeBps) {
        LOGGER.info("[bond] FeesSet teller={}, protocolFeeBps={}", teller, protocolFeeBps);
    }

    @Override
    public void addressesSet(String teller) {
        LOGGER.info("[bond] AddressesSet teller={}", teller);
    }

    @Override
    public void paused(String teller) {
        LOGGER.info("[bond] Paused teller={}", teller);
    }

    @Override
    public void unpaused(String teller) {
        LOGGER.info("[bond] Unpaused teller={}", teller);
    }

    @Override
    public void tellerAdded(String depository, String teller) {
        LOGGER.info("[depository] TellerAdded depository={}, teller={}", depository, teller);
    }

    @Override
    public void tellerRemoved(String depository, String teller) {
        LOGGER.info("[depository] TellerRemoved depository={}, teller={}", depository, teller);
    }

    @Override
    public void tellerCreated(String depository, String name, String teller) {
        LOGGER.info("[depository] TellerCreated depository={}, name={}, teller={}", depository, name, teller);
    }

    @Override
    public void paramsSet(String depository) {
        LOGGER.info("[depository] ParamsSet depository={}", depository);
    }

    @Override
    public void governancePending(String contract, String pendingGovernance) {
        LOGGER.info("[governance] GovernancePending contract={}, pending={}", contract, pendingGovernance);
    }

    @Override
    public void governanceTransferred(String contract, String oldGovernance, String newGovernance) {
        LOGGER.info("[governance] GovernanceTransferred contract={}, old={}, new={}", contract, oldGovernance, newGovernance);
    }

    @Override
    public void governanceLocked(String contract) {
        LOGGER.warn("[governance] GovernanceLocked contract={}", contract);
    }
}
