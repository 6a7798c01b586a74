package com.work.bond.core.depository;

import com.work.bond.core.event.BondEventListener;
import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.execution.Revertible;
import com.work.bond.core.governance.Governance;
import com.work.bond.core.ledger.AssetLedger;
import com.work.bond.core.ledger.ContractRegistry;
import com.work.bond.core.model.TellerConfig;
import com.work.bond.core.teller.BondTeller;
import com.work.bond.core.teller.TellerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bond.core.support.ValidationUtils.requireNonNegative;
import static com.work.bond.core.support.ValidationUtils.requireNonNull;
import static com.work.bond.core.support.ValidationUtils.requireNonZeroAddress;

/**
 * 债券存管：决定哪些 teller 有权领取奖励资产，并作为工厂创建新的 teller。
 *
 * 1. 授权：治理方增删 teller，只有已授权 teller 才能 pullReward
 * 2. 供给：pullReward 以 depository 的 minter 身份给 teller 铸造奖励
 * 3. 工厂：按 CREATE / CREATE2 规则分配地址，所有 teller 共享同一个 {@link TellerContext}
 */
public class BondDepository implements Revertible {

    private static final Logger LOGGER = LoggerFactory.getLogger(BondDepository.class);

    private final String address;
    private final String tellerImplementation;
    private final TellerContext context;
    private final AssetLedger ledger;
    private final BondExecutionTemplate executionTemplate;
    private final ContractRegistry contractRegistry;
    private final BondEventListener listener;
    private final Governance governance;

    private String reward;
    private String lockVault;
    private String underwritingPool;
    private String dao;
    private Set<String> tellers = new LinkedHashSet<>();

    /**
     * 下一次 CREATE 使用的 nonce；与 EIP-161 一致，合约账户的 nonce 从 1 开始。
     */
    private long deployNonce = 1L;

    public BondDepository(String address,
                          String governanceAddress,
                          String reward,
                          String lockVault,
                          String underwritingPool,
                          String dao,
                          String tellerImplementation,
                          TellerContext context) {
        this.context = requireNonNull(context, "context");
        requireNonZeroAddress(governanceAddress, BondErrorCode.ZERO_ADDRESS_GOVERNANCE);
        this.reward = requireNonZeroAddress(reward, BondErrorCode.ZERO_ADDRESS_REWARD);
        this.lockVault = requireNonZeroAddress(lockVault, BondErrorCode.ZERO_ADDRESS_LOCK_VAULT);
        this.underwritingPool = requireNonZeroAddress(underwritingPool, BondErrorCode.ZERO_ADDRESS_POOL);
        this.dao = requireNonZeroAddress(dao, BondErrorCode.ZERO_ADDRESS_DAO);
        this.address = requireNonZeroAddress(address, BondErrorCode.ZERO_ADDRESS_DEPOSITORY);
        this.governance = new Governance(this.address, governanceAddress, context.getListener());
        this.tellerImplementation = normalizeAddress(tellerImplementation);
        this.ledger = context.getLedger();
        this.executionTemplate = context.getExecutionTemplate();
        this.contractRegistry = context.getContractRegistry();
        this.listener = context.getListener();
        executionTemplate.register(this);
        contractRegistry.register(this.address, this);
    }

    // ------------------------------------------------------------------
    // teller 授权
    // ------------------------------------------------------------------

    /**
     * 授权 teller（幂等）。
     */
    public void addTeller(String caller, String teller) {
        executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            addTellerInternal(normalizeAddress(teller));
        });
    }

    /**
     * 取消授权（幂等）；已发出的债券仍可在 teller 上领取。
     */
    public void removeTeller(String caller, String teller) {
        executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            String normalized = normalizeAddress(teller);
            tellers.remove(normalized);
            listener.tellerRemoved(address, normalized);
        });
    }

    public boolean isTeller(String teller) {
        return executionTemplate.read(() -> teller != null && tellers.contains(normalizeAddress(teller)));
    }

    public List<String> getTellers() {
        return executionTemplate.read(() -> Collections.unmodifiableList(new ArrayList<>(tellers)));
    }

    // ------------------------------------------------------------------
    // 奖励供给
    // ------------------------------------------------------------------

    /**
     * 给调用方 teller 铸造 amount 奖励。
     */
    public void pullReward(String caller, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            if (caller == null || !tellers.contains(normalizeAddress(caller))) {
                throw new BondAuthorizationException(BondErrorCode.NOT_TELLER);
            }
            if (!ledger.isMinter(reward, address)) {
                throw new BondAuthorizationException(BondErrorCode.NOT_MINTER);
            }
            ledger.mint(reward, address, caller, amount);
        });
    }

    /**
     * 治理方取回 depository 名下的奖励资产。
     */
    public void returnReward(String caller, BigInteger amount, String recipient) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            ledger.transfer(reward, address, requireNonZeroAddress(recipient, BondErrorCode.INVALID_ADDRESS), amount);
        });
    }

    /**
     * 更新工厂为新 teller 配置的默认地址；不影响已创建的 teller。
     */
    public void setAddresses(String caller, String newReward, String newLockVault, String newPool, String newDao) {
        executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            reward = requireNonZeroAddress(newReward, BondErrorCode.ZERO_ADDRESS_REWARD);
            lockVault = requireNonZeroAddress(newLockVault, BondErrorCode.ZERO_ADDRESS_LOCK_VAULT);
            underwritingPool = requireNonZeroAddress(newPool, BondErrorCode.ZERO_ADDRESS_POOL);
            dao = requireNonZeroAddress(newDao, BondErrorCode.ZERO_ADDRESS_DAO);
            listener.paramsSet(address);
        });
    }

    // ------------------------------------------------------------------
    // 工厂
    // ------------------------------------------------------------------

    /**
     * 按 CREATE 规则（depository 地址 + 自增 nonce）创建并授权一个新 teller。
     */
    public BondTeller createBondTeller(String caller, String name, String tellerGovernance,
                                       String principal, boolean permittable) {
        requireNonEmpty(name, "name");
        return executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            String tellerAddress = TellerAddressCalculator.createAddress(address, deployNonce++);
            return deploy(tellerAddress, name, tellerGovernance, principal, permittable);
        });
    }

    /**
     * 按 CREATE2 规则创建：地址只取决于 depository、salt 与 implementation，可提前预测。
     */
    public BondTeller create2BondTeller(String caller, String name, String tellerGovernance,
                                        String principal, boolean permittable, byte[] salt) {
        requireNonEmpty(name, "name");
        requireNonNull(salt, "salt");
        return executionTemplate.execute(() -> {
            governance.requireGovernance(caller);
            return deploy(predictTellerAddress(salt), name, tellerGovernance, principal, permittable);
        });
    }

    public String predictTellerAddress(byte[] salt) {
        return TellerAddressCalculator.create2Address(address, salt, tellerImplementation);
    }

    // ------------------------------------------------------------------
    // 治理
    // ------------------------------------------------------------------

    public void setPendingGovernance(String caller, String pendingGovernance) {
        executionTemplate.execute(() -> governance.setPendingGovernance(caller, pendingGovernance));
    }

    public void acceptGovernance(String caller) {
        executionTemplate.execute(() -> governance.acceptGovernance(caller));
    }

    public void lockGovernance(String caller) {
        executionTemplate.execute(() -> governance.lockGovernance(caller));
    }

    public String getGovernance() {
        return executionTemplate.read(governance::getGovernance);
    }

    public String getPendingGovernance() {
        return executionTemplate.read(governance::getPendingGovernance);
    }

    public boolean isGovernanceLocked() {
        return executionTemplate.read(governance::isLocked);
    }

    public String getAddress() {
        return address;
    }

    public String getTellerImplementation() {
        return tellerImplementation;
    }

    public String getReward() {
        return executionTemplate.read(() -> reward);
    }

    public String getLockVault() {
        return executionTemplate.read(() -> lockVault);
    }

    public String getUnderwritingPool() {
        return executionTemplate.read(() -> underwritingPool);
    }

    public String getDao() {
        return executionTemplate.read(() -> dao);
    }

    @Override
    public Runnable checkpoint() {
        Runnable governanceUndo = governance.checkpoint();
        String savedReward = reward;
        String savedLockVault = lockVault;
        String savedPool = underwritingPool;
        String savedDao = dao;
        Set<String> savedTellers = new LinkedHashSet<>(tellers);
        long savedNonce = deployNonce;
        return () -> {
            governanceUndo.run();
            reward = savedReward;
            lockVault = savedLockVault;
            underwritingPool = savedPool;
            dao = savedDao;
            tellers = savedTellers;
            deployNonce = savedNonce;
        };
    }

    private BondTeller deploy(String tellerAddress, String name, String tellerGovernance,
                              String principal, boolean permittable) {
        if (contractRegistry.contains(tellerAddress)) {
            throw new BondException(BondErrorCode.DEPLOYMENT_EXISTS, tellerAddress);
        }
        TellerConfig tellerConfig = new TellerConfig(reward, lockVault, underwritingPool, dao,
                principal, permittable, address);
        BondTeller teller = new BondTeller(tellerAddress, context);
        contractRegistry.register(tellerAddress, teller);
        teller.initialize(name, tellerGovernance, tellerConfig);
        addTellerInternal(teller.getAddress());
        listener.tellerCreated(address, name, teller.getAddress());
        LOGGER.info("[depository] teller created, depository={}, name={}, teller={}, principal={}",
                address, name, teller.getAddress(), tellerConfig.getPrincipal());
        return teller;
    }

    private void addTellerInternal(String teller) {
        tellers.add(teller);
        listener.tellerAdded(address, teller);
    }
}
