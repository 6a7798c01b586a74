package com.work.bond.core.teller;

import com.work.bond.core.depository.BondDepository;
import com.work.bond.core.event.BondEventListener;
import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.exception.BondNotFoundException;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.execution.Revertible;
import com.work.bond.core.governance.Governance;
import com.work.bond.core.ledger.AssetLedger;
import com.work.bond.core.ledger.LockVault;
import com.work.bond.core.ledger.PermitSignature;
import com.work.bond.core.model.Bond;
import com.work.bond.core.model.DepositResult;
import com.work.bond.core.model.GlobalTerms;
import com.work.bond.core.model.TellerConfig;
import com.work.bond.core.model.TellerState;
import com.work.bond.core.model.TermsState;
import com.work.bond.core.pricing.BondPricing;
import com.work.bond.core.registry.BondRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.work.bond.core.support.ValidationUtils.isZeroAddress;
import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bond.core.support.ValidationUtils.requireNonNegative;
import static com.work.bond.core.support.ValidationUtils.requireNonNull;

/**
 * 债券柜台：以衰减价格出售奖励资产，收取本金，发放线性归属的债券或锁仓头寸。
 *
 * 职责：
 * 1. 报价：按当前衰减价格换算数量，检查容量与单笔上限
 * 2. 存款：三个入口（直接授权、签名授权、直接转入）各自完成授权后汇入同一个内部流程
 * 3. 领取：按归属进度释放奖励，全部领完后销毁债券
 *
 * 所有状态变更都经由 {@link BondExecutionTemplate}，任何一步失败整体回滚。
 */
public class BondTeller implements Revertible {

    private static final Logger LOGGER = LoggerFactory.getLogger(BondTeller.class);

    public static final int MAX_BPS = 10_000;

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(MAX_BPS);

    private final String address;
    private final TellerContext context;
    private final AssetLedger ledger;
    private final BondExecutionTemplate executionTemplate;
    private final BondEventListener listener;

    private boolean initialized;
    private String name;
    private Governance governance;
    private TellerConfig config;
    private TermsState termsState;
    private int protocolFeeBps;
    private boolean paused;
    private long numBonds;
    private Map<Long, Bond> bonds = new HashMap<>();
    private final BondRegistry registry = new BondRegistry();

    /**
     * 正在执行存款或领取时置位，用于拒绝回调中的重入。
     */
    private boolean entered;

    public BondTeller(String address, TellerContext context) {
        this.address = normalizeAddress(address);
        this.context = requireNonNull(context, "context");
        this.ledger = context.getLedger();
        this.executionTemplate = context.getExecutionTemplate();
        this.listener = context.getListener();
        executionTemplate.register(this);
    }

    // ------------------------------------------------------------------
    // 管理接口
    // ------------------------------------------------------------------

    /**
     * 一次性初始化；通常由 depository 的工厂在创建后立刻调用。
     */
    public void initialize(String name, String governanceAddress, TellerConfig tellerConfig) {
        requireNonEmpty(name, "name");
        requireNonNull(tellerConfig, "tellerConfig");
        executionTemplate.execute(() -> {
            if (initialized) {
                throw new BondException(BondErrorCode.ALREADY_INITIALIZED);
            }
            this.governance = new Governance(address, governanceAddress, listener);
            this.name = name;
            this.config = tellerConfig;
            this.initialized = true;
            listener.addressesSet(address);
        });
    }

    /**
     * 整体替换条款；成功后价格锚点重置为 startPrice，容量重置为 capacity。
     */
    public void setTerms(String caller, GlobalTerms terms) {
        requireNonNull(terms, "terms");
        executionTemplate.execute(() -> {
            requireGovernance(caller);
            validateTerms(terms);
            termsState = new TermsState(terms, context.now());
            listener.termsSet(address);
            LOGGER.info("[bond] terms set, teller={}, terms={}", address, terms);
        });
    }

    public void setFees(String caller, int newProtocolFeeBps) {
        executionTemplate.execute(() -> {
            requireGovernance(caller);
            if (newProtocolFeeBps < 0 || newProtocolFeeBps > MAX_BPS) {
                throw new BondException(BondErrorCode.INVALID_PROTOCOL_FEE, String.valueOf(newProtocolFeeBps));
            }
            protocolFeeBps = newProtocolFeeBps;
            listener.feesSet(address, newProtocolFeeBps);
        });
    }

    public void setAddresses(String caller, TellerConfig tellerConfig) {
        requireNonNull(tellerConfig, "tellerConfig");
        executionTemplate.execute(() -> {
            requireGovernance(caller);
            config = tellerConfig;
            listener.addressesSet(address);
        });
    }

    /**
     * 暂停存款（幂等）；已有债券的领取不受影响。
     */
    public void pause(String caller) {
        executionTemplate.execute(() -> {
            requireGovernance(caller);
            paused = true;
            listener.paused(address);
        });
    }

    public void unpause(String caller) {
        executionTemplate.execute(() -> {
            requireGovernance(caller);
            paused = false;
            listener.unpaused(address);
        });
    }

    public void setPendingGovernance(String caller, String pendingGovernance) {
        executionTemplate.execute(() -> requireInitializedGovernance().setPendingGovernance(caller, pendingGovernance));
    }

    public void acceptGovernance(String caller) {
        executionTemplate.execute(() -> requireInitializedGovernance().acceptGovernance(caller));
    }

    public void lockGovernance(String caller) {
        executionTemplate.execute(() -> requireInitializedGovernance().lockGovernance(caller));
    }

    // ------------------------------------------------------------------
    // 报价
    // ------------------------------------------------------------------

    /**
     * 当前衰减后的价格（每个完整奖励代币需要的本金基本单位）。
     */
    public BigInteger bondPrice() {
        return executionTemplate.read(() -> BondPricing.currentPrice(requireTerms(), context.now()));
    }

    /**
     * amountIn 本金当前可以换到的奖励数量。stake 在单一费率模型下不影响结果。
     */
    public BigInteger calculateAmountOut(BigInteger amountIn, boolean stake) {
        requireNonNegative(amountIn, "amountIn");
        return executionTemplate.read(() -> {
            TermsState state = requireTerms();
            BigInteger price = requireNonZeroPrice(state);
            BigInteger amountOut = BondPricing.amountOut(amountIn, price);
            checkCapacityAndSize(state, amountIn, amountOut);
            return amountOut;
        });
    }

    /**
     * 换到 amountOut 奖励当前需要的本金数量。
     */
    public BigInteger calculateAmountIn(BigInteger amountOut, boolean stake) {
        requireNonNegative(amountOut, "amountOut");
        return executionTemplate.read(() -> {
            TermsState state = requireTerms();
            BigInteger price = requireNonZeroPrice(state);
            BigInteger amountIn = BondPricing.amountIn(amountOut, price);
            checkCapacityAndSize(state, amountIn, amountOut);
            return amountIn;
        });
    }

    // ------------------------------------------------------------------
    // 存款入口
    // ------------------------------------------------------------------

    /**
     * 直接存款：caller 事先对 teller 授权了足够的本金额度。
     */
    public DepositResult deposit(String caller, BigInteger amountIn, BigInteger minAmountOut,
                                 String depositor, boolean stake) {
        requireNonNegative(amountIn, "amountIn");
        requireNonNegative(minAmountOut, "minAmountOut");
        return executionTemplate.execute(() -> guarded(() ->
                depositInternal(normalizeAddress(caller), false, amountIn, minAmountOut, depositor, stake)));
    }

    /**
     * 签名存款：先用 depositor 的 permit 签名设置授权，再从 depositor 拉取本金。
     */
    public DepositResult depositSigned(String caller, BigInteger amountIn, BigInteger minAmountOut,
                                       String depositor, boolean stake, long deadline, PermitSignature signature) {
        requireNonNegative(amountIn, "amountIn");
        requireNonNegative(minAmountOut, "minAmountOut");
        requireNonNull(signature, "signature");
        return executionTemplate.execute(() -> guarded(() -> {
            TellerConfig current = requireAcceptingDeposits();
            if (!current.isPermittable()) {
                throw new BondAuthorizationException(BondErrorCode.PERMIT_NOT_SUPPORTED);
            }
            ledger.permit(current.getPrincipal(), depositor, address, amountIn, deadline, signature);
            LOGGER.debug("[bond] permit applied, teller={}, caller={}, depositor={}", address, caller, depositor);
            return depositInternal(normalizeAddress(depositor), false, amountIn, minAmountOut, depositor, stake);
        }));
    }

    /**
     * 直接转入：sender 把本金转给 teller 即视为一次不设滑点、不质押的存款，收款人为 sender。
     */
    public DepositResult receive(String sender, BigInteger amount) {
        requireNonNegative(amount, "amount");
        return executionTemplate.execute(() -> guarded(() -> {
            TellerConfig current = requireAcceptingDeposits();
            ledger.transfer(current.getPrincipal(), sender, address, amount);
            return depositInternal(normalizeAddress(sender), true, amount, BigInteger.ZERO, sender, false);
        }));
    }

    // ------------------------------------------------------------------
    // 领取
    // ------------------------------------------------------------------

    /**
     * 领取 bondId 当前可领取的奖励，发给调用方。全部领完后债券被销毁。
     *
     * @return 本次领取的数量
     */
    public BigInteger claimPayout(String caller, long bondId) {
        return executionTemplate.execute(() -> guarded(() -> {
            Bond bond = bonds.get(bondId);
            if (bond == null || !registry.exists(bondId)) {
                throw new BondNotFoundException(BondErrorCode.BOND_NOT_FOUND, String.valueOf(bondId));
            }
            String recipient = normalizeAddress(caller);
            if (!registry.isApprovedOrOwner(recipient, bondId)) {
                throw new BondAuthorizationException(BondErrorCode.NOT_BONDER);
            }

            long now = context.now();
            BigInteger claimable = bond.claimableAmount(now);
            bond.setPayoutAlreadyClaimed(bond.getPayoutAlreadyClaimed().add(claimable));
            boolean exhausted = bond.isFullyClaimed();
            if (exhausted) {
                registry.burn(bondId);
                bonds.remove(bondId);
            }

            if (claimable.signum() > 0) {
                ledger.transfer(config.getReward(), address, recipient, claimable);
            }
            if (exhausted) {
                listener.bondRedeemed(address, bondId, recipient, claimable);
            }
            LOGGER.debug("[bond] payout claimed, teller={}, bondId={}, recipient={}, amount={}, burned={}",
                    address, bondId, recipient, claimable, exhausted);
            return claimable;
        }));
    }

    // ------------------------------------------------------------------
    // 债券所有权
    // ------------------------------------------------------------------

    public void transferBond(String caller, String from, String to, long bondId) {
        executionTemplate.execute(() -> registry.transfer(caller, from, to, bondId));
    }

    public void approve(String caller, String to, long bondId) {
        executionTemplate.execute(() -> registry.approve(caller, to, bondId));
    }

    public void setApprovalForAll(String caller, String operator, boolean approved) {
        executionTemplate.execute(() -> registry.setApprovalForAll(caller, operator, approved));
    }

    public Bond getBond(long bondId) {
        return executionTemplate.read(() -> {
            Bond bond = bonds.get(bondId);
            if (bond == null) {
                throw new BondNotFoundException(BondErrorCode.BOND_NOT_FOUND, String.valueOf(bondId));
            }
            return bond.copy();
        });
    }

    public String ownerOf(long bondId) {
        return executionTemplate.read(() -> registry.ownerOf(bondId));
    }

    public boolean exists(long bondId) {
        return executionTemplate.read(() -> registry.exists(bondId));
    }

    public String getApproved(long bondId) {
        return executionTemplate.read(() -> registry.getApproved(bondId));
    }

    public boolean isApprovedForAll(String owner, String operator) {
        return executionTemplate.read(() -> registry.isApprovedForAll(owner, operator));
    }

    public long balanceOf(String owner) {
        return executionTemplate.read(() -> registry.balanceOf(owner));
    }

    public List<Long> listBondsOfOwner(String owner) {
        return executionTemplate.read(() -> registry.listBondsOfOwner(owner));
    }

    public long totalSupply() {
        return executionTemplate.read(registry::totalSupply);
    }

    // ------------------------------------------------------------------
    // 状态查询
    // ------------------------------------------------------------------

    public TellerState state() {
        return executionTemplate.read(() -> {
            if (!initialized) {
                return TellerState.UNINITIALIZED;
            }
            if (paused) {
                return TellerState.PAUSED;
            }
            return termsState == null ? TellerState.TERMS_UNSET : TellerState.ACTIVE;
        });
    }

    public String getAddress() {
        return address;
    }

    public String getName() {
        return executionTemplate.read(() -> name);
    }

    public TellerConfig getConfig() {
        return executionTemplate.read(() -> config);
    }

    /**
     * 当前条款；未设置时为 null。
     */
    public GlobalTerms getTerms() {
        return executionTemplate.read(() -> termsState == null ? null : termsState.getTerms());
    }

    public boolean isTermsSet() {
        return executionTemplate.read(() -> termsState != null);
    }

    public BigInteger getCapacity() {
        return executionTemplate.read(() -> requireTerms().getCapacity());
    }

    public BigInteger getNextPrice() {
        return executionTemplate.read(() -> requireTerms().getNextPrice());
    }

    public long getLastPriceUpdate() {
        return executionTemplate.read(() -> requireTerms().getLastPriceUpdate());
    }

    public int getProtocolFeeBps() {
        return executionTemplate.read(() -> protocolFeeBps);
    }

    public boolean isPaused() {
        return executionTemplate.read(() -> paused);
    }

    public long getNumBonds() {
        return executionTemplate.read(() -> numBonds);
    }

    public String getGovernance() {
        return executionTemplate.read(() -> requireInitializedGovernance().getGovernance());
    }

    public String getPendingGovernance() {
        return executionTemplate.read(() -> requireInitializedGovernance().getPendingGovernance());
    }

    public boolean isGovernanceLocked() {
        return executionTemplate.read(() -> requireInitializedGovernance().isLocked());
    }

    @Override
    public Runnable checkpoint() {
        boolean savedInitialized = initialized;
        String savedName = name;
        Governance savedGovernance = governance;
        Runnable governanceUndo = governance == null ? null : governance.checkpoint();
        TellerConfig savedConfig = config;
        TermsState savedTerms = termsState == null ? null : termsState.copy();
        int savedFee = protocolFeeBps;
        boolean savedPaused = paused;
        long savedNumBonds = numBonds;
        Map<Long, Bond> savedBonds = new HashMap<>();
        bonds.forEach((id, bond) -> savedBonds.put(id, bond.copy()));
        Runnable registryUndo = registry.checkpoint();
        boolean savedEntered = entered;
        return () -> {
            initialized = savedInitialized;
            name = savedName;
            governance = savedGovernance;
            if (governanceUndo != null) {
                governanceUndo.run();
            }
            config = savedConfig;
            termsState = savedTerms;
            protocolFeeBps = savedFee;
            paused = savedPaused;
            numBonds = savedNumBonds;
            bonds = savedBonds;
            registryUndo.run();
            entered = savedEntered;
        };
    }

    // ------------------------------------------------------------------
    // 内部流程
    // ------------------------------------------------------------------

    /**
     * 三个存款入口共用的流程：先按固定顺序校验，再修改内部状态，最后做外部转账。
     *
     * @param payer          本金的来源
     * @param principalHeld  true 表示本金已经在 teller 名下（直接转入）
     */
    private DepositResult depositInternal(String payer, boolean principalHeld, BigInteger amountIn,
                                          BigInteger minAmountOut, String depositor, boolean stake) {
        TellerConfig current = requireAcceptingDeposits();
        TermsState state = requireTerms();
        GlobalTerms terms = state.getTerms();
        long now = context.now();
        if (now < terms.getStartTime()) {
            throw new BondException(BondErrorCode.BOND_NOT_STARTED);
        }
        if (now > terms.getEndTime()) {
            throw new BondException(BondErrorCode.BOND_CONCLUDED);
        }
        BigInteger price = requireNonZeroPrice(state);
        BigInteger payout = BondPricing.amountOut(amountIn, price);
        checkCapacityAndSize(state, amountIn, payout);
        if (payout.compareTo(minAmountOut) < 0) {
            throw new BondException(BondErrorCode.SLIPPAGE);
        }
        if (isZeroAddress(depositor)) {
            throw new BondException(BondErrorCode.INVALID_ADDRESS);
        }
        String recipient = normalizeAddress(depositor);

        // 先改内部状态
        BigInteger used = terms.isCapacityIsPayout() ? payout : amountIn;
        state.setCapacity(state.getCapacity().subtract(used));
        state.setNextPrice(BondPricing.adjustedPrice(price, payout, terms));
        state.setLastPriceUpdate(now);

        long bondId = 0L;
        if (!stake) {
            bondId = ++numBonds;
            bonds.put(bondId, new Bond(bondId, amountIn, payout, now, terms.getGlobalVestingTerm()));
            registry.mint(recipient, bondId);
        }

        // 再做外部转账：本金按协议费率拆给 DAO 和承保池
        BigInteger daoShare = amountIn.multiply(BigInteger.valueOf(protocolFeeBps)).divide(BPS_DENOMINATOR);
        BigInteger poolShare = amountIn.subtract(daoShare);
        routePrincipal(current, payer, principalHeld, current.getDao(), daoShare);
        routePrincipal(current, payer, principalHeld, current.getUnderwritingPool(), poolShare);

        depository(current).pullReward(address, payout);

        if (stake) {
            long end = now + terms.getGlobalVestingTerm();
            LockVault vault = context.getContractRegistry()
                    .resolve(current.getLockVault(), LockVault.class, BondErrorCode.CONTRACT_NOT_FOUND);
            ledger.approve(current.getReward(), address, vault.getAddress(), payout);
            long lockId = vault.createLock(address, recipient, payout, end);
            listener.lockCreated(address, lockId, recipient, payout, end);
            LOGGER.debug("[bond] deposit staked, teller={}, lockId={}, owner={}, principal={}, payout={}",
                    address, lockId, recipient, amountIn, payout);
            return new DepositResult(lockId, true, amountIn, payout);
        }

        listener.bondCreated(address, bondId, amountIn, payout, now, terms.getGlobalVestingTerm());
        LOGGER.debug("[bond] bond created, teller={}, bondId={}, owner={}, principal={}, payout={}",
                address, bondId, recipient, amountIn, payout);
        return new DepositResult(bondId, false, amountIn, payout);
    }

    /**
     * 存款入口的前置检查，先于 permit 或转入本金执行：暂停优先于未初始化。
     */
    private TellerConfig requireAcceptingDeposits() {
        if (paused) {
            throw new BondException(BondErrorCode.PAUSED);
        }
        return requireInitialized();
    }

    private void routePrincipal(TellerConfig current, String payer, boolean principalHeld, String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        if (principalHeld) {
            ledger.transfer(current.getPrincipal(), address, to, amount);
        } else {
            ledger.transferFrom(current.getPrincipal(), address, payer, to, amount);
        }
    }

    private BondDepository depository(TellerConfig current) {
        return context.getContractRegistry()
                .resolve(current.getDepository(), BondDepository.class, BondErrorCode.CONTRACT_NOT_FOUND);
    }

    private <T> T guarded(Supplier<T> work) {
        if (entered) {
            throw new BondException(BondErrorCode.REENTRANT_CALL);
        }
        entered = true;
        try {
            return work.get();
        } finally {
            entered = false;
        }
    }

    private void checkCapacityAndSize(TermsState state, BigInteger amountIn, BigInteger amountOut) {
        GlobalTerms terms = state.getTerms();
        BigInteger used = terms.isCapacityIsPayout() ? amountOut : amountIn;
        if (used.compareTo(state.getCapacity()) > 0) {
            throw new BondException(BondErrorCode.BOND_AT_CAPACITY);
        }
        if (amountOut.compareTo(terms.getMaxPayout()) > 0) {
            throw new BondException(BondErrorCode.BOND_TOO_LARGE);
        }
    }

    private BigInteger requireNonZeroPrice(TermsState state) {
        BigInteger price = BondPricing.currentPrice(state, context.now());
        if (price.signum() == 0) {
            throw new BondException(BondErrorCode.ZERO_PRICE);
        }
        return price;
    }

    private TellerConfig requireInitialized() {
        if (!initialized) {
            throw new BondException(BondErrorCode.NOT_INITIALIZED);
        }
        return config;
    }

    private TermsState requireTerms() {
        if (!initialized || termsState == null) {
            throw new BondException(BondErrorCode.NOT_INITIALIZED);
        }
        return termsState;
    }

    private Governance requireInitializedGovernance() {
        if (governance == null) {
            throw new BondException(BondErrorCode.NOT_INITIALIZED);
        }
        return governance;
    }

    private void requireGovernance(String caller) {
        requireInitializedGovernance().requireGovernance(caller);
    }

    private static void validateTerms(GlobalTerms terms) {
        if (terms.getStartPrice() == null || terms.getStartPrice().signum() <= 0) {
            throw new BondException(BondErrorCode.INVALID_PRICE);
        }
        if (terms.getPriceAdjDenom() == null || terms.getPriceAdjDenom().signum() == 0) {
            throw new BondException(BondErrorCode.DIVIDE_BY_ZERO);
        }
        if (terms.getStartTime() > terms.getEndTime()) {
            throw new BondException(BondErrorCode.INVALID_DATES);
        }
        if (terms.getHalfLife() <= 0) {
            throw new BondException(BondErrorCode.INVALID_HALF_LIFE);
        }
        if (isNegative(terms.getMinimumPrice()) || isNegative(terms.getMaxPayout())
                || isNegative(terms.getPriceAdjNum()) || terms.getPriceAdjDenom().signum() < 0
                || isNegative(terms.getCapacity()) || terms.getStartTime() < 0
                || terms.getGlobalVestingTerm() < 0) {
            throw new BondException(BondErrorCode.INVALID_TERMS);
        }
    }

    private static boolean isNegative(BigInteger value) {
        return value == null || value.signum() < 0;
    }
}
