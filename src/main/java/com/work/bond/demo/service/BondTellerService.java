package com.work.bond.demo.service;

import com.work.bond.core.depository.BondDepository;
import com.work.bond.core.depository.TellerAddressCalculator;
import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.ledger.ContractRegistry;
import com.work.bond.core.ledger.PermitSignature;
import com.work.bond.core.model.Bond;
import com.work.bond.core.model.DepositResult;
import com.work.bond.core.model.GlobalTerms;
import com.work.bond.core.model.TellerConfig;
import com.work.bond.core.support.InMemoryAssetLedger;
import com.work.bond.core.teller.BondTeller;
import com.work.bond.demo.config.BondProperties;
import com.work.bond.demo.web.dto.BondView;
import com.work.bond.demo.web.dto.ClaimResponse;
import com.work.bond.demo.web.dto.CreateTellerRequest;
import com.work.bond.demo.web.dto.DepositRequest;
import com.work.bond.demo.web.dto.DepositResponse;
import com.work.bond.demo.web.dto.QuoteResponse;
import com.work.bond.demo.web.dto.SignedDepositRequest;
import com.work.bond.demo.web.dto.TellerView;
import com.work.bond.demo.web.dto.TermsRequest;
import com.work.bond.demo.web.dto.TermsView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static com.work.bond.core.support.ValidationUtils.normalizeAddress;

/**
 * 业务侧门面：按地址找到 teller，把 REST 请求翻译成核心组件调用，再把结果转换为视图。
 */
@Service
public class BondTellerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BondTellerService.class);

    private final BondDepository depository;
    private final ContractRegistry contractRegistry;
    private final InMemoryAssetLedger ledger;
    private final BondProperties properties;
    private final BondExecutionTemplate executionTemplate;
    private final Clock clock;

    public BondTellerService(BondDepository depository,
                             ContractRegistry contractRegistry,
                             InMemoryAssetLedger ledger,
                             BondProperties properties,
                             BondExecutionTemplate executionTemplate,
                             Clock clock) {
        this.depository = depository;
        this.contractRegistry = contractRegistry;
        this.ledger = ledger;
        this.properties = properties;
        this.executionTemplate = executionTemplate;
        this.clock = clock;
    }

    /**
     * 启动时按配置创建 teller 并设置协议费率；条款需要治理方之后通过管理接口设置。
     */
    @PostConstruct
    public void bootstrap() {
        String governance = properties.getGovernance();
        for (BondProperties.TellerProperties teller : properties.getTellers()) {
            BondTeller created = create(governance, teller.getName(), governance,
                    teller.getPrincipal(), teller.isPermittable(), teller.getSalt());
            if (properties.getProtocolFeeBps() > 0) {
                created.setFees(governance, properties.getProtocolFeeBps());
            }
            LOGGER.info("[bootstrap] teller ready, name={}, address={}, principal={}, permittable={}",
                    teller.getName(), created.getAddress(), teller.getPrincipal(), teller.isPermittable());
        }
    }

    // ---- 查询 ----

    public List<TellerView> listTellers() {
        List<TellerView> views = new ArrayList<>();
        for (String address : depository.getTellers()) {
            views.add(toView(teller(address)));
        }
        return views;
    }

    public TellerView getTeller(String address) {
        return toView(teller(address));
    }

    public QuoteResponse quoteOut(String address, BigInteger amountIn, boolean stake) {
        BondTeller teller = teller(address);
        BigInteger amountOut = teller.calculateAmountOut(amountIn, stake);
        return quote(amountIn, amountOut, teller.bondPrice(), stake);
    }

    public QuoteResponse quoteIn(String address, BigInteger amountOut, boolean stake) {
        BondTeller teller = teller(address);
        BigInteger amountIn = teller.calculateAmountIn(amountOut, stake);
        return quote(amountIn, amountOut, teller.bondPrice(), stake);
    }

    public BondView getBond(String address, long bondId) {
        BondTeller teller = teller(address);
        return toView(teller.getBond(bondId), teller.ownerOf(bondId));
    }

    public List<BondView> listBonds(String address, String owner) {
        BondTeller teller = teller(address);
        List<BondView> views = new ArrayList<>();
        for (Long bondId : teller.listBondsOfOwner(owner)) {
            views.add(toView(teller.getBond(bondId), teller.ownerOf(bondId)));
        }
        return views;
    }

    // ---- 存款与领取 ----

    public DepositResponse deposit(String address, String caller, DepositRequest request) {
        DepositResult result = teller(address).deposit(caller, request.getAmountIn(), request.getMinAmountOut(),
                request.getDepositor(), request.isStake());
        return toResponse(result);
    }

    public DepositResponse depositSigned(String address, String caller, SignedDepositRequest request) {
        PermitSignature signature = PermitSignature.of(request.getV(), request.getR(), request.getS());
        DepositResult result = teller(address).depositSigned(caller, request.getAmountIn(), request.getMinAmountOut(),
                request.getDepositor(), request.isStake(), request.getDeadline(), signature);
        return toResponse(result);
    }

    public DepositResponse receive(String address, String caller, BigInteger amount) {
        return toResponse(teller(address).receive(caller, amount));
    }

    public ClaimResponse claim(String address, String caller, long bondId) {
        BondTeller teller = teller(address);
        BigInteger amount = teller.claimPayout(caller, bondId);
        ClaimResponse response = new ClaimResponse();
        response.setBondId(bondId);
        response.setAmount(amount);
        response.setBurned(!teller.exists(bondId));
        return response;
    }

    // ---- 管理 ----

    public TellerView setTerms(String address, String caller, TermsRequest request) {
        BondTeller teller = teller(address);
        teller.setTerms(caller, GlobalTerms.builder()
                .startPrice(request.getStartPrice())
                .minimumPrice(request.getMinimumPrice())
                .maxPayout(request.getMaxPayout())
                .priceAdjNum(request.getPriceAdjNum())
                .priceAdjDenom(request.getPriceAdjDenom())
                .capacity(request.getCapacity())
                .capacityIsPayout(request.isCapacityIsPayout())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .globalVestingTerm(request.getGlobalVestingTerm())
                .halfLife(request.getHalfLife())
                .build());
        return toView(teller);
    }

    public TellerView setFees(String address, String caller, int protocolFeeBps) {
        BondTeller teller = teller(address);
        teller.setFees(caller, protocolFeeBps);
        return toView(teller);
    }

    public TellerView pause(String address, String caller) {
        BondTeller teller = teller(address);
        teller.pause(caller);
        return toView(teller);
    }

    public TellerView unpause(String address, String caller) {
        BondTeller teller = teller(address);
        teller.unpause(caller);
        return toView(teller);
    }

    public TellerView createTeller(String caller, CreateTellerRequest request) {
        BondTeller teller = create(caller, request.getName(), request.getGovernance(),
                request.getPrincipal(), request.isPermittable(), request.getSalt());
        return toView(teller);
    }

    public void removeTeller(String caller, String address) {
        depository.removeTeller(caller, address);
    }

    // ---- demo 账本 ----

    /**
     * 给任意地址发测试资产。奖励资产只能经 depository 铸造，这里拒绝。
     */
    public BigInteger faucet(String asset, String holder, BigInteger amount) {
        if (normalizeAddress(asset).equals(depository.getReward())) {
            LOGGER.warn("[faucet] reward asset rejected, asset={}, holder={}", asset, holder);
            throw new BondAuthorizationException(BondErrorCode.NOT_MINTER, asset);
        }
        ledger.credit(asset, holder, amount);
        return ledger.balanceOf(asset, holder);
    }

    public void approve(String caller, String asset, String spender, BigInteger amount) {
        ledger.approve(asset, caller, spender, amount);
    }

    public BigInteger balanceOf(String asset, String holder) {
        return ledger.balanceOf(asset, holder);
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }

    private BondTeller create(String caller, String name, String governance, String principal,
                              boolean permittable, String salt) {
        return executionTemplate.execute(() -> {
            BondTeller teller = salt == null || salt.trim().isEmpty()
                    ? depository.createBondTeller(caller, name, governance, principal, permittable)
                    : depository.create2BondTeller(caller, name, governance, principal, permittable,
                            TellerAddressCalculator.toSalt(salt));
            // demo 账本里由资产自身决定是否支持 permit，随 teller 创建成功一起开启
            if (permittable) {
                ledger.enablePermit(principal);
            }
            return teller;
        });
    }

    private BondTeller teller(String address) {
        return contractRegistry.resolve(address, BondTeller.class, BondErrorCode.TELLER_NOT_FOUND);
    }

    private TellerView toView(BondTeller teller) {
        TellerView view = new TellerView();
        TellerConfig config = teller.getConfig();
        view.setAddress(teller.getAddress());
        view.setName(teller.getName());
        view.setState(teller.state().name());
        view.setPrincipal(config == null ? null : config.getPrincipal());
        view.setPermittable(config != null && config.isPermittable());
        view.setGovernance(teller.getGovernance());
        view.setProtocolFeeBps(teller.getProtocolFeeBps());
        view.setNumBonds(teller.getNumBonds());
        GlobalTerms terms = teller.getTerms();
        if (terms != null) {
            view.setTerms(toView(terms));
            view.setCapacity(teller.getCapacity());
            view.setPrice(teller.bondPrice());
            view.setNextPrice(teller.getNextPrice());
            view.setLastPriceUpdate(teller.getLastPriceUpdate());
        }
        return view;
    }

    private static TermsView toView(GlobalTerms terms) {
        TermsView view = new TermsView();
        view.setStartPrice(terms.getStartPrice());
        view.setMinimumPrice(terms.getMinimumPrice());
        view.setMaxPayout(terms.getMaxPayout());
        view.setPriceAdjNum(terms.getPriceAdjNum());
        view.setPriceAdjDenom(terms.getPriceAdjDenom());
        view.setCapacity(terms.getCapacity());
        view.setCapacityIsPayout(terms.isCapacityIsPayout());
        view.setStartTime(terms.getStartTime());
        view.setEndTime(terms.getEndTime());
        view.setGlobalVestingTerm(terms.getGlobalVestingTerm());
        view.setHalfLife(terms.getHalfLife());
        return view;
    }

    private BondView toView(Bond bond, String owner) {
        BondView view = new BondView();
        view.setId(bond.getId());
        view.setOwner(owner);
        view.setPrincipalPaid(bond.getPrincipalPaid());
        view.setPayoutAmount(bond.getPayoutAmount());
        view.setPayoutAlreadyClaimed(bond.getPayoutAlreadyClaimed());
        view.setClaimable(bond.claimableAmount(now()));
        view.setVestingStart(bond.getVestingStart());
        view.setLocalVestingTerm(bond.getLocalVestingTerm());
        return view;
    }

    private static DepositResponse toResponse(DepositResult result) {
        DepositResponse response = new DepositResponse();
        response.setId(result.getId());
        response.setStake(result.isStake());
        response.setPrincipalPaid(result.getPrincipalPaid());
        response.setPayout(result.getPayout());
        return response;
    }

    private static QuoteResponse quote(BigInteger amountIn, BigInteger amountOut, BigInteger price, boolean stake) {
        QuoteResponse response = new QuoteResponse();
        response.setAmountIn(amountIn);
        response.setAmountOut(amountOut);
        response.setPrice(price);
        response.setStake(stake);
        return response;
    }
}
