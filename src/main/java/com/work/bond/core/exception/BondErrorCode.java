package com.work.bond.core.exception;

/**
 * 组件内所有可区分的失败原因。
 * <p>reason 字符串对外稳定（REST 响应、日志、测试断言均依赖它），不要随意修改。</p>
 */
public enum BondErrorCode {

    // 配置类错误：在 setter 处同步拒绝，绝不静默截断
    ZERO_ADDRESS_GOVERNANCE(Category.CONFIGURATION, "zero address governance"),
    ZERO_ADDRESS_REWARD(Category.CONFIGURATION, "zero address solace"),
    ZERO_ADDRESS_LOCK_VAULT(Category.CONFIGURATION, "zero address xslocker"),
    ZERO_ADDRESS_POOL(Category.CONFIGURATION, "zero address pool"),
    ZERO_ADDRESS_DAO(Category.CONFIGURATION, "zero address dao"),
    ZERO_ADDRESS_PRINCIPAL(Category.CONFIGURATION, "zero address principal"),
    ZERO_ADDRESS_DEPOSITORY(Category.CONFIGURATION, "zero address bond depo"),
    INVALID_PRICE(Category.CONFIGURATION, "invalid price"),
    DIVIDE_BY_ZERO(Category.CONFIGURATION, "1/0"),
    INVALID_DATES(Category.CONFIGURATION, "invalid dates"),
    INVALID_HALF_LIFE(Category.CONFIGURATION, "invalid halflife"),
    INVALID_TERMS(Category.CONFIGURATION, "invalid terms"),
    INVALID_PROTOCOL_FEE(Category.CONFIGURATION, "invalid protocol fee"),
    INVALID_ADDRESS(Category.CONFIGURATION, "invalid address"),
    INVALID_AMOUNT(Category.CONFIGURATION, "invalid amount"),

    // 时间类错误
    BOND_NOT_STARTED(Category.TEMPORAL, "bond not yet started"),
    BOND_CONCLUDED(Category.TEMPORAL, "bond concluded"),
    ZERO_PRICE(Category.TEMPORAL, "zero price"),
    PERMIT_EXPIRED(Category.TEMPORAL, "permit expired"),

    // 容量类错误：整笔拒绝，不做部分成交
    BOND_AT_CAPACITY(Category.CAPACITY, "bond at capacity"),
    BOND_TOO_LARGE(Category.CAPACITY, "bond too large"),
    SLIPPAGE(Category.CAPACITY, "slippage protection"),

    // 权限类错误
    NOT_GOVERNANCE(Category.AUTHORIZATION, "!governance"),
    NOT_PENDING_GOVERNANCE(Category.AUTHORIZATION, "!pending governance"),
    GOVERNANCE_LOCKED(Category.AUTHORIZATION, "governance locked"),
    NOT_BONDER(Category.AUTHORIZATION, "!bonder"),
    NOT_TELLER(Category.AUTHORIZATION, "!teller"),
    NOT_MINTER(Category.AUTHORIZATION, "!minter"),
    NOT_APPROVED(Category.AUTHORIZATION, "caller is not owner nor approved"),
    PERMIT_NOT_SUPPORTED(Category.AUTHORIZATION, "principal does not support permit"),
    INVALID_SIGNATURE(Category.AUTHORIZATION, "invalid signature"),
    LOCK_NOT_OWNER(Category.AUTHORIZATION, "only owner"),

    // 不存在
    BOND_NOT_FOUND(Category.NOT_FOUND, "query for nonexistent token"),
    TELLER_NOT_FOUND(Category.NOT_FOUND, "teller not found"),
    LOCK_NOT_FOUND(Category.NOT_FOUND, "query for nonexistent lock"),
    CONTRACT_NOT_FOUND(Category.NOT_FOUND, "no contract at address"),

    // 状态类错误
    NOT_INITIALIZED(Category.STATE, "not initialized"),
    ALREADY_INITIALIZED(Category.STATE, "already initialized"),
    PAUSED(Category.STATE, "cannot deposit while paused"),
    REENTRANT_CALL(Category.STATE, "reentrant call"),
    DEPLOYMENT_EXISTS(Category.STATE, "deployment exists"),
    LOCKED(Category.STATE, "locked"),
    TOKEN_ALREADY_MINTED(Category.STATE, "token already minted"),

    // 账本类错误（由外部账本抛出，原样透传）
    INSUFFICIENT_BALANCE(Category.LEDGER, "transfer amount exceeds balance"),
    INSUFFICIENT_ALLOWANCE(Category.LEDGER, "transfer amount exceeds allowance");

    public enum Category {
        CONFIGURATION,
        TEMPORAL,
        CAPACITY,
        AUTHORIZATION,
        NOT_FOUND,
        STATE,
        LEDGER
    }

    private final Category category;
    private final String reason;

    BondErrorCode(Category category, String reason) {
        this.category = category;
        this.reason = reason;
    }

    public Category getCategory() {
        return category;
    }

    public String getReason() {
        return reason;
    }
}
