package com.work.bond.core.ledger;

import java.math.BigInteger;

/**
 * 账本抽象：所有资产转移、铸造与授权都经由这里完成，真实项目中可由链上 RPC 实现。
 * <p>语义与 ERC-20 一致：余额不足抛 INSUFFICIENT_BALANCE，授权不足抛 INSUFFICIENT_ALLOWANCE。</p>
 */
public interface AssetLedger {

    BigInteger balanceOf(String asset, String holder);

    BigInteger allowance(String asset, String owner, String spender);

    void approve(String asset, String owner, String spender, BigInteger amount);

    /**
     * 由 from 本人发起的转账。
     */
    void transfer(String asset, String from, String to, BigInteger amount);

    /**
     * 由 spender 代 from 发起的转账，消耗 allowance。
     */
    void transferFrom(String asset, String spender, String from, String to, BigInteger amount);

    boolean isMinter(String asset, String account);

    /**
     * 只有 asset 的 minter 才能铸造，否则抛 NOT_MINTER。
     */
    void mint(String asset, String minter, String to, BigInteger amount);

    /**
     * 该资产是否支持链下签名授权（permit）。
     */
    boolean supportsPermit(String asset);

    BigInteger nonces(String asset, String owner);

    /**
     * 校验 owner 的签名后设置 allowance(owner, spender) = value，并递增 owner 的 nonce。
     */
    void permit(String asset, String owner, String spender, BigInteger value, long deadline, PermitSignature signature);
}
