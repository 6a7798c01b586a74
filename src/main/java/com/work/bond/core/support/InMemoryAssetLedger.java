package com.work.bond.core.support;

import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.execution.Revertible;
import com.work.bond.core.ledger.AssetLedger;
import com.work.bond.core.ledger.PermitDigest;
import com.work.bond.core.ledger.PermitSignature;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonNegative;
import static com.work.bond.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存账本实现，方便在没有链节点的环境下演示组件行为。
 * 注意：该实现仅用于 demo 与测试，不具备持久化与跨进程一致性。
 * 所有读写都经由 {@link BondExecutionTemplate}：外部直接调用也会与进行中的存款串行，不会被其回滚覆盖。
 */
public class InMemoryAssetLedger implements AssetLedger, Revertible {

    private final Clock clock;
    private final BondExecutionTemplate executionTemplate;

    private Map<String, BigInteger> balances = new HashMap<>();
    private Map<String, BigInteger> allowances = new HashMap<>();
    private Map<String, BigInteger> permitNonces = new HashMap<>();
    private Map<String, Set<String>> minters = new HashMap<>();
    private Set<String> permittable = new HashSet<>();

    public InMemoryAssetLedger(Clock clock, BondExecutionTemplate executionTemplate) {
        this.clock = requireNonNull(clock, "clock");
        this.executionTemplate = requireNonNull(executionTemplate, "executionTemplate");
        executionTemplate.register(this);
    }

    @Override
    public BigInteger balanceOf(String asset, String holder) {
        return executionTemplate.read(() -> balances.getOrDefault(key(asset, holder), BigInteger.ZERO));
    }

    @Override
    public BigInteger allowance(String asset, String owner, String spender) {
        return executionTemplate.read(() -> allowances.getOrDefault(key(asset, owner, spender), BigInteger.ZERO));
    }

    @Override
    public void approve(String asset, String owner, String spender, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            allowances.put(key(asset, owner, spender), amount);
        });
    }

    @Override
    public void transfer(String asset, String from, String to, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> move(asset, from, to, amount));
    }

    @Override
    public void transferFrom(String asset, String spender, String from, String to, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            String allowanceKey = key(asset, from, spender);
            BigInteger allowed = allowances.getOrDefault(allowanceKey, BigInteger.ZERO);
            // 与 ERC-20 一致：先检查余额，再检查授权
            if (balances.getOrDefault(key(asset, from), BigInteger.ZERO).compareTo(amount) < 0) {
                throw new BondException(BondErrorCode.INSUFFICIENT_BALANCE);
            }
            if (allowed.compareTo(amount) < 0) {
                throw new BondException(BondErrorCode.INSUFFICIENT_ALLOWANCE);
            }
            allowances.put(allowanceKey, allowed.subtract(amount));
            move(asset, from, to, amount);
        });
    }

    @Override
    public boolean isMinter(String asset, String account) {
        return executionTemplate.read(() -> {
            Set<String> set = minters.get(normalizeAddress(asset));
            return set != null && set.contains(normalizeAddress(account));
        });
    }

    @Override
    public void mint(String asset, String minter, String to, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            if (!isMinter(asset, minter)) {
                throw new BondAuthorizationException(BondErrorCode.NOT_MINTER);
            }
            balances.merge(key(asset, to), amount, BigInteger::add);
        });
    }

    @Override
    public boolean supportsPermit(String asset) {
        return executionTemplate.read(() -> permittable.contains(normalizeAddress(asset)));
    }

    @Override
    public BigInteger nonces(String asset, String owner) {
        return executionTemplate.read(() -> permitNonces.getOrDefault(key(asset, owner), BigInteger.ZERO));
    }

    @Override
    public void permit(String asset, String owner, String spender, BigInteger value,
                       long deadline, PermitSignature signature) {
        requireNonNull(signature, "signature");
        requireNonNegative(value, "value");
        executionTemplate.execute(() -> {
            if (!permittable.contains(normalizeAddress(asset))) {
                throw new BondAuthorizationException(BondErrorCode.PERMIT_NOT_SUPPORTED);
            }
            if (clock.instant().getEpochSecond() > deadline) {
                throw new BondException(BondErrorCode.PERMIT_EXPIRED);
            }
            String nonceKey = key(asset, owner);
            BigInteger nonce = permitNonces.getOrDefault(nonceKey, BigInteger.ZERO);
            byte[] digest = PermitDigest.digest(normalizeAddress(asset), normalizeAddress(owner),
                    normalizeAddress(spender), value, nonce, deadline);
            Optional<String> signer = PermitDigest.recoverSigner(digest, signature);
            if (!signer.isPresent() || !signer.get().equals(normalizeAddress(owner))) {
                throw new BondAuthorizationException(BondErrorCode.INVALID_SIGNATURE);
            }
            permitNonces.put(nonceKey, nonce.add(BigInteger.ONE));
            allowances.put(key(asset, owner, spender), value);
        });
    }

    // ---- demo / 测试辅助：真实账本中由资产合约自身的治理完成 ----

    public void addMinter(String asset, String account) {
        executionTemplate.execute(() -> {
            minters.computeIfAbsent(normalizeAddress(asset), k -> new HashSet<>()).add(normalizeAddress(account));
        });
    }

    public void removeMinter(String asset, String account) {
        executionTemplate.execute(() -> {
            Set<String> set = minters.get(normalizeAddress(asset));
            if (set != null) {
                set.remove(normalizeAddress(account));
            }
        });
    }

    public void enablePermit(String asset) {
        executionTemplate.execute(() -> {
            permittable.add(normalizeAddress(asset));
        });
    }

    /**
     * 直接给 holder 记账（相当于测试网水龙头）。
     */
    public void credit(String asset, String holder, BigInteger amount) {
        requireNonNegative(amount, "amount");
        executionTemplate.execute(() -> {
            balances.merge(key(asset, holder), amount, BigInteger::add);
        });
    }

    /**
     * 只在模板持有全局锁时调用。
     */
    @Override
    public Runnable checkpoint() {
        Map<String, BigInteger> savedBalances = new HashMap<>(balances);
        Map<String, BigInteger> savedAllowances = new HashMap<>(allowances);
        Map<String, BigInteger> savedNonces = new HashMap<>(permitNonces);
        Map<String, Set<String>> savedMinters = new HashMap<>();
        minters.forEach((asset, set) -> savedMinters.put(asset, new HashSet<>(set)));
        Set<String> savedPermittable = new HashSet<>(permittable);
        return () -> {
            balances = savedBalances;
            allowances = savedAllowances;
            permitNonces = savedNonces;
            minters = savedMinters;
            permittable = savedPermittable;
        };
    }

    private void move(String asset, String from, String to, BigInteger amount) {
        String fromKey = key(asset, from);
        BigInteger balance = balances.getOrDefault(fromKey, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new BondException(BondErrorCode.INSUFFICIENT_BALANCE);
        }
        balances.put(fromKey, balance.subtract(amount));
        balances.merge(key(asset, to), amount, BigInteger::add);
    }

    private static String key(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(normalizeAddress(part));
        }
        return sb.toString();
    }
}
