package com.work.bond.core.registry;

import com.work.bond.core.exception.BondAuthorizationException;
import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.core.exception.BondNotFoundException;
import com.work.bond.core.execution.Revertible;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.work.bond.core.support.ValidationUtils.isZeroAddress;
import static com.work.bond.core.support.ValidationUtils.normalizeAddress;
import static com.work.bond.core.support.ValidationUtils.requireNonZeroAddress;

/**
 * 债券所有权登记：id -> owner，id -> 单张授权，owner -> 全部授权的 operator。
 * 每个 teller 持有一份，只在执行模板的事务内修改。
 */
public class BondRegistry implements Revertible {

    private Map<Long, String> owners = new TreeMap<>();
    private Map<Long, String> approvals = new HashMap<>();
    private Map<String, Set<String>> operators = new HashMap<>();

    public void mint(String to, long id) {
        String owner = requireNonZeroAddress(to, BondErrorCode.INVALID_ADDRESS);
        if (owners.containsKey(id)) {
            throw new BondException(BondErrorCode.TOKEN_ALREADY_MINTED, String.valueOf(id));
        }
        owners.put(id, owner);
    }

    public void burn(long id) {
        requireExists(id);
        owners.remove(id);
        approvals.remove(id);
    }

    /**
     * caller 必须是 owner、该 id 的授权地址或 owner 的 operator；转移后清除单张授权。
     */
    public void transfer(String caller, String from, String to, long id) {
        String owner = ownerOf(id);
        if (!owner.equals(normalizeAddress(from))) {
            throw new BondAuthorizationException(BondErrorCode.NOT_APPROVED, "transfer of token that is not own");
        }
        String recipient = requireNonZeroAddress(to, BondErrorCode.INVALID_ADDRESS);
        if (!isApprovedOrOwner(caller, id)) {
            throw new BondAuthorizationException(BondErrorCode.NOT_APPROVED);
        }
        approvals.remove(id);
        owners.put(id, recipient);
    }

    /**
     * 只有 owner 或其 operator 可以设置单张授权；传零地址表示撤销。
     */
    public void approve(String caller, String to, long id) {
        String owner = ownerOf(id);
        String normalizedCaller = normalizeAddress(caller);
        if (!owner.equals(normalizedCaller) && !isApprovedForAll(owner, normalizedCaller)) {
            throw new BondAuthorizationException(BondErrorCode.NOT_APPROVED);
        }
        String approved = normalizeAddress(to);
        if (approved.equals(owner)) {
            throw new BondException(BondErrorCode.INVALID_ADDRESS, "approval to current owner");
        }
        if (isZeroAddress(approved)) {
            approvals.remove(id);
        } else {
            approvals.put(id, approved);
        }
    }

    public void setApprovalForAll(String owner, String operator, boolean approved) {
        String normalizedOwner = normalizeAddress(owner);
        String normalizedOperator = normalizeAddress(operator);
        if (normalizedOwner.equals(normalizedOperator)) {
            throw new BondException(BondErrorCode.INVALID_ADDRESS, "approve to caller");
        }
        if (approved) {
            operators.computeIfAbsent(normalizedOwner, k -> new HashSet<>()).add(normalizedOperator);
        } else {
            Set<String> set = operators.get(normalizedOwner);
            if (set != null) {
                set.remove(normalizedOperator);
            }
        }
    }

    public String getApproved(long id) {
        requireExists(id);
        return approvals.get(id);
    }

    public boolean isApprovedForAll(String owner, String operator) {
        Set<String> set = operators.get(normalizeAddress(owner));
        return set != null && set.contains(normalizeAddress(operator));
    }

    public boolean isApprovedOrOwner(String spender, long id) {
        String owner = ownerOf(id);
        String normalized = normalizeAddress(spender);
        return owner.equals(normalized)
                || normalized.equals(approvals.get(id))
                || isApprovedForAll(owner, normalized);
    }

    public String ownerOf(long id) {
        requireExists(id);
        return owners.get(id);
    }

    public boolean exists(long id) {
        return owners.containsKey(id);
    }

    public long balanceOf(String owner) {
        String normalized = normalizeAddress(owner);
        return owners.values().stream().filter(normalized::equals).count();
    }

    /**
     * 按 id 升序返回 owner 持有的全部债券 id。
     */
    public List<Long> listBondsOfOwner(String owner) {
        String normalized = normalizeAddress(owner);
        List<Long> ids = new ArrayList<>();
        owners.forEach((id, holder) -> {
            if (holder.equals(normalized)) {
                ids.add(id);
            }
        });
        return Collections.unmodifiableList(ids);
    }

    public long totalSupply() {
        return owners.size();
    }

    @Override
    public Runnable checkpoint() {
        Map<Long, String> savedOwners = new TreeMap<>(owners);
        Map<Long, String> savedApprovals = new HashMap<>(approvals);
        Map<String, Set<String>> savedOperators = new HashMap<>();
        operators.forEach((owner, set) -> savedOperators.put(owner, new HashSet<>(set)));
        return () -> {
            owners = savedOwners;
            approvals = savedApprovals;
            operators = savedOperators;
        };
    }

    private void requireExists(long id) {
        if (!owners.containsKey(id)) {
            throw new BondNotFoundException(BondErrorCode.BOND_NOT_FOUND, String.valueOf(id));
        }
    }
}
