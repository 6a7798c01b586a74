package com.work.bond.core.ledger;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondNotFoundException;
import com.work.bond.core.execution.Revertible;
import com.work.bond.core.support.ValidationUtils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.bond.core.support.ValidationUtils.requireNonNull;

/**
 * 地址到组件实例的映射（相当于运行时的"按地址调用合约"）。
 * teller 通过它找到配置里的 depository 与 lock vault，宿主应用通过它按地址找到 teller。
 */
public class ContractRegistry implements Revertible {

    private final Map<String, Object> contracts = new ConcurrentHashMap<>();

    public void register(String address, Object contract) {
        requireNonNull(contract, "contract");
        contracts.put(ValidationUtils.normalizeAddress(address), contract);
    }

    public void unregister(String address) {
        contracts.remove(ValidationUtils.normalizeAddress(address));
    }

    public boolean contains(String address) {
        return address != null && contracts.containsKey(address.toLowerCase(Locale.ROOT));
    }

    /**
     * 按地址解析指定类型的组件，不存在或类型不符时抛 {@code missing}。
     */
    public <T> T resolve(String address, Class<T> type, BondErrorCode missing) {
        Object contract = address == null ? null : contracts.get(address.toLowerCase(Locale.ROOT));
        if (!type.isInstance(contract)) {
            throw new BondNotFoundException(missing, address);
        }
        return type.cast(contract);
    }

    @Override
    public Runnable checkpoint() {
        Map<String, Object> saved = new HashMap<>(contracts);
        return () -> {
            contracts.clear();
            contracts.putAll(saved);
        };
    }
}
