package com.work.bond.core.teller;

import com.work.bond.core.event.BondEventListener;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.ledger.AssetLedger;
import com.work.bond.core.ledger.ContractRegistry;

import java.time.Clock;

import static com.work.bond.core.support.ValidationUtils.requireNonNull;

/**
 * 所有 teller 与 depository 共享的运行时依赖：账本、事务模板、时钟、事件端口、地址注册表。
 * 相当于链上环境本身，工厂创建的每个 teller 都复用同一份。
 */
public final class TellerContext {

    private final AssetLedger ledger;
    private final BondExecutionTemplate executionTemplate;
    private final Clock clock;
    private final BondEventListener listener;
    private final ContractRegistry contractRegistry;

    public TellerContext(AssetLedger ledger,
                         BondExecutionTemplate executionTemplate,
                         Clock clock,
                         BondEventListener listener,
                         ContractRegistry contractRegistry) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.executionTemplate = requireNonNull(executionTemplate, "executionTemplate");
        this.clock = requireNonNull(clock, "clock");
        this.listener = requireNonNull(listener, "listener");
        this.contractRegistry = requireNonNull(contractRegistry, "contractRegistry");
    }

    /**
     * 当前区块时间（epoch 秒）。
     */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public AssetLedger getLedger() {
        return ledger;
    }

    public BondExecutionTemplate getExecutionTemplate() {
        return executionTemplate;
    }

    public Clock getClock() {
        return clock;
    }

    public BondEventListener getListener() {
        return listener;
    }

    public ContractRegistry getContractRegistry() {
        return contractRegistry;
    }
}
