package com.work.bond.demo.config;

import com.work.bond.core.depository.BondDepository;
import com.work.bond.core.event.BondEventListener;
import com.work.bond.core.event.LoggingBondEventListener;
import com.work.bond.core.execution.BondExecutionTemplate;
import com.work.bond.core.ledger.ContractRegistry;
import com.work.bond.core.support.InMemoryAssetLedger;
import com.work.bond.core.support.InMemoryLockVault;
import com.work.bond.core.teller.TellerContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 账本与锁仓金库使用内存实现；接入真实链时替换 {@link InMemoryAssetLedger} 与 {@link InMemoryLockVault} 即可。
 */
@Configuration
@EnableConfigurationProperties(BondProperties.class)
public class BondEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BondExecutionTemplate bondExecutionTemplate() {
        return new BondExecutionTemplate();
    }

    @Bean
    @ConditionalOnMissingBean(BondEventListener.class)
    public BondEventListener bondEventListener() {
        return new LoggingBondEventListener();
    }

    @Bean
    public InMemoryAssetLedger assetLedger(Clock clock, BondExecutionTemplate template) {
        return new InMemoryAssetLedger(clock, template);
    }

    @Bean
    public ContractRegistry contractRegistry(BondExecutionTemplate template) {
        ContractRegistry registry = new ContractRegistry();
        template.register(registry);
        return registry;
    }

    @Bean
    public TellerContext tellerContext(InMemoryAssetLedger ledger,
                                       BondExecutionTemplate template,
                                       Clock clock,
                                       BondEventListener listener,
                                       ContractRegistry contractRegistry) {
        return new TellerContext(ledger, template, clock, listener, contractRegistry);
    }

    @Bean
    public InMemoryLockVault lockVault(BondProperties properties,
                                       InMemoryAssetLedger ledger,
                                       Clock clock,
                                       BondExecutionTemplate template,
                                       ContractRegistry contractRegistry) {
        InMemoryLockVault vault = new InMemoryLockVault(properties.getLockVault(), properties.getRewardAsset(),
                ledger, clock, template);
        contractRegistry.register(vault.getAddress(), vault);
        return vault;
    }

    /**
     * depository 创建后即被授予奖励资产的 minter 权限，否则 pullReward 会以 "!minter" 失败。
     */
    @Bean
    public BondDepository bondDepository(BondProperties properties,
                                         TellerContext tellerContext,
                                         InMemoryAssetLedger ledger,
                                         InMemoryLockVault lockVault) {
        BondDepository depository = new BondDepository(
                properties.getDepositoryAddress(),
                properties.getGovernance(),
                properties.getRewardAsset(),
                lockVault.getAddress(),
                properties.getUnderwritingPool(),
                properties.getDao(),
                properties.getTellerImplementation(),
                tellerContext);
        ledger.addMinter(properties.getRewardAsset(), depository.getAddress());
        return depository;
    }
}
