package com.work.bond.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 仅存在于 demo/业务包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的构造参数（{@link com.work.bond.core.model.TellerConfig} 等）。
 */
@ConfigurationProperties(prefix = "bond")
public class BondProperties {

    /**
     * depository 与启动时创建的 teller 的治理地址
     */
    private String governance;

    private String depositoryAddress;

    /**
     * teller 逻辑实现的地址，只参与 CREATE2 地址计算
     */
    private String tellerImplementation;

    private String rewardAsset;
    private String lockVault;
    private String underwritingPool;
    private String dao;

    /**
     * 启动时给每个 teller 设置的协议费率（bps）
     */
    private int protocolFeeBps;

    private List<TellerProperties> tellers = new ArrayList<>();

    public String getGovernance() {
        return governance;
    }

    public void setGovernance(String governance) {
        this.governance = governance;
    }

    public String getDepositoryAddress() {
        return depositoryAddress;
    }

    public void setDepositoryAddress(String depositoryAddress) {
        this.depositoryAddress = depositoryAddress;
    }

    public String getTellerImplementation() {
        return tellerImplementation;
    }

    public void setTellerImplementation(String tellerImplementation) {
        this.tellerImplementation = tellerImplementation;
    }

    public String getRewardAsset() {
        return rewardAsset;
    }

    public void setRewardAsset(String rewardAsset) {
        this.rewardAsset = rewardAsset;
    }

    public String getLockVault() {
        return lockVault;
    }

    public void setLockVault(String lockVault) {
        this.lockVault = lockVault;
    }

    public String getUnderwritingPool() {
        return underwritingPool;
    }

    public void setUnderwritingPool(String underwritingPool) {
        this.underwritingPool = underwritingPool;
    }

    public String getDao() {
        return dao;
    }

    public void setDao(String dao) {
        this.dao = dao;
    }

    public int getProtocolFeeBps() {
        return protocolFeeBps;
    }

    public void setProtocolFeeBps(int protocolFeeBps) {
        this.protocolFeeBps = protocolFeeBps;
    }

    public List<TellerProperties> getTellers() {
        return tellers;
    }

    public void setTellers(List<TellerProperties> tellers) {
        this.tellers = tellers;
    }

    /**
     * 启动时由 depository 工厂创建的 teller。
     */
    public static class TellerProperties {

        private String name;
        private String principal;
        private boolean permittable;

        /**
         * 设置后走 CREATE2，地址可提前预测；否则按 nonce 分配
         */
        private String salt;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPrincipal() {
            return principal;
        }

        public void setPrincipal(String principal) {
            this.principal = principal;
        }

        public boolean isPermittable() {
            return permittable;
        }

        public void setPermittable(boolean permittable) {
            this.permittable = permittable;
        }

        public String getSalt() {
            return salt;
        }

        public void setSalt(String salt) {
            this.salt = salt;
        }
    }
}
