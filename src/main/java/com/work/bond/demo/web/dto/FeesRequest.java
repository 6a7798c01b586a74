package com.work.bond.demo.web.dto;

import javax.validation.constraints.NotNull;

/**
 * 设置协议费率请求（bps，范围由核心组件校验）。
 */
public class FeesRequest {

    @NotNull(message = "protocolFeeBps 不能为空")
    private Integer protocolFeeBps;

    public Integer getProtocolFeeBps() {
        return protocolFeeBps;
    }

    public void setProtocolFeeBps(Integer protocolFeeBps) {
        this.protocolFeeBps = protocolFeeBps;
    }
}
