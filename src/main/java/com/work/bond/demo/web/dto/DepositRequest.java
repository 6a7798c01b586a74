package com.work.bond.demo.web.dto;

import java.math.BigInteger;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

/**
 * 直接存款请求：调用方（X-Caller）需事先对 teller 授权本金额度。
 */
public class DepositRequest {

    @NotNull(message = "amountIn 不能为空")
    private BigInteger amountIn;

    @NotNull(message = "minAmountOut 不能为空")
    private BigInteger minAmountOut;

    @NotBlank(message = "depositor 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String depositor;

    private boolean stake;

    public BigInteger getAmountIn() {
        return amountIn;
    }

    public void setAmountIn(BigInteger amountIn) {
        this.amountIn = amountIn;
    }

    public BigInteger getMinAmountOut() {
        return minAmountOut;
    }

    public void setMinAmountOut(BigInteger minAmountOut) {
        this.minAmountOut = minAmountOut;
    }

    public String getDepositor() {
        return depositor;
    }

    public void setDepositor(String depositor) {
        this.depositor = depositor;
    }

    public boolean isStake() {
        return stake;
    }

    public void setStake(boolean stake) {
        this.stake = stake;
    }
}
