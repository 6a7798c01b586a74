package com.work.bond.demo.web.dto;

import java.math.BigInteger;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

/**
 * 签名存款请求：附带 depositor 对 teller 的 permit 签名。
 */
public class SignedDepositRequest {

    @NotNull(message = "amountIn 不能为空")
    private BigInteger amountIn;

    @NotNull(message = "minAmountOut 不能为空")
    private BigInteger minAmountOut;

    @NotBlank(message = "depositor 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String depositor;

    private boolean stake;

    private long deadline;

    private int v;

    @NotBlank(message = "r 不能为空")
    private String r;

    @NotBlank(message = "s 不能为空")
    private String s;

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

    public long getDeadline() {
        return deadline;
    }

    public void setDeadline(long deadline) {
        this.deadline = deadline;
    }

    public int getV() {
        return v;
    }

    public void setV(int v) {
        this.v = v;
    }

    public String getR() {
        return r;
    }

    public void setR(String r) {
        this.r = r;
    }

    public String getS() {
        return s;
    }

    public void setS(String s) {
        this.s = s;
    }
}
