package com.work.bond.demo.web.dto;

import java.math.BigInteger;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

/**
 * demo 水龙头：直接给 holder 记账。
 */
public class FaucetRequest {

    @NotBlank(message = "asset 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String asset;

    @NotBlank(message = "holder 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String holder;

    @NotNull(message = "amount 不能为空")
    private BigInteger amount;

    public String getAsset() {
        return asset;
    }

    public void setAsset(String asset) {
        this.asset = asset;
    }

    public String getHolder() {
        return holder;
    }

    public void setHolder(String holder) {
        this.holder = holder;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
