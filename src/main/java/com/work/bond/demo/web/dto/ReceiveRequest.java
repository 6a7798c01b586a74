package com.work.bond.demo.web.dto;

import java.math.BigInteger;
import javax.validation.constraints.NotNull;

/**
 * 直接转入请求：调用方（X-Caller）把本金转给 teller。
 */
public class ReceiveRequest {

    @NotNull(message = "amount 不能为空")
    private BigInteger amount;

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
