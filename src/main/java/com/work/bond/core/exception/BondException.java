package com.work.bond.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 * <p>每个实例都带有 {@link BondErrorCode}，调用方应按 code 区分原因，而不是解析 message。</p>
 */
public class BondException extends RuntimeException {

    private final BondErrorCode code;

    public BondException(BondErrorCode code) {
        super(code.getReason());
        this.code = code;
    }

    public BondException(BondErrorCode code, String detail) {
        super(detail == null || detail.isEmpty() ? code.getReason() : code.getReason() + ": " + detail);
        this.code = code;
    }

    public BondErrorCode getCode() {
        return code;
    }

    public BondErrorCode.Category getCategory() {
        return code.getCategory();
    }

    public String getReason() {
        return code.getReason();
    }
}
