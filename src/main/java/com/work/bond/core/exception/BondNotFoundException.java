package com.work.bond.core.exception;

/**
 * 查询或操作的对象不存在（bond 已赎回销毁、teller 未注册等）。
 */
public class BondNotFoundException extends BondException {

    public BondNotFoundException(BondErrorCode code) {
        super(code);
    }

    public BondNotFoundException(BondErrorCode code, String detail) {
        super(code, detail);
    }
}
