package com.work.bond.core.exception;

/**
 * 调用方无权执行该操作（非 governance、非 bond 持有人、非授权 teller 等）。
 */
public class BondAuthorizationException extends BondException {

    public BondAuthorizationException(BondErrorCode code) {
        super(code);
    }

    public BondAuthorizationException(BondErrorCode code, String detail) {
        super(code, detail);
    }
}
