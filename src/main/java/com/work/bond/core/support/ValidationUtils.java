package com.work.bond.core.support;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import org.web3j.crypto.WalletUtils;

import java.math.BigInteger;
import java.util.Locale;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验金额非负（uint256 语义），null 视为非法。
     */
    public static BigInteger requireNonNegative(BigInteger value, String paramName) {
        if (value == null || value.signum() < 0) {
            throw new BondException(BondErrorCode.INVALID_AMOUNT, paramName);
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new BondException(BondErrorCode.INVALID_AMOUNT, paramName);
        }
        return value;
    }

    /**
     * 地址格式校验并统一为小写形式；格式非法抛 INVALID_ADDRESS。
     * <p>零地址在格式上是合法的，是否允许由调用方决定。</p>
     */
    public static String normalizeAddress(String address) {
        if (address == null || !WalletUtils.isValidAddress(address) || !address.startsWith("0x")) {
            throw new BondException(BondErrorCode.INVALID_ADDRESS, String.valueOf(address));
        }
        return address.toLowerCase(Locale.ROOT);
    }

    public static boolean isZeroAddress(String address) {
        return address == null || ZERO_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * 零地址按调用方给定的错误码拒绝（例如 "zero address dao"），其余按格式校验。
     */
    public static String requireNonZeroAddress(String address, BondErrorCode zeroCode) {
        if (isZeroAddress(address)) {
            throw new BondException(zeroCode);
        }
        return normalizeAddress(address);
    }
}
