package com.work.bond.core.depository;

import org.web3j.crypto.Hash;
import org.web3j.rlp.RlpEncoder;
import org.web3j.rlp.RlpList;
import org.web3j.rlp.RlpString;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Locale;

/**
 * 新 teller 地址的计算方式与 EVM 一致，保证同一输入在任何节点上得到同一地址。
 * <ul>
 *     <li>CREATE：{@code keccak(rlp([deployer, nonce]))[12:]}</li>
 *     <li>CREATE2：{@code keccak(0xff ++ deployer ++ salt ++ keccak(initCode))[12:]}，
 *     initCode 为指向 implementation 的 EIP-1167 最小代理</li>
 * </ul>
 */
public final class TellerAddressCalculator {

    private static final String CLONE_PREFIX = "3d602d80600a3d3981f3363d3d373d3d3d363d73";
    private static final String CLONE_SUFFIX = "5af43d82803e903d91602b57fd5bf3";

    private TellerAddressCalculator() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String createAddress(String deployer, long nonce) {
        byte[] encoded = RlpEncoder.encode(new RlpList(
                RlpString.create(Numeric.hexStringToByteArray(deployer)),
                RlpString.create(BigInteger.valueOf(nonce))));
        return toAddress(Hash.sha3(encoded));
    }

    public static String create2Address(String deployer, byte[] salt, String implementation) {
        if (salt == null || salt.length != 32) {
            throw new IllegalArgumentException("salt 必须是 32 字节");
        }
        return create2AddressForInitCode(deployer, salt, cloneInitCode(implementation));
    }

    static String create2AddressForInitCode(String deployer, byte[] salt, byte[] initCode) {
        byte[] initCodeHash = Hash.sha3(initCode);
        byte[] deployerBytes = Numeric.hexStringToByteArray(deployer);
        byte[] buffer = new byte[1 + deployerBytes.length + salt.length + initCodeHash.length];
        buffer[0] = (byte) 0xff;
        System.arraycopy(deployerBytes, 0, buffer, 1, deployerBytes.length);
        System.arraycopy(salt, 0, buffer, 1 + deployerBytes.length, salt.length);
        System.arraycopy(initCodeHash, 0, buffer, 1 + deployerBytes.length + salt.length, initCodeHash.length);
        return toAddress(Hash.sha3(buffer));
    }

    /**
     * 把十六进制字符串左补零成 32 字节 salt（"0x" 可选）。
     */
    public static byte[] toSalt(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(hex);
        if (raw.length > 32) {
            throw new IllegalArgumentException("salt 超过 32 字节");
        }
        byte[] salt = new byte[32];
        System.arraycopy(raw, 0, salt, 32 - raw.length, raw.length);
        return salt;
    }

    static byte[] cloneInitCode(String implementation) {
        String impl = Numeric.cleanHexPrefix(implementation).toLowerCase(Locale.ROOT);
        return Numeric.hexStringToByteArray(CLONE_PREFIX + impl + CLONE_SUFFIX);
    }

    private static String toAddress(byte[] hash) {
        return Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }
}
