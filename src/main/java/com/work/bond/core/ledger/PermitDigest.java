package com.work.bond.core.ledger;

import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Locale;
import java.util.Optional;

/**
 * permit 签名摘要与签名者恢复。
 * <p>摘要 = keccak256(PERMIT_TYPEHASH ‖ asset ‖ owner ‖ spender ‖ value ‖ nonce ‖ deadline)，
 * 每个字段按 32 字节左补零编码；签名直接作用于摘要（不加 personal_sign 前缀）。</p>
 */
public final class PermitDigest {

    public static final byte[] PERMIT_TYPEHASH = Hash.sha3(
            "Permit(address asset,address owner,address spender,uint256 value,uint256 nonce,uint256 deadline)"
                    .getBytes(StandardCharsets.UTF_8));

    private PermitDigest() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] digest(String asset, String owner, String spender,
                                BigInteger value, BigInteger nonce, long deadline) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(32 * 7);
        out.writeBytes(PERMIT_TYPEHASH);
        out.writeBytes(word(Numeric.toBigInt(asset)));
        out.writeBytes(word(Numeric.toBigInt(owner)));
        out.writeBytes(word(Numeric.toBigInt(spender)));
        out.writeBytes(word(value));
        out.writeBytes(word(nonce));
        out.writeBytes(word(BigInteger.valueOf(deadline)));
        return Hash.sha3(out.toByteArray());
    }

    /**
     * 从签名恢复签名者地址（小写、带 0x）；签名无法恢复时返回 empty。
     */
    public static Optional<String> recoverSigner(byte[] digest, PermitSignature signature) {
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, signature.toSignatureData());
            return Optional.of("0x" + Keys.getAddress(publicKey).toLowerCase(Locale.ROOT));
        } catch (SignatureException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static byte[] word(BigInteger value) {
        return Numeric.toBytesPadded(value, 32);
    }
}
