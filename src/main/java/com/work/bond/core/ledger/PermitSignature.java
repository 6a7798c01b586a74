package com.work.bond.core.ledger;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.util.Arrays;

import static com.work.bond.core.support.ValidationUtils.requireNonEmpty;

/**
 * secp256k1 签名 (v, r, s)，对应 permit 调用携带的三个参数。
 */
public class PermitSignature {

    private final byte v;
    private final byte[] r;
    private final byte[] s;

    public PermitSignature(byte v, byte[] r, byte[] s) {
        if (r == null || r.length != 32 || s == null || s.length != 32) {
            throw new IllegalArgumentException("r/s 必须为 32 字节");
        }
        this.v = v;
        this.r = Arrays.copyOf(r, 32);
        this.s = Arrays.copyOf(s, 32);
    }

    public static PermitSignature of(int v, String rHex, String sHex) {
        requireNonEmpty(rHex, "r");
        requireNonEmpty(sHex, "s");
        return new PermitSignature((byte) v,
                Numeric.toBytesPadded(Numeric.toBigInt(rHex), 32),
                Numeric.toBytesPadded(Numeric.toBigInt(sHex), 32));
    }

    public static PermitSignature from(Sign.SignatureData data) {
        return new PermitSignature(data.getV()[0], data.getR(), data.getS());
    }

    public Sign.SignatureData toSignatureData() {
        return new Sign.SignatureData(v, r, s);
    }

    public int getV() {
        return v & 0xff;
    }

    public String getR() {
        return Numeric.toHexString(r);
    }

    public String getS() {
        return Numeric.toHexString(s);
    }
}
