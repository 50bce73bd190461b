package com.zookies.zkbackend.util;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * secp256k1 helpers for Ethereum personal-message signatures (EIP-191) and addresses.
 * Signatures are 65 bytes {@code r || s || v} with {@code v} in {27, 28}, hex encoded with a 0x prefix.
 */
public class EthereumSignatureUtils {

    private static final String PERSONAL_MESSAGE_PREFIX = "\u0019Ethereum Signed Message:\n";
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern PRIVATE_KEY_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public static final int SIGNATURE_LENGTH = 65;

    public static byte[] keccak256(byte[] input) {
        return new Keccak.Digest256().digest(input);
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (Exception e) {
            throw new RuntimeException("SHA-256 hashing failed", e);
        }
    }

    /**
     * keccak256("\x19Ethereum Signed Message:\n" + byteLength(message) + message)
     */
    public static byte[] hashPersonalMessage(String message) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        byte[] prefix = (PERSONAL_MESSAGE_PREFIX + body.length).getBytes(StandardCharsets.UTF_8);
        byte[] payload = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, payload, 0, prefix.length);
        System.arraycopy(body, 0, payload, prefix.length, body.length);
        return keccak256(payload);
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    public static boolean isValidPrivateKey(String privateKeyHex) {
        return privateKeyHex != null && PRIVATE_KEY_PATTERN.matcher(privateKeyHex).matches();
    }

    public static ECKey keyFromPrivateHex(String privateKeyHex) {
        BigInteger priv = new BigInteger(1, decodeHex(privateKeyHex));
        return ECKey.fromPrivate(priv, false);
    }

    /**
     * Uncompressed SEC1 public key, 65 bytes starting with 0x04, as 0x-prefixed hex.
     */
    public static String publicKeyHex(ECKey key) {
        return "0x" + Hex.toHexString(key.getPubKeyPoint().getEncoded(false));
    }

    public static String addressOf(ECKey key) {
        byte[] uncompressed = key.getPubKeyPoint().getEncoded(false);
        byte[] hash = keccak256(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        return toChecksumAddress("0x" + Hex.toHexString(Arrays.copyOfRange(hash, 12, 32)));
    }

    /**
     * Address for a compressed or uncompressed public key given as hex.
     */
    public static String addressOfPublicKey(String publicKeyHex) {
        return addressOf(ECKey.fromPublicOnly(decodeHex(publicKeyHex)));
    }

    /**
     * EIP-55 mixed-case checksum encoding.
     */
    public static String toChecksumAddress(String address) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + address);
        }
        String lower = address.substring(2).toLowerCase(Locale.ROOT);
        String hashHex = Hex.toHexString(keccak256(lower.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder sb = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) && Character.digit(hashHex.charAt(i), 16) >= 8) {
                sb.append(Character.toUpperCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String signPersonalMessage(String message, ECKey key) {
        Sha256Hash digest = Sha256Hash.wrap(hashPersonalMessage(message));
        ECKey.ECDSASignature sig = key.sign(digest);
        int recId = findRecoveryId(sig, digest, key);
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(toBytes32(sig.r), 0, out, 0, 32);
        System.arraycopy(toBytes32(sig.s), 0, out, 32, 32);
        out[64] = (byte) (27 + recId);
        return "0x" + Hex.toHexString(out);
    }

    /**
     * Recovers the checksummed signer address of a personal-message signature.
     *
     * @throws IllegalArgumentException if the signature is not 65 well-formed bytes
     * @throws IllegalStateException if no public key can be recovered
     */
    public static String recoverPersonalMessageSigner(String message, String signatureHex) {
        byte[] sig = decodeHex(signatureHex);
        if (sig.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature must be " + SIGNATURE_LENGTH + " bytes, got " + sig.length);
        }
        int v = sig[64] & 0xFF;
        int recId = v >= 27 ? v - 27 : v;
        if (recId < 0 || recId > 1) {
            throw new IllegalArgumentException("Invalid recovery byte: " + v);
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(sig, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, 32, 64));
        if (r.signum() == 0 || s.signum() == 0) {
            throw new IllegalArgumentException("Signature component is zero");
        }
        Sha256Hash digest = Sha256Hash.wrap(hashPersonalMessage(message));
        ECKey recovered = ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s), digest, false);
        if (recovered == null) {
            throw new IllegalStateException("Could not recover public key from signature");
        }
        return addressOf(recovered);
    }

    public static byte[] decodeHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex input is null");
        }
        String stripped = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (stripped.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex input has odd length");
        }
        try {
            return Hex.decode(stripped);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex input", e);
        }
    }

    private static int findRecoveryId(ECKey.ECDSASignature sig, Sha256Hash digest, ECKey key) {
        byte[] expected = key.getPubKeyPoint().getEncoded(false);
        for (int recId = 0; recId < 2; recId++) {
            ECKey candidate = ECKey.recoverFromSignature(recId, sig, digest, false);
            if (candidate != null && Arrays.equals(candidate.getPubKeyPoint().getEncoded(false), expected)) {
                return recId;
            }
        }
        throw new IllegalStateException("Could not determine recovery id for signature");
    }

    private static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length == 32) return bytes;
        byte[] padded = new byte[32];
        int srcPos = Math.max(0, bytes.length - 32);
        int length = bytes.length - srcPos;
        System.arraycopy(bytes, srcPos, padded, 32 - length, length);
        return padded;
    }

}
