package com.zookies.zkbackend.util;

import org.bitcoinj.core.ECKey;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EthereumSignatureUtilsTest {

    private static final String PRIVATE_KEY = "0x79b9be0588ba3f0fe9402b42b94c15884d07861dbbde985e7c51e6654b9e8177";
    private static final String PUBLIC_KEY = "0x04dc4d36c81578ad126887f0a5942e2fd1cbc56dad152a43a2f03e032938f45c13cf87e1027d66ec2bf60fc423f34afe80384e9ad67b20cdec28143bc2469d7183";
    private static final String ADDRESS = "0x8d5625f97295ce30cD728c5bb1Aa2af1751D8Dd3";

    @Nested
    @DisplayName("Hashing")
    class Hashing {

        @Test
        void keccak256_shouldMatchKnownEmptyInputDigest() {
            byte[] digest = EthereumSignatureUtils.keccak256(new byte[0]);

            assertThat(Hex.toHexString(digest))
                    .isEqualTo("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
        }

        @Test
        void hashPersonalMessage_shouldPrefixByteLengthNotCharLength() {
            // "é" is two bytes in UTF-8
            byte[] expected = EthereumSignatureUtils.keccak256(
                    "\u0019Ethereum Signed Message:\n2é".getBytes(StandardCharsets.UTF_8));

            assertThat(EthereumSignatureUtils.hashPersonalMessage("é")).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Keys and addresses")
    class KeysAndAddresses {

        @Test
        void shouldDeriveKnownPublicKeyAndAddressFromPrivateKey() {
            ECKey key = EthereumSignatureUtils.keyFromPrivateHex(PRIVATE_KEY);

            assertThat(EthereumSignatureUtils.publicKeyHex(key)).isEqualTo(PUBLIC_KEY);
            assertThat(EthereumSignatureUtils.addressOf(key)).isEqualTo(ADDRESS);
        }

        @Test
        void addressOfPublicKey_shouldAcceptUncompressedAndCompressedKeys() {
            ECKey key = EthereumSignatureUtils.keyFromPrivateHex(PRIVATE_KEY);
            String compressed = "0x" + Hex.toHexString(key.getPubKeyPoint().getEncoded(true));

            assertThat(EthereumSignatureUtils.addressOfPublicKey(PUBLIC_KEY)).isEqualTo(ADDRESS);
            assertThat(EthereumSignatureUtils.addressOfPublicKey(compressed)).isEqualTo(ADDRESS);
        }

        @Test
        void toChecksumAddress_shouldApplyEip55Casing() {
            assertThat(EthereumSignatureUtils.toChecksumAddress("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed"))
                    .isEqualTo("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
            assertThat(EthereumSignatureUtils.toChecksumAddress(ADDRESS.toLowerCase())).isEqualTo(ADDRESS);
        }

        @Test
        void isValidAddress_shouldRequirePrefixAndFortyHexChars() {
            assertThat(EthereumSignatureUtils.isValidAddress(ADDRESS)).isTrue();
            assertThat(EthereumSignatureUtils.isValidAddress(ADDRESS.substring(2))).isFalse();
            assertThat(EthereumSignatureUtils.isValidAddress(ADDRESS + "0")).isFalse();
            assertThat(EthereumSignatureUtils.isValidAddress("0x" + "g".repeat(40))).isFalse();
            assertThat(EthereumSignatureUtils.isValidAddress(null)).isFalse();
        }

        @Test
        void decodeHex_shouldRejectOddLengthAndNonHexInput() {
            assertThatThrownBy(() -> EthereumSignatureUtils.decodeHex("0xabc"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> EthereumSignatureUtils.decodeHex("0xzz"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Personal message signatures")
    class PersonalMessageSignatures {

        private final ECKey key = EthereumSignatureUtils.keyFromPrivateHex(PRIVATE_KEY);

        @Test
        void shouldProduce65ByteSignatureWithRecoveryByte27Or28() {
            String signature = EthereumSignatureUtils.signPersonalMessage("hello", key);

            byte[] bytes = EthereumSignatureUtils.decodeHex(signature);
            assertThat(signature).startsWith("0x").hasSize(132);
            assertThat(bytes[64] & 0xFF).isIn(27, 28);
        }

        @Test
        void shouldRecoverSignerAddress() {
            String signature = EthereumSignatureUtils.signPersonalMessage("hello", key);

            assertThat(EthereumSignatureUtils.recoverPersonalMessageSigner("hello", signature)).isEqualTo(ADDRESS);
        }

        @Test
        void shouldAcceptRecoveryByteWithoutOffset() {
            byte[] bytes = EthereumSignatureUtils.decodeHex(EthereumSignatureUtils.signPersonalMessage("hello", key));
            bytes[64] = (byte) (bytes[64] - 27);

            String recovered = EthereumSignatureUtils.recoverPersonalMessageSigner("hello", "0x" + Hex.toHexString(bytes));

            assertThat(recovered).isEqualTo(ADDRESS);
        }

        @Test
        void shouldRecoverDifferentAddressForDifferentMessage() {
            String signature = EthereumSignatureUtils.signPersonalMessage("hello", key);

            assertThat(EthereumSignatureUtils.recoverPersonalMessageSigner("hello!", signature)).isNotEqualTo(ADDRESS);
        }

        @Test
        void shouldRejectSignatureOfWrongLength() {
            assertThatThrownBy(() -> EthereumSignatureUtils.recoverPersonalMessageSigner("hello", "0x" + "ab".repeat(64)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("65 bytes");
        }

        @Test
        void shouldRejectInvalidRecoveryByte() {
            byte[] bytes = EthereumSignatureUtils.decodeHex(EthereumSignatureUtils.signPersonalMessage("hello", key));
            bytes[64] = 35;

            assertThatThrownBy(() -> EthereumSignatureUtils.recoverPersonalMessageSigner("hello", "0x" + Hex.toHexString(bytes)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("recovery byte");
        }
    }

}
