package io.obscur.security;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Base64;

final class AesGcmTest {

    @Test
    void layoutIsIvThenCiphertextAndTag() {
        byte[] key = new byte[AesGcm.KEY_BYTES];
        key[5] = 9;

        String payload = AesGcm.encryptString("abc", key);
        byte[] raw = Base64.getDecoder().decode(payload);

        Assertions.assertEquals(AesGcm.GCM_IV_BYTES + 3 + 16, raw.length);
        Assertions.assertEquals("abc", AesGcm.decryptString(payload, key));
        Assertions.assertNotEquals(payload, AesGcm.encryptString("abc", key));
    }

    @Test
    void tamperingAndWrongKeysFail() {
        byte[] key = new byte[AesGcm.KEY_BYTES];
        String payload = AesGcm.encryptString("attack at dawn", key);
        byte[] raw = Base64.getDecoder().decode(payload);
        raw[raw.length - 1] ^= 0x01;

        Assertions.assertThrows(CryptoException.class,
                () -> AesGcm.decrypt(Base64.getEncoder().encodeToString(raw), key));
        byte[] other = new byte[AesGcm.KEY_BYTES];
        other[0] = 1;
        Assertions.assertThrows(CryptoException.class, () -> AesGcm.decrypt(payload, other));
        Assertions.assertThrows(CryptoException.class, () -> AesGcm.decrypt("AAAA", key));
        Assertions.assertThrows(ValidationException.class, () -> AesGcm.encryptString("x", new byte[31]));
    }
}
