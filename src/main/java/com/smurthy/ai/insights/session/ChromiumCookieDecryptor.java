package com.smurthy.ai.insights.session;

import com.smurthy.ai.insights.exception.SessionNotFoundException;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * Decrypts Chromium {@code encrypted_value} blobs on Linux and macOS.
 *
 * Format: a 3-byte version prefix ("v10" or "v11") followed by AES-128-CBC ciphertext.
 * The key is PBKDF2-HMAC-SHA1 over the safe-storage password with salt "saltysalt";
 * the IV is 16 spaces. Cookie databases at meta version 24 or later prepend a
 * SHA-256 digest of the host to the plaintext, which is stripped.
 */
public class ChromiumCookieDecryptor {

    static final String LINUX_DEFAULT_PASSWORD = "peanuts";
    static final int LINUX_ITERATIONS = 1;
    static final int MAC_ITERATIONS = 1003;
    static final int HOST_DIGEST_META_VERSION = 24;

    private static final byte[] SALT = "saltysalt".getBytes(StandardCharsets.UTF_8);
    private static final byte[] IV = "                ".getBytes(StandardCharsets.UTF_8);
    private static final int HOST_DIGEST_LENGTH = 32;

    private final SecretKeySpec v10Key;
    private final SecretKeySpec v11Key;  // null when no keyring password is known

    ChromiumCookieDecryptor(SecretKeySpec v10Key, SecretKeySpec v11Key) {
        this.v10Key = v10Key;
        this.v11Key = v11Key;
    }

    /**
     * Linux: v10 always uses the built-in password; v11 needs the password from the desktop keyring.
     */
    public static ChromiumCookieDecryptor linux(String keyringPassword) {
        SecretKeySpec v10 = deriveKey(LINUX_DEFAULT_PASSWORD, LINUX_ITERATIONS);
        SecretKeySpec v11 = keyringPassword == null || keyringPassword.isBlank()
                ? null
                : deriveKey(keyringPassword, LINUX_ITERATIONS);
        return new ChromiumCookieDecryptor(v10, v11);
    }

    /**
     * macOS: both prefixes use the Keychain "Safe Storage" password.
     */
    public static ChromiumCookieDecryptor mac(String keychainPassword) {
        SecretKeySpec key = deriveKey(keychainPassword, MAC_ITERATIONS);
        return new ChromiumCookieDecryptor(key, key);
    }

    /**
     * @return the plaintext cookie value, or null when {@code encrypted} is empty
     *         (the cookie is then stored unencrypted in the {@code value} column)
     */
    public String decrypt(byte[] encrypted, int metaVersion) {
        if (encrypted == null || encrypted.length == 0) {
            return null;
        }
        if (encrypted.length <= 3) {
            throw new SessionNotFoundException("Encrypted cookie value is truncated");
        }

        String prefix = new String(encrypted, 0, 3, StandardCharsets.US_ASCII);
        SecretKeySpec key = switch (prefix) {
            case "v10" -> v10Key;
            case "v11" -> v11Key;
            default -> throw new SessionNotFoundException(
                    "Unsupported cookie encryption '" + prefix + "' (Windows DPAPI and app-bound encryption are not supported)");
        };
        if (key == null) {
            throw new SessionNotFoundException(
                    "Cookie is encrypted with the desktop keyring password; set insights.session.safe-storage-password");
        }

        byte[] plain = aesDecrypt(key, Arrays.copyOfRange(encrypted, 3, encrypted.length));
        if (metaVersion >= HOST_DIGEST_META_VERSION && plain.length >= HOST_DIGEST_LENGTH) {
            plain = Arrays.copyOfRange(plain, HOST_DIGEST_LENGTH, plain.length);
        }
        return new String(plain, StandardCharsets.UTF_8);
    }

    /**
     * Encrypts a value the way Chromium does. The inverse of {@link #decrypt(byte[], int)}.
     */
    byte[] encrypt(String prefix, String value, byte[] hostDigest) {
        SecretKeySpec key = "v11".equals(prefix) ? v11Key : v10Key;
        try {
            byte[] plain = value.getBytes(StandardCharsets.UTF_8);
            if (hostDigest != null) {
                byte[] withDigest = new byte[hostDigest.length + plain.length];
                System.arraycopy(hostDigest, 0, withDigest, 0, hostDigest.length);
                System.arraycopy(plain, 0, withDigest, hostDigest.length, plain.length);
                plain = withDigest;
            }
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(IV));
            byte[] body = cipher.doFinal(plain);
            byte[] out = new byte[3 + body.length];
            System.arraycopy(prefix.getBytes(StandardCharsets.US_ASCII), 0, out, 0, 3);
            System.arraycopy(body, 0, out, 3, body.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES encryption failed", e);
        }
    }

    private static byte[] aesDecrypt(SecretKeySpec key, byte[] ciphertext) {
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(IV));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new SessionNotFoundException("Could not decrypt cookie value (wrong safe-storage password?)", e);
        }
    }

    static SecretKeySpec deriveKey(String password, int iterations) {
        try {
            PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), SALT, iterations, 128);
            byte[] key = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA1").generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA1 is not available", e);
        }
    }
}
