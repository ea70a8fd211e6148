package com.routermon.utils;

import org.bouncycastle.crypto.generators.SCrypt;

import javax.crypto.Cipher;

import javax.crypto.spec.GCMParameterSpec;

import javax.crypto.spec.SecretKeySpec;

import java.nio.charset.StandardCharsets;

import java.security.SecureRandom;

import java.util.Arrays;

import java.util.Base64;

import java.util.Map;

import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * Device secret encryption for RouterMon

 * Uses:
 * - AES-256-GCM for two-way encryption of device login secrets
 * - scrypt (N=16384, r=8, p=1) over the shared secret key with the fixed salt "salt" to derive the AES key

 * Stored format: base64(salt):base64(iv):base64(authTag):base64(ciphertext)
 * The salt segment is random filler kept for format compatibility; it does not enter the key.
 * Values written by the web back end with the same ENCRYPTION_KEY decrypt here and vice versa.
 */
public class PasswordUtil
{

    private static final Logger logger = LoggerFactory.getLogger(PasswordUtil.class);

    private static final byte[] KEY_SALT = "salt".getBytes(StandardCharsets.UTF_8);

    private static final int SCRYPT_COST = 16384;

    private static final int SCRYPT_BLOCK_SIZE = 8;

    private static final int SCRYPT_PARALLELISM = 1;

    private static final int KEY_LENGTH = 32;

    private static final String ENCRYPTION_ALGORITHM = "AES";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final int SALT_LENGTH = 32;

    private static final int IV_LENGTH = 16;

    private static final int TAG_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    // one scrypt derivation per shared key
    private static final Map<String, SecretKeySpec> KEYS = new ConcurrentHashMap<>();

    /**
     * Encrypt a device secret for storage (TWO-WAY symmetric encryption)
     *
     * @param secret Plain text secret
     * @param secretKey Shared secret key
     * @return Encrypted secret in salt:iv:authTag:data form, or null on failure
     */
    public static String encryptSecret(String secret, String secretKey)
    {
        try
        {
            var salt = new byte[SALT_LENGTH];

            var iv = new byte[IV_LENGTH];

            RANDOM.nextBytes(salt);

            RANDOM.nextBytes(iv);

            var cipher = Cipher.getInstance(TRANSFORMATION);

            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(secretKey), new GCMParameterSpec(TAG_LENGTH * 8, iv));

            // GCM appends the tag to the ciphertext
            var sealed = cipher.doFinal(secret.getBytes(StandardCharsets.UTF_8));

            var data = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);

            var tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

            var encoder = Base64.getEncoder();

            return encoder.encodeToString(salt) + ":" + encoder.encodeToString(iv) + ":"
                + encoder.encodeToString(tag) + ":" + encoder.encodeToString(data);
        }
        catch (Exception exception)
        {
            logger.error("Failed to encrypt secret: {}", exception.getMessage());

            return null;
        }
    }

    /**
     * Decrypt a stored device secret (TWO-WAY symmetric decryption)
     *
     * @param encryptedSecret Encrypted secret in salt:iv:authTag:data form
     * @param secretKey Shared secret key
     * @return Plain text secret, or null when the value is malformed or fails authentication
     */
    public static String decryptSecret(String encryptedSecret, String secretKey)
    {
        try
        {
            if (encryptedSecret == null)
            {
                return null;
            }

            var parts = encryptedSecret.split(":");

            if (parts.length != 4)
            {
                logger.error("Failed to decrypt secret: expected 4 segments, got {}", parts.length);

                return null;
            }

            var decoder = Base64.getDecoder();

            var iv = decoder.decode(parts[1]);

            var tag = decoder.decode(parts[2]);

            var data = decoder.decode(parts[3]);

            var sealed = new byte[data.length + tag.length];

            System.arraycopy(data, 0, sealed, 0, data.length);

            System.arraycopy(tag, 0, sealed, data.length, tag.length);

            var cipher = Cipher.getInstance(TRANSFORMATION);

            cipher.init(Cipher.DECRYPT_MODE, deriveKey(secretKey), new GCMParameterSpec(tag.length * 8, iv));

            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        }
        catch (Exception exception)
        {
            logger.error("Failed to decrypt secret: {}", exception.getMessage());

            return null;
        }
    }

    private static SecretKeySpec deriveKey(String secretKey)
    {
        return KEYS.computeIfAbsent(secretKey, key -> new SecretKeySpec(
                SCrypt.generate(key.getBytes(StandardCharsets.UTF_8), KEY_SALT, SCRYPT_COST, SCRYPT_BLOCK_SIZE,
                        SCRYPT_PARALLELISM, KEY_LENGTH),
                ENCRYPTION_ALGORITHM));
    }

}
