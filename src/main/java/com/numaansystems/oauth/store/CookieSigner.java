package com.numaansystems.oauth.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Signs and verifies cookie values using HMAC-SHA256.
 *
 * <p>Signed values have the form {@code {urlEncodedValue}:{hexSignature}}.
 * URL encoding keeps the value within the characters allowed in a cookie and
 * free of the separator.</p>
 *
 * <p>When no secret is configured a random key is generated, so cookies
 * signed before a restart no longer verify.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class CookieSigner {

    private static final Logger logger = LoggerFactory.getLogger(CookieSigner.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SEPARATOR = ":";

    private final byte[] secretKey;
    private final boolean keyConfigured;

    /**
     * @param secret the signing secret, or null/blank to use a random per-process key
     */
    public CookieSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            byte[] keyBytes = new byte[32];
            new SecureRandom().nextBytes(keyBytes);
            this.secretKey = keyBytes;
            this.keyConfigured = false;
            logger.warn("oauth.cookie-secret not configured, using a random key. "
                    + "Signed cookies will not survive a restart.");
        } else {
            this.secretKey = secret.getBytes(StandardCharsets.UTF_8);
            this.keyConfigured = true;
        }
    }

    /**
     * Signs a cookie value.
     *
     * @param value the value to sign
     * @return signed value in format {@code {urlEncodedValue}:{signature}}
     */
    public String sign(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Cookie value cannot be null or empty");
        }
        String encodedValue = URLEncoder.encode(value, StandardCharsets.UTF_8);
        return encodedValue + SEPARATOR + calculateHmac(encodedValue);
    }

    /**
     * Verifies a signed cookie value and extracts the original value.
     *
     * @param signedValue the signed cookie value
     * @return the original value if the signature is valid, null otherwise
     */
    public String verifyAndExtract(String signedValue) {
        if (signedValue == null || signedValue.isEmpty()) {
            return null;
        }

        int separatorIndex = signedValue.lastIndexOf(SEPARATOR);
        if (separatorIndex < 0) {
            logger.debug("Signed cookie value has no separator");
            return null;
        }

        String encodedValue = signedValue.substring(0, separatorIndex);
        String providedSignature = signedValue.substring(separatorIndex + 1);
        String expectedSignature = calculateHmac(encodedValue);

        if (!MessageDigest.isEqual(
                expectedSignature.getBytes(StandardCharsets.US_ASCII),
                providedSignature.getBytes(StandardCharsets.US_ASCII))) {
            logger.debug("Cookie signature verification failed");
            return null;
        }

        try {
            return URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Signed cookie value is not valid URL encoding: {}", e.getMessage());
            return null;
        }
    }

    public boolean isKeyConfigured() {
        return keyConfigured;
    }

    private String calculateHmac(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secretKey, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
