package ch.so.arp.scenesearch.visual;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Signs request bodies for the visual embedding service with HMAC-SHA256 over
 * {@code timestamp + "." + body}. The signature is sent as
 * {@code sha256=<hex>}.
 */
class RequestSigner {

    static final String SIGNATURE_HEADER = "X-Signature";
    static final String TIMESTAMP_HEADER = "X-Timestamp";

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final byte[] secret;

    RequestSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("visual service secret must be provided");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    String sign(long timestamp, String body) {
        return PREFIX + HexFormat.of().formatHex(hmac(timestamp + "." + body));
    }

    private byte[] hmac(String message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException(ALGORITHM + " not available", ex);
        }
    }
}
