package com.flagship.investment_ledger.payment.webhook;

import com.flagship.investment_ledger.payment.gateway.PaystackProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies Paystack webhook signatures.
 *
 * The gateway sends the lowercase hex HMAC-SHA512 of the raw request body, keyed
 * with the account secret, in the {@code X-Paystack-Signature} header. The
 * expected digest is recomputed over the exact bytes received and compared in
 * constant time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA512";

    private final PaystackProperties props;

    /**
     * @throws InvalidSignatureException if the header is missing, the secret is not
     *         configured, or the digest does not match
     */
    public void verify(byte[] rawBody, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing webhook signature");
        }
        String secret = props.getSecretKey();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook received but gateway secret key is not configured; rejecting");
            throw new InvalidSignatureException("Webhook signing secret not configured");
        }

        byte[] expected = sign(rawBody != null ? rawBody : new byte[0], secret)
            .getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signatureHeader.trim().toLowerCase(Locale.ROOT)
            .getBytes(StandardCharsets.US_ASCII);

        if (!MessageDigest.isEqual(expected, provided)) {
            throw new InvalidSignatureException("Invalid signature");
        }
    }

    /**
     * Lowercase hex HMAC-SHA512 of {@code body} under {@code secret}.
     */
    public static String sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA512 is not available", e);
        }
    }
}
