package com.example.transfersim.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 簽章
 *
 * Header 格式：X-Webhook-Signature: sha256=<hex>
 */
public final class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private static final String ALGORITHM = "HmacSHA256";

    private WebhookSigner() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 對原始 JSON body 簽章
     *
     * @param body 實際送出的 body
     * @param secret 共享密鑰
     * @return sha256=<小寫 hex>
     */
    public static String sign(String body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
            return "sha256=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
