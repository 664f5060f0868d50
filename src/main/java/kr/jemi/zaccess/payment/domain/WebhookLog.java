package kr.jemi.zaccess.payment.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;

/**
 * 수신한 결제 웹훅 원문. 같은 (orderId, status, signature) 조합은 한 번만 기록된다.
 */
public record WebhookLog(
        long id,
        @NotBlank String webhookId,
        @NotBlank String orderId,
        @NotBlank String transactionStatus,
        String payload,
        @NotNull LocalDateTime processedAt
) implements SelfValidating {

    public WebhookLog(long id, String webhookId, String orderId, String transactionStatus, String payload,
                      LocalDateTime processedAt) {
        this.id = id;
        this.webhookId = webhookId;
        this.orderId = orderId;
        this.transactionStatus = transactionStatus;
        this.payload = payload;
        this.processedAt = processedAt;
        validateSelf();
    }

    public static WebhookLog create(long id, String orderId, String transactionStatus, String signatureKey,
                                    String payload, LocalDateTime now) {
        return new WebhookLog(id, webhookIdOf(orderId, transactionStatus, signatureKey), orderId,
                transactionStatus, payload, now);
    }

    public static String webhookIdOf(String orderId, String transactionStatus, String signatureKey) {
        String source = orderId + "-" + transactionStatus + "-" + (signatureKey == null ? "" : signatureKey);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256을 사용할 수 없습니다", e);
        }
    }
}
