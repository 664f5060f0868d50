package kr.jemi.zaccess.inventory.application.port.in;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.time.Duration;

/**
 * @param paymentIntentId 연결된 결제 요청. 없으면 null
 * @param ttl 선점 유지 시간. null이면 기본값을 쓴다
 */
public record ReserveStockCommand(
        long accessTierId,
        @NotBlank String userId,
        @Min(1) int quantity,
        Long paymentIntentId,
        Duration ttl
) implements SelfValidating {

    public ReserveStockCommand(long accessTierId, String userId, int quantity,
                               Long paymentIntentId, Duration ttl) {
        this.accessTierId = accessTierId;
        this.userId = userId;
        this.quantity = quantity;
        this.paymentIntentId = paymentIntentId;
        this.ttl = ttl;
        validateSelf();
    }

    public ReserveStockCommand(long accessTierId, String userId, int quantity) {
        this(accessTierId, userId, quantity, null, null);
    }
}
