package kr.jemi.zaccess.booking.application.port.in;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zaccess.common.validation.SelfValidating;

/**
 * @param stockReservationId 결제 화면에서 잡아둔 선점이 있으면 그 id. 선점의 tier와 수량이 요청과 같아야 한다
 */
public record CheckoutCommand(
        @NotBlank String userId,
        long accessTierId,
        @Min(1) int quantity,
        Long stockReservationId
) implements SelfValidating {

    public CheckoutCommand(String userId, long accessTierId, int quantity, Long stockReservationId) {
        this.userId = userId;
        this.accessTierId = accessTierId;
        this.quantity = quantity;
        this.stockReservationId = stockReservationId;
        validateSelf();
    }

    public CheckoutCommand(String userId, long accessTierId, int quantity) {
        this(userId, accessTierId, quantity, null);
    }
}
