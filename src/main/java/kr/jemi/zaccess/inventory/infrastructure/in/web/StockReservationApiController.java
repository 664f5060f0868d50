package kr.jemi.zaccess.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zaccess.inventory.application.port.in.ReleaseStockUseCase;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockCommand;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockUseCase;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.ReleaseStockResponse;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.ReserveStockRequest;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.StockReservationResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@Tag(name = "StockReservation", description = "결제 화면용 임시 재고 선점")
@RestController
public class StockReservationApiController {

    private final ReserveStockUseCase reserveStockUseCase;
    private final ReleaseStockUseCase releaseStockUseCase;

    public StockReservationApiController(ReserveStockUseCase reserveStockUseCase,
                                         ReleaseStockUseCase releaseStockUseCase) {
        this.reserveStockUseCase = reserveStockUseCase;
        this.releaseStockUseCase = releaseStockUseCase;
    }

    @Operation(summary = "재고 선점", description = "결제가 끝날 때까지 재고를 잡아둡니다. 기본 유지 시간은 30분입니다.")
    @PostMapping("/api/stock-reservations")
    public ResponseEntity<StockReservationResponse> reserve(
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody ReserveStockRequest request) {
        Duration ttl = request.ttlMinutes() != null ? Duration.ofMinutes(request.ttlMinutes()) : null;
        StockReservation reservation = reserveStockUseCase.reserve(new ReserveStockCommand(
                request.accessTierId(), userId, request.quantity(), request.paymentIntentId(), ttl));
        return ResponseEntity.status(HttpStatus.CREATED).body(StockReservationResponse.from(reservation));
    }

    @Operation(summary = "재고 선점 해제", description = "여러 번 호출해도 한 번만 해제됩니다.")
    @DeleteMapping("/api/stock-reservations/{reservationId}")
    public ResponseEntity<ReleaseStockResponse> release(@PathVariable long reservationId) {
        boolean released = releaseStockUseCase.release(reservationId, "cancelled");
        return ResponseEntity.ok(new ReleaseStockResponse(reservationId, released));
    }
}
