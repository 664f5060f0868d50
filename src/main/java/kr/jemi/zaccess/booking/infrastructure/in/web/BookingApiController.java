package kr.jemi.zaccess.booking.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zaccess.booking.application.port.in.CancelBookingUseCase;
import kr.jemi.zaccess.booking.application.port.in.CheckoutCommand;
import kr.jemi.zaccess.booking.application.port.in.CheckoutUseCase;
import kr.jemi.zaccess.booking.application.port.in.GetBookingUseCase;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.infrastructure.in.web.dto.BookingResponse;
import kr.jemi.zaccess.booking.infrastructure.in.web.dto.CancelBookingResponse;
import kr.jemi.zaccess.booking.infrastructure.in.web.dto.CheckoutRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Booking", description = "예매 생성·조회·취소")
@RestController
public class BookingApiController {

    private final CheckoutUseCase checkoutUseCase;
    private final GetBookingUseCase getBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;

    public BookingApiController(CheckoutUseCase checkoutUseCase,
                                GetBookingUseCase getBookingUseCase,
                                CancelBookingUseCase cancelBookingUseCase) {
        this.checkoutUseCase = checkoutUseCase;
        this.getBookingUseCase = getBookingUseCase;
        this.cancelBookingUseCase = cancelBookingUseCase;
    }

    @Operation(summary = "예매 생성", description = "재고를 배정하고 결제 대기(PENDING) 예매를 만듭니다. 결제 기한은 기본 30분입니다.")
    @PostMapping("/api/bookings")
    public ResponseEntity<BookingResponse> checkout(
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CheckoutRequest request) {
        Booking booking = checkoutUseCase.checkout(new CheckoutCommand(
                userId, request.accessTierId(), request.quantity(), request.stockReservationId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    @Operation(summary = "예매 조회")
    @GetMapping("/api/bookings/{bookingCode}")
    public ResponseEntity<BookingResponse> get(@PathVariable String bookingCode) {
        return ResponseEntity.ok(BookingResponse.from(getBookingUseCase.getBooking(bookingCode)));
    }

    @Operation(summary = "예매 취소", description = "결제 대기 중인 예매를 취소하고 재고를 반환합니다. 이미 종료된 예매는 변경되지 않습니다.")
    @PostMapping("/api/bookings/{bookingCode}/cancel")
    public ResponseEntity<CancelBookingResponse> cancel(@PathVariable String bookingCode) {
        boolean cancelled = cancelBookingUseCase.cancel(bookingCode);
        return ResponseEntity.ok(new CancelBookingResponse(bookingCode, cancelled));
    }
}
