package kr.jemi.zaccess.booking.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.booking.api.BookingFacade;
import kr.jemi.zaccess.booking.api.BookingSweep;
import kr.jemi.zaccess.booking.api.PaymentStatusCounts;
import kr.jemi.zaccess.booking.api.PendingPayment;
import kr.jemi.zaccess.booking.application.port.in.CancelBookingUseCase;
import kr.jemi.zaccess.booking.application.port.in.CheckoutCommand;
import kr.jemi.zaccess.booking.application.port.in.CheckoutUseCase;
import kr.jemi.zaccess.booking.application.port.in.ConfirmBookingPaymentUseCase;
import kr.jemi.zaccess.booking.application.port.in.ExpireBookingsUseCase;
import kr.jemi.zaccess.booking.application.port.in.GetBookingUseCase;
import kr.jemi.zaccess.booking.application.port.out.BookingPort;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.BookingStatus;
import kr.jemi.zaccess.booking.domain.PaymentStatus;
import kr.jemi.zaccess.booking.domain.SweepResult;
import kr.jemi.zaccess.common.concurrency.OptimisticRetry;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Service
public class BookingService implements CheckoutUseCase, GetBookingUseCase, CancelBookingUseCase,
        ConfirmBookingPaymentUseCase, BookingFacade {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private static final String BOOKING_CODE_PREFIX = "BK";

    private final BookingWriter bookingWriter;
    private final BookingPort bookingPort;
    private final ExpireBookingsUseCase expireBookingsUseCase;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration paymentWindow;
    private final int maxAttempts;

    public BookingService(BookingWriter bookingWriter,
                          BookingPort bookingPort,
                          ExpireBookingsUseCase expireBookingsUseCase,
                          TSID.Factory tsidFactory,
                          Clock clock,
                          @Value("${zaccess.booking.payment-window}") Duration paymentWindow,
                          @Value("${zaccess.booking.retry.max-attempts}") int maxAttempts) {
        this.bookingWriter = bookingWriter;
        this.bookingPort = bookingPort;
        this.expireBookingsUseCase = expireBookingsUseCase;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.paymentWindow = paymentWindow;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Booking checkout(CheckoutCommand command) {
        TSID tsid = tsidFactory.generate();
        String bookingCode = BOOKING_CODE_PREFIX + tsid;

        Booking booking = OptimisticRetry.execute("checkout", maxAttempts,
                () -> bookingWriter.checkout(tsid.toLong(), bookingCode, command.userId(),
                        command.accessTierId(), command.quantity(), command.stockReservationId(),
                        paymentWindow, LocalDateTime.now(clock)));

        log.info("예매 생성: bookingCode={}, tierId={}, quantity={}, expiresAt={}",
                booking.getBookingCode(), booking.getAccessTierId(), booking.getQuantity(),
                booking.getExpiresAt());
        return booking;
    }

    @Override
    @Transactional(readOnly = true)
    public Booking getBooking(String bookingCode) {
        return bookingPort.findByBookingCode(bookingCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND, bookingCode));
    }

    @Override
    public boolean cancel(String bookingCode) {
        boolean cancelled = OptimisticRetry.execute("cancelBooking", maxAttempts,
                () -> bookingWriter.cancel(bookingCode, PaymentStatus.EXPIRED, LocalDateTime.now(clock)));
        if (cancelled) {
            log.info("예매 취소, 재고 반환: bookingCode={}", bookingCode);
        }
        return cancelled;
    }

    @Override
    public boolean confirmPayment(String bookingCode) {
        boolean paid = OptimisticRetry.execute("confirmPayment", maxAttempts,
                () -> bookingWriter.markPaid(bookingCode, LocalDateTime.now(clock)));
        if (paid) {
            log.info("결제 확인: bookingCode={}", bookingCode);
        } else {
            log.debug("이미 종료된 예매, 결제 확인 생략: bookingCode={}", bookingCode);
        }
        return paid;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isPaid(String bookingCode) {
        return bookingPort.findByBookingCode(bookingCode)
                .map(booking -> booking.getStatus() == BookingStatus.PAID)
                .orElse(false);
    }

    @Override
    public boolean failPayment(String bookingCode) {
        boolean cancelled = OptimisticRetry.execute("failPayment", maxAttempts,
                () -> bookingWriter.cancel(bookingCode, PaymentStatus.FAILED, LocalDateTime.now(clock)));
        if (cancelled) {
            log.info("결제 실패로 예매 취소, 재고 반환: bookingCode={}", bookingCode);
        }
        return cancelled;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String bookingCode) {
        return bookingPort.existsByBookingCode(bookingCode);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PendingPayment> findAwaitingPayment(int limit) {
        return bookingPort.findAwaitingPayment(LocalDateTime.now(clock), limit).stream()
                .map(BookingService::toPendingPayment)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PendingPayment> findOverdueUnpaid(Duration lookback, int limit) {
        LocalDateTime now = LocalDateTime.now(clock);
        return bookingPort.findOverdueUnpaid(now.minus(lookback), now, limit).stream()
                .map(BookingService::toPendingPayment)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentStatusCounts countPaymentStatuses(LocalDateTime from, LocalDateTime to) {
        Map<PaymentStatus, Long> counts = bookingPort.countByPaymentStatus(from, to);
        return new PaymentStatusCounts(
                counts.getOrDefault(PaymentStatus.PENDING, 0L),
                counts.getOrDefault(PaymentStatus.PAID, 0L),
                counts.getOrDefault(PaymentStatus.FAILED, 0L),
                counts.getOrDefault(PaymentStatus.EXPIRED, 0L));
    }

    @Override
    public BookingSweep expireOverdue() {
        SweepResult result = expireBookingsUseCase.expireOverdue();
        return new BookingSweep(result.processed(), result.found());
    }

    private static PendingPayment toPendingPayment(Booking booking) {
        return new PendingPayment(booking.getBookingCode(), booking.getUserId(),
                booking.getTotalAmount(), booking.getExpiresAt(), booking.getCreatedAt(),
                booking.getStatus() == BookingStatus.EXPIRED);
    }
}
