package com.booking.lifecycle.api;

import com.booking.lifecycle.lifecycle.AcceptBookingHandler;
import com.booking.lifecycle.lifecycle.BookingActionResult;
import com.booking.lifecycle.lifecycle.BookingCreationService;
import com.booking.lifecycle.lifecycle.BookingQueryService;
import com.booking.lifecycle.lifecycle.CancellationHandler;
import com.booking.lifecycle.lifecycle.CompletionHandler;
import com.booking.lifecycle.lifecycle.CreateBookingCommand;
import com.booking.lifecycle.lifecycle.DeclineBookingHandler;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for the booking lifecycle. The caller's user id arrives in the {@value #CALLER_HEADER}
 * header, set by the authenticating gateway in front of this service.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
@Tag(name = "Bookings", description = "Create bookings and drive them through accept, decline, complete and cancel")
public class BookingController {

    public static final String CALLER_HEADER = "X-User-Id";

    private final BookingCreationService creationService;
    private final BookingQueryService queryService;
    private final AcceptBookingHandler acceptHandler;
    private final DeclineBookingHandler declineHandler;
    private final CompletionHandler completionHandler;
    private final CancellationHandler cancellationHandler;

    @PostMapping
    @Operation(
            summary = "Create booking",
            description = "Places an authorization hold for totalAmount on paymentMethodId and creates a PENDING booking "
                    + "the provider must answer before the response deadline. Repeating a requestId returns the booking "
                    + "already created for it.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Booking created (or replayed for a known requestId).",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\", \"details\"|\"message\": ... }"),
            @ApiResponse(responseCode = "402", description = "Authorization declined. Body: { \"error\": \"PAYMENT_DECLINED\", \"message\": ... }"),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable; retry with the same requestId.")
    })
    public ResponseEntity<BookingResponseDto> create(@Valid @RequestBody CreateBookingRequestDto dto) {
        CreateBookingCommand command = CreateBookingCommand.builder()
                .requestId(dto.getRequestId())
                .customerId(dto.getCustomerId())
                .providerId(dto.getProviderId())
                .serviceId(dto.getServiceId())
                .providerAccountId(dto.getProviderAccountId())
                .baseAmount(dto.getBaseAmount())
                .totalAmount(dto.getTotalAmount())
                .currencyCode(dto.getCurrencyCode())
                .depositPercentage(dto.getDepositPercentage())
                .paymentMethodId(dto.getPaymentMethodId())
                .build();
        BookingEntity booking = creationService.create(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponseDto.from(booking));
    }

    @GetMapping("/{bookingId}")
    @Operation(summary = "Get booking", description = "Readable by the booking's customer and provider.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Booking found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingResponseDto.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a party to the booking."),
            @ApiResponse(responseCode = "404", description = "Unknown booking.")
    })
    public BookingResponseDto get(@PathVariable String bookingId,
                                  @RequestHeader(CALLER_HEADER) String callerId) {
        return BookingResponseDto.from(queryService.get(bookingId, callerId));
    }

    @GetMapping("/reconciliation")
    @Operation(summary = "Bookings needing reconciliation",
            description = "Bookings whose capture or provider payout failed (payment status CAPTURE_FAILED). "
                    + "Requires the caller header.")
    @ApiResponse(responseCode = "400", description = "Missing caller header.")
    public List<BookingResponseDto> reconciliation(@RequestHeader(CALLER_HEADER) String callerId) {
        log.info("Reconciliation list requested by {}", callerId);
        return queryService.findNeedingReconciliation().stream()
                .map(BookingResponseDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/{bookingId}/accept")
    @Operation(summary = "Accept booking",
            description = "Provider accepts a PENDING booking; the deposit is captured. A failed capture still returns 200 "
                    + "with paymentOutcome=CHARGE_FAILED and the booking ACCEPTED.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted. Check body.paymentOutcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingActionResponseDto.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the booking's provider."),
            @ApiResponse(responseCode = "404", description = "Unknown booking."),
            @ApiResponse(responseCode = "409", description = "Booking is no longer PENDING. Body includes currentStatus.")
    })
    public BookingActionResponseDto accept(@PathVariable String bookingId,
                                           @RequestHeader(CALLER_HEADER) String callerId) {
        return respond(acceptHandler.accept(bookingId, callerId));
    }

    @PostMapping("/{bookingId}/decline")
    @Operation(summary = "Decline booking",
            description = "Provider declines a PENDING booking; any captured deposit is refunded.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Declined. Check body.paymentOutcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingActionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Reason too long."),
            @ApiResponse(responseCode = "403", description = "Caller is not the booking's provider."),
            @ApiResponse(responseCode = "409", description = "Booking is no longer PENDING.")
    })
    public BookingActionResponseDto decline(@PathVariable String bookingId,
                                            @RequestHeader(CALLER_HEADER) String callerId,
                                            @RequestBody(required = false) ReasonRequestDto dto) {
        return respond(declineHandler.decline(bookingId, callerId, dto != null ? dto.getReason() : null));
    }

    @PostMapping("/{bookingId}/complete")
    @Operation(summary = "Complete booking",
            description = "Provider marks an ACCEPTED booking done; the remaining amount is captured and the provider paid. "
                    + "Payment failures return 200 with paymentOutcome CHARGE_FAILED or TRANSFER_FAILED.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Completed. Check body.paymentOutcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingActionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Provider has no payout account."),
            @ApiResponse(responseCode = "403", description = "Caller is not the booking's provider."),
            @ApiResponse(responseCode = "409", description = "Booking is not ACCEPTED.")
    })
    public BookingActionResponseDto complete(@PathVariable String bookingId,
                                             @RequestHeader(CALLER_HEADER) String callerId) {
        return respond(completionHandler.complete(bookingId, callerId));
    }

    @PostMapping("/{bookingId}/cancel")
    @Operation(summary = "Cancel booking",
            description = "Customer or provider cancels an ACCEPTED booking; the uncaptured hold is released.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancelled. Check body.paymentOutcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BookingActionResponseDto.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a party to the booking."),
            @ApiResponse(responseCode = "409", description = "Booking is not ACCEPTED.")
    })
    public BookingActionResponseDto cancel(@PathVariable String bookingId,
                                           @RequestHeader(CALLER_HEADER) String callerId,
                                           @RequestBody(required = false) ReasonRequestDto dto) {
        return respond(cancellationHandler.cancel(bookingId, callerId, dto != null ? dto.getReason() : null));
    }

    private BookingActionResponseDto respond(BookingActionResult result) {
        if (result.getPaymentOutcome().isFailure()) {
            log.warn("Booking action completed with payment failure: bookingId={}, status={}, outcome={}",
                    result.getBooking().getId(), result.getBooking().getStatus(), result.getPaymentOutcome());
        }
        return BookingActionResponseDto.from(result);
    }
}
