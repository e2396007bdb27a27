package com.booking.lifecycle.api;

import com.booking.lifecycle.domain.GatewayErrorKind;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.lifecycle.BookingActionResult;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for accept, decline, complete and cancel. The booking's status change
 * always succeeded when this is returned; check {@code paymentOutcome} for the money side.
 */
@Value
@Builder
public class BookingActionResponseDto {

    BookingResponseDto booking;
    PaymentOutcome paymentOutcome;
    GatewayErrorKind paymentErrorKind;
    String paymentErrorCode;
    String paymentErrorMessage;

    public static BookingActionResponseDto from(BookingActionResult result) {
        BookingActionResponseDtoBuilder builder = BookingActionResponseDto.builder()
                .booking(BookingResponseDto.from(result.getBooking()))
                .paymentOutcome(result.getPaymentOutcome());
        if (result.getPaymentError() != null) {
            builder.paymentErrorKind(result.getPaymentError().getKind())
                    .paymentErrorCode(result.getPaymentError().getCode())
                    .paymentErrorMessage(result.getPaymentError().getMessage());
        }
        return builder.build();
    }
}
