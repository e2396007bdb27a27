package com.booking.lifecycle.lifecycle;

/**
 * Gateway idempotency keys. Each is derived from the booking (or create request) and the
 * payment stage only, so every retry of a stage reuses the same key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String authorize(String requestId) {
        return "authorize:" + requestId;
    }

    public static String depositCapture(String bookingId) {
        return "capture:deposit:" + bookingId;
    }

    public static String remainingCapture(String bookingId) {
        return "capture:remaining:" + bookingId;
    }

    public static String refund(String bookingId) {
        return "refund:" + bookingId;
    }

    public static String transfer(String bookingId) {
        return "transfer:" + bookingId;
    }

    public static String release(String bookingId) {
        return "release:" + bookingId;
    }
}
