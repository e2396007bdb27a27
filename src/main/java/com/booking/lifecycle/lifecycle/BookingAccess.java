package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.error.ForbiddenException;
import com.booking.lifecycle.error.ValidationException;
import com.booking.lifecycle.persistence.entity.BookingEntity;

/**
 * Caller checks shared by the handlers.
 */
final class BookingAccess {

    private BookingAccess() {
    }

    static void requireCaller(String callerId) {
        if (callerId == null || callerId.isBlank()) {
            throw new ValidationException("Caller id is required");
        }
    }

    static void requireProvider(BookingEntity booking, String callerId) {
        requireCaller(callerId);
        if (!callerId.equals(booking.getProviderId())) {
            throw new ForbiddenException("Only the assigned provider can act on booking " + booking.getId());
        }
    }

    static void requireParty(BookingEntity booking, String callerId) {
        requireCaller(callerId);
        if (!callerId.equals(booking.getProviderId()) && !callerId.equals(booking.getCustomerId())) {
            throw new ForbiddenException("Caller is not a party to booking " + booking.getId());
        }
    }

    /** Trims the reason and enforces the length cap; blank becomes null. */
    static String normalizeReason(String reason, int maxLength) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        String trimmed = reason.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException("Reason must be at most " + maxLength + " characters");
        }
        return trimmed;
    }
}
