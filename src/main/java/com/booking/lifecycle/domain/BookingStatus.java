package com.booking.lifecycle.domain;

/**
 * Lifecycle states of a booking. Allowed edges:
 * <ul>
 *   <li>PENDING → ACCEPTED, DECLINED, EXPIRED</li>
 *   <li>ACCEPTED → COMPLETED, CANCELLED</li>
 * </ul>
 * Nothing re-enters PENDING and nothing leaves a terminal state.
 */
public enum BookingStatus {
    /** Requested by the customer, waiting for the provider to respond. */
    PENDING,
    /** Provider accepted; deposit capture has been attempted. */
    ACCEPTED,
    /** Provider declined before the deadline. */
    DECLINED,
    /** Provider did not respond before the deadline. */
    EXPIRED,
    /** Service rendered. */
    COMPLETED,
    /** Accepted booking called off by the customer or provider. */
    CANCELLED;

    public boolean isTerminal() {
        return this == DECLINED || this == EXPIRED || this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(BookingStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target == ACCEPTED || target == DECLINED || target == EXPIRED;
            case ACCEPTED:
                return target == COMPLETED || target == CANCELLED;
            default:
                return false;
        }
    }
}
