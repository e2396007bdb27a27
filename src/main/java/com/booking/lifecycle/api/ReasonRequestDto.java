package com.booking.lifecycle.api;

import lombok.Data;

/**
 * Optional body for decline and cancel. Length is checked against the configured cap.
 */
@Data
public class ReasonRequestDto {

    private String reason;
}
