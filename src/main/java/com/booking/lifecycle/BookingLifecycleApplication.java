package com.booking.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Booking lifecycle engine: provider accept/decline/complete, deadline expiry and staged
 * payment capture against the payment gateway.
 */
@SpringBootApplication
@EnableScheduling
public class BookingLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingLifecycleApplication.class, args);
    }
}
