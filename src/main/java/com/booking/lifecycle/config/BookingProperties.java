package com.booking.lifecycle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Engine settings bound from the {@code booking.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    /** How long a provider has to answer a pending booking. */
    @NotNull
    private Duration responseWindow = Duration.ofHours(24);

    @NotBlank
    private String defaultCurrency = "GBP";

    /** Maximum length of decline and cancellation reasons. */
    @Min(1)
    private int reasonMaxLength = 500;

    private Deposit deposit = new Deposit();

    private DeadlineMonitor deadlineMonitor = new DeadlineMonitor();

    private Gateway gateway = new Gateway();

    @Data
    public static class Deposit {
        /** Share of the total captured on acceptance when the request does not name one. */
        @Min(0)
        @Max(100)
        private int defaultPercentage = 20;
    }

    @Data
    public static class DeadlineMonitor {
        private boolean enabled = true;
        /** Delay between sweeps, in milliseconds. */
        @Min(1000)
        private long interval = 60_000;
        @Min(1)
        private int batchSize = 100;
        /** Threads available for refunds fired by the sweep. */
        @Min(1)
        private int refundThreads = 2;
    }

    @Data
    public static class Gateway {
        /** Upper bound on a single gateway call; exceeding it counts as a timeout. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        @Min(1)
        private int callThreads = 32;
        @Min(0)
        private int callQueueCapacity = 200;
        /** Registers the in-memory gateway; switch off when a real integration is wired in. */
        private boolean mockEnabled = true;
    }
}
