package com.openstable.rental.config;

import com.openstable.sync.support.BackoffPolicy;
import com.openstable.sync.view.RefreshPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code stable.sync}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stable.sync")
public class SyncProperties {

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Optimistic optimistic = new Optimistic();

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Listing listing = new Listing();

    @Valid
    private Refresh refresh = new Refresh();

    @Valid
    private Conflict conflict = new Conflict();

    /** Restricts the views to one owner's stables and bookings; all when unset. */
    private String ownerId;

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(retry.maxRetries, retry.initialDelay, retry.multiplier, retry.maxDelay);
    }

    public RefreshPolicy refreshPolicy() {
        return refresh.mode == RefreshMode.PERIODIC_POLL
                ? RefreshPolicy.poll(refresh.pollInterval)
                : RefreshPolicy.eventDriven();
    }

    @Data
    public static class Retry {
        @Min(0)
        private int maxRetries = 10;
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(1);
        @DecimalMin("1.0")
        private double multiplier = 1.5;
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Optimistic {
        @NotNull
        private Duration confirmationTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Batch {
        private boolean enabled = false;
        @NotNull
        private Duration delay = Duration.ofMillis(100);
        @Min(1)
        private int maxSize = 50;
    }

    @Data
    public static class Listing {
        /** Minimum spacing between summary recomputations. */
        @NotNull
        private Duration throttleInterval = Duration.ofMillis(500);
        @NotNull
        private Duration searchDebounce = Duration.ofMillis(300);
    }

    @Data
    public static class Refresh {
        @NotNull
        private RefreshMode mode = RefreshMode.EVENT_DRIVEN;
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Conflict {
        @NotNull
        private ConflictPolicy policy = ConflictPolicy.DETECT;
    }

    public enum RefreshMode {
        EVENT_DRIVEN,
        PERIODIC_POLL
    }

    public enum ConflictPolicy {
        /** Conflicts are reported on the booking view only. */
        DETECT,
        /** Overlapping active bookings are rejected before anything is applied. */
        PREVENT
    }
}
