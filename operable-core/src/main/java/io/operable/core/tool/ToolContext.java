package io.operable.core.tool;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record ToolContext(CancellationToken cancellation, Instant deadline, Clock clock) {

    public ToolContext {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static ToolContext background() {
        return new ToolContext(new CancellationToken(), null, Clock.systemUTC());
    }

    public static ToolContext withTimeout(CancellationToken cancellation, Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new ToolContext(cancellation, clock.instant().plus(timeout), clock);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isExpired() {
        return remaining().map(Duration::isZero).orElse(false);
    }

    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }
}
