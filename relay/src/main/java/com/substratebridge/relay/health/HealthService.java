package com.substratebridge.relay.health;

import com.substratebridge.core.api.IAsyncMessageSink;
import com.substratebridge.core.api.IAsyncMessageSource;
import com.substratebridge.core.msg.Status;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Queries source and sink status in parallel.
 * <p>
 * An unreachable broker becomes a non-working status with the error as its only problem.
 * </p>
 */
@RequiredArgsConstructor
public class HealthService {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(15);

    private final String relayId;
    private final IAsyncMessageSource source;
    private final IAsyncMessageSink sink;
    private final Clock clock;

    public Mono<HealthReport> check() {
        return Mono.zip(safeStatus(source.status()), safeStatus(sink.status()))
            .map(statuses -> new HealthReport(
                relayId,
                statuses.getT1().isWorking() && statuses.getT2().isWorking(),
                statuses.getT1(),
                statuses.getT2(),
                Instant.now(clock)
            ));
    }

    private static Mono<Status> safeStatus(Mono<Status> status) {
        return status
            .timeout(CHECK_TIMEOUT)
            .onErrorResume(error -> Mono.just(Status.notWorking(List.of(String.valueOf(error.getMessage())))));
    }
}
