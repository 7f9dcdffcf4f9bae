package com.substratebridge.relay.health;

import com.substratebridge.core.msg.Status;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time health of both ends of the relay.
 */
@Value
public class HealthReport {
    String relayId;
    boolean healthy;
    Status source;
    Status sink;
    Instant checkedAt;
}
