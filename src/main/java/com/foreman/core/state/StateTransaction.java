package com.foreman.core.state;

import java.time.Instant;
import java.util.Map;

/**
 * One append-only audit entry in {@code project_state_transactions}.
 *
 * @param previousState full document of the row before the change; null for {@code initialize_state}
 */
public record StateTransaction(
    String id,
    String projectId,
    Instant occurredAt,
    String changeType,
    Map<String, Object> payload,
    String actor,
    Map<String, Object> previousState
) {}
