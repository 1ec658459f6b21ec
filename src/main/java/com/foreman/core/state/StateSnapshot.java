package com.foreman.core.state;

import java.time.Instant;
import java.util.Map;

public record StateSnapshot(
    String id,
    String projectId,
    Instant snapshotAt,
    Map<String, Object> state,
    String takenBy,
    String notes
) {}
