package com.foreman.core.persistence;

import com.foreman.core.state.ProjectState;

import java.util.Optional;

/**
 * Process-local read cache for project state. Writers evict; only readers populate.
 * Entries are not shared between processes.
 * <p>
 * Every eviction bumps the project's generation. A reader takes the generation before it
 * goes to storage and offers its result with {@link #putIfGeneration}; if a write was evicted
 * in between, the offer is refused and the possibly older value never reaches the cache.
 */
public interface StateCache {

    static String key(String projectId) {
        return "project_state:" + projectId;
    }

    Optional<ProjectState> get(String projectId);

    /** Current generation of the project's entry; 0 until the first eviction. */
    long generation(String projectId);

    /**
     * Caches {@code state} only if no eviction happened since {@code expectedGeneration} was read.
     *
     * @return true if the value was cached
     */
    boolean putIfGeneration(ProjectState state, long expectedGeneration);

    void evict(String projectId);
}
