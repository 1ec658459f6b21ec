package com.foreman.core.persistence;

import com.foreman.core.state.ProjectState;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateCache} backed by a {@link ConcurrentHashMap}. Each key holds a slot with the
 * generation and the cached value, and all slot changes go through {@code compute}, so the
 * generation check and the put are atomic with respect to evictions.
 * <p>
 * Evicted slots keep their generation and are never removed, one small entry per project seen.
 */
public class InMemoryStateCache implements StateCache {

    private record Slot(long generation, ProjectState state) {}

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    @Override
    public Optional<ProjectState> get(String projectId) {
        Slot slot = slots.get(StateCache.key(projectId));
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.state());
    }

    @Override
    public long generation(String projectId) {
        Slot slot = slots.get(StateCache.key(projectId));
        return slot == null ? 0L : slot.generation();
    }

    @Override
    public boolean putIfGeneration(ProjectState state, long expectedGeneration) {
        boolean[] stored = {false};
        slots.compute(StateCache.key(state.projectId()), (key, slot) -> {
            long current = slot == null ? 0L : slot.generation();
            if (current != expectedGeneration) {
                return slot;
            }
            stored[0] = true;
            return new Slot(current, state);
        });
        return stored[0];
    }

    @Override
    public void evict(String projectId) {
        slots.compute(StateCache.key(projectId),
                (key, slot) -> new Slot(slot == null ? 1L : slot.generation() + 1, null));
    }

    /** Number of projects with a cached value. */
    public int size() {
        return (int) slots.values().stream().filter(slot -> slot.state() != null).count();
    }
}
