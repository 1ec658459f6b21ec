package com.foreman.core.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A partial update to a project's state. Only fields set on the builder are applied;
 * a null field means "leave as is".
 * <p>
 * {@code metadata} is merged shallowly into the stored metadata and {@code pendingTasks}
 * replaces the stored list. When {@code expectedLastUpdated} is set the update only applies
 * if the row has not changed since that instant.
 */
public final class ProjectStateUpdate {

    private final String currentPhase;
    private final String activeTaskId;
    private final String activeAgentId;
    private final Map<String, Object> metadata;
    private final List<String> pendingTasks;
    private final ProjectStatus status;
    private final String lastAction;
    private final Instant expectedLastUpdated;
    private final String actor;

    private ProjectStateUpdate(Builder builder) {
        this.currentPhase = builder.currentPhase;
        this.activeTaskId = builder.activeTaskId;
        this.activeAgentId = builder.activeAgentId;
        this.metadata = builder.metadata == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.pendingTasks = builder.pendingTasks == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.pendingTasks));
        this.status = builder.status;
        this.lastAction = builder.lastAction;
        this.expectedLastUpdated = builder.expectedLastUpdated;
        this.actor = builder.actor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True when no state field is set; {@code expectedLastUpdated} and {@code actor} do not count. */
    public boolean isEmpty() {
        return currentPhase == null && activeTaskId == null && activeAgentId == null
                && metadata == null && pendingTasks == null && status == null && lastAction == null;
    }

    public String currentPhase() {
        return currentPhase;
    }

    public String activeTaskId() {
        return activeTaskId;
    }

    public String activeAgentId() {
        return activeAgentId;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public List<String> pendingTasks() {
        return pendingTasks;
    }

    public ProjectStatus status() {
        return status;
    }

    public String lastAction() {
        return lastAction;
    }

    public Instant expectedLastUpdated() {
        return expectedLastUpdated;
    }

    public String actor() {
        return actor;
    }

    public static final class Builder {
        private String currentPhase;
        private String activeTaskId;
        private String activeAgentId;
        private Map<String, Object> metadata;
        private List<String> pendingTasks;
        private ProjectStatus status;
        private String lastAction;
        private Instant expectedLastUpdated;
        private String actor;

        private Builder() {}

        public Builder currentPhase(String currentPhase) {
            this.currentPhase = currentPhase;
            return this;
        }

        public Builder activeTaskId(String activeTaskId) {
            this.activeTaskId = activeTaskId;
            return this;
        }

        public Builder activeAgentId(String activeAgentId) {
            this.activeAgentId = activeAgentId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder pendingTasks(List<String> pendingTasks) {
            this.pendingTasks = pendingTasks;
            return this;
        }

        public Builder status(ProjectStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastAction(String lastAction) {
            this.lastAction = lastAction;
            return this;
        }

        public Builder expectedLastUpdated(Instant expectedLastUpdated) {
            this.expectedLastUpdated = expectedLastUpdated;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public ProjectStateUpdate build() {
            return new ProjectStateUpdate(this);
        }
    }
}
