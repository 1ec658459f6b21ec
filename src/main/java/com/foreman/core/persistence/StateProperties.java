package com.foreman.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Project state settings, bound from {@code foreman.state.*}.
 */
@ConfigurationProperties(prefix = "foreman.state")
public class StateProperties {

    /** Serve {@code getState} reads from the in-process cache. */
    private boolean cacheEnabled = true;

    /** Run {@code CREATE TABLE IF NOT EXISTS} for the state tables on startup. */
    private boolean createSchema = true;

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public boolean isCreateSchema() {
        return createSchema;
    }

    public void setCreateSchema(boolean createSchema) {
        this.createSchema = createSchema;
    }
}
