package com.foreman.core.persistence;

import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.state.ProjectStateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} for durable project state.
 * <p>
 * Builds the {@link ProjectStateManager} over the application {@link DataSource}, creating
 * the state tables on startup unless {@code foreman.state.create-schema} is false. The
 * in-process read cache can be switched off with {@code foreman.state.cache-enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(StateProperties.class)
public class ProjectStateConfig {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock foremanClock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonColumns jsonColumns() {
        return new JsonColumns();
    }

    @Bean
    public ProjectStateSchema projectStateSchema(DataSource dataSource, StateProperties properties) throws Exception {
        var schema = new ProjectStateSchema(dataSource);
        if (properties.isCreateSchema()) {
            schema.createTables();
        } else {
            log.info("Schema creation disabled; expecting project state tables to exist");
        }
        return schema;
    }

    @Bean
    public ProjectStateManager projectStateManager(DataSource dataSource,
                                                   ProjectStateSchema schema,
                                                   JsonColumns jsonColumns,
                                                   StateProperties properties,
                                                   Clock clock,
                                                   @Autowired(required = false) ForemanMetrics metrics) {
        StateCache cache = properties.isCacheEnabled() ? new InMemoryStateCache() : null;
        log.info("Configuring JDBC project state manager (cache {})", cache != null ? "enabled" : "disabled");
        return new ProjectStateManager(dataSource, new ProjectStateDao(jsonColumns), cache, clock, metrics);
    }
}
