package com.foreman.core.lifecycle;

import com.foreman.core.events.EventBus;
import com.foreman.core.events.LifecycleEvent;
import com.foreman.core.metrics.ForemanMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;

/**
 * Provides the shared {@link AgentLifecycleManager}. Status changes are counted and
 * published to the {@link EventBus} as {@link LifecycleEvent}s.
 */
@Configuration
public class LifecycleConfig {

    @Bean
    public AgentLifecycleManager agentLifecycleManager(EventBus eventBus,
                                                       Clock clock,
                                                       @Autowired(required = false) ForemanMetrics metrics) {
        return new AgentLifecycleManager((agentId, state, payload) -> {
            if (metrics != null) {
                metrics.recordLifecycleNotification(state.name());
            }
            eventBus.publish(new LifecycleEvent(agentId, state, new LinkedHashMap<>(payload), clock.instant()));
        }, clock);
    }
}
