package com.parallax.core.config;

import com.parallax.core.dispatch.ConcurrentDispatcher;
import com.parallax.core.events.EventBus;
import com.parallax.core.lifecycle.LifecycleHooks;
import com.parallax.core.merge.MergeCoordinator;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.resume.ResumeScanner;
import com.parallax.core.scheduler.GroupScheduler;
import com.parallax.workspace.MergeHook;
import com.parallax.workspace.TaskExecutionHook;
import com.parallax.workspace.VerificationHook;
import com.parallax.workspace.WorkspaceInventory;
import com.parallax.workspace.WorkspaceProperties;
import com.parallax.workspace.WorkspaceProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;

@Configuration
public class CoreConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Event delivery runs on its own daemon thread so publishers never wait on subscribers.
     */
    @Bean
    public EventBus eventBus() {
        return new EventBus(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "parallax-events");
            t.setDaemon(true);
            return t;
        }));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GroupScheduler groupScheduler() {
        return new GroupScheduler();
    }

    @Bean
    public LifecycleHooks lifecycleHooks(WorkspaceProvider provider, TaskExecutionHook taskHook,
                                         VerificationHook verifier, WorkspaceProperties properties) {
        return new LifecycleHooks(provider, taskHook, verifier,
                Duration.ofSeconds(properties.getTask().getTimeoutSeconds()),
                Duration.ofSeconds(properties.getVerify().getTimeoutSeconds()));
    }

    @Bean
    public MergeCoordinator mergeCoordinator(WorkspaceProvider provider, MergeHook mergeHook,
                                             WorkspaceProperties properties, EventBus eventBus,
                                             @Autowired(required = false) ParallaxMetrics metrics) {
        return new MergeCoordinator(provider, mergeHook, properties.getSettleDelayMs(), eventBus, metrics);
    }

    @Bean
    public ConcurrentDispatcher concurrentDispatcher(GroupScheduler scheduler, LifecycleHooks hooks,
                                                     MergeCoordinator mergeCoordinator,
                                                     WorkspaceProperties properties, EventBus eventBus,
                                                     @Autowired(required = false) ParallaxMetrics metrics) {
        return new ConcurrentDispatcher(scheduler, hooks, mergeCoordinator, properties.getMaxParallel(),
                eventBus, metrics);
    }

    @Bean
    public ResumeScanner resumeScanner(WorkspaceInventory inventory, Clock clock, WorkspaceProperties properties) {
        return new ResumeScanner(inventory, clock, Duration.ofDays(properties.getRecencyDays()));
    }
}
