package com.z254.swarm.hive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Engine infrastructure beans.
 */
@Configuration
public class HiveConfig {

    /**
     * Threads the activation engine runs activations on.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler activationScheduler(SwarmProperties properties) {
        SwarmProperties.SchedulerProperties scheduler = properties.getScheduler();
        return Schedulers.newBoundedElastic(
                Math.max(1, scheduler.getWorkers()),
                Math.max(1, scheduler.getQueueCapacity()),
                "hive-activation");
    }
}
