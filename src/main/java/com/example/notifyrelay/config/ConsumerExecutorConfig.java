package com.example.notifyrelay.config;

import com.example.notifyrelay.routing.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@Slf4j
public class ConsumerExecutorConfig {

    /**
     * Runs the stream polling loops and therefore the message handler. Each subscribed
     * stream keeps one thread busy for the lifetime of the consumer, so the core size is
     * raised to the number of routed queues and tasks are never queued behind a loop.
     * Shutdown interrupts running handlers so in-flight deliveries stop retrying.
     */
    @Bean(name = "consumerExecutor")
    public ThreadPoolTaskExecutor consumerExecutor(RoutingTable routingTable,
            @Value("${relay.consumer.core-pool-size:10}") int corePoolSize,
            @Value("${relay.consumer.max-pool-size:50}") int maxPoolSize) {
        int streams = routingTable.queueNames().size();
        int core = Math.max(corePoolSize, streams);
        if (core > corePoolSize) {
            log.info("Raising consumer core pool size from {} to {} for {} routed queue(s)",
                    corePoolSize, core, streams);
        }

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(maxPoolSize, core));
        // direct hand-off: a submission either gets a thread or is rejected
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("Consumer-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }
}
