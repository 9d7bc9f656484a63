package com.algoexec.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${algoexec.async.mailbox-queue-capacity:2147483647}")
    private int mailboxQueueCapacity;

    /**
     * Single consumer thread for portfolio mutations from broker callbacks. One thread and
     * a FIFO queue keep updates in arrival order.
     */
    @Bean("portfolioMailboxExecutor")
    public ThreadPoolTaskExecutor portfolioMailboxExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(mailboxQueueCapacity);
        executor.setThreadNamePrefix("portfolio-mailbox-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
