package com.silentrisk.websocket.config;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.websocket.subscriber.StatusUpdateSubscriber;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Subscribes to the status bus channel. The container re-subscribes after a
 * lost connection, waiting the configured recovery interval between attempts.
 *
 * Events are dispatched on a single thread so that the updates of one task
 * reach clients in the order they were published.
 */
@Configuration
public class StatusBusConfig {

    @Bean
    public ThreadPoolTaskExecutor statusBusDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("status-bus-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public RedisMessageListenerContainer statusBusListenerContainer(RedisConnectionFactory connectionFactory,
                                                                    StatusUpdateSubscriber subscriber,
                                                                    ThreadPoolTaskExecutor statusBusDispatchExecutor,
                                                                    SilentRiskProperties properties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(statusBusDispatchExecutor);
        container.setSubscriptionExecutor(new SimpleAsyncTaskExecutor("status-bus-subscription-"));
        container.addMessageListener(subscriber, new ChannelTopic(properties.getStatusBus().getChannel()));
        container.setRecoveryInterval(properties.getStatusBus().getRecoveryInterval().toMillis());
        return container;
    }
}
