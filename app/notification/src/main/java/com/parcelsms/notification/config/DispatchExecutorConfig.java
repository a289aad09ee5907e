/*
 * Where: Notification application configuration
 * What: Provides the bounded worker pool the dispatcher sends on
 * Why: Cap the number of in-flight provider calls per instance
 */
package com.parcelsms.notification.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchExecutorConfig {

  @Bean(destroyMethod = "shutdown")
  ExecutorService dispatchExecutor(NotificationDispatchProperties properties) {
    return Executors.newFixedThreadPool(
        properties.concurrency(),
        new ThreadFactoryBuilder().setNameFormat("notification-dispatch-%d").setDaemon(true).build());
  }
}
