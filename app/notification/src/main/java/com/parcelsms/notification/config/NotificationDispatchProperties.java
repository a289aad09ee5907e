/*
 * Where: Notification application configuration binding
 * What: Holds polling, batch and concurrency settings of the dispatcher
 * Why: Externalize throughput knobs of the send loop
 */
package com.parcelsms.notification.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.dispatch")
@Validated
public record NotificationDispatchProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int concurrency,
    @Positive int errorMessageMaxLength) {}
