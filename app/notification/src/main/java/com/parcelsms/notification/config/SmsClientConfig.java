/*
 * Where: Notification application configuration
 * What: Provides the RestClient dedicated to the SMS provider
 * Why: Provider base URL and timeouts live in one place
 */
package com.parcelsms.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SmsClientConfig {

  @Bean
  RestClient smsRestClient(RestClient.Builder builder, SmsProviderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
