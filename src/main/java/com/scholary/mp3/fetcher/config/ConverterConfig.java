package com.scholary.mp3.fetcher.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for conversion-related beans.
 *
 * <p>Enables the ConverterProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ConverterProperties.class)
public class ConverterConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
