package com.skyrelay.bridge.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BridgeConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
