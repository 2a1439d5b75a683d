package com.skyrelay.bridge.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for the telemetry API.
 *
 * <p>Dashboards are usually served from another origin, so CORS is opened for the configured
 * allowlist only.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final BridgeProperties properties;

  public WebConfig(BridgeProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers API CORS mappings when an allowlist is configured.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "OPTIONS")
        .allowedHeaders("*")
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }
}
