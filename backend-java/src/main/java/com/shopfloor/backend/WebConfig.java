package com.shopfloor.backend;

import java.nio.file.Path;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.shopfloor.backend.util.SharedBackendPaths;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${app.uploads-dir:./uploads}")
  private String uploadsDir;

  @Value("${app.cors.allowed-origins:*}")
  private String[] allowedOrigins;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/v1/**")
        .allowedOrigins(allowedOrigins)
        .allowedMethods("GET", "POST", "PUT", "DELETE")
        .allowedHeaders("*");
  }

  /** Inspection photos are served straight from the uploads directory. */
  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    Path dir = SharedBackendPaths.uploadsDir(uploadsDir, List.of("uploads", "../uploads"));
    registry.addResourceHandler("/uploads/**")
        .addResourceLocations(dir.toUri().toString());
  }
}
