package com.shopfloor.backend.config;

import java.time.OffsetDateTime;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * JSON shape of inspections on the wire and in the section-tree columns. Dates are written as
 * ISO strings and read leniently; a single photo reference sent as a bare string is read as a
 * one-element list.
 */
@Configuration
public class JacksonConfig {
  static SimpleModule inspectionDates() {
    return new SimpleModule("inspection-dates")
        .addDeserializer(OffsetDateTime.class, new LenientOffsetDateTimeDeserializer());
  }

  @Bean
  public Jackson2ObjectMapperBuilderCustomizer inspectionJsonCustomizer() {
    return builder -> builder
        .modulesToInstall(inspectionDates())
        .featuresToEnable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }
}
