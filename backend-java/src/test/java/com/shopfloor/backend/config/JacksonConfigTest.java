package com.shopfloor.backend.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopfloor.backend.inspection.InspectionResult;
import com.shopfloor.backend.inspection.InspectionResultItem;

class JacksonConfigTest {

  private static ObjectMapper mapper() {
    Jackson2ObjectMapperBuilder builder = Jackson2ObjectMapperBuilder.json();
    new JacksonConfig().inspectionJsonCustomizer().customize(builder);
    return builder.build();
  }

  @Test
  void readsFormDatesAndBarePhotoReference() throws Exception {
    InspectionResult r = mapper().readValue("""
        {"orderId":"OP-9","inspectionDate":"2026-03-02 08:30:00",
         "sections":[{"id":"s","name":"S","items":[{"id":"a","photos":"/uploads/a.jpg"}]}]}
        """, InspectionResult.class);

    assertThat(r.getInspectionDate()).isEqualTo(OffsetDateTime.of(2026, 3, 2, 8, 30, 0, 0, ZoneOffset.UTC));
    assertThat(r.findItem("s", "a").map(InspectionResultItem::getPhotos).orElseThrow())
        .containsExactly("/uploads/a.jpg");
  }

  @Test
  void writesDatesAsIsoStrings() throws Exception {
    InspectionResult r = new InspectionResult();
    r.setInspectionDate(OffsetDateTime.of(2026, 3, 2, 8, 30, 0, 0, ZoneOffset.UTC));

    assertThat(mapper().writeValueAsString(r)).contains("\"inspectionDate\":\"2026-03-02T08:30:00Z\"");
  }
}
