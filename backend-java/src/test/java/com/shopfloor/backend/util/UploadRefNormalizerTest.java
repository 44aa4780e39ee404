package com.shopfloor.backend.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UploadRefNormalizerTest {

  @Test
  void uploadsReferencesCollapseToServerPath() {
    assertThat(UploadRefNormalizer.normalize("/uploads/a.jpg")).isEqualTo("/uploads/a.jpg");
    assertThat(UploadRefNormalizer.normalize("uploads/a.jpg")).isEqualTo("/uploads/a.jpg");
    assertThat(UploadRefNormalizer.normalize("https://qc.example.com/uploads/a.jpg")).isEqualTo("/uploads/a.jpg");
    assertThat(UploadRefNormalizer.normalize(" uploads\\b.png ")).isEqualTo("/uploads/b.png");
  }

  @Test
  void otherReferencesAreKeptAndBlanksDropped() {
    assertThat(UploadRefNormalizer.normalize("https://drive.example.com/file/1")).isEqualTo("https://drive.example.com/file/1");
    assertThat(UploadRefNormalizer.normalize("   ")).isNull();
    assertThat(UploadRefNormalizer.normalize(null)).isNull();
  }
}
