package com.shopfloor.backend.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import com.shopfloor.backend.util.SharedBackendPaths;

/** Stores inspection photos; items keep only the returned {@code path}. */
@RestController
public class UploadController {
  private static final Logger logger = LoggerFactory.getLogger(UploadController.class);

  private static final Set<String> IMAGE_EXT = Set.of(".jpg", ".jpeg", ".png", ".webp", ".heic");

  @Value("${app.uploads-dir:./uploads}")
  private String uploadsDir;

  @PostMapping(value = "/v1/uploads/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public Map<String, Object> uploadPhoto(@RequestPart("file") MultipartFile file) throws IOException {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("empty file");
    }

    String name = UUID.randomUUID().toString().replace("-", "") + extensionOf(file.getOriginalFilename());
    Path dir = SharedBackendPaths.uploadsDir(uploadsDir, List.of("uploads", "../uploads"));
    Files.createDirectories(dir);
    file.transferTo(dir.resolve(name));

    String path = "/uploads/" + name;
    String url = ServletUriComponentsBuilder.fromCurrentContextPath()
        .path(path)
        .toUriString();
    logger.info("Stored inspection photo {} ({} bytes)", path, file.getSize());
    return Map.of("url", url, "path", path);
  }

  /** Known image extension of {@code original}, else ".jpg". */
  static String extensionOf(String original) {
    String n = original == null ? "" : original.trim();
    int idx = n.lastIndexOf('.');
    String ext = idx >= 0 ? n.substring(idx).toLowerCase(Locale.ROOT) : "";
    return IMAGE_EXT.contains(ext) ? ext : ".jpg";
  }
}
