package com.shopfloor.backend.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Resolves the database file and uploads directory relative to the repository checkout. */
public final class SharedBackendPaths {
  private static final String MODULE_DIR = "backend-java";

  private SharedBackendPaths() {}

  /** Nearest ancestor of the working directory that contains the backend module, else the working directory. */
  public static Path repoRoot() {
    Path cwd = Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize();
    for (Path dir = cwd; dir != null; dir = dir.getParent()) {
      if (Files.isDirectory(dir.resolve(MODULE_DIR)) && Files.exists(dir.resolve("pom.xml"))) {
        return dir;
      }
    }
    return cwd;
  }

  public static Path repoPath(String relative) {
    Objects.requireNonNull(relative, "relative");
    String t = relative.trim();
    if (t.isEmpty()) {
      throw new IllegalArgumentException("relative is blank");
    }
    return repoRoot().resolve(t).toAbsolutePath().normalize();
  }

  /** First of {@code configured} and {@code fallbacks} that is an existing directory; {@code configured} otherwise. */
  public static Path uploadsDir(String configured, List<String> fallbacks) {
    Path p = absolute(configured);
    if (p != null && Files.isDirectory(p)) {
      return p;
    }
    return fallbacks.stream()
        .map(SharedBackendPaths::absolute)
        .filter(fp -> fp != null && Files.isDirectory(fp))
        .findFirst()
        .orElse(p != null ? p : repoPath("uploads"));
  }

  /** SQLite creates the file itself; only its parent directory has to exist. */
  public static Path dbFile(String configured) {
    Path p = absolute(configured);
    if (p == null) {
      return repoPath("shopfloor.db");
    }
    Path parent = p.getParent();
    if (parent != null && !Files.isDirectory(parent)) {
      throw new IllegalStateException("database directory does not exist: " + parent);
    }
    return p;
  }

  private static Path absolute(String s) {
    String t = (s == null) ? "" : s.trim();
    if (t.isEmpty()) {
      return null;
    }
    return Path.of(t).toAbsolutePath().normalize();
  }
}
