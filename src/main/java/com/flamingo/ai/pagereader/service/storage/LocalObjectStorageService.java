package com.flamingo.ai.pagereader.service.storage;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Stores objects as files below {@code reader.storage.base-path}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalObjectStorageService implements ObjectStorageService {

  private final ReaderConfig readerConfig;

  @Override
  public void put(String key, byte[] bytes) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, bytes);
      log.debug("Stored object {} ({} bytes)", key, bytes.length);
    } catch (IOException e) {
      throw new ObjectStorageException(key, "Failed to store object", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      if (Files.deleteIfExists(resolve(key))) {
        log.debug("Deleted object {}", key);
      }
    } catch (IOException e) {
      throw new ObjectStorageException(key, "Failed to delete object", e);
    }
  }

  private Path resolve(String key) {
    Path base = Path.of(readerConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
    Path target = base.resolve(key).normalize();
    if (!target.startsWith(base)) {
      throw new IllegalArgumentException("Object key escapes storage root: " + key);
    }
    return target;
  }
}
