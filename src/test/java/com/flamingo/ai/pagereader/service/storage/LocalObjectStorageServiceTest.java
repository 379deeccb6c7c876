package com.flamingo.ai.pagereader.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalObjectStorageServiceTest {

  @TempDir Path root;

  private LocalObjectStorageService storage;

  @BeforeEach
  void setUp() {
    ReaderConfig config = new ReaderConfig();
    config.getStorage().setBasePath(root.toString());
    storage = new LocalObjectStorageService(config);
  }

  @Test
  void shouldStoreObjectUnderNestedKey() throws Exception {
    byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

    storage.put("owner-1/doc.txt", content);

    assertThat(Files.readAllBytes(root.resolve("owner-1").resolve("doc.txt"))).isEqualTo(content);
  }

  @Test
  void shouldReplaceExistingObject() throws Exception {
    storage.put("a.txt", new byte[] {1});
    storage.put("a.txt", new byte[] {2, 3});

    assertThat(Files.readAllBytes(root.resolve("a.txt"))).containsExactly(2, 3);
  }

  @Test
  void shouldDeleteStoredObject() {
    storage.put("owner-1/doc.txt", new byte[] {1});

    storage.delete("owner-1/doc.txt");

    assertThat(Files.exists(root.resolve("owner-1").resolve("doc.txt"))).isFalse();
  }

  @Test
  void shouldIgnoreDeleteOfMissingObject() {
    assertThatCode(() -> storage.delete("missing.pdf")).doesNotThrowAnyException();
  }

  @Test
  void shouldRejectKeysOutsideRoot() {
    assertThatThrownBy(() -> storage.put("../escape.txt", new byte[] {1}))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> storage.delete("../escape.txt"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
