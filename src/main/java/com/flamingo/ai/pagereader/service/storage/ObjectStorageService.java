package com.flamingo.ai.pagereader.service.storage;

/**
 * Blob storage for original uploads. Failures are thrown as {@link ObjectStorageException} and are
 * not interpreted by callers.
 */
public interface ObjectStorageService {

  /**
   * Stores bytes under a key, replacing any previous object.
   *
   * @param key relative object key, e.g. {@code owner/document.pdf}
   * @param bytes content
   */
  void put(String key, byte[] bytes);

  /**
   * Removes the object stored under a key. A missing object is not an error.
   *
   * @param key relative object key
   */
  void delete(String key);
}
