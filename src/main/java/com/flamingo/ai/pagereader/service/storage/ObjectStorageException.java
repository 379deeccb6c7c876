package com.flamingo.ai.pagereader.service.storage;

/** Exception thrown when the object store cannot read or write an object. */
public class ObjectStorageException extends RuntimeException {

  private final String key;

  public ObjectStorageException(String key, String message, Throwable cause) {
    super(message + ": " + key, cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
