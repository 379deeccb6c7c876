package com.flamingo.ai.pagereader.service.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pagereader.domain.model.ContentFingerprint;
import com.flamingo.ai.pagereader.service.extraction.RawUpload;

/** Computes the checksum and size of a content representation from its JSON form. */
public final class ContentFingerprints {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ContentFingerprints() {}

  public static ContentFingerprint of(Object content) {
    try {
      byte[] json = MAPPER.writeValueAsBytes(content);
      return new ContentFingerprint(RawUpload.sha256Hex(json), json.length);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize content: " + e.getMessage(), e);
    }
  }
}
