package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.exception.InvalidRequestException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import org.apache.tika.Tika;

/**
 * Immutable upload: bytes, original name, sniffed MIME type, SHA-256 and size. Bytes are copied on
 * the way in and on the way out.
 */
public final class RawUpload {

  private static final Tika TIKA = new Tika();

  private final byte[] bytes;
  private final String fileName;
  private final String mimeType;
  private final String checksumSha256;

  private RawUpload(byte[] bytes, String fileName, String mimeType, String checksumSha256) {
    this.bytes = bytes;
    this.fileName = fileName;
    this.mimeType = mimeType;
    this.checksumSha256 = checksumSha256;
  }

  /**
   * Creates an upload, detecting the MIME type from content and name.
   *
   * @throws InvalidRequestException if the bytes are null
   */
  public static RawUpload of(String fileName, byte[] bytes) {
    if (bytes == null) {
      throw new InvalidRequestException("Upload content is missing", "Please upload a valid file");
    }
    byte[] copy = Arrays.copyOf(bytes, bytes.length);
    String name = fileName == null || fileName.isBlank() ? "document" : fileName;
    return new RawUpload(copy, name, TIKA.detect(copy, name), sha256Hex(copy));
  }

  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  public String fileName() {
    return fileName;
  }

  public String mimeType() {
    return mimeType;
  }

  public String checksumSha256() {
    return checksumSha256;
  }

  public long size() {
    return bytes.length;
  }

  /**
   * Resolves the document format from the file extension, then the detected MIME type.
   *
   * @throws InvalidRequestException if the format is not supported
   */
  public DocumentFormat format() {
    return DocumentFormat.resolve(fileName, mimeType)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Unsupported file type: " + fileName + " (" + mimeType + ")",
                    "Supported formats: PDF, EPUB, TXT, MD"));
  }

  /** File name without its last extension. */
  public String baseName() {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  public static String sha256Hex(byte[] data) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
