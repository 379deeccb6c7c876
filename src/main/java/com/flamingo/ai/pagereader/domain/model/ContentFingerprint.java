package com.flamingo.ai.pagereader.domain.model;

/**
 * Checksum and size of one serialized content representation.
 *
 * @param checksumSha256 lowercase hex SHA-256 of the JSON bytes
 * @param sizeBytes length of the JSON in UTF-8 bytes
 */
public record ContentFingerprint(String checksumSha256, long sizeBytes) {}
