package com.flamingo.ai.pagereader.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists embedding vectors as a JSON number array. */
@Converter
public class FloatArrayConverter extends JsonColumnConverter<float[]> {

  public FloatArrayConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected float[] emptyValue() {
    return new float[0];
  }
}
