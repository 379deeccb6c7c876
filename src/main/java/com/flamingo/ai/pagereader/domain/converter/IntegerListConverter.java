package com.flamingo.ai.pagereader.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists citation page numbers as a JSON array. */
@Converter
public class IntegerListConverter extends JsonColumnConverter<List<Integer>> {

  public IntegerListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<Integer> emptyValue() {
    return new ArrayList<>();
  }
}
