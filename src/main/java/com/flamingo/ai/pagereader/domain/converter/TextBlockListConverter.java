package com.flamingo.ai.pagereader.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists the rich block representation as a JSON array. */
@Converter
public class TextBlockListConverter extends JsonColumnConverter<List<TextBlock>> {

  public TextBlockListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<TextBlock> emptyValue() {
    return new ArrayList<>();
  }
}
