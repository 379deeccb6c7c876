package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Plain text and Markdown: the text is taken as is and split into synthetic pages. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlainTextExtractor implements DocumentExtractor {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final Paginator paginator;

  @Override
  public ExtractionResult extract(RawUpload upload, ExtractionListener listener) {
    String text = decodeUtf8(upload.bytes());
    List<TextBlock> blocks = paginator.paginate(text);
    int pageCount = blocks.get(blocks.size() - 1).pageNumber();

    ExtractedMetadata metadata = new ExtractedMetadata(upload.baseName(), null, pageCount, false);
    listener.onMetadata(metadata);
    log.debug("Text document {} split into {} synthetic pages", upload.fileName(), pageCount);
    return new ExtractionResult(blocks, metadata, Paginator.countWords(text));
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.TXT || format == DocumentFormat.MD;
  }

  /** Decodes UTF-8, dropping malformed sequences and a leading byte order mark. */
  static String decodeUtf8(byte[] bytes) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String text;
    try {
      text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      throw new IllegalStateException("UTF-8 decoder configured to ignore errors failed", e);
    }
    return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
  }
}
