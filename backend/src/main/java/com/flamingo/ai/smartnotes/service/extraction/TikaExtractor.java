package com.flamingo.ai.smartnotes.service.extraction;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.ExtractedContent;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link Extractor} using Apache Tika's {@link AutoDetectParser}, covering PDF, Office formats,
 * Markdown and plain text. Embedded images are not extracted.
 */
@Service
@Slf4j
public class TikaExtractor implements Extractor {

  private final AutoDetectParser parser = new AutoDetectParser();

  @Override
  public ExtractedContent extract(InputStream inputStream, String fileName, String mimeType) {
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    try {
      parser.parse(inputStream, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika extraction failed for {} ({}): {}", fileName, mimeType, e.getMessage());
      throw new CollaboratorException(
          CollaboratorType.EXTRACTOR, "extract", "cannot parse " + fileName, false, e);
    }

    String text = normalize(handler.toString());
    if (text.isBlank()) {
      throw new ExtractionInsufficientException(0, 1);
    }
    log.debug("Extracted {} chars from {}", text.length(), fileName);
    return new ExtractedContent(text, List.of());
  }

  /** Collapses runs of blank lines left by Tika's XHTML output. */
  private static String normalize(String text) {
    return text.replace("\r\n", "\n").replaceAll("[ \\t]+\\n", "\n").replaceAll("\\n{3,}", "\n\n")
        .strip();
  }
}
