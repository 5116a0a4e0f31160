package com.flamingo.ai.smartnotes.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.smartnotes.domain.model.ExtractedContent;
import com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TikaExtractor Tests")
class TikaExtractorTest {

  private final TikaExtractor extractor = new TikaExtractor();

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should keep paragraph breaks of plain text")
  void shouldKeepParagraphs_whenPlainText() {
    String text = "Cells are small.\n\n\n\nMembranes are thin.   \nThey control transport.";

    ExtractedContent content = extractor.extract(stream(text), "notes.txt", "text/plain");

    assertThat(content.text())
        .isEqualTo("Cells are small.\n\nMembranes are thin.\nThey control transport.");
    assertThat(content.media()).isEmpty();
  }

  @Test
  @DisplayName("should extract the visible text of HTML")
  void shouldExtractBodyText_whenHtml() {
    String html =
        "<html><head><title>Ignored</title><script>var x = 1;</script></head>"
            + "<body><h1>Mitosis</h1><p>The nucleus divides.</p></body></html>";

    ExtractedContent content = extractor.extract(stream(html), "lecture.html", "text/html");

    assertThat(content.text()).contains("Mitosis", "The nucleus divides.");
    assertThat(content.text()).doesNotContain("var x");
  }

  @Test
  @DisplayName("should reject a document without text")
  void shouldReject_whenNoText() {
    assertThatThrownBy(() -> extractor.extract(stream("  \n\n "), "blank.txt", "text/plain"))
        .isInstanceOf(ExtractionInsufficientException.class)
        .extracting(e -> ((ExtractionInsufficientException) e).getContentLength())
        .isEqualTo(0);
  }
}
