package com.flamingo.ai.smartnotes.service.image;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link ImageAnalyzer} sending the image bytes to a vision-capable chat model as LangChain4j
 * {@link ImageContent}.
 *
 * <p>Locations are resolved under the configured media directory. Anything that resolves outside
 * it, or whose bytes Tika does not detect as an image, is refused before the model is called.
 */
@Service
@Slf4j
public class VisionImageAnalyzer implements ImageAnalyzer {

  private static final String PROMPT =
      "Describe this figure from a study document in two or three sentences. Focus on what it"
          + " shows and what a student should learn from it.";

  private final ChatModel textChatModel;
  private final CollaboratorGateway collaboratorGateway;
  private final Path mediaRoot;
  private final Tika tika = new Tika();

  public VisionImageAnalyzer(
      @Qualifier("textChatModel") ChatModel textChatModel,
      CollaboratorGateway collaboratorGateway,
      SmartNotesConfig config) {
    this.textChatModel = textChatModel;
    this.collaboratorGateway = collaboratorGateway;
    this.mediaRoot = Path.of(config.getMedia().getBaseDir()).toAbsolutePath().normalize();
  }

  @Override
  public String describe(MediaReference image) {
    if (image.mimeType() == null || !image.mimeType().startsWith("image/")) {
      throw new CollaboratorException(
          CollaboratorType.IMAGE_ANALYZER,
          "describe",
          "unsupported media type " + image.mimeType(),
          false);
    }
    byte[] bytes = readBytes(image);
    String detected = tika.detect(bytes);
    if (!detected.startsWith("image/")) {
      log.warn("Media {} declared {} but contains {}", image.id(), image.mimeType(), detected);
      throw new CollaboratorException(
          CollaboratorType.IMAGE_ANALYZER,
          "describe",
          "content of " + image.id() + " is not an image: " + detected,
          false);
    }
    String base64 = Base64.getEncoder().encodeToString(bytes);
    UserMessage message =
        UserMessage.from(TextContent.from(PROMPT), ImageContent.from(base64, detected));

    String description =
        collaboratorGateway.call(
            CollaboratorType.IMAGE_ANALYZER,
            "describe",
            () -> textChatModel.chat(message).aiMessage().text());
    if (description == null || description.isBlank()) {
      throw new CollaboratorException(
          CollaboratorType.IMAGE_ANALYZER, "describe", "empty description", false);
    }
    log.debug("Described image {} ({} chars)", image.id(), description.length());
    return description.strip();
  }

  private byte[] readBytes(MediaReference image) {
    try {
      return Files.readAllBytes(resolve(image));
    } catch (IOException | RuntimeException e) {
      throw new CollaboratorException(
          CollaboratorType.IMAGE_ANALYZER,
          "describe",
          "cannot read image " + image.id() + ": " + e.getMessage(),
          false,
          e);
    }
  }

  /** Real path of the image file, which must lie inside the media directory. */
  private Path resolve(MediaReference image) throws IOException {
    if (image.location() == null || image.location().isBlank()) {
      throw new IOException("no location");
    }
    Path root = mediaRoot.toRealPath();
    Path file = root.resolve(image.location()).normalize().toRealPath();
    if (!file.startsWith(root)) {
      log.warn("Refusing media {} outside the media directory: {}", image.id(), image.location());
      throw new IOException("location outside the media directory");
    }
    return file;
  }
}
