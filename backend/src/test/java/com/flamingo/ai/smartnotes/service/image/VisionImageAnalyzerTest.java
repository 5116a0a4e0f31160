package com.flamingo.ai.smartnotes.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("VisionImageAnalyzer")
class VisionImageAnalyzerTest {

  @Mock private ChatModel textChatModel;
  @Mock private CollaboratorGateway collaboratorGateway;

  private static final byte[] PNG = {
    (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13, 'I', 'H', 'D', 'R'
  };

  @TempDir Path tempDir;

  private Path mediaDir;
  private VisionImageAnalyzer analyzer;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() throws Exception {
    mediaDir = Files.createDirectory(tempDir.resolve("media"));
    SmartNotesConfig config = new SmartNotesConfig();
    config.getMedia().setBaseDir(mediaDir.toString());
    analyzer = new VisionImageAnalyzer(textChatModel, collaboratorGateway, config);
    when(collaboratorGateway.call(any(CollaboratorType.class), anyString(), any(Callable.class)))
        .thenAnswer(invocation -> ((Callable<Object>) invocation.getArgument(2)).call());
  }

  @Test
  @DisplayName("should send the image bytes with the prompt and return the description")
  void shouldDescribe_whenImageReadable() throws Exception {
    Files.write(mediaDir.resolve("cell.png"), PNG);
    when(textChatModel.chat(any(ChatMessage.class)))
        .thenReturn(
            ChatResponse.builder().aiMessage(AiMessage.from(" A labelled animal cell. ")).build());

    String description =
        analyzer.describe(new MediaReference("img-1", 0, "image/png", "cell.png"));

    assertThat(description).isEqualTo("A labelled animal cell.");
    ArgumentCaptor<ChatMessage> sent = ArgumentCaptor.forClass(ChatMessage.class);
    verify(textChatModel).chat(sent.capture());
    UserMessage message = (UserMessage) sent.getValue();
    assertThat(message.contents()).hasSize(2);
    ImageContent image = (ImageContent) message.contents().get(1);
    assertThat(image.image().mimeType()).isEqualTo("image/png");
    assertThat(image.image().base64Data()).isEqualTo(Base64.getEncoder().encodeToString(PNG));
  }

  @Test
  @DisplayName("should refuse media that is not an image")
  void shouldRefuse_whenNotAnImage() {
    MediaReference pdf = new MediaReference("att-1", 0, "application/pdf", "x.pdf");

    assertThatThrownBy(() -> analyzer.describe(pdf))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("unsupported media type");
    verify(collaboratorGateway, never()).call(any(), anyString(), any());
  }

  @Test
  @DisplayName("should fail without calling the model when the file is missing")
  void shouldFail_whenFileMissing() {
    MediaReference missing =
        new MediaReference("img-2", 0, "image/png", "gone.png");

    assertThatThrownBy(() -> analyzer.describe(missing))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("cannot read image img-2");
    verify(textChatModel, never()).chat(any(ChatMessage.class));
  }

  @Test
  @DisplayName("should not read files outside the media directory")
  void shouldRefuse_whenLocationEscapesMediaDirectory() throws Exception {
    Path secrets = tempDir.resolve("application-secrets.properties");
    Files.writeString(secrets, "db.password=hunter2");

    assertThatThrownBy(
            () ->
                analyzer.describe(
                    new MediaReference(
                        "img-3", 0, "image/png", "../application-secrets.properties")))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("outside the media directory");
    MediaReference absolute = new MediaReference("img-4", 0, "image/png", secrets.toString());
    assertThatThrownBy(() -> analyzer.describe(absolute))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("outside the media directory");
    verify(textChatModel, never()).chat(any(ChatMessage.class));
  }

  @Test
  @DisplayName("should refuse a file whose bytes are not an image")
  void shouldRefuse_whenBytesAreNotAnImage() throws Exception {
    Files.write(
        mediaDir.resolve("figure.png"), "db.password=hunter2".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(
            () -> analyzer.describe(new MediaReference("img-5", 0, "image/png", "figure.png")))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("is not an image");
    verify(textChatModel, never()).chat(any(ChatMessage.class));
  }
}
