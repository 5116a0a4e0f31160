package com.flamingo.ai.smartnotes.service.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.smartnotes.domain.enums.DocumentState;
import com.flamingo.ai.smartnotes.domain.model.TopicGraphState;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryDocumentStore")
class InMemoryDocumentStoreTest {

  private final InMemoryDocumentStore store = new InMemoryDocumentStore();

  private static WorkspaceSnapshot snapshot(UUID id, String title, Instant updatedAt) {
    return new WorkspaceSnapshot(
        id,
        title,
        null,
        "text",
        List.of(),
        50,
        false,
        DocumentState.UPLOADED,
        TopicGraphState.empty(4),
        Map.of(),
        List.of(),
        updatedAt,
        updatedAt);
  }

  @Test
  @DisplayName("should replace the stored snapshot on save")
  void shouldReplace_whenSavedTwice() {
    UUID id = UUID.randomUUID();
    Instant now = Instant.now();

    store.save(snapshot(id, "First", now));
    store.save(snapshot(id, "Second", now.plusSeconds(1)));

    assertThat(store.load(id)).get().extracting(WorkspaceSnapshot::title).isEqualTo("Second");
    assertThat(store.list()).hasSize(1);
  }

  @Test
  @DisplayName("should list the most recently updated document first")
  void shouldListByRecency() {
    Instant now = Instant.now();
    UUID older = UUID.randomUUID();
    UUID newer = UUID.randomUUID();
    store.save(snapshot(older, "Older", now.minusSeconds(60)));
    store.save(snapshot(newer, "Newer", now));

    assertThat(store.list()).extracting(WorkspaceSnapshot::id).containsExactly(newer, older);
  }

  @Test
  @DisplayName("should forget a deleted document")
  void shouldForget_whenDeleted() {
    UUID id = UUID.randomUUID();
    store.save(snapshot(id, "Doomed", Instant.now()));

    store.delete(id);

    assertThat(store.exists(id)).isFalse();
    assertThat(store.load(id)).isEmpty();
  }
}
