package com.flamingo.ai.smartnotes.service.store;

import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** {@link DocumentStore} keeping immutable snapshots in memory. */
@Component
@ConditionalOnProperty(name = "smartnotes.store.type", havingValue = "memory")
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

  private final Map<UUID, WorkspaceSnapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<WorkspaceSnapshot> load(UUID documentId) {
    return Optional.ofNullable(snapshots.get(documentId));
  }

  @Override
  public void save(WorkspaceSnapshot snapshot) {
    snapshots.put(snapshot.id(), snapshot);
    log.debug("Stored snapshot of document {}", snapshot.id());
  }

  @Override
  public void delete(UUID documentId) {
    snapshots.remove(documentId);
  }

  @Override
  public boolean exists(UUID documentId) {
    return snapshots.containsKey(documentId);
  }

  @Override
  public List<WorkspaceSnapshot> list() {
    return snapshots.values().stream()
        .sorted(Comparator.comparing(WorkspaceSnapshot::updatedAt).reversed())
        .toList();
  }
}
