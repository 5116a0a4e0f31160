package com.flamingo.ai.smartnotes.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.smartnotes.domain.entity.DocumentSnapshotEntity;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import com.flamingo.ai.smartnotes.domain.repository.DocumentSnapshotRepository;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link DocumentStore} writing each snapshot as one JSON row through Spring Data JPA. A save is a
 * single row upsert, so it either fully lands or not at all.
 */
@Component
@ConditionalOnProperty(name = "smartnotes.store.type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaDocumentStore implements DocumentStore {

  private final DocumentSnapshotRepository repository;
  private final ObjectMapper objectMapper;

  @Override
  @Transactional(readOnly = true)
  public Optional<WorkspaceSnapshot> load(UUID documentId) {
    return repository.findById(documentId.toString()).map(this::fromEntity);
  }

  @Override
  @Transactional
  public void save(WorkspaceSnapshot snapshot) {
    DocumentSnapshotEntity entity =
        DocumentSnapshotEntity.builder()
            .id(snapshot.id().toString())
            .title(snapshot.title())
            .state(snapshot.state())
            .granularity(snapshot.granularity())
            .snapshotJson(toJson(snapshot))
            .createdAt(LocalDateTime.ofInstant(snapshot.createdAt(), ZoneOffset.UTC))
            .updatedAt(LocalDateTime.ofInstant(snapshot.updatedAt(), ZoneOffset.UTC))
            .build();
    repository.save(entity);
    log.debug("Saved snapshot of document {} ({})", snapshot.id(), snapshot.state());
  }

  @Override
  @Transactional
  public void delete(UUID documentId) {
    repository.deleteById(documentId.toString());
  }

  @Override
  @Transactional(readOnly = true)
  public boolean exists(UUID documentId) {
    return repository.existsById(documentId.toString());
  }

  @Override
  @Transactional(readOnly = true)
  public List<WorkspaceSnapshot> list() {
    return repository.findAllByOrderByUpdatedAtDesc().stream().map(this::fromEntity).toList();
  }

  private String toJson(WorkspaceSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new CollaboratorException(
          CollaboratorType.STORE, "save", "cannot serialize " + snapshot.id(), false, e);
    }
  }

  private WorkspaceSnapshot fromEntity(DocumentSnapshotEntity entity) {
    try {
      return objectMapper.readValue(entity.getSnapshotJson(), WorkspaceSnapshot.class);
    } catch (JsonProcessingException e) {
      log.error("Corrupt snapshot for document {}", entity.getId(), e);
      throw new CollaboratorException(
          CollaboratorType.STORE, "load", "cannot read snapshot " + entity.getId(), false, e);
    }
  }
}
