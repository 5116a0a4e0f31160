package com.flamingo.ai.smartnotes.service.store;

import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persists document snapshots. Each call is all-or-nothing. */
public interface DocumentStore {

  Optional<WorkspaceSnapshot> load(UUID documentId);

  void save(WorkspaceSnapshot snapshot);

  void delete(UUID documentId);

  boolean exists(UUID documentId);

  /** Snapshots of every stored document, most recently updated first. */
  List<WorkspaceSnapshot> list();
}
