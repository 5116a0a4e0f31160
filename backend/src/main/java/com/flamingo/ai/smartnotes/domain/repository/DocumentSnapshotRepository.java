package com.flamingo.ai.smartnotes.domain.repository;

import com.flamingo.ai.smartnotes.domain.entity.DocumentSnapshotEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for document snapshots. */
@Repository
public interface DocumentSnapshotRepository extends JpaRepository<DocumentSnapshotEntity, String> {

  /** Finds all snapshots, most recently updated first. */
  List<DocumentSnapshotEntity> findAllByOrderByUpdatedAtDesc();
}
