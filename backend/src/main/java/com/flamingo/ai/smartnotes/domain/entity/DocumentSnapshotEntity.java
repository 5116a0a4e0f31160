package com.flamingo.ai.smartnotes.domain.entity;

import com.flamingo.ai.smartnotes.domain.enums.DocumentState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Persisted snapshot of one document, serialized as JSON. */
@Entity
@Table(name = "document_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentSnapshotEntity {

  /** Document id as a UUID string. */
  @Id
  @Column(length = 36)
  private String id;

  private String title;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private DocumentState state;

  private int granularity;

  /** Full workspace snapshot (content, topic graph, notes, chat log). */
  @Column(columnDefinition = "TEXT", nullable = false)
  private String snapshotJson;

  /** UTC. */
  @Column(nullable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;
}
