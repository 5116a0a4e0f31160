package com.flamingo.ai.smartnotes.service.document;

import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.domain.model.GenerateNotesOptions;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteGenerationReport;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicView;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/**
 * Operations exposed to the application. Mutations are serialized per document and saved
 * atomically; reads see the last committed state.
 */
public interface DocumentService {

  /** Creates and segments a document from text. Nothing is stored if segmentation fails. */
  WorkspaceSnapshot createDocument(
      String title, String content, List<MediaReference> media, Integer granularity);

  /** Extracts text from an uploaded file, then creates the document. */
  WorkspaceSnapshot uploadDocument(MultipartFile file, String title, Integer granularity);

  WorkspaceSnapshot getDocument(UUID documentId);

  List<WorkspaceSnapshot> listDocuments();

  /** Re-segments with a new granularity; existing notes become stale. */
  WorkspaceSnapshot setGranularity(UUID documentId, int granularity);

  Topic mergeTopics(UUID documentId, Collection<String> topicKeys);

  NoteGenerationReport generateNotes(UUID documentId, GenerateNotesOptions options);

  Note reviseNote(UUID documentId, String topicKey, String instruction, Integer expectedRevision);

  List<TopicView> listTopics(UUID documentId);

  /** Current note of a live topic, with links resolved against the current graph. */
  Note getNote(UUID documentId, String topicKey);

  /** Current notes of every live topic that has one, read from a single snapshot. */
  List<Note> getCurrentNotes(UUID documentId);

  /** Every stored revision for a topic key, stale ones included. */
  List<Note> getNoteHistory(UUID documentId, String topicKey);

  /** Revision chat log, optionally restricted to one topic. */
  List<ChatTurn> getChatHistory(UUID documentId, String topicKey);

  void deleteDocument(UUID documentId);
}
