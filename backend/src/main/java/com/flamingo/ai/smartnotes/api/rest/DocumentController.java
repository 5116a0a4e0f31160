package com.flamingo.ai.smartnotes.api.rest;

import com.flamingo.ai.smartnotes.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.smartnotes.api.dto.request.GenerateNotesRequest;
import com.flamingo.ai.smartnotes.api.dto.request.GranularityRequest;
import com.flamingo.ai.smartnotes.api.dto.request.MergeTopicsRequest;
import com.flamingo.ai.smartnotes.api.dto.request.RevisionRequest;
import com.flamingo.ai.smartnotes.api.dto.response.ChatTurnResponse;
import com.flamingo.ai.smartnotes.api.dto.response.DocumentResponse;
import com.flamingo.ai.smartnotes.api.dto.response.NoteGenerationResponse;
import com.flamingo.ai.smartnotes.api.dto.response.NoteResponse;
import com.flamingo.ai.smartnotes.api.dto.response.TopicResponse;
import com.flamingo.ai.smartnotes.domain.model.GenerateNotesOptions;
import com.flamingo.ai.smartnotes.domain.model.NoteFile;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import com.flamingo.ai.smartnotes.service.document.DocumentService;
import com.flamingo.ai.smartnotes.service.document.NoteExportService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for documents, their topics, notes and revision chat. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;
  private final NoteExportService noteExportService;

  /** Creates and segments a document from plain text. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentResponse> createDocument(
      @Valid @RequestBody CreateDocumentRequest request) {
    WorkspaceSnapshot snapshot =
        documentService.createDocument(
            request.getTitle(),
            request.getContent(),
            request.getMedia(),
            request.getGranularity());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromSnapshot(snapshot));
  }

  /** Uploads a file, extracts its text and segments it. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "title", required = false) String title,
      @RequestParam(value = "granularity", required = false) Integer granularity) {
    WorkspaceSnapshot snapshot = documentService.uploadDocument(file, title, granularity);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromSnapshot(snapshot));
  }

  /** Lists documents, most recently updated first. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments() {
    return ResponseEntity.ok(
        documentService.listDocuments().stream().map(DocumentResponse::fromSnapshot).toList());
  }

  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    WorkspaceSnapshot snapshot = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromSnapshot(snapshot));
  }

  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }

  /** Re-segments the document. Existing notes become stale. */
  @PutMapping("/{documentId}/granularity")
  public ResponseEntity<DocumentResponse> setGranularity(
      @PathVariable UUID documentId, @Valid @RequestBody GranularityRequest request) {
    WorkspaceSnapshot snapshot =
        documentService.setGranularity(documentId, request.getGranularity());
    return ResponseEntity.ok(DocumentResponse.fromSnapshot(snapshot));
  }

  @GetMapping("/{documentId}/topics")
  public ResponseEntity<List<TopicResponse>> listTopics(@PathVariable UUID documentId) {
    return ResponseEntity.ok(
        documentService.listTopics(documentId).stream().map(TopicResponse::fromView).toList());
  }

  /** Merges two or more topics into a new one. */
  @PostMapping("/{documentId}/topics/merge")
  public ResponseEntity<TopicResponse> mergeTopics(
      @PathVariable UUID documentId, @Valid @RequestBody MergeTopicsRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            TopicResponse.fromTopic(
                documentService.mergeTopics(documentId, request.getTopicKeys())));
  }

  /** Generates notes. An absent body generates Markdown for every topic without a fresh note. */
  @PostMapping("/{documentId}/notes")
  public ResponseEntity<NoteGenerationResponse> generateNotes(
      @PathVariable UUID documentId,
      @RequestBody(required = false) GenerateNotesRequest request) {
    GenerateNotesOptions options =
        request == null ? GenerateNotesOptions.defaults() : request.toOptions();
    return ResponseEntity.ok(
        NoteGenerationResponse.fromReport(documentService.generateNotes(documentId, options)));
  }

  /** Downloads every current note plus a table of contents as a ZIP archive. */
  @GetMapping("/{documentId}/notes/export")
  public ResponseEntity<byte[]> exportNotes(@PathVariable UUID documentId) {
    return file(noteExportService.exportAll(documentId));
  }

  @GetMapping("/{documentId}/notes/{topicKey}")
  public ResponseEntity<NoteResponse> getNote(
      @PathVariable UUID documentId, @PathVariable String topicKey) {
    return ResponseEntity.ok(NoteResponse.fromNote(documentService.getNote(documentId, topicKey)));
  }

  @GetMapping("/{documentId}/notes/{topicKey}/history")
  public ResponseEntity<List<NoteResponse>> getNoteHistory(
      @PathVariable UUID documentId, @PathVariable String topicKey) {
    return ResponseEntity.ok(
        documentService.getNoteHistory(documentId, topicKey).stream()
            .map(NoteResponse::fromNote)
            .toList());
  }

  @GetMapping("/{documentId}/notes/{topicKey}/download")
  public ResponseEntity<byte[]> downloadNote(
      @PathVariable UUID documentId, @PathVariable String topicKey) {
    return file(noteExportService.download(documentId, topicKey));
  }

  /** Applies a chat instruction to a topic's current note. */
  @PostMapping("/{documentId}/notes/{topicKey}/revisions")
  public ResponseEntity<NoteResponse> reviseNote(
      @PathVariable UUID documentId,
      @PathVariable String topicKey,
      @Valid @RequestBody RevisionRequest request) {
    return ResponseEntity.ok(
        NoteResponse.fromNote(
            documentService.reviseNote(
                documentId, topicKey, request.getInstruction(), request.getExpectedRevision())));
  }

  /** Gets the revision chat log, optionally for one topic. */
  @GetMapping("/{documentId}/chat")
  public ResponseEntity<List<ChatTurnResponse>> getChatHistory(
      @PathVariable UUID documentId,
      @RequestParam(value = "topicKey", required = false) String topicKey) {
    return ResponseEntity.ok(
        documentService.getChatHistory(documentId, topicKey).stream()
            .map(ChatTurnResponse::fromTurn)
            .toList());
  }

  private ResponseEntity<byte[]> file(NoteFile file) {
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(file.fileName()).build().toString())
        .contentType(MediaType.parseMediaType(file.mimeType()))
        .body(file.content());
  }
}
