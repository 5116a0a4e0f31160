package com.flamingo.ai.smartnotes.service.document;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteFile;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.InputException;
import io.micrometer.core.annotation.Timed;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Packages current notes as downloadable files.
 *
 * <p>Inside the ZIP every note is stored under its topic anchor (e.g. {@code topic-T3.md}) so the
 * relative links between notes resolve, next to an {@code index.md} table of contents sorted by
 * topic name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteExportService {

  static final String INDEX_FILE = "index.md";
  private static final String ZIP_MIME_TYPE = "application/zip";

  private final DocumentService documentService;

  /** A single current note, named after its topic. */
  public NoteFile download(UUID documentId, String topicKey) {
    Note note = documentService.getNote(documentId, topicKey);
    String fileName = slug(note.body().title(), topicKey) + note.format().getExtension();
    return new NoteFile(
        fileName, note.format().getMimeType(), note.rendered().getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Every current note plus a table of contents.
   *
   * @throws InputException if no topic has a current note
   */
  @Timed(value = "notes.export", description = "Time to export notes as ZIP")
  public NoteFile exportAll(UUID documentId) {
    WorkspaceSnapshot document = documentService.getDocument(documentId);
    List<Note> notes =
        documentService.getCurrentNotes(documentId).stream()
            .sorted(Comparator.comparing(note -> note.body().title().toLowerCase(Locale.ROOT)))
            .toList();
    if (notes.isEmpty()) {
      throw new InputException(
          "No current notes for " + documentId, "Generate notes before exporting them.");
    }

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(bytes, StandardCharsets.UTF_8)) {
      writeEntry(zip, INDEX_FILE, tableOfContents(document.title(), notes));
      for (Note note : notes) {
        writeEntry(zip, entryName(note), note.rendered());
      }
    } catch (IOException e) {
      throw new CollaboratorException(
          CollaboratorType.RENDERER, "export", "cannot build archive: " + e.getMessage(), false, e);
    }
    log.info("Exported {} notes of document {}", notes.size(), documentId);
    return new NoteFile(
        slug(document.title(), "notes") + "-notes.zip", ZIP_MIME_TYPE, bytes.toByteArray());
  }

  static String tableOfContents(String title, List<Note> notes) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(title == null ? "Notes" : title).append("\n\n");
    md.append("## Table of Contents\n\n");
    int index = 1;
    for (Note note : notes) {
      md.append(index++)
          .append(". [")
          .append(note.body().title())
          .append("](")
          .append(entryName(note))
          .append(")\n");
    }
    return md.toString();
  }

  private static String entryName(Note note) {
    return NoteBody.anchorFor(note.topicKey()) + note.format().getExtension();
  }

  private static void writeEntry(ZipOutputStream zip, String name, String content)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(content.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }

  /** File-system friendly name; falls back when nothing usable remains. */
  static String slug(String text, String fallback) {
    if (text == null) {
      return fallback;
    }
    String ascii =
        Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
    String slug =
        ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
    return slug.isEmpty() ? fallback : slug;
  }
}
