package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;

/**
 * Structured content of a note, independent of output format.
 *
 * @param anchor per-topic anchor other notes link to, e.g. {@code topic-T3}
 * @param title note title
 * @param summary short lead paragraph
 * @param sections headed sections in display order
 * @param images analysed images
 * @param links outbound links to other topics
 */
public record NoteBody(
    String anchor,
    String title,
    String summary,
    List<NoteSection> sections,
    List<ImageAttachment> images,
    List<NoteLink> links) {

  public NoteBody {
    summary = summary == null ? "" : summary;
    sections = sections == null ? List.of() : List.copyOf(sections);
    images = images == null ? List.of() : List.copyOf(images);
    links = links == null ? List.of() : List.copyOf(links);
  }

  public NoteBody withLinks(List<NoteLink> newLinks) {
    return new NoteBody(anchor, title, summary, sections, images, newLinks);
  }

  public static String anchorFor(String topicKey) {
    return "topic-" + topicKey;
  }
}
