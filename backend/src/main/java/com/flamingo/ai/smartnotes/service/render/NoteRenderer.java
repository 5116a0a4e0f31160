package com.flamingo.ai.smartnotes.service.render;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;

/** Renders a structured note body to a string in a given format. Deterministic. */
public interface NoteRenderer {

  String render(NoteBody body, NoteFormat format);

  /** Relative link target of a topic's note in the given format. */
  static String linkTarget(String topicKey, NoteFormat format) {
    String anchor = NoteBody.anchorFor(topicKey);
    return switch (format) {
      case MARKDOWN, HTML -> anchor + format.getExtension();
      case LATEX -> anchor;
    };
  }
}
