package com.flamingo.ai.smartnotes.service.render;

import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;
import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.ImageAttachment;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteLink;
import com.flamingo.ai.smartnotes.domain.model.NoteSection;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.stereotype.Component;

/**
 * {@link NoteRenderer} built on commonmark-java.
 *
 * <p>The body is first assembled as Markdown. HTML is rendered with commonmark's {@link
 * HtmlRenderer} (raw HTML from the model is escaped) and wrapped in a standalone page; LaTeX is
 * produced by {@link LatexVisitor} walking the same Markdown AST.
 */
@Component
@Slf4j
public class CommonmarkNoteRenderer implements NoteRenderer {

  static final String ENRICHMENT_NOTICE = "Supplementary material, not taken from the document.";

  private static final Parser PARSER = Parser.builder().build();
  private static final HtmlRenderer HTML_RENDERER =
      HtmlRenderer.builder().escapeHtml(true).build();

  @Override
  public String render(NoteBody body, NoteFormat format) {
    return switch (format) {
      case MARKDOWN -> toMarkdown(body, format, true);
      case HTML -> toHtml(body);
      case LATEX -> toLatex(body);
    };
  }

  String toMarkdown(NoteBody body, NoteFormat format, boolean includeTitle) {
    StringBuilder md = new StringBuilder();
    if (includeTitle) {
      md.append("# ").append(singleLine(body.title())).append("\n\n");
    }
    if (!body.summary().isBlank()) {
      md.append(body.summary().strip()).append("\n\n");
    }
    for (NoteSection section : body.sections()) {
      md.append("## ").append(singleLine(section.heading())).append("\n\n");
      if (section.provenance() == ContentProvenance.ENRICHMENT) {
        md.append("> ").append(ENRICHMENT_NOTICE).append("\n\n");
      }
      md.append(section.body() == null ? "" : section.body().strip()).append("\n\n");
    }
    if (!body.images().isEmpty()) {
      md.append("## Figures\n\n");
      for (ImageAttachment image : body.images()) {
        md.append("![")
            .append(singleLine(image.description()))
            .append("](<")
            .append(image.location())
            .append(">)\n\n")
            .append('*')
            .append(singleLine(image.description()))
            .append("*\n\n");
      }
    }
    if (!body.links().isEmpty()) {
      md.append("## Related topics\n\n");
      for (NoteLink link : body.links()) {
        md.append("- [")
            .append(singleLine(link.anchorText()))
            .append("](")
            .append(NoteRenderer.linkTarget(link.targetKey(), format))
            .append(")\n");
      }
    }
    return md.toString().strip() + "\n";
  }

  private String toHtml(NoteBody body) {
    Node document = PARSER.parse(toMarkdown(body, NoteFormat.HTML, true));
    String content = HTML_RENDERER.render(document);
    return "<!DOCTYPE html>\n"
        + "<html lang=\"en\">\n"
        + "<head>\n"
        + "<meta charset=\"utf-8\">\n"
        + "<title>"
        + escapeHtml(body.title())
        + "</title>\n"
        + "</head>\n"
        + "<body>\n"
        + "<article id=\""
        + escapeHtml(body.anchor())
        + "\">\n"
        + content
        + "</article>\n"
        + "</body>\n"
        + "</html>\n";
  }

  private String toLatex(NoteBody body) {
    Node document = PARSER.parse(toMarkdown(body, NoteFormat.LATEX, false));
    LatexVisitor visitor = new LatexVisitor();
    document.accept(visitor);
    return "\\documentclass{article}\n"
        + "\\usepackage[utf8]{inputenc}\n"
        + "\\usepackage{graphicx}\n"
        + "\\usepackage{hyperref}\n"
        + "\\title{"
        + LatexVisitor.escape(body.title())
        + "}\n"
        + "\\begin{document}\n"
        + "\\maketitle\n"
        + "\\label{"
        + body.anchor()
        + "}\n\n"
        + visitor.result().strip()
        + "\n\n\\end{document}\n";
  }

  private static String singleLine(String text) {
    return text == null ? "" : text.replaceAll("\\s+", " ").strip();
  }

  static String escapeHtml(String text) {
    if (text == null) {
      return "";
    }
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }
}
