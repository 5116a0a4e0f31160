package com.flamingo.ai.smartnotes.service.render;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;

/** Walks a commonmark AST and writes the body of a LaTeX article. */
class LatexVisitor extends AbstractVisitor {

  private static final String TOPIC_LINK_PREFIX = "topic-";

  private final StringBuilder out = new StringBuilder();

  String result() {
    return out.toString();
  }

  @Override
  public void visit(Heading heading) {
    String command =
        switch (heading.getLevel()) {
          case 1, 2 -> "\\section*{";
          case 3 -> "\\subsection*{";
          default -> "\\paragraph{";
        };
    out.append(command);
    visitChildren(heading);
    out.append("}\n\n");
  }

  @Override
  public void visit(Paragraph paragraph) {
    visitChildren(paragraph);
    out.append(paragraph.getParent() instanceof ListItem ? "\n" : "\n\n");
  }

  @Override
  public void visit(Text text) {
    out.append(escape(text.getLiteral()));
  }

  @Override
  public void visit(Emphasis emphasis) {
    out.append("\\emph{");
    visitChildren(emphasis);
    out.append('}');
  }

  @Override
  public void visit(StrongEmphasis strongEmphasis) {
    out.append("\\textbf{");
    visitChildren(strongEmphasis);
    out.append('}');
  }

  @Override
  public void visit(Code code) {
    out.append("\\texttt{").append(escape(code.getLiteral())).append('}');
  }

  @Override
  public void visit(FencedCodeBlock codeBlock) {
    verbatim(codeBlock.getLiteral());
  }

  @Override
  public void visit(IndentedCodeBlock codeBlock) {
    verbatim(codeBlock.getLiteral());
  }

  @Override
  public void visit(BulletList bulletList) {
    out.append("\\begin{itemize}\n");
    visitChildren(bulletList);
    out.append("\\end{itemize}\n\n");
  }

  @Override
  public void visit(OrderedList orderedList) {
    out.append("\\begin{enumerate}\n");
    visitChildren(orderedList);
    out.append("\\end{enumerate}\n\n");
  }

  @Override
  public void visit(ListItem listItem) {
    out.append("\\item ");
    visitChildren(listItem);
  }

  @Override
  public void visit(BlockQuote blockQuote) {
    out.append("\\begin{quote}\n");
    visitChildren(blockQuote);
    out.append("\\end{quote}\n\n");
  }

  @Override
  public void visit(Link link) {
    String destination = link.getDestination();
    if (destination.startsWith(TOPIC_LINK_PREFIX)) {
      out.append("\\hyperref[").append(destination).append("]{");
    } else {
      out.append("\\href{").append(escapeUrl(destination)).append("}{");
    }
    visitChildren(link);
    out.append('}');
  }

  @Override
  public void visit(Image image) {
    StringBuilder caption = new StringBuilder();
    for (Node child = image.getFirstChild(); child != null; child = child.getNext()) {
      if (child instanceof Text text) {
        caption.append(text.getLiteral());
      }
    }
    out.append("\\begin{figure}[h]\n\\centering\n")
        .append("\\includegraphics[width=0.8\\linewidth]{")
        .append(image.getDestination())
        .append("}\n\\caption{")
        .append(escape(caption.toString()))
        .append("}\n\\end{figure}\n");
  }

  @Override
  public void visit(SoftLineBreak softLineBreak) {
    out.append('\n');
  }

  @Override
  public void visit(HardLineBreak hardLineBreak) {
    out.append("\\\\\n");
  }

  @Override
  public void visit(ThematicBreak thematicBreak) {
    out.append("\\noindent\\rule{\\linewidth}{0.4pt}\n\n");
  }

  @Override
  public void visit(HtmlInline htmlInline) {
    out.append(escape(htmlInline.getLiteral()));
  }

  @Override
  public void visit(HtmlBlock htmlBlock) {
    out.append(escape(htmlBlock.getLiteral())).append("\n\n");
  }

  private void verbatim(String literal) {
    out.append("\\begin{verbatim}\n").append(literal);
    if (!literal.endsWith("\n")) {
      out.append('\n');
    }
    out.append("\\end{verbatim}\n\n");
  }

  static String escape(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    for (char c : text.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\textbackslash{}");
        case '{', '}', '$', '&', '#', '_', '%' -> sb.append('\\').append(c);
        case '~' -> sb.append("\\textasciitilde{}");
        case '^' -> sb.append("\\textasciicircum{}");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  private static String escapeUrl(String url) {
    return url.replace("%", "\\%").replace("#", "\\#");
  }
}
