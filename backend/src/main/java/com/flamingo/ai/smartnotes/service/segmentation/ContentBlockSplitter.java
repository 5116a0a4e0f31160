package com.flamingo.ai.smartnotes.service.segmentation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits content into numbered blocks that the segmentation model assigns to topics.
 *
 * <p>Blocks start at paragraph boundaries (blank lines). Content without paragraphs falls back to
 * line boundaries, then to sentence groups of at most {@link #MAX_BLOCK_CHARS}. Whitespace between
 * paragraphs belongs to the preceding block, so the blocks cover the whole content.
 */
@Component
@Slf4j
public class ContentBlockSplitter {

  /** Paragraphs longer than this are split further at sentence boundaries. */
  static final int MAX_BLOCK_CHARS = 1_500;

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern LINE_BREAK = Pattern.compile("\\n");
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

  public List<ContentBlock> split(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    List<Integer> starts = boundaries(content, PARAGRAPH_BREAK, 0, content.length());
    if (starts.size() == 1 && content.length() > MAX_BLOCK_CHARS) {
      starts = boundaries(content, LINE_BREAK, 0, content.length());
    }
    starts = refineLongBlocks(content, starts);

    List<ContentBlock> blocks = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      int start = i == 0 ? 0 : starts.get(i);
      int end = i + 1 < starts.size() ? starts.get(i + 1) : content.length();
      blocks.add(new ContentBlock(i, start, end, content.substring(start, end)));
    }
    log.debug("Split {} chars into {} blocks", content.length(), blocks.size());
    return blocks;
  }

  // ---- boundary detection ----

  /** Start offsets of the non-whitespace text following each separator in [from, to). */
  private List<Integer> boundaries(String content, Pattern separator, int from, int to) {
    List<Integer> starts = new ArrayList<>();
    starts.add(from);
    Matcher matcher = separator.matcher(content).region(from, to);
    while (matcher.find()) {
      int next = skipWhitespace(content, matcher.end(), to);
      if (next < to && next > starts.get(starts.size() - 1)) {
        starts.add(next);
      }
    }
    return starts;
  }

  private List<Integer> refineLongBlocks(String content, List<Integer> starts) {
    List<Integer> refined = new ArrayList<>();
    for (int i = 0; i < starts.size(); i++) {
      int start = starts.get(i);
      int end = i + 1 < starts.size() ? starts.get(i + 1) : content.length();
      refined.add(start);
      if (end - start > MAX_BLOCK_CHARS) {
        refined.addAll(sentenceGroupStarts(content, start, end));
      }
    }
    return refined;
  }

  /** Additional block starts inside [start, end) grouping sentences up to the size limit. */
  private List<Integer> sentenceGroupStarts(String content, int start, int end) {
    List<Integer> extra = new ArrayList<>();
    int groupStart = start;
    Matcher matcher = SENTENCE_END.matcher(content).region(start, end);
    int lastCut = -1;
    while (matcher.find()) {
      int sentenceStart = matcher.end();
      if (sentenceStart - groupStart > MAX_BLOCK_CHARS && lastCut > groupStart) {
        extra.add(lastCut);
        groupStart = lastCut;
      }
      lastCut = sentenceStart;
    }
    if (end - groupStart > MAX_BLOCK_CHARS && lastCut > groupStart && lastCut < end) {
      extra.add(lastCut);
    }
    return extra;
  }

  private static int skipWhitespace(String content, int index, int limit) {
    int i = index;
    while (i < limit && Character.isWhitespace(content.charAt(i))) {
      i++;
    }
    return i;
  }
}
