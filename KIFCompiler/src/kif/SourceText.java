package kif;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * KIF text as read from a file, possibly restricted to a range of its lines. Offsets are relative
 * to {@link #content()}; positions report line numbers of the whole file.
 */
public final class SourceText {
  public static class Pos {
    private final String file;
    private final int lineNumber;
    private final int column; // Line and column are 0-based.

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    @Override
    public String toString() {
      return (lineNumber + 1) + ":" + (column + 1);
    }
  }

  private final String file;
  private final String content;
  private final int firstLine;
  private final ImmutableList<String> lines;
  private final ImmutableList<Integer> lineStarts;

  private SourceText(String file, String content, int firstLine) {
    this.file = file;
    this.content = content;
    this.firstLine = firstLine;
    this.lines = splitLines(content);

    ImmutableList.Builder<Integer> starts = ImmutableList.builder();
    int offset = 0;
    for (String line : lines) {
      starts.add(offset);
      offset += line.length();
    }
    this.lineStarts = starts.build();
  }

  public static SourceText of(String file, String content) {
    return new SourceText(file, content, 0);
  }

  public static SourceText read(File file) throws IOException {
    return of(file.toString(), Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  // Each line keeps its '\n'; a final line without one is kept as is.
  private static ImmutableList<String> splitLines(String content) {
    List<String> pieces = Splitter.on('\n').splitToList(content);
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int i = 0; i < pieces.size() - 1; i++) {
      builder.add(pieces.get(i) + "\n");
    }
    String last = pieces.get(pieces.size() - 1);
    if (!last.isEmpty()) builder.add(last);
    return builder.build();
  }

  public String file() {
    return file;
  }

  public String content() {
    return content;
  }

  public int firstLine() {
    return firstLine;
  }

  public int lineCount() {
    return lines.size();
  }

  /**
   * Restricts the text to lines {@code startLine} through {@code endLine}, 1-based and inclusive.
   * A start before the first line means the first line; a missing end, or one past the last line,
   * means the last line. An end before the start gives empty text.
   */
  public SourceText lines(int startLine, Optional<Integer> endLine) {
    Preconditions.checkArgument(
        !endLine.isPresent() || endLine.get() >= 0, "negative end line: %s", endLine);

    int from = Math.min(Math.max(1, startLine) - 1, lines.size());
    int to = Math.min(endLine.orElse(lines.size()), lines.size());
    String sliced = to <= from ? "" : String.join("", lines.subList(from, to));
    return new SourceText(file, sliced, firstLine + from);
  }

  public Pos pos(int offset) {
    Preconditions.checkArgument(
        offset >= 0 && offset <= content.length(), "offset %s out of range", offset);
    if (lineStarts.isEmpty()) return new Pos(file, firstLine, 0);

    int index = Collections.binarySearch(lineStarts, offset);
    int line = index >= 0 ? index : -index - 2;
    return new Pos(file, firstLine + line, offset - lineStarts.get(line));
  }

  public String slice(SourceSpan span) {
    return span.slice(content);
  }
}
