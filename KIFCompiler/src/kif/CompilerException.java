package kif;

import java.io.PrintStream;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    EMPTY_INPUT,
    UNMATCHED_CLOSE_PAREN,
    UNCLOSED_OPEN_PAREN;
  }

  private final Reason reason;
  private final int offset;
  private final String errorMsg;

  public CompilerException(Reason reason, int offset, String errorMsg) {
    super(errorMsg);
    this.reason = reason;
    this.offset = offset;
    this.errorMsg = errorMsg;
  }

  public Reason reason() {
    return reason;
  }

  public int offset() {
    return offset;
  }

  public void print(PrintStream out, SourceText source) {
    SourceText.Pos pos = source.pos(offset);
    out.println(
        String.format(
            "ERROR: %s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg));
  }
}
