package kif;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

// [start, end) in chars of the compiled text.
@AutoValue
public abstract class SourceSpan {
  public abstract int start();

  public abstract int end();

  public String slice(String text) {
    Preconditions.checkArgument(
        end() <= text.length(), "span %s is outside of text of length %s", this, text.length());
    return text.substring(start(), end());
  }

  public static SourceSpan create(int start, int end) {
    Preconditions.checkArgument(start >= 0 && start <= end, "bad span [%s, %s)", start, end);
    return new AutoValue_SourceSpan(start, end);
  }

  @Override
  public String toString() {
    return "[" + start() + ", " + end() + ")";
  }
}
