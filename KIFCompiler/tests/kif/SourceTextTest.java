package kif;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class SourceTextTest {

  private static final SourceText TEXT = SourceText.of("axioms.kif", "(a)\n(b c)\n\n(d)");

  @Test
  public void lineCount() {
    assertThat(TEXT.lineCount()).isEqualTo(4);
    assertThat(SourceText.of("f", "x\ny\n").lineCount()).isEqualTo(2);
    assertThat(SourceText.of("f", "").lineCount()).isEqualTo(0);
  }

  @Test
  public void lineRanges() {
    assertThat(TEXT.lines(2, Optional.of(2)).content()).isEqualTo("(b c)\n");
    assertThat(TEXT.lines(2, Optional.empty()).content()).isEqualTo("(b c)\n\n(d)");
    assertThat(TEXT.lines(0, Optional.of(1)).content()).isEqualTo("(a)\n");
    assertThat(TEXT.lines(3, Optional.of(99)).content()).isEqualTo("\n(d)");
    assertThat(TEXT.lines(3, Optional.of(2)).content()).isEmpty();
    assertThat(TEXT.lines(10, Optional.empty()).content()).isEmpty();
  }

  @Test
  public void veryNegativeStartMeansTheFirstLine() {
    assertThat(TEXT.lines(-5, Optional.of(1)).content()).isEqualTo("(a)\n");
    assertThat(TEXT.lines(Integer.MIN_VALUE, Optional.empty()).content())
        .isEqualTo(TEXT.content());
    assertThat(TEXT.lines(Integer.MIN_VALUE, Optional.empty()).firstLine()).isEqualTo(0);
  }

  @Test
  public void positionsUseFileLineNumbers() {
    SourceText.Pos first = TEXT.pos(0);
    assertThat(first.file()).isEqualTo("axioms.kif");
    assertThat(first.toString()).isEqualTo("1:1");
    assertThat(TEXT.pos(7).toString()).isEqualTo("2:4");
    assertThat(TEXT.pos(10).toString()).isEqualTo("3:1");
    assertThat(TEXT.pos(11).toString()).isEqualTo("4:1");

    SourceText tail = TEXT.lines(2, Optional.empty());
    assertThat(tail.firstLine()).isEqualTo(1);
    assertThat(tail.pos(0).toString()).isEqualTo("2:1");
    assertThat(tail.pos(6).toString()).isEqualTo("3:1");
    assertThat(tail.pos(7).lineNumber()).isEqualTo(3);
  }

  @Test
  public void positionAtEndOfText() {
    assertThat(TEXT.pos(TEXT.content().length()).toString()).isEqualTo("4:4");
    assertThat(SourceText.of("f", "").pos(0).toString()).isEqualTo("1:1");
  }

  @Test
  public void sliceBySpan() {
    assertThat(TEXT.slice(SourceSpan.create(4, 9))).isEqualTo("(b c)");
  }
}
