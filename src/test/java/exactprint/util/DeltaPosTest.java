package exactprint.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import org.junit.Test;

public class DeltaPosTest {

  private static final SourcePosition CURSOR = new SourcePosition(3, 7);

  @Test
  public void sameLineDelta_movesRightFromCursor() {
    assertThat(DeltaPos.sameLine(2).applyTo(CURSOR), is(equalTo(new SourcePosition(3, 9))));
  }

  @Test
  public void zeroDelta_staysAtCursor() {
    assertThat(DeltaPos.ZERO.applyTo(CURSOR), is(equalTo(CURSOR)));
  }

  @Test
  public void lineDelta_indentsFromStartOfLine() {
    assertThat(new DeltaPos(2, 4).applyTo(CURSOR), is(equalTo(new SourcePosition(5, 5))));
    assertThat(new DeltaPos(1, 0).applyTo(CURSOR), is(equalTo(new SourcePosition(4, 1))));
  }

  @Test
  public void between_isInverseOfApplyTo() {
    SourcePosition sameLine = new SourcePosition(3, 12);
    SourcePosition below = new SourcePosition(6, 2);
    assertThat(DeltaPos.between(CURSOR, sameLine), is(equalTo(DeltaPos.sameLine(5))));
    assertThat(DeltaPos.between(CURSOR, below), is(equalTo(new DeltaPos(3, 1))));
    assertThat(DeltaPos.between(CURSOR, below).applyTo(CURSOR), is(equalTo(below)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void between_rejectsEarlierTarget() {
    DeltaPos.between(CURSOR, new SourcePosition(2, 40));
  }

  @Test
  public void positions_orderedByLineThenColumn() {
    assertThat(new SourcePosition(2, 40).isBefore(CURSOR), is(true));
    assertThat(new SourcePosition(3, 6).isBefore(CURSOR), is(true));
    assertThat(CURSOR.isBefore(CURSOR), is(false));
    assertThat(CURSOR.shift(new DeltaPos(1, 2)), is(equalTo(new SourcePosition(4, 9))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void sourcePosition_rejectsColumnZero() {
    new SourcePosition(1, 0);
  }

  @Test
  public void nullSpan_isDetected() {
    assertThat(SourceRange.nullAt(CURSOR).isNull(), is(true));
    assertThat(new SourceRange(CURSOR, 1).isNull(), is(false));
  }
}
