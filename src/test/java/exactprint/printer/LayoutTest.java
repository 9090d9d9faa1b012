package exactprint.printer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.jooq.lambda.tuple.Tuple.tuple;

import com.google.common.collect.ImmutableList;
import exactprint.annotation.AnnotationTable;
import exactprint.comment.Comment;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.List;
import org.jooq.lambda.tuple.Tuple2;
import org.junit.Before;
import org.junit.Test;

public class LayoutTest {

  private PrintContext ctx;

  @Before
  public void setup() {
    ctx = new PrintContext(ImmutableList.of(), new AnnotationTable());
  }

  private static SourcePosition pos(int line, int column) {
    return new SourcePosition(line, column);
  }

  private Tuple2<SourcePosition, Runnable> item(int line, int column, String text) {
    return tuple(pos(line, column), (Runnable) () -> ctx.printString(text));
  }

  @Test
  public void parenList_commasAtRecordedColumns() {
    Layout.parenList(
        ctx,
        ImmutableList.of(pos(1, 1), pos(1, 3), pos(1, 6), pos(1, 9)),
        ImmutableList.of(item(1, 2, "a"), item(1, 5, "b"), item(1, 8, "c")));
    assertThat(ctx.output(), is(equalTo("(a, b, c)")));
  }

  @Test
  public void parenList_irregularSpacingIsKept() {
    Layout.parenList(
        ctx,
        ImmutableList.of(pos(1, 1), pos(1, 5), pos(1, 7), pos(1, 12)),
        ImmutableList.of(item(1, 3, "a"), item(1, 6, "b"), item(1, 10, "c")));
    assertThat(ctx.output(), is(equalTo("( a ,b,  c )")));
  }

  @Test
  public void squareList_emptyListNeedsBothBrackets() {
    Layout.squareList(ctx, ImmutableList.of(pos(1, 1), pos(1, 2)), ImmutableList.of());
    assertThat(ctx.output(), is(equalTo("[]")));
  }

  @Test
  public void parenHashList_printsUnboxedBrackets() {
    Layout.parenHashList(
        ctx,
        ImmutableList.of(pos(1, 1), pos(1, 5), pos(1, 8)),
        ImmutableList.of(item(1, 4, "a"), item(1, 7, "b")));
    assertThat(ctx.output(), is(equalTo("(# a, b#)")));
  }

  @Test(expected = MalformedListArityError.class)
  public void bracketList_tooFewPositionsFails() {
    Layout.parenList(
        ctx,
        ImmutableList.of(pos(1, 1), pos(1, 5)),
        ImmutableList.of(item(1, 2, "a"), item(1, 4, "b")));
  }

  @Test(expected = MalformedListArityError.class)
  public void bracketList_emptyListWithOnePositionFails() {
    Layout.curlyList(ctx, ImmutableList.of(pos(1, 1)), ImmutableList.of());
  }

  @Test
  public void bracketList_commentInsideIsPrinted() {
    ctx =
        new PrintContext(
            ImmutableList.of(Comment.block(SourceRange.of(1, 2, 1, 7), "{- -}")),
            new AnnotationTable());
    Layout.squareList(
        ctx, ImmutableList.of(pos(1, 1), pos(1, 9)), ImmutableList.of(item(1, 8, "x")));
    assertThat(ctx.output(), is(equalTo("[{- -} x]")));
  }

  @Test
  public void layoutList_nullMarkersPrintNothing() {
    Layout.layoutList(
        ctx,
        ImmutableList.of(
            SourceRange.nullAt(pos(1, 1)),
            SourceRange.nullAt(pos(2, 1)),
            SourceRange.nullAt(pos(3, 1)),
            SourceRange.nullAt(pos(3, 4))),
        ImmutableList.of(item(1, 1, "foo"), item(2, 1, "bar"), item(3, 1, "baz")));
    assertThat(ctx.output(), is(equalTo("foo\nbar\nbaz")));
  }

  @Test
  public void layoutList_explicitBracesAndSemicolons() {
    Layout.layoutList(
        ctx,
        ImmutableList.of(
            SourceRange.of(1, 1, 1, 2), SourceRange.of(1, 4, 1, 5), SourceRange.of(1, 8, 1, 9)),
        ImmutableList.of(item(1, 3, "x"), item(1, 6, "y")));
    assertThat(ctx.output(), is(equalTo("{ x; y }")));
  }

  @Test
  public void layoutList_trailingSemicolon() {
    Layout.layoutList(
        ctx,
        ImmutableList.of(
            SourceRange.of(1, 1, 1, 2),
            SourceRange.of(1, 4, 1, 5),
            SourceRange.of(1, 7, 1, 8),
            SourceRange.of(1, 9, 1, 10)),
        ImmutableList.of(item(1, 3, "x"), item(1, 6, "y")));
    assertThat(ctx.output(), is(equalTo("{ x; y; }")));
  }

  @Test
  public void layoutList_doubledSemicolonBetweenItems() {
    Layout.layoutList(
        ctx,
        ImmutableList.of(
            SourceRange.of(1, 1, 1, 2),
            SourceRange.of(1, 4, 1, 5),
            SourceRange.of(1, 5, 1, 6),
            SourceRange.of(1, 8, 1, 9)),
        ImmutableList.of(item(1, 2, "x"), item(1, 7, "y")));
    assertThat(ctx.output(), is(equalTo("{x ;; y}")));
  }

  @Test
  public void bracketList_surplusSeparatorFollowsLastItem() {
    Layout.curlyList(
        ctx,
        ImmutableList.of(pos(1, 1), pos(1, 3), pos(1, 5), pos(1, 6)),
        ImmutableList.of(item(1, 2, "a"), item(1, 4, "b")));
    assertThat(ctx.output(), is(equalTo("{a,b,}")));
  }

  @Test(expected = MalformedListArityError.class)
  public void layoutList_markerCountMustFitItems() {
    Layout.layoutList(
        ctx,
        ImmutableList.of(SourceRange.nullAt(pos(1, 1)), SourceRange.nullAt(pos(1, 4))),
        ImmutableList.of(item(1, 1, "x"), item(2, 1, "y")));
  }

  @Test
  public void mergeByPosition_firstStreamWinsTies() {
    List<Tuple2<SourcePosition, String>> merged =
        Layout.mergeByPosition(
            ImmutableList.of(tuple(pos(1, 1), "a1"), tuple(pos(3, 1), "a3")),
            ImmutableList.of(tuple(pos(1, 1), "b1"), tuple(pos(2, 1), "b2")));
    assertThat(
        merged,
        contains(
            tuple(pos(1, 1), "a1"),
            tuple(pos(1, 1), "b1"),
            tuple(pos(2, 1), "b2"),
            tuple(pos(3, 1), "a3")));
  }

  @Test
  public void printStrs_printsInGivenOrder() {
    Layout.printStrs(
        ctx,
        ImmutableList.of(tuple(pos(1, 1), "data"), tuple(pos(1, 6), "T"), tuple(pos(2, 3), "=")));
    assertThat(ctx.output(), is(equalTo("data T\n  =")));
  }

  @Test
  public void interleave_appendsRestOfLongerList() {
    assertThat(
        Layout.interleave(ImmutableList.of(1, 3, 5, 7), ImmutableList.of(2, 4)),
        contains(1, 2, 3, 4, 5, 7));
  }
}
