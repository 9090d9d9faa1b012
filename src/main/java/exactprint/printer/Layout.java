package exactprint.printer;

import static org.jooq.lambda.Seq.seq;
import static org.jooq.lambda.tuple.Tuple.tuple;

import exactprint.ast.Node;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.tuple.Tuple2;

/**
 * Combinators for printing sequences of positioned things. Each element is a position and an
 * action; the printer moves to the position (printing pending comments on the way) and then runs
 * the action.
 */
public class Layout {

  private Layout() {}

  /** Prints the items strictly in the given order. */
  public static void printSeq(PrintContext context, List<Tuple2<SourcePosition, Runnable>> items) {
    for (Tuple2<SourcePosition, Runnable> item : items) {
      context.printWhitespace(item.v1);
      item.v2.run();
    }
  }

  public static void printStrs(PrintContext context, List<Tuple2<SourcePosition, String>> strs) {
    printSeq(context, strings(context, strs));
  }

  /**
   * Merges two position ordered streams into one. On equal positions the element of {@code as}
   * comes first.
   */
  public static <T> List<Tuple2<SourcePosition, T>> mergeByPosition(
      List<Tuple2<SourcePosition, T>> as, List<Tuple2<SourcePosition, T>> bs) {
    List<Tuple2<SourcePosition, T>> merged = new ArrayList<>(as.size() + bs.size());
    int i = 0;
    int j = 0;
    while (i < as.size() && j < bs.size()) {
      if (!bs.get(j).v1.isBefore(as.get(i).v1)) {
        merged.add(as.get(i++));
      } else {
        merged.add(bs.get(j++));
      }
    }
    merged.addAll(as.subList(i, as.size()));
    merged.addAll(bs.subList(j, bs.size()));
    return merged;
  }

  public static void printStreams(
      PrintContext context,
      List<Tuple2<SourcePosition, Runnable>> xs,
      List<Tuple2<SourcePosition, Runnable>> ys) {
    printSeq(context, mergeByPosition(xs, ys));
  }

  /** Pairs each node with its start and the action visiting it. */
  public static List<Tuple2<SourcePosition, Runnable>> located(
      List<? extends Node> nodes, Consumer<Node> visit) {
    return seq(nodes)
        .map(n -> tuple(n.range().begin, (Runnable) () -> visit.accept(n)))
        .toList();
  }

  /**
   * Prints {@code open}, the items separated by {@code separator}, and {@code close}, each piece of
   * punctuation at its recorded position. {@code points} holds the open bracket, at least one
   * separator between each pair of items and the close bracket; surplus separators follow the last
   * item.
   */
  public static void bracketList(
      PrintContext context,
      String open,
      String separator,
      String close,
      List<SourcePosition> points,
      List<Tuple2<SourcePosition, Runnable>> items) {
    checkArity("bracketList", points.size(), items.size(), null);
    List<Tuple2<SourcePosition, String>> punctuation = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); ++i) {
      String text = i == 0 ? open : i == points.size() - 1 ? close : separator;
      punctuation.add(tuple(points.get(i), text));
    }
    printSeq(context, interleave(strings(context, punctuation), items));
  }

  public static void parenList(
      PrintContext context,
      List<SourcePosition> points,
      List<Tuple2<SourcePosition, Runnable>> items) {
    bracketList(context, "(", ",", ")", points, items);
  }

  public static void squareList(
      PrintContext context,
      List<SourcePosition> points,
      List<Tuple2<SourcePosition, Runnable>> items) {
    bracketList(context, "[", ",", "]", points, items);
  }

  public static void curlyList(
      PrintContext context,
      List<SourcePosition> points,
      List<Tuple2<SourcePosition, Runnable>> items) {
    bracketList(context, "{", ",", "}", points, items);
  }

  public static void parenHashList(
      PrintContext context,
      List<SourcePosition> points,
      List<Tuple2<SourcePosition, Runnable>> items) {
    bracketList(context, "(#", ",", "#)", points, items);
  }

  /**
   * Prints a block under the layout rule. {@code markers} are the open brace, the semicolons
   * between items and the close brace; a null span marks a token the layout rule inserted and is
   * not printed. Markers and items are merged by position, so extra semicolons ({@code do { x; y;
   * }}) print where they were.
   */
  public static void layoutList(
      PrintContext context,
      List<SourceRange> markers,
      List<Tuple2<SourcePosition, Runnable>> items) {
    SourceRange first = markers.isEmpty() ? null : markers.get(0);
    checkArity("layoutList", markers.size(), items.size(), first);
    List<Tuple2<SourcePosition, Runnable>> tokens = new ArrayList<>(markers.size());
    for (int i = 0; i < markers.size(); ++i) {
      SourceRange marker = markers.get(i);
      String text = marker.isNull() ? "" : i == 0 ? "{" : i == markers.size() - 1 ? "}" : ";";
      tokens.add(tuple(marker.begin, (Runnable) () -> context.printString(text)));
    }
    printStreams(context, tokens, items);
  }

  private static void checkArity(
      String combinator, int points, int items, @Nullable SourceRange range) {
    int expected = Math.max(items + 1, 2);
    if (points < expected) {
      throw new MalformedListArityError(
          combinator, "at least " + expected + " (for " + items + " items)", points, range);
    }
  }

  private static List<Tuple2<SourcePosition, Runnable>> strings(
      PrintContext context, List<Tuple2<SourcePosition, String>> strs) {
    return seq(strs).map(s -> s.map2(text -> (Runnable) () -> context.printString(text))).toList();
  }

  /** Alternates between both lists, starting with {@code xs}, until one runs out. */
  static <T> List<T> interleave(List<T> xs, List<T> ys) {
    List<T> result = new ArrayList<>(xs.size() + ys.size());
    Iterator<T> x = xs.iterator();
    Iterator<T> y = ys.iterator();
    while (x.hasNext() && y.hasNext()) {
      result.add(x.next());
      result.add(y.next());
    }
    x.forEachRemaining(result::add);
    y.forEachRemaining(result::add);
    return result;
  }
}
