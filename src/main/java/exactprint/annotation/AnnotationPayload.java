package exactprint.annotation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.DeltaPos;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The node-kind specific part of an {@link Annotation}: where the auxiliary tokens of a node (the
 * keywords, punctuation and separators that are not child nodes) were found in the source.
 *
 * <p>Unless documented otherwise a {@link DeltaPos} is taken from the printer's cursor at the
 * moment the token is printed. Absent optional positions mean the token does not occur.
 */
public abstract class AnnotationPayload {

  AnnotationPayload() {}

  /** The whole file: whitespace between the last printed token and the end of file. */
  public static class ModuleFile extends AnnotationPayload {
    public final DeltaPos eof;

    public ModuleFile(DeltaPos eof) {
      this.eof = checkNotNull(eof);
    }
  }

  /**
   * Stored on the module name. {@code module}, {@code (} and {@code where} are taken from the start
   * of the module, {@code )} from the cursor after the last export.
   */
  public static class ModuleHeader extends AnnotationPayload {
    public final DeltaPos module;
    public final Optional<DeltaPos> open;
    public final Optional<DeltaPos> close;
    public final DeltaPos where;

    public ModuleHeader(
        DeltaPos module, @Nullable DeltaPos open, @Nullable DeltaPos close, DeltaPos where) {
      this.module = checkNotNull(module);
      this.open = Optional.ofNullable(open);
      this.close = Optional.ofNullable(close);
      this.where = checkNotNull(where);
    }
  }

  /** The comma following an element of a comma separated list. */
  public static class ListItem extends AnnotationPayload {
    public final DeltaPos comma;

    public ListItem(DeltaPos comma) {
      this.comma = checkNotNull(comma);
    }
  }

  /** {@code T(..)} in an export or import list. */
  public static class ThingAll extends AnnotationPayload {
    public final DeltaPos open;
    public final DeltaPos dotdot;
    public final DeltaPos close;

    public ThingAll(DeltaPos open, DeltaPos dotdot, DeltaPos close) {
      this.open = checkNotNull(open);
      this.dotdot = checkNotNull(dotdot);
      this.close = checkNotNull(close);
    }
  }

  /** All positions but {@code close} are taken from the start of the import. */
  public static class Import extends AnnotationPayload {
    public final Optional<DeltaPos> qualified;
    public final Optional<DeltaPos> as;
    public final Optional<DeltaPos> asName;
    public final Optional<DeltaPos> hiding;
    public final Optional<DeltaPos> open;
    public final Optional<DeltaPos> close;

    public Import(
        @Nullable DeltaPos qualified,
        @Nullable DeltaPos as,
        @Nullable DeltaPos asName,
        @Nullable DeltaPos hiding,
        @Nullable DeltaPos open,
        @Nullable DeltaPos close) {
      this.qualified = Optional.ofNullable(qualified);
      this.as = Optional.ofNullable(as);
      this.asName = Optional.ofNullable(asName);
      this.hiding = Optional.ofNullable(hiding);
      this.open = Optional.ofNullable(open);
      this.close = Optional.ofNullable(close);
    }
  }

  public static class TypeSig extends AnnotationPayload {
    public final DeltaPos dcolon;

    public TypeSig(DeltaPos dcolon) {
      this.dcolon = checkNotNull(dcolon);
    }
  }

  public static class PatBind extends AnnotationPayload {
    public final Optional<DeltaPos> eq;
    public final Optional<DeltaPos> where;

    public PatBind(@Nullable DeltaPos eq, @Nullable DeltaPos where) {
      this.eq = Optional.ofNullable(eq);
      this.where = Optional.ofNullable(where);
    }
  }

  /** One equation of a function; {@code infix} tells whether the name sits between the patterns. */
  public static class Match extends AnnotationPayload {
    public final DeltaPos name;
    public final boolean infix;
    public final Optional<DeltaPos> eq;
    public final Optional<DeltaPos> where;

    public Match(DeltaPos name, boolean infix, @Nullable DeltaPos eq, @Nullable DeltaPos where) {
      this.name = checkNotNull(name);
      this.infix = infix;
      this.eq = Optional.ofNullable(eq);
      this.where = Optional.ofNullable(where);
    }
  }

  public static class GuardedRhs extends AnnotationPayload {
    public final Optional<DeltaPos> guard;
    public final Optional<DeltaPos> eq;

    public GuardedRhs(@Nullable DeltaPos guard, @Nullable DeltaPos eq) {
      this.guard = Optional.ofNullable(guard);
      this.eq = Optional.ofNullable(eq);
    }
  }

  public static class DataDecl extends AnnotationPayload {
    public final DeltaPos eq;

    public DataDecl(DeltaPos eq) {
      this.eq = checkNotNull(eq);
    }
  }

  /** The {@code |} following a constructor, if another one follows. */
  public static class ConDecl extends AnnotationPayload {
    public final Optional<DeltaPos> bar;

    public ConDecl(@Nullable DeltaPos bar) {
      this.bar = Optional.ofNullable(bar);
    }
  }

  /**
   * Brace and semicolon markers of a block, absolute: open brace, one separator between each pair
   * of items, close brace. A null span stands for a token supplied by the layout rule.
   */
  public static class Layout extends AnnotationPayload {
    public final List<SourceRange> markers;

    public Layout(List<SourceRange> markers) {
      this.markers = ImmutableList.copyOf(markers);
    }
  }

  public static class AsPat extends AnnotationPayload {
    public final DeltaPos at;

    public AsPat(DeltaPos at) {
      this.at = checkNotNull(at);
    }
  }

  public static class Tuple extends AnnotationPayload {
    public final DeltaPos open;
    public final DeltaPos close;

    public Tuple(DeltaPos open, DeltaPos close) {
      this.open = checkNotNull(open);
      this.close = checkNotNull(close);
    }
  }

  public static class Paren extends AnnotationPayload {
    public final DeltaPos open;
    public final DeltaPos close;

    public Paren(DeltaPos open, DeltaPos close) {
      this.open = checkNotNull(open);
      this.close = checkNotNull(close);
    }
  }

  public static class FunTy extends AnnotationPayload {
    public final DeltaPos arrow;

    public FunTy(DeltaPos arrow) {
      this.arrow = checkNotNull(arrow);
    }
  }

  /** Context of a qualified type, {@code (Eq a, Show a) =>}. */
  public static class Context extends AnnotationPayload {
    public final Optional<DeltaPos> open;
    public final Optional<DeltaPos> darrow;
    public final Optional<DeltaPos> close;

    public Context(@Nullable DeltaPos open, @Nullable DeltaPos darrow, @Nullable DeltaPos close) {
      this.open = Optional.ofNullable(open);
      this.darrow = Optional.ofNullable(darrow);
      this.close = Optional.ofNullable(close);
    }
  }

  /** {@code let ... in}; {@code in} is taken from the start of the let. */
  public static class Let extends AnnotationPayload {
    public final Optional<DeltaPos> let;
    public final Optional<DeltaPos> in;

    public Let(@Nullable DeltaPos let, @Nullable DeltaPos in) {
      this.let = Optional.ofNullable(let);
      this.in = Optional.ofNullable(in);
    }
  }

  public static class Do extends AnnotationPayload {
    public final Optional<DeltaPos> doKeyword;

    public Do(@Nullable DeltaPos doKeyword) {
      this.doKeyword = Optional.ofNullable(doKeyword);
    }
  }

  public static class BindStmt extends AnnotationPayload {
    public final DeltaPos larrow;

    public BindStmt(DeltaPos larrow) {
      this.larrow = checkNotNull(larrow);
    }
  }

  /** {@code [from, then .. to]}. */
  public static class ArithSeq extends AnnotationPayload {
    public final DeltaPos open;
    public final Optional<DeltaPos> comma;
    public final DeltaPos dotdot;
    public final DeltaPos close;

    public ArithSeq(DeltaPos open, @Nullable DeltaPos comma, DeltaPos dotdot, DeltaPos close) {
      this.open = checkNotNull(open);
      this.comma = Optional.ofNullable(comma);
      this.dotdot = checkNotNull(dotdot);
      this.close = checkNotNull(close);
    }
  }

  /** Absolute positions of a bracketed list: open bracket, separators, close bracket. */
  public static class Brackets extends AnnotationPayload {
    public final List<SourcePosition> points;

    public Brackets(List<SourcePosition> points) {
      this.points = ImmutableList.copyOf(points);
    }
  }

  /** The exact spelling of a numeric literal. */
  public static class OverLit extends AnnotationPayload {
    public final String source;

    public OverLit(String source) {
      this.source = checkNotNull(source);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
