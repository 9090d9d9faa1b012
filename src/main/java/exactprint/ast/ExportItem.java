package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceRange;

/** An entry of an export or import list. */
public abstract class ExportItem extends Node {

  public final Name name;

  ExportItem(Name name, SourceRange range) {
    super(range);
    this.name = checkNotNull(name);
  }

  /** A value, {@code foo}. */
  public static class Var extends ExportItem {
    public Var(Name name, SourceRange range) {
      super(name, range);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitVarExport(this, arg);
    }
  }

  /** A type or class without its constructors or methods, {@code T}. */
  public static class ThingAbs extends ExportItem {
    public ThingAbs(Name name, SourceRange range) {
      super(name, range);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitThingAbs(this, arg);
    }
  }

  /** A type or class with everything it contains, {@code T(..)}. */
  public static class ThingAll extends ExportItem {
    public ThingAll(Name name, SourceRange range) {
      super(name, range);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitThingAll(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitVarExport(Var that, A arg);

    R visitThingAbs(ThingAbs that, A arg);

    R visitThingAll(ThingAll that, A arg);
  }
}
