package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** {@code import qualified M as N hiding (x, y)}. */
public class Import extends Node {

  public final Name module;
  public final boolean qualified;
  public final Optional<String> as;
  public final boolean hiding;
  public final Optional<List<ExportItem>> items;

  public Import(
      Name module,
      boolean qualified,
      @Nullable String as,
      boolean hiding,
      @Nullable List<ExportItem> items,
      SourceRange range) {
    super(range);
    this.module = checkNotNull(module);
    this.qualified = qualified;
    this.as = Optional.ofNullable(as);
    this.hiding = hiding;
    this.items = Optional.ofNullable(items).map(ImmutableList::copyOf);
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitImport(this, arg);
  }
}
