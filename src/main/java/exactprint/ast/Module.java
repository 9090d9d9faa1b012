package exactprint.ast;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Root of a syntax tree: one source file. */
public class Module extends Node {

  public final Optional<Name> name;
  /** Absent when there is no export list, empty for {@code module M () where}. */
  public final Optional<List<ExportItem>> exports;

  public final List<Import> imports;
  public final List<Decl> declarations;

  public Module(
      @Nullable Name name,
      @Nullable List<ExportItem> exports,
      List<Import> imports,
      List<Decl> declarations,
      SourceRange range) {
    super(range);
    this.name = Optional.ofNullable(name);
    this.exports = Optional.ofNullable(exports).map(ImmutableList::copyOf);
    this.imports = ImmutableList.copyOf(imports);
    this.declarations = ImmutableList.copyOf(declarations);
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitModule(this, arg);
  }
}
