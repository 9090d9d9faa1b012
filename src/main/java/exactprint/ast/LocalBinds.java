package exactprint.ast;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.List;

/**
 * The bindings of a {@code where} or {@code let}. Bindings and signatures are kept apart, as the
 * parser delivers them; the printer puts them back into source order.
 */
public class LocalBinds extends Node {

  public static final LocalBinds EMPTY =
      new LocalBinds(
          ImmutableList.of(),
          ImmutableList.of(),
          SourceRange.nullAt(SourcePosition.BEGIN_OF_FILE));

  public final List<Decl> bindings;
  public final List<Decl.TypeSig> signatures;

  public LocalBinds(List<Decl> bindings, List<Decl.TypeSig> signatures, SourceRange range) {
    super(range);
    this.bindings = ImmutableList.copyOf(bindings);
    this.signatures = ImmutableList.copyOf(signatures);
  }

  public boolean isEmpty() {
    return bindings.isEmpty() && signatures.isEmpty();
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitLocalBinds(this, arg);
  }
}
