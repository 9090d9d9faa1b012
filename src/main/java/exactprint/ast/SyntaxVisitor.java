package exactprint.ast;

/**
 * Visits every variant of the syntax tree. Implementing this interface is what makes a printer
 * complete: a variant without a method does not compile.
 *
 * @param <A> argument threaded into each visit
 * @param <R> result of a visit
 */
public interface SyntaxVisitor<A, R>
    extends ExportItem.Visitor<A, R>,
        Decl.Visitor<A, R>,
        Pat.Visitor<A, R>,
        Type.Visitor<A, R>,
        Stmt.Visitor<A, R>,
        Expr.Visitor<A, R>,
        Literal.Visitor<A, R> {

  R visitModule(Module that, A arg);

  R visitName(Name that, A arg);

  R visitImport(Import that, A arg);

  R visitConDecl(ConDecl that, A arg);

  R visitMatch(Match that, A arg);

  R visitGuardedRhs(GuardedRhs that, A arg);

  R visitLocalBinds(LocalBinds that, A arg);
}
