package exactprint.printer;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import exactprint.annotation.AnnotationPayload;
import exactprint.annotation.AnnotationTable;
import exactprint.annotation.Annotations;
import exactprint.ast.ConDecl;
import exactprint.ast.Decl;
import exactprint.ast.ExportItem;
import exactprint.ast.Expr;
import exactprint.ast.GuardedRhs;
import exactprint.ast.Import;
import exactprint.ast.Literal;
import exactprint.ast.LocalBinds;
import exactprint.ast.Match;
import exactprint.ast.Module;
import exactprint.ast.Name;
import exactprint.ast.Node;
import exactprint.ast.Pat;
import exactprint.ast.Stmt;
import exactprint.ast.SyntaxVisitor;
import exactprint.ast.Type;
import exactprint.comment.Comment;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.jooq.lambda.tuple.Tuple2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a syntax tree exactly as laid out in the source it was parsed from.
 *
 * <p>The tree supplies the names, literals and structure; the annotation table supplies where the
 * remaining tokens (keywords, punctuation, separators) go and which comments were floated onto
 * which node. Every node is entered through {@link #visit}, which moves the cursor to the node,
 * releases the comments floated onto it and finally prints the node's trailing list comma. The
 * {@code visit*} methods only print the node's own tokens and visit the children in source order.
 *
 * <p>Instances belong to exactly one run.
 */
public class ExactPrinter implements SyntaxVisitor<Annotations, Void> {

  private static final Logger LOGGER = LoggerFactory.getLogger("ExactPrinter");

  private final PrintContext context;
  private final PrinterOptions options;

  ExactPrinter(PrintContext context, PrinterOptions options) {
    this.context = checkNotNull(context);
    this.options = checkNotNull(options);
  }

  /** Prints {@code root} and every comment; the annotation table is not modified. */
  public static String print(
      Node root, List<Comment> comments, AnnotationTable annotations, PrinterOptions options) {
    PrintContext context = new PrintContext(comments, annotations);
    new ExactPrinter(context, options).visit(root);
    context.printRemainingComments();
    return context.output();
  }

  /** Moves to the node, then prints it. */
  void visit(Node node) {
    enter(node, anns -> node.acceptVisitor(this, anns));
  }

  private void enter(Node node, Consumer<Annotations> render) {
    SourceRange range = node.range();
    if (range.isNull()) {
      LOGGER.debug("skipping synthetic {}", node);
      return;
    }
    context.printWhitespace(range.begin);
    Annotations anns = context.lookupAnnotation(range);
    if (!anns.comments().isEmpty()) {
      context.mergeComments(anns.comments());
      anns = anns.withoutComments();
      context.storeAnnotation(range, anns);
    }
    LOGGER.debug("{} {}", node, anns);
    render.accept(anns);
    anns.find(AnnotationPayload.ListItem.class)
        .ifPresent(item -> context.printStringAtDelta(item.comma, ","));
  }

  private void visitAll(List<? extends Node> nodes) {
    nodes.forEach(this::visit);
  }

  private void visitBinds(LocalBinds binds) {
    if (!binds.isEmpty()) {
      visit(binds);
    }
  }

  private <P extends AnnotationPayload> P expect(Annotations anns, Class<P> kind, Node node) {
    List<P> found = anns.payloads(kind);
    if (found.size() != 1) {
      throw new MissingAnnotationError(node, kind, found.size());
    }
    return found.get(0);
  }

  private Void unsupported(Node node) {
    if (options.unsupportedVariantPolicy == UnsupportedVariantPolicy.FAIL) {
      throw new UnsupportedVariantError(node);
    }
    LOGGER.warn("no exact printer for {}, printing a placeholder", node);
    context.printString("<<unsupported " + node.kind() + ">>");
    return null;
  }

  private static String open(boolean unboxed) {
    return unboxed ? "(#" : "(";
  }

  private static String close(boolean unboxed) {
    return unboxed ? "#)" : ")";
  }

  @Override
  public Void visitModule(Module that, Annotations anns) {
    AnnotationPayload.ModuleFile file = expect(anns, AnnotationPayload.ModuleFile.class, that);
    SourcePosition start = context.getPos();
    if (that.name.isPresent()) {
      Name name = that.name.get();
      AnnotationPayload.ModuleHeader header =
          expect(
              context.lookupAnnotation(name.range()), AnnotationPayload.ModuleHeader.class, name);
      context.printStringAtDeltaP(start, header.module, "module");
      visit(name);
      if (that.exports.isPresent()) {
        context.printStringAtMaybeDeltaP(start, header.open, "(");
        visitAll(that.exports.get());
        context.printStringAtMaybeDelta(header.close, ")");
      }
      context.printStringAtDeltaP(start, header.where, "where");
    }
    visitAll(that.imports);
    Layout.printSeq(context, Layout.located(that.declarations, this::visit));

    // whitespace up to the end of the file
    SourcePosition end = file.eof.applyTo(context.getPos());
    LOGGER.debug("end of file at {}", end);
    context.advanceTo(end);
    return null;
  }

  @Override
  public Void visitName(Name that, Annotations anns) {
    context.printString(that.prefixForm());
    return null;
  }

  @Override
  public Void visitVarExport(ExportItem.Var that, Annotations anns) {
    context.printString(that.name.prefixForm());
    return null;
  }

  @Override
  public Void visitThingAbs(ExportItem.ThingAbs that, Annotations anns) {
    context.printString(that.name.prefixForm());
    return null;
  }

  @Override
  public Void visitThingAll(ExportItem.ThingAll that, Annotations anns) {
    AnnotationPayload.ThingAll an = expect(anns, AnnotationPayload.ThingAll.class, that);
    context.printString(that.name.prefixForm());
    context.printStringAtDelta(an.open, "(");
    context.printStringAtDelta(an.dotdot, "..");
    context.printStringAtDelta(an.close, ")");
    return null;
  }

  @Override
  public Void visitImport(Import that, Annotations anns) {
    AnnotationPayload.Import an = expect(anns, AnnotationPayload.Import.class, that);
    SourcePosition start = context.getPos();
    context.printString("import");
    context.printStringAtMaybeDeltaP(start, an.qualified, "qualified");
    visit(that.module);
    context.printStringAtMaybeDeltaP(start, an.as, "as");
    if (that.as.isPresent()) {
      context.printStringAtMaybeDeltaP(start, an.asName, that.as.get());
    }
    context.printStringAtMaybeDeltaP(start, an.hiding, "hiding");
    context.printStringAtMaybeDeltaP(start, an.open, "(");
    that.items.ifPresent(this::visitAll);
    context.printStringAtMaybeDelta(an.close, ")");
    return null;
  }

  @Override
  public Void visitTypeSig(Decl.TypeSig that, Annotations anns) {
    AnnotationPayload.TypeSig an = expect(anns, AnnotationPayload.TypeSig.class, that);
    visitAll(that.names);
    context.printStringAtDelta(an.dcolon, "::");
    visit(that.type);
    return null;
  }

  @Override
  public Void visitFunBind(Decl.FunBind that, Annotations anns) {
    visitAll(that.matches);
    return null;
  }

  @Override
  public Void visitPatBind(Decl.PatBind that, Annotations anns) {
    AnnotationPayload.PatBind an = expect(anns, AnnotationPayload.PatBind.class, that);
    visit(that.lhs);
    context.printStringAtMaybeDelta(an.eq, "=");
    visitAll(that.rhs);
    context.printStringAtMaybeDelta(an.where, "where");
    visitBinds(that.binds);
    return null;
  }

  @Override
  public Void visitDataDecl(Decl.DataDecl that, Annotations anns) {
    AnnotationPayload.DataDecl an = expect(anns, AnnotationPayload.DataDecl.class, that);
    context.printString("data");
    visit(that.name);
    visitAll(that.typeVariables);
    context.printStringAtDelta(an.eq, "=");
    visitAll(that.constructors);
    return null;
  }

  @Override
  public Void visitOtherDecl(Decl.Other that, Annotations anns) {
    return unsupported(that);
  }

  @Override
  public Void visitConDecl(ConDecl that, Annotations anns) {
    AnnotationPayload.ConDecl an = expect(anns, AnnotationPayload.ConDecl.class, that);
    visit(that.name);
    visitAll(that.arguments);
    context.printStringAtMaybeDelta(an.bar, "|");
    return null;
  }

  @Override
  public Void visitMatch(Match that, Annotations anns) {
    AnnotationPayload.Match an = expect(anns, AnnotationPayload.Match.class, that);
    if (an.infix) {
      checkState(
          that.patterns.size() >= 2, "infix equation of %s needs two operands", that.name.text);
      visit(that.patterns.get(0));
      context.printStringAtDelta(an.name, that.name.infixForm());
      visitAll(that.patterns.subList(1, that.patterns.size()));
    } else {
      context.printStringAtDelta(an.name, that.name.prefixForm());
      visitAll(that.patterns);
    }
    context.printStringAtMaybeDelta(an.eq, "=");
    visitAll(that.rhs);
    context.printStringAtMaybeDelta(an.where, "where");
    visitBinds(that.binds);
    return null;
  }

  @Override
  public Void visitGuardedRhs(GuardedRhs that, Annotations anns) {
    AnnotationPayload.GuardedRhs an = expect(anns, AnnotationPayload.GuardedRhs.class, that);
    context.printStringAtMaybeDelta(an.guard, "|");
    visitAll(that.guards);
    context.printStringAtMaybeDelta(an.eq, "=");
    visit(that.body);
    return null;
  }

  @Override
  public Void visitLocalBinds(LocalBinds that, Annotations anns) {
    // bindings win ties against signatures
    List<Tuple2<SourcePosition, Runnable>> items =
        Layout.mergeByPosition(
            Layout.located(that.bindings, this::visit),
            Layout.located(that.signatures, this::visit));
    Optional<AnnotationPayload.Layout> layout = anns.find(AnnotationPayload.Layout.class);
    if (layout.isPresent()) {
      Layout.layoutList(context, layout.get().markers, items);
    } else {
      Layout.printSeq(context, items);
    }
    return null;
  }

  @Override
  public Void visitVarPat(Pat.Var that, Annotations anns) {
    context.printString(that.name.prefixForm());
    return null;
  }

  @Override
  public Void visitLitPat(Pat.Lit that, Annotations anns) {
    // the literal shares the pattern's span and therefore its annotation
    return that.literal.acceptVisitor(this, anns);
  }

  @Override
  public Void visitConPat(Pat.Con that, Annotations anns) {
    visit(that.constructor);
    visitAll(that.arguments);
    return null;
  }

  @Override
  public Void visitWildPat(Pat.Wild that, Annotations anns) {
    context.printString("_");
    return null;
  }

  @Override
  public Void visitAsPat(Pat.As that, Annotations anns) {
    AnnotationPayload.AsPat an = expect(anns, AnnotationPayload.AsPat.class, that);
    visit(that.name);
    context.printStringAtDelta(an.at, "@");
    visit(that.pattern);
    return null;
  }

  @Override
  public Void visitTuplePat(Pat.Tuple that, Annotations anns) {
    AnnotationPayload.Tuple an = expect(anns, AnnotationPayload.Tuple.class, that);
    context.printStringAtDelta(an.open, open(that.unboxed));
    visitAll(that.elements);
    context.printStringAtDelta(an.close, close(that.unboxed));
    return null;
  }

  @Override
  public Void visitTyVar(Type.Var that, Annotations anns) {
    context.printString(that.name.prefixForm());
    return null;
  }

  @Override
  public Void visitTyApp(Type.App that, Annotations anns) {
    visit(that.function);
    visit(that.argument);
    return null;
  }

  @Override
  public Void visitFunTy(Type.Fun that, Annotations anns) {
    AnnotationPayload.FunTy an = expect(anns, AnnotationPayload.FunTy.class, that);
    visit(that.argument);
    context.printStringAtDelta(an.arrow, "->");
    visit(that.result);
    return null;
  }

  @Override
  public Void visitParTy(Type.Paren that, Annotations anns) {
    AnnotationPayload.Paren an = expect(anns, AnnotationPayload.Paren.class, that);
    context.printStringAtDelta(an.open, "(");
    visit(that.type);
    context.printStringAtDelta(an.close, ")");
    return null;
  }

  @Override
  public Void visitTupleTy(Type.Tuple that, Annotations anns) {
    AnnotationPayload.Tuple an = expect(anns, AnnotationPayload.Tuple.class, that);
    context.printStringAtDelta(an.open, open(that.unboxed));
    visitAll(that.elements);
    context.printStringAtDelta(an.close, close(that.unboxed));
    return null;
  }

  @Override
  public Void visitQualifiedTy(Type.Qualified that, Annotations anns) {
    AnnotationPayload.Context an = expect(anns, AnnotationPayload.Context.class, that);
    context.printStringAtMaybeDelta(an.open, "(");
    visitAll(that.context);
    context.printStringAtMaybeDelta(an.close, ")");
    context.printStringAtMaybeDelta(an.darrow, "=>");
    visit(that.body);
    return null;
  }

  @Override
  public Void visitBodyStmt(Stmt.Body that, Annotations anns) {
    visit(that.expression);
    return null;
  }

  @Override
  public Void visitBindStmt(Stmt.Bind that, Annotations anns) {
    AnnotationPayload.BindStmt an = expect(anns, AnnotationPayload.BindStmt.class, that);
    visit(that.pattern);
    context.printStringAtDelta(an.larrow, "<-");
    visit(that.expression);
    return null;
  }

  @Override
  public Void visitLetStmt(Stmt.Let that, Annotations anns) {
    AnnotationPayload.Let an = expect(anns, AnnotationPayload.Let.class, that);
    SourcePosition start = context.getPos();
    context.printStringAtMaybeDelta(an.let, "let");
    visitBinds(that.binds);
    context.printStringAtMaybeDeltaP(start, an.in, "in");
    return null;
  }

  @Override
  public Void visitVar(Expr.Var that, Annotations anns) {
    context.printString(that.name.prefixForm());
    return null;
  }

  @Override
  public Void visitLit(Expr.Lit that, Annotations anns) {
    return that.literal.acceptVisitor(this, anns);
  }

  @Override
  public Void visitOpApp(Expr.OpApp that, Annotations anns) {
    visit(that.left);
    enter(that.operator, an -> context.printString(that.operator.name.infixForm()));
    visit(that.right);
    return null;
  }

  @Override
  public Void visitApp(Expr.App that, Annotations anns) {
    visit(that.function);
    visit(that.argument);
    return null;
  }

  @Override
  public Void visitParen(Expr.Paren that, Annotations anns) {
    AnnotationPayload.Paren an = expect(anns, AnnotationPayload.Paren.class, that);
    context.printStringAtDelta(an.open, "(");
    visit(that.expression);
    context.printStringAtDelta(an.close, ")");
    return null;
  }

  @Override
  public Void visitLet(Expr.Let that, Annotations anns) {
    AnnotationPayload.Let an = expect(anns, AnnotationPayload.Let.class, that);
    SourcePosition start = context.getPos();
    context.printStringAtMaybeDelta(an.let, "let");
    visitBinds(that.binds);
    context.printStringAtMaybeDeltaP(start, an.in, "in");
    visit(that.body);
    return null;
  }

  @Override
  public Void visitDo(Expr.Do that, Annotations anns) {
    AnnotationPayload.Do an = expect(anns, AnnotationPayload.Do.class, that);
    context.printStringAtMaybeDelta(an.doKeyword, "do");
    Optional<AnnotationPayload.Layout> layout = anns.find(AnnotationPayload.Layout.class);
    if (layout.isPresent()) {
      Layout.layoutList(
          context, layout.get().markers, Layout.located(that.statements, this::visit));
    } else {
      visitAll(that.statements);
    }
    return null;
  }

  @Override
  public Void visitTuple(Expr.Tuple that, Annotations anns) {
    AnnotationPayload.Tuple an = expect(anns, AnnotationPayload.Tuple.class, that);
    context.printStringAtDelta(an.open, open(that.unboxed));
    visitAll(that.elements);
    context.printStringAtDelta(an.close, close(that.unboxed));
    return null;
  }

  @Override
  public Void visitExplicitList(Expr.ExplicitList that, Annotations anns) {
    AnnotationPayload.Brackets an = expect(anns, AnnotationPayload.Brackets.class, that);
    Layout.squareList(context, an.points, Layout.located(that.elements, this::visit));
    return null;
  }

  @Override
  public Void visitArithSeq(Expr.ArithSeq that, Annotations anns) {
    AnnotationPayload.ArithSeq an = expect(anns, AnnotationPayload.ArithSeq.class, that);
    context.printStringAtDelta(an.open, "[");
    visit(that.from);
    if (that.then.isPresent()) {
      context.printStringAtMaybeDelta(an.comma, ",");
      visit(that.then.get());
    }
    context.printStringAtDelta(an.dotdot, "..");
    that.to.ifPresent(this::visit);
    context.printStringAtDelta(an.close, "]");
    return null;
  }

  @Override
  public Void visitOtherExpr(Expr.Other that, Annotations anns) {
    return unsupported(that);
  }

  @Override
  public Void visitCharLit(Literal.Char that, Annotations anns) {
    context.printString("'" + that.raw + "'");
    return null;
  }

  @Override
  public Void visitStringLit(Literal.Str that, Annotations anns) {
    context.printString("\"" + that.raw + "\"");
    return null;
  }

  @Override
  public Void visitNumberLit(Literal.Number that, Annotations anns) {
    context.printString(expect(anns, AnnotationPayload.OverLit.class, that).source);
    return null;
  }
}
