package exactprint.printer;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import exactprint.annotation.Annotation;
import exactprint.annotation.AnnotationPayload;
import exactprint.annotation.AnnotationTable;
import exactprint.ast.Decl;
import exactprint.ast.Expr;
import exactprint.ast.GuardedRhs;
import exactprint.ast.Literal;
import exactprint.ast.LocalBinds;
import exactprint.ast.Match;
import exactprint.ast.Module;
import exactprint.ast.Name;
import exactprint.comment.AttachedComment;
import exactprint.comment.Comment;
import exactprint.comment.DeltaComment;
import exactprint.util.DeltaPos;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Generates the source of a module of simple equations, separated by blank lines and comments,
 * together with the tree, comments and annotations a parser would deliver for it.
 */
public class ModuleGenerator extends Generator<GeneratedModule> {

  private static final List<String> IDENTS = ImmutableList.of("f", "go", "xs'", "foo_bar", "x1");

  private static final List<String> NUMBERS = ImmutableList.of("1", "0x1F", "1e3", "007");

  private int sizeHint = 10;

  private StringBuilder text;
  private int line;
  private int column;
  private List<Comment> comments;
  private List<String> commentTexts;
  private AnnotationTable table;
  private SourcePosition lastToken;

  public ModuleGenerator() {
    super(GeneratedModule.class);
  }

  public void configure(Size size) {
    sizeHint = size.max();
  }

  @Override
  public GeneratedModule generate(SourceOfRandomness random, GenerationStatus status) {
    text = new StringBuilder();
    line = 1;
    column = 1;
    comments = new ArrayList<>();
    commentTexts = new ArrayList<>();
    table = new AnnotationTable();

    int n = 1 + random.nextInt(0, Math.max(0, sizeHint));
    List<Decl> decls = new ArrayList<>(n);
    for (int i = 0; i < n; ++i) {
      genGap(random);
      decls.add(genEquation(random));
    }
    genGap(random);

    SourcePosition end = pos();
    Module module =
        new Module(
            null,
            null,
            ImmutableList.of(),
            decls,
            new SourceRange(SourcePosition.BEGIN_OF_FILE, end));
    table.store(
        module.range(), new AnnotationPayload.ModuleFile(DeltaPos.between(lastToken, end)));
    return new GeneratedModule(module, comments, commentTexts, table, text.toString());
  }

  // (blank line | comment line)*
  private void genGap(SourceOfRandomness random) {
    int n = random.nextInt(0, 2);
    for (int i = 0; i < n; ++i) {
      switch (random.nextInt(0, 2)) {
        case 0:
          break;
        case 1:
          emit(Strings.repeat(" ", random.nextInt(0, 3)));
          genComment(Comment::line, "-- note " + random.nextInt(0, 99));
          break;
        default:
          emit(Strings.repeat(" ", random.nextInt(0, 3)));
          genComment(Comment::block, "{- block -}");
          break;
      }
      newLine();
    }
  }

  private void genComment(BiFunction<SourceRange, String, Comment> factory, String comment) {
    SourceRange range = new SourceRange(pos(), comment.length());
    comments.add(factory.apply(range, comment));
    commentTexts.add(comment);
    emit(comment);
  }

  // IDENT = (IDENT | NUMBER) comment?
  private Decl genEquation(SourceOfRandomness random) {
    emit(Strings.repeat(" ", random.nextInt(0, 2)));
    SourcePosition start = pos();

    String ident = random.choose(IDENTS);
    Name name = new Name(ident, new SourceRange(pos(), ident.length()));
    emit(ident);
    int beforeEq = random.nextInt(1, 3);
    emit(Strings.repeat(" ", beforeEq));
    emit("=");
    emit(Strings.repeat(" ", random.nextInt(1, 3)));

    SourcePosition bodyStart = pos();
    Expr body;
    List<AnnotationPayload> payloads = new ArrayList<>();
    payloads.add(new AnnotationPayload.GuardedRhs(null, null));
    if (random.nextBoolean()) {
      String number = random.choose(NUMBERS);
      body = new Expr.Lit(new Literal.Number(new SourceRange(pos(), number.length())));
      payloads.add(new AnnotationPayload.OverLit(number));
      emit(number);
    } else {
      String var = random.choose(IDENTS);
      Name varName = new Name(var, new SourceRange(pos(), var.length()));
      body = new Expr.Var(varName, varName.range());
      emit(var);
    }
    lastToken = pos();

    List<AttachedComment> floated = new ArrayList<>();
    if (random.nextBoolean()) {
      int gap = random.nextInt(1, 3);
      emit(Strings.repeat(" ", gap));
      String comment = "-- trailing";
      if (random.nextBoolean()) {
        // floated onto the right hand side, relative to its start
        int from = lastToken.column - bodyStart.column + gap;
        floated.add(
            new DeltaComment(
                false,
                DeltaPos.sameLine(from),
                DeltaPos.sameLine(from + comment.length()),
                comment));
        commentTexts.add(comment);
        emit(comment);
      } else {
        genComment(Comment::line, comment);
      }
    }

    List<Annotation> records = new ArrayList<>();
    for (AnnotationPayload payload : payloads) {
      records.add(new Annotation(records.isEmpty() ? floated : ImmutableList.of(), payload));
    }
    table.store(body.range(), records.toArray(new Annotation[0]));

    SourceRange range = new SourceRange(start, lastToken);
    table.store(
        range,
        new AnnotationPayload.Match(DeltaPos.ZERO, false, DeltaPos.sameLine(beforeEq), null));
    GuardedRhs rhs = new GuardedRhs(ImmutableList.of(), body, body.range());
    Match match =
        new Match(name, ImmutableList.of(), ImmutableList.of(rhs), LocalBinds.EMPTY, range);
    newLine();
    return new Decl.FunBind(name, ImmutableList.of(match), range);
  }

  private SourcePosition pos() {
    return new SourcePosition(line, column);
  }

  private void emit(String s) {
    text.append(s);
    column += s.length();
  }

  private void newLine() {
    text.append('\n');
    line++;
    column = 1;
  }
}
