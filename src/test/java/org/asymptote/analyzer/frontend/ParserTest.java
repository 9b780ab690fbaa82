package org.asymptote.analyzer.frontend;

import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.api.ParseException;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.lexer.Lexer;
import org.asymptote.analyzer.frontend.parser.Parser;
import org.asymptote.analyzer.frontend.parser.ProcedureTable;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.ForLoop;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.frontend.parser.ast.RepeatUntilLoop;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.frontend.parser.ast.WhileLoop;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * The tests cover the statement forms, the relaxed and delimited block styles and the
 * structural errors that carry an expected/found pair.
 */
public class ParserTest {

    private Program parse(String source) throws AnalysisException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics, "test.txt").scanTokens(), diagnostics).parse();
    }

    /**
     * Verifies a main block with nested loops in both block styles.
     */
    @Test
    @Tag("unit")
    void testNestedLoopsInMainBlock() throws AnalysisException {
        // Arrange
        String source = String.join("\n",
                "begin",
                "  for i <- 1 to n do",
                "    for j <- i + 1 to n do begin",
                "      x <- x + 1",
                "    end",
                "  end",
                "end");

        // Act
        Program program = parse(source);

        // Assert
        assertThat(program.procedures()).isEmpty();
        assertThat(program.hasBody()).isTrue();
        assertThat(program.body().statements()).hasSize(1);
        ForLoop outer = (ForLoop) program.body().statements().get(0);
        assertThat(outer.variable().name()).isEqualTo("i");
        assertThat(outer.descending()).isFalse();
        ForLoop inner = (ForLoop) outer.body().statements().get(0);
        assertThat(inner.body().delimited()).isTrue();
        assertThat(inner.body().statements().get(0)).isInstanceOf(Assignment.class);
    }

    /**
     * A file made only of procedures needs no main block; a {@code begin ... end} procedure body is closed once.
     */
    @Test
    @Tag("unit")
    void testProceduresOnly() throws AnalysisException {
        // Arrange
        String source = String.join("\n",
                "procedure fact(n)",
                "begin",
                "  if n <= 1 then",
                "    return 1",
                "  end",
                "  return n * fact(n - 1)",
                "end",
                "",
                "function twice(x)",
                "  return 2 * x",
                "end");

        // Act
        Program program = parse(source);

        // Assert
        assertThat(program.hasBody()).isFalse();
        assertThat(program.procedures()).extracting(ProcedureDecl::procedureName).containsExactly("fact", "twice");
        ProcedureDecl fact = program.procedures().get(0);
        assertThat(fact.parameters()).extracting(p -> p.name()).containsExactly("n");
        assertThat(fact.body().statements()).hasSize(2);
        assertThat(fact.body().statements().get(0)).isInstanceOf(IfElse.class);
        ReturnStmt recursive = (ReturnStmt) fact.body().statements().get(1);
        assertThat(AstPrinter.render(recursive.value())).isEqualTo("n * fact(n - 1)");
    }

    /**
     * An else-if chain shares the closing {@code end} of its last branch.
     */
    @Test
    @Tag("unit")
    void testElseIfChain() throws AnalysisException {
        // Arrange
        String source = String.join("\n",
                "begin",
                "  if x < 0 then",
                "    y <- -1",
                "  else if x = 0 then",
                "    y <- 0",
                "  else",
                "    y <- 1",
                "  end",
                "  z <- y",
                "end");

        // Act
        Program program = parse(source);

        // Assert
        assertThat(program.body().statements()).hasSize(2);
        IfElse first = (IfElse) program.body().statements().get(0);
        assertThat(first.hasElse()).isTrue();
        IfElse nested = (IfElse) first.elseBranch().statements().get(0);
        assertThat(AstPrinter.render(nested.condition())).isEqualTo("x = 0");
        assertThat(nested.hasElse()).isTrue();
    }

    /**
     * Verifies while and repeat loops, the {@code swap ... with ...} form and {@code div}.
     */
    @Test
    @Tag("unit")
    void testConditionalLoopsAndSwap() throws AnalysisException {
        // Arrange
        String source = String.join("\n",
                "begin",
                "  while low <= high do",
                "    mid <- (low + high) div 2",
                "    swap A[low] with A[mid]",
                "  end",
                "  repeat",
                "    i <- i * 2",
                "  until i >= n",
                "end");

        // Act
        Program program = parse(source);

        // Assert
        WhileLoop loop = (WhileLoop) program.body().statements().get(0);
        Assignment mid = (Assignment) loop.body().statements().get(0);
        assertThat(mid.value()).isInstanceOf(BinaryExpr.class);
        assertThat(((BinaryExpr) mid.value()).operator()).isEqualToIgnoringCase("div");
        Call swap = (Call) loop.body().statements().get(1);
        assertThat(swap.calleeName()).isEqualTo("swap");
        assertThat(swap.arguments()).hasSize(2);
        RepeatUntilLoop repeat = (RepeatUntilLoop) program.body().statements().get(1);
        assertThat(AstPrinter.render(repeat.condition())).isEqualTo("i >= n");
    }

    /**
     * A bare {@code return} on its own line takes no value from the next line.
     */
    @Test
    @Tag("unit")
    void testBareReturnDoesNotConsumeNextLine() throws AnalysisException {
        // Arrange
        String source = String.join("\n",
                "procedure p(n)",
                "  if n = 0 then",
                "    return",
                "  end",
                "  x <- n",
                "end");

        // Act
        Program program = parse(source);

        // Assert
        IfElse guard = (IfElse) program.procedures().get(0).body().statements().get(0);
        ReturnStmt ret = (ReturnStmt) guard.thenBranch().statements().get(0);
        assertThat(ret.value()).isNull();
        assertThat(program.procedures().get(0).body().statements()).hasSize(2);
    }

    /**
     * A missing {@code end} surfaces what was expected, what was found and where.
     */
    @Test
    @Tag("unit")
    void testMissingEndReportsExpectedAndFound() {
        // Arrange
        String source = String.join("\n",
                "begin",
                "  for i <- 1 to n do",
                "    x <- x + 1",
                "end");

        // Act & Assert
        assertThatThrownBy(() -> parse(source))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException parse = (ParseException) e;
                    assertThat(parse.getExpected()).isEqualTo("'end'");
                    assertThat(parse.getFound()).isEqualTo("end of file");
                    assertThat(parse.getSourceInfo().fileName()).isEqualTo("test.txt");
                    assertThat(parse.getMessage()).startsWith("Expected 'end' but found 'end of file' at test.txt:");
                });
    }

    @Test
    @Tag("unit")
    void testMissingDoIsReported() {
        assertThatThrownBy(() -> parse("begin\n  while x > 0\n    x <- x - 1\n  end\nend"))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getExpected())
                .isEqualTo("'do'");
    }

    @Test
    @Tag("unit")
    void testMainBlockRequired() {
        assertThatThrownBy(() -> parse("x <- 1"))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getExpected())
                .isEqualTo("'begin'");
    }

    /**
     * Deeply nested input is rejected with a parse error instead of exhausting the call stack.
     */
    @Test
    @Tag("unit")
    void testDeepParenthesesAreRejected() {
        // Arrange
        String source = "begin\n  x <- " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + "\nend";

        // Act & Assert
        assertThatThrownBy(() -> parse(source))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("levels of nesting")
                .extracting(e -> ((ParseException) e).getFound())
                .isEqualTo("(");
    }

    @Test
    @Tag("unit")
    void testDeepBlocksAndSignsAreRejected() {
        String blocks = "begin\n" + "begin\n".repeat(5_000) + "x <- 1\n" + "end\n".repeat(5_001);
        String signs = "begin\n  x <- " + "-".repeat(20_000) + "1\nend";

        assertThatThrownBy(() -> parse(blocks)).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> parse(signs)).isInstanceOf(ParseException.class);
    }

    @Test
    @Tag("unit")
    void testModerateNestingIsAccepted() throws AnalysisException {
        Program program = parse("begin\n  x <- " + "(".repeat(60) + "n + 1" + ")".repeat(60) + "\nend");

        assertThat(program.body().statements()).singleElement().isInstanceOf(Assignment.class);
    }

    /**
     * Procedure lookups ignore case; duplicate names are reported as warnings.
     */
    @Test
    @Tag("unit")
    void testProcedureTable() throws AnalysisException {
        // Arrange
        Program program = parse("procedure Sort(A)\n  x <- 1\nend\nprocedure sort(B)\n  y <- 2\nend");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        ProcedureTable table = ProcedureTable.of(program, diagnostics);

        // Assert
        assertThat(table.contains("SORT")).isTrue();
        assertThat(table.lookup("sort")).isPresent();
        assertThat(diagnostics.getDiagnostics()).isNotEmpty();
        assertThat(diagnostics.hasErrors()).isFalse();
    }
}
