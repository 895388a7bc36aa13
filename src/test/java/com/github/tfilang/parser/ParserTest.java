package com.github.tfilang.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.tfilang.Tokenizer;
import com.github.tfilang.Tokenizer.TokenType;
import com.github.tfilang.parser.CompilationUnit.BinaryExpression;
import com.github.tfilang.parser.CompilationUnit.ConstDeclaration;
import com.github.tfilang.parser.CompilationUnit.Expression;
import com.github.tfilang.parser.CompilationUnit.ForStatement;
import com.github.tfilang.parser.CompilationUnit.IfStatement;
import com.github.tfilang.parser.CompilationUnit.LetDeclaration;
import com.github.tfilang.parser.CompilationUnit.NumberExpression;
import com.github.tfilang.parser.CompilationUnit.PrintStatement;
import com.github.tfilang.parser.CompilationUnit.Statement;
import com.github.tfilang.parser.CompilationUnit.StringExpression;
import com.github.tfilang.parser.CompilationUnit.VariableExpression;
import com.github.tfilang.parser.CompilationUnit.WhileStatement;

public class ParserTest {

    @ParameterizedTest
    @MethodSource("statements")
    public void testStatementParse(String code, Statement expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseStatement(tokens);
        assertEquals(expected, parsed);
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testExpressionParse(String code, Expression expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseExpression(tokens);
        assertEquals(expected, parsed);
    }

    @ParameterizedTest
    @MethodSource("syntaxErrors")
    public void testSyntaxErrors(String code, int line, int column, String expected, String found) {
        var tokens = new Tokenizer().tokenize(code);
        var e = assertThrows(SyntaxException.class, () -> new Parser().parseCompilationUnit(tokens));
        assertEquals(line, e.error().line());
        assertEquals(column, e.error().column());
        assertEquals(expected, e.error().expected());
        assertEquals(found, e.error().found());
    }

    private static Object[][] statements() {
        var x = new VariableExpression("x");
        var i = new VariableExpression("i");
        return new Object[][] {
            {
                "bahubali();",
                new PrintStatement(List.of())
            }, {
                "bahubali(1, x, \"s\");",
                new PrintStatement(new NumberExpression(1), x, new StringExpression("s"))
            }, {
                "rrr x = 1;",
                new ConstDeclaration("x", new NumberExpression(1))
            }, {
                "pushpa y = x + 1;",
                new LetDeclaration("y", new BinaryExpression(x, TokenType.PLUS, new NumberExpression(1)))
            }, {
                "magadheera(x > 1) { bahubali(x); }",
                new IfStatement(new BinaryExpression(x, TokenType.GT, new NumberExpression(1)),
                        List.of(new PrintStatement(x)))
            }, {
                "magadheera(x) { bahubali(1); } karthikeya { bahubali(2); }",
                new IfStatement(x,
                        List.of(new PrintStatement(new NumberExpression(1))),
                        List.of(new PrintStatement(new NumberExpression(2))))
            }, {
                "pokiri(x < 3) { }",
                new WhileStatement(new BinaryExpression(x, TokenType.LT, new NumberExpression(3)), List.of())
            }, {
                "eega(pushpa i = 0; i < 3; i + 1) { bahubali(i); }",
                new ForStatement(new LetDeclaration("i", new NumberExpression(0)),
                        new BinaryExpression(i, TokenType.LT, new NumberExpression(3)),
                        new BinaryExpression(i, TokenType.PLUS, new NumberExpression(1)),
                        List.of(new PrintStatement(i)))
            }, {
                "pokiri(x != 0) { pokiri(x == 1) { bahubali(x); } }",
                new WhileStatement(new BinaryExpression(x, TokenType.NOT_EQUALS, new NumberExpression(0)),
                        List.of(new WhileStatement(new BinaryExpression(x, TokenType.EQUALS_EQUALS, new NumberExpression(1)),
                                List.of(new PrintStatement(x)))))
            }
        };
    }

    private static Object[][] expressions() {
        var a = new VariableExpression("a");
        var b = new VariableExpression("b");
        var c = new VariableExpression("c");
        return new Object[][] {
            {
                "42",
                new NumberExpression(42)
            }, {
                "\"text\"",
                new StringExpression("text")
            }, {
                "a + b * c",
                new BinaryExpression(new BinaryExpression(a, TokenType.PLUS, b), TokenType.STAR, c)
            }, {
                "a + (b * c)",
                new BinaryExpression(a, TokenType.PLUS, new BinaryExpression(b, TokenType.STAR, c))
            }, {
                "a >= b - 1",
                new BinaryExpression(new BinaryExpression(a, TokenType.GE, b), TokenType.MINUS, new NumberExpression(1))
            }, {
                "((a))",
                a
            }
        };
    }

    private static Object[][] syntaxErrors() {
        return new Object[][] {
            { "rrr x = 42", 1, 11, "';'", "end of input" },
            { "bahubali \"hi\";", 1, 10, "'('", "string \"hi\"" },
            { "x = 5;", 1, 1, "statement", "identifier 'x'" },
            { "rrr = 5;", 1, 5, "identifier", "'='" },
            { "bahubali(1)\nrrr y = 2;", 1, 12, "';'", "'rrr'" },
            { "karthikeya { bahubali(1); }", 1, 1, "statement", "'karthikeya'" },
            { "eega(bahubali(1); i < 3; i + 1) { bahubali(i); }", 1, 6, "'rrr' or 'pushpa' declaration", "'bahubali'" },
            { "pokiri(x) {\n  bahubali(x);", 2, 15, "'}'", "end of input" },
            { "bahubali(1 +);", 1, 13, "expression", "')'" }
        };
    }

    @Test
    public void testCompilationUnit() {
        var tokens = new Tokenizer().tokenize("rrr x = 10;\n// comment\nbahubali(x);\n");
        var unit = new Parser().parseCompilationUnit(tokens);
        assertEquals(new CompilationUnit(List.of(
                new ConstDeclaration("x", new NumberExpression(10)),
                new PrintStatement(new VariableExpression("x")))), unit);
    }

    @Test
    public void testEmptyProgram() {
        var unit = new Parser().parseCompilationUnit(new Tokenizer().tokenize("  // nothing here\n"));
        assertEquals(List.of(), unit.statements());
    }

    @Test
    public void testMissingSemicolonRendering() {
        var tokens = new Tokenizer().tokenize("rrr x = 42");
        var e = assertThrows(SyntaxException.class, () -> new Parser().parseCompilationUnit(tokens));
        assertEquals("""
                Parse Error at line 1, column 11
                   Expected ';' but found end of input
                   rrr x = 42
                             ^
                   Suggestion: statements must end with ';'""", e.error().render());
        assertEquals("Expected ';' but found end of input at line 1, column 11", e.getMessage());
    }

    @Test
    public void testFallbackSuggestion() {
        assertEquals("Variable assignments need 'rrr' (const) or 'pushpa' (let) keyword", SyntaxError.suggestFor("x = 5;"));
        assertEquals("Check your syntax and make sure all statements end with ';'", SyntaxError.suggestFor("rrr x = 1"));
    }

}
