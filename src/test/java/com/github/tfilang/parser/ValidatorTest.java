package com.github.tfilang.parser;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.tfilang.Tokenizer;
import com.github.tfilang.Tokenizer.TokenType;
import com.github.tfilang.parser.CompilationUnit.BinaryExpression;
import com.github.tfilang.parser.CompilationUnit.ConstDeclaration;
import com.github.tfilang.parser.CompilationUnit.DeclarationType;
import com.github.tfilang.parser.CompilationUnit.NumberExpression;
import com.github.tfilang.parser.CompilationUnit.PrintStatement;
import com.github.tfilang.parser.CompilationUnit.Statement;
import com.github.tfilang.parser.ValidationError.DuplicateVariable;
import com.github.tfilang.parser.ValidationError.EmptyBlock;
import com.github.tfilang.parser.ValidationError.EmptyIdentifier;
import com.github.tfilang.parser.ValidationError.EmptyPrintStatement;
import com.github.tfilang.parser.ValidationError.InvalidExpression;
import com.github.tfilang.parser.ValidationError.UndefinedVariable;
import com.github.tfilang.parser.Validator.ValidationContext;

public class ValidatorTest {

    private static List<Statement> parse(String code) {
        return new Parser().parseCompilationUnit(new Tokenizer().tokenize(code)).statements();
    }

    @ParameterizedTest
    @MethodSource("invalidPrograms")
    public void testInvalidPrograms(String code, ValidationError expected) {
        var statements = parse(code);
        var e = assertThrows(ValidationException.class, () -> new Validator().validateProgram(statements));
        assertEquals(expected, e.error());
    }

    private static Object[][] invalidPrograms() {
        return new Object[][] {
            {
                "bahubali();",
                new EmptyPrintStatement(1)
            }, {
                "magadheera(x > 5) { }",
                new EmptyBlock(1, "magadheera")
            }, {
                "rrr x = 10; rrr x = 20;",
                new DuplicateVariable(2, "x", 1)
            }, {
                "pushpa x = 1; rrr x = 2;",
                new DuplicateVariable(2, "x", 1)
            }, {
                "pushpa x = 1; pushpa x = 2;",
                new DuplicateVariable(2, "x", 1)
            }, {
                "rrr x = 1; pushpa x = 2; pushpa x = 3;",
                new DuplicateVariable(3, "x", 2)
            }, {
                "rrr x = x;",
                new UndefinedVariable(1, "x")
            }, {
                "bahubali(1, missing);",
                new UndefinedVariable(1, "missing")
            }, {
                "magadheera(1) { rrr y = 1; bahubali(y); } bahubali(y);",
                new UndefinedVariable(2, "y")
            }, {
                "pushpa n = 1; pokiri(n < 3) { pushpa inner = n; bahubali(inner); } bahubali(inner);",
                new UndefinedVariable(3, "inner")
            }, {
                "eega(pushpa i = 0; i < 3; i + 1) { bahubali(i); } bahubali(i);",
                new UndefinedVariable(2, "i")
            }, {
                "rrr a = 1; pokiri(a > 0) { bahubali(b); }",
                new UndefinedVariable(2, "b")
            }, {
                "pushpa x = 1; magadheera(x) { pushpa x = 2; bahubali(x); }",
                new DuplicateVariable(2, "x", 1)
            }, {
                "rrr x = 1; magadheera(x) { bahubali(x); } karthikeya { }",
                new EmptyBlock(2, "karthikeya")
            }, {
                "pokiri(1) { }",
                new EmptyBlock(1, "pokiri")
            }, {
                "eega(pushpa i = 0; i < 3; i + 1) { }",
                new EmptyBlock(1, "eega")
            }, {
                "eega(pushpa i = 0; i < limit; i + 1) { bahubali(i); }",
                new UndefinedVariable(1, "limit")
            }
        };
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "rrr x = 10; bahubali(x);",
        "rrr x = 1; pushpa x = 2; bahubali(x);",
        "rrr x = 1; magadheera(x) { pushpa x = 2; bahubali(x); } pushpa x = 3;",
        "magadheera(1) { rrr y = 1; bahubali(y); } magadheera(2) { rrr y = 2; bahubali(y); }",
        "eega(pushpa i = 0; i < 3; i + 1) { bahubali(i); } eega(pushpa i = 0; i < 3; i + 1) { bahubali(i); }",
        "pushpa n = 3; pokiri(n > 0) { eega(rrr j = n; j < 10; j + 1) { bahubali(n, j); } }",
        ""
    })
    public void testValidPrograms(String code) {
        var statements = parse(code);
        assertDoesNotThrow(() -> new Validator().validateProgram(statements));
    }

    @Test
    public void testEmptyIdentifier() {
        var statements = List.<Statement>of(new ConstDeclaration("", new NumberExpression(1)));
        var e = assertThrows(ValidationException.class, () -> new Validator().validateProgram(statements));
        assertEquals(new EmptyIdentifier(1, "rrr"), e.error());
    }

    @Test
    public void testUnknownOperator() {
        var statements = List.<Statement>of(new PrintStatement(
                new BinaryExpression(new NumberExpression(1), TokenType.COMMA, new NumberExpression(2))));
        var e = assertThrows(ValidationException.class, () -> new Validator().validateProgram(statements));
        assertEquals(new InvalidExpression(1, "Unknown operator: COMMA"), e.error());
    }

    @Test
    public void testDetailedValidationCollectsAllErrors() {
        var statements = parse("bahubali(); rrr x = 1; rrr x = 2; bahubali(y); bahubali(x);");
        var errors = new Validator().validateProgramDetailed(statements);
        assertEquals(List.of(
                new EmptyPrintStatement(1),
                new DuplicateVariable(3, "x", 2),
                new UndefinedVariable(4, "y")), errors);
    }

    @Test
    public void testDetailedValidationOfValidProgram() {
        assertEquals(List.of(), new Validator().validateProgramDetailed(parse("rrr x = 1; bahubali(x);")));
    }

    @Test
    public void testRender() {
        assertEquals("""
                Validation Error at statement 2
                   Variable 'x' is already declared at statement 1
                   Suggestion: Use a different variable name or redeclare a 'rrr' variable with 'pushpa'""",
                new DuplicateVariable(2, "x", 1).render());
    }

    @Test
    public void testExceptionMessage() {
        var e = new ValidationException(new UndefinedVariable(4, "z"));
        assertEquals("Variable 'z' is not defined (statement 4)", e.getMessage());
    }

    @Test
    public void testContextScopes() {
        var context = new ValidationContext();
        context.declareVariable("a", 1, DeclarationType.CONST);
        assertEquals(1, context.depth());

        context.enterScope();
        context.declareVariable("b", 2, DeclarationType.LET);
        context.declareVariable("a", 2, DeclarationType.LET);
        assertEquals(2, context.depth());
        assertEquals(DeclarationType.LET, context.lookup("a").get().type());
        assertEquals(List.of("a", "b"), List.copyOf(context.declaredVariables()));

        context.exitScope();
        assertEquals(DeclarationType.CONST, context.lookup("a").get().type());
        assertTrue(context.isVariableDeclared("a"));
        assertFalse(context.isVariableDeclared("b"));

        assertThrows(IllegalStateException.class, context::exitScope);
    }

    @Test
    public void testContextRejectsRedeclaration() {
        var context = new ValidationContext();
        context.declareVariable("a", 1, DeclarationType.LET);
        var e = assertThrows(ValidationException.class, () -> context.declareVariable("a", 5, DeclarationType.LET));
        assertEquals(new DuplicateVariable(5, "a", 1), e.error());
    }

}
