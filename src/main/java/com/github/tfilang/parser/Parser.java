package com.github.tfilang.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.tfilang.SourcePosition;
import com.github.tfilang.Tokenizer.Token;
import com.github.tfilang.Tokenizer.TokenType;
import com.github.tfilang.Tokenizer.Tokens;
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
import com.github.tfilang.parser.CompilationUnit.VariableDeclaration;
import com.github.tfilang.parser.CompilationUnit.VariableExpression;
import com.github.tfilang.parser.CompilationUnit.WhileStatement;

import lombok.extern.slf4j.Slf4j;

/**
 * Recursive descent parser. Every statement starts with a keyword, so the
 * parser commits to a rule after one token of lookahead and reports a
 * {@link SyntaxException} at the first token the rule cannot accept.
 * <p>
 * Binary operators have no relative precedence: {@code a + b * c} parses as
 * {@code (a + b) * c}.
 */
@Slf4j
public class Parser {

    private static final String TERMINATOR_SUGGESTION = "statements must end with ';'";

    public CompilationUnit parseCompilationUnit(Tokens tokens) {
        var token = tokens.peek();

        List<Statement> statements = new ArrayList<>();

        while (token.type() != TokenType.EOF) {
            var statement = parseStatement(tokens);
            statements.add(statement);
            token = tokens.peek();
        }

        log.debug("parsed {} top-level statements", statements.size());
        return new CompilationUnit(statements);
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case PRINT -> parsePrintStatement(tokens);
            case CONST, LET -> parseVariableDeclaration(tokens);
            case IF -> parseIfStatement(tokens);
            case WHILE -> parseWhileStatement(tokens);
            case FOR -> parseForStatement(tokens);
            case ELSE -> throw syntaxError(tokens, token, "statement",
                    "karthikeya must directly follow the closing '}' of a magadheera block");
            default -> throw syntaxError(tokens, token, "statement", null);
        };
    }

    // <> bahubali "(" [expression ("," expression)*]? ")" ";"
    private PrintStatement parsePrintStatement(Tokens tokens) {
        tokens.next();
        expect(tokens, TokenType.LPAREN, "bahubali statements need parentheses: bahubali(\"message\");");

        List<Expression> expressions = new ArrayList<>();

        if (!tokens.matches(TokenType.RPAREN)) {
            expressions.add(parseExpression(tokens));
            while (tokens.matches(TokenType.COMMA)) {
                tokens.next();
                expressions.add(parseExpression(tokens));
            }
        }
        expect(tokens, TokenType.RPAREN, "separate bahubali arguments with ',' and close them with ')'");
        expect(tokens, TokenType.SEMICOLON, TERMINATOR_SUGGESTION);
        return new PrintStatement(expressions);
    }

    // <> (rrr | pushpa) name "=" expression ";"
    private VariableDeclaration parseVariableDeclaration(Tokens tokens) {
        var keywordToken = tokens.next();
        var nameToken = expect(tokens, TokenType.IDENTIFIER,
                "declarations look like '" + keywordToken.image() + " name = value;'");
        expect(tokens, TokenType.EQUALS, "declarations look like '" + keywordToken.image() + " " + nameToken.image() + " = value;'");
        var initializer = parseExpression(tokens);
        expect(tokens, TokenType.SEMICOLON, TERMINATOR_SUGGESTION);

        if (keywordToken.type() == TokenType.CONST) {
            return new ConstDeclaration(nameToken.image(), initializer);
        } else {
            return new LetDeclaration(nameToken.image(), initializer);
        }
    }

    // <> magadheera "(" expression ")" block [karthikeya block]?
    private IfStatement parseIfStatement(Tokens tokens) {
        tokens.next();
        var condition = parseCondition(tokens, "magadheera statements need parentheses: magadheera(condition) { ... }");
        var thenBlock = parseBlock(tokens);
        var elseBlock = Optional.<List<Statement>>empty();
        if (tokens.matches(TokenType.ELSE)) {
            tokens.next();
            elseBlock = Optional.of(parseBlock(tokens));
        }
        return new IfStatement(condition, thenBlock, elseBlock);
    }

    // <> pokiri "(" expression ")" block
    private WhileStatement parseWhileStatement(Tokens tokens) {
        tokens.next();
        var condition = parseCondition(tokens, "pokiri statements need parentheses: pokiri(condition) { ... }");
        var body = parseBlock(tokens);
        return new WhileStatement(condition, body);
    }

    // <> eega "(" declaration expression ";" expression ")" block
    private ForStatement parseForStatement(Tokens tokens) {
        tokens.next();
        expect(tokens, TokenType.LPAREN, "eega statements need parentheses: eega(init; condition; update) { ... }");

        var initToken = tokens.peek();
        var init = parseStatement(tokens);
        if (!(init instanceof VariableDeclaration declaration)) {
            throw syntaxError(tokens, initToken, "'rrr' or 'pushpa' declaration",
                    "the eega initializer must declare the loop variable: eega(pushpa i = 0; i < 10; i + 1) { ... }");
        }
        var condition = parseExpression(tokens);
        expect(tokens, TokenType.SEMICOLON, "separate the eega condition and update with ';'");
        var update = parseExpression(tokens);
        expect(tokens, TokenType.RPAREN, "close the eega header with ')'");
        var body = parseBlock(tokens);
        return new ForStatement(declaration, condition, update, body);
    }

    private Expression parseCondition(Tokens tokens, String suggestion) {
        expect(tokens, TokenType.LPAREN, suggestion);
        var condition = parseExpression(tokens);
        expect(tokens, TokenType.RPAREN, "close the condition with ')'");
        return condition;
    }

    private List<Statement> parseBlock(Tokens tokens) {
        expect(tokens, TokenType.LBRACE, "blocks are enclosed in '{' and '}'");
        var statements = new ArrayList<Statement>();
        while (true) {
            var token = tokens.peek();
            if (token.type() == TokenType.RBRACE) {
                tokens.next();
                break;
            }
            if (token.type() == TokenType.EOF) {
                throw syntaxError(tokens, token, TokenType.RBRACE.describe(), "close the block with '}'");
            }
            var statement = parseStatement(tokens);
            statements.add(statement);
        }
        return statements;
    }

    // term (operator term)*, folded to the left
    Expression parseExpression(Tokens tokens) {
        var expr = parseTerm(tokens);

        while (tokens.peek().type().isBinaryOperator()) {
            var operator = tokens.next().type();
            var right = parseTerm(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseTerm(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case NUMBER -> {
                var numberToken = tokens.next();
                yield new NumberExpression(Integer.parseInt(numberToken.image()));
            }
            case IDENTIFIER -> {
                var nameToken = tokens.next();
                yield new VariableExpression(nameToken.image());
            }
            case STRING -> {
                var stringToken = tokens.next();
                yield new StringExpression(stringToken.image());
            }
            case LPAREN -> {
                tokens.next();
                var e = parseExpression(tokens);
                expect(tokens, TokenType.RPAREN, "every '(' needs a matching ')'");
                yield e;
            }
            default -> throw syntaxError(tokens, token, "expression",
                    "expressions are numbers, names, \"strings\" or parenthesized expressions joined by operators");
        };
    }

    private Token expect(Tokens tokens, TokenType type, String suggestion) {
        var token = tokens.peek();
        if (token.type() != type) {
            // a missing terminator belongs right after the construct it ends
            var at = type == TokenType.SEMICOLON ? null : token;
            throw syntaxError(tokens, at, type.describe(), describe(token), suggestion);
        }
        return tokens.next();
    }

    private SyntaxException syntaxError(Tokens tokens, Token token, String expected, String suggestion) {
        return syntaxError(tokens, token, expected, describe(token), suggestion);
    }

    /**
     * Positions the error at the start of {@code token}; a {@code null} or
     * end-of-input token positions it just past the previously consumed one.
     */
    private SyntaxException syntaxError(Tokens tokens, Token token, String expected, String found, String suggestion) {
        int offset;
        if (token == null || token.type() == TokenType.EOF) {
            var previous = tokens.previous();
            offset = previous.type() == TokenType.EOF ? previous.start() : previous.end();
        } else {
            offset = token.start();
        }
        var position = SourcePosition.of(tokens.source(), offset);
        return new SyntaxException(SyntaxError.at(position, expected, found, suggestion));
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, NUMBER -> token.type().describe() + " '" + token.image() + "'";
            case STRING -> "string \"" + token.image() + "\"";
            default -> token.type().describe();
        };
    }

}
