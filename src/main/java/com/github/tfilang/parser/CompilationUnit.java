package com.github.tfilang.parser;

import java.util.List;
import java.util.Optional;

import com.github.tfilang.Tokenizer.TokenType;

public record CompilationUnit(List<Statement> statements) {

    public sealed interface Statement {}

    public record PrintStatement(List<Expression> expressions) implements Statement {
        public PrintStatement(Expression... expressions) {
            this(List.of(expressions));
        }
    }

    /**
     * Common shape of {@code rrr} and {@code pushpa} declarations.
     */
    public sealed interface VariableDeclaration extends Statement {
        String name();
        Expression initializer();
        DeclarationType declarationType();
    }
    public record ConstDeclaration(String name, Expression initializer) implements VariableDeclaration {
        public DeclarationType declarationType() { return DeclarationType.CONST; }
    }
    public record LetDeclaration(String name, Expression initializer) implements VariableDeclaration {
        public DeclarationType declarationType() { return DeclarationType.LET; }
    }

    public record IfStatement(Expression condition, List<Statement> thenBlock, Optional<List<Statement>> elseBlock) implements Statement {
        public IfStatement(Expression condition, List<Statement> thenBlock) {
            this(condition, thenBlock, Optional.empty());
        }
        public IfStatement(Expression condition, List<Statement> thenBlock, List<Statement> elseBlock) {
            this(condition, thenBlock, Optional.of(elseBlock));
        }
    }
    public record WhileStatement(Expression condition, List<Statement> body) implements Statement {}
    public record ForStatement(VariableDeclaration init, Expression condition, Expression update, List<Statement> body) implements Statement {}

    public sealed interface Expression {}

    public record NumberExpression(int number) implements Expression {}
    public record StringExpression(String string) implements Expression {}
    public record VariableExpression(String name) implements Expression {}
    public record BinaryExpression(Expression left, TokenType operator, Expression right) implements Expression {}

    public enum DeclarationType {
        CONST("rrr"),
        LET("pushpa");

        public final String keyword;

        private DeclarationType(String keyword) {
            this.keyword = keyword;
        }
    }

}
