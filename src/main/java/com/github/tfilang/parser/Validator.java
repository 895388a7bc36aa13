package com.github.tfilang.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.tfilang.parser.CompilationUnit.BinaryExpression;
import com.github.tfilang.parser.CompilationUnit.DeclarationType;
import com.github.tfilang.parser.CompilationUnit.Expression;
import com.github.tfilang.parser.CompilationUnit.ForStatement;
import com.github.tfilang.parser.CompilationUnit.IfStatement;
import com.github.tfilang.parser.CompilationUnit.NumberExpression;
import com.github.tfilang.parser.CompilationUnit.PrintStatement;
import com.github.tfilang.parser.CompilationUnit.Statement;
import com.github.tfilang.parser.CompilationUnit.StringExpression;
import com.github.tfilang.parser.CompilationUnit.VariableDeclaration;
import com.github.tfilang.parser.CompilationUnit.VariableExpression;
import com.github.tfilang.parser.CompilationUnit.WhileStatement;
import com.github.tfilang.parser.ValidationError.DuplicateVariable;
import com.github.tfilang.parser.ValidationError.EmptyBlock;
import com.github.tfilang.parser.ValidationError.EmptyIdentifier;
import com.github.tfilang.parser.ValidationError.EmptyPrintStatement;
import com.github.tfilang.parser.ValidationError.InvalidExpression;
import com.github.tfilang.parser.ValidationError.UndefinedVariable;

import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Semantic checks over a parsed program. The tree is only read, never
 * changed.
 */
@Slf4j
public class Validator {

    /**
     * Fails with a {@link ValidationException} on the first problem.
     */
    public void validateProgram(List<Statement> statements) {
        var context = new ValidationContext();

        for (int i = 0; i < statements.size(); i++) {
            validateStatement(statements.get(i), i + 1, context);
        }
        log.debug("validated {} top-level statements", statements.size());
    }

    /**
     * Keeps going after a failing top-level statement and returns every
     * problem found, at most one per top-level statement.
     */
    public List<ValidationError> validateProgramDetailed(List<Statement> statements) {
        var context = new ValidationContext();
        List<ValidationError> errors = new ArrayList<>();

        for (int i = 0; i < statements.size(); i++) {
            try {
                validateStatement(statements.get(i), i + 1, context);
            } catch (ValidationException e) {
                errors.add(e.error());
            }
        }
        return errors;
    }

    void validateStatement(Statement statement, int line, ValidationContext context) {
        if (statement instanceof PrintStatement ps) {
            if (ps.expressions().isEmpty()) {
                throw new ValidationException(new EmptyPrintStatement(line));
            }
            ps.expressions().forEach(e -> validateExpression(e, line, context));
        } else if (statement instanceof VariableDeclaration vd) {
            validateVariableDeclaration(vd, line, context);
        } else if (statement instanceof IfStatement ifs) {
            if (ifs.thenBlock().isEmpty()) {
                throw new ValidationException(new EmptyBlock(line, "magadheera"));
            }
            if (ifs.elseBlock().isPresent() && ifs.elseBlock().get().isEmpty()) {
                throw new ValidationException(new EmptyBlock(line, "karthikeya"));
            }
            validateExpression(ifs.condition(), line, context);
            validateBlock(ifs.thenBlock(), line, context);
            ifs.elseBlock().ifPresent(b -> validateBlock(b, line, context));
        } else if (statement instanceof WhileStatement ws) {
            if (ws.body().isEmpty()) {
                throw new ValidationException(new EmptyBlock(line, "pokiri"));
            }
            validateExpression(ws.condition(), line, context);
            validateBlock(ws.body(), line, context);
        } else if (statement instanceof ForStatement fs) {
            if (fs.body().isEmpty()) {
                throw new ValidationException(new EmptyBlock(line, "eega"));
            }
            // the loop variable lives as long as the loop
            context.enterScope();
            try {
                validateVariableDeclaration(fs.init(), line, context);
                validateExpression(fs.condition(), line, context);
                validateExpression(fs.update(), line, context);
                fs.body().forEach(s -> validateStatement(s, line, context));
            } finally {
                context.exitScope();
            }
        } else {
            throw new ValidationException(new InvalidExpression(line, "Unsupported statement " + statement));
        }
    }

    private void validateVariableDeclaration(VariableDeclaration vd, int line, ValidationContext context) {
        var type = vd.declarationType();
        if (vd.name() == null || vd.name().isEmpty()) {
            throw new ValidationException(new EmptyIdentifier(line, type.keyword));
        }
        context.checkRedeclaration(vd.name(), line, type);
        // the initializer cannot see the name it initializes
        validateExpression(vd.initializer(), line, context);
        context.bind(vd.name(), line, type);
    }

    private void validateBlock(List<Statement> block, int line, ValidationContext context) {
        context.enterScope();
        try {
            block.forEach(s -> validateStatement(s, line, context));
        } finally {
            context.exitScope();
        }
    }

    void validateExpression(Expression expression, int line, ValidationContext context) {
        if (expression instanceof NumberExpression || expression instanceof StringExpression) {
            return;
        }
        if (expression instanceof VariableExpression ve) {
            if (!context.isVariableDeclared(ve.name())) {
                throw new ValidationException(new UndefinedVariable(line, ve.name()));
            }
        } else if (expression instanceof BinaryExpression be) {
            validateExpression(be.left(), line, context);
            validateExpression(be.right(), line, context);
            if (be.operator() == null || !be.operator().isBinaryOperator()) {
                throw new ValidationException(new InvalidExpression(line, "Unknown operator: " + be.operator()));
            }
        } else {
            throw new ValidationException(new InvalidExpression(line, "Unsupported expression " + expression));
        }
    }

    public record Binding(int line, DeclarationType type) {}

    /**
     * Declared names, innermost scope first. The outermost scope is never
     * removed.
     */
    @ToString
    public static class ValidationContext {
        private final Deque<Map<String, Binding>> scopes = new ArrayDeque<>();

        public ValidationContext() {
            scopes.push(new HashMap<>());
        }

        public void enterScope() {
            scopes.push(new HashMap<>());
        }

        public void exitScope() {
            if (scopes.size() == 1) {
                throw new IllegalStateException("cannot leave the program scope");
            }
            scopes.pop();
        }

        public int depth() {
            return scopes.size();
        }

        public Optional<Binding> lookup(String name) {
            for (var scope : scopes) {
                var binding = scope.get(name);
                if (binding != null) {
                    return Optional.of(binding);
                }
            }
            return Optional.empty();
        }

        public boolean isVariableDeclared(String name) {
            return lookup(name).isPresent();
        }

        /**
         * Only a {@code rrr} name may be declared again, and only with
         * {@code pushpa}.
         */
        public void checkRedeclaration(String name, int line, DeclarationType type) {
            var existing = lookup(name);
            if (existing.isPresent()) {
                var original = existing.get();
                if (!(original.type() == DeclarationType.CONST && type == DeclarationType.LET)) {
                    throw new ValidationException(new DuplicateVariable(line, name, original.line()));
                }
            }
        }

        /**
         * Adds the name to the innermost scope and returns the new binding.
         * Bindings are told apart by identity.
         */
        public Binding bind(String name, int line, DeclarationType type) {
            var binding = new Binding(line, type);
            scopes.peek().put(name, binding);
            return binding;
        }

        public void declareVariable(String name, int line, DeclarationType type) {
            checkRedeclaration(name, line, type);
            bind(name, line, type);
        }

        public Set<String> declaredVariables() {
            Set<String> names = new LinkedHashSet<>();
            scopes.descendingIterator().forEachRemaining(scope -> names.addAll(scope.keySet()));
            return names;
        }
    }

}
