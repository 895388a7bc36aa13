package com.github.tfilang;

import java.util.List;
import java.util.stream.Collectors;

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

import lombok.extern.slf4j.Slf4j;

/**
 * Emits JavaScript for a validated program. Block contents are not
 * indented here; see {@link OutputFormatter#reindent(String)}.
 */
@Slf4j
public class Generator {

    private static final String INDENT = "    ";

    public String generateProgram(List<Statement> statements) {
        var code = statements.stream()
                .map(this::generateStatement)
                .collect(Collectors.joining("\n"));
        log.debug("generated {} characters of JavaScript", code.length());
        return code;
    }

    public String generateStatement(Statement statement) {
        if (statement instanceof PrintStatement ps) {
            var args = ps.expressions().stream()
                    .map(this::generateExpression)
                    .collect(Collectors.joining(", "));
            return "console.log(" + args + ");";
        } else if (statement instanceof ConstDeclaration cd) {
            return "const " + cd.name() + " = " + generateExpression(cd.initializer()) + ";";
        } else if (statement instanceof LetDeclaration ld) {
            return "let " + ld.name() + " = " + generateExpression(ld.initializer()) + ";";
        } else if (statement instanceof IfStatement ifs) {
            var code = "if (" + generateExpression(ifs.condition()) + ") {\n" + generateBlock(ifs.thenBlock()) + "\n}";
            if (ifs.elseBlock().isPresent()) {
                code += " else {\n" + generateBlock(ifs.elseBlock().get()) + "\n}";
            }
            return code;
        } else if (statement instanceof WhileStatement ws) {
            return "while (" + generateExpression(ws.condition()) + ") {\n" + generateBlock(ws.body()) + "\n}";
        } else if (statement instanceof ForStatement fs) {
            var init = generateStatement(fs.init());
            init = init.substring(0, init.length() - 1);
            // the update is evaluated and discarded, exactly as written
            return "for (" + init + "; " + generateExpression(fs.condition()) + "; " + generateExpression(fs.update()) + ") {\n"
                    + generateBlock(fs.body()) + "\n}";
        }
        throw new GenerationException(new GenerationError("no template for statement", String.valueOf(statement)));
    }

    public String generateExpression(Expression expression) {
        if (expression instanceof NumberExpression ne) {
            return Integer.toString(ne.number());
        } else if (expression instanceof VariableExpression ve) {
            return ve.name();
        } else if (expression instanceof StringExpression se) {
            return "\"" + se.string() + "\"";
        } else if (expression instanceof BinaryExpression be) {
            if (be.operator() == null || !be.operator().isBinaryOperator()) {
                throw new GenerationException(new GenerationError("not a binary operator", String.valueOf(be.operator())));
            }
            return "(" + generateExpression(be.left()) + " " + be.operator().constantPattern + " " + generateExpression(be.right()) + ")";
        }
        throw new GenerationException(new GenerationError("no template for expression", String.valueOf(expression)));
    }

    /**
     * Prefixes every line of the statement with {@code indentLevel} levels of
     * indentation.
     */
    public String generateFormattedStatement(Statement statement, int indentLevel) {
        var indent = INDENT.repeat(indentLevel);
        return generateStatement(statement).lines()
                .map(line -> indent + line)
                .collect(Collectors.joining("\n"));
    }

    public String generateFormattedProgram(List<Statement> statements) {
        return statements.stream()
                .map(s -> generateFormattedStatement(s, 0))
                .collect(Collectors.joining("\n"));
    }

    private String generateBlock(List<Statement> block) {
        return block.stream()
                .map(this::generateStatement)
                .collect(Collectors.joining("\n"));
    }

}
