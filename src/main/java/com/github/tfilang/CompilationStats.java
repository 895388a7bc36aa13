package com.github.tfilang;

import java.util.List;

import com.github.tfilang.parser.CompilationUnit;
import com.github.tfilang.parser.CompilationUnit.ConstDeclaration;
import com.github.tfilang.parser.CompilationUnit.ForStatement;
import com.github.tfilang.parser.CompilationUnit.IfStatement;
import com.github.tfilang.parser.CompilationUnit.LetDeclaration;
import com.github.tfilang.parser.CompilationUnit.PrintStatement;
import com.github.tfilang.parser.CompilationUnit.Statement;
import com.github.tfilang.parser.CompilationUnit.WhileStatement;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Statement counts of a parsed program. Everything but
 * {@link #totalStatements()} includes nested statements; the declaration in
 * an {@code eega} header is not counted.
 */
@Accessors(fluent = true)
@Getter
@ToString
public class CompilationStats {
    private int totalStatements;
    private int printStatements;
    private int constDeclarations;
    private int letDeclarations;
    private int ifStatements;
    private int whileLoops;
    private int forLoops;

    public static CompilationStats of(CompilationUnit unit) {
        var stats = new CompilationStats();
        stats.totalStatements = unit.statements().size();
        stats.count(unit.statements());
        return stats;
    }

    private void count(List<Statement> statements) {
        statements.forEach(this::count);
    }

    private void count(Statement statement) {
        if (statement instanceof PrintStatement) {
            printStatements++;
        } else if (statement instanceof ConstDeclaration) {
            constDeclarations++;
        } else if (statement instanceof LetDeclaration) {
            letDeclarations++;
        } else if (statement instanceof IfStatement ifs) {
            ifStatements++;
            count(ifs.thenBlock());
            ifs.elseBlock().ifPresent(this::count);
        } else if (statement instanceof WhileStatement ws) {
            whileLoops++;
            count(ws.body());
        } else if (statement instanceof ForStatement fs) {
            forLoops++;
            count(fs.body());
        } else {
            throw new IllegalArgumentException("Unknown statement " + statement);
        }
    }

    public int totalDeclarations() {
        return constDeclarations + letDeclarations;
    }

    public int totalControlStructures() {
        return ifStatements + whileLoops + forLoops;
    }

    public String summary() {
        return "Compilation Summary:\n"
                + "- Total statements: " + totalStatements + "\n"
                + "- Print statements: " + printStatements + "\n"
                + "- Variable declarations: " + totalDeclarations() + "\n"
                + "- Control structures: " + totalControlStructures();
    }
}
