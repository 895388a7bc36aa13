package com.github.tfilang;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.github.tfilang.parser.CompilationUnit;
import com.github.tfilang.parser.CompilationUnit.BinaryExpression;
import com.github.tfilang.parser.CompilationUnit.Expression;
import com.github.tfilang.parser.CompilationUnit.ForStatement;
import com.github.tfilang.parser.CompilationUnit.IfStatement;
import com.github.tfilang.parser.CompilationUnit.PrintStatement;
import com.github.tfilang.parser.CompilationUnit.Statement;
import com.github.tfilang.parser.CompilationUnit.VariableDeclaration;
import com.github.tfilang.parser.CompilationUnit.VariableExpression;
import com.github.tfilang.parser.CompilationUnit.WhileStatement;
import com.github.tfilang.parser.Parser;
import com.github.tfilang.parser.SyntaxException;
import com.github.tfilang.parser.ValidationException;
import com.github.tfilang.parser.Validator;
import com.github.tfilang.parser.Validator.Binding;
import com.github.tfilang.parser.Validator.ValidationContext;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a source through tokenizer, parser, validator and generator. Every
 * call starts from fresh stage state, so one instance may compile any
 * number of sources.
 */
@Slf4j
public class Compiler implements ConfigReader.ConfigTarget {

    static final int EXIT_COMPILATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final int MAX_PRINT_ARGUMENTS = 5;
    static final int MAX_LOOP_BODY = 10;

    @Getter
    @Setter
    private CompilationOptions options = new CompilationOptions();

    public static void main(String[] args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);
        int status = compiler.run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: Compiler <input.tfi> [output.js]");
            return EXIT_USAGE;
        }
        var input = Path.of(args[0]);
        var fileName = input.getFileName().toString();
        if (!fileName.endsWith(".tfi")) {
            err.println("Error: Input file must have a .tfi extension (e.g., main.tfi)");
            return EXIT_USAGE;
        }
        var output = args.length == 2
                ? Path.of(args[1])
                : input.resolveSibling(fileName.substring(0, fileName.length() - ".tfi".length()) + ".js");

        try {
            var source = Files.readString(input, StandardCharsets.UTF_8);
            var result = compileWithOptions(source, options);
            Files.writeString(output, result.generatedText(), StandardCharsets.UTF_8);
            log.info("compiled {} to {}", input, output);
            out.println("Compiled successfully! Output written to: " + output);

            if (result.hasWarnings()) {
                err.println("Compilation warnings:");
                result.warnings().forEach(w -> err.println("  " + w));
            }
            out.println(compilationStats(source).summary());
            return 0;
        } catch (CompilationException e) {
            log.info("compilation of {} failed", input);
            err.println(e.getMessage());
            return EXIT_COMPILATION_FAILED;
        } catch (IOException e) {
            log.debug("cannot compile {}", input, e);
            err.println("Error: " + e.getMessage());
            return EXIT_COMPILATION_FAILED;
        }
    }

    public String compile(String source) {
        return compileWithDetails(source).generatedText();
    }

    /**
     * @throws CompilationException for the first error of any stage
     */
    public CompilationResult compileWithDetails(String source) {
        var unit = parse(source);

        try {
            new Validator().validateProgram(unit.statements());
        } catch (ValidationException e) {
            throw new CompilationException(e.error(), e);
        }
        log.debug("validation passed");

        String code;
        try {
            code = new Generator().generateProgram(unit.statements());
        } catch (GenerationException e) {
            throw new CompilationException(e.error(), e);
        }

        var result = new CompilationResult(code, unit.statements().size());
        collectWarnings(unit.statements()).forEach(warning -> {
            log.debug("warning: {}", warning);
            result.addWarning(warning);
        });
        return result;
    }

    public CompilationResult compileWithOptions(String source, CompilationOptions options) {
        var result = compileWithDetails(source);
        if (options.isDefault()) {
            return result;
        }
        return result.withGeneratedText(OutputFormatter.apply(result.generatedText(), source, options));
    }

    /**
     * Counts statements without validating the program.
     */
    public CompilationStats compilationStats(String source) {
        return CompilationStats.of(parse(source));
    }

    private CompilationUnit parse(String source) {
        try {
            var tokens = new Tokenizer().tokenize(source);
            return new Parser().parseCompilationUnit(tokens);
        } catch (LexException e) {
            throw new CompilationException(e.error(), e);
        } catch (SyntaxException e) {
            throw new CompilationException(e.error(), e);
        }
    }

    static List<String> collectWarnings(List<Statement> statements) {
        var scan = new WarningScan();
        if (statements.isEmpty()) {
            scan.warnings.add("Program contains no statements");
        }
        for (int i = 0; i < statements.size(); i++) {
            scan.statement(statements.get(i), i + 1);
        }
        for (var declared : scan.declarations) {
            if (!scan.read.contains(declared.binding())) {
                scan.warnings.add("Statement " + declared.binding().line() + ": variable '" + declared.name()
                        + "' is declared but never read");
            }
        }
        return scan.warnings;
    }

    /**
     * Walks the tree once, recording structural warnings as it goes. Reads are
     * resolved through the same scopes the validator uses, so a shadowed or
     * block-local binding is only read by the names that actually see it.
     */
    private static class WarningScan {
        final List<String> warnings = new ArrayList<>();
        final List<Declared> declarations = new ArrayList<>();
        final Set<Binding> read = Collections.newSetFromMap(new IdentityHashMap<>());
        final ValidationContext context = new ValidationContext();

        record Declared(String name, Binding binding) {}

        void statement(Statement statement, int line) {
            if (statement instanceof PrintStatement ps) {
                if (ps.expressions().size() > MAX_PRINT_ARGUMENTS) {
                    warnings.add("Statement " + line + ": Print statement has " + ps.expressions().size()
                            + " arguments, consider breaking it up");
                }
                ps.expressions().forEach(this::expression);
            } else if (statement instanceof VariableDeclaration vd) {
                expression(vd.initializer());
                declarations.add(new Declared(vd.name(), context.bind(vd.name(), line, vd.declarationType())));
            } else if (statement instanceof IfStatement ifs) {
                expression(ifs.condition());
                block(ifs.thenBlock(), line);
                ifs.elseBlock().ifPresent(b -> block(b, line));
            } else if (statement instanceof WhileStatement ws) {
                if (ws.body().size() > MAX_LOOP_BODY) {
                    warnings.add("Statement " + line + ": While loop has " + ws.body().size()
                            + " statements, consider refactoring");
                }
                expression(ws.condition());
                block(ws.body(), line);
            } else if (statement instanceof ForStatement fs) {
                if (fs.body().size() > MAX_LOOP_BODY) {
                    warnings.add("Statement " + line + ": For loop has " + fs.body().size()
                            + " statements, consider refactoring");
                }
                context.enterScope();
                try {
                    statement(fs.init(), line);
                    expression(fs.condition());
                    expression(fs.update());
                    fs.body().forEach(s -> statement(s, line));
                } finally {
                    context.exitScope();
                }
            }
        }

        void block(List<Statement> block, int line) {
            context.enterScope();
            try {
                block.forEach(s -> statement(s, line));
            } finally {
                context.exitScope();
            }
        }

        void expression(Expression expression) {
            if (expression instanceof VariableExpression ve) {
                context.lookup(ve.name()).ifPresent(read::add);
            } else if (expression instanceof BinaryExpression be) {
                expression(be.left());
                expression(be.right());
            }
        }
    }

}
