package com.github.tfilang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Tokenizer {

    static final String STRING_PUNCTUATION = "!#$%&'()*+,-./:;<=>?@[]^_`{|}~";

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.keyword) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());
        patterns.add(new CommentPattern());

        // comments before "/", longer symbols before their prefixes
        patterns.sort(Comparator.comparingInt(
            (Pattern p) -> p instanceof CommentPattern ? Integer.MAX_VALUE
                : p instanceof StaticPattern sp ? sp.pattern.length()
                : Integer.MIN_VALUE).reversed());
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        while (index < programString.length()) {
            if (isWhitespace(programString.charAt(index))) {
                index++;
                continue;
            }

            boolean gotMatch = false;
            for (var pattern : patterns) {
                var result = pattern.match(programString, index);
                if (result.isPresent()) {
                    var token = result.get();
                    if (token.type() != TokenType.COMMENT) {
                        tokens.add(token);
                    }
                    index = token.end();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                throw new LexException(new LexError.UnexpectedCharacter(
                        programString.codePointAt(index), index, SourcePosition.of(programString, index)));
            }
        }

        tokens.add(new Token(TokenType.EOF, "", index, index));
        log.debug("tokenized {} characters into {} tokens", programString.length(), tokens.size());

        return new Tokens(programString, tokens);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
    }

    interface Pattern {
        Optional<Token> match(String programString, int index);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, index, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (isAsciiDigit(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isAsciiDigit(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                try {
                    Integer.parseInt(image);
                } catch (NumberFormatException e) {
                    throw new LexException(new LexError.NumberOutOfRange(image, start, SourcePosition.of(programString, start)));
                }
                return Optional.of(new Token(TokenType.NUMBER, image, start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    /**
     * Identifiers and keywords. A keyword only matches when the whole run
     * equals it, so {@code rrrx} stays an identifier.
     */
    static class IdentifierPattern implements Pattern {
        private static final Map<String, TokenType> KEYWORDS = Arrays.stream(TokenType.values())
                .filter(t -> t.keyword)
                .collect(Collectors.toMap(t -> t.constantPattern, Function.identity()));

        @Override
        public Optional<Token> match(String programString, int index) {
            if (isIdentifierStart(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isIdentifierPart(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = KEYWORDS.getOrDefault(image, TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, start, index));
            } else {
                return Optional.empty();
            }
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || isAsciiDigit(c);
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.charAt(index) == '"') {
                int start = index;
                index++;
                while (index < programString.length()) {
                    char cur = programString.charAt(index);
                    if (cur == '"') {
                        break;
                    }
                    if (cur == '\n' || cur == '\r') {
                        throw unterminated(programString, start);
                    }
                    if (!isStringCharacter(cur)) {
                        throw new LexException(new LexError.UnexpectedCharacter(
                                programString.codePointAt(index), index, SourcePosition.of(programString, index)));
                    }
                    index++;
                }
                if (index == programString.length()) {
                    throw unterminated(programString, start);
                }
                index += 1;
                return Optional.of(new Token(TokenType.STRING, programString.substring(start + 1, index - 1), start, index));
            } else {
                return Optional.empty();
            }
        }

        private static LexException unterminated(String programString, int start) {
            return new LexException(new LexError.UnterminatedString(start, SourcePosition.of(programString, start)));
        }

        private static boolean isStringCharacter(char c) {
            return c == ' '
                    || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isAsciiDigit(c)
                    || STRING_PUNCTUATION.indexOf(c) >= 0;
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.startsWith("//", index)) {
                int start = index;
                index += 2;
                while (index < programString.length() && programString.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, index), start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public record Token(TokenType type, String image, int start, int end) {
        public int length() {
            return end - start;
        }
    }

    public enum TokenType {
        PRINT("bahubali", true),
        CONST("rrr", true),
        LET("pushpa", true),
        IF("magadheera", true),
        ELSE("karthikeya", true),
        WHILE("pokiri", true),
        FOR("eega", true),

        IDENTIFIER,
        NUMBER,
        STRING,

        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        GE(">="), LE("<="),
        GT(">"), LT("<"),
        PLUS("+"), MINUS("-"),
        STAR("*"), SLASH("/"),

        COMMENT,

        LBRACE("{"),
        RBRACE("}"),
        LPAREN("("),
        RPAREN(")"),

        SEMICOLON(";"),
        EQUALS("="),
        COMMA(","),
        EOF;

        private static final Set<TokenType> BINARY_OPERATORS = EnumSet.of(
                EQUALS_EQUALS, NOT_EQUALS, GE, LE, GT, LT, PLUS, MINUS, STAR, SLASH);

        public final String constantPattern;
        final boolean keyword;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this(constantPattern, false);
        }
        private TokenType(String constantPattern, boolean keyword) {
            this.constantPattern = constantPattern;
            this.keyword = keyword;
        }

        public boolean isBinaryOperator() {
            return BINARY_OPERATORS.contains(this);
        }

        /**
         * How the token type reads in an error message.
         */
        public String describe() {
            return switch (this) {
                case IDENTIFIER -> "identifier";
                case NUMBER -> "number";
                case STRING -> "string";
                case COMMENT -> "comment";
                case EOF -> "end of input";
                default -> "'" + constantPattern + "'";
            };
        }
    }

    public static class Tokens {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Tokens(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        public String source() {
            return source;
        }

        public List<Token> tokens() {
            return List.copyOf(tokens);
        }

        public Token next() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return tokens.get(index);
        }

        /**
         * The most recently consumed token, or the first token if none was
         * consumed yet.
         */
        public Token previous() {
            return tokens.get(Math.max(index - 1, 0));
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }
    }

}
