package com.tonelparser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for Smalltalk method bodies.
 *
 * <p>Never fails: characters that start no token are dropped. The role of
 * {@code |} (temporaries/parameter delimiter or binary selector) and whether
 * a {@code -} belongs to the following numeral are decided from a small
 * scope state that is updated as each token is emitted.
 */
public class Lexer {

    private static final Map<String, TokenType> PSEUDO_VARIABLES = Map.of(
        "nil", TokenType.NIL,
        "true", TokenType.TRUE,
        "false", TokenType.FALSE,
        "self", TokenType.SELF,
        "super", TokenType.SUPER,
        "thisContext", TokenType.THIS_CONTEXT
    );

    private static final String BINARY_CHARS = "\\+*/=><@%~&-?,";

    private enum ScopeKind { ROOT, BLOCK, LITERAL }

    // Declaration phase of a sequence: [ :a :b | | t1 t2 | statements ]
    private enum Phase { START, PARAMS, BODY_START, IN_TEMPS, BODY }

    private static final class Scope {
        final ScopeKind kind;
        // true for a literal-array paren, false for a code paren
        final Deque<Boolean> parens = new ArrayDeque<>();
        Phase phase = Phase.START;

        Scope(ScopeKind kind) {
            this.kind = kind;
        }
    }

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();

    private int position = 0;
    private int line = 1;
    private int lineStart = 0;
    private Token lastSignificant = null;

    public Lexer(String source) {
        this.source = source != null ? source : "";
        this.length = this.source.length();
        this.scopes.push(new Scope(ScopeKind.ROOT));
    }

    public List<Token> tokenize() {
        while (position < length) {
            char c = source.charAt(position);

            if (Character.isWhitespace(c)) {
                advanceTo(position + 1);
                continue;
            }

            switch (c) {
                case '"' -> scanQuoted('"', TokenType.COMMENT, position);
                case '\'' -> scanQuoted('\'', TokenType.STRING, position);
                case '$' -> scanCharacter();
                case '#' -> scanHash();
                case '^' -> emitChars(TokenType.RETURN, 1);
                case ';' -> emitChars(TokenType.CASCADE, 1);
                case '.' -> emitChars(TokenType.PERIOD, 1);
                case '(' -> emitChars(TokenType.LPAREN, 1);
                case ')' -> emitChars(TokenType.RPAREN, 1);
                case '[' -> emitChars(TokenType.LBRACKET, 1);
                case ']' -> emitChars(TokenType.RBRACKET, 1);
                case '{' -> emitChars(TokenType.LBRACE, 1);
                case '}' -> emitChars(TokenType.RBRACE, 1);
                case '|' -> emitChars(pipeRole(), 1);
                case ':' -> {
                    if (peekChar(1) == '=') {
                        emitChars(TokenType.ASSIGN, 2);
                    } else {
                        emitChars(TokenType.COLON, 1);
                    }
                }
                default -> scanOther(c);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, position - lineStart + 1, position, position));
        return tokens;
    }

    private void scanOther(char c) {
        if (c == '<' && isLetter(peekChar(1)) && pragmaAllowedHere() && scanPragma()) {
            return;
        }
        if (isDigit(c)) {
            scanNumber(position);
        } else if (isLetter(c)) {
            scanIdentifier();
        } else if (c == '-' && isDigit(peekChar(1)) && signMergesHere()) {
            scanNumber(position);
        } else if (isBinaryChar(c)) {
            scanBinarySelector();
        } else {
            // Unknown character
            advanceTo(position + 1);
        }
    }

    // ------------------------------------------------------------------
    // Literals
    // ------------------------------------------------------------------

    /**
     * Scans a quote-delimited span starting at {@code start}, where a doubled
     * delimiter stands for the delimiter itself. An unterminated span drops
     * its opening character only.
     */
    private void scanQuoted(char quote, TokenType type, int start) {
        int end = quotedEnd(quote, position);
        if (end < 0) {
            advanceTo(position + 1);
            return;
        }
        emit(type, start, end);
    }

    /** Offset just past the closing quote of the span opened at {@code open}, or -1. */
    private int quotedEnd(char quote, int open) {
        int i = open + 1;
        while (i < length) {
            if (source.charAt(i) == quote) {
                if (i + 1 < length && source.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private void scanCharacter() {
        if (position + 1 >= length) {
            advanceTo(position + 1);
            return;
        }
        int cp = source.codePointAt(position + 1);
        emit(TokenType.CHARACTER, position, position + 1 + Character.charCount(cp));
    }

    private void scanHash() {
        char next = peekChar(1);
        if (next == '(') {
            emitChars(TokenType.LITERAL_ARRAY_START, 2);
        } else if (next == '[') {
            emitChars(TokenType.BYTE_ARRAY_START, 2);
        } else if (isLetter(next) || next == '_') {
            int end = identifierEnd(position + 1, true);
            // Keyword symbols such as #at:put:
            while (end < length && source.charAt(end) == ':') {
                int partEnd = identifierEnd(end + 1, true);
                if (partEnd < length && source.charAt(partEnd) == ':' && partEnd > end + 1) {
                    end = partEnd;
                } else {
                    end++;
                    break;
                }
            }
            emit(TokenType.SYMBOL, position, end);
        } else if (next == '\'') {
            int end = quotedEnd('\'', position + 1);
            if (end < 0) {
                advanceTo(position + 1);
            } else {
                emit(TokenType.SYMBOL, position, end);
            }
        } else if (isBinaryChar(next) || next == '|') {
            int end = position + 1;
            while (end < length && (isBinaryChar(source.charAt(end)) || source.charAt(end) == '|')) {
                end++;
            }
            emit(TokenType.SYMBOL, position, end);
        } else {
            advanceTo(position + 1);
        }
    }

    /**
     * Scans a numeral starting at {@code start}, which is either a digit or a
     * minus sign directly followed by a digit. Forms: radix {@code 16rFF},
     * scaled decimal {@code 3.14s2}, float {@code 1.5e-3} and integer.
     */
    private void scanNumber(int start) {
        int digitsStart = source.charAt(start) == '-' ? start + 1 : start;
        int end = digitsEnd(digitsStart);

        if (end < length && source.charAt(end) == 'r' && end + 1 < length
                && isAlphanumeric(source.charAt(end + 1))) {
            int radixEnd = end + 1;
            while (radixEnd < length && isAlphanumeric(source.charAt(radixEnd))) {
                radixEnd++;
            }
            emit(TokenType.NUMBER, start, radixEnd);
            return;
        }

        if (end + 1 < length && source.charAt(end) == '.' && isDigit(source.charAt(end + 1))) {
            int fractionEnd = digitsEnd(end + 1);
            if (fractionEnd < length && source.charAt(fractionEnd) == 's') {
                emit(TokenType.NUMBER, start, digitsEnd(fractionEnd + 1));
                return;
            }
            end = fractionEnd;
        }

        if (end < length && (source.charAt(end) == 'e' || source.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < length && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && isDigit(source.charAt(exponent))) {
                end = digitsEnd(exponent);
            }
        }

        emit(TokenType.NUMBER, start, end);
    }

    private int digitsEnd(int from) {
        int i = from;
        while (i < length && isDigit(source.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * A {@code -} joins the following numeral when nothing before it could
     * receive a binary message, and always inside literal and byte arrays.
     */
    private boolean signMergesHere() {
        if (isLiteralContext()) {
            return true;
        }
        return lastSignificant == null || !lastSignificant.type().canEndReceiver();
    }

    // ------------------------------------------------------------------
    // Names, selectors and pragmas
    // ------------------------------------------------------------------

    private void scanIdentifier() {
        int end = identifierEnd(position, false);
        if (end < length && source.charAt(end) == ':' && !(end + 1 < length && source.charAt(end + 1) == '=')) {
            emit(TokenType.KEYWORD, position, end + 1);
            return;
        }
        String word = source.substring(position, end);
        emit(PSEUDO_VARIABLES.getOrDefault(word, TokenType.IDENTIFIER), position, end);
    }

    private int identifierEnd(int from, boolean allowLeadingUnderscore) {
        int i = from;
        if (i < length && (isLetter(source.charAt(i)) || (allowLeadingUnderscore && source.charAt(i) == '_'))) {
            i++;
        }
        while (i < length && (isAlphanumeric(source.charAt(i)) || source.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    /**
     * Binary selector run. A {@code -} that is not the first character and
     * starts a numeral ends the run, so {@code 3+-4} reads as {@code 3 + -4}.
     */
    private void scanBinarySelector() {
        int end = position + 1;
        while (end < length && isBinaryChar(source.charAt(end))) {
            if (source.charAt(end) == '-' && end + 1 < length && isDigit(source.charAt(end + 1))) {
                break;
            }
            end++;
        }
        emit(TokenType.BINARY_SELECTOR, position, end);
    }

    private boolean pragmaAllowedHere() {
        return lastSignificant == null
            || lastSignificant.is(TokenType.PERIOD)
            || lastSignificant.is(TokenType.PIPE);
    }

    /** Scans {@code <name ...>} honouring quoted strings; false when there is no closing '>'. */
    private boolean scanPragma() {
        int i = position + 1;
        while (i < length) {
            char c = source.charAt(i);
            if (c == '\'') {
                int end = quotedEnd('\'', i);
                if (end < 0) {
                    return false;
                }
                i = end;
                continue;
            }
            if (c == '>') {
                emit(TokenType.PRAGMA, position, i + 1);
                return true;
            }
            i++;
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Context tracking
    // ------------------------------------------------------------------

    private Scope scope() {
        return scopes.peek();
    }

    private boolean isLiteralContext() {
        Scope scope = scope();
        if (scope.kind == ScopeKind.LITERAL) {
            return true;
        }
        Boolean innermost = scope.parens.peek();
        return innermost != null && innermost;
    }

    private TokenType pipeRole() {
        Scope scope = scope();
        if (!scope.parens.isEmpty() || scope.kind == ScopeKind.LITERAL) {
            return TokenType.BINARY_SELECTOR;
        }
        return switch (scope.phase) {
            case PARAMS, START, BODY_START, IN_TEMPS -> TokenType.PIPE;
            case BODY -> lastSignificant != null && lastSignificant.type().canEndReceiver()
                ? TokenType.BINARY_SELECTOR
                : TokenType.PIPE;
        };
    }

    private void track(Token token) {
        Scope scope = scope();
        switch (token.type()) {
            case PIPE -> scope.phase = switch (scope.phase) {
                case PARAMS -> Phase.BODY_START;
                case START, BODY_START -> Phase.IN_TEMPS;
                case IN_TEMPS, BODY -> Phase.BODY;
            };
            case COLON -> scope.phase = scope.phase == Phase.START || scope.phase == Phase.PARAMS
                ? Phase.PARAMS
                : Phase.BODY;
            case IDENTIFIER, NIL, TRUE, FALSE, SELF, SUPER, THIS_CONTEXT -> {
                if (scope.phase != Phase.PARAMS && scope.phase != Phase.IN_TEMPS) {
                    scope.phase = Phase.BODY;
                }
            }
            case LBRACKET -> {
                scope.phase = Phase.BODY;
                scopes.push(new Scope(ScopeKind.BLOCK));
            }
            case BYTE_ARRAY_START -> {
                scope.phase = Phase.BODY;
                scopes.push(new Scope(ScopeKind.LITERAL));
            }
            case RBRACKET -> {
                if (scopes.size() > 1) {
                    scopes.pop();
                }
            }
            case LPAREN -> {
                scope.phase = Phase.BODY;
                scope.parens.push(isLiteralContext());
            }
            case LITERAL_ARRAY_START -> {
                scope.phase = Phase.BODY;
                scope.parens.push(Boolean.TRUE);
            }
            case RPAREN -> {
                if (!scope.parens.isEmpty()) {
                    scope.parens.pop();
                }
            }
            default -> {
                if (scope.phase != Phase.IN_TEMPS) {
                    scope.phase = Phase.BODY;
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Emission and position bookkeeping
    // ------------------------------------------------------------------

    private void emitChars(TokenType type, int count) {
        emit(type, position, position + count);
    }

    private void emit(TokenType type, int start, int end) {
        Token token = new Token(type, source.substring(start, end), line, start - lineStart + 1, start, end);
        tokens.add(token);
        advanceTo(end);
        if (!type.isTrivia()) {
            track(token);
            lastSignificant = token;
        }
    }

    private void advanceTo(int end) {
        for (int i = position; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        position = end;
    }

    private char peekChar(int offset) {
        int i = position + offset;
        return i < length ? source.charAt(i) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphanumeric(char c) {
        return isLetter(c) || isDigit(c);
    }

    private static boolean isBinaryChar(char c) {
        return BINARY_CHARS.indexOf(c) >= 0;
    }
}
