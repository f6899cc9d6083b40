package com.tonelparser;

import com.tonelparser.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Smalltalk method bodies.
 *
 * <p>Precedence, tightest first: primary, unary send, binary send, keyword
 * send, cascade, assignment. The first structural problem aborts the parse
 * with a {@link ParseException}; no partial tree is returned.
 */
public class Parser {
    private static final Set<String> RESERVED_IDENTIFIERS =
        Set.of("nil", "true", "false", "self", "super", "thisContext");

    // Deeper input is rejected before the recursion can exhaust the stack
    static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;

    public Parser(String source) {
        this(new Lexer(source).tokenize());
    }

    /**
     * @param tokens lexer output; comment and pragma tokens are dropped here
     */
    public Parser(List<Token> tokens) {
        List<Token> significant = new ArrayList<>(tokens.size() + 1);
        for (Token token : tokens) {
            if (!token.type().isTrivia()) {
                significant.add(token);
            }
        }
        if (significant.isEmpty() || !significant.get(significant.size() - 1).is(TokenType.EOF)) {
            Token last = significant.isEmpty() ? null : significant.get(significant.size() - 1);
            significant.add(last == null
                ? new Token(TokenType.EOF, "", 1, 1, 0, 0)
                : new Token(TokenType.EOF, "", last.line(), last.column() + last.lexeme().length(),
                            last.endPosition(), last.endPosition()));
        }
        this.tokens = significant;
    }

    public Sequence parse() {
        Sequence sequence = parseSequence(false);

        if (!isAtEnd() && !endsWithReturn(sequence.statements())) {
            throw new ExpectedTokenException("Unexpected " + describe(peek()) + " after statement", peek());
        }
        // Anything after a top-level return is unreachable and left unparsed
        return sequence;
    }

    // ========================================================================
    // Sequences and statements
    // ========================================================================

    private Sequence parseSequence(boolean inBlock) {
        TemporaryVariables temporaries = null;
        if (check(TokenType.PIPE)) {
            temporaries = parseTemporaries();
        }

        List<Statement> statements = parseStatements();

        if (inBlock && endsWithReturn(statements)) {
            skipToBlockEnd();
        }
        return new Sequence(temporaries, statements);
    }

    private TemporaryVariables parseTemporaries() {
        advance(); // |
        List<String> names = new ArrayList<>();
        while (check(TokenType.IDENTIFIER) || isPseudoVariable(peek())) {
            Token name = advance();
            validateBindable(name, "temporary variable");
            names.add(name.lexeme());
        }
        consume(TokenType.PIPE, "Expected closing '|' for temporaries");
        return new TemporaryVariables(names);
    }

    private List<Statement> parseStatements() {
        List<Statement> statements = new ArrayList<>();

        while (!isAtEnd() && !check(TokenType.RBRACKET)) {
            // Empty statements
            if (match(TokenType.PERIOD)) {
                continue;
            }

            if (check(TokenType.RETURN)) {
                statements.add(parseReturn());
                match(TokenType.PERIOD);
                break;
            }

            statements.add(parseExpression());

            if (!match(TokenType.PERIOD)) {
                break;
            }
        }

        return statements;
    }

    private Return parseReturn() {
        advance(); // ^
        if (!startsPrimary(peek())) {
            throw new ExpectedTokenException("expression", "return", "Expected expression after '^'", peek());
        }
        return new Return(parseExpression());
    }

    /**
     * Skips unreachable statements after a return inside a block, up to (not
     * including) the block's closing bracket.
     */
    private void skipToBlockEnd() {
        int open = 0;
        while (!isAtEnd()) {
            if (check(TokenType.RBRACKET)) {
                if (open == 0) {
                    return;
                }
                open--;
            } else if (check(TokenType.LBRACKET) || check(TokenType.BYTE_ARRAY_START)) {
                open++;
            }
            advance();
        }
    }

    private static boolean endsWithReturn(List<Statement> statements) {
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof Return;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        enterNesting();
        Expression expr = isAssignmentStart() ? parseAssignment() : parseCascade();
        depth--;
        return expr;
    }

    private void enterNesting() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new ExpectedTokenException(
                "Expressions nested deeper than " + MAX_NESTING_DEPTH + " levels", peek());
        }
    }

    private boolean isAssignmentStart() {
        return (check(TokenType.IDENTIFIER) || isPseudoVariable(peek())) && checkAhead(1, TokenType.ASSIGN);
    }

    private Assignment parseAssignment() {
        Token target = advance();
        validateBindable(target, "assignment target");
        advance(); // :=
        if (!startsPrimary(peek())) {
            throw new ExpectedTokenException("expression", "assignment", "Expected expression after ':='", peek());
        }
        return new Assignment(target.lexeme(), parseExpression());
    }

    private Expression parseCascade() {
        Expression primary = parsePrimary();
        Expression expr = parseKeywordTail(parseBinaryTail(parseUnaryTail(primary)));

        if (!check(TokenType.CASCADE)) {
            return expr;
        }
        if (expr == primary || !(expr instanceof MessageSend first)) {
            throw new ExpectedTokenException("Expected a message send before ';'", peek());
        }

        List<CascadeMessage> messages = new ArrayList<>();
        messages.add(new CascadeMessage(first.selector(), first.arguments()));
        while (match(TokenType.CASCADE)) {
            messages.add(parseCascadeMessage());
        }
        return new Cascade(first.receiver(), messages);
    }

    private CascadeMessage parseCascadeMessage() {
        if (check(TokenType.KEYWORD)) {
            StringBuilder selector = new StringBuilder();
            List<Expression> arguments = new ArrayList<>();
            while (check(TokenType.KEYWORD)) {
                Token keyword = advance();
                selector.append(keyword.lexeme());
                arguments.add(parseKeywordArgument(keyword));
            }
            return new CascadeMessage(selector.toString(), arguments);
        }
        if (check(TokenType.BINARY_SELECTOR)) {
            Token operator = advance();
            return new CascadeMessage(operator.lexeme(), List.of(parseBinaryArgument(operator)));
        }
        if (check(TokenType.IDENTIFIER)) {
            return new CascadeMessage(advance().lexeme(), List.of());
        }
        throw new ExpectedTokenException("Expected message selector after ';'", peek());
    }

    private Expression parseKeywordTail(Expression receiver) {
        if (!check(TokenType.KEYWORD)) {
            return receiver;
        }

        StringBuilder selector = new StringBuilder();
        List<Expression> arguments = new ArrayList<>();
        while (check(TokenType.KEYWORD)) {
            Token keyword = advance();
            selector.append(keyword.lexeme());
            arguments.add(parseKeywordArgument(keyword));
        }
        return new MessageSend(receiver, selector.toString(), arguments);
    }

    private Expression parseKeywordArgument(Token keyword) {
        Expression operand = parseOperand("Expected argument after '" + keyword.lexeme() + "'");
        return parseBinaryTail(parseUnaryTail(operand));
    }

    private Expression parseBinaryTail(Expression left) {
        while (check(TokenType.BINARY_SELECTOR)) {
            Token operator = advance();
            Expression right = parseBinaryArgument(operator);
            left = new MessageSend(left, operator.lexeme(), List.of(right));
        }
        return left;
    }

    private Expression parseBinaryArgument(Token operator) {
        return parseUnaryTail(parseOperand("Expected argument after binary selector '" + operator.lexeme() + "'"));
    }

    private Expression parseUnaryTail(Expression receiver) {
        while (check(TokenType.IDENTIFIER) && !checkAhead(1, TokenType.COLON)) {
            receiver = new MessageSend(receiver, advance().lexeme());
        }
        return receiver;
    }

    private Expression parseOperand(String message) {
        if (!startsPrimary(peek())) {
            throw new ExpectedTokenException("expression", "message argument", message, peek());
        }
        return parsePrimary();
    }

    // ========================================================================
    // Primaries
    // ========================================================================

    private Expression parsePrimary() {
        Token token = peek();
        return switch (token.type()) {
            case IDENTIFIER, SELF, SUPER, THIS_CONTEXT -> new Variable(advance().lexeme());
            case NIL -> new Literal(null, advance().lexeme());
            case TRUE -> new Literal(Boolean.TRUE, advance().lexeme());
            case FALSE -> new Literal(Boolean.FALSE, advance().lexeme());
            case NUMBER -> new Literal(NumberLiterals.decode(advance()), token.lexeme());
            case STRING -> new Literal(unquote(advance().lexeme()), token.lexeme());
            case CHARACTER -> new Literal(advance().lexeme().substring(1), token.lexeme());
            case SYMBOL -> new Literal(symbolName(advance().lexeme()), token.lexeme());
            case LBRACKET -> parseBlock();
            case LPAREN -> parseParenthesized();
            case LBRACE -> parseDynamicArray();
            case LITERAL_ARRAY_START -> {
                advance();
                yield new LiteralArray(parseLiteralArrayElements());
            }
            case BYTE_ARRAY_START -> new ByteArray(parseByteArrayValues());
            default -> throw new ExpectedTokenException("Unexpected " + describe(token), token);
        };
    }

    private Expression parseParenthesized() {
        advance(); // (
        if (!startsPrimary(peek())) {
            throw new ExpectedTokenException("expression", "parentheses", "Expected expression inside parentheses", peek());
        }
        Expression expr = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' to close parenthesized expression");
        return expr;
    }

    private Block parseBlock() {
        advance(); // [

        List<String> parameters = new ArrayList<>();
        while (match(TokenType.COLON)) {
            if (!check(TokenType.IDENTIFIER) && !isPseudoVariable(peek())) {
                throw new ExpectedTokenException("Expected parameter name after ':'", peek());
            }
            Token name = advance();
            validateBindable(name, "block parameter");
            parameters.add(name.lexeme());
        }

        if (!parameters.isEmpty() && !isAtEnd() && !match(TokenType.PIPE) && !check(TokenType.RBRACKET)) {
            throw new ExpectedTokenException("Expected '|' or ']' after block parameters", peek());
        }

        Sequence body = null;
        if (!isAtEnd() && !check(TokenType.RBRACKET)) {
            body = parseSequence(true);
        }

        if (isAtEnd()) {
            throw new ExpectedTokenException("Unclosed block - missing ']'", peek());
        }
        consume(TokenType.RBRACKET, "Expected ']' to close block but found " + describe(peek()));
        return new Block(parameters, body);
    }

    private DynamicArray parseDynamicArray() {
        advance(); // {
        List<Expression> expressions = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.RBRACE)) {
            if (match(TokenType.PERIOD)) {
                continue;
            }
            expressions.add(parseExpression());
            if (!match(TokenType.PERIOD)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "Expected '}' to close dynamic array");
        return new DynamicArray(expressions);
    }

    /**
     * Elements of a literal array, after its opening token and up to and
     * including the matching ')'. Words are data here, never variables.
     */
    private List<Object> parseLiteralArrayElements() {
        enterNesting();
        List<Object> elements = new ArrayList<>();

        while (!check(TokenType.RPAREN)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("Unclosed literal array - missing ')'", peek());
            }

            Token token = peek();
            switch (token.type()) {
                case NUMBER -> elements.add(NumberLiterals.decode(advance()));
                case STRING -> elements.add(unquote(advance().lexeme()));
                case CHARACTER -> elements.add(advance().lexeme().substring(1));
                case SYMBOL -> elements.add(symbolName(advance().lexeme()));
                case TRUE -> {
                    advance();
                    elements.add(Boolean.TRUE);
                }
                case FALSE -> {
                    advance();
                    elements.add(Boolean.FALSE);
                }
                case NIL -> {
                    advance();
                    elements.add(null);
                }
                case IDENTIFIER, BINARY_SELECTOR, CASCADE, SELF, SUPER, THIS_CONTEXT ->
                    elements.add(advance().lexeme());
                case KEYWORD -> elements.add(parseKeywordRun());
                case LPAREN, LITERAL_ARRAY_START -> {
                    advance();
                    elements.add(parseLiteralArrayElements());
                }
                case BYTE_ARRAY_START -> {
                    // Same number representation as the other elements
                    List<Long> bytes = new ArrayList<>();
                    for (Integer value : parseByteArrayValues()) {
                        bytes.add(value.longValue());
                    }
                    elements.add(Collections.unmodifiableList(bytes));
                }
                default -> throw new ExpectedTokenException("Unexpected " + describe(token) + " in literal array", token);
            }
        }

        advance(); // )
        depth--;
        return Collections.unmodifiableList(elements);
    }

    /** Adjacent keyword parts form one name: #(at:put:) holds 'at:put:'. */
    private String parseKeywordRun() {
        StringBuilder name = new StringBuilder(advance().lexeme());
        while (check(TokenType.KEYWORD) && peek().position() == previous().endPosition()) {
            name.append(advance().lexeme());
        }
        return name.toString();
    }

    private List<Integer> parseByteArrayValues() {
        advance(); // #[
        List<Integer> values = new ArrayList<>();

        while (!check(TokenType.RBRACKET)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("Unclosed byte array - missing ']'", peek());
            }
            if (!check(TokenType.NUMBER)) {
                throw new ExpectedTokenException("Expected byte value but found " + describe(peek()), peek());
            }
            Token token = advance();
            Number value = NumberLiterals.decode(token);
            if (!NumberLiterals.isByte(value)) {
                throw new InvalidByteValueException("Byte value must be 0-255, got " + token.lexeme(), token);
            }
            values.add(value.intValue());
        }

        advance(); // ]
        return List.copyOf(values);
    }

    // ========================================================================
    // Literal text helpers
    // ========================================================================

    private static String unquote(String quoted) {
        return quoted.substring(1, quoted.length() - 1).replace("''", "'");
    }

    private static String symbolName(String symbol) {
        String name = symbol.substring(1);
        if (name.length() >= 2 && name.startsWith("'") && name.endsWith("'")) {
            return unquote(name);
        }
        return name;
    }

    private void validateBindable(Token name, String context) {
        if (RESERVED_IDENTIFIERS.contains(name.lexeme())) {
            throw new ReservedIdentifierException(name.lexeme(), name, context);
        }
    }

    private static boolean isPseudoVariable(Token token) {
        return token.type().isPseudoVariable();
    }

    private static boolean startsPrimary(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, NIL, TRUE, FALSE, SELF, SUPER, THIS_CONTEXT,
                 NUMBER, STRING, CHARACTER, SYMBOL,
                 LBRACKET, LPAREN, LBRACE, LITERAL_ARRAY_START, BYTE_ARRAY_START -> true;
            default -> false;
        };
    }

    private static String describe(Token token) {
        if (token.is(TokenType.EOF)) {
            return "end of input";
        }
        return "token '" + token.lexeme() + "'";
    }

    // Helper methods

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(type.name(), null, message, peek());
    }

    public static Sequence parse(String source) {
        return new Parser(source).parse();
    }
}
