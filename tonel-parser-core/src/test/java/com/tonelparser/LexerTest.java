package com.tonelparser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type(), "token stream must end with EOF");
        return tokens.subList(0, tokens.size() - 1);
    }

    private static List<TokenType> types(String source) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : lex(source)) {
            types.add(token.type());
        }
        return types;
    }

    private static List<String> lexemes(String source) {
        List<String> lexemes = new ArrayList<>();
        for (Token token : lex(source)) {
            lexemes.add(token.lexeme());
        }
        return lexemes;
    }

    private static List<TokenType> pipeRoles(String source) {
        List<TokenType> roles = new ArrayList<>();
        for (Token token : lex(source)) {
            if (token.lexeme().equals("|")) {
                roles.add(token.type());
            }
        }
        return roles;
    }

    // ---------------------------------------------------------------- pipes

    @Test
    void testBlockParameterPipeIsDelimiter() {
        assertEquals(List.of(TokenType.PIPE), pipeRoles("(items select: [ :each | each value ])"));
    }

    @Test
    void testPipeInsideParenthesesIsBinary() {
        assertEquals(List.of(TokenType.BINARY_SELECTOR), pipeRoles("((a | b) & c)"));
    }

    @Test
    void testPipeInNestedBlocksAndParentheses() {
        String source = "(items do: [ :pragma | (pragma second | all) ifFalse: [ :x | x ] ])";
        assertEquals(
            List.of(TokenType.PIPE, TokenType.BINARY_SELECTOR, TokenType.PIPE),
            pipeRoles(source));
    }

    @Test
    void testBlockTemporariesThenBinaryPipe() {
        assertEquals(
            List.of(TokenType.PIPE, TokenType.PIPE, TokenType.BINARY_SELECTOR),
            pipeRoles("[ | temp | (temp | other) ]"));
    }

    @Test
    void testPipeAfterReceiverIsBinary() {
        assertEquals(List.of(TokenType.BINARY_SELECTOR), pipeRoles("true | false"));
    }

    @Test
    void testMethodTemporariesFollowedByBinaryPipe() {
        assertEquals(
            List.of(TokenType.PIPE, TokenType.PIPE, TokenType.BINARY_SELECTOR),
            pipeRoles("| a b | a | b"));
    }

    @Test
    void testParametersAndTemporariesInOneBlock() {
        assertEquals(
            List.of(TokenType.PIPE, TokenType.PIPE, TokenType.PIPE, TokenType.BINARY_SELECTOR),
            pipeRoles("[ :x | | t | t := x | false ]"));
    }

    @Test
    void testPipeAfterBlockParametersWithoutSpaces() {
        assertEquals(List.of(TokenType.PIPE), pipeRoles("[:x|x]"));
    }

    @Test
    void testPipeInLiteralArrayIsBinary() {
        assertEquals(List.of(TokenType.BINARY_SELECTOR), pipeRoles("#(a | b)"));
    }

    // ------------------------------------------------------- signed numbers

    @Test
    void testMinusAfterBinarySelectorMerges() {
        assertEquals(List.of("x", "+", "-5"), lexemes("x + -5"));
        assertEquals(TokenType.NUMBER, lex("x + -5").get(2).type());
    }

    @Test
    void testMinusAfterReceiverStaysBinary() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.BINARY_SELECTOR, TokenType.NUMBER),
            types("x - 5"));
        assertEquals(List.of("x", "-", "5"), lexemes("x-5"));
        assertEquals(List.of("3", "-", "5"), lexemes("3 -5"));
    }

    @Test
    void testMinusAtStatementStartMerges() {
        assertEquals(List.of("-1"), lexemes("-1"));
        assertEquals(List.of("x", ":=", "-3", ".", "^", "-4.5"), lexemes("x := -3. ^ -4.5"));
        assertEquals(List.of("a", "at:", "-1"), lexemes("a at: -1"));
    }

    @Test
    void testBinaryRunStopsBeforeSignedNumeral() {
        assertEquals(List.of("3", "+", "-4"), lexemes("3+-4"));
        assertEquals(List.of("a", "->", "b"), lexemes("a->b"));
    }

    @Test
    void testPlusNeverMerges() {
        assertEquals(
            List.of(TokenType.BINARY_SELECTOR, TokenType.NUMBER),
            types("+5"));
    }

    @Test
    void testMinusAlwaysMergesInsideLiteralArrays() {
        assertEquals(List.of("#(", "1", "-2", ")"), lexemes("#(1 -2)"));
        assertEquals(List.of("#[", "1", "-2", "]"), lexemes("#[1 -2]"));
    }

    @Test
    void testSignedRadixNumber() {
        assertEquals(List.of("x", ":=", "-16rFF"), lexemes("x := -16rFF"));
    }

    // ---------------------------------------------------------- literals

    @Test
    void testNumberForms() {
        assertEquals(List.of("16rFF", "3.14s2", "1.5e10", "2e-3", "42", "1.5s"),
            lexemes("16rFF 3.14s2 1.5e10 2e-3 42 1.5s"));
        for (Token token : lex("16rFF 3.14s2 1.5e10 2e-3 42")) {
            assertEquals(TokenType.NUMBER, token.type(), token.toString());
        }
    }

    @Test
    void testNumberFollowedByStatementPeriod() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER, TokenType.PERIOD),
            types("x := 1."));
    }

    @Test
    void testStringsAndComments() {
        List<Token> tokens = lex("\"a \"\"quoted\"\" comment\" 'it''s'");
        assertEquals(2, tokens.size());
        assertEquals(TokenType.COMMENT, tokens.get(0).type());
        assertEquals("\"a \"\"quoted\"\" comment\"", tokens.get(0).lexeme());
        assertEquals(TokenType.STRING, tokens.get(1).type());
        assertEquals("'it''s'", tokens.get(1).lexeme());
    }

    @Test
    void testCharacters() {
        assertEquals(List.of("$a", "$$", "$'", "$ "), lexemes("$a $$ $' $ "));
        assertEquals(
            List.of(TokenType.CHARACTER, TokenType.CHARACTER, TokenType.CHARACTER, TokenType.CHARACTER),
            types("$a $$ $' $ "));
    }

    @Test
    void testSymbols() {
        List<String> source = List.of("#foo", "#at:put:", "#value:", "#'hello world'", "#+", "#==>", "#|", "#_private");
        List<Token> tokens = lex(String.join(" ", source));
        assertEquals(source.size(), tokens.size());
        for (int i = 0; i < source.size(); i++) {
            assertEquals(TokenType.SYMBOL, tokens.get(i).type());
            assertEquals(source.get(i), tokens.get(i).lexeme());
        }
    }

    @Test
    void testArrayOpeners() {
        assertEquals(
            List.of(TokenType.LITERAL_ARRAY_START, TokenType.RPAREN,
                    TokenType.BYTE_ARRAY_START, TokenType.RBRACKET,
                    TokenType.LBRACE, TokenType.RBRACE),
            types("#() #[] {}"));
    }

    // ---------------------------------------------------------- names

    @Test
    void testKeywordsAndAssignment() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.NUMBER, TokenType.KEYWORD, TokenType.NUMBER),
            types("a at: 1 put: 2"));
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER),
            types("x:=1"));
    }

    @Test
    void testPseudoVariables() {
        assertEquals(
            List.of(TokenType.NIL, TokenType.TRUE, TokenType.FALSE,
                    TokenType.SELF, TokenType.SUPER, TokenType.THIS_CONTEXT, TokenType.IDENTIFIER),
            types("nil true false self super thisContext selfish"));
    }

    @Test
    void testPunctuation() {
        assertEquals(
            List.of(TokenType.RETURN, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.CASCADE,
                    TokenType.IDENTIFIER, TokenType.PERIOD),
            types("^ a b; c."));
        assertEquals(List.of(TokenType.LBRACKET, TokenType.COLON, TokenType.IDENTIFIER), types("[ : x"));
    }

    // ---------------------------------------------------------- pragmas

    @Test
    void testPragmaAtStatementStart() {
        List<Token> tokens = lex("<primitive: 60 error: 'a > b'> ^ self");
        assertEquals(TokenType.PRAGMA, tokens.get(0).type());
        assertEquals("<primitive: 60 error: 'a > b'>", tokens.get(0).lexeme());
        assertEquals(TokenType.RETURN, tokens.get(1).type());
    }

    @Test
    void testLessThanInExpressionIsBinary() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.BINARY_SELECTOR, TokenType.IDENTIFIER),
            types("a <b"));
        assertEquals(List.of("a", "<", "b", ">", "c"), lexemes("a <b> c"));
    }

    @Test
    void testPragmaAfterTemporaries() {
        assertEquals(
            List.of(TokenType.PIPE, TokenType.IDENTIFIER, TokenType.PIPE, TokenType.PRAGMA, TokenType.IDENTIFIER),
            types("| a | <foo> a"));
    }

    // ---------------------------------------------------------- recovery and positions

    @Test
    void testUnknownCharactersAreDropped() {
        assertEquals(List.of("a", "b"), lexemes("a ! b"));
        assertEquals(List.of("abc"), lexemes("'abc"));
        // only the opening quote of an unterminated comment is dropped
        assertEquals(List.of("x", "never", "closed"), lexemes("x \"never closed"));
        assertEquals(List.of(), lexemes("#"));
    }

    @Test
    void testEmptySourceIsJustEof() {
        List<Token> tokens = new Lexer("").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
    }

    @Test
    void testLineAndColumn() {
        List<Token> tokens = lex("x := 1.\n  y foo");
        Token y = tokens.get(4);
        assertEquals("y", y.lexeme());
        assertEquals(2, y.line());
        assertEquals(3, y.column());
        assertEquals(10, y.position());
        assertEquals(11, y.endPosition());
    }

    @Test
    void testLineCountingInsideMultiLineTokens() {
        List<Token> tokens = lex("'one\ntwo' \"c\nd\" z");
        Token z = tokens.get(2);
        assertEquals(3, z.line());
        assertEquals(4, z.column());
    }
}
