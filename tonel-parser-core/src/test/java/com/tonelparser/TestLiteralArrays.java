package com.tonelparser;

import com.tonelparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLiteralArrays {

    private static List<Object> elements(String source) {
        Statement statement = Parser.parse(source).statements().get(0);
        return assertInstanceOf(LiteralArray.class, statement).elements();
    }

    private static List<Integer> bytes(String source) {
        Statement statement = Parser.parse(source).statements().get(0);
        return assertInstanceOf(ByteArray.class, statement).values();
    }

    @Test
    void testNestedArrays() {
        assertEquals(List.of(1L, List.of(2L, 3L), 4L), elements("#(1 (2 3) 4)"));
        assertEquals(List.of(List.of(List.of())), elements("#(#(()))"));
    }

    @Test
    void testAtomKinds() {
        List<Object> expected = Arrays.asList(
            "foo", "bar:", "baz", "a", "str", true, false, null, "self", "+", List.of(1L), ";");
        assertEquals(expected, elements("#(foo bar: #baz $a 'str' true false nil self + #(1) ;)"));
    }

    @Test
    void testWordsAreDataNotVariables() {
        for (Object element : elements("#(x y thisContext super)")) {
            assertInstanceOf(String.class, element);
        }
    }

    @Test
    void testAdjacentKeywordsFold() {
        assertEquals(List.of("at:put:", "at:put:", "at:", "put:"), elements("#(at:put: #at:put: at: put:)"));
    }

    @Test
    void testNumbersInLiteralArrays() {
        assertEquals(List.of(1L, -2L, 3.5, 255L), elements("#(1 -2 3.5 16rFF)"));
    }

    @Test
    void testPipeAndOperatorsAreAtoms() {
        assertEquals(List.of("a", "|", "b", "==>", ","), elements("#(a | b ==> ,)"));
    }

    @Test
    void testByteArrayInsideLiteralArray() {
        assertEquals(List.of(List.of(1L, 2L), "x"), elements("#(#[1 2] x)"));
    }

    @Test
    void testLiteralArrayAsArgument() {
        MessageSend send = (MessageSend) Parser.parse("#(3 1 2) asSortedCollection: [ :a :b | a > b ]")
            .statements().get(0);
        assertEquals(new LiteralArray(List.of(3L, 1L, 2L)), send.receiver());
    }

    @Test
    void testUnclosedLiteralArray() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> Parser.parse("#(1 2"));
        assertTrue(e.getMessage().contains("missing ')'"), e.getMessage());
        assertThrows(ExpectedTokenException.class, () -> Parser.parse("#(1 . 2)"));
    }

    @Test
    void testByteArrays() {
        assertEquals(List.of(0, 255), bytes("#[0 255]"));
        assertEquals(List.of(), bytes("#[]"));
        assertEquals(List.of(255, 10), bytes("#[16rFF 2r1010]"));
    }

    @Test
    void testByteValueOutOfRange() {
        InvalidByteValueException e = assertThrows(InvalidByteValueException.class, () -> Parser.parse("#[256]"));
        assertEquals("InvalidByteValue", e.getErrorType());
        assertEquals("256", e.getToken().lexeme());

        assertThrows(InvalidByteValueException.class, () -> Parser.parse("#[1 -1]"));
        assertThrows(InvalidByteValueException.class, () -> Parser.parse("#[1.5]"));
    }

    @Test
    void testByteArrayRejectsNonNumbers() {
        assertThrows(ExpectedTokenException.class, () -> Parser.parse("#[1 foo]"));
        assertThrows(ExpectedTokenException.class, () -> Parser.parse("#[1 2"));
    }

    @Test
    void testLiteralArrayIsImmutable() {
        List<Object> elements = elements("#(1 nil (2))");
        assertThrows(UnsupportedOperationException.class, () -> elements.add(3L));
        @SuppressWarnings("unchecked")
        List<Object> nested = (List<Object>) elements.get(2);
        assertThrows(UnsupportedOperationException.class, () -> nested.add(3L));
    }
}
