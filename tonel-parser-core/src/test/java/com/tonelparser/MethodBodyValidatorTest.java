package com.tonelparser;

import com.tonelparser.MethodBodyValidator.BodyValidation;
import com.tonelparser.MethodBodyValidator.ErrorInfo;
import com.tonelparser.MethodBodyValidator.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MethodBodyValidatorTest {

    @Test
    void testValidBody() {
        ValidationResult result = MethodBodyValidator.validate("\n\t| sum |\n\tsum := 0.\n\t^ sum + 1\n");
        assertTrue(result.valid());
        assertNull(result.error());
    }

    @Test
    void testEmptyBodyIsValid() {
        assertTrue(MethodBodyValidator.validate("").valid());
        assertTrue(MethodBodyValidator.validate("  \"only a comment\"  ").valid());
    }

    @Test
    void testErrorOnSecondLine() {
        ValidationResult result = MethodBodyValidator.validate("x := 1.\ny := ");
        assertFalse(result.valid());
        ErrorInfo error = result.error();
        assertEquals(2, error.line());
        assertEquals("y :=", error.errorText());
        assertTrue(error.reason().contains("Expected expression after ':='"), error.reason());
    }

    @Test
    void testErrorTextIsStripped() {
        ErrorInfo error = MethodBodyValidator.validate("\n\tx := 1.\n\t^ x + )").error();
        assertEquals(3, error.line());
        assertEquals("^ x + )", error.errorText());
    }

    @Test
    void testReservedIdentifierReported() {
        ErrorInfo error = MethodBodyValidator.validate("self := 1").error();
        assertEquals(1, error.line());
        assertEquals("self := 1", error.errorText());
        assertTrue(error.reason().contains("reserved identifier 'self'"), error.reason());
    }

    @Test
    void testDeeplyNestedBodyIsReported() {
        ValidationResult result = MethodBodyValidator.validate("^ " + "(".repeat(3000) + "1" + ")".repeat(3000));
        assertFalse(result.valid());
        assertEquals(1, result.error().line());
        assertTrue(result.error().reason().contains("nested deeper than"), result.error().reason());
    }

    @Test
    void testValidateBodies() {
        String document = "Foo >> a [ ^ 1 ]\nFoo >> b [ ^ ]\n";
        List<BodyValidation> results = MethodBodyValidator.validateBodies(document, ScanPolicy.SKIP_UNMATCHED);
        assertEquals(2, results.size());

        assertEquals(new BracketPair(9, 15), results.get(0).pair());
        assertTrue(results.get(0).result().valid());

        ValidationResult second = results.get(1).result();
        assertFalse(second.valid());
        assertEquals(1, second.error().line());
        assertEquals("^", second.error().errorText());
        assertTrue(second.error().reason().contains("Expected expression after '^'"), second.error().reason());
    }

    @Test
    void testValidateBodiesUnmatchedOpener() {
        String document = "Foo >> a [ ^ 1";
        assertEquals(List.of(), MethodBodyValidator.validateBodies(document, ScanPolicy.SKIP_UNMATCHED));
        assertThrows(UnmatchedBracketException.class,
            () -> MethodBodyValidator.validateBodies(document, ScanPolicy.STRICT));
    }
}
