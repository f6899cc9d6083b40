package com.tonelparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the parser over method bodies and reports failures as values instead
 * of exceptions, for tools that check many bodies and collect the problems.
 */
public final class MethodBodyValidator {
    private static final Logger logger = LoggerFactory.getLogger(MethodBodyValidator.class);

    private static final Pattern LINE_REFERENCE = Pattern.compile("line (\\d{1,9})", Pattern.CASE_INSENSITIVE);

    private MethodBodyValidator() {
    }

    /**
     * Where and why a body failed to parse.
     *
     * @param reason    failure message
     * @param line      1-based line within the validated text
     * @param errorText that line with surrounding whitespace removed
     */
    public record ErrorInfo(String reason, int line, String errorText) {
    }

    public record ValidationResult(boolean valid, ErrorInfo error) {
        static ValidationResult success() {
            return new ValidationResult(true, null);
        }

        static ValidationResult failure(ErrorInfo error) {
            return new ValidationResult(false, error);
        }
    }

    /** Result for one bracketed body of a document. Lines are relative to the body. */
    public record BodyValidation(BracketPair pair, ValidationResult result) {
    }

    public static ValidationResult validate(String body) {
        try {
            Parser.parse(body);
            return ValidationResult.success();
        } catch (ParseException e) {
            logger.debug("Method body failed to parse: {}", e.getMessage());
            return ValidationResult.failure(describe(body, e));
        } catch (RuntimeException e) {
            logger.debug("Unexpected failure while parsing method body", e);
            return ValidationResult.failure(
                new ErrorInfo("Unexpected error: " + e.getClass().getSimpleName(), 1, String.valueOf(e.getMessage())));
        }
    }

    /**
     * Validates every top-level bracketed body of {@code document}.
     *
     * @throws UnmatchedBracketException under {@link ScanPolicy#STRICT} when an opener is never closed
     */
    public static List<BodyValidation> validateBodies(String document, ScanPolicy policy) {
        List<BodyValidation> results = new ArrayList<>();
        for (BracketPair pair : BoundaryScanner.findAll(document, policy)) {
            results.add(new BodyValidation(pair, validate(pair.body(document))));
        }
        return results;
    }

    private static ErrorInfo describe(String body, ParseException e) {
        String message = e.getMessage();
        int line = e.getLine();
        if (line <= 0) {
            line = 1;
            Matcher matcher = LINE_REFERENCE.matcher(message);
            if (matcher.find()) {
                line = Integer.parseInt(matcher.group(1));
            }
        }

        String[] lines = body.split("\n", -1);
        String errorText = line >= 1 && line <= lines.length ? lines[line - 1].strip() : "";
        return new ErrorInfo(message, line, errorText);
    }
}
