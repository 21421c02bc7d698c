package com.bookreader.exception;

import com.bookreader.descriptions.ExtractionRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionProblemsTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.byDefaultProvider()
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("should name the field and reason of an invalid request")
    void invalidField() {
        ErrorResponse error = ExtractionProblems.invalidRequest("mode", "unknown processing mode 'turbo'", "/descriptions/extract");

        assertEquals(ExtractionProblems.INVALID_REQUEST_TYPE, error.type());
        assertEquals(ExtractionProblems.INVALID_REQUEST_TITLE, error.title());
        assertEquals(400, error.status());
        assertEquals("mode: unknown processing mode 'turbo'", error.detail());
        assertEquals("/descriptions/extract", error.instance());
    }

    @Test
    @DisplayName("should list every violated field of a request body in field order")
    void violations() {
        Set<ConstraintViolation<ExtractionRequest>> violations =
            validator.validate(new ExtractionRequest("ch", null, null, null, 0));

        ErrorResponse error = ExtractionProblems.invalidRequest(violations, null);

        assertEquals(ExtractionProblems.INVALID_REQUEST_TYPE, error.type());
        assertEquals(400, error.status());
        assertEquals("illustrationBudget: illustrationBudget must be positive; text: text is required", error.detail());
    }

    @Test
    @DisplayName("should fall back to a generic detail without violations")
    void noViolations() {
        assertEquals("Validation failed", ExtractionProblems.invalidRequest(List.of(), null).detail());
    }

    @Test
    @DisplayName("should describe an engine without extractors as unavailable")
    void unavailable() {
        ErrorResponse error = ExtractionProblems.unavailable("no extractor is loaded", "/descriptions/extract");

        assertEquals(ExtractionProblems.UNAVAILABLE_TYPE, error.type());
        assertEquals(503, error.status());
        assertEquals("no extractor is loaded", error.detail());
    }
}
