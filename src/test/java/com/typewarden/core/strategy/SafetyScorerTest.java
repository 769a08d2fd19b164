package com.typewarden.core.strategy;

import com.typewarden.core.model.AnyTypeCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafetyScorerTest {

    private final SafetyScorer scorer = new SafetyScorer();

    @Test
    @DisplayName("high-confidence array narrowing clamps to 1.0")
    void highConfidenceArray() {
        assertEquals(1.0, scorer.score(0.9, AnyTypeCategory.ARRAY_TYPE, "any[]", "unknown[]",
                "const items: any[] = obj;", false), 1e-9);
    }

    @Test
    @DisplayName("low-confidence array narrowing stays below the default threshold")
    void lowConfidenceArray() {
        double score = scorer.score(0.3, AnyTypeCategory.ARRAY_TYPE, "any[]", "unknown[]",
                "const items: any[] = obj;", false);
        assertEquals(0.55, score, 1e-9);
        assertTrue(score < 0.7);
    }

    @Test
    @DisplayName("function lines and error contexts are penalised")
    void penalties() {
        double function = scorer.score(0.6, AnyTypeCategory.FUNCTION_PARAM, "(x: any", "(x: string",
                "function f(x: any) {", false);
        double error = scorer.score(0.6, AnyTypeCategory.ERROR_HANDLING, "e: any", "e: string",
                "function f(e: any) {", false);

        assertEquals(0.5, function, 1e-9);
        assertEquals(0.3, error, 1e-9);
    }

    @Test
    @DisplayName("declarations and test files are boosted")
    void boosts() {
        double score = scorer.score(0.5, AnyTypeCategory.FUNCTION_PARAM, "any", "string",
                "type Loader = { load: any };", true);
        assertEquals(0.6, score, 1e-9);
    }

    @Test
    @DisplayName("score never goes below zero")
    void clampedAtZero() {
        assertEquals(0.0, scorer.score(0.1, AnyTypeCategory.ERROR_HANDLING, "e: any", "e: string",
                "} catch (error) { const f = (e: any) => e; }", false), 1e-9);
    }
}
