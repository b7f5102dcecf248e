package org.smartcalc.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizerTest {

    private static List<String> tokens(String... t) {
        return Arrays.asList(t);
    }

    @Nested
    @DisplayName("splitting")
    class Splitting {

        @Test
        void stripsWhitespaceAndSplitsSymbols() {
            assertEquals(tokens("2", "+", "3"), Normalizer.normalize("  2 +\t3 "));
        }

        @Test
        void keepsAlphanumericRunsTogether() {
            assertEquals(tokens("abc", "*", "12", "/", "a1"), Normalizer.normalize("abc*12 / a1"));
        }

        @Test
        void splitsParentheses() {
            assertEquals(tokens("(", "(", "x", ")", ")"), Normalizer.normalize("((x))"));
        }

        @Test
        void blankInputGivesNoTokens() {
            assertTrue(Normalizer.normalize("").isEmpty());
            assertTrue(Normalizer.normalize("   ").isEmpty());
        }
    }

    @Nested
    @DisplayName("signs")
    class Signs {

        @Test
        void doubleNegationBecomesPlus() {
            assertEquals(tokens("5"), Normalizer.normalize("--5"));
            assertEquals(tokens("3", "+", "2"), Normalizer.normalize("3 -- 2"));
        }

        @Test
        void collapseLeavesPlusBeforeTheOddMinus() {
            assertEquals("+-", Normalizer.collapseDoubleNegation("---"));
            assertEquals("++", Normalizer.collapseDoubleNegation("----"));
        }

        @Test
        void oddRunOfMinusesEndsAsOneMinus() {
            assertEquals(tokens("3", "-", "2"), Normalizer.normalize("3 --- 2"));
            assertEquals(tokens("3", "+", "2"), Normalizer.normalize("3 ---- 2"));
        }

        @Test
        void unaryPlusIsDropped() {
            assertEquals(tokens("~", "5"), Normalizer.normalize("+-5"));
            assertEquals(tokens("~", "5"), Normalizer.normalize("-+5"));
            assertEquals(tokens("1", "+", "2"), Normalizer.normalize("1 +++ 2"));
            assertEquals(tokens("(", "4", ")"), Normalizer.normalize("(+4)"));
        }

        @Test
        void plusBeforeMinusIsDropped() {
            assertEquals(tokens("5", "-", "3"), Normalizer.normalize("5 + -3"));
        }

        @Test
        void leadingMinusBecomesNegate() {
            assertEquals(tokens("~", "7"), Normalizer.normalize("-7"));
            assertEquals(tokens("~", "(", "x", ")"), Normalizer.normalize("-(x)"));
        }

        @Test
        void minusAfterOperatorOrParenBecomesNegate() {
            assertEquals(tokens("2", "*", "~", "3"), Normalizer.normalize("2 * -3"));
            assertEquals(tokens("2", "^", "~", "1"), Normalizer.normalize("2 ^ -1"));
            assertEquals(tokens("10", "-", "(", "~", "3", ")"), Normalizer.normalize("10 - (-3)"));
        }

        @Test
        void binaryMinusIsKept() {
            assertEquals(tokens("8", "-", "2", "-", "3"), Normalizer.normalize("8 - 2 - 3"));
            assertEquals(tokens("(", "1", ")", "-", "1"), Normalizer.normalize("(1) - 1"));
        }

        @Test
        void minusPlusMinusCancels() {
            assertEquals(tokens("~", "~", "5"), Normalizer.normalize("-+-5"));
        }
    }
}
