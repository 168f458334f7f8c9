package br.edu.ifba.kgraph.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the document token count hint.
 */
class TokenUtilTest {

    @Test
    @DisplayName("Should count tokens accurately for English text")
    void testEstimateTokensEnglish() {
        // "Hello, world!" = 4 tokens in cl100k_base
        assertEquals(4, TokenUtil.estimateTokens("Hello, world!"));
    }

    @Test
    @DisplayName("Should count tokens for Japanese text")
    void testEstimateTokensJapanese() {
        int tokens = TokenUtil.estimateTokens("猫が座った。犬が走った。");
        assertTrue(tokens > 0, "Japanese text should produce tokens");
    }

    @Test
    @DisplayName("Should return 0 for empty string")
    void testEstimateTokensEmpty() {
        assertEquals(0, TokenUtil.estimateTokens(""));
    }

    @Test
    @DisplayName("Approximation should use four characters per token")
    void testEstimateTokensApproximate() {
        assertEquals(0, TokenUtil.estimateTokensApproximate(""));
        assertEquals(2, TokenUtil.estimateTokensApproximate("abcdefgh"));
        assertEquals(3, TokenUtil.estimateTokensApproximate("abcdefghi"));
    }
}
