package com.docsum.common.util;

import java.util.Collection;

/**
 * Rough token estimate for prompt sizing and logging.
 * Approximation: 1 token ≈ 4 characters for English text
 */
public final class TokenCounter {
    private static final double CHARS_PER_TOKEN = 4.0;
    
    private TokenCounter() {}
    
    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
    
    public static int countTokens(Collection<String> texts) {
        int total = 0;
        for (String text : texts) {
            total += countTokens(text);
        }
        return total;
    }
}
