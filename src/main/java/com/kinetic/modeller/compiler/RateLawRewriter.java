package com.kinetic.modeller.compiler;

import java.util.List;
import java.util.OptionalInt;

import com.kinetic.modeller.model.IndexTable;
import com.kinetic.modeller.parser.RateLawToken;
import com.kinetic.modeller.parser.RateLawToken.TokenType;
import com.kinetic.modeller.parser.RateLawTokenizer;

/**
 * Replaces entity names in rate-law text with {@code y[slot]}, keeping all other text as written.
 *
 * Whole identifier tokens are matched, so {@code A} never touches {@code AB} or {@code A_2}
 * whatever order the names are indexed in. An identifier directly followed by {@code (}
 * is a function call and is left alone.
 */
public class RateLawRewriter {

    private static final String STATE_VECTOR = "y";

    private final IndexTable index;

    public RateLawRewriter(IndexTable index) {
        this.index = index;
    }

    public String rewrite(String rateLaw) {
        List<RateLawToken> tokens = new RateLawTokenizer(rateLaw).tokenize();
        StringBuilder sb = new StringBuilder();
        int copied = 0;

        // the last token is EOF
        for (int i = 0; i < tokens.size() - 1; i++) {
            RateLawToken token = tokens.get(i);
            RateLawToken next = tokens.get(i + 1);
            if (!token.is(TokenType.IDENTIFIER) || next.is(TokenType.LPAREN)) {
                continue;
            }
            if (next.is(TokenType.LBRACKET) && STATE_VECTOR.equals(token.getValue())) {
                continue;
            }
            OptionalInt slot = index.slotOf(token.getValue());
            if (slot.isEmpty()) {
                continue;
            }
            sb.append(rateLaw, copied, token.getStart());
            sb.append("y[").append(slot.getAsInt()).append(']');
            copied = token.getEnd();
        }

        sb.append(rateLaw.substring(copied));
        return sb.toString();
    }
}
