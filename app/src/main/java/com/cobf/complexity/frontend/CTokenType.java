package com.cobf.complexity.frontend;

/**
 * Lexical categories produced by {@link CLexer}.
 */
public enum CTokenType {
    IDENTIFIER,
    KEYWORD,
    INT_CONST,
    FLOAT_CONST,
    CHAR_CONST,
    STRING_LITERAL,
    PUNCTUATOR,
    PREPROCESSOR,
    EOF;

    /** True for numeric, character and string literals. */
    public boolean isLiteral() {
        return this == INT_CONST || this == FLOAT_CONST || this == CHAR_CONST || this == STRING_LITERAL;
    }
}
