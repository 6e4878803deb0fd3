package com.cobf.complexity.frontend;

/**
 * A single lexeme with the line it starts on.
 */
public record CToken(CTokenType type, String value, int line) {

    public boolean is(CTokenType expectedType, String expectedValue) {
        return type == expectedType && value.equals(expectedValue);
    }

    public boolean isPunct(String punct) {
        return is(CTokenType.PUNCTUATOR, punct);
    }

    public boolean isKeyword(String keyword) {
        return is(CTokenType.KEYWORD, keyword);
    }

    @Override
    public String toString() {
        return type + "('" + value + "')@" + line;
    }
}
