package com.cobf.complexity.frontend;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CLexerTest {

    private static List<CTokenType> types(List<CToken> tokens) {
        return tokens.stream().map(CToken::type).toList();
    }

    private static List<String> values(List<CToken> tokens) {
        return tokens.stream().map(CToken::value).toList();
    }

    @Test
    void testTokenizeEndsWithEof() {
        List<CToken> tokens = new CLexer("int x;").tokenize();
        assertEquals(CTokenType.EOF, tokens.get(tokens.size() - 1).type());
        assertEquals(3, CLexer.lex("int x;").size(), "lex should drop the EOF token");
    }

    @Test
    void testKeywordsIdentifiersAndPunctuators() {
        List<CToken> tokens = CLexer.lex("void f() { while (count >= 10) count -= 2; }");
        assertEquals(List.of("void", "f", "(", ")", "{", "while", "(", "count", ">=", "10", ")", "count", "-=",
                "2", ";", "}"), values(tokens));
        assertEquals(CTokenType.KEYWORD, tokens.get(5).type());
        assertEquals(CTokenType.IDENTIFIER, tokens.get(7).type());
        assertEquals(CTokenType.PUNCTUATOR, tokens.get(8).type());
        assertEquals(CTokenType.INT_CONST, tokens.get(9).type());
    }

    @Test
    void testMultiCharacterOperatorsStayWhole() {
        assertEquals(List.of("void", "f", "(", ")", "{", "a", "<<=", "b", "->", "c", ";", "g", "(", "d", "++", ")",
                ";", "}", "int", "h", "(", "int", "n", ",", "...", ")", ";"),
                values(CLexer.lex("void f() { a <<= b->c; g(d++); }\nint h(int n, ...);")));
    }

    @Test
    void testNumericLiterals() {
        List<CToken> tokens = CLexer.lex("double v[] = { 0x1F, 0b101, 42UL, 3.14, 1e-5, .5f, 0x1.8p3 };");
        List<CToken> numbers = tokens.stream().filter(t -> t.type().isLiteral()).toList();
        assertEquals(List.of(CTokenType.INT_CONST, CTokenType.INT_CONST, CTokenType.INT_CONST,
                CTokenType.FLOAT_CONST, CTokenType.FLOAT_CONST, CTokenType.FLOAT_CONST, CTokenType.FLOAT_CONST),
                types(numbers));
        assertEquals("42UL", numbers.get(2).value());
        assertEquals("1e-5", numbers.get(4).value());
    }

    @Test
    void testSignFoldedIntoLiteralIsSplitOut() {
        List<CToken> tokens = CLexer.lex("int v = -7;");
        assertEquals(List.of("int", "v", "=", "-", "7", ";"), values(tokens));
        assertEquals(CTokenType.PUNCTUATOR, tokens.get(3).type());
        assertEquals(CTokenType.INT_CONST, tokens.get(4).type());
    }

    @Test
    void testCharacterAndStringLiterals() {
        List<CToken> tokens = CLexer.lex("""
                char c = 'a', q = '\\'';
                char *s = "say \\"hi\\"";
                int *w = L"wide";
                char *u = u8"utf";
                """);
        List<CToken> literals = tokens.stream().filter(t -> t.type().isLiteral()).toList();
        assertEquals(List.of(CTokenType.CHAR_CONST, CTokenType.CHAR_CONST, CTokenType.STRING_LITERAL,
                CTokenType.STRING_LITERAL, CTokenType.STRING_LITERAL), types(literals));
        assertEquals("'\\''", literals.get(1).value());
        assertEquals("\"say \\\"hi\\\"\"", literals.get(2).value());
        assertEquals("L\"wide\"", literals.get(3).value());
        assertEquals("u8\"utf\"", literals.get(4).value());
    }

    @Test
    void testCommentsAreSkippedAndLinesCounted() {
        List<CToken> tokens = CLexer.lex("int a /* one\ntwo */ = b; // three\nint c;");
        assertEquals(List.of("int", "a", "=", "b", ";", "int", "c", ";"), values(tokens));
        assertEquals(1, tokens.get(1).line());
        assertEquals(2, tokens.get(2).line(), "Token after a block comment sits on the comment's last line");
        assertEquals(3, tokens.get(6).line());
    }

    @Test
    void testPreprocessorDirectiveIsOneToken() {
        List<CToken> tokens = CLexer.lex("#include <stdio.h>\n#define MAX(a, b) \\\n  ((a) > (b))\nint x;");
        assertEquals(CTokenType.PREPROCESSOR, tokens.get(0).type());
        assertEquals("#include <stdio.h>", tokens.get(0).value());
        assertEquals(CTokenType.PREPROCESSOR, tokens.get(1).type());
        assertTrue(tokens.get(1).value().contains("((a) > (b))"), "Continuation line should join the directive");
        assertEquals(List.of("int", "x", ";"), values(tokens.subList(2, tokens.size())));
    }

    @Test
    void testConditionalDirectivesKeepGuardedCode() {
        List<CToken> tokens = CLexer.lex("#ifdef DEBUG\nint x;\n#else\nint y;\n#endif\nFILE *f;");
        assertEquals(List.of("#ifdef DEBUG", "int", "x", ";", "#else", "int", "y", ";", "#endif", "FILE", "*", "f",
                ";"), values(tokens));
        assertEquals(CTokenType.PREPROCESSOR, tokens.get(4).type());
        assertEquals(CTokenType.IDENTIFIER, tokens.get(9).type(), "Library typedef names are identifiers");
    }

    @Test
    void testMalformedInputStillTokenizes() {
        List<CToken> tokens = CLexer.lex("int x = \"open;\n");
        assertEquals(List.of("int", "x", "="), values(tokens.subList(0, 3)));
        assertThrows(CParseException.class, () -> CParser.parse("int x = \"open;\n"),
                "Only the parser rejects an unterminated literal");
    }
}
