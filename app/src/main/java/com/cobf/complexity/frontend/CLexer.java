package com.cobf.complexity.frontend;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenises C source text by walking the leaves of its tree-sitter parse.
 * Comments are dropped; literals come out whole, and each preprocessor
 * directive line becomes a single {@link CTokenType#PREPROCESSOR} token.
 * Tokenising never fails: leaves under an ERROR node are emitted like any
 * other, since only {@link CParser} decides whether the text is valid C.
 */
public class CLexer {

    public static final Set<String> KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Bool", "_Complex", "_Imaginary", "_Alignas", "_Alignof", "_Atomic", "_Noreturn",
            "_Static_assert", "_Thread_local", "alignas", "alignof");

    private static final Set<String> LITERALS = Set.of("number_literal", "char_literal", "string_literal");
    private static final Set<String> DIRECTIVES = Set.of("preproc_include", "preproc_def", "preproc_function_def",
            "preproc_call");
    private static final Set<String> CONDITIONAL_DIRECTIVES = Set.of("preproc_if", "preproc_ifdef",
            "preproc_elif", "preproc_elifdef", "preproc_else");

    private final String source;

    public CLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenises the whole input. The returned list always ends with an
     * {@link CTokenType#EOF} token.
     */
    public List<CToken> tokenize() {
        SourceTree tree = SourceTree.parse(source);
        List<CToken> tokens = new ArrayList<>();
        walk(tree, tree.root(), tokens);
        tokens.add(new CToken(CTokenType.EOF, "", (int) Math.max(1, source.lines().count())));
        return tokens;
    }

    /**
     * Convenience for metric code: all tokens except the trailing EOF.
     */
    public static List<CToken> lex(String source) {
        List<CToken> tokens = new CLexer(source).tokenize();
        return tokens.subList(0, tokens.size() - 1);
    }

    private static void walk(SourceTree tree, TSNode node, List<CToken> out) {
        String type = node.getType();
        if (type.equals("comment") || node.isMissing()) {
            return;
        }
        if (DIRECTIVES.contains(type)) {
            out.add(directive(tree.text(node), SourceTree.line(node)));
            return;
        }
        if (CONDITIONAL_DIRECTIVES.contains(type)) {
            conditional(tree, node, out);
            return;
        }
        if (LITERALS.contains(type)) {
            literal(tree.text(node), type, SourceTree.line(node), out);
            return;
        }
        if (node.getChildCount() == 0) {
            String text = tree.text(node);
            if (!text.isBlank()) {
                out.add(new CToken(classify(text, node.isNamed()), text, SourceTree.line(node)));
            }
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            walk(tree, node.getChild(i), out);
        }
    }

    /** The {@code #if}/{@code #else}/{@code #endif} lines become directives; the guarded code is tokenised. */
    private static void conditional(SourceTree tree, TSNode node, List<CToken> out) {
        StringBuilder line = null;
        int lineNumber = 0;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            String field = node.getFieldNameForChild(i);
            String text = tree.text(child);
            if (!child.isNamed() && text.startsWith("#")) {
                if (line != null) {
                    out.add(directive(line.toString(), lineNumber));
                }
                line = new StringBuilder(text);
                lineNumber = SourceTree.line(child);
            } else if (line != null && ("name".equals(field) || "condition".equals(field))) {
                line.append(' ').append(text);
            } else if (child.isNamed() || !text.isBlank()) {
                if (line != null) {
                    out.add(directive(line.toString(), lineNumber));
                    line = null;
                }
                walk(tree, child, out);
            }
        }
        if (line != null) {
            out.add(directive(line.toString(), lineNumber));
        }
    }

    private static CToken directive(String text, int line) {
        return new CToken(CTokenType.PREPROCESSOR, text.replace("\\\n", " ").strip(), line);
    }

    private static void literal(String text, String type, int line, List<CToken> out) {
        switch (type) {
            case "char_literal" -> out.add(new CToken(CTokenType.CHAR_CONST, text, line));
            case "string_literal" -> out.add(new CToken(CTokenType.STRING_LITERAL, text, line));
            default -> {
                // a sign folded into the literal is still its own operator
                if (text.startsWith("-") || text.startsWith("+")) {
                    out.add(new CToken(CTokenType.PUNCTUATOR, text.substring(0, 1), line));
                    text = text.substring(1).strip();
                }
                out.add(new CToken(isFloating(text) ? CTokenType.FLOAT_CONST : CTokenType.INT_CONST, text, line));
            }
        }
    }

    static boolean isFloating(String number) {
        String lower = number.toLowerCase();
        if (lower.startsWith("0x")) {
            return lower.indexOf('.') >= 0 || lower.indexOf('p') >= 0;
        }
        return !lower.startsWith("0b") && (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0);
    }

    private static CTokenType classify(String text, boolean named) {
        if (KEYWORDS.contains(text)) {
            return CTokenType.KEYWORD;
        }
        char first = text.charAt(0);
        if (named || Character.isLetter(first) || first == '_') {
            return CTokenType.IDENTIFIER;
        }
        return CTokenType.PUNCTUATOR;
    }
}
