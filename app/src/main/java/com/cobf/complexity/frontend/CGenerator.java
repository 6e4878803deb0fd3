package com.cobf.complexity.frontend;

import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import com.cobf.complexity.frontend.ast.CNodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Regenerates compilable C text from a syntax tree.
 * Statements go one per line with four-space indentation; expressions get
 * parentheses only where operator precedence requires them.
 */
public class CGenerator implements CNodeVisitor<String> {

    private static final String INDENT = "    ";

    // Expression binding strength, loosest first
    private static final int COMMA = 1;
    private static final int ASSIGN = 2;
    private static final int TERNARY = 3;
    private static final int BINARY_BASE = 3;
    private static final int UNARY = 14;
    private static final int POSTFIX = 15;

    private int indent;

    public String generate(CNode node) {
        indent = 0;
        return node.accept(this);
    }

    // === Translation unit and declarations ===

    @Override
    public String visit(FileAst node) {
        StringBuilder out = new StringBuilder();
        for (CNode ext : node.ext()) {
            if (ext instanceof FuncDef) {
                out.append(ext.accept(this));
            } else {
                out.append(ext.accept(this)).append(";\n");
            }
        }
        return out.toString();
    }

    @Override
    public String visit(FuncDef node) {
        return declaration(node.decl(), true) + "\n" + node.body().accept(this);
    }

    @Override
    public String visit(Decl node) {
        return declaration(node, true);
    }

    @Override
    public String visit(DeclList node) {
        if (node.decls().isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(declaration(node.decls().get(0), true));
        for (Decl decl : node.decls().subList(1, node.decls().size())) {
            out.append(", ").append(declaration(decl, false));
        }
        return out.toString();
    }

    private String declaration(Decl decl, boolean withType) {
        StringBuilder out = new StringBuilder();
        if (withType) {
            for (String spec : decl.funcSpecs()) {
                out.append(spec).append(' ');
            }
            for (String storage : decl.storage()) {
                out.append(storage).append(' ');
            }
            out.append(type(decl.type()));
        } else {
            out.append(declaratorOnly(decl.type()));
        }
        if (decl.bitsize() != null) {
            out.append(" : ").append(decl.bitsize().accept(this));
        }
        if (decl.init() != null) {
            out.append(" = ").append(operand(decl.init(), ASSIGN, false));
        }
        return out.toString();
    }

    @Override
    public String visit(Typedef node) {
        StringBuilder out = new StringBuilder("typedef ");
        for (String storage : node.storage()) {
            out.append(storage).append(' ');
        }
        return out.append(type(node.type())).toString();
    }

    @Override
    public String visit(Typename node) {
        return type(node.type());
    }

    @Override
    public String visit(TypeDecl node) {
        return type(node);
    }

    @Override
    public String visit(PtrDecl node) {
        return type(node);
    }

    @Override
    public String visit(ArrayDecl node) {
        return type(node);
    }

    @Override
    public String visit(FuncDecl node) {
        return type(node);
    }

    @Override
    public String visit(IdentifierType node) {
        return String.join(" ", node.names());
    }

    @Override
    public String visit(ParamList node) {
        return node.params().stream().map(p -> p.accept(this)).collect(Collectors.joining(", "));
    }

    @Override
    public String visit(EllipsisParam node) {
        return "...";
    }

    @Override
    public String visit(Struct node) {
        return structOrUnion("struct", node.name(), node.decls());
    }

    @Override
    public String visit(Union node) {
        return structOrUnion("union", node.name(), node.decls());
    }

    private String structOrUnion(String keyword, String name, List<Decl> decls) {
        StringBuilder out = new StringBuilder(keyword);
        if (name != null) {
            out.append(' ').append(name);
        }
        if (decls != null) {
            out.append('\n').append(indentation()).append("{\n");
            indent++;
            for (Decl decl : decls) {
                out.append(indentation()).append(declaration(decl, true)).append(";\n");
            }
            indent--;
            out.append(indentation()).append('}');
        }
        return out.toString();
    }

    @Override
    public String visit(CNode.Enum node) {
        StringBuilder out = new StringBuilder("enum");
        if (node.name() != null) {
            out.append(' ').append(node.name());
        }
        if (node.values() != null) {
            out.append(" {").append(node.values().accept(this)).append('}');
        }
        return out.toString();
    }

    @Override
    public String visit(EnumeratorList node) {
        return node.enumerators().stream().map(e -> e.accept(this)).collect(Collectors.joining(", "));
    }

    @Override
    public String visit(Enumerator node) {
        return node.value() == null ? node.name() : node.name() + " = " + node.value().accept(this);
    }

    /**
     * Renders a type chain around its declared name, e.g. {@code int (*fp)(int)}.
     */
    private String type(CNode node) {
        List<CNode> modifiers = new ArrayList<>();
        CNode current = node;
        while (current instanceof PtrDecl || current instanceof ArrayDecl || current instanceof FuncDecl) {
            modifiers.add(current);
            current = innerType(current);
        }
        if (!(current instanceof TypeDecl leaf)) {
            // struct/union/enum declared without a declarator
            return current.accept(this);
        }
        String name = leaf.declname() == null ? "" : leaf.declname();
        String declarator = applyModifiers(name, modifiers);
        StringBuilder out = new StringBuilder();
        for (String qual : leaf.quals()) {
            out.append(qual).append(' ');
        }
        out.append(leaf.type().accept(this));
        if (!declarator.isEmpty()) {
            out.append(' ').append(declarator);
        }
        return out.toString();
    }

    /** Declarator text without the base type, for the second and later names of a declaration list. */
    private String declaratorOnly(CNode node) {
        List<CNode> modifiers = new ArrayList<>();
        CNode current = node;
        while (current instanceof PtrDecl || current instanceof ArrayDecl || current instanceof FuncDecl) {
            modifiers.add(current);
            current = innerType(current);
        }
        String name = current instanceof TypeDecl leaf && leaf.declname() != null ? leaf.declname() : "";
        return applyModifiers(name, modifiers);
    }

    private String applyModifiers(String name, List<CNode> modifiers) {
        String text = name;
        for (int i = 0; i < modifiers.size(); i++) {
            CNode modifier = modifiers.get(i);
            boolean afterPointer = i > 0 && modifiers.get(i - 1) instanceof PtrDecl;
            if (modifier instanceof ArrayDecl array) {
                if (afterPointer) {
                    text = "(" + text + ")";
                }
                StringBuilder dim = new StringBuilder();
                for (String qual : array.dimQuals()) {
                    dim.append(qual).append(' ');
                }
                if (array.dim() != null) {
                    dim.append(array.dim().accept(this));
                }
                text = text + "[" + dim.toString().strip() + "]";
            } else if (modifier instanceof FuncDecl function) {
                if (afterPointer) {
                    text = "(" + text + ")";
                }
                text = text + "(" + (function.args() == null ? "" : function.args().accept(this)) + ")";
            } else if (modifier instanceof PtrDecl pointer) {
                if (pointer.quals().isEmpty()) {
                    text = "*" + text;
                } else {
                    text = "* " + String.join(" ", pointer.quals()) + (text.isEmpty() ? "" : " " + text);
                }
            }
        }
        return text;
    }

    private static CNode innerType(CNode modifier) {
        if (modifier instanceof PtrDecl pointer) {
            return pointer.type();
        }
        if (modifier instanceof ArrayDecl array) {
            return array.type();
        }
        return ((FuncDecl) modifier).type();
    }

    // === Statements ===

    @Override
    public String visit(Compound node) {
        StringBuilder out = new StringBuilder(indentation()).append("{\n");
        indent++;
        for (CNode item : node.blockItems()) {
            out.append(statement(item));
        }
        indent--;
        return out.append(indentation()).append("}\n").toString();
    }

    private String statement(CNode node) {
        if (node instanceof Compound || node instanceof If || node instanceof Switch || node instanceof While
                || node instanceof DoWhile || node instanceof For || node instanceof Label || node instanceof Case
                || node instanceof Default || node instanceof Return || node instanceof Break
                || node instanceof Continue || node instanceof Goto || node instanceof EmptyStatement) {
            return node.accept(this);
        }
        return indentation() + node.accept(this) + ";\n";
    }

    /** A sub-statement of a control construct: braces stay level, bare statements indent. */
    private String body(CNode node) {
        if (node instanceof Compound) {
            return statement(node);
        }
        indent++;
        String text = statement(node);
        indent--;
        return text;
    }

    @Override
    public String visit(If node) {
        StringBuilder out = new StringBuilder(indentation())
                .append("if (").append(node.cond().accept(this)).append(")\n")
                .append(body(node.iftrue()));
        if (node.iffalse() != null) {
            out.append(indentation()).append("else\n").append(body(node.iffalse()));
        }
        return out.toString();
    }

    @Override
    public String visit(Switch node) {
        return indentation() + "switch (" + node.cond().accept(this) + ")\n" + body(node.stmt());
    }

    @Override
    public String visit(While node) {
        return indentation() + "while (" + node.cond().accept(this) + ")\n" + body(node.stmt());
    }

    @Override
    public String visit(DoWhile node) {
        return indentation() + "do\n" + body(node.stmt())
                + indentation() + "while (" + node.cond().accept(this) + ");\n";
    }

    @Override
    public String visit(For node) {
        String init = node.init() == null ? "" : node.init().accept(this);
        String cond = node.cond() == null ? "" : " " + node.cond().accept(this);
        String next = node.next() == null ? "" : " " + node.next().accept(this);
        return indentation() + "for (" + init + ";" + cond + ";" + next + ")\n" + body(node.stmt());
    }

    @Override
    public String visit(Break node) {
        return indentation() + "break;\n";
    }

    @Override
    public String visit(Continue node) {
        return indentation() + "continue;\n";
    }

    @Override
    public String visit(Goto node) {
        return indentation() + "goto " + node.name() + ";\n";
    }

    @Override
    public String visit(Label node) {
        return node.name() + ":\n" + statement(node.stmt());
    }

    @Override
    public String visit(Case node) {
        return indentation() + "case " + node.expr().accept(this) + ":\n" + caseBody(node.stmts());
    }

    @Override
    public String visit(Default node) {
        return indentation() + "default:\n" + caseBody(node.stmts());
    }

    private String caseBody(List<CNode> stmts) {
        StringBuilder out = new StringBuilder();
        indent++;
        for (CNode stmt : stmts) {
            out.append(statement(stmt));
        }
        indent--;
        return out.toString();
    }

    @Override
    public String visit(Return node) {
        return indentation() + "return" + (node.expr() == null ? "" : " " + node.expr().accept(this)) + ";\n";
    }

    @Override
    public String visit(EmptyStatement node) {
        return indentation() + ";\n";
    }

    // === Expressions ===

    @Override
    public String visit(BinaryOp node) {
        int precedence = BINARY_BASE + CParser.BINARY_PRECEDENCE.get(node.op());
        return operand(node.left(), precedence, false) + " " + node.op() + " "
                + operand(node.right(), precedence, true);
    }

    @Override
    public String visit(UnaryOp node) {
        String op = node.op();
        if (op.equals("p++") || op.equals("p--")) {
            return operand(node.expr(), POSTFIX, false) + op.substring(1);
        }
        if (op.equals("sizeof") || op.equals("_Alignof")) {
            return op + "(" + node.expr().accept(this) + ")";
        }
        String inner = operand(node.expr(), UNARY, false);
        // keep "- -x" and "& &x" from fusing into another operator
        if (!inner.isEmpty() && inner.charAt(0) == op.charAt(op.length() - 1)) {
            return op + " " + inner;
        }
        return op + inner;
    }

    @Override
    public String visit(TernaryOp node) {
        return operand(node.cond(), TERNARY + 1, false) + " ? " + node.iftrue().accept(this) + " : "
                + operand(node.iffalse(), TERNARY, false);
    }

    @Override
    public String visit(Assignment node) {
        return operand(node.lvalue(), UNARY, false) + " " + node.op() + " " + operand(node.rvalue(), ASSIGN, false);
    }

    @Override
    public String visit(Id node) {
        return node.name();
    }

    @Override
    public String visit(Constant node) {
        return node.value();
    }

    @Override
    public String visit(FuncCall node) {
        String args = node.args() == null ? "" : arguments(node.args().exprs());
        return operand(node.name(), POSTFIX, false) + "(" + args + ")";
    }

    @Override
    public String visit(ExprList node) {
        return node.exprs().stream().map(e -> operand(e, ASSIGN, false)).collect(Collectors.joining(", "));
    }

    private String arguments(List<CNode> exprs) {
        return exprs.stream().map(e -> operand(e, ASSIGN, false)).collect(Collectors.joining(", "));
    }

    @Override
    public String visit(Cast node) {
        return "(" + node.toType().accept(this) + ")" + operand(node.expr(), UNARY, false);
    }

    @Override
    public String visit(ArrayRef node) {
        return operand(node.name(), POSTFIX, false) + "[" + node.subscript().accept(this) + "]";
    }

    @Override
    public String visit(StructRef node) {
        return operand(node.name(), POSTFIX, false) + node.type() + node.field().name();
    }

    @Override
    public String visit(InitList node) {
        return "{" + arguments(node.exprs()) + "}";
    }

    @Override
    public String visit(NamedInitializer node) {
        StringBuilder out = new StringBuilder();
        for (CNode designator : node.name()) {
            if (designator instanceof Id id) {
                out.append('.').append(id.name());
            } else {
                out.append('[').append(designator.accept(this)).append(']');
            }
        }
        return out.append(" = ").append(operand(node.expr(), ASSIGN, false)).toString();
    }

    @Override
    public String visit(CompoundLiteral node) {
        return "(" + node.type().accept(this) + ")" + node.init().accept(this);
    }

    /**
     * Renders a sub-expression, parenthesised when it binds looser than its
     * context requires. Right operands of left-associative operators also
     * need parentheses at equal strength.
     */
    private String operand(CNode node, int required, boolean rightOperand) {
        String text = node.accept(this);
        int strength = strength(node);
        if (strength < required || (rightOperand && strength == required)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static int strength(CNode node) {
        if (node instanceof ExprList) {
            return COMMA;
        }
        if (node instanceof Assignment) {
            return ASSIGN;
        }
        if (node instanceof TernaryOp) {
            return TERNARY;
        }
        if (node instanceof BinaryOp binary) {
            return BINARY_BASE + CParser.BINARY_PRECEDENCE.get(binary.op());
        }
        if (node instanceof Cast || (node instanceof UnaryOp unary && !unary.op().startsWith("p"))) {
            return UNARY;
        }
        return POSTFIX;
    }

    private String indentation() {
        return INDENT.repeat(indent);
    }
}
