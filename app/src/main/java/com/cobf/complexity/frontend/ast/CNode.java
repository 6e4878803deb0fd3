package com.cobf.complexity.frontend.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Closed set of C syntax tree node kinds.
 * Nodes are immutable; {@link #children()} lists the child nodes in source
 * order and {@link #accept(CNodeVisitor)} dispatches to the matching
 * visitor method, so adding a kind breaks every visitor at compile time.
 */
public sealed interface CNode {

    List<CNode> children();

    <R> R accept(CNodeVisitor<R> visitor);

    private static List<CNode> collect(Object... parts) {
        List<CNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof CNode node) {
                result.add(node);
            } else if (part instanceof Collection<?> nodes) {
                for (Object item : nodes) {
                    if (item instanceof CNode node) {
                        result.add(node);
                    }
                }
            }
        }
        return List.copyOf(result);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }

    // === Translation unit and declarations ===

    record FileAst(List<CNode> ext) implements CNode {
        public FileAst {
            ext = List.copyOf(ext);
        }

        public List<CNode> children() {
            return ext;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record FuncDef(Decl decl, Compound body) implements CNode {
        /** Declared name of the function, or null when the declaration is missing. */
        public String name() {
            return decl == null ? null : decl.name();
        }

        public List<CNode> children() {
            return collect(decl, body);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Decl(String name, List<String> quals, List<String> storage, List<String> funcSpecs,
            CNode type, CNode init, CNode bitsize) implements CNode {
        public Decl {
            quals = List.copyOf(quals);
            storage = List.copyOf(storage);
            funcSpecs = List.copyOf(funcSpecs);
        }

        public List<CNode> children() {
            return collect(type, init, bitsize);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DeclList(List<Decl> decls) implements CNode {
        public DeclList {
            decls = List.copyOf(decls);
        }

        public List<CNode> children() {
            return collect(decls);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TypeDecl(String declname, List<String> quals, CNode type) implements CNode {
        public TypeDecl {
            quals = List.copyOf(quals);
        }

        public List<CNode> children() {
            return collect(type);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record IdentifierType(List<String> names) implements CNode {
        public IdentifierType {
            names = List.copyOf(names);
        }

        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PtrDecl(List<String> quals, CNode type) implements CNode {
        public PtrDecl {
            quals = List.copyOf(quals);
        }

        public List<CNode> children() {
            return collect(type);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrayDecl(CNode type, CNode dim, List<String> dimQuals) implements CNode {
        public ArrayDecl {
            dimQuals = List.copyOf(dimQuals);
        }

        public List<CNode> children() {
            return collect(type, dim);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record FuncDecl(ParamList args, CNode type) implements CNode {
        public List<CNode> children() {
            return collect(args, type);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ParamList(List<CNode> params) implements CNode {
        public ParamList {
            params = List.copyOf(params);
        }

        public List<CNode> children() {
            return params;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record EllipsisParam() implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Typedef(String name, List<String> quals, List<String> storage, CNode type) implements CNode {
        public Typedef {
            quals = List.copyOf(quals);
            storage = List.copyOf(storage);
        }

        public List<CNode> children() {
            return collect(type);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Typename(String name, List<String> quals, CNode type) implements CNode {
        public Typename {
            quals = List.copyOf(quals);
        }

        public List<CNode> children() {
            return collect(type);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** A struct definition ({@code decls} non-null) or reference ({@code decls} null). */
    record Struct(String name, List<Decl> decls) implements CNode {
        public Struct {
            decls = copy(decls);
        }

        public List<CNode> children() {
            return collect(decls);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Union(String name, List<Decl> decls) implements CNode {
        public Union {
            decls = copy(decls);
        }

        public List<CNode> children() {
            return collect(decls);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Enum(String name, EnumeratorList values) implements CNode {
        public List<CNode> children() {
            return collect(values);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record EnumeratorList(List<Enumerator> enumerators) implements CNode {
        public EnumeratorList {
            enumerators = List.copyOf(enumerators);
        }

        public List<CNode> children() {
            return collect(enumerators);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Enumerator(String name, CNode value) implements CNode {
        public List<CNode> children() {
            return collect(value);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // === Statements ===

    record Compound(List<CNode> blockItems) implements CNode {
        public Compound {
            blockItems = List.copyOf(blockItems);
        }

        public List<CNode> children() {
            return blockItems;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record If(CNode cond, CNode iftrue, CNode iffalse) implements CNode {
        public List<CNode> children() {
            return collect(cond, iftrue, iffalse);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Switch(CNode cond, CNode stmt) implements CNode {
        public List<CNode> children() {
            return collect(cond, stmt);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record While(CNode cond, CNode stmt) implements CNode {
        public List<CNode> children() {
            return collect(cond, stmt);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DoWhile(CNode cond, CNode stmt) implements CNode {
        public List<CNode> children() {
            return collect(cond, stmt);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record For(CNode init, CNode cond, CNode next, CNode stmt) implements CNode {
        public List<CNode> children() {
            return collect(init, cond, next, stmt);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Break() implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Continue() implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Goto(String name) implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Label(String name, CNode stmt) implements CNode {
        public List<CNode> children() {
            return collect(stmt);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Case(CNode expr, List<CNode> stmts) implements CNode {
        public Case {
            stmts = List.copyOf(stmts);
        }

        public List<CNode> children() {
            return collect(expr, stmts);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Default(List<CNode> stmts) implements CNode {
        public Default {
            stmts = List.copyOf(stmts);
        }

        public List<CNode> children() {
            return stmts;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Return(CNode expr) implements CNode {
        public List<CNode> children() {
            return collect(expr);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record EmptyStatement() implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // === Expressions ===

    record BinaryOp(String op, CNode left, CNode right) implements CNode {
        public List<CNode> children() {
            return collect(left, right);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Unary operator; postfix increments are spelled {@code p++} and {@code p--}. */
    record UnaryOp(String op, CNode expr) implements CNode {
        public List<CNode> children() {
            return collect(expr);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TernaryOp(CNode cond, CNode iftrue, CNode iffalse) implements CNode {
        public List<CNode> children() {
            return collect(cond, iftrue, iffalse);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Assignment(String op, CNode lvalue, CNode rvalue) implements CNode {
        public List<CNode> children() {
            return collect(lvalue, rvalue);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Id(String name) implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Literal; {@code type} is one of int, float, char or string. */
    record Constant(String type, String value) implements CNode {
        public List<CNode> children() {
            return List.of();
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record FuncCall(CNode name, ExprList args) implements CNode {
        public List<CNode> children() {
            return collect(name, args);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ExprList(List<CNode> exprs) implements CNode {
        public ExprList {
            exprs = List.copyOf(exprs);
        }

        public List<CNode> children() {
            return exprs;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Cast(Typename toType, CNode expr) implements CNode {
        public List<CNode> children() {
            return collect(toType, expr);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrayRef(CNode name, CNode subscript) implements CNode {
        public List<CNode> children() {
            return collect(name, subscript);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Member access; {@code type} is {@code .} or {@code ->}. */
    record StructRef(CNode name, String type, Id field) implements CNode {
        public List<CNode> children() {
            return collect(name, field);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record InitList(List<CNode> exprs) implements CNode {
        public InitList {
            exprs = List.copyOf(exprs);
        }

        public List<CNode> children() {
            return exprs;
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Designated initializer; each designator is an {@link Id} field or a subscript expression. */
    record NamedInitializer(List<CNode> name, CNode expr) implements CNode {
        public NamedInitializer {
            name = List.copyOf(name);
        }

        public List<CNode> children() {
            return collect(expr, name);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record CompoundLiteral(Typename type, InitList init) implements CNode {
        public List<CNode> children() {
            return collect(type, init);
        }

        public <R> R accept(CNodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
