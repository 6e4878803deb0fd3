package com.cobf.complexity.frontend.ast;

/**
 * Base visitor that walks every child of every node it does not override.
 * Subclasses override the kinds they care about and call
 * {@link #visitChildren(CNode)} to continue into the subtree.
 */
public abstract class CNodeWalker implements CNodeVisitor<Void> {

    /** Visits a possibly absent node. */
    public void walk(CNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    protected void visitChildren(CNode node) {
        for (CNode child : node.children()) {
            child.accept(this);
        }
    }

    /** Called for every node kind the subclass does not override. */
    protected Void defaultVisit(CNode node) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visit(CNode.FileAst node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.FuncDef node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Decl node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.DeclList node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.TypeDecl node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.IdentifierType node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.PtrDecl node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.ArrayDecl node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.FuncDecl node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.ParamList node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.EllipsisParam node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Typedef node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Typename node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Struct node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Union node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Enum node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.EnumeratorList node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Enumerator node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Compound node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.If node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Switch node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.While node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.DoWhile node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.For node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Break node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Continue node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Goto node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Label node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Case node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Default node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Return node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.EmptyStatement node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.BinaryOp node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.UnaryOp node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.TernaryOp node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Assignment node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Id node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Constant node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.FuncCall node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.ExprList node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.Cast node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.ArrayRef node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.StructRef node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.InitList node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.NamedInitializer node) {
        return defaultVisit(node);
    }

    @Override
    public Void visit(CNode.CompoundLiteral node) {
        return defaultVisit(node);
    }
}
