package com.cobf.complexity.frontend.ast;

/**
 * One method per {@link CNode} kind.
 *
 * @param <R> result type of a visit
 */
public interface CNodeVisitor<R> {

    R visit(CNode.FileAst node);

    R visit(CNode.FuncDef node);

    R visit(CNode.Decl node);

    R visit(CNode.DeclList node);

    R visit(CNode.TypeDecl node);

    R visit(CNode.IdentifierType node);

    R visit(CNode.PtrDecl node);

    R visit(CNode.ArrayDecl node);

    R visit(CNode.FuncDecl node);

    R visit(CNode.ParamList node);

    R visit(CNode.EllipsisParam node);

    R visit(CNode.Typedef node);

    R visit(CNode.Typename node);

    R visit(CNode.Struct node);

    R visit(CNode.Union node);

    R visit(CNode.Enum node);

    R visit(CNode.EnumeratorList node);

    R visit(CNode.Enumerator node);

    R visit(CNode.Compound node);

    R visit(CNode.If node);

    R visit(CNode.Switch node);

    R visit(CNode.While node);

    R visit(CNode.DoWhile node);

    R visit(CNode.For node);

    R visit(CNode.Break node);

    R visit(CNode.Continue node);

    R visit(CNode.Goto node);

    R visit(CNode.Label node);

    R visit(CNode.Case node);

    R visit(CNode.Default node);

    R visit(CNode.Return node);

    R visit(CNode.EmptyStatement node);

    R visit(CNode.BinaryOp node);

    R visit(CNode.UnaryOp node);

    R visit(CNode.TernaryOp node);

    R visit(CNode.Assignment node);

    R visit(CNode.Id node);

    R visit(CNode.Constant node);

    R visit(CNode.FuncCall node);

    R visit(CNode.ExprList node);

    R visit(CNode.Cast node);

    R visit(CNode.ArrayRef node);

    R visit(CNode.StructRef node);

    R visit(CNode.InitList node);

    R visit(CNode.NamedInitializer node);

    R visit(CNode.CompoundLiteral node);
}
