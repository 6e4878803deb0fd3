package com.cobf.complexity.frontend;

import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import static com.cobf.complexity.frontend.SourceTree.field;
import static com.cobf.complexity.frontend.SourceTree.fields;
import static com.cobf.complexity.frontend.SourceTree.line;
import static com.cobf.complexity.frontend.SourceTree.namedChildren;

/**
 * Builds {@link CNode} trees from the tree-sitter C grammar.
 * The source is parsed once by tree-sitter; any ERROR or MISSING node is
 * reported as a {@link CParseException}, otherwise the concrete syntax tree
 * is folded into the abstract node kinds the metrics walk. Preprocessor
 * directives are dropped and only the first branch of a conditional block
 * is kept.
 *
 * Usage: {@code FileAst tree = CParser.parse(source);}
 */
public class CParser {

    private static final Set<String> FUNCTION_SPECIFIERS = Set.of("inline", "__inline", "__inline__",
            "_Noreturn", "noreturn");
    private static final Set<String> CONDITIONAL_DIRECTIVES = Set.of("preproc_if", "preproc_ifdef",
            "preproc_elif", "preproc_elifdef", "preproc_else");
    private static final Set<String> TAG_SPECIFIERS = Set.of("struct_specifier", "union_specifier",
            "enum_specifier");

    private final SourceTree tree;

    public CParser(String source) {
        this.tree = SourceTree.parse(source);
    }

    public static FileAst parse(String source) {
        return new CParser(source).parseTranslationUnit();
    }

    public FileAst parseTranslationUnit() {
        TSNode root = tree.root();
        TSNode error = firstError(root, "");
        if (error != null) {
            throw syntaxError(error);
        }
        List<CNode> ext = new ArrayList<>();
        for (TSNode item : namedChildren(root)) {
            externalDeclaration(item, ext);
        }
        return new FileAst(ext);
    }

    // === Syntax errors ===

    private static TSNode firstError(TSNode node, String parentType) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.isMissing()) {
                if (!isTolerated(node, parentType)) {
                    return child;
                }
            } else if (child.getType().equals("ERROR")) {
                return child;
            } else if (child.hasError()) {
                TSNode nested = firstError(child, node.getType());
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Gaps tree-sitter fills in for constructs that are valid C: a label right
     * before a closing brace and an unnamed bit-field.
     */
    private static boolean isTolerated(TSNode parent, String grandparentType) {
        if (parent.getType().equals("expression_statement")) {
            return grandparentType.equals("labeled_statement");
        }
        if (parent.getType().equals("field_declaration")) {
            for (TSNode child : namedChildren(parent)) {
                if (child.getType().equals("bitfield_clause")) {
                    return true;
                }
            }
        }
        return false;
    }

    private CParseException syntaxError(TSNode node) {
        if (node.isMissing()) {
            return new CParseException("expected '" + node.getType() + "'", line(node));
        }
        String text = tree.text(node).strip();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline).strip();
        }
        return new CParseException("unexpected '" + text + "'", line(node));
    }

    private static CParseException unsupported(TSNode node) {
        return new CParseException("unsupported construct " + node.getType(), line(node));
    }

    // === Declarations ===

    private record DeclSpec(List<String> storage, List<String> quals, List<String> funcSpecs, CNode type) {
    }

    private record Declarator(String name, CNode type) {
    }

    private void externalDeclaration(TSNode item, List<CNode> out) {
        String type = item.getType();
        if (type.equals("function_definition")) {
            out.add(functionDefinition(item));
        } else if (type.equals("declaration")) {
            out.addAll(declaration(item));
        } else if (type.equals("type_definition")) {
            out.addAll(typeDefinition(item));
        } else if (TAG_SPECIFIERS.contains(type)) {
            out.add(new Decl(null, List.of(), List.of(), List.of(), typeSpecifier(item), null, null));
        } else if (CONDITIONAL_DIRECTIVES.contains(type)) {
            for (TSNode nested : takenBranch(item)) {
                externalDeclaration(nested, out);
            }
        } else if (!type.startsWith("preproc_")) {
            throw new CParseException("unexpected " + type + " at file scope", line(item));
        }
    }

    /** Items of the first branch of a conditional directive; the {@code alternative} chain is skipped. */
    private static List<TSNode> takenBranch(TSNode conditional) {
        List<TSNode> items = new ArrayList<>();
        for (int i = 0; i < conditional.getChildCount(); i++) {
            TSNode child = conditional.getChild(i);
            if (child.isNamed() && conditional.getFieldNameForChild(i) == null
                    && !child.getType().equals("comment")) {
                items.add(child);
            }
        }
        return items;
    }

    private FuncDef functionDefinition(TSNode node) {
        DeclSpec spec = specifiers(node);
        Declarator d = declarator(field(node, "declarator"), spec);
        Decl decl = new Decl(d.name(), spec.quals(), spec.storage(), spec.funcSpecs(), d.type(), null, null);
        return new FuncDef(decl, compound(field(node, "body")));
    }

    private List<Decl> declaration(TSNode node) {
        DeclSpec spec = specifiers(node);
        List<TSNode> declarators = fields(node, "declarator");
        if (declarators.isEmpty()) {
            return List.of(new Decl(null, spec.quals(), spec.storage(), spec.funcSpecs(), spec.type(), null, null));
        }
        List<Decl> decls = new ArrayList<>();
        for (TSNode child : declarators) {
            CNode init = null;
            if (child.getType().equals("init_declarator")) {
                init = initializer(field(child, "value"));
                child = field(child, "declarator");
            }
            Declarator d = declarator(child, spec);
            decls.add(new Decl(d.name(), spec.quals(), spec.storage(), spec.funcSpecs(), d.type(), init, null));
        }
        return decls;
    }

    private List<Typedef> typeDefinition(TSNode node) {
        DeclSpec spec = specifiers(node);
        List<Typedef> typedefs = new ArrayList<>();
        for (TSNode child : fields(node, "declarator")) {
            Declarator d = declarator(child, spec);
            typedefs.add(new Typedef(d.name(), spec.quals(), spec.storage(), d.type()));
        }
        return typedefs;
    }

    private DeclSpec specifiers(TSNode node) {
        List<String> storage = new ArrayList<>();
        List<String> quals = new ArrayList<>();
        List<String> funcSpecs = new ArrayList<>();
        CNode type = null;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if ("type".equals(node.getFieldNameForChild(i))) {
                type = typeSpecifier(child);
                continue;
            }
            String kind = child.getType();
            if (kind.equals("storage_class_specifier") || kind.equals("type_qualifier")) {
                // alignas(N) is kept as a qualifier so it prints where it was written
                String word = tree.text(child).replaceAll("\\s+", " ");
                if (FUNCTION_SPECIFIERS.contains(word)) {
                    funcSpecs.add(word);
                } else if (kind.equals("storage_class_specifier")) {
                    storage.add(word);
                } else {
                    quals.add(word);
                }
            }
        }
        return new DeclSpec(storage, quals, funcSpecs, type == null ? new IdentifierType(List.of("int")) : type);
    }

    private CNode typeSpecifier(TSNode node) {
        switch (node.getType()) {
            case "primitive_type":
            case "type_identifier":
                return new IdentifierType(List.of(tree.text(node)));
            case "sized_type_specifier": {
                List<String> names = new ArrayList<>();
                for (int i = 0; i < node.getChildCount(); i++) {
                    TSNode child = node.getChild(i);
                    if (!child.isNamed() || "type".equals(node.getFieldNameForChild(i))) {
                        names.add(tree.text(child));
                    }
                }
                return new IdentifierType(names);
            }
            case "struct_specifier":
            case "union_specifier": {
                TSNode name = field(node, "name");
                TSNode body = field(node, "body");
                List<Decl> decls = body == null ? null : fieldDeclarations(namedChildren(body));
                String tag = name == null ? null : tree.text(name);
                return node.getType().equals("struct_specifier") ? new Struct(tag, decls) : new Union(tag, decls);
            }
            case "enum_specifier": {
                TSNode name = field(node, "name");
                TSNode body = field(node, "body");
                EnumeratorList values = null;
                if (body != null) {
                    List<Enumerator> enumerators = new ArrayList<>();
                    for (TSNode enumerator : namedChildren(body)) {
                        if (enumerator.getType().equals("enumerator")) {
                            TSNode value = field(enumerator, "value");
                            enumerators.add(new Enumerator(tree.text(field(enumerator, "name")),
                                    value == null ? null : expression(value)));
                        }
                    }
                    values = new EnumeratorList(enumerators);
                }
                return new CNode.Enum(name == null ? null : tree.text(name), values);
            }
            default:
                throw unsupported(node);
        }
    }

    private List<Decl> fieldDeclarations(List<TSNode> members) {
        List<Decl> decls = new ArrayList<>();
        for (TSNode member : members) {
            if (member.getType().equals("field_declaration")) {
                decls.addAll(fieldDeclaration(member));
            } else if (CONDITIONAL_DIRECTIVES.contains(member.getType())) {
                decls.addAll(fieldDeclarations(takenBranch(member)));
            } else if (!member.getType().startsWith("preproc_")) {
                throw unsupported(member);
            }
        }
        return decls;
    }

    private List<Decl> fieldDeclaration(TSNode member) {
        DeclSpec spec = specifiers(member);
        List<Declarator> declarators = new ArrayList<>();
        List<CNode> bitsizes = new ArrayList<>();
        for (int i = 0; i < member.getChildCount(); i++) {
            TSNode child = member.getChild(i);
            if ("declarator".equals(member.getFieldNameForChild(i)) && !child.isMissing()) {
                declarators.add(declarator(child, spec));
                bitsizes.add(null);
            } else if (child.getType().equals("bitfield_clause")) {
                CNode width = expression(namedChildren(child).get(0));
                if (declarators.isEmpty()) {
                    // unnamed padding: "int : 3;"
                    declarators.add(new Declarator(null, spec.type()));
                    bitsizes.add(width);
                } else {
                    bitsizes.set(bitsizes.size() - 1, width);
                }
            }
        }
        if (declarators.isEmpty()) {
            return List.of(new Decl(null, spec.quals(), spec.storage(), spec.funcSpecs(), spec.type(), null, null));
        }
        List<Decl> decls = new ArrayList<>();
        for (int i = 0; i < declarators.size(); i++) {
            Declarator d = declarators.get(i);
            decls.add(new Decl(d.name(), spec.quals(), spec.storage(), spec.funcSpecs(), d.type(), null,
                    bitsizes.get(i)));
        }
        return decls;
    }

    /**
     * Folds a (possibly abstract) declarator into a type chain. Syntactic
     * nesting runs outside-in, so the outermost declarator ends up innermost
     * around the {@link TypeDecl} leaf: {@code *a[3]} is an array of pointers.
     */
    private Declarator declarator(TSNode node, DeclSpec spec) {
        List<UnaryOperator<CNode>> modifiers = new ArrayList<>();
        String name = null;
        TSNode current = node;
        while (current != null) {
            switch (current.getType()) {
                case "identifier", "field_identifier", "type_identifier", "primitive_type" -> {
                    name = tree.text(current);
                    current = null;
                }
                case "pointer_declarator", "abstract_pointer_declarator" -> {
                    List<String> quals = qualifiers(current);
                    modifiers.add(t -> new PtrDecl(quals, t));
                    current = field(current, "declarator");
                }
                case "array_declarator", "abstract_array_declarator" -> {
                    CNode dim = arrayDimension(current);
                    List<String> dimQuals = qualifiers(current);
                    modifiers.add(t -> new ArrayDecl(t, dim, dimQuals));
                    current = field(current, "declarator");
                }
                case "function_declarator", "abstract_function_declarator" -> {
                    ParamList params = parameterList(field(current, "parameters"));
                    modifiers.add(t -> new FuncDecl(params, t));
                    current = field(current, "declarator");
                }
                case "parenthesized_declarator", "abstract_parenthesized_declarator" -> {
                    List<TSNode> inner = namedChildren(current);
                    current = inner.isEmpty() ? null : inner.get(inner.size() - 1);
                }
                default -> throw unsupported(current);
            }
        }
        CNode type = new TypeDecl(name, spec.quals(), spec.type());
        for (UnaryOperator<CNode> modifier : modifiers) {
            type = modifier.apply(type);
        }
        return new Declarator(name, type);
    }

    private List<String> qualifiers(TSNode node) {
        List<String> quals = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.getType().equals("type_qualifier") || (!child.isNamed() && child.getType().equals("static"))) {
                quals.add(tree.text(child));
            }
        }
        return quals;
    }

    private CNode arrayDimension(TSNode node) {
        TSNode size = field(node, "size");
        if (size != null) {
            return expression(size);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!child.isNamed() && child.getType().equals("*")) {
                return new Id("*");
            }
        }
        return null;
    }

    private ParamList parameterList(TSNode node) {
        List<CNode> params = new ArrayList<>();
        for (TSNode param : namedChildren(node)) {
            if (param.getType().equals("variadic_parameter")) {
                params.add(new EllipsisParam());
                continue;
            }
            if (!param.getType().equals("parameter_declaration")) {
                throw unsupported(param);
            }
            DeclSpec spec = specifiers(param);
            Declarator d = declarator(field(param, "declarator"), spec);
            if (d.name() != null) {
                params.add(new Decl(d.name(), spec.quals(), spec.storage(), spec.funcSpecs(), d.type(), null, null));
            } else {
                params.add(new Typename(null, spec.quals(), d.type()));
            }
        }
        return params.isEmpty() ? null : new ParamList(params);
    }

    private Typename typeName(TSNode descriptor) {
        DeclSpec spec = specifiers(descriptor);
        return new Typename(null, spec.quals(), declarator(field(descriptor, "declarator"), spec).type());
    }

    private CNode initializer(TSNode node) {
        return node.getType().equals("initializer_list") ? initializerList(node) : expression(node);
    }

    private InitList initializerList(TSNode node) {
        List<CNode> exprs = new ArrayList<>();
        for (TSNode item : namedChildren(node)) {
            if (!item.getType().equals("initializer_pair")) {
                exprs.add(initializer(item));
                continue;
            }
            List<CNode> designators = new ArrayList<>();
            for (TSNode designator : fields(item, "designator")) {
                switch (designator.getType()) {
                    case "field_designator" -> designators.add(new Id(tree.text(namedChildren(designator).get(0))));
                    case "subscript_designator" -> designators.add(expression(namedChildren(designator).get(0)));
                    default -> throw unsupported(designator);
                }
            }
            exprs.add(new NamedInitializer(designators, initializer(field(item, "value"))));
        }
        return new InitList(exprs);
    }

    // === Statements ===

    private Compound compound(TSNode node) {
        List<CNode> items = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            blockItem(child, items);
        }
        return new Compound(items);
    }

    private void blockItem(TSNode node, List<CNode> out) {
        String type = node.getType();
        if (type.equals("declaration")) {
            out.addAll(declaration(node));
        } else if (type.equals("type_definition")) {
            out.addAll(typeDefinition(node));
        } else if (TAG_SPECIFIERS.contains(type)) {
            out.add(new Decl(null, List.of(), List.of(), List.of(), typeSpecifier(node), null, null));
        } else if (CONDITIONAL_DIRECTIVES.contains(type)) {
            for (TSNode nested : takenBranch(node)) {
                blockItem(nested, out);
            }
        } else if (!type.startsWith("preproc_")) {
            out.add(statement(node));
        }
    }

    private CNode statement(TSNode node) {
        switch (node.getType()) {
            case "compound_statement":
                return compound(node);
            case "expression_statement": {
                List<TSNode> expr = namedChildren(node);
                return expr.isEmpty() ? new EmptyStatement() : expression(expr.get(0));
            }
            case "if_statement": {
                TSNode alternative = field(node, "alternative");
                if (alternative != null && alternative.getType().equals("else_clause")) {
                    alternative = namedChildren(alternative).get(0);
                }
                CNode otherwise = alternative == null ? null : statement(alternative);
                return new If(expression(field(node, "condition")), statement(field(node, "consequence")),
                        otherwise);
            }
            case "switch_statement":
                return new Switch(expression(field(node, "condition")), statement(field(node, "body")));
            case "case_statement":
                return caseStatement(node);
            case "while_statement":
                return new While(expression(field(node, "condition")), statement(field(node, "body")));
            case "do_statement":
                return new DoWhile(expression(field(node, "condition")), statement(field(node, "body")));
            case "for_statement":
                return forStatement(node);
            case "return_statement": {
                List<TSNode> value = namedChildren(node);
                return new Return(value.isEmpty() ? null : expression(value.get(0)));
            }
            case "break_statement":
                return new Break();
            case "continue_statement":
                return new Continue();
            case "goto_statement":
                return new Goto(tree.text(field(node, "label")));
            case "labeled_statement": {
                List<TSNode> parts = namedChildren(node);
                return new Label(tree.text(field(node, "label")), statement(parts.get(parts.size() - 1)));
            }
            case "attributed_statement": {
                List<TSNode> parts = namedChildren(node);
                return statement(parts.get(parts.size() - 1));
            }
            default:
                throw unsupported(node);
        }
    }

    /** tree-sitter already gives each label the statements up to the next label. */
    private CNode caseStatement(TSNode node) {
        List<CNode> stmts = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.isNamed() && node.getFieldNameForChild(i) == null && !child.getType().equals("comment")) {
                blockItem(child, stmts);
            }
        }
        TSNode value = field(node, "value");
        return value == null ? new Default(stmts) : new Case(expression(value), stmts);
    }

    private CNode forStatement(TSNode node) {
        TSNode initNode = field(node, "initializer");
        CNode init = null;
        if (initNode != null) {
            init = initNode.getType().equals("declaration")
                    ? new DeclList(declaration(initNode))
                    : expression(initNode);
        }
        TSNode cond = field(node, "condition");
        TSNode step = field(node, "update");
        return new For(init, cond == null ? null : expression(cond), step == null ? null : expression(step),
                statement(field(node, "body")));
    }

    // === Expressions ===

    private CNode expression(TSNode node) {
        switch (node.getType()) {
            case "identifier":
            case "true":
            case "false":
            case "null":
                return new Id(tree.text(node));
            case "number_literal":
                return number(tree.text(node));
            case "char_literal":
                return new Constant("char", tree.text(node));
            case "string_literal":
                return new Constant("string", tree.text(node));
            case "concatenated_string":
                return concatenation(node);
            case "parenthesized_expression":
                return expression(namedChildren(node).get(0));
            case "comma_expression": {
                List<CNode> exprs = new ArrayList<>();
                flattenComma(node, exprs);
                return new ExprList(exprs);
            }
            case "assignment_expression":
                return new Assignment(operator(node), expression(field(node, "left")),
                        expression(field(node, "right")));
            case "binary_expression":
                return new BinaryOp(operator(node), expression(field(node, "left")),
                        expression(field(node, "right")));
            case "unary_expression":
            case "pointer_expression":
                return new UnaryOp(operator(node), expression(field(node, "argument")));
            case "update_expression": {
                TSNode argument = field(node, "argument");
                boolean prefix = field(node, "operator").getStartByte() < argument.getStartByte();
                return new UnaryOp(prefix ? operator(node) : "p" + operator(node), expression(argument));
            }
            case "conditional_expression": {
                TSNode whenTrue = field(node, "consequence");
                return new TernaryOp(expression(field(node, "condition")),
                        whenTrue == null ? null : expression(whenTrue), expression(field(node, "alternative")));
            }
            case "call_expression":
                return new FuncCall(expression(field(node, "function")), arguments(field(node, "arguments")));
            case "subscript_expression":
                return new ArrayRef(expression(field(node, "argument")), expression(field(node, "index")));
            case "field_expression":
                return new StructRef(expression(field(node, "argument")), operator(node),
                        new Id(tree.text(field(node, "field"))));
            case "cast_expression":
                return new Cast(typeName(field(node, "type")), expression(field(node, "value")));
            case "sizeof_expression": {
                TSNode type = field(node, "type");
                return new UnaryOp("sizeof", type != null ? typeName(type) : expression(field(node, "value")));
            }
            case "alignof_expression":
                return new UnaryOp("_Alignof", typeName(field(node, "type")));
            case "compound_literal_expression":
                return new CompoundLiteral(typeName(field(node, "type")), initializerList(field(node, "value")));
            case "initializer_list":
                return initializerList(node);
            default:
                throw unsupported(node);
        }
    }

    private String operator(TSNode node) {
        return tree.text(field(node, "operator"));
    }

    private void flattenComma(TSNode node, List<CNode> out) {
        if (node.getType().equals("comma_expression")) {
            flattenComma(field(node, "left"), out);
            flattenComma(field(node, "right"), out);
        } else {
            out.add(expression(node));
        }
    }

    private ExprList arguments(TSNode node) {
        List<CNode> args = new ArrayList<>();
        for (TSNode arg : namedChildren(node)) {
            args.add(expression(arg));
        }
        return args.isEmpty() ? null : new ExprList(args);
    }

    /** tree-sitter folds a leading sign into the literal; split it back out as a unary operator. */
    private static CNode number(String text) {
        if (text.startsWith("-") || text.startsWith("+")) {
            return new UnaryOp(text.substring(0, 1), number(text.substring(1).strip()));
        }
        return new Constant(CLexer.isFloating(text) ? "float" : "int", text);
    }

    private CNode concatenation(TSNode node) {
        String value = null;
        for (TSNode part : namedChildren(node)) {
            if (!part.getType().equals("string_literal")) {
                throw new CParseException("macro inside string concatenation", line(part));
            }
            String text = tree.text(part);
            value = value == null ? text
                    : value.substring(0, value.length() - 1) + text.substring(text.indexOf('"') + 1);
        }
        return new Constant("string", value);
    }
}
