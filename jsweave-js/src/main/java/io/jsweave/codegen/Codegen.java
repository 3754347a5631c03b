/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.jsweave.codegen;

import io.jsweave.ast.*;

import java.util.List;

/**
 * Prints a tree back to JavaScript on a single line per top level statement. Parentheses
 * come only from {@link ParenthesizedExpression} nodes, so a transform that builds
 * expressions where precedence matters has to insert them itself.
 */
public class Codegen {

    private final StringBuilder sb = new StringBuilder();

    public static String generate(AstNode node) {
        Codegen codegen = new Codegen();
        codegen.print(node);
        return codegen.sb.toString();
    }

    private void print(AstNode node) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case PROGRAM -> {
                List<Statement> body = ((Program) node).body;
                for (int i = 0; i < body.size(); i++) {
                    if (i > 0) {
                        sb.append('\n');
                    }
                    print(body.get(i));
                }
            }
            case EXPRESSION_STATEMENT -> {
                Expression expression = ((ExpressionStatement) node).expression;
                boolean wrap = startsAmbiguously(expression);
                if (wrap) {
                    sb.append('(');
                }
                print(expression);
                if (wrap) {
                    sb.append(')');
                }
                sb.append(';');
            }
            case BLOCK_STATEMENT -> block(((BlockStatement) node).body);
            case VARIABLE_DECLARATION -> {
                variableDeclaration((VariableDeclaration) node);
                sb.append(';');
            }
            case VARIABLE_DECLARATOR -> {
                VariableDeclarator n = (VariableDeclarator) node;
                print(n.id);
                if (n.init != null) {
                    sb.append(" = ");
                    print(n.init);
                }
            }
            case RETURN_STATEMENT -> {
                ReturnStatement n = (ReturnStatement) node;
                sb.append("return");
                if (n.argument != null) {
                    sb.append(' ');
                    print(n.argument);
                }
                sb.append(';');
            }
            case IF_STATEMENT -> {
                IfStatement n = (IfStatement) node;
                sb.append("if (");
                print(n.test);
                sb.append(") ");
                print(n.consequent);
                if (n.alternate != null) {
                    sb.append(" else ");
                    print(n.alternate);
                }
            }
            case THROW_STATEMENT -> {
                sb.append("throw ");
                print(((ThrowStatement) node).argument);
                sb.append(';');
            }
            case EMPTY_STATEMENT -> sb.append(';');
            case IMPORT_DECLARATION -> importDeclaration((ImportDeclaration) node);
            case IMPORT_SPECIFIER -> {
                ImportSpecifier n = (ImportSpecifier) node;
                sb.append(n.imported);
                if (!n.imported.equals(n.local.name)) {
                    sb.append(" as ").append(n.local.name);
                }
            }
            case IMPORT_DEFAULT_SPECIFIER -> sb.append(((ImportDefaultSpecifier) node).local.name);
            case IMPORT_NAMESPACE_SPECIFIER -> sb.append("* as ").append(((ImportNamespaceSpecifier) node).local.name);
            case EXPORT_DEFAULT_DECLARATION -> {
                Expression declaration = ((ExportDefaultDeclaration) node).declaration;
                sb.append("export default ");
                print(declaration);
                if (!(declaration instanceof FunctionNode fn && fn.isDeclaration())) {
                    sb.append(';');
                }
            }
            case EXPORT_NAMED_DECLARATION -> {
                sb.append("export ");
                print(((ExportNamedDeclaration) node).declaration);
            }
            case FUNCTION -> function((FunctionNode) node);
            case ARROW_FUNCTION_EXPRESSION -> arrow((ArrowFunctionExpression) node);
            case FORMAL_PARAMETERS -> join(((FormalParameters) node).items, ", ");
            case FUNCTION_BODY -> block(((FunctionBody) node).statements);
            case BINDING_IDENTIFIER -> sb.append(((BindingIdentifier) node).name);
            case OBJECT_PATTERN -> {
                List<BindingProperty> properties = ((ObjectPattern) node).properties;
                if (properties.isEmpty()) {
                    sb.append("{}");
                } else {
                    sb.append("{ ");
                    join(properties, ", ");
                    sb.append(" }");
                }
            }
            case BINDING_PROPERTY -> {
                BindingProperty n = (BindingProperty) node;
                if (n.shorthand) {
                    print(n.value);
                } else {
                    propertyKey(n.key, n.computed);
                    sb.append(": ");
                    print(n.value);
                }
            }
            case ARRAY_PATTERN -> {
                sb.append('[');
                List<BindingPattern> elements = ((ArrayPattern) node).elements;
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    print(elements.get(i));
                }
                if (!elements.isEmpty() && elements.get(elements.size() - 1) == null) {
                    sb.append(',');
                }
                sb.append(']');
            }
            case ASSIGNMENT_PATTERN -> {
                AssignmentPattern n = (AssignmentPattern) node;
                print(n.left);
                sb.append(" = ");
                print(n.right);
            }
            case IDENTIFIER_REFERENCE -> sb.append(((IdentifierReference) node).name);
            case IDENTIFIER_NAME -> sb.append(((IdentifierName) node).name);
            case THIS_EXPRESSION -> sb.append("this");
            case NULL_LITERAL -> sb.append("null");
            case BOOLEAN_LITERAL -> sb.append(((BooleanLiteral) node).value);
            case NUMERIC_LITERAL -> sb.append(((NumericLiteral) node).raw);
            case STRING_LITERAL -> quote(((StringLiteral) node).value);
            case ARRAY_EXPRESSION -> {
                sb.append('[');
                List<ArrayElement> elements = ((ArrayExpression) node).elements;
                join(elements, ", ");
                if (!elements.isEmpty() && elements.get(elements.size() - 1) instanceof Elision) {
                    sb.append(',');
                }
                sb.append(']');
            }
            case ELISION -> {
                // a hole prints as nothing between its commas
            }
            case OBJECT_EXPRESSION -> {
                List<ObjectPropertyKind> properties = ((ObjectExpression) node).properties;
                if (properties.isEmpty()) {
                    sb.append("{}");
                } else {
                    sb.append("{ ");
                    join(properties, ", ");
                    sb.append(" }");
                }
            }
            case OBJECT_PROPERTY -> objectProperty((ObjectProperty) node);
            case SPREAD_ELEMENT -> {
                sb.append("...");
                print(((SpreadElement) node).argument);
            }
            case CALL_EXPRESSION -> {
                CallExpression n = (CallExpression) node;
                print(n.callee);
                sb.append(n.optional ? "?.(" : "(");
                join(n.arguments, ", ");
                sb.append(')');
            }
            case NEW_EXPRESSION -> {
                NewExpression n = (NewExpression) node;
                sb.append("new ");
                print(n.callee);
                sb.append('(');
                join(n.arguments, ", ");
                sb.append(')');
            }
            case STATIC_MEMBER_EXPRESSION -> {
                StaticMemberExpression n = (StaticMemberExpression) node;
                print(n.object);
                sb.append(n.optional ? "?." : ".");
                print(n.property);
            }
            case COMPUTED_MEMBER_EXPRESSION -> {
                ComputedMemberExpression n = (ComputedMemberExpression) node;
                print(n.object);
                sb.append(n.optional ? "?.[" : "[");
                print(n.expression);
                sb.append(']');
            }
            case UNARY_EXPRESSION -> {
                UnaryExpression n = (UnaryExpression) node;
                sb.append(n.operator);
                if (Character.isLetter(n.operator.charAt(0))) {
                    sb.append(' ');
                }
                print(n.argument);
            }
            case UPDATE_EXPRESSION -> {
                UpdateExpression n = (UpdateExpression) node;
                if (n.prefix) {
                    sb.append(n.operator);
                    print(n.argument);
                } else {
                    print(n.argument);
                    sb.append(n.operator);
                }
            }
            case BINARY_EXPRESSION -> {
                BinaryExpression n = (BinaryExpression) node;
                binary(n.left, n.operator, n.right);
            }
            case LOGICAL_EXPRESSION -> {
                LogicalExpression n = (LogicalExpression) node;
                binary(n.left, n.operator, n.right);
            }
            case CONDITIONAL_EXPRESSION -> {
                ConditionalExpression n = (ConditionalExpression) node;
                print(n.test);
                sb.append(" ? ");
                print(n.consequent);
                sb.append(" : ");
                print(n.alternate);
            }
            case ASSIGNMENT_EXPRESSION -> {
                AssignmentExpression n = (AssignmentExpression) node;
                binary(n.left, n.operator, n.right);
            }
            case SEQUENCE_EXPRESSION -> join(((SequenceExpression) node).expressions, ", ");
            case PARENTHESIZED_EXPRESSION -> {
                sb.append('(');
                print(((ParenthesizedExpression) node).expression);
                sb.append(')');
            }
            case AWAIT_EXPRESSION -> {
                sb.append("await ");
                print(((AwaitExpression) node).argument);
            }
            case YIELD_EXPRESSION -> {
                YieldExpression n = (YieldExpression) node;
                sb.append(n.delegate ? "yield*" : "yield");
                if (n.argument != null) {
                    sb.append(' ');
                    print(n.argument);
                }
            }
            case JSX_ELEMENT -> {
                JsxElement n = (JsxElement) node;
                print(n.openingElement);
                join(n.children, "");
                print(n.closingElement);
            }
            case JSX_OPENING_ELEMENT -> {
                JsxOpeningElement n = (JsxOpeningElement) node;
                sb.append('<');
                print(n.name);
                for (JsxAttributeItem attribute : n.attributes) {
                    sb.append(' ');
                    print(attribute);
                }
                sb.append(n.selfClosing ? " />" : ">");
            }
            case JSX_CLOSING_ELEMENT -> {
                sb.append("</");
                print(((JsxClosingElement) node).name);
                sb.append('>');
            }
            case JSX_FRAGMENT -> {
                JsxFragment n = (JsxFragment) node;
                print(n.openingFragment);
                join(n.children, "");
                print(n.closingFragment);
            }
            case JSX_OPENING_FRAGMENT -> sb.append("<>");
            case JSX_CLOSING_FRAGMENT -> sb.append("</>");
            case JSX_IDENTIFIER -> sb.append(((JsxIdentifier) node).name);
            case JSX_MEMBER_EXPRESSION -> {
                JsxMemberExpression n = (JsxMemberExpression) node;
                print(n.object);
                sb.append('.');
                print(n.property);
            }
            case JSX_NAMESPACED_NAME -> {
                JsxNamespacedName n = (JsxNamespacedName) node;
                print(n.namespace);
                sb.append(':');
                print(n.name);
            }
            case JSX_ATTRIBUTE -> {
                JsxAttribute n = (JsxAttribute) node;
                print(n.name);
                if (n.value instanceof StringLiteral literal) {
                    char quote = literal.value.indexOf('"') == -1 ? '"' : '\'';
                    sb.append('=').append(quote).append(literal.value).append(quote);
                } else if (n.value != null) {
                    sb.append('=');
                    print(n.value);
                }
            }
            case JSX_SPREAD_ATTRIBUTE -> {
                sb.append("{...");
                print(((JsxSpreadAttribute) node).argument);
                sb.append('}');
            }
            case JSX_EXPRESSION_CONTAINER -> {
                sb.append('{');
                print(((JsxExpressionContainer) node).expression);
                sb.append('}');
            }
            case JSX_EMPTY_EXPRESSION -> {
                // {}
            }
            case JSX_TEXT -> sb.append(((JsxText) node).value);
        }
    }

    private void join(List<? extends AstNode> nodes, String separator) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            print(nodes.get(i));
        }
    }

    private void block(List<Statement> statements) {
        if (statements.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append("{ ");
        join(statements, " ");
        sb.append(" }");
    }

    private void binary(AstNode left, String operator, AstNode right) {
        print(left);
        sb.append(' ').append(operator).append(' ');
        print(right);
    }

    private void variableDeclaration(VariableDeclaration node) {
        sb.append(node.declarationKind.keyword()).append(' ');
        join(node.declarations, ", ");
    }

    private void importDeclaration(ImportDeclaration node) {
        sb.append("import ");
        if (!node.specifiers.isEmpty()) {
            boolean first = true;
            boolean braceOpen = false;
            for (ImportDeclarationSpecifier specifier : node.specifiers) {
                if (!first) {
                    sb.append(", ");
                }
                if (specifier instanceof ImportSpecifier && !braceOpen) {
                    sb.append("{ ");
                    braceOpen = true;
                }
                print(specifier);
                first = false;
            }
            if (braceOpen) {
                sb.append(" }");
            }
            sb.append(" from ");
        }
        print(node.source);
        sb.append(';');
    }

    private void function(FunctionNode node) {
        if (node.async) {
            sb.append("async ");
        }
        sb.append("function");
        if (node.generator) {
            sb.append('*');
        }
        sb.append(' ');
        if (node.id != null) {
            sb.append(node.id.name);
        }
        sb.append('(');
        print(node.params);
        sb.append(") ");
        print(node.body);
    }

    private void arrow(ArrowFunctionExpression node) {
        if (node.async) {
            sb.append("async ");
        }
        sb.append('(');
        print(node.params);
        sb.append(") => ");
        Expression expression = node.getExpression();
        if (expression == null) {
            print(node.body);
        } else if (expression instanceof ObjectExpression) {
            sb.append('(');
            print(expression);
            sb.append(')');
        } else {
            print(expression);
        }
    }

    private void objectProperty(ObjectProperty node) {
        if (node.shorthand) {
            print(node.value);
            return;
        }
        if (node.method && node.value instanceof FunctionNode fn) {
            if (fn.async) {
                sb.append("async ");
            }
            if (fn.generator) {
                sb.append('*');
            }
            propertyKey(node.key, node.computed);
            sb.append('(');
            print(fn.params);
            sb.append(") ");
            print(fn.body);
            return;
        }
        propertyKey(node.key, node.computed);
        sb.append(": ");
        print(node.value);
    }

    private void propertyKey(PropertyKey key, boolean computed) {
        if (computed) {
            sb.append('[');
            print(key);
            sb.append(']');
        } else {
            print(key);
        }
    }

    private void quote(String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    /**
     * An expression statement may not start with {@code function} or {@code {}.
     */
    private static boolean startsAmbiguously(Expression expression) {
        Expression head = expression;
        while (true) {
            if (head instanceof FunctionNode || head instanceof ObjectExpression) {
                return true;
            }
            if (head instanceof CallExpression call) {
                head = call.callee;
            } else if (head instanceof StaticMemberExpression member) {
                head = member.object;
            } else if (head instanceof ComputedMemberExpression member) {
                head = member.object;
            } else if (head instanceof BinaryExpression binary) {
                head = binary.left;
            } else if (head instanceof LogicalExpression logical) {
                head = logical.left;
            } else if (head instanceof ConditionalExpression conditional) {
                head = conditional.test;
            } else if (head instanceof SequenceExpression sequence && !sequence.expressions.isEmpty()) {
                head = sequence.expressions.get(0);
            } else {
                return false;
            }
        }
    }

}
