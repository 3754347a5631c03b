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
package io.jsweave.traverse;

import io.jsweave.ast.*;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.ScopeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * Single depth-first walk of a unit driving any number of visitors. See {@link Visitor} for
 * the hook order.
 * <p>
 * A {@link RuntimeException} thrown by a hook is logged and recorded as a
 * {@link VisitorFailure}, and the walk goes on. An unbalanced ancestor or scope stack aborts
 * the walk and is reported in {@link TraverseResult#abortReason()}. Nothing escapes
 * {@link #traverse}.
 */
public class Traverser {

    static final Logger logger = LoggerFactory.getLogger(Traverser.class);

    private enum Position {
        EXPRESSION, STATEMENT, OTHER
    }

    private final CompilationUnit unit;
    private final List<Visitor> visitors;
    private final TraverseCtx ctx;
    private final List<VisitorFailure> failures = new ArrayList<>();

    private Traverser(CompilationUnit unit, List<? extends Visitor> visitors) {
        this.unit = unit;
        this.visitors = List.copyOf(visitors);
        this.ctx = new TraverseCtx(unit);
    }

    public static TraverseResult traverse(CompilationUnit unit, Visitor... visitors) {
        return traverse(unit, Arrays.asList(visitors));
    }

    public static TraverseResult traverse(CompilationUnit unit, List<? extends Visitor> visitors) {
        boolean mutating = false;
        for (Visitor visitor : visitors) {
            if (!visitor.isReadOnly()) {
                mutating = true;
                break;
            }
        }
        Lock lock = mutating ? unit.writeLock() : unit.readLock();
        lock.lock();
        try {
            return new Traverser(unit, visitors).run();
        } finally {
            lock.unlock();
        }
    }

    private TraverseResult run() {
        String abortReason = null;
        long startTime = System.currentTimeMillis();
        try {
            visit(unit.getProgram(), Position.OTHER);
            if (ctx.ancestry().depth() != 0) {
                throw new TraversalException("ancestor stack not empty after walk: " + ctx.ancestry());
            }
            if (ctx.currentScopeId() != null) {
                throw new TraversalException("scope stack not empty after walk: " + ctx.scopeStack());
            }
        } catch (TraversalException e) {
            abortReason = e.getMessage();
            logger.error("{}: walk aborted: {}", unit.getName(), abortReason);
        } catch (StackOverflowError e) {
            abortReason = "tree nested too deeply, stack overflow at depth " + ctx.ancestry().depth();
            logger.error("{}: walk aborted: {}", unit.getName(), abortReason);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("{}: walked with {} visitor(s) in {} ms, diagnostics: {}, failures: {}", unit.getName(),
                    visitors.size(), System.currentTimeMillis() - startTime, ctx.getDiagnostics().size(), failures.size());
        }
        return new TraverseResult(ctx.getDiagnostics(), failures, abortReason);
    }

    // ========== per node ==========

    private AstNode visit(AstNode node, Position position) {
        ScopeId scopeId = node instanceof ScopeOwner owner ? owner.getScopeId() : null;
        if (scopeId != null) {
            ctx.pushScope(scopeId);
        }
        for (Visitor visitor : visitors) {
            try {
                visitor.enterNode(node, ctx);
                if (position == Position.EXPRESSION) {
                    visitor.enterExpression((Expression) node, ctx);
                } else if (position == Position.STATEMENT) {
                    visitor.enterStatement((Statement) node, ctx);
                }
                enter(visitor, node);
            } catch (RuntimeException e) {
                fail(visitor, node, e.toString(), e);
            }
        }
        walkChildren(node);
        AstNode current = node;
        for (Visitor visitor : visitors) {
            try {
                exit(visitor, current);
                if (position == Position.EXPRESSION) {
                    current = replace(visitor, current, visitor.exitExpression((Expression) current, ctx));
                } else if (position == Position.STATEMENT) {
                    current = replace(visitor, current, visitor.exitStatement((Statement) current, ctx));
                }
                visitor.exitNode(current, ctx);
            } catch (RuntimeException e) {
                fail(visitor, current, e.toString(), e);
            }
        }
        if (scopeId != null) {
            ctx.popScope(scopeId);
        }
        return current;
    }

    private AstNode replace(Visitor visitor, AstNode current, AstNode returned) {
        if (returned == current) {
            return current;
        }
        if (returned == null) {
            fail(visitor, current, "returned null from exit hook", null);
            return current;
        }
        if (visitor.isReadOnly()) {
            fail(visitor, current, "read-only visitor returned a replacement: " + returned.kind(), null);
            return current;
        }
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {} replaced {} with {}", unit.getName(), visitor.name(), current.kind(), returned.kind());
        }
        return returned;
    }

    private void fail(Visitor visitor, AstNode node, String message, Exception e) {
        logger.warn("{}: visitor {} failed on {} {}: {}", unit.getName(), visitor.name(), node.kind(),
                unit.getSource().getPositionDisplay(node.getSpan().start()), message);
        if (e != null && logger.isDebugEnabled()) {
            logger.debug("visitor failure stack trace", e);
        }
        failures.add(new VisitorFailure(visitor.name(), node.kind(), node.getSpan(), message));
    }

    // ========== children ==========

    @SuppressWarnings("unchecked")
    private <T extends AstNode> T child(AstNode parent, Slot slot, int index, T child, Position position) {
        if (child == null) {
            return null;
        }
        Ancestry ancestry = ctx.ancestry();
        ancestry.push(new Ancestor(parent, slot, index));
        int depth = ancestry.depth();
        AstNode result = visit(child, position);
        if (ancestry.depth() != depth) {
            throw new TraversalException("ancestor stack unbalanced below " + parent.kind() + "." + slot
                    + ", expected depth " + depth + " but was " + ancestry.depth());
        }
        ancestry.pop();
        return (T) result;
    }

    private Expression expression(AstNode parent, Slot slot, Expression child) {
        return child(parent, slot, -1, child, Position.EXPRESSION);
    }

    private Statement statement(AstNode parent, Slot slot, Statement child) {
        return child(parent, slot, -1, child, Position.STATEMENT);
    }

    private <T extends AstNode> T node(AstNode parent, Slot slot, T child) {
        return child(parent, slot, -1, child, Position.OTHER);
    }

    /**
     * Walks a slot whose type admits any expression, such as an argument or a computed key.
     */
    private <T extends AstNode> T expressionOrNode(AstNode parent, Slot slot, T child) {
        return child(parent, slot, -1, child, child instanceof Expression ? Position.EXPRESSION : Position.OTHER);
    }

    private <T extends AstNode> void list(AstNode parent, Slot slot, List<T> items, Position position) {
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            if (item == null) {
                continue;
            }
            Position itemPosition = position;
            if (position == Position.EXPRESSION && !(item instanceof Expression)) {
                itemPosition = Position.OTHER;
            }
            items.set(i, child(parent, slot, i, item, itemPosition));
        }
    }

    private void walkChildren(AstNode node) {
        switch (node.kind()) {
            case PROGRAM -> list(node, Slot.PROGRAM_BODY, ((Program) node).body, Position.STATEMENT);
            case EXPRESSION_STATEMENT -> {
                ExpressionStatement n = (ExpressionStatement) node;
                n.expression = expression(n, Slot.EXPRESSION_STATEMENT_EXPRESSION, n.expression);
            }
            case BLOCK_STATEMENT -> list(node, Slot.BLOCK_BODY, ((BlockStatement) node).body, Position.STATEMENT);
            case VARIABLE_DECLARATION -> list(node, Slot.VARIABLE_DECLARATIONS, ((VariableDeclaration) node).declarations, Position.OTHER);
            case VARIABLE_DECLARATOR -> {
                VariableDeclarator n = (VariableDeclarator) node;
                n.id = node(n, Slot.VARIABLE_DECLARATOR_ID, n.id);
                n.init = expression(n, Slot.VARIABLE_DECLARATOR_INIT, n.init);
            }
            case RETURN_STATEMENT -> {
                ReturnStatement n = (ReturnStatement) node;
                n.argument = expression(n, Slot.RETURN_ARGUMENT, n.argument);
            }
            case IF_STATEMENT -> {
                IfStatement n = (IfStatement) node;
                n.test = expression(n, Slot.IF_TEST, n.test);
                n.consequent = statement(n, Slot.IF_CONSEQUENT, n.consequent);
                n.alternate = statement(n, Slot.IF_ALTERNATE, n.alternate);
            }
            case THROW_STATEMENT -> {
                ThrowStatement n = (ThrowStatement) node;
                n.argument = expression(n, Slot.THROW_ARGUMENT, n.argument);
            }
            case IMPORT_DECLARATION -> {
                ImportDeclaration n = (ImportDeclaration) node;
                list(n, Slot.IMPORT_SPECIFIERS, n.specifiers, Position.OTHER);
                n.source = node(n, Slot.IMPORT_SOURCE, n.source);
            }
            case IMPORT_SPECIFIER -> {
                ImportSpecifier n = (ImportSpecifier) node;
                n.local = node(n, Slot.IMPORT_SPECIFIER_LOCAL, n.local);
            }
            case IMPORT_DEFAULT_SPECIFIER -> {
                ImportDefaultSpecifier n = (ImportDefaultSpecifier) node;
                n.local = node(n, Slot.IMPORT_SPECIFIER_LOCAL, n.local);
            }
            case IMPORT_NAMESPACE_SPECIFIER -> {
                ImportNamespaceSpecifier n = (ImportNamespaceSpecifier) node;
                n.local = node(n, Slot.IMPORT_SPECIFIER_LOCAL, n.local);
            }
            case EXPORT_DEFAULT_DECLARATION -> {
                ExportDefaultDeclaration n = (ExportDefaultDeclaration) node;
                n.declaration = expression(n, Slot.EXPORT_DEFAULT_DECLARATION, n.declaration);
            }
            case EXPORT_NAMED_DECLARATION -> {
                ExportNamedDeclaration n = (ExportNamedDeclaration) node;
                n.declaration = statement(n, Slot.EXPORT_NAMED_DECLARATION, n.declaration);
            }
            case FUNCTION -> {
                FunctionNode n = (FunctionNode) node;
                n.id = node(n, Slot.FUNCTION_ID, n.id);
                n.params = node(n, Slot.FUNCTION_PARAMS, n.params);
                n.body = node(n, Slot.FUNCTION_BODY, n.body);
            }
            case ARROW_FUNCTION_EXPRESSION -> {
                ArrowFunctionExpression n = (ArrowFunctionExpression) node;
                n.params = node(n, Slot.ARROW_PARAMS, n.params);
                n.body = node(n, Slot.ARROW_BODY, n.body);
            }
            case FORMAL_PARAMETERS -> list(node, Slot.FORMAL_PARAMETERS_ITEMS, ((FormalParameters) node).items, Position.OTHER);
            case FUNCTION_BODY -> list(node, Slot.FUNCTION_BODY_STATEMENTS, ((FunctionBody) node).statements, Position.STATEMENT);
            case OBJECT_PATTERN -> list(node, Slot.OBJECT_PATTERN_PROPERTIES, ((ObjectPattern) node).properties, Position.OTHER);
            case BINDING_PROPERTY -> {
                BindingProperty n = (BindingProperty) node;
                n.key = n.computed ? expressionOrNode(n, Slot.BINDING_PROPERTY_KEY, n.key) : node(n, Slot.BINDING_PROPERTY_KEY, n.key);
                n.value = node(n, Slot.BINDING_PROPERTY_VALUE, n.value);
            }
            case ARRAY_PATTERN -> list(node, Slot.ARRAY_PATTERN_ELEMENTS, ((ArrayPattern) node).elements, Position.OTHER);
            case ASSIGNMENT_PATTERN -> {
                AssignmentPattern n = (AssignmentPattern) node;
                n.left = node(n, Slot.ASSIGNMENT_PATTERN_LEFT, n.left);
                n.right = expression(n, Slot.ASSIGNMENT_PATTERN_RIGHT, n.right);
            }
            case ARRAY_EXPRESSION -> list(node, Slot.ARRAY_ELEMENTS, ((ArrayExpression) node).elements, Position.EXPRESSION);
            case OBJECT_EXPRESSION -> list(node, Slot.OBJECT_PROPERTIES, ((ObjectExpression) node).properties, Position.OTHER);
            case OBJECT_PROPERTY -> {
                ObjectProperty n = (ObjectProperty) node;
                n.key = n.computed ? expressionOrNode(n, Slot.OBJECT_PROPERTY_KEY, n.key) : node(n, Slot.OBJECT_PROPERTY_KEY, n.key);
                n.value = expression(n, Slot.OBJECT_PROPERTY_VALUE, n.value);
            }
            case SPREAD_ELEMENT -> {
                SpreadElement n = (SpreadElement) node;
                n.argument = expression(n, Slot.SPREAD_ARGUMENT, n.argument);
            }
            case CALL_EXPRESSION -> {
                CallExpression n = (CallExpression) node;
                n.callee = expression(n, Slot.CALL_CALLEE, n.callee);
                list(n, Slot.CALL_ARGUMENTS, n.arguments, Position.EXPRESSION);
            }
            case NEW_EXPRESSION -> {
                NewExpression n = (NewExpression) node;
                n.callee = expression(n, Slot.NEW_CALLEE, n.callee);
                list(n, Slot.NEW_ARGUMENTS, n.arguments, Position.EXPRESSION);
            }
            case STATIC_MEMBER_EXPRESSION -> {
                StaticMemberExpression n = (StaticMemberExpression) node;
                n.object = expression(n, Slot.MEMBER_OBJECT, n.object);
                n.property = node(n, Slot.MEMBER_PROPERTY, n.property);
            }
            case COMPUTED_MEMBER_EXPRESSION -> {
                ComputedMemberExpression n = (ComputedMemberExpression) node;
                n.object = expression(n, Slot.MEMBER_OBJECT, n.object);
                n.expression = expression(n, Slot.MEMBER_PROPERTY, n.expression);
            }
            case UNARY_EXPRESSION -> {
                UnaryExpression n = (UnaryExpression) node;
                n.argument = expression(n, Slot.UNARY_ARGUMENT, n.argument);
            }
            case UPDATE_EXPRESSION -> {
                UpdateExpression n = (UpdateExpression) node;
                n.argument = node(n, Slot.UPDATE_ARGUMENT, n.argument);
            }
            case BINARY_EXPRESSION -> {
                BinaryExpression n = (BinaryExpression) node;
                n.left = expression(n, Slot.BINARY_LEFT, n.left);
                n.right = expression(n, Slot.BINARY_RIGHT, n.right);
            }
            case LOGICAL_EXPRESSION -> {
                LogicalExpression n = (LogicalExpression) node;
                n.left = expression(n, Slot.LOGICAL_LEFT, n.left);
                n.right = expression(n, Slot.LOGICAL_RIGHT, n.right);
            }
            case CONDITIONAL_EXPRESSION -> {
                ConditionalExpression n = (ConditionalExpression) node;
                n.test = expression(n, Slot.CONDITIONAL_TEST, n.test);
                n.consequent = expression(n, Slot.CONDITIONAL_CONSEQUENT, n.consequent);
                n.alternate = expression(n, Slot.CONDITIONAL_ALTERNATE, n.alternate);
            }
            case ASSIGNMENT_EXPRESSION -> {
                AssignmentExpression n = (AssignmentExpression) node;
                n.left = node(n, Slot.ASSIGNMENT_LEFT, n.left);
                n.right = expression(n, Slot.ASSIGNMENT_RIGHT, n.right);
            }
            case SEQUENCE_EXPRESSION -> list(node, Slot.SEQUENCE_EXPRESSIONS, ((SequenceExpression) node).expressions, Position.EXPRESSION);
            case PARENTHESIZED_EXPRESSION -> {
                ParenthesizedExpression n = (ParenthesizedExpression) node;
                n.expression = expression(n, Slot.PARENTHESIZED_EXPRESSION, n.expression);
            }
            case AWAIT_EXPRESSION -> {
                AwaitExpression n = (AwaitExpression) node;
                n.argument = expression(n, Slot.AWAIT_ARGUMENT, n.argument);
            }
            case YIELD_EXPRESSION -> {
                YieldExpression n = (YieldExpression) node;
                n.argument = expression(n, Slot.YIELD_ARGUMENT, n.argument);
            }
            case JSX_ELEMENT -> {
                JsxElement n = (JsxElement) node;
                n.openingElement = node(n, Slot.JSX_ELEMENT_OPENING, n.openingElement);
                list(n, Slot.JSX_ELEMENT_CHILDREN, n.children, Position.OTHER);
                n.closingElement = node(n, Slot.JSX_ELEMENT_CLOSING, n.closingElement);
            }
            case JSX_OPENING_ELEMENT -> {
                JsxOpeningElement n = (JsxOpeningElement) node;
                n.name = node(n, Slot.JSX_OPENING_ELEMENT_NAME, n.name);
                list(n, Slot.JSX_OPENING_ELEMENT_ATTRIBUTES, n.attributes, Position.OTHER);
            }
            case JSX_CLOSING_ELEMENT -> {
                JsxClosingElement n = (JsxClosingElement) node;
                n.name = node(n, Slot.JSX_CLOSING_ELEMENT_NAME, n.name);
            }
            case JSX_FRAGMENT -> {
                JsxFragment n = (JsxFragment) node;
                n.openingFragment = node(n, Slot.JSX_FRAGMENT_OPENING, n.openingFragment);
                list(n, Slot.JSX_FRAGMENT_CHILDREN, n.children, Position.OTHER);
                n.closingFragment = node(n, Slot.JSX_FRAGMENT_CLOSING, n.closingFragment);
            }
            case JSX_MEMBER_EXPRESSION -> {
                JsxMemberExpression n = (JsxMemberExpression) node;
                n.object = node(n, Slot.JSX_MEMBER_OBJECT, n.object);
                n.property = node(n, Slot.JSX_MEMBER_PROPERTY, n.property);
            }
            case JSX_NAMESPACED_NAME -> {
                JsxNamespacedName n = (JsxNamespacedName) node;
                n.namespace = node(n, Slot.JSX_NAMESPACE, n.namespace);
                n.name = node(n, Slot.JSX_NAMESPACED_NAME, n.name);
            }
            case JSX_ATTRIBUTE -> {
                JsxAttribute n = (JsxAttribute) node;
                n.name = node(n, Slot.JSX_ATTRIBUTE_NAME, n.name);
                n.value = node(n, Slot.JSX_ATTRIBUTE_VALUE, n.value);
            }
            case JSX_SPREAD_ATTRIBUTE -> {
                JsxSpreadAttribute n = (JsxSpreadAttribute) node;
                n.argument = expression(n, Slot.JSX_SPREAD_ATTRIBUTE_ARGUMENT, n.argument);
            }
            case JSX_EXPRESSION_CONTAINER -> {
                JsxExpressionContainer n = (JsxExpressionContainer) node;
                n.expression = expressionOrNode(n, Slot.JSX_EXPRESSION_CONTAINER_EXPRESSION, n.expression);
            }
            default -> {
                // leaf
            }
        }
    }

    // ========== dispatch ==========

    private void enter(Visitor visitor, AstNode node) {
        switch (node.kind()) {
            case PROGRAM -> visitor.enterProgram((Program) node, ctx);
            case EXPRESSION_STATEMENT -> visitor.enterExpressionStatement((ExpressionStatement) node, ctx);
            case BLOCK_STATEMENT -> visitor.enterBlockStatement((BlockStatement) node, ctx);
            case VARIABLE_DECLARATION -> visitor.enterVariableDeclaration((VariableDeclaration) node, ctx);
            case VARIABLE_DECLARATOR -> visitor.enterVariableDeclarator((VariableDeclarator) node, ctx);
            case RETURN_STATEMENT -> visitor.enterReturnStatement((ReturnStatement) node, ctx);
            case IF_STATEMENT -> visitor.enterIfStatement((IfStatement) node, ctx);
            case THROW_STATEMENT -> visitor.enterThrowStatement((ThrowStatement) node, ctx);
            case EMPTY_STATEMENT -> visitor.enterEmptyStatement((EmptyStatement) node, ctx);
            case IMPORT_DECLARATION -> visitor.enterImportDeclaration((ImportDeclaration) node, ctx);
            case IMPORT_SPECIFIER -> visitor.enterImportSpecifier((ImportSpecifier) node, ctx);
            case IMPORT_DEFAULT_SPECIFIER -> visitor.enterImportDefaultSpecifier((ImportDefaultSpecifier) node, ctx);
            case IMPORT_NAMESPACE_SPECIFIER -> visitor.enterImportNamespaceSpecifier((ImportNamespaceSpecifier) node, ctx);
            case EXPORT_DEFAULT_DECLARATION -> visitor.enterExportDefaultDeclaration((ExportDefaultDeclaration) node, ctx);
            case EXPORT_NAMED_DECLARATION -> visitor.enterExportNamedDeclaration((ExportNamedDeclaration) node, ctx);
            case FUNCTION -> visitor.enterFunction((FunctionNode) node, ctx);
            case ARROW_FUNCTION_EXPRESSION -> visitor.enterArrowFunctionExpression((ArrowFunctionExpression) node, ctx);
            case FORMAL_PARAMETERS -> visitor.enterFormalParameters((FormalParameters) node, ctx);
            case FUNCTION_BODY -> visitor.enterFunctionBody((FunctionBody) node, ctx);
            case BINDING_IDENTIFIER -> visitor.enterBindingIdentifier((BindingIdentifier) node, ctx);
            case OBJECT_PATTERN -> visitor.enterObjectPattern((ObjectPattern) node, ctx);
            case BINDING_PROPERTY -> visitor.enterBindingProperty((BindingProperty) node, ctx);
            case ARRAY_PATTERN -> visitor.enterArrayPattern((ArrayPattern) node, ctx);
            case ASSIGNMENT_PATTERN -> visitor.enterAssignmentPattern((AssignmentPattern) node, ctx);
            case IDENTIFIER_REFERENCE -> visitor.enterIdentifierReference((IdentifierReference) node, ctx);
            case IDENTIFIER_NAME -> visitor.enterIdentifierName((IdentifierName) node, ctx);
            case THIS_EXPRESSION -> visitor.enterThisExpression((ThisExpression) node, ctx);
            case NULL_LITERAL -> visitor.enterNullLiteral((NullLiteral) node, ctx);
            case BOOLEAN_LITERAL -> visitor.enterBooleanLiteral((BooleanLiteral) node, ctx);
            case NUMERIC_LITERAL -> visitor.enterNumericLiteral((NumericLiteral) node, ctx);
            case STRING_LITERAL -> visitor.enterStringLiteral((StringLiteral) node, ctx);
            case ARRAY_EXPRESSION -> visitor.enterArrayExpression((ArrayExpression) node, ctx);
            case ELISION -> visitor.enterElision((Elision) node, ctx);
            case OBJECT_EXPRESSION -> visitor.enterObjectExpression((ObjectExpression) node, ctx);
            case OBJECT_PROPERTY -> visitor.enterObjectProperty((ObjectProperty) node, ctx);
            case SPREAD_ELEMENT -> visitor.enterSpreadElement((SpreadElement) node, ctx);
            case CALL_EXPRESSION -> visitor.enterCallExpression((CallExpression) node, ctx);
            case NEW_EXPRESSION -> visitor.enterNewExpression((NewExpression) node, ctx);
            case STATIC_MEMBER_EXPRESSION -> visitor.enterStaticMemberExpression((StaticMemberExpression) node, ctx);
            case COMPUTED_MEMBER_EXPRESSION -> visitor.enterComputedMemberExpression((ComputedMemberExpression) node, ctx);
            case UNARY_EXPRESSION -> visitor.enterUnaryExpression((UnaryExpression) node, ctx);
            case UPDATE_EXPRESSION -> visitor.enterUpdateExpression((UpdateExpression) node, ctx);
            case BINARY_EXPRESSION -> visitor.enterBinaryExpression((BinaryExpression) node, ctx);
            case LOGICAL_EXPRESSION -> visitor.enterLogicalExpression((LogicalExpression) node, ctx);
            case CONDITIONAL_EXPRESSION -> visitor.enterConditionalExpression((ConditionalExpression) node, ctx);
            case ASSIGNMENT_EXPRESSION -> visitor.enterAssignmentExpression((AssignmentExpression) node, ctx);
            case SEQUENCE_EXPRESSION -> visitor.enterSequenceExpression((SequenceExpression) node, ctx);
            case PARENTHESIZED_EXPRESSION -> visitor.enterParenthesizedExpression((ParenthesizedExpression) node, ctx);
            case AWAIT_EXPRESSION -> visitor.enterAwaitExpression((AwaitExpression) node, ctx);
            case YIELD_EXPRESSION -> visitor.enterYieldExpression((YieldExpression) node, ctx);
            case JSX_ELEMENT -> visitor.enterJsxElement((JsxElement) node, ctx);
            case JSX_OPENING_ELEMENT -> visitor.enterJsxOpeningElement((JsxOpeningElement) node, ctx);
            case JSX_CLOSING_ELEMENT -> visitor.enterJsxClosingElement((JsxClosingElement) node, ctx);
            case JSX_FRAGMENT -> visitor.enterJsxFragment((JsxFragment) node, ctx);
            case JSX_OPENING_FRAGMENT -> visitor.enterJsxOpeningFragment((JsxOpeningFragment) node, ctx);
            case JSX_CLOSING_FRAGMENT -> visitor.enterJsxClosingFragment((JsxClosingFragment) node, ctx);
            case JSX_IDENTIFIER -> visitor.enterJsxIdentifier((JsxIdentifier) node, ctx);
            case JSX_MEMBER_EXPRESSION -> visitor.enterJsxMemberExpression((JsxMemberExpression) node, ctx);
            case JSX_NAMESPACED_NAME -> visitor.enterJsxNamespacedName((JsxNamespacedName) node, ctx);
            case JSX_ATTRIBUTE -> visitor.enterJsxAttribute((JsxAttribute) node, ctx);
            case JSX_SPREAD_ATTRIBUTE -> visitor.enterJsxSpreadAttribute((JsxSpreadAttribute) node, ctx);
            case JSX_EXPRESSION_CONTAINER -> visitor.enterJsxExpressionContainer((JsxExpressionContainer) node, ctx);
            case JSX_EMPTY_EXPRESSION -> visitor.enterJsxEmptyExpression((JsxEmptyExpression) node, ctx);
            case JSX_TEXT -> visitor.enterJsxText((JsxText) node, ctx);
        }
    }

    private void exit(Visitor visitor, AstNode node) {
        switch (node.kind()) {
            case PROGRAM -> visitor.exitProgram((Program) node, ctx);
            case EXPRESSION_STATEMENT -> visitor.exitExpressionStatement((ExpressionStatement) node, ctx);
            case BLOCK_STATEMENT -> visitor.exitBlockStatement((BlockStatement) node, ctx);
            case VARIABLE_DECLARATION -> visitor.exitVariableDeclaration((VariableDeclaration) node, ctx);
            case VARIABLE_DECLARATOR -> visitor.exitVariableDeclarator((VariableDeclarator) node, ctx);
            case RETURN_STATEMENT -> visitor.exitReturnStatement((ReturnStatement) node, ctx);
            case IF_STATEMENT -> visitor.exitIfStatement((IfStatement) node, ctx);
            case THROW_STATEMENT -> visitor.exitThrowStatement((ThrowStatement) node, ctx);
            case EMPTY_STATEMENT -> visitor.exitEmptyStatement((EmptyStatement) node, ctx);
            case IMPORT_DECLARATION -> visitor.exitImportDeclaration((ImportDeclaration) node, ctx);
            case IMPORT_SPECIFIER -> visitor.exitImportSpecifier((ImportSpecifier) node, ctx);
            case IMPORT_DEFAULT_SPECIFIER -> visitor.exitImportDefaultSpecifier((ImportDefaultSpecifier) node, ctx);
            case IMPORT_NAMESPACE_SPECIFIER -> visitor.exitImportNamespaceSpecifier((ImportNamespaceSpecifier) node, ctx);
            case EXPORT_DEFAULT_DECLARATION -> visitor.exitExportDefaultDeclaration((ExportDefaultDeclaration) node, ctx);
            case EXPORT_NAMED_DECLARATION -> visitor.exitExportNamedDeclaration((ExportNamedDeclaration) node, ctx);
            case FUNCTION -> visitor.exitFunction((FunctionNode) node, ctx);
            case ARROW_FUNCTION_EXPRESSION -> visitor.exitArrowFunctionExpression((ArrowFunctionExpression) node, ctx);
            case FORMAL_PARAMETERS -> visitor.exitFormalParameters((FormalParameters) node, ctx);
            case FUNCTION_BODY -> visitor.exitFunctionBody((FunctionBody) node, ctx);
            case BINDING_IDENTIFIER -> visitor.exitBindingIdentifier((BindingIdentifier) node, ctx);
            case OBJECT_PATTERN -> visitor.exitObjectPattern((ObjectPattern) node, ctx);
            case BINDING_PROPERTY -> visitor.exitBindingProperty((BindingProperty) node, ctx);
            case ARRAY_PATTERN -> visitor.exitArrayPattern((ArrayPattern) node, ctx);
            case ASSIGNMENT_PATTERN -> visitor.exitAssignmentPattern((AssignmentPattern) node, ctx);
            case IDENTIFIER_REFERENCE -> visitor.exitIdentifierReference((IdentifierReference) node, ctx);
            case IDENTIFIER_NAME -> visitor.exitIdentifierName((IdentifierName) node, ctx);
            case THIS_EXPRESSION -> visitor.exitThisExpression((ThisExpression) node, ctx);
            case NULL_LITERAL -> visitor.exitNullLiteral((NullLiteral) node, ctx);
            case BOOLEAN_LITERAL -> visitor.exitBooleanLiteral((BooleanLiteral) node, ctx);
            case NUMERIC_LITERAL -> visitor.exitNumericLiteral((NumericLiteral) node, ctx);
            case STRING_LITERAL -> visitor.exitStringLiteral((StringLiteral) node, ctx);
            case ARRAY_EXPRESSION -> visitor.exitArrayExpression((ArrayExpression) node, ctx);
            case ELISION -> visitor.exitElision((Elision) node, ctx);
            case OBJECT_EXPRESSION -> visitor.exitObjectExpression((ObjectExpression) node, ctx);
            case OBJECT_PROPERTY -> visitor.exitObjectProperty((ObjectProperty) node, ctx);
            case SPREAD_ELEMENT -> visitor.exitSpreadElement((SpreadElement) node, ctx);
            case CALL_EXPRESSION -> visitor.exitCallExpression((CallExpression) node, ctx);
            case NEW_EXPRESSION -> visitor.exitNewExpression((NewExpression) node, ctx);
            case STATIC_MEMBER_EXPRESSION -> visitor.exitStaticMemberExpression((StaticMemberExpression) node, ctx);
            case COMPUTED_MEMBER_EXPRESSION -> visitor.exitComputedMemberExpression((ComputedMemberExpression) node, ctx);
            case UNARY_EXPRESSION -> visitor.exitUnaryExpression((UnaryExpression) node, ctx);
            case UPDATE_EXPRESSION -> visitor.exitUpdateExpression((UpdateExpression) node, ctx);
            case BINARY_EXPRESSION -> visitor.exitBinaryExpression((BinaryExpression) node, ctx);
            case LOGICAL_EXPRESSION -> visitor.exitLogicalExpression((LogicalExpression) node, ctx);
            case CONDITIONAL_EXPRESSION -> visitor.exitConditionalExpression((ConditionalExpression) node, ctx);
            case ASSIGNMENT_EXPRESSION -> visitor.exitAssignmentExpression((AssignmentExpression) node, ctx);
            case SEQUENCE_EXPRESSION -> visitor.exitSequenceExpression((SequenceExpression) node, ctx);
            case PARENTHESIZED_EXPRESSION -> visitor.exitParenthesizedExpression((ParenthesizedExpression) node, ctx);
            case AWAIT_EXPRESSION -> visitor.exitAwaitExpression((AwaitExpression) node, ctx);
            case YIELD_EXPRESSION -> visitor.exitYieldExpression((YieldExpression) node, ctx);
            case JSX_ELEMENT -> visitor.exitJsxElement((JsxElement) node, ctx);
            case JSX_OPENING_ELEMENT -> visitor.exitJsxOpeningElement((JsxOpeningElement) node, ctx);
            case JSX_CLOSING_ELEMENT -> visitor.exitJsxClosingElement((JsxClosingElement) node, ctx);
            case JSX_FRAGMENT -> visitor.exitJsxFragment((JsxFragment) node, ctx);
            case JSX_OPENING_FRAGMENT -> visitor.exitJsxOpeningFragment((JsxOpeningFragment) node, ctx);
            case JSX_CLOSING_FRAGMENT -> visitor.exitJsxClosingFragment((JsxClosingFragment) node, ctx);
            case JSX_IDENTIFIER -> visitor.exitJsxIdentifier((JsxIdentifier) node, ctx);
            case JSX_MEMBER_EXPRESSION -> visitor.exitJsxMemberExpression((JsxMemberExpression) node, ctx);
            case JSX_NAMESPACED_NAME -> visitor.exitJsxNamespacedName((JsxNamespacedName) node, ctx);
            case JSX_ATTRIBUTE -> visitor.exitJsxAttribute((JsxAttribute) node, ctx);
            case JSX_SPREAD_ATTRIBUTE -> visitor.exitJsxSpreadAttribute((JsxSpreadAttribute) node, ctx);
            case JSX_EXPRESSION_CONTAINER -> visitor.exitJsxExpressionContainer((JsxExpressionContainer) node, ctx);
            case JSX_EMPTY_EXPRESSION -> visitor.exitJsxEmptyExpression((JsxEmptyExpression) node, ctx);
            case JSX_TEXT -> visitor.exitJsxText((JsxText) node, ctx);
        }
    }

}
