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

/**
 * Callbacks of a depth-first walk. Every hook has a no-op default so a visitor overrides
 * only the node kinds it cares about.
 * <p>
 * Per node the {@link Traverser} calls, for each visitor in registration order,
 * {@link #enterNode}, then {@link #enterExpression} or {@link #enterStatement} when the node
 * sits in an expression or statement position, then the kind specific {@code enterX}. After
 * the children it calls, again per visitor, the kind specific {@code exitX},
 * {@link #exitExpression} or {@link #exitStatement}, then {@link #exitNode}.
 * <p>
 * {@code exitExpression} and {@code exitStatement} return the node to install in the
 * parent's slot. A replacement is handed to the next visitor's exit hooks and is installed
 * before the parent's own exit hooks run. It is not walked again.
 */
public interface Visitor {

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Read-only visitors may not return replacements and run under the unit's read lock.
     */
    default boolean isReadOnly() {
        return true;
    }

    default void enterNode(AstNode node, TraverseCtx ctx) {
    }

    default void exitNode(AstNode node, TraverseCtx ctx) {
    }

    default void enterExpression(Expression node, TraverseCtx ctx) {
    }

    default Expression exitExpression(Expression node, TraverseCtx ctx) {
        return node;
    }

    default void enterStatement(Statement node, TraverseCtx ctx) {
    }

    default Statement exitStatement(Statement node, TraverseCtx ctx) {
        return node;
    }

    //==== statements

    default void enterProgram(Program node, TraverseCtx ctx) {
    }

    default void exitProgram(Program node, TraverseCtx ctx) {
    }

    default void enterExpressionStatement(ExpressionStatement node, TraverseCtx ctx) {
    }

    default void exitExpressionStatement(ExpressionStatement node, TraverseCtx ctx) {
    }

    default void enterBlockStatement(BlockStatement node, TraverseCtx ctx) {
    }

    default void exitBlockStatement(BlockStatement node, TraverseCtx ctx) {
    }

    default void enterVariableDeclaration(VariableDeclaration node, TraverseCtx ctx) {
    }

    default void exitVariableDeclaration(VariableDeclaration node, TraverseCtx ctx) {
    }

    default void enterVariableDeclarator(VariableDeclarator node, TraverseCtx ctx) {
    }

    default void exitVariableDeclarator(VariableDeclarator node, TraverseCtx ctx) {
    }

    default void enterReturnStatement(ReturnStatement node, TraverseCtx ctx) {
    }

    default void exitReturnStatement(ReturnStatement node, TraverseCtx ctx) {
    }

    default void enterIfStatement(IfStatement node, TraverseCtx ctx) {
    }

    default void exitIfStatement(IfStatement node, TraverseCtx ctx) {
    }

    default void enterThrowStatement(ThrowStatement node, TraverseCtx ctx) {
    }

    default void exitThrowStatement(ThrowStatement node, TraverseCtx ctx) {
    }

    default void enterEmptyStatement(EmptyStatement node, TraverseCtx ctx) {
    }

    default void exitEmptyStatement(EmptyStatement node, TraverseCtx ctx) {
    }

    default void enterImportDeclaration(ImportDeclaration node, TraverseCtx ctx) {
    }

    default void exitImportDeclaration(ImportDeclaration node, TraverseCtx ctx) {
    }

    default void enterImportSpecifier(ImportSpecifier node, TraverseCtx ctx) {
    }

    default void exitImportSpecifier(ImportSpecifier node, TraverseCtx ctx) {
    }

    default void enterImportDefaultSpecifier(ImportDefaultSpecifier node, TraverseCtx ctx) {
    }

    default void exitImportDefaultSpecifier(ImportDefaultSpecifier node, TraverseCtx ctx) {
    }

    default void enterImportNamespaceSpecifier(ImportNamespaceSpecifier node, TraverseCtx ctx) {
    }

    default void exitImportNamespaceSpecifier(ImportNamespaceSpecifier node, TraverseCtx ctx) {
    }

    default void enterExportDefaultDeclaration(ExportDefaultDeclaration node, TraverseCtx ctx) {
    }

    default void exitExportDefaultDeclaration(ExportDefaultDeclaration node, TraverseCtx ctx) {
    }

    default void enterExportNamedDeclaration(ExportNamedDeclaration node, TraverseCtx ctx) {
    }

    default void exitExportNamedDeclaration(ExportNamedDeclaration node, TraverseCtx ctx) {
    }

    //==== functions

    default void enterFunction(FunctionNode node, TraverseCtx ctx) {
    }

    default void exitFunction(FunctionNode node, TraverseCtx ctx) {
    }

    default void enterArrowFunctionExpression(ArrowFunctionExpression node, TraverseCtx ctx) {
    }

    default void exitArrowFunctionExpression(ArrowFunctionExpression node, TraverseCtx ctx) {
    }

    default void enterFormalParameters(FormalParameters node, TraverseCtx ctx) {
    }

    default void exitFormalParameters(FormalParameters node, TraverseCtx ctx) {
    }

    default void enterFunctionBody(FunctionBody node, TraverseCtx ctx) {
    }

    default void exitFunctionBody(FunctionBody node, TraverseCtx ctx) {
    }

    //==== patterns

    default void enterBindingIdentifier(BindingIdentifier node, TraverseCtx ctx) {
    }

    default void exitBindingIdentifier(BindingIdentifier node, TraverseCtx ctx) {
    }

    default void enterObjectPattern(ObjectPattern node, TraverseCtx ctx) {
    }

    default void exitObjectPattern(ObjectPattern node, TraverseCtx ctx) {
    }

    default void enterBindingProperty(BindingProperty node, TraverseCtx ctx) {
    }

    default void exitBindingProperty(BindingProperty node, TraverseCtx ctx) {
    }

    default void enterArrayPattern(ArrayPattern node, TraverseCtx ctx) {
    }

    default void exitArrayPattern(ArrayPattern node, TraverseCtx ctx) {
    }

    default void enterAssignmentPattern(AssignmentPattern node, TraverseCtx ctx) {
    }

    default void exitAssignmentPattern(AssignmentPattern node, TraverseCtx ctx) {
    }

    //==== expressions

    default void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
    }

    default void exitIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
    }

    default void enterIdentifierName(IdentifierName node, TraverseCtx ctx) {
    }

    default void exitIdentifierName(IdentifierName node, TraverseCtx ctx) {
    }

    default void enterThisExpression(ThisExpression node, TraverseCtx ctx) {
    }

    default void exitThisExpression(ThisExpression node, TraverseCtx ctx) {
    }

    default void enterNullLiteral(NullLiteral node, TraverseCtx ctx) {
    }

    default void exitNullLiteral(NullLiteral node, TraverseCtx ctx) {
    }

    default void enterBooleanLiteral(BooleanLiteral node, TraverseCtx ctx) {
    }

    default void exitBooleanLiteral(BooleanLiteral node, TraverseCtx ctx) {
    }

    default void enterNumericLiteral(NumericLiteral node, TraverseCtx ctx) {
    }

    default void exitNumericLiteral(NumericLiteral node, TraverseCtx ctx) {
    }

    default void enterStringLiteral(StringLiteral node, TraverseCtx ctx) {
    }

    default void exitStringLiteral(StringLiteral node, TraverseCtx ctx) {
    }

    default void enterArrayExpression(ArrayExpression node, TraverseCtx ctx) {
    }

    default void exitArrayExpression(ArrayExpression node, TraverseCtx ctx) {
    }

    default void enterElision(Elision node, TraverseCtx ctx) {
    }

    default void exitElision(Elision node, TraverseCtx ctx) {
    }

    default void enterObjectExpression(ObjectExpression node, TraverseCtx ctx) {
    }

    default void exitObjectExpression(ObjectExpression node, TraverseCtx ctx) {
    }

    default void enterObjectProperty(ObjectProperty node, TraverseCtx ctx) {
    }

    default void exitObjectProperty(ObjectProperty node, TraverseCtx ctx) {
    }

    default void enterSpreadElement(SpreadElement node, TraverseCtx ctx) {
    }

    default void exitSpreadElement(SpreadElement node, TraverseCtx ctx) {
    }

    default void enterCallExpression(CallExpression node, TraverseCtx ctx) {
    }

    default void exitCallExpression(CallExpression node, TraverseCtx ctx) {
    }

    default void enterNewExpression(NewExpression node, TraverseCtx ctx) {
    }

    default void exitNewExpression(NewExpression node, TraverseCtx ctx) {
    }

    default void enterStaticMemberExpression(StaticMemberExpression node, TraverseCtx ctx) {
    }

    default void exitStaticMemberExpression(StaticMemberExpression node, TraverseCtx ctx) {
    }

    default void enterComputedMemberExpression(ComputedMemberExpression node, TraverseCtx ctx) {
    }

    default void exitComputedMemberExpression(ComputedMemberExpression node, TraverseCtx ctx) {
    }

    default void enterUnaryExpression(UnaryExpression node, TraverseCtx ctx) {
    }

    default void exitUnaryExpression(UnaryExpression node, TraverseCtx ctx) {
    }

    default void enterUpdateExpression(UpdateExpression node, TraverseCtx ctx) {
    }

    default void exitUpdateExpression(UpdateExpression node, TraverseCtx ctx) {
    }

    default void enterBinaryExpression(BinaryExpression node, TraverseCtx ctx) {
    }

    default void exitBinaryExpression(BinaryExpression node, TraverseCtx ctx) {
    }

    default void enterLogicalExpression(LogicalExpression node, TraverseCtx ctx) {
    }

    default void exitLogicalExpression(LogicalExpression node, TraverseCtx ctx) {
    }

    default void enterConditionalExpression(ConditionalExpression node, TraverseCtx ctx) {
    }

    default void exitConditionalExpression(ConditionalExpression node, TraverseCtx ctx) {
    }

    default void enterAssignmentExpression(AssignmentExpression node, TraverseCtx ctx) {
    }

    default void exitAssignmentExpression(AssignmentExpression node, TraverseCtx ctx) {
    }

    default void enterSequenceExpression(SequenceExpression node, TraverseCtx ctx) {
    }

    default void exitSequenceExpression(SequenceExpression node, TraverseCtx ctx) {
    }

    default void enterParenthesizedExpression(ParenthesizedExpression node, TraverseCtx ctx) {
    }

    default void exitParenthesizedExpression(ParenthesizedExpression node, TraverseCtx ctx) {
    }

    default void enterAwaitExpression(AwaitExpression node, TraverseCtx ctx) {
    }

    default void exitAwaitExpression(AwaitExpression node, TraverseCtx ctx) {
    }

    default void enterYieldExpression(YieldExpression node, TraverseCtx ctx) {
    }

    default void exitYieldExpression(YieldExpression node, TraverseCtx ctx) {
    }

    //==== jsx

    default void enterJsxElement(JsxElement node, TraverseCtx ctx) {
    }

    default void exitJsxElement(JsxElement node, TraverseCtx ctx) {
    }

    default void enterJsxOpeningElement(JsxOpeningElement node, TraverseCtx ctx) {
    }

    default void exitJsxOpeningElement(JsxOpeningElement node, TraverseCtx ctx) {
    }

    default void enterJsxClosingElement(JsxClosingElement node, TraverseCtx ctx) {
    }

    default void exitJsxClosingElement(JsxClosingElement node, TraverseCtx ctx) {
    }

    default void enterJsxFragment(JsxFragment node, TraverseCtx ctx) {
    }

    default void exitJsxFragment(JsxFragment node, TraverseCtx ctx) {
    }

    default void enterJsxOpeningFragment(JsxOpeningFragment node, TraverseCtx ctx) {
    }

    default void exitJsxOpeningFragment(JsxOpeningFragment node, TraverseCtx ctx) {
    }

    default void enterJsxClosingFragment(JsxClosingFragment node, TraverseCtx ctx) {
    }

    default void exitJsxClosingFragment(JsxClosingFragment node, TraverseCtx ctx) {
    }

    default void enterJsxIdentifier(JsxIdentifier node, TraverseCtx ctx) {
    }

    default void exitJsxIdentifier(JsxIdentifier node, TraverseCtx ctx) {
    }

    default void enterJsxMemberExpression(JsxMemberExpression node, TraverseCtx ctx) {
    }

    default void exitJsxMemberExpression(JsxMemberExpression node, TraverseCtx ctx) {
    }

    default void enterJsxNamespacedName(JsxNamespacedName node, TraverseCtx ctx) {
    }

    default void exitJsxNamespacedName(JsxNamespacedName node, TraverseCtx ctx) {
    }

    default void enterJsxAttribute(JsxAttribute node, TraverseCtx ctx) {
    }

    default void exitJsxAttribute(JsxAttribute node, TraverseCtx ctx) {
    }

    default void enterJsxSpreadAttribute(JsxSpreadAttribute node, TraverseCtx ctx) {
    }

    default void exitJsxSpreadAttribute(JsxSpreadAttribute node, TraverseCtx ctx) {
    }

    default void enterJsxExpressionContainer(JsxExpressionContainer node, TraverseCtx ctx) {
    }

    default void exitJsxExpressionContainer(JsxExpressionContainer node, TraverseCtx ctx) {
    }

    default void enterJsxEmptyExpression(JsxEmptyExpression node, TraverseCtx ctx) {
    }

    default void exitJsxEmptyExpression(JsxEmptyExpression node, TraverseCtx ctx) {
    }

    default void enterJsxText(JsxText node, TraverseCtx ctx) {
    }

    default void exitJsxText(JsxText node, TraverseCtx ctx) {
    }

}
