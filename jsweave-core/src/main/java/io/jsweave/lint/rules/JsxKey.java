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
package io.jsweave.lint.rules;

import io.jsweave.ast.*;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.lint.LintRule;
import io.jsweave.semantic.ModuleRecord;
import io.jsweave.semantic.SymbolTable;
import io.jsweave.traverse.Ancestor;
import io.jsweave.traverse.Slot;
import io.jsweave.traverse.TraverseCtx;

import java.util.List;
import java.util.Set;

/**
 * {@code react(jsx-key)}: elements rendered from an array literal or from a
 * {@code map}/{@code flatMap}/{@code Array.from} callback need a {@code key} prop, and a
 * {@code key} prop must come before any spread attribute.
 */
public class JsxKey implements LintRule {

    public static final String NAME = "jsx-key";

    static final String MISSING_IN_ARRAY = "Missing \"key\" prop for element in array.";
    static final String MISSING_IN_ITERATOR = "Missing \"key\" prop for element in iterator.";
    static final String KEY_AFTER_SPREAD = "\"key\" prop must be placed before any `{...spread}`";

    private static final Set<String> TARGET_METHODS = Set.of("flatMap", "from", "map");

    /**
     * Where an element sits, {@code iteratorSpan} is null for an array literal.
     */
    private record Outer(Span iteratorSpan) {

        static final Outer ARRAY = new Outer(null);

    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String plugin() {
        return "react";
    }

    @Override
    public void enterJsxElement(JsxElement node, TraverseCtx ctx) {
        Outer outer = findOuter(node, ctx);
        if (outer != null && !isWithinChildrenToArray(ctx) && node.openingElement.getAttribute("key") == null) {
            report(ctx, missingKey(node.openingElement.name.getSpan(), outer));
        }
        checkKeyBeforeSpread(node.openingElement, ctx);
    }

    @Override
    public void enterJsxFragment(JsxFragment node, TraverseCtx ctx) {
        Outer outer = findOuter(node, ctx);
        if (outer != null && !isWithinChildrenToArray(ctx)) {
            report(ctx, missingKey(node.openingFragment.getSpan(), outer));
        }
    }

    private static Diagnostic missingKey(Span span, Outer outer) {
        if (outer.iteratorSpan == null) {
            return Diagnostic.warn(MISSING_IN_ARRAY).withLabel(span);
        }
        return Diagnostic.warn(MISSING_IN_ITERATOR)
                .withLabel(outer.iteratorSpan, "Iterator starts here.")
                .withLabel(span, "Element generated here.")
                .withHelp("Add a \"key\" prop to the element in the iterator "
                        + "(https://react.dev/learn/rendering-lists#keeping-list-items-in-order-with-key).");
    }

    // ========== array or iterator ==========

    /**
     * Scans outward from the element. The order of the checks matters: an arrow is crossed
     * only with an explicit return or an expression body, a callback that is an object
     * property value never counts, and only one function may be crossed.
     */
    private static Outer findOuter(AstNode node, TraverseCtx ctx) {
        List<Ancestor> ancestors = ctx.ancestry().nearestFirst();
        boolean outsideFunction = false;
        boolean explicitReturn = false;
        AstNode argument = null;
        AstNode child = node;
        for (int i = 0; i < ancestors.size(); i++) {
            Ancestor ancestor = ancestors.get(i);
            AstNode parent = ancestor.node();
            switch (parent.kind()) {
                case ARROW_FUNCTION_EXPRESSION -> {
                    ArrowFunctionExpression arrow = (ArrowFunctionExpression) parent;
                    List<Statement> statements = arrow.body.statements;
                    boolean expressionBody = !statements.isEmpty() && statements.get(0) instanceof ExpressionStatement;
                    if (!explicitReturn && !expressionBody) {
                        return null;
                    }
                    if (isObjectPropertyValue(ancestors, i) || outsideFunction) {
                        return null;
                    }
                    outsideFunction = true;
                }
                case FUNCTION -> {
                    if (isObjectPropertyValue(ancestors, i) || outsideFunction) {
                        return null;
                    }
                    outsideFunction = true;
                }
                case ARRAY_EXPRESSION -> {
                    return outsideFunction ? null : Outer.ARRAY;
                }
                case CALL_EXPRESSION -> {
                    if (ancestor.slot() == Slot.CALL_ARGUMENTS) {
                        argument = child;
                    }
                    return matchIterator((CallExpression) parent, argument);
                }
                case NEW_EXPRESSION -> {
                    if (ancestor.slot() == Slot.NEW_ARGUMENTS) {
                        argument = child;
                    }
                }
                case JSX_ELEMENT, JSX_OPENING_ELEMENT, JSX_FRAGMENT, OBJECT_PROPERTY -> {
                    return null;
                }
                case RETURN_STATEMENT -> explicitReturn = true;
                default -> {
                    // transparent
                }
            }
            child = parent;
        }
        return null;
    }

    private static boolean isObjectPropertyValue(List<Ancestor> ancestors, int functionIndex) {
        int index = functionIndex + 1;
        return index < ancestors.size() && ancestors.get(index).is(NodeKind.OBJECT_PROPERTY);
    }

    private static Outer matchIterator(CallExpression call, AstNode argument) {
        if (argument == null || !(call.callee.withoutParentheses() instanceof MemberExpression member)) {
            return null;
        }
        String method = member.getStaticPropertyName();
        if (method == null || !TARGET_METHODS.contains(method)) {
            return null;
        }
        int index = "from".equals(method) ? 1 : 0;
        if (index < call.arguments.size() && call.arguments.get(index) == argument) {
            return new Outer(member.getStaticPropertySpan());
        }
        return null;
    }

    // ========== Children.toArray ==========

    private static boolean isWithinChildrenToArray(TraverseCtx ctx) {
        for (Ancestor ancestor : ctx.ancestry().nearestFirst()) {
            if (ancestor.node() instanceof CallExpression call && "toArray".equals(call.getCalleeName()) && isChildren(call, ctx)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code Children.toArray(...)} or {@code React.Children.toArray(...)}.
     */
    private static boolean isChildren(CallExpression call, TraverseCtx ctx) {
        if (!(call.callee instanceof MemberExpression member)) {
            return false;
        }
        if (member.getObject() instanceof IdentifierReference ident) {
            return isImport(ctx, ident.name, "Children", "React");
        }
        if (!(member.getObject().withoutParentheses() instanceof MemberExpression inner)) {
            return false;
        }
        if (!(inner.getObject() instanceof IdentifierReference root)) {
            return false;
        }
        String property = inner.getStaticPropertyName();
        return property != null && isImport(ctx, root.name, "React", "React") && property.equals("Children");
    }

    /**
     * A file that neither imports anything nor declares anything at top level is taken to
     * rely on globals, so names match literally. Otherwise the name must be imported from
     * the module.
     */
    static boolean isImport(TraverseCtx ctx, String localName, String expectedLocalName, String expectedModule) {
        ModuleRecord module = ctx.module();
        SymbolTable symbols = ctx.symbols();
        if (module.getRequestedModules().isEmpty() && symbols.getBindings(symbols.getRootScopeId()).isEmpty()) {
            return localName.equals(expectedLocalName);
        }
        return module.isImported(localName, expectedModule.toLowerCase());
    }

    // ========== key before spread ==========

    private void checkKeyBeforeSpread(JsxOpeningElement opening, TraverseCtx ctx) {
        int keyIndex = -1;
        Span keySpan = null;
        int spreadIndex = -1;
        List<JsxAttributeItem> attributes = opening.attributes;
        for (int i = 0; i < attributes.size(); i++) {
            JsxAttributeItem item = attributes.get(i);
            if (item instanceof JsxAttribute attr) {
                if (attr.isIdentifier("key")) {
                    keyIndex = i;
                    keySpan = attr.name.getSpan();
                }
            } else if (item instanceof JsxSpreadAttribute) {
                spreadIndex = i;
            }
            if (keyIndex >= 0 && spreadIndex >= 0) {
                break;
            }
        }
        if (keyIndex >= 0 && spreadIndex >= 0 && keyIndex > spreadIndex) {
            report(ctx, Diagnostic.warn(KEY_AFTER_SPREAD)
                    .withLabel(keySpan)
                    .withHelp("To avoid conflicting with React's new JSX transform: "
                            + "https://reactjs.org/blog/2020/09/22/introducing-the-new-jsx-transform.html"));
        }
    }

}
