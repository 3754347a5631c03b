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
import io.jsweave.codegen.Codegen;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.ScopeId;
import io.jsweave.semantic.SemanticBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraverserTest {

    static class Recorder implements Visitor {

        final String prefix;
        final List<String> log;

        Recorder(String prefix, List<String> log) {
            this.prefix = prefix;
            this.log = log;
        }

        @Override
        public void enterNode(AstNode node, TraverseCtx ctx) {
            log.add(prefix + ":enterNode:" + node.kind());
        }

        @Override
        public void exitNode(AstNode node, TraverseCtx ctx) {
            log.add(prefix + ":exitNode:" + node.kind());
        }

        @Override
        public void enterExpression(Expression node, TraverseCtx ctx) {
            log.add(prefix + ":enterExpression");
        }

        @Override
        public Expression exitExpression(Expression node, TraverseCtx ctx) {
            log.add(prefix + ":exitExpression");
            return node;
        }

        @Override
        public void enterStatement(Statement node, TraverseCtx ctx) {
            log.add(prefix + ":enterStatement");
        }

        @Override
        public Statement exitStatement(Statement node, TraverseCtx ctx) {
            log.add(prefix + ":exitStatement");
            return node;
        }

        @Override
        public void enterExpressionStatement(ExpressionStatement node, TraverseCtx ctx) {
            log.add(prefix + ":enterExpressionStatement");
        }

        @Override
        public void exitExpressionStatement(ExpressionStatement node, TraverseCtx ctx) {
            log.add(prefix + ":exitExpressionStatement");
        }

        @Override
        public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
            log.add(prefix + ":enterIdentifierReference");
        }

        @Override
        public void exitIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
            log.add(prefix + ":exitIdentifierReference");
        }

    }

    private static List<String> only(List<String> log, String kind) {
        List<String> list = new ArrayList<>();
        for (String entry : log) {
            if (entry.endsWith(":" + kind)) {
                list.add(entry);
            }
        }
        return list;
    }

    @Test
    void testHookOrder() {
        CompilationUnit unit = SemanticBuilder.parse("a;");
        List<String> log = new ArrayList<>();
        TraverseResult result = Traverser.traverse(unit, new Recorder("A", log), new Recorder("B", log));
        assertTrue(result.isClean());
        int start = log.indexOf("A:enterNode:EXPRESSION_STATEMENT");
        assertEquals(List.of(
                "A:enterNode:EXPRESSION_STATEMENT",
                "A:enterStatement",
                "A:enterExpressionStatement",
                "B:enterNode:EXPRESSION_STATEMENT",
                "B:enterStatement",
                "B:enterExpressionStatement",
                "A:enterNode:IDENTIFIER_REFERENCE",
                "A:enterExpression",
                "A:enterIdentifierReference",
                "B:enterNode:IDENTIFIER_REFERENCE",
                "B:enterExpression",
                "B:enterIdentifierReference",
                "A:exitIdentifierReference",
                "A:exitExpression",
                "A:exitNode:IDENTIFIER_REFERENCE",
                "B:exitIdentifierReference",
                "B:exitExpression",
                "B:exitNode:IDENTIFIER_REFERENCE",
                "A:exitExpressionStatement",
                "A:exitStatement",
                "A:exitNode:EXPRESSION_STATEMENT",
                "B:exitExpressionStatement",
                "B:exitStatement",
                "B:exitNode:EXPRESSION_STATEMENT"), log.subList(start, start + 24));
        assertEquals("A:enterNode:PROGRAM", log.get(0));
        assertEquals("B:exitNode:PROGRAM", log.get(log.size() - 1));
    }

    @Test
    void testPositions() {
        CompilationUnit unit = SemanticBuilder.parse("const x = [a, ...b]; <p>{c}</p>;");
        List<String> log = new ArrayList<>();
        Traverser.traverse(unit, new Recorder("A", log));
        // the spread itself sits in an array slot but is not an expression, its argument is
        assertEquals(2, only(log, "enterStatement").size());
        assertEquals(5, only(log, "enterExpression").size());
    }

    @Test
    void testDepthBalance() {
        CompilationUnit unit = SemanticBuilder.parse(
                "function f(a, { b }) { if (a) { return <div key={b}>{[1, 2].map((x) => x)}</div>; } }");
        List<String> mismatches = new ArrayList<>();
        int[] depth = {0};
        int[] max = {0};
        Traverser.traverse(unit, new Visitor() {
            @Override
            public void enterNode(AstNode node, TraverseCtx ctx) {
                if (ctx.ancestry().depth() != depth[0]) {
                    mismatches.add("enter " + node.kind() + " at " + ctx.ancestry().depth());
                }
                depth[0]++;
                max[0] = Math.max(max[0], depth[0]);
            }

            @Override
            public void exitNode(AstNode node, TraverseCtx ctx) {
                depth[0]--;
                if (ctx.ancestry().depth() != depth[0]) {
                    mismatches.add("exit " + node.kind() + " at " + ctx.ancestry().depth());
                }
            }
        });
        assertEquals(List.of(), mismatches);
        assertEquals(0, depth[0]);
        assertTrue(max[0] > 10);
    }

    @Test
    void testAncestry() {
        CompilationUnit unit = SemanticBuilder.parse("foo(bar.baz);");
        List<Ancestor> seen = new ArrayList<>();
        Traverser.traverse(unit, new Visitor() {
            @Override
            public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
                if (node.name.equals("bar")) {
                    seen.addAll(ctx.ancestry().nearestFirst());
                }
            }
        });
        assertEquals(4, seen.size());
        assertEquals(NodeKind.STATIC_MEMBER_EXPRESSION, seen.get(0).kind());
        assertEquals(Slot.MEMBER_OBJECT, seen.get(0).slot());
        assertEquals(NodeKind.CALL_EXPRESSION, seen.get(1).kind());
        assertEquals(Slot.CALL_ARGUMENTS, seen.get(1).slot());
        assertEquals(0, seen.get(1).index());
        assertEquals(NodeKind.PROGRAM, seen.get(3).kind());
    }

    @Test
    void testFailureIsolation() {
        CompilationUnit unit = SemanticBuilder.parse("a; boom; c;");
        List<String> names = new ArrayList<>();
        Visitor failing = new Visitor() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
                if (node.name.equals("boom")) {
                    throw new IllegalStateException("boom");
                }
            }
        };
        Visitor counting = new Visitor() {
            @Override
            public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
                names.add(node.name);
            }
        };
        TraverseResult result = Traverser.traverse(unit, failing, counting);
        assertEquals(List.of("a", "boom", "c"), names);
        assertFalse(result.isAborted());
        assertEquals(1, result.failures().size());
        VisitorFailure failure = result.failures().get(0);
        assertEquals("failing", failure.visitor());
        assertEquals(NodeKind.IDENTIFIER_REFERENCE, failure.kind());
        assertEquals(new Span(3, 7), failure.span());
        assertTrue(failure.message().contains("boom"));
    }

    @Test
    void testReadOnlyReplacementRejected() {
        CompilationUnit unit = SemanticBuilder.parse("x = 1;");
        TraverseResult result = Traverser.traverse(unit, new Visitor() {
            @Override
            public Expression exitExpression(Expression node, TraverseCtx ctx) {
                return node instanceof NumericLiteral ? ctx.ast().numericLiteral(2) : node;
            }
        });
        assertEquals(1, result.failures().size());
        assertTrue(result.failures().get(0).message().startsWith("read-only visitor returned a replacement"));
        assertEquals("x = 1;", Codegen.generate(unit.getProgram()));
    }

    @Test
    void testNullReplacementRejected() {
        CompilationUnit unit = SemanticBuilder.parse("x;");
        TraverseResult result = Traverser.traverse(unit, new Visitor() {
            @Override
            public boolean isReadOnly() {
                return false;
            }

            @Override
            public Statement exitStatement(Statement node, TraverseCtx ctx) {
                return null;
            }
        });
        assertEquals(1, result.failures().size());
        assertEquals("x;", Codegen.generate(unit.getProgram()));
    }

    @Test
    void testReplacementSeenByLaterVisitors() {
        CompilationUnit unit = SemanticBuilder.parse("x = 1 + y;");
        List<String> seen = new ArrayList<>();
        Visitor replacing = new Visitor() {
            @Override
            public boolean isReadOnly() {
                return false;
            }

            @Override
            public Expression exitExpression(Expression node, TraverseCtx ctx) {
                if (node instanceof NumericLiteral literal && literal.value == 1) {
                    return ctx.ast().numericLiteral(2);
                }
                return node;
            }
        };
        Visitor observing = new Visitor() {
            @Override
            public Expression exitExpression(Expression node, TraverseCtx ctx) {
                if (node instanceof NumericLiteral literal) {
                    seen.add("literal " + literal.raw);
                }
                return node;
            }

            @Override
            public void exitBinaryExpression(BinaryExpression node, TraverseCtx ctx) {
                seen.add("binary " + Codegen.generate(node));
            }
        };
        TraverseResult result = Traverser.traverse(unit, replacing, observing);
        assertTrue(result.isClean());
        assertEquals(List.of("literal 2", "binary 2 + y"), seen);
        assertEquals("x = 2 + y;", Codegen.generate(unit.getProgram()));
    }

    @Test
    void testScopeTracking() {
        CompilationUnit unit = SemanticBuilder.parse("a; function f() { { b; } }");
        FunctionNode f = (FunctionNode) unit.getProgram().body.get(1);
        BlockStatement block = (BlockStatement) f.body.statements.get(0);
        List<List<ScopeId>> stacks = new ArrayList<>();
        Traverser.traverse(unit, new Visitor() {
            @Override
            public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
                stacks.add(ctx.scopeStack());
            }
        });
        ScopeId root = unit.getProgram().getScopeId();
        assertEquals(List.of(root), stacks.get(0));
        assertEquals(List.of(root, f.getScopeId(), block.getScopeId()), stacks.get(1));
    }

    @Test
    void testDiagnosticsCollected() {
        CompilationUnit unit = SemanticBuilder.parse("a; b;");
        TraverseResult result = Traverser.traverse(unit, new Visitor() {
            @Override
            public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
                ctx.report(Diagnostic.warn("found " + node.name).withLabel(node.span));
            }
        });
        assertEquals(2, result.diagnostics().size());
        assertEquals("found a", result.diagnostics().get(0).message());
        assertEquals(new Span(3, 4), result.diagnostics().get(1).primarySpan());
    }

    @Test
    void testDeepNestingAborts() {
        CompilationUnit unit = SemanticBuilder.parse("x;");
        ExpressionStatement statement = (ExpressionStatement) unit.getProgram().body.get(0);
        Expression expression = statement.expression;
        for (int i = 0; i < 200_000; i++) {
            expression = AstBuilder.INSTANCE.parenthesized(expression);
        }
        statement.expression = expression;
        TraverseResult result = Traverser.traverse(unit, new Visitor() {
        });
        assertTrue(result.isAborted());
        assertTrue(result.abortReason().contains("nested too deeply"), result.abortReason());
        // the unit stays usable after the aborted walk
        statement.expression = AstBuilder.INSTANCE.parenthesized(AstBuilder.INSTANCE.nullLiteral());
        assertTrue(Traverser.traverse(unit, new Visitor() {
        }).isClean());
    }

}
