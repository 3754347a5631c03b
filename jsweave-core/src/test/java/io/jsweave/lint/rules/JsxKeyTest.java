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

import io.jsweave.ast.Span;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.diagnostics.LabeledSpan;
import io.jsweave.lint.LintResult;
import io.jsweave.lint.Linter;
import io.jsweave.semantic.SemanticBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsxKeyTest {

    private static List<Diagnostic> lint(String text) {
        LintResult result = new Linter(List.of(new JsxKey())).lint(SemanticBuilder.parse(text));
        assertTrue(result.failures().isEmpty(), result.failures().toString());
        return result.diagnostics();
    }

    private static void pass(String text) {
        assertEquals(List.of(), lint(text), text);
    }

    private static void fail(String text, int count) {
        List<Diagnostic> diagnostics = lint(text);
        assertEquals(count, diagnostics.size(), text + " " + diagnostics);
        for (Diagnostic d : diagnostics) {
            assertEquals("react(jsx-key)", d.code());
        }
    }

    @Test
    void testPass() {
        pass("fn()");
        pass("[1, 2, 3].map(function () {})");
        pass("<App />;");
        pass("[<App key={0} />, <App key={1} />];");
        pass("[1, 2, 3].map(function(x) { return <App key={x} /> });");
        pass("[1, 2, 3].map(x => <App key={x} />);");
        pass("[1, 2 ,3].map(x => x && <App x={x} key={x} />);");
        pass("[1, 2 ,3].map(x => x ? <App x={x} key=\"1\" /> : <OtherApp x={x} key=\"2\" />);");
        pass("[1, 2, 3].map(x => { return <App key={x} /> });");
        pass("Array.from([1, 2, 3], function(x) { return <App key={x} /> });");
        pass("Array.from([1, 2, 3], (x => <App key={x} />));");
        pass("Array.from([1, 2, 3], (x => {return <App key={x} />}));");
        pass("Array.from([1, 2, 3], someFn);");
        pass("Array.from([1, 2, 3]);");
        pass("[1, 2, 3].foo(x => <App />);");
        pass("var App = () => <div />;");
        pass("[1, 2, 3].map(function(x) { return; });");
        pass("foo(() => <div />);");
        pass("foo(() => <></>);");
        pass("<></>;");
        pass("<App {...{}} />;");
        pass("<App key=\"keyBeforeSpread\" {...{}} />;");
        pass("const spans = [<span key=\"notunique\"/>,<span key=\"notunique\"/>];");
    }

    @Test
    void testPassNested() {
        pass("""
                function App() {
                  return (
                    <div className="App">
                      {[1, 2, 3, 4, 5].map((val) => {
                        const text = () => <strong>{val}</strong>;
                        return null
                      })}
                    </div>
                  );
                }
                """);
        pass("""
                function App() {
                  return (
                    <div className="App">
                      {[1, 2, 3, 4, 5].map((val) => {
                        const text = <strong>{val}</strong>;
                        return <button key={val}>{text}</button>;
                      })}
                    </div>
                  );
                }
                """);
        pass("""
                MyStory.decorators = [
                  (Component) => <div><Component /></div>
                ];
                """);
        pass("""
                const columns = [{
                  accessorKey: 'lastName',
                  header: ({ column }) => <Header column={column} title="Last Name" />,
                  cell: function ({ row }) { return <div>{row.value}</div> },
                }];
                """);
        pass("""
                const router = createBrowserRouter([
                  { path: "/", element: <Root />, children: [{ path: "team", element: <Team /> }] },
                ]);
                """);
    }

    @Test
    void testMissingInArray() {
        fail("[<App />];", 1);
        fail("[<App {...key} />];", 1);
        fail("[<App key={0}/>, <App />];", 1);
        fail("[<></>];", 1);
        Diagnostic d = lint("[<App />];").get(0);
        assertEquals(JsxKey.MISSING_IN_ARRAY, d.message());
        assertEquals(List.of(LabeledSpan.of(new Span(2, 5))), d.labels());
        assertNull(d.help());
    }

    @Test
    void testMissingInIterator() {
        fail("[1, 2 ,3].map(function(x) { return <App /> });", 1);
        fail("[1, 2 ,3].map(x => <App />);", 1);
        fail("[1, 2 ,3].map(x => x && <App x={x} />);", 1);
        fail("[1, 2 ,3].map(x => x ? <App x={x} key=\"1\" /> : <OtherApp x={x} />);", 1);
        fail("[1, 2 ,3].map(x => x ? <App x={x} /> : <OtherApp x={x} key=\"2\" />);", 1);
        fail("[1, 2 ,3].map(x => { return <App /> });", 1);
        fail("Array.from([1, 2 ,3], function(x) { return <App /> });", 1);
        fail("Array.from([1, 2 ,3], (x => { return <App /> }));", 1);
        fail("Array.from([1, 2 ,3], (x => <App />));", 1);
        fail("[1, 2, 3]?.map(x => <BabelEslintApp />)", 1);
        fail("[1, 2, 3]?.map(x => <><OxcCompilerHello /></>)", 1);
        fail("[1, 2, 3].map(x => <>{x}</>);", 1);
    }

    @Test
    void testIteratorLabels() {
        Diagnostic d = lint("[1, 2, 3].map(x => <App />);").get(0);
        assertEquals(JsxKey.MISSING_IN_ITERATOR, d.message());
        assertEquals(List.of(
                new LabeledSpan(new Span(10, 13), "Iterator starts here."),
                new LabeledSpan(new Span(20, 23), "Element generated here.")), d.labels());
        assertEquals(new Span(10, 13), d.primarySpan());
        assertTrue(d.help().startsWith("Add a \"key\" prop to the element in the iterator"));
    }

    @Test
    void testEveryReturnReported() {
        List<Diagnostic> diagnostics = lint("""
                const Test = () => {
                  const list = [1, 2, 3, 4, 5];
                  return (
                    <div>
                      {list.map(item => {
                        if (item < 2) {
                          return <div>{item}</div>;
                        } else if (item < 5) {
                          return <div></div>
                        } else {
                          return <div></div>
                        }
                        return <div />;
                      })}
                    </div>
                  );
                };
                """);
        assertEquals(4, diagnostics.size());
        for (Diagnostic d : diagnostics) {
            assertEquals(JsxKey.MISSING_IN_ITERATOR, d.message());
        }
    }

    @Test
    void testKeyAfterSpread() {
        List<Diagnostic> diagnostics = lint("[<App {...obj} key=\"keyAfterSpread\" />];");
        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals(JsxKey.KEY_AFTER_SPREAD, d.message());
        assertEquals(new Span(15, 18), d.primarySpan());
        assertTrue(d.help().contains("new JSX transform"));
        fail("<div {...obj} key=\"keyAfterSpread\" />;", 1);
    }

    @Test
    void testChildrenToArray() {
        pass("React.Children.toArray([1, 2 ,3].map(x => <App />));");
        pass("""
                import { Children } from "react";
                Children.toArray([1, 2 ,3].map(x => <App />));
                """);
        pass("""
                import React from "react";
                React.Children.toArray([1, 2 ,3].map(x => <App />));
                """);
        pass("""
                import Act from 'react';
                Act.Children.toArray(Array.from([1, 2 ,3], x => <App />));
                """);
        fail("foo.Children.toArray([1, 2 ,3].map(x => <App />));", 1);
        fail("""
                import { Children as ReactChildren } from 'react';
                const Children = ReactChildren;
                Children.toArray([1, 2 ,3].map(x => <App />));
                """, 1);
        fail("""
                const React = {};
                React.Children.toArray([1, 2 ,3].map(x => <App />));
                """, 1);
    }

}
