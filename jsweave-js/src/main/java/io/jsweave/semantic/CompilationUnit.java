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
package io.jsweave.semantic;

import io.jsweave.ast.Program;
import io.jsweave.common.Source;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One parsed and bound source unit. Passes that mutate the tree hold the write lock,
 * read-only passes may share the read lock.
 */
public class CompilationUnit {

    private final Source source;
    private final Program program;
    private final SymbolTable symbols;
    private final ModuleRecord module;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CompilationUnit(Source source, Program program, SymbolTable symbols, ModuleRecord module) {
        this.source = source;
        this.program = program;
        this.symbols = symbols;
        this.module = module;
    }

    public Source getSource() {
        return source;
    }

    public String getName() {
        return source.getName();
    }

    public Program getProgram() {
        return program;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public ModuleRecord getModule() {
        return module;
    }

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }

    @Override
    public String toString() {
        return source.getName();
    }

}
