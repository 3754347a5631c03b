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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ModuleRecord {

    private final List<ImportEntry> importEntries = new ArrayList<>();
    private final Set<String> requestedModules = new LinkedHashSet<>();

    public void addRequestedModule(String module) {
        requestedModules.add(module);
    }

    public void addImportEntry(ImportEntry entry) {
        requestedModules.add(entry.moduleRequest());
        importEntries.add(entry);
    }

    public List<ImportEntry> getImportEntries() {
        return Collections.unmodifiableList(importEntries);
    }

    public Set<String> getRequestedModules() {
        return Collections.unmodifiableSet(requestedModules);
    }

    public boolean isImported(String localName, String moduleRequest) {
        for (ImportEntry entry : importEntries) {
            if (entry.moduleRequest().equals(moduleRequest) && entry.localName().equals(localName)) {
                return true;
            }
        }
        return false;
    }

}
