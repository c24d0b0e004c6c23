package org.dxworks.mddocx.converter;

import org.dxworks.mddocx.model.TextRun;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects text segments and merges neighbours with equal attributes before any run is created.
 */
final class InlineCollector {

    private final List<TextRun> runs = new ArrayList<>();
    private StringBuilder pending;
    private InlineAttributes pendingAttributes;

    void append(String value, InlineAttributes attributes) {
        if (value == null || value.isEmpty()) {
            return;
        }
        if (pending != null && pendingAttributes.equals(attributes)) {
            pending.append(value);
            return;
        }
        flush();
        pending = new StringBuilder(value);
        pendingAttributes = attributes;
    }

    List<TextRun> finish() {
        flush();
        return runs;
    }

    private void flush() {
        if (pending != null) {
            runs.add(pendingAttributes.toRun(pending.toString()));
            pending = null;
            pendingAttributes = null;
        }
    }
}
