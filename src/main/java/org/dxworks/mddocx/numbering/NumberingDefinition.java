package org.dxworks.mddocx.numbering;

import java.util.List;

public final class NumberingDefinition {
    public final String reference;
    public final int sequenceId;
    public final List<NumberingLevel> levels;

    public NumberingDefinition(String reference, int sequenceId, List<NumberingLevel> levels) {
        this.reference = reference;
        this.sequenceId = sequenceId;
        this.levels = List.copyOf(levels);
    }
}
