package org.dxworks.mddocx.numbering;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocates sequence ids to ordered lists for one assembly pass.
 * <p>
 * Each section counts its own lists from 1; the ids handed out are offset by the highest id of all
 * previously completed sections, so ids form one dense run {@code 1..max} across the document and
 * two lists never share an id. List identity is reference identity of the source node.
 * Not thread-safe: one registry belongs to exactly one pass.
 */
public class NumberingRegistry {

    private static final int LEVEL_COUNT = 9;
    private static final String[] LEVEL_FORMATS = {"decimal", "lowerLetter", "lowerRoman"};

    private final Map<Object, Integer> allocated = new IdentityHashMap<>();
    private int maxSequenceId;
    private int offset;
    private int localMax;
    private boolean sectionOpen;

    /**
     * Opens a section whose lists are numbered after {@code maxSequenceIdSoFar}.
     *
     * @return the offset applied to the section's local list numbers
     */
    public int registerSection(int maxSequenceIdSoFar) {
        if (sectionOpen) {
            throw new IllegalStateException("Previous section was not completed");
        }
        if (maxSequenceIdSoFar < maxSequenceId) {
            throw new IllegalArgumentException("Offset " + maxSequenceIdSoFar
                    + " would reuse ids up to " + maxSequenceId);
        }
        offset = maxSequenceIdSoFar;
        localMax = 0;
        sectionOpen = true;
        return offset;
    }

    public int registerSection() {
        return registerSection(maxSequenceId);
    }

    /**
     * Returns the sequence id of {@code listIdentity}, allocating the next one on first sight.
     */
    public int allocate(Object listIdentity) {
        if (!sectionOpen) {
            throw new IllegalStateException("allocate() called outside a section");
        }
        Integer existing = allocated.get(listIdentity);
        if (existing != null) {
            return existing;
        }
        localMax++;
        int sequenceId = offset + localMax;
        allocated.put(listIdentity, sequenceId);
        return sequenceId;
    }

    /**
     * Closes the current section.
     *
     * @return the number of ordered lists allocated in it
     */
    public int completeSection() {
        if (!sectionOpen) {
            throw new IllegalStateException("No section is open");
        }
        sectionOpen = false;
        maxSequenceId = offset + localMax;
        return localMax;
    }

    public int getMaxSequenceId() {
        return sectionOpen ? offset + localMax : maxSequenceId;
    }

    public static String referenceFor(int sequenceId) {
        return "numbered-list-" + sequenceId;
    }

    /**
     * One numbering definition per allocated id, {@code 1..max}.
     */
    public List<NumberingDefinition> numberingConfig() {
        List<NumberingDefinition> definitions = new ArrayList<>();
        for (int id = 1; id <= getMaxSequenceId(); id++) {
            definitions.add(new NumberingDefinition(referenceFor(id), id, buildLevels()));
        }
        return definitions;
    }

    private static List<NumberingLevel> buildLevels() {
        List<NumberingLevel> levels = new ArrayList<>();
        for (int level = 0; level < LEVEL_COUNT; level++) {
            levels.add(new NumberingLevel(
                    level,
                    LEVEL_FORMATS[level % LEVEL_FORMATS.length],
                    "%" + (level + 1) + ".",
                    "left",
                    720 * (level + 1),
                    360));
        }
        return levels;
    }
}
