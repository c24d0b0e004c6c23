package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * One header or footer slot ({@code default}, {@code first} or {@code even}) of a configuration level.
 * <ul>
 *   <li>{@link State#INHERIT}: the key was absent, the enclosing level's slot applies unchanged</li>
 *   <li>{@link State#CLEAR}: the key was an explicit {@code null}, no header/footer in this slot</li>
 *   <li>{@link State#SET}: the content is merged over the enclosing level's slot</li>
 * </ul>
 */
@JsonDeserialize(using = HeaderFooterSlotDeserializer.class)
public final class HeaderFooterSlot {

    public enum State { INHERIT, CLEAR, SET }

    private static final HeaderFooterSlot INHERIT = new HeaderFooterSlot(State.INHERIT, null);
    private static final HeaderFooterSlot CLEAR = new HeaderFooterSlot(State.CLEAR, null);

    private final State state;
    private final HeaderFooterContent value;

    private HeaderFooterSlot(State state, HeaderFooterContent value) {
        this.state = state;
        this.value = value;
    }

    public static HeaderFooterSlot inherit() {
        return INHERIT;
    }

    public static HeaderFooterSlot clear() {
        return CLEAR;
    }

    public static HeaderFooterSlot set(HeaderFooterContent value) {
        if (value == null) {
            return CLEAR;
        }
        return new HeaderFooterSlot(State.SET, value);
    }

    public State getState() {
        return state;
    }

    @JsonValue
    public HeaderFooterContent getValue() {
        return value;
    }

    public boolean isInherit() {
        return state == State.INHERIT;
    }

    public boolean isClear() {
        return state == State.CLEAR;
    }

    public boolean isSet() {
        return state == State.SET;
    }
}
