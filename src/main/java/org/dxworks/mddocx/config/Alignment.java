package org.dxworks.mddocx.config;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFIED
}
