package org.dxworks.mddocx.config;

public enum SectionBreakType {
    NEXT_PAGE,
    NEXT_COLUMN,
    CONTINUOUS,
    EVEN_PAGE,
    ODD_PAGE
}
