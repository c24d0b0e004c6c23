package org.dxworks.mddocx.config;

public enum TextDirection {
    LTR,
    RTL
}
