package org.dxworks.mddocx.config;

public enum Orientation {
    PORTRAIT,
    LANDSCAPE
}
