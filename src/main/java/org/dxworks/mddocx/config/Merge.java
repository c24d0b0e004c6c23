package org.dxworks.mddocx.config;

final class Merge {

    private Merge() {
        // utility class
    }

    static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }
}
