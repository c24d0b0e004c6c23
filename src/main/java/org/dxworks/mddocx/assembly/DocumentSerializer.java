package org.dxworks.mddocx.assembly;

import java.io.IOException;

/**
 * Turns assembled document options into the bytes of a finished document.
 */
public interface DocumentSerializer {

    byte[] serialize(DocumentOptions options) throws IOException;
}
