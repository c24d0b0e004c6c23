package org.dxworks.mddocx.converter;

import org.commonmark.node.Node;

/**
 * Parses Markdown source into a syntax tree.
 */
public interface MarkdownParser {

    Node parse(String markdown);
}
