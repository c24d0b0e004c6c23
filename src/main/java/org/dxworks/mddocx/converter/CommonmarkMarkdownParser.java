package org.dxworks.mddocx.converter;

import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;

import java.util.List;

/**
 * CommonMark parser with GitHub tables and YAML front matter enabled.
 */
public class CommonmarkMarkdownParser implements MarkdownParser {

    private final Parser parser;

    public CommonmarkMarkdownParser() {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .build();
    }

    @Override
    public Node parse(String markdown) {
        return parser.parse(markdown != null ? markdown : "");
    }
}
