package org.dxworks.mddocx.converter;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.dxworks.mddocx.config.TextReplacement;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies find-and-replace rules to every text literal of a parsed tree, in rule order.
 * Code spans, code blocks and raw HTML are left untouched.
 */
public class TextReplacer extends AbstractVisitor {

    private final List<Rule> rules = new ArrayList<>();

    public TextReplacer(List<TextReplacement> replacements) {
        if (replacements == null) {
            return;
        }
        for (TextReplacement replacement : replacements) {
            if (replacement == null || replacement.find == null || replacement.find.isEmpty()) {
                continue;
            }
            rules.add(Rule.of(replacement));
        }
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public void apply(Node document) {
        if (!rules.isEmpty()) {
            document.accept(this);
        }
    }

    @Override
    public void visit(Text text) {
        String literal = text.getLiteral();
        for (Rule rule : rules) {
            try {
                literal = rule.pattern.matcher(literal).replaceAll(rule.replacement);
            } catch (IndexOutOfBoundsException e) {
                // group reference beyond the groups the pattern defines
                throw new IllegalArgumentException("Invalid text replacement: " + rule.replacement
                        + " for pattern " + rule.pattern.pattern(), e);
            }
        }
        text.setLiteral(literal);
    }

    private static final class Rule {
        final Pattern pattern;
        final String replacement;

        private Rule(Pattern pattern, String replacement) {
            this.pattern = pattern;
            this.replacement = replacement;
        }

        static Rule of(TextReplacement replacement) {
            String replace = replacement.replace != null ? replacement.replace : "";
            if (!replacement.regex) {
                return new Rule(Pattern.compile(Pattern.quote(replacement.find)), Matcher.quoteReplacement(replace));
            }
            try {
                return new Rule(Pattern.compile(replacement.find), replace);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid text replacement pattern: " + replacement.find, e);
            }
        }
    }
}
