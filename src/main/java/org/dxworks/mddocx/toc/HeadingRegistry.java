package org.dxworks.mddocx.toc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Headings of one assembly pass in document order, across all sections. Append-only.
 * <p>
 * Anchor ids are derived from the heading text, so the same input always yields the same ids.
 * They start with {@code _} (hidden bookmarks in Word) and stay within Word's 40 character limit.
 */
public class HeadingRegistry {

    private static final int MAX_SLUG_LENGTH = 32;
    private static final String FALLBACK_SLUG = "heading";

    private final List<HeadingEntry> entries = new ArrayList<>();
    private final Set<String> usedAnchors = new HashSet<>();

    public String register(String text, int level) {
        String anchorId = uniqueAnchor(slugify(text));
        entries.add(new HeadingEntry(text, level, anchorId));
        return anchorId;
    }

    public List<HeadingEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    private String uniqueAnchor(String slug) {
        String candidate = "_" + slug;
        int suffix = 2;
        while (usedAnchors.contains(candidate)) {
            candidate = "_" + slug + "-" + suffix++;
        }
        usedAnchors.add(candidate);
        return candidate;
    }

    static String slugify(String text) {
        if (text == null) {
            return FALLBACK_SLUG;
        }
        StringBuilder slug = new StringBuilder();
        boolean pendingDash = false;
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                if (pendingDash && slug.length() > 0) {
                    slug.append('-');
                }
                pendingDash = false;
                slug.append(c);
            } else {
                pendingDash = true;
            }
        }
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug.setLength(MAX_SLUG_LENGTH);
            while (slug.length() > 0 && slug.charAt(slug.length() - 1) == '-') {
                slug.setLength(slug.length() - 1);
            }
        }
        return slug.length() == 0 ? FALLBACK_SLUG : slug.toString();
    }
}
