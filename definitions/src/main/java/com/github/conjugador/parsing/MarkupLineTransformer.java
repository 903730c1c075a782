package com.github.conjugador.parsing;

import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Removes wiki markup from section text, one markup category per method.
 * <p>
 * Every operation is total: unbalanced or otherwise malformed markup leaves the
 * input untouched.
 */
public final class MarkupLineTransformer {
    private static final String GALLERY_START = "<gallery>";
    private static final String GALLERY_END = "</gallery>";

    private static final String TEMPLATE_START = "{{";
    private static final String TEMPLATE_END = "}}";

    private static final String LINK_START = "[[";
    private static final String LINK_END = "]]";
    private static final String LINK_SEPARATOR = "|";

    private static final String MEDIAWIKI_BOLD = "'''";
    private static final String MEDIAWIKI_ITALIC = "''";

    private static final Pattern P_REF = Pattern.compile("<ref>(.*)</ref>");
    private static final Pattern P_TAG = Pattern.compile("<[^>]*>");

    private MarkupLineTransformer() {}

    /**
     * Deletes the first {@code <gallery>...</gallery>} block, which may span several lines.
     * Subsequent blocks are left intact.
     */
    public static String removeGallerySections(String text) {
        Objects.requireNonNull(text);

        int start = text.indexOf(GALLERY_START);

        if (start == -1) {
            return text;
        }

        int end = text.indexOf(GALLERY_END, start);

        if (end == -1) {
            return text;
        }

        return text.substring(0, start) + text.substring(end + GALLERY_END.length());
    }

    /**
     * Deletes all top-level templates along with any templates nested in them.
     * <p>
     * A closing brace pair with no preceding opening one, or a template that is never
     * closed, stops the process and the remaining text is returned as is.
     */
    public static String removeTemplates(String line) {
        Objects.requireNonNull(line);

        var current = line;

        while (true) {
            var next = removeFirstTemplate(current);

            if (next.equals(current)) {
                return current;
            }

            current = next;
        }
    }

    private static String removeFirstTemplate(String line) {
        int startPos = -1;
        int depth = 0;
        int pos = 0;

        while (true) {
            int start = line.indexOf(TEMPLATE_START, pos);
            int end = line.indexOf(TEMPLATE_END, pos);

            if (start == -1 && end == -1) {
                return line; // unclosed or no template at all
            }

            if (start != -1 && (end == -1 || start < end)) {
                if (startPos == -1) {
                    startPos = start;
                }

                depth++;
                pos = start + TEMPLATE_START.length();
            } else {
                if (depth == 0) {
                    return line; // stray closing braces
                }

                depth--;
                pos = end + TEMPLATE_END.length();

                if (depth == 0) {
                    return line.substring(0, startPos) + line.substring(pos);
                }
            }
        }
    }

    /**
     * Replaces every {@code [[target|label]]} link with its label, or with the target when
     * no label is present.
     */
    public static String removeInternalLinks(String line) {
        Objects.requireNonNull(line);

        var current = line;

        while (true) {
            int start = current.indexOf(LINK_START);

            if (start == -1) {
                return current;
            }

            int end = current.indexOf(LINK_END, start);

            if (end == -1) {
                return current;
            }

            var content = current.substring(start + LINK_START.length(), end);
            int separator = content.lastIndexOf(LINK_SEPARATOR);

            if (separator != -1) {
                content = content.substring(separator + LINK_SEPARATOR.length());
            }

            current = current.substring(0, start) + content + current.substring(end + LINK_END.length());
        }
    }

    public static String removeWikiEmphasis(String line) {
        Objects.requireNonNull(line);
        var text = StringUtils.remove(line, MEDIAWIKI_BOLD);
        return StringUtils.remove(text, MEDIAWIKI_ITALIC);
    }

    /**
     * Strips XML and HTML tags, keeping their inner text. The contents of a {@code <ref>}
     * element are preserved in italics, preceded by a single space.
     */
    public static String removeXmlTags(String line) {
        Objects.requireNonNull(line);

        var m = P_REF.matcher(line);

        if (!m.find()) {
            return stripTags(line);
        }

        return stripTags(line.substring(0, m.start())) +
            " <i>" + stripTags(m.group(1)) + "</i>" +
            stripTags(line.substring(m.end()));
    }

    private static String stripTags(String text) {
        return P_TAG.matcher(text).replaceAll("");
    }
}
