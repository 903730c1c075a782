package com.github.conjugador.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.github.conjugador.parsing.ListStructureConverter.ListState;

/**
 * Builds an HTML description out of the "Verb" section of a Wiktionary entry.
 * <p>
 * The section spans from the {@code ===Verb===} header up to the next heading. Each of its
 * lines is stripped of templates, links, emphasis and tags, then list markers are turned
 * into HTML. Processing stops at the first cross-reference section marker such as
 * {@code {{-sin-}}} or {@code {{-trad-}}}.
 */
public final class SectionExtractor {
    private static final Logger LOGGER = Logger.getLogger(SectionExtractor.class.getName());

    private static final Pattern P_VERB_HEADER = Pattern.compile("===[ ]*Verb[ ]*===");
    private static final Pattern P_TEXT = Pattern.compile("[a-zA-Z]");

    private static final String NEXT_HEADING = "==";
    private static final String SECTION_MARKER = "{{-";

    private static final String ALTERNATIVE_FORM_NOTICE = "<p style='font-weight: 300'>Forma alternativa a <a href='/conjugador-de-verbs/verb/%1$s'>%1$s</a></p>";

    private SectionExtractor() {}

    /**
     * Extracts the description of a page.
     *
     * @param text revision text of the page
     * @param infinitives known infinitives; an alternative form is only mentioned if listed here
     * @return HTML description, empty if the page has no usable "Verb" section
     */
    public static String extract(String text, Set<String> infinitives) {
        Objects.requireNonNull(text);
        Objects.requireNonNull(infinitives);

        var optSection = findSection(text);

        if (optSection.isEmpty()) {
            return "";
        }

        var section = MarkupLineTransformer.removeGallerySections(optSection.get());
        var sb = new StringBuilder(section.length());
        var state = ListState.INITIAL;
        String alternative = null;

        for (var line : splitLines(section)) {
            if (line.toLowerCase(Locale.ROOT).contains(SECTION_MARKER)) {
                break;
            }

            if (alternative == null) {
                alternative = AlternativeFormMatcher.extract(line).orElse(null);
            }

            var html = MarkupLineTransformer.removeTemplates(line);
            html = MarkupLineTransformer.removeInternalLinks(html);
            html = MarkupLineTransformer.removeWikiEmphasis(html);
            html = MarkupLineTransformer.removeXmlTags(html);

            var conversion = ListStructureConverter.convert(html, state);
            state = conversion.state();
            html = conversion.line();

            if (!hasText(html)) {
                LOGGER.logp(Level.FINE, "SectionExtractor", "extract", "Discard: {0}", html);
                continue;
            }

            sb.append(html);
        }

        if (alternative != null) {
            if (infinitives.contains(alternative)) {
                sb.append(String.format(ALTERNATIVE_FORM_NOTICE, alternative));
            } else {
                LOGGER.logp(Level.FINE, "SectionExtractor", "extract", "Alternative form ''{0}'' not in infinitives", alternative);
            }
        }

        return sb.toString();
    }

    static Optional<String> findSection(String text) {
        var m = P_VERB_HEADER.matcher(text);

        if (!m.find()) {
            return Optional.empty();
        }

        int start = m.end();
        int end = text.indexOf(NEXT_HEADING, start);

        if (end == -1) {
            return Optional.empty();
        }

        return Optional.of(text.substring(start, end));
    }

    // line terminators are kept
    static List<String> splitLines(String text) {
        var lines = new ArrayList<String>();
        int pos = 0;

        while (pos < text.length()) {
            int newline = text.indexOf('\n', pos);
            int end = newline == -1 ? text.length() : newline + 1;
            lines.add(text.substring(pos, end));
            pos = end;
        }

        return lines;
    }

    private static boolean hasText(String line) {
        return P_TEXT.matcher(line).find();
    }
}
