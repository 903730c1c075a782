package com.github.conjugador.parsing;

import java.util.Objects;

/**
 * Turns wiki list markers into HTML lists, one line at a time.
 * <p>
 * Lines starting with {@code #} become ordered list items, lines starting with {@code #:}
 * become description list items. Whether each list is currently open travels between
 * calls in a {@link ListState}, which must start out as {@link ListState#INITIAL} for every
 * new section.
 */
public final class ListStructureConverter {
    private static final String ITEM_MARKER = "#";
    private static final String DESCRIPTION_MARKER = "#:";

    private ListStructureConverter() {}

    public static Conversion convert(String line, ListState state) {
        Objects.requireNonNull(line);
        Objects.requireNonNull(state);

        var ordered = toOrderedList(line, state.listOpen());
        var description = toDescriptionList(ordered.line(), state.descriptionListOpen());

        return new Conversion(description.line(), new ListState(ordered.open(), description.open()));
    }

    private static Step toOrderedList(String line, boolean open) {
        var html = line.strip();

        if (html.startsWith(ITEM_MARKER) && !html.startsWith(DESCRIPTION_MARKER)) {
            var text = html.substring(ITEM_MARKER.length()).strip();

            if (text.isEmpty()) {
                return new Step("", false);
            }

            var prefix = open ? "" : "<ol>";
            return new Step(prefix + "<li>" + text + "</li>", true);
        }

        if (open && !html.startsWith(DESCRIPTION_MARKER)) {
            return new Step("</ol>" + line, false);
        }

        return new Step(line, open);
    }

    private static Step toDescriptionList(String line, boolean open) {
        var html = line.strip();

        if (html.startsWith(DESCRIPTION_MARKER)) {
            var text = html.substring(DESCRIPTION_MARKER.length()).strip();

            if (text.isEmpty()) {
                return new Step("", false);
            }

            var prefix = open ? "" : "<dl>";
            return new Step(prefix + "<dd>" + text + "</dd>", true);
        }

        if (open) {
            return new Step("</dl>" + line, false);
        }

        return new Step(line, false);
    }

    private record Step(String line, boolean open) {}

    /**
     * Open/closed status of the ordered list and the description list within one section.
     */
    public record ListState(boolean listOpen, boolean descriptionListOpen) {
        public static final ListState INITIAL = new ListState(false, false);
    }

    public record Conversion(String line, ListState state) {}
}
