package com.github.conjugador.parsing;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the Catalan alternative form referenced through {@code {{forma-a|ca|...}}}.
 * Must be fed raw lines, before any template has been stripped.
 */
public final class AlternativeFormMatcher {
    private static final Pattern P_ALTERNATIVE_FORM = Pattern.compile("\\{\\{forma-a\\|ca\\|([a-zàéèíóòúç·]+)\\}\\}");

    private AlternativeFormMatcher() {}

    public static Optional<String> extract(String rawLine) {
        Objects.requireNonNull(rawLine);

        var m = P_ALTERNATIVE_FORM.matcher(rawLine);
        String word = null;

        // the rightmost occurrence wins
        while (m.find()) {
            word = m.group(1);
        }

        return Optional.ofNullable(word);
    }
}
