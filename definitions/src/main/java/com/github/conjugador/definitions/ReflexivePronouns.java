package com.github.conjugador.definitions;

import java.util.Locale;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Wiktionary lists pronominal verbs with their reflexive pronoun attached
 * (e.g. <i>apoltronar-se</i>, <i>enamorar's</i>), whereas the conjugator only knows
 * the bare infinitive.
 */
public final class ReflexivePronouns {
    private static final String SHORT = "'s";
    private static final String LONG = "-se";

    private ReflexivePronouns() {}

    /**
     * Strips at most one trailing reflexive pronoun: apoltronar-se -> apoltronar.
     */
    public static String removeReflexivePronoun(String infinitive) {
        Objects.requireNonNull(infinitive);

        if (infinitive.endsWith(SHORT)) {
            return StringUtils.removeEnd(infinitive, SHORT);
        }

        return StringUtils.removeEnd(infinitive, LONG);
    }

    /**
     * Lower-cases and trims a page title, then strips its reflexive pronoun.
     */
    public static String toCanonicalKey(String title) {
        Objects.requireNonNull(title);
        return removeReflexivePronoun(title.toLowerCase(Locale.ROOT).strip());
    }
}
