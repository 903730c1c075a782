package com.github.conjugador.parsing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class AlternativeFormMatcherTest {
    @Test
    void catalanForm() {
        var line = "{{es-verb|t|present=acenso}} {{forma-a|ca|complànyer}}";
        assertEquals(Optional.of("complànyer"), AlternativeFormMatcher.extract(line));
    }

    @Test
    void otherLanguage() {
        var line = "{{es-verb|t|present=acenso}} {{forma-a|es|cantar}}";
        assertTrue(AlternativeFormMatcher.extract(line).isEmpty());
    }

    @Test
    void catalanLetters() {
        assertEquals(Optional.of("col·locar"), AlternativeFormMatcher.extract("{{forma-a|ca|col·locar}}"));
        assertEquals(Optional.of("començar"), AlternativeFormMatcher.extract("{{forma-a|ca|començar}}"));
    }

    @Test
    void rejectsInvalidCharacters() {
        assertTrue(AlternativeFormMatcher.extract("{{forma-a|ca|Cantar}}").isEmpty());
        assertTrue(AlternativeFormMatcher.extract("{{forma-a|ca|cantar2}}").isEmpty());
        assertTrue(AlternativeFormMatcher.extract("{{forma-a|ca|}}").isEmpty());
        assertTrue(AlternativeFormMatcher.extract("{{forma-a|ca|cantar|nota}}").isEmpty());
    }
}
