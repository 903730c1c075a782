package com.github.conjugador.parsing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class SectionExtractorTest {
    private static final Set<String> INFINITIVES = Set.of("abaltir", "complànyer", "complanyer");

    @Test
    void simpleDefinition() {
        var text = "===Verb===\n{{ca-verb}}\n#Endormiscar.\n==Notes==";
        assertEquals("<ol><li>Endormiscar.</li>", SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void fullEntry() {
        var text = """
            == {{-ca-}} ==
            {{pron|ca|or=/ə.bəl.ˈti/}}

            === Verb ===
            {{ca-verb|t}}

            # [[endormiscar|Endormiscar]], mig '''dormir'''.<ref>DIEC</ref>
            #: {{ex-us|ca|Em vaig abaltir.}}
            #: Ja s'abaltia.
            # {{marca|ca|pronominal}} Endormiscar-se.

            {{-sin-}}
            * [[adormir]]

            ==== Conjugació ====
            """;

        var expected = "<ol><li>Endormiscar, mig dormir. <i>DIEC</i></li>" +
            "<dl><dd>Ja s'abaltia.</dd>" +
            "</dl><li>Endormiscar-se.</li>" +
            "</ol>\n";

        assertEquals(expected, SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void stopsAtSectionMarker() {
        var text = """
            ===Verb===
            # Primer sentit.
            {{-Trad-}}
            # Segon sentit.
            ==Notes==""";

        var description = SectionExtractor.extract(text, INFINITIVES);
        assertEquals("<ol><li>Primer sentit.</li>", description);
    }

    @Test
    void unterminatedListIsNotClosed() {
        var text = "===Verb===\n# U.\n#: Exemple.\n==";
        assertEquals("<ol><li>U.</li><dl><dd>Exemple.</dd>", SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void alternativeFormNotice() {
        var text = """
            ===Verb===
            {{ca-verb}} {{forma-a|ca|complànyer}}
            # Plànyer.
            ==Notes==""";

        var expected = "<ol><li>Plànyer.</li>" +
            "<p style='font-weight: 300'>Forma alternativa a <a href='/conjugador-de-verbs/verb/complànyer'>complànyer</a></p>";

        assertEquals(expected, SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void firstAlternativeFormWins() {
        var text = """
            ===Verb===
            {{forma-a|ca|complanyer}}
            {{forma-a|ca|complànyer}}
            # Plànyer.
            ==""";

        var description = SectionExtractor.extract(text, INFINITIVES);
        assertTrue(description.endsWith("<a href='/conjugador-de-verbs/verb/complanyer'>complanyer</a></p>"));
    }

    @Test
    void unknownAlternativeFormIsDropped() {
        var text = "===Verb===\n{{forma-a|ca|desconegut}}\n# Definició.\n==";
        assertEquals("<ol><li>Definició.</li>", SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void alternativeFormOnlyEntry() {
        var text = "===Verb===\n{{ca-verb}}\n# {{forma-a|ca|abaltir}}\n==";
        var expected = "<p style='font-weight: 300'>Forma alternativa a <a href='/conjugador-de-verbs/verb/abaltir'>abaltir</a></p>";
        assertEquals(expected, SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void galleryIsRemoved() {
        var text = """
            ===Verb===
            <gallery>
            Fitxer:Gos.jpg|Un gos
            </gallery>
            # Mirar.
            ==""";

        assertEquals("<ol><li>Mirar.</li>", SectionExtractor.extract(text, INFINITIVES));
    }

    @Test
    void missingHeader() {
        assertEquals("", SectionExtractor.extract("===Nom===\n# Cosa.\n==", INFINITIVES));
    }

    @Test
    void missingNextHeading() {
        assertEquals("", SectionExtractor.extract("===Verb===\n# Fer.\n", INFINITIVES));
    }

    @Test
    void findSection() {
        var section = SectionExtractor.findSection("intro\n=== Verb ===\nA\nB\n==X==");
        assertEquals("\nA\nB\n", section.get());
        assertFalse(SectionExtractor.findSection("===Verbs===\nA\n==").isPresent());
    }

    @Test
    void splitLinesKeepsTerminators() {
        assertEquals(List.of("a\n", "\n", "b"), SectionExtractor.splitLines("a\n\nb"));
        assertEquals(List.of("a\n"), SectionExtractor.splitLines("a\n"));
        assertEquals(List.of(), SectionExtractor.splitLines(""));
    }
}
