package com.github.conjugador.parsing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class MarkupLineTransformerTest {
    @Test
    void removeTemplatesSingle() {
        var line = "Això és un {{ca.v.conj.para1|dom}} text";
        assertEquals("Això és un  text", MarkupLineTransformer.removeTemplates(line));
    }

    @Test
    void removeTemplatesNested() {
        var line = "Això és un {{ex-us|ca|Cal diferenciar el català del segle {{romanes|XV}} del català del segle {{romanes|XVI}}.}} text";
        assertEquals("Això és un  text", MarkupLineTransformer.removeTemplates(line));
    }

    @Test
    void removeTemplatesSiblings() {
        var line = "{{marca|ca|mallorquí|menorquí}} [[ensumar|Ensumar]] {{q|aspirar}}";
        assertEquals(" [[ensumar|Ensumar]] ", MarkupLineTransformer.removeTemplates(line));
    }

    @Test
    void removeTemplatesIsIdempotent() {
        var line = "{{a|{{b|{{c}}}}}} x {{d}} y";
        var once = MarkupLineTransformer.removeTemplates(line);
        assertEquals(" x  y", once);
        assertEquals(once, MarkupLineTransformer.removeTemplates(once));
    }

    @Test
    void removeTemplatesStrayClosingBraces() {
        var line = "text }} more {{tpl}} end";
        assertEquals(line, MarkupLineTransformer.removeTemplates(line));
    }

    @Test
    void removeTemplatesUnclosed() {
        assertEquals("{{a {{b}} text", MarkupLineTransformer.removeTemplates("{{a {{b}} text"));
        assertEquals("x  {{open", MarkupLineTransformer.removeTemplates("x {{closed}} {{open"));
    }

    @Test
    void removeInternalLinksWithLabel() {
        assertEquals("Ensumar", MarkupLineTransformer.removeInternalLinks("[[ensumar|Ensumar]]"));
    }

    @Test
    void removeInternalLinksWithoutLabel() {
        assertEquals("ensumar", MarkupLineTransformer.removeInternalLinks("[[ensumar]]"));
    }

    @Test
    void removeInternalLinksSeveral() {
        var line = "Fer [[olor|olors]] amb el [[nas]], [[Viquipèdia:x|y|z]] i [[sense tancar";
        assertEquals("Fer olors amb el nas, z i [[sense tancar", MarkupLineTransformer.removeInternalLinks(line));
    }

    @Test
    void removeWikiEmphasis() {
        assertEquals("bold and italic", MarkupLineTransformer.removeWikiEmphasis("'''bold''' and ''italic''"));
    }

    @Test
    void removeXmlTags() {
        var line = "Perjudicar la parença d'algú. <i>És un vestit que la desparença molt</i>.";
        assertEquals("Perjudicar la parença d'algú. És un vestit que la desparença molt.", MarkupLineTransformer.removeXmlTags(line));
    }

    @Test
    void removeXmlTagsRef() {
        var line = "Pantalons de rodamón lligats amb un cordill.<ref>Barbara Kingsolver, 2010</ref>";
        assertEquals("Pantalons de rodamón lligats amb un cordill. <i>Barbara Kingsolver, 2010</i>", MarkupLineTransformer.removeXmlTags(line));
    }

    @Test
    void removeXmlTagsInsideRef() {
        var line = "Text<br/><ref>Autor, <b>Obra</b></ref>";
        assertEquals("Text <i>Autor, Obra</i>", MarkupLineTransformer.removeXmlTags(line));
    }

    @Test
    void removeGallerySections() {
        var text = """
            Inici <gallery>;
            Fitxer:30 Days of Gratitude- Day 25 (4130230553).jpg|Gos amb ulleres [1]
            Fitxer:Chess-familienschach.PNG|Exemple d'ulleres o forquilla [4]
            </gallery> Fi""";

        assertEquals("Inici  Fi", MarkupLineTransformer.removeGallerySections(text));
    }

    @Test
    void removeGallerySectionsOnlyFirst() {
        var text = "a<gallery>x</gallery>b<gallery>y</gallery>c";
        assertEquals("ab<gallery>y</gallery>c", MarkupLineTransformer.removeGallerySections(text));
    }

    @Test
    void removeGallerySectionsUnclosed() {
        var text = "a<gallery>x";
        assertEquals(text, MarkupLineTransformer.removeGallerySections(text));
    }
}
