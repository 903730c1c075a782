package com.github.conjugador.definitions;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.github.conjugador.parsing.SectionExtractor;
import com.github.conjugador.utils.PageContainer;

/**
 * Collects the descriptions of all known infinitives found in a Wiktionary dump.
 * <p>
 * A page is taken into account if its title, stripped of reflexive pronouns, is a known
 * infinitive, it is tagged as a Catalan verb and its "Verb" section yields a non-empty
 * description. When several pages map to the same infinitive, the last one in dump order
 * wins, also in parallel mode.
 */
public final class DefinitionsBuilder {
    private static final Logger LOGGER = Logger.getLogger(DefinitionsBuilder.class.getName());

    private static final String VERB_TEMPLATE = "{{ca-verb";

    private final InfinitivesFile infinitives;
    private boolean parallel;

    public DefinitionsBuilder(InfinitivesFile infinitives) {
        this.infinitives = Objects.requireNonNull(infinitives);
    }

    public DefinitionsBuilder parallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    public Definitions build(Stream<PageContainer> pages) {
        Objects.requireNonNull(pages);

        var stream = parallel ? pages.parallel() : pages.sequential();

        var descriptions = stream
            .map(this::process)
            .flatMap(Optional::stream)
            .collect(Collectors.toMap(
                Entry::verb,
                Entry::description,
                (previous, latest) -> latest,
                LinkedHashMap::new
            ));

        var definitions = new Definitions(descriptions, infinitives.getInfinitives());

        LOGGER.logp(Level.INFO, "DefinitionsBuilder", "build", "Definitions: {0}, without definitions: {1}",
            new Object[] {definitions.size(), definitions.getUndefinedInfinitives().size()});

        return definitions;
    }

    Optional<Entry> process(PageContainer page) {
        var title = page.getTitle();
        var verb = ReflexivePronouns.toCanonicalKey(title);

        if (!infinitives.contains(verb)) {
            LOGGER.logp(Level.FINEST, "DefinitionsBuilder", "process", "Discard not in word list: {0}", title);
            return Optional.empty();
        }

        var text = page.getText();

        if (!text.contains(VERB_TEMPLATE)) {
            LOGGER.logp(Level.FINE, "DefinitionsBuilder", "process", "Discard is not a verb: {0}", title);
            return Optional.empty();
        }

        var description = SectionExtractor.extract(text, infinitives.asSet());

        if (description.isEmpty()) {
            LOGGER.logp(Level.FINE, "DefinitionsBuilder", "process", "Discard no description: {0}", title);
            return Optional.empty();
        }

        LOGGER.logp(Level.FINER, "DefinitionsBuilder", "process", "Store {0}: {1}", new Object[] {verb, description});
        return Optional.of(new Entry(verb, description));
    }

    record Entry(String verb, String description) {}
}
