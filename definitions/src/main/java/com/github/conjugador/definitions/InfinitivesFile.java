package com.github.conjugador.definitions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * List of infinitives, one per line, as generated from the Catalan dictionary.
 * Entries are lower-cased and trimmed; blank lines are skipped.
 */
public final class InfinitivesFile {
    private final List<String> infinitives;
    private final Set<String> lookup;

    InfinitivesFile(List<String> infinitives) {
        this.infinitives = List.copyOf(infinitives);
        this.lookup = Collections.unmodifiableSet(new LinkedHashSet<>(this.infinitives));
    }

    public static InfinitivesFile load(Path path) throws IOException {
        Objects.requireNonNull(path);
        return of(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static InfinitivesFile of(List<String> lines) {
        Objects.requireNonNull(lines);

        var infinitives = lines.stream()
            .map(line -> line.toLowerCase(Locale.ROOT).strip())
            .filter(line -> !line.isEmpty())
            .toList();

        return new InfinitivesFile(infinitives);
    }

    /**
     * Infinitives in file order, duplicates included.
     */
    public List<String> getInfinitives() {
        return infinitives;
    }

    public Set<String> asSet() {
        return lookup;
    }

    public boolean contains(String infinitive) {
        return lookup.contains(infinitive);
    }

    public int size() {
        return infinitives.size();
    }
}
