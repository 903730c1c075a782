package com.github.conjugador.definitions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;

/**
 * Persists definitions as consumed by the conjugator: a text file alternating infinitive
 * and description lines, and a JSON object mapping each infinitive to its description.
 */
public final class DefinitionsWriter {
    public static final String TEXT_FILENAME = "definitions.txt";
    public static final String JSON_FILENAME = "definitions.json";

    private final Path directory;

    public DefinitionsWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory);
    }

    public void write(Definitions definitions) throws IOException {
        Objects.requireNonNull(definitions);

        FileUtils.forceMkdir(directory.toFile());

        Files.write(getTextPath(), makeTextLines(definitions), StandardCharsets.UTF_8);
        Files.writeString(getJsonPath(), makeJson(definitions).toString(), StandardCharsets.UTF_8);
    }

    public Path getTextPath() {
        return directory.resolve(TEXT_FILENAME);
    }

    public Path getJsonPath() {
        return directory.resolve(JSON_FILENAME);
    }

    static List<String> makeTextLines(Definitions definitions) {
        var lines = new ArrayList<String>();

        for (var verb : definitions.getDefinedInfinitives()) {
            lines.add(verb);
            lines.add(definitions.getDescription(verb).get());
        }

        return lines;
    }

    static JSONObject makeJson(Definitions definitions) {
        return new JSONObject(definitions.getDescriptions());
    }
}
