package com.github.conjugador.tasks;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.LogManager;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.github.conjugador.definitions.Definitions;
import com.github.conjugador.definitions.DefinitionsBuilder;
import com.github.conjugador.definitions.DefinitionsWriter;
import com.github.conjugador.definitions.InfinitivesFile;
import com.github.conjugador.dumps.XMLDumpReader;
import com.github.conjugador.dumps.XMLRevision;

/**
 * Generates {@code definitions.txt} and {@code definitions.json} out of a Catalan
 * Wiktionary dump and the list of infinitives known to the conjugator.
 */
public final class ExtractDefinitions {
    private static final Path DEFAULT_DUMP = Paths.get("./data/cawiktionary-latest-pages-meta-current.xml");
    private static final Path DEFAULT_INFINITIVES = Paths.get("./data/infinitives.txt");
    private static final Path DEFAULT_OUTPUT = Paths.get("./data/");

    private static final int EXIT_FAILURE = 1;
    private static final int EXIT_USAGE = 2;

    private ExtractDefinitions() {}

    public static void main(String[] args) throws Exception {
        configureLogging();
        System.exit(run(args));
    }

    static int run(String[] args) {
        var options = makeOptions();
        CommandLine line;

        try {
            line = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp(ExtractDefinitions.class.getName(), options);
            return EXIT_USAGE;
        }

        if (line.hasOption("help")) {
            new HelpFormatter().printHelp(ExtractDefinitions.class.getName(), options);
            return 0;
        }

        var dumpPath = optPath(line, "dump", DEFAULT_DUMP);
        var infinitivesPath = optPath(line, "infinitives", DEFAULT_INFINITIVES);
        var outputPath = optPath(line, "output", DEFAULT_OUTPUT);

        try {
            var definitions = extract(dumpPath, infinitivesPath, line.hasOption("parallel"));
            new DefinitionsWriter(outputPath).write(definitions);

            System.out.println("Definitions: " + definitions.size());
            System.out.println("Without Definitions: " + definitions.getUndefinedInfinitives().size());
            return 0;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Unable to generate definitions: " + e);
            return EXIT_FAILURE;
        }
    }

    static Definitions extract(Path dumpPath, Path infinitivesPath, boolean parallel) throws IOException {
        var infinitives = InfinitivesFile.load(infinitivesPath);
        var builder = new DefinitionsBuilder(infinitives).parallel(parallel);

        try (var stream = new XMLDumpReader(dumpPath).getStAXReaderStream()) {
            return builder.build(stream.map(XMLRevision::toPageContainer));
        }
    }

    private static Options makeOptions() {
        var options = new Options();
        options.addOption("d", "dump", true, "Wiktionary XML dump, optionally compressed (default: " + DEFAULT_DUMP + ")");
        options.addOption("i", "infinitives", true, "infinitives file, one per line (default: " + DEFAULT_INFINITIVES + ")");
        options.addOption("o", "output", true, "output directory (default: " + DEFAULT_OUTPUT + ")");
        options.addOption("p", "parallel", false, "process pages in parallel");
        options.addOption("h", "help", false, "print this message");
        return options;
    }

    private static Path optPath(CommandLine line, String option, Path defaultPath) {
        return line.hasOption(option) ? Paths.get(line.getOptionValue(option)) : defaultPath;
    }

    private static void configureLogging() throws IOException {
        try (var is = ExtractDefinitions.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        }
    }
}
