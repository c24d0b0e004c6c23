package org.dxworks.mddocx;

import org.dxworks.mddocx.assembly.DocumentAssembler;
import org.dxworks.mddocx.assembly.DocumentAssemblyException;
import org.dxworks.mddocx.assembly.DocumentOptions;
import org.dxworks.mddocx.assembly.JsonDocumentWriter;
import org.dxworks.mddocx.config.Options;
import org.dxworks.mddocx.model.Diagnostic;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printHelp(err);
            return EXIT_ERROR;
        }
        if (arguments.help) {
            printHelp(out);
            return EXIT_OK;
        }

        try {
            convert(arguments, MddocxConfig.load(), out);
            return EXIT_OK;
        } catch (IOException | DocumentAssemblyException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            printHelp(err);
            return EXIT_ERROR;
        }
    }

    static void convert(CliArguments arguments, MddocxConfig config, PrintStream out)
            throws IOException, DocumentAssemblyException {
        if (!Files.isRegularFile(arguments.input)) {
            throw new IOException("Input file does not exist: " + arguments.input);
        }
        String markdown = Files.readString(arguments.input, StandardCharsets.UTF_8);

        Options options = arguments.options != null ? OptionsLoader.load(arguments.options) : new Options();
        if (options.documentType == null) {
            options.documentType = config.getDocumentType();
        }

        out.println("Converting " + arguments.input.toAbsolutePath());
        Instant startTime = Instant.now();

        DocumentOptions document = new DocumentAssembler().assemble(markdown, options);
        byte[] bytes = new JsonDocumentWriter(config.isPrettyPrint()).serialize(document);

        // Create parent directories if they don't exist
        if (arguments.output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(arguments.output.toAbsolutePath().getParent());
        }
        Files.write(arguments.output, bytes);

        for (Diagnostic diagnostic : document.diagnostics) {
            out.println("  " + diagnostic);
        }
        Duration duration = Duration.between(startTime, Instant.now());
        out.println("Wrote " + document.sections.size() + " section(s), "
                + document.numbering.config.size() + " numbered list(s) to "
                + arguments.output.toAbsolutePath() + " in " + duration.toMillis() + " ms");
    }

    static void printHelp(PrintStream stream) {
        stream.println("Usage: java -jar mddocx.jar <input.md> <output.json> [--options <file>]");
        stream.println("  <input.md>:          Markdown file to convert");
        stream.println("  <output.json>:       Path of the document options JSON to write");
        stream.println("  -o, --options <file>: Conversion options (.json, .yml or .yaml)");
        stream.println("  -h, --help:          Show this help");
    }

    static final class CliArguments {
        final Path input;
        final Path output;
        final Path options;
        final boolean help;

        private CliArguments(Path input, Path output, Path options, boolean help) {
            this.input = input;
            this.output = output;
            this.options = options;
            this.help = help;
        }

        static CliArguments parse(String[] args) {
            String input = null;
            String output = null;
            String options = null;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h":
                    case "--help":
                        return new CliArguments(null, null, null, true);
                    case "-o":
                    case "--options":
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for " + arg);
                        }
                        options = args[++i];
                        break;
                    default:
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (input == null) {
                            input = arg;
                        } else if (output == null) {
                            output = arg;
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                }
            }
            if (input == null || output == null) {
                throw new IllegalArgumentException("Both <input.md> and <output.json> are required");
            }
            return new CliArguments(Paths.get(input), Paths.get(output),
                    options != null ? Paths.get(options) : null, false);
        }
    }
}
