package pl.marcinmilkowski.cqp_tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.config.TranslationConfig;
import pl.marcinmilkowski.cqp_tree.config.TranslationConfigLoader;
import pl.marcinmilkowski.cqp_tree.frontend.FrontendRegistry;
import pl.marcinmilkowski.cqp_tree.frontend.InputError;
import pl.marcinmilkowski.cqp_tree.frontend.ParsingFailedException;
import pl.marcinmilkowski.cqp_tree.frontend.UnableToGuessFrontendException;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.translation.CandidateLimitExceededException;
import pl.marcinmilkowski.cqp_tree.translation.CqpTranslator;
import pl.marcinmilkowski.cqp_tree.translation.InconsistentOrderingException;
import pl.marcinmilkowski.cqp_tree.translation.NotSupportedException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Commands:
 *   translate [FRONTEND] -q "query" ...     translate queries given as arguments
 *   translate [FRONTEND] -f query.conllu    translate queries read from files
 *   frontends                               list the available front-ends
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * @return process exit status
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            showUsage(out);
            return 1;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "translate":
                    return handleTranslateCommand(args, in, out, err);
                case "frontends":
                    for (String name : FrontendRegistry.withDefaults().names()) {
                        out.println(name);
                    }
                    return 0;
                case "help":
                case "--help":
                case "-h":
                    showUsage(out);
                    return 0;
                default:
                    err.println("Unknown command: " + command);
                    showUsage(err);
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Use 'help' command for usage information.");
            return 1;
        } catch (IOException e) {
            logger.error("I/O error", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void showUsage(PrintStream out) {
        out.println("Usage: java -jar cqp-tree.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  translate [FRONTEND] [options]");
        out.println("      Translate tree-style corpus queries to CQP queries.");
        out.println("      If FRONTEND is omitted, it is determined automatically for each query.");
        out.println("      Options:");
        out.println("        --query, -q <str>        Query to translate (repeatable)");
        out.println("        --file, -f <file>        File containing a query to translate (repeatable)");
        out.println("        --output, -o <file>      Write results to file instead of stdout");
        out.println("        --encoding, -e <enc>     Encoding for reading and writing files (default: UTF-8)");
        out.println("        --config, -c <file>      Translation config (JSON)");
        out.println("        --max-candidates <n>     Maximum number of alternatives, 0 for no limit");
        out.println("      Without --query or --file the query is read from stdin.");
        out.println();
        out.println("  frontends");
        out.println("      List the available front-ends");
        out.println();
        out.println("Examples:");
        out.println("  java -jar cqp-tree.jar translate deptreepy -q 'TREE_ (pos NOUN) (pos ADJ)'");
        out.println("  java -jar cqp-tree.jar translate -f example.conllu -o query.cqp");
    }

    private static int handleTranslateCommand(String[] args, InputStream in, PrintStream out, PrintStream err)
            throws IOException {
        FrontendRegistry registry = FrontendRegistry.withDefaults();
        String frontend = null;
        List<String> queries = new ArrayList<>();
        List<String> files = new ArrayList<>();
        String outputPath = null;
        String configPath = null;
        Integer maxCandidates = null;
        Charset encoding = StandardCharsets.UTF_8;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--query":
                case "-q":
                    queries.add(requireValue(args, ++i));
                    break;
                case "--file":
                case "-f":
                    files.add(requireValue(args, ++i));
                    break;
                case "--output":
                case "-o":
                    outputPath = requireValue(args, ++i);
                    break;
                case "--encoding":
                case "-e":
                    encoding = Charset.forName(requireValue(args, ++i));
                    break;
                case "--config":
                case "-c":
                    configPath = requireValue(args, ++i);
                    break;
                case "--max-candidates":
                    maxCandidates = Integer.parseInt(requireValue(args, ++i));
                    break;
                default:
                    if (args[i].startsWith("-") || frontend != null) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    if (!registry.names().contains(args[i])) {
                        throw new IllegalArgumentException("Unknown front-end: " + args[i]
                            + " (supported: " + String.join(", ", registry.names()) + ")");
                    }
                    frontend = args[i];
            }
        }
        if (!queries.isEmpty() && !files.isEmpty()) {
            throw new IllegalArgumentException("--query and --file cannot be combined");
        }

        TranslationConfig config = configPath != null
            ? TranslationConfigLoader.load(Paths.get(configPath))
            : TranslationConfigLoader.loadDefault();
        if (maxCandidates != null) {
            config = config.withMaxCandidates(maxCandidates);
        }
        CqpTranslator translator = new CqpTranslator(config);

        List<String> inputs = new ArrayList<>(queries);
        for (String file : files) {
            try {
                inputs.add(Files.readString(Path.of(file), encoding));
            } catch (IOException e) {
                err.println("Could not read input file " + file + ": " + e.getMessage());
            }
        }
        if (queries.isEmpty() && files.isEmpty()) {
            err.println("No input file specified. Reading from stdin instead.");
            inputs.add(new String(in.readAllBytes(), encoding));
        }

        int translated = 0;
        Writer writer = null;
        try {
            if (outputPath != null) {
                writer = Files.newBufferedWriter(Path.of(outputPath), encoding);
            }
            for (String input : inputs) {
                String cqp = translate(registry, translator, frontend, input, err);
                if (cqp == null) {
                    continue;
                }
                translated++;
                if (writer != null) {
                    writer.write(cqp);
                    writer.write(System.lineSeparator());
                } else {
                    out.println(cqp);
                }
            }
        } finally {
            if (writer != null) {
                writer.close();
            }
        }
        return translated > 0 ? 0 : 1;
    }

    /**
     * Translate one input, reporting failures on {@code err}.
     *
     * @return the CQP pattern, or null if the input could not be translated
     */
    private static String translate(FrontendRegistry registry, CqpTranslator translator,
                                    String frontend, String input, PrintStream err) {
        try {
            Query query = frontend != null ? registry.translate(input, frontend) : registry.translate(input);
            return translator.translate(query);
        } catch (ParsingFailedException e) {
            err.println("Query could not be parsed:");
            for (InputError error : e.getErrors()) {
                err.println(error);
            }
        } catch (UnableToGuessFrontendException e) {
            if (e.noFrontendMatches()) {
                err.println("Unable to determine front-end: No front-end accepts the query.");
            } else {
                err.println("Unable to determine front-end: Query is accepted by "
                    + String.join(" and ", e.getMatchingFrontends()));
            }
        } catch (NotSupportedException e) {
            err.println("Query cannot be translated: " + e.getMessage());
        } catch (InconsistentOrderingException e) {
            err.println("Query cannot be translated: " + e.getMessage());
        } catch (CandidateLimitExceededException e) {
            err.println("Query cannot be translated: " + e.getMessage()
                + ". Use --max-candidates to raise the limit.");
        }
        return null;
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }
}
