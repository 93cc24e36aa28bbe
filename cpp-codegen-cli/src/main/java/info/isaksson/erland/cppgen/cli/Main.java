package info.isaksson.erland.cppgen.cli;

import info.isaksson.erland.cppgen.core.CppCodegenOptions;
import info.isaksson.erland.cppgen.core.CppCodegenResult;
import info.isaksson.erland.cppgen.core.CppCodegenService;
import info.isaksson.erland.cppgen.core.GenerationWarning;
import info.isaksson.erland.cppgen.core.GenerationWarnings;
import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.render.CppStandard;
import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.DocsStyle;
import info.isaksson.erland.cppgen.style.Indentation;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * CLI entrypoint: generates a C++ header/source pair holding i18n strings as a class of
 * {@code static const char *} members.
 */
public final class Main {

    static final String VERSION = "0.1.0-SNAPSHOT";
    static final String SEPARATOR = "// ----------------------------------------";

    private static final CppCodegenService SERVICE = new CppCodegenService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }
        if (parsed.version) {
            System.out.println("cpp-codegen " + VERSION);
            return 0;
        }

        if (parsed.config == null) {
            System.err.println("Error: a config file is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path configPath = Paths.get(parsed.config).toAbsolutePath().normalize();
        if (!Files.isRegularFile(configPath)) {
            System.err.println("Error: config file does not exist: " + configPath);
            return 1;
        }

        final I18nConfig config;
        try {
            config = I18nConfig.read(configPath);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            System.err.println("Error: invalid config: " + configPath);
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: could not read config: " + configPath);
            System.err.println(e.getMessage());
            return 2;
        }
        debug(parsed, "Config: class=" + config.className + ", file=" + config.fileName);

        GenerationWarnings warnings = new GenerationWarnings();
        I18nStrings strings = new I18nStrings(warnings);
        for (Path file : config.resolveStrings(configPath)) {
            if (!Files.isRegularFile(file)) {
                System.err.println("Error: strings file does not exist: " + file);
                return 1;
            }
            try {
                strings.load(file);
            } catch (IOException e) {
                System.err.println("Error: could not read strings file: " + file);
                System.err.println(e.getMessage());
                return 2;
            }
            debug(parsed, "Loaded " + file);
        }

        if (parsed.verbosity.allows(Verbosity.WARNING)) {
            for (GenerationWarning w : warnings.sorted()) {
                System.err.println("Warning: " + w);
            }
        }

        final CppCodegenResult res;
        try {
            CppClass cls = ConfigClassBuilder.build(config.className, strings.values());
            res = SERVICE.generate(config.fileName, List.of(cls), toCoreOptions(parsed));
        } catch (RuntimeException e) {
            System.err.println("Error: generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.dryRun) {
            System.out.println(SEPARATOR);
            System.out.println("// " + res.header.fileName);
            System.out.println(SEPARATOR);
            System.out.print(res.headerText);
            System.out.println(SEPARATOR);
            System.out.println("// " + res.source.fileName);
            System.out.println(SEPARATOR);
            System.out.print(res.sourceText);
            System.out.println(SEPARATOR);
            return 0;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        final Path headerOut = outDir.resolve(res.header.fileName);
        final Path sourceOut = outDir.resolve(res.source.fileName);
        try {
            Files.createDirectories(outDir);
            Files.writeString(headerOut, res.headerText);
            Files.writeString(sourceOut, res.sourceText);
        } catch (IOException e) {
            System.err.println("Error: could not write output to: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.verbosity.allows(Verbosity.INFO)) {
            System.out.println(
                    "cpp-codegen\n" +
                    "- Config: " + configPath + "\n" +
                    "- Header: " + headerOut + "\n" +
                    "- Source: " + sourceOut + "\n" +
                    "- Strings: " + strings.values().size() + "\n" +
                    "- Warnings: " + warnings.size()
            );
        }
        return 0;
    }

    private static void debug(CliArgs parsed, String message) {
        if (parsed.verbosity.allows(Verbosity.DEBUG)) {
            System.err.println("Debug: " + message);
        }
    }

    static CppCodegenOptions toCoreOptions(CliArgs parsed) {
        CppCodegenOptions o = new CppCodegenOptions();
        o.cppStandard = parsed.cppStandard;
        o.braceStyle = parsed.braceStyle;
        o.docsStyle = parsed.docsStyle;
        o.indentUnit = parsed.indentUnit;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        boolean version = false;
        String config;
        String output = ".";
        boolean dryRun = false;
        Verbosity verbosity = Verbosity.INFO;

        CppStandard cppStandard = CppStandard.CPP_11;
        BraceStyle braceStyle = BraceStyle.KNR;
        DocsStyle docsStyle = DocsStyle.ABOVE;
        String indentUnit = Indentation.TAB;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--version":
                        out.version = true;
                        break;
                    case "--output":
                    case "-o":
                        out.output = requireValue(args, ++i, a);
                        break;
                    case "--dryrun":
                    case "-d":
                        out.dryRun = true;
                        break;
                    case "--verbosity":
                    case "-v":
                        out.verbosity = Verbosity.parseCli(requireValue(args, ++i, a));
                        break;
                    case "--std":
                        out.cppStandard = CppStandard.parseCli(requireValue(args, ++i, a));
                        break;
                    case "--brace-style":
                        out.braceStyle = BraceStyle.parseCli(requireValue(args, ++i, a));
                        break;
                    case "--docs":
                        out.docsStyle = DocsStyle.parseCli(requireValue(args, ++i, a));
                        break;
                    case "--indent":
                        out.indentUnit = parseIndent(requireValue(args, ++i, a));
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.config == null) {
                            out.config = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        /** {@code tab} or a positive number of spaces. */
        static String parseIndent(String v) {
            String s = v.trim().toLowerCase();
            if (s.equals("tab")) return Indentation.TAB;
            try {
                return Indentation.spaces(Integer.parseInt(s));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for --indent: " + v + " (expected tab or a positive number)", e);
            }
        }

        static void printHelp() {
            System.out.println(
                    "cpp-codegen\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar cpp-codegen-cli.jar <config.json> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  -o, --output <dir>     Output folder (default: current directory)\n" +
                    "  -d, --dryrun           Print the generated files instead of writing them\n" +
                    "  -v, --verbosity <lvl>  error | warning | info | debug (default: info)\n" +
                    "  --std <std>            c++03 | c++11 (default: c++11)\n" +
                    "  --brace-style <style>  allman | knr | single-line (default: knr)\n" +
                    "  --docs <style>         above | same-line (default: above)\n" +
                    "  --indent <tab|N>       Indent with a tab or N spaces (default: tab)\n" +
                    "  --version              Print the version\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Config:\n" +
                    "  {\"strings\": [\"en.txt\"], \"className\": \"Config\", \"fileName\": \"Config\"}\n" +
                    "  String files hold 'key = value' lines and are resolved against the config's folder.\n"
            );
        }
    }
}
