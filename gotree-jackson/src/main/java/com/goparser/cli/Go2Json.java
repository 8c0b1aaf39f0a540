package com.goparser.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goparser.jackson.GoTreeJackson;
import com.goparser.jackson.JacksonGenericJsonProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts Go source files to generic JSON syntax trees.
 *
 * Each {@code name.go} gets a {@code name.json} next to it.
 *
 * Usage:
 *   java -cp ... com.goparser.cli.Go2Json [options] <file-or-directory>
 *
 * Options:
 *   --ext=EXT        Source extension for directory walks (default: go)
 *   --out-ext=EXT    Output extension (default: json)
 *   --fail-fast      Stop at the first failing file
 *   --compact        Write single-line JSON
 *   --report=PATH    Write a JSON summary of the run
 *   --verbose        Enable verbose output
 */
public class Go2Json {

    private static final ObjectMapper mapper = GoTreeJackson.createObjectMapper();

    private final Config config;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Runs the tool and returns its exit code: 0 if every unit was converted, 1 otherwise.
     */
    public static int execute(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            return 1;
        }
        return new Go2Json(config).run();
    }

    public Go2Json(Config config) {
        this.config = config;
    }

    public int run() {
        JacksonGenericJsonProvider provider = new JacksonGenericJsonProvider(mapper);
        SourceUnitConverter converter = new SourceUnitConverter(provider.getSerializer(), config.outputExtension, config.compact);
        SourceUnitWalker walker = new SourceUnitWalker(converter, config.sourceExtension, config.failFast, config.verbose);

        WalkReport report;
        try {
            report = walker.walk(config.input);
        } catch (UnitConversionException e) {
            if (e.type() == FailureType.PATH && e.source().equals(config.input)) {
                System.err.println("Error accessing the path: " + e.getMessage());
            } else {
                System.err.println("Error processing file: " + e.getMessage());
            }
            if (config.verbose) {
                e.printStackTrace();
            }
            return 1;
        }

        if (config.verbose || report.hasFailures()) {
            System.out.printf("Processed %d file(s): %d written, %d failed%n",
                report.processed(), report.written().size(), report.failures().size());
        }

        if (config.report != null) {
            try {
                Files.writeString(config.report, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
                System.out.println("Wrote report to: " + config.report);
            } catch (IOException e) {
                System.err.println("Failed to write report: " + e.getMessage());
                return 1;
            }
        }

        return report.hasFailures() ? 1 : 0;
    }

    private static void printUsage() {
        System.out.println("Usage: Go2Json [options] <file-or-directory>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --ext=EXT        Source extension for directory walks (default: go)");
        System.out.println("  --out-ext=EXT    Output extension (default: json)");
        System.out.println("  --fail-fast      Stop at the first failing file (default: report and continue)");
        System.out.println("  --compact        Write single-line JSON instead of indented JSON");
        System.out.println("  --report=PATH    Write a JSON summary of the run");
        System.out.println("  --verbose        Enable verbose output");
        System.out.println("  --help           Show this help");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  Go2Json main.go");
        System.out.println("  Go2Json --fail-fast --report=report.json ./src");
    }

    // ========== Inner classes ==========

    public static class Config {
        String sourceExtension = "go";
        String outputExtension = "json";
        boolean failFast = false;
        boolean compact = false;
        Path report = null;
        boolean verbose = false;
        Path input = null;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--ext=")) {
                    config.sourceExtension = stripDot(arg.substring(6));
                } else if (arg.startsWith("--out-ext=")) {
                    config.outputExtension = stripDot(arg.substring(10));
                } else if (arg.equals("--fail-fast")) {
                    config.failFast = true;
                } else if (arg.equals("--compact")) {
                    config.compact = true;
                } else if (arg.startsWith("--report=")) {
                    config.report = Path.of(arg.substring(9));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    if (config.input != null) {
                        System.err.println("Error: Only one input path may be given");
                        return null;
                    }
                    config.input = Path.of(arg);
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.input == null) {
                System.err.println("Please provide the path to the Go source file or folder as a command-line argument.");
                return null;
            }
            if (config.sourceExtension.isEmpty() || config.outputExtension.isEmpty()) {
                System.err.println("Error: Extensions must not be empty");
                return null;
            }

            return config;
        }

        private static String stripDot(String extension) {
            return extension.startsWith(".") ? extension.substring(1) : extension;
        }
    }
}
