package io.github.eutro.funclets.api;

import io.github.eutro.funclets.validate.ValidatedBody;
import io.github.eutro.funclets.validate.ValidationException;
import io.github.eutro.funclets.validate.ValidatorOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;

public class Cli {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        List<String> paths = new ArrayList<>();
        boolean suppressFlags = false;
        boolean dumpSsa = false;
        int threads = Runtime.getRuntime().availableProcessors();
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return 0;
                    case "-j":
                    case "--threads":
                        if (i == args.length) {
                            System.err.printf("%s: expected thread count%n", arg);
                            return 1;
                        }
                        try {
                            threads = Integer.parseInt(args[i++]);
                        } catch (NumberFormatException e) {
                            System.err.printf("%s: not a number: %s%n", arg, args[i - 1]);
                            return 1;
                        }
                        if (threads <= 0) {
                            System.err.printf("%s: thread count must be positive%n", arg);
                            return 1;
                        }
                        break;
                    case "--ssa":
                        dumpSsa = true;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        System.err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp();
            return 1;
        }

        configureLogging();
        ModuleValidator validator = new ModuleValidator(ValidatorOptions.DEFAULT, threads);
        boolean failed = false;
        for (String path : paths) {
            ModuleValidation validation;
            try {
                validation = validator.validate(Files.readAllBytes(Paths.get(path)));
            } catch (IOException e) {
                System.err.printf("could not read file %s: %s%n", path, e);
                failed = true;
                continue;
            } catch (ValidationException e) {
                System.out.printf("%s: %s%n", path, e.getMessage());
                failed = true;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                System.err.println("interrupted");
                return 1;
            }
            for (BodyResult result : validation.results) {
                System.out.printf("%s: %s%n", path, result);
                ValidatedBody body = result.getBody();
                if (dumpSsa && body != null) {
                    System.out.println(body.func);
                }
            }
            failed |= !validation.isValid();
        }
        return failed ? 1 : 0;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream config = Cli.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("could not read logging configuration: " + e);
        }
    }

    private static void printHelp() {
        System.out.println(
                "usage: funclets [-h|--help] [-j|--threads <n>] [--ssa] <file> ...\n" +
                        "\n" +
                        "  <file> : a binary module whose function bodies to validate\n" +
                        "  -j|--threads <n> : validate up to <n> bodies at once\n" +
                        "  --ssa : print the SSA IR of each valid body\n" +
                        "  -h|--help : show this help"
        );
    }
}
