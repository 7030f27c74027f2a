package com.gofixture.cli;

import com.gofixture.cli.config.RenderConfig;
import com.gofixture.cli.config.RenderConfigReader;
import com.gofixture.cli.io.DocumentDecoder;
import com.gofixture.cli.io.FixtureWriter;
import com.gofixture.dump.DumpConfig;
import com.gofixture.dump.DumpResult;
import com.gofixture.dump.FixtureDumper;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the gofixture command line tool.
 *
 * Usage:
 *   java -jar gofixture-cli-java.jar render \
 *     --input   <file.json> [--input <file.json> ...] \
 *     --type    <fully.qualified.Class> \
 *     --package <go package name> \
 *     --config  <render.json> \
 *     --options <indent=2,depth=3,sort=true,stringers=false> \
 *     --output  <file.go>
 *
 * Each input is rendered to a Go file next to it with the extension replaced by {@code .go},
 * or to {@code --output} when a single input is given.
 */
public class FixtureMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[gofixture-cli] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar gofixture-cli-java.jar render " +
                               "--input <file.json> [--type <class>] [--package <name>] " +
                               "[--config <render.json>] [--options <k=v,...>] [--output <file.go>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[gofixture-cli] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Runs the command and returns the files written. */
    static List<Path> run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("render")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        List<String> inputs = new ArrayList<>();
        String typeName = null;
        String packageName = null;
        String configPath = null;
        String options = null;
        String outputPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"   -> inputs.add(requireNext(args, i++, "--input"));
                case "--type"    -> typeName    = requireNext(args, i++, "--type");
                case "--package" -> packageName = requireNext(args, i++, "--package");
                case "--config"  -> configPath  = requireNext(args, i++, "--config");
                case "--options" -> options     = requireNext(args, i++, "--options");
                case "--output"  -> outputPath  = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (inputs.isEmpty()) throw new UsageException("--input is required");
        if (outputPath != null && inputs.size() > 1) {
            throw new UsageException("--output requires exactly one --input");
        }

        // Precedence: defaults < render.json < --options < --package
        DumpConfig config = DumpConfig.defaults();
        RenderConfig fileConfig = null;
        if (configPath != null) {
            System.err.println("[gofixture-cli] Reading render config: " + configPath);
            fileConfig = new RenderConfigReader().read(Paths.get(configPath));
            config = fileConfig.applyTo(config);
        }
        config = DumpConfig.parse(options, config);
        if (packageName != null) {
            config = config.withPackageName(packageName);
        }
        if (typeName == null && fileConfig != null) {
            typeName = fileConfig.getType();
        }
        Class<?> type = resolveType(typeName);
        System.err.println("[gofixture-cli] " + config + (type != null ? " type=" + type.getName() : ""));

        FixtureDumper dumper = new FixtureDumper(config);
        DocumentDecoder decoder = new DocumentDecoder();
        FixtureWriter writer = new FixtureWriter();
        List<Path> written = new ArrayList<>();
        for (String input : inputs) {
            Path source = Paths.get(input);
            List<Object> documents = decoder.decode(source, type);
            System.err.println("[gofixture-cli] " + source + ": " + documents.size() + " document(s)");
            DumpResult result = dumper.dump(documents.toArray());
            Path target = outputPath != null ? Paths.get(outputPath) : goFileFor(source);
            writer.write(target, result.text());
            written.add(target);
        }
        System.err.println("[gofixture-cli] Done.");
        return written;
    }

    private static Class<?> resolveType(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return null;
        }
        try {
            return Class.forName(typeName.trim());
        } catch (ClassNotFoundException e) {
            throw new UsageException("Unknown --type class: " + typeName);
        }
    }

    /** {@code deploy.json} → {@code deploy.go}, in the same directory. */
    static Path goFileFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".go");
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
