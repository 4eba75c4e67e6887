package io.github.eutro.pathprof.runner;

import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.ir.LinearIR;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Cli {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String program = null;
        File outputDir = new File(".");
        File batchFile = null;
        Map<String, Long> params = new LinkedHashMap<>();
        boolean optimize = true;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            System.err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        outputDir = new File(args[i++]);
                        break;
                    case "-b":
                    case "--batch":
                        if (i == args.length) {
                            System.err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        batchFile = new File(args[i++]);
                        break;
                    case "-p":
                    case "--param":
                        if (i == args.length) {
                            System.err.printf("%s: expected <name>=<value>%n", arg);
                            return 1;
                        }
                        String param = args[i++];
                        int eq = param.indexOf('=');
                        try {
                            if (eq < 0) throw new NumberFormatException("missing '='");
                            params.put(ParamsFile.paramName(param.substring(0, eq)), Long.parseLong(param.substring(eq + 1)));
                        } catch (NumberFormatException e) {
                            System.err.printf("%s: invalid parameter \"%s\": %s%n", arg, param, e.getMessage());
                            return 1;
                        }
                        break;
                    case "--no-optimize":
                        optimize = false;
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
            if (program != null) {
                System.err.printf("%s: program already specified%n", arg);
                return 1;
            }
            program = arg;
        }
        if (program == null) {
            printHelp();
            return 1;
        }

        try {
            LinearIR ir = LinearIR.parse(new String(Files.readAllBytes(new File(program).toPath()), StandardCharsets.UTF_8));
            ProfilerOptions options = new ProfilerOptions();
            if (!optimize) options.setOptimizeEventCounting(false);
            ProfileSession session = ProfileSession.open(
                    ir,
                    options,
                    RunnerOptions.inDirectory(outputDir.toPath())
            );
            List<Map<String, Long>> batch = batchFile == null
                    ? Collections.singletonList(params)
                    : ParamsFile.read(batchFile.toPath());
            session.runBatch(batch);
            for (String line : session.report()) {
                System.out.println(line);
            }
            return 0;
        } catch (IOException e) {
            System.err.printf("error: %s%n", e);
            return 1;
        } catch (ProfilingException | ExecutionException | IllegalArgumentException e) {
            System.err.printf("error: %s%n", e.getMessage());
            return 1;
        }
    }

    private static void printHelp() {
        System.out.println(
                "usage: pathprof [-h|--help] [-o|--output <dir>] [-b|--batch <file>] [-p|--param <name>=<value>]*\n" +
                        "                [--no-optimize] <program>\n" +
                        "\n" +
                        "  <program> : the program to profile, in the assembler text format\n" +
                        "  -o|--output <dir> : write hash_dump.txt and path_profile_data.txt to <dir>\n" +
                        "  -b|--batch <file> : run once for each JSON object of parameters in <file>, one per line\n" +
                        "  -p|--param <name>=<value> : set a parameter for a single run\n" +
                        "  --no-optimize : instrument every edge instead of only spanning tree chords\n" +
                        "  -h|--help : show this help"
        );
    }
}
