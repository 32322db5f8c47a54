// file: cli/src/main/java/io/regtree/cli/CliConfig.java
package io.regtree.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Command line configuration for {@link Cli}.
 *
 * Supports:
 *  - command:  treeify | find | diff | help
 *  - operands: positional arguments of the command (file paths, label id)
 *  - out:      optional output file; stdout when null
 *  - pretty:   indent JSON output
 */
public record CliConfig(
        String command,
        List<String> operands,
        String out,
        boolean pretty
) {

    public CliConfig {
        operands = List.copyOf(operands);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags (anywhere before or after the command):
     *   --out,    -o   <file>
     *   --pretty
     *   --help,   -h
     *
     * @throws CliException on unknown flags, unknown commands or wrong operand counts
     */
    public static CliConfig fromArgs(String[] args) {
        String out = null;
        boolean pretty = false;
        var positional = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig("help", List.of(), null, false);
                }

                case "--out", "-o" -> {
                    ensureValue(args, i);
                    out = args[++i];
                }

                case "--pretty" -> pretty = true;

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CliException("unknown option: " + args[i]);
                    }
                    positional.add(args[i]);
                }
            }
        }

        if (positional.isEmpty()) throw new CliException("missing command");

        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());

        switch (command) {
            case "treeify" -> requireCount(command, operands, 1, "<fragments.json>");
            case "find" -> requireCount(command, operands, 2, "<tree.json> <label-id>");
            case "diff" -> {
                if (operands.isEmpty()) throw new CliException("diff requires <version.json>...");
            }
            case "help" -> { }
            default -> throw new CliException("unknown command: " + command);
        }
        return new CliConfig(command, operands, out, pretty);
    }

    private static void requireCount(String command, List<String> operands, int n, String usage) {
        if (operands.size() != n) {
            throw new CliException(command + " requires " + usage);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }
}
