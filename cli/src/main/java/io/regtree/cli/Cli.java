// file: cli/src/main/java/io/regtree/cli/Cli.java
package io.regtree.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.regtree.core.FrozenNode;
import io.regtree.core.Node;
import io.regtree.core.TreeBuilder;
import io.regtree.core.Trees;
import io.regtree.core.diff.Change;
import io.regtree.core.diff.DiffEngine;
import io.regtree.core.diff.StructuralDiffEngine;
import io.regtree.storage.Checkpointer;
import io.regtree.storage.MemoryCheckpointer;
import io.regtree.storage.NodeCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line front end over the regulation tree core.
 *
 * Usage:
 *   regtree [--out file] [--pretty] treeify <fragments.json>
 *   regtree [--out file] [--pretty] find <tree.json> <label-id>
 *   regtree [--out file] [--pretty] diff <version.json>...
 *
 * Examples:
 *   regtree treeify fragments.json
 *   regtree find 2011-31725.json 1005-2-a
 *   regtree --pretty diff 2011-31725.json 2012-1234.json
 *
 * Every input file holds either one node object or an array of node
 * fragments; fragments are rebuilt with {@link TreeBuilder#treeify}.
 * The diff command compares every ordered pair of versions, a version
 * against itself included. Tree builds and diffs go through a
 * {@link Checkpointer} so identical inputs are processed once.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    private static final String USAGE = """
            Usage:
              regtree [--out file] [--pretty] treeify <fragments.json>
              regtree [--out file] [--pretty] find <tree.json> <label-id>
              regtree [--out file] [--pretty] diff <version.json>...
            """;

    private final NodeCodec codec;
    private final Checkpointer checkpointer;
    private final DiffEngine diffEngine;

    Cli(boolean pretty, Checkpointer checkpointer, DiffEngine diffEngine) {
        this.codec = new NodeCodec(pretty);
        this.codec.mapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.checkpointer = checkpointer;
        this.diffEngine = diffEngine;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    /** Run one command; returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.command().equals("help")) {
                out.print(USAGE);
                return 0;
            }

            var cli = new Cli(cfg.pretty(), new MemoryCheckpointer(), new StructuralDiffEngine());
            String result = cli.execute(cfg);

            if (cfg.out() != null) {
                Files.writeString(Path.of(cfg.out()), result, StandardCharsets.UTF_8);
                log.info("wrote " + cfg.out());
            } else {
                out.println(result);
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    String execute(CliConfig cfg) {
        List<String> ops = cfg.operands();
        return switch (cfg.command()) {
            case "treeify" -> codec.encode(TreeBuilder.treeify(codec.decodeFragments(read(Path.of(ops.get(0))))));
            case "find" -> find(Path.of(ops.get(0)), ops.get(1));
            case "diff" -> codec.encode(diffAll(ops.stream().map(Path::of).toList()));
            default -> throw new CliException("unknown command: " + cfg.command());
        };
    }

    private String find(Path file, String labelId) {
        Node root = buildTree(read(file), file.toString());
        return Trees.find(root, labelId).map(codec::encode).orElse("(not found)");
    }

    /**
     * Diff every ordered pair of versions.
     *
     * @return lhs version -> rhs version -> label id -> change
     */
    Map<String, Map<String, Map<String, Change>>> diffAll(List<Path> files) {
        var versions = new LinkedHashMap<String, FrozenNode>();
        for (Path file : files) {
            String version = versionId(file);
            if (versions.containsKey(version)) {
                throw new CliException("duplicate version: " + version);
            }
            String content = read(file);
            log.info("Version " + version);
            FrozenNode tree = checkpointer.checkpoint(
                    "init-tree-" + sha256(content),
                    () -> FrozenNode.from(buildTree(content, file.toString())));
            versions.put(version, tree);
        }

        var all = new LinkedHashMap<String, Map<String, Map<String, Change>>>();
        for (var lhs : versions.entrySet()) {
            var row = new LinkedHashMap<String, Map<String, Change>>();
            for (var rhs : versions.entrySet()) {
                Map<String, Change> changes = checkpointer.checkpoint(
                        diffKey(lhs.getKey(), rhs.getKey()),
                        () -> diffEngine.changesBetween(lhs.getValue(), rhs.getValue()));
                row.put(rhs.getKey(), changes);
            }
            all.put(lhs.getKey(), row);
        }
        return all;
    }

    /** A single rooted tree from a node object or an array of fragments. */
    private Node buildTree(String json, String source) {
        List<Node> roots = TreeBuilder.treeify(codec.decodeFragments(json));
        if (roots.size() != 1) {
            throw new CliException(source + ": expected exactly one root, found " + roots.size());
        }
        return roots.get(0);
    }

    /** Checkpoint key for one ordered pair; ids are length-prefixed since they may contain '-'. */
    static String diffKey(String lhs, String rhs) {
        return "diff-" + lhs.length() + ":" + lhs + "-" + rhs.length() + ":" + rhs;
    }

    static String versionId(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
    }

    static String sha256(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String read(Path file) {
        if (!Files.isRegularFile(file)) throw new CliException("no such file: " + file);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load logging.properties", e);
        }
    }
}
