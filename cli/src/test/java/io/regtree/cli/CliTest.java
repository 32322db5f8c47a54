package io.regtree.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line front end over JSON files.
 */
class CliTest {

    @TempDir
    Path tmp;

    private final ObjectMapper json = new ObjectMapper();
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private static final String V1 = """
            [
              {"text": "(a) First.", "children": [], "label": ["1005", "2", "a"], "node_type": "regtext"},
              {"text": "", "children": [], "label": ["1005", "2"], "node_type": "regtext", "title": "Definitions"},
              {"text": "Part", "children": [], "label": ["1005"], "node_type": "regtext"}
            ]
            """;

    private static final String V2 = """
            [
              {"text": "Part", "children": [], "label": ["1005"], "node_type": "regtext"},
              {"text": "", "children": [], "label": ["1005", "2"], "node_type": "regtext", "title": "Definitions"},
              {"text": "(a) Revised.", "children": [], "label": ["1005", "2", "a"], "node_type": "regtext"},
              {"text": "(b) New.", "children": [], "label": ["1005", "2", "b"], "node_type": "regtext"}
            ]
            """;

    private int run(String... args) {
        return Cli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }

    private Path write(String name, String content) throws Exception {
        Path p = tmp.resolve(name);
        Files.writeString(p, content);
        return p;
    }

    @Test
    void treeify_prints_reconstructed_roots() throws Exception {
        Path frags = write("frags.json", V1);

        assertEquals(0, run("treeify", frags.toString()));

        JsonNode roots = json.readTree(out());
        assertEquals(1, roots.size());
        JsonNode root = roots.get(0);
        assertEquals("Part", root.get("text").asText());
        JsonNode sec = root.get("children").get(0);
        assertEquals("Definitions", sec.get("title").asText());
        assertEquals("(a) First.", sec.get("children").get(0).get("text").asText());
        assertFalse(root.has("title"));
    }

    @Test
    void find_prints_node_or_not_found() throws Exception {
        Path tree = write("2011-31725.json", V1);

        assertEquals(0, run("find", tree.toString(), "1005-2-a"));
        assertEquals("(a) First.", json.readTree(out()).get("text").asText());

        outBytes.reset();
        assertEquals(0, run("find", tree.toString(), "1005-9"));
        assertEquals("(not found)", out().trim());
    }

    @Test
    void diff_covers_every_ordered_pair_including_self() throws Exception {
        Path v1 = write("2011-31725.json", V1);
        Path v2 = write("2012-1234.json", V2);
        Path target = tmp.resolve("diffs.json");

        assertEquals(0, run("--out", target.toString(), "diff", v1.toString(), v2.toString()));

        JsonNode diffs = json.readTree(Files.readString(target));
        assertEquals(0, diffs.get("2011-31725").get("2011-31725").size());
        assertEquals(0, diffs.get("2012-1234").get("2012-1234").size());

        JsonNode forward = diffs.get("2011-31725").get("2012-1234");
        assertEquals("MODIFIED", forward.get("1005-2-a").get("op").asText());
        assertEquals("(a) Revised.", forward.get("1005-2-a").get("newText").asText());
        assertFalse(forward.get("1005-2-a").has("oldTitle"), "unchanged fields are omitted");
        assertEquals("ADDED", forward.get("1005-2-b").get("op").asText());

        JsonNode backward = diffs.get("2012-1234").get("2011-31725");
        assertEquals("DELETED", backward.get("1005-2-b").get("op").asText());
    }

    @Test
    void hyphenated_version_ids_get_their_own_diffs() throws Exception {
        String same = """
                {"text": "Part", "children": [], "label": ["1005"], "node_type": "regtext"}
                """;
        String changed = """
                {"text": "Part, amended", "children": [], "label": ["1005"], "node_type": "regtext"}
                """;
        Path a = write("a.json", same);
        Path bc = write("b-c.json", same);
        Path ab = write("a-b.json", same);
        Path c = write("c.json", changed);
        Path target = tmp.resolve("diffs.json");

        assertEquals(0, run("--out", target.toString(), "diff",
                a.toString(), bc.toString(), ab.toString(), c.toString()));

        JsonNode diffs = json.readTree(Files.readString(target));
        assertEquals(0, diffs.get("a").get("b-c").size());
        JsonNode abToC = diffs.get("a-b").get("c");
        assertEquals(1, abToC.size());
        assertEquals("Part, amended", abToC.get("1005").get("newText").asText());
    }

    @Test
    void diff_keys_are_distinct_for_overlapping_ids() {
        assertNotEquals(Cli.diffKey("a", "b-c"), Cli.diffKey("a-b", "c"));
        assertEquals(Cli.diffKey("2011-31725", "2012-1234"), Cli.diffKey("2011-31725", "2012-1234"));
    }

    @Test
    void fragments_without_a_single_root_are_a_usage_error() throws Exception {
        Path bad = write("bad.json", """
                [
                  {"text": "a", "children": [], "label": ["1005"], "node_type": "regtext"},
                  {"text": "b", "children": [], "label": ["1006"], "node_type": "regtext"}
                ]
                """);

        assertEquals(1, run("diff", bad.toString()));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("expected exactly one root"));
    }

    @Test
    void missing_file_and_bad_usage_exit_with_status_one() {
        assertEquals(1, run("treeify", tmp.resolve("nope.json").toString()));
        assertEquals(1, run("frobnicate"));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void malformed_json_exits_with_status_two() throws Exception {
        Path broken = write("broken.json", "{not json");
        assertEquals(2, run("treeify", broken.toString()));
    }

    @Test
    void version_id_strips_json_extension() {
        assertEquals("2011-31725", Cli.versionId(Path.of("/data/2011-31725.json")));
        assertEquals("notes.txt", Cli.versionId(Path.of("notes.txt")));
        assertEquals(64, Cli.sha256("reg").length());
    }
}
