package main;

import ir.CFGBuilder;
import ir.ControlFlowGraph;
import ir.SamplePrograms;
import ir.io.ParseException;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import analysis.symbolic.SynthesisExample;

/**
 * Exit codes of {@link ChironMain} and the readers for its auxiliary files
 */
public class TestChironMain extends TestCase {

    private static final String SIGN = "{\"name\": \"sign\", \"statements\": ["
            + "{\"kind\": \"if\", \"guard\": \":x > 0\","
            + " \"then\": [{\"kind\": \"assign\", \"target\": \":y\", \"value\": \"1\"}],"
            + " \"else\": [{\"kind\": \"assign\", \"target\": \":y\", \"value\": \"-1\"}]}]}";

    private static final String COUNTDOWN = "{\"name\": \"countdown\", \"statements\": ["
            + "{\"kind\": \"assign\", \"target\": \":i\", \"value\": \"10\"},"
            + "{\"kind\": \"assign\", \"target\": \":s\", \"value\": \"0\"},"
            + "{\"kind\": \"while\", \"guard\": \":i > 0\", \"body\": ["
            + "{\"kind\": \"assign\", \"target\": \":s\", \"value\": \":s + :i\"},"
            + "{\"kind\": \"assign\", \"target\": \":i\", \"value\": \":i - 1\"}]}]}";

    private static String tempFile(String contents) throws IOException {
        File f = File.createTempFile("chiron", ".json");
        f.deleteOnExit();
        try (Writer out = new FileWriter(f)) {
            out.write(contents);
        }
        return f.getAbsolutePath();
    }

    public static void testInterpret() throws IOException {
        String file = tempFile(SIGN);
        assertEquals(ChironMain.EXIT_OK, ChironMain.run(new String[] { file, "-interpret", "-d", "{\":x\": 3}" }));
    }

    public static void testHelp() {
        assertEquals(ChironMain.EXIT_OK, ChironMain.run(new String[] { "-h" }));
    }

    public static void testUnknownOption() {
        assertEquals(ChironMain.EXIT_PARSE_ERROR, ChironMain.run(new String[] { "-frobnicate" }));
    }

    public static void testMissingFile() {
        assertEquals(ChironMain.EXIT_PARSE_ERROR,
                     ChironMain.run(new String[] { "/nonexistent/chiron/prog.json", "-interpret" }));
    }

    public static void testBadJson() throws IOException {
        String file = tempFile("{\"name\": \"bad\", \"statements\": [");
        assertEquals(ChironMain.EXIT_PARSE_ERROR, ChironMain.run(new String[] { file, "-interpret" }));
    }

    public static void testBadBindings() throws IOException {
        String file = tempFile(SIGN);
        assertEquals(ChironMain.EXIT_PARSE_ERROR,
                     ChironMain.run(new String[] { file, "-interpret", "-d", "{\":x\": 1.5}" }));
    }

    public static void testMalformedProgram() throws IOException {
        String file = tempFile("{\"name\": \"bad\", \"statements\": ["
                + "{\"kind\": \"assign\", \"target\": \":x\", \"value\": \":y > 1\"}]}");
        assertEquals(ChironMain.EXIT_MALFORMED, ChironMain.run(new String[] { file, "-interpret" }));
    }

    public static void testAnalysesCompose() throws IOException {
        String file = tempFile(COUNTDOWN);
        String[] args = { file, "-optimize", "-dataflow", "-ai", "-domain", "sign", "-fuzz", "-profile" };
        assertEquals(ChironMain.EXIT_OK, ChironMain.run(args));
    }

    public static void testSavedIRReloads() throws IOException {
        String file = tempFile(COUNTDOWN);
        File saved = File.createTempFile("chiron", ".ir.json");
        saved.deleteOnExit();
        assertEquals(ChironMain.EXIT_OK,
                     ChironMain.run(new String[] { file, "-saveJson", saved.getAbsolutePath() }));
        assertEquals(ChironMain.EXIT_OK, ChironMain.run(new String[] { saved.getAbsolutePath(), "-interpret" }));
    }

    public static void testFaultLocalization() throws IOException {
        String file = tempFile(SIGN);
        String tests = tempFile("[{\"inputs\": {\":x\": 3}, \"expected\": {\":y\": 1}},"
                + " {\"inputs\": {\":x\": -3}, \"expected\": {\":y\": 1}}]");
        assertEquals(ChironMain.EXIT_OK, ChironMain.run(new String[] { file, "-sbfl", "-tests", tests }));
    }

    public static void testFaultLocalizationNeedsTests() throws IOException {
        String file = tempFile(SIGN);
        assertEquals(ChironMain.EXIT_PARSE_ERROR, ChironMain.run(new String[] { file, "-sbfl" }));
    }

    public static void testSynthesisNeedsExamples() throws IOException {
        String file = tempFile(SIGN);
        assertEquals(ChironMain.EXIT_PARSE_ERROR,
                     ChironMain.run(new String[] { file, "-synth", "-constparams", ":x" }));
    }

    public static void testParseBindings() {
        Map<String, Long> b = ChironMain.parseBindings("{\":x\": 3, \":y\": -7}");
        assertEquals(2, b.size());
        assertEquals(Long.valueOf(3), b.get(":x"));
        assertEquals(Long.valueOf(-7), b.get(":y"));
        assertTrue(ChironMain.parseBindings("{}").isEmpty());
    }

    public static void testNonIntegerBinding() {
        try {
            ChironMain.parseBindings("{\":x\": \"three\"}");
        } catch (ParseException e) {
            // Expected
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testReadTests() {
        List<Map<String, Long>> inputs = new ArrayList<>();
        List<Map<String, Long>> expected = new ArrayList<>();
        ChironMain.readTests(new StringReader("[{\"inputs\": {\":x\": 1}, \"expected\": {\":y\": 2}},"
                + " {\"inputs\": {\":x\": 0}}]"), inputs, expected);
        assertEquals(2, inputs.size());
        assertEquals(Long.valueOf(1), inputs.get(0).get(":x"));
        assertEquals(Long.valueOf(2), expected.get(0).get(":y"));
        assertTrue(expected.get(1).isEmpty());
    }

    public static void testReadExamples() {
        List<SynthesisExample> examples = ChironMain.readExamples(new StringReader("[{\"inputs\": {\":x\": 1},"
                + " \"outputs\": {\":y\": 5}}]"));
        assertEquals(1, examples.size());

        try {
            ChironMain.readExamples(new StringReader("[{\"inputs\": {\":x\": 1}}]"));
        } catch (ParseException e) {
            // Expected
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testPasses() {
        ControlFlowGraph sign = new CFGBuilder().build(SamplePrograms.sign());
        ConcreteInterpreter interpreter = new ConcreteInterpreter();
        ExecutionResult positive = interpreter.run(sign, Collections.singletonMap(":x", 3L));
        assertTrue(ChironMain.passes(positive, Collections.singletonMap(":y", 1L)));
        assertFalse(ChironMain.passes(positive, Collections.singletonMap(":y", -1L)));
        assertTrue(ChironMain.passes(positive, Collections.<String, Long> emptyMap()));

        ControlFlowGraph division = new CFGBuilder().build(SamplePrograms.division());
        ExecutionResult fault = interpreter.run(division, Collections.singletonMap(":x", 0L));
        assertFalse(ChironMain.passes(fault, Collections.<String, Long> emptyMap()));
    }
}
