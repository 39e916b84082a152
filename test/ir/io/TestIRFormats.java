package ir.io;

import ir.CFGBuilder;
import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import junit.framework.TestCase;

import org.json.JSONObject;

import ast.Program;
import ast.StatementKind;
import ast.TurtleOp;

/**
 * Saving and loading graphs in the JSON and binary forms, and reading JSON programs
 */
public class TestIRFormats extends TestCase {

    private static Program[] programs() {
        return new Program[] { SamplePrograms.straightLine(), SamplePrograms.sign(), SamplePrograms.countdown(),
                SamplePrograms.division(), SamplePrograms.forever(), SamplePrograms.square(),
                SamplePrograms.foldable(), SamplePrograms.twoDiamonds() };
    }

    public static void testJsonRoundTrip() throws IOException {
        for (Program p : programs()) {
            ControlFlowGraph cfg = SamplePrograms.build(p);
            StringWriter out = new StringWriter();
            JsonIRFormat.write(cfg, out);
            ControlFlowGraph loaded = JsonIRFormat.read(new StringReader(out.toString()));
            assertTrue(p.getName(), cfg.structurallyEquals(loaded));
            assertEquals(cfg.getName(), loaded.getName());
        }
    }

    public static void testBinaryRoundTrip() throws IOException {
        for (Program p : programs()) {
            ControlFlowGraph cfg = SamplePrograms.build(p);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            BinaryIRFormat.write(cfg, out);
            ControlFlowGraph loaded = BinaryIRFormat.read(new ByteArrayInputStream(out.toByteArray()));
            assertTrue(p.getName(), cfg.structurallyEquals(loaded));
        }
    }

    public static void testStructuralEqualityNoticesDifferences() {
        ControlFlowGraph sign = SamplePrograms.build(SamplePrograms.sign());
        ControlFlowGraph countdown = SamplePrograms.build(SamplePrograms.countdown());
        assertFalse(sign.structurallyEquals(countdown));
    }

    public static void testBinaryRejectsForeignData() throws IOException {
        try {
            BinaryIRFormat.read(new ByteArrayInputStream("not an IR file".getBytes("UTF-8")));
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testBinaryRejectsTruncatedData() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BinaryIRFormat.write(SamplePrograms.build(SamplePrograms.countdown()), out);
        byte[] full = out.toByteArray();
        byte[] half = new byte[full.length / 2];
        System.arraycopy(full, 0, half, 0, half.length);
        try {
            BinaryIRFormat.read(new ByteArrayInputStream(half));
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testJsonRejectsMissingFields() {
        try {
            JsonIRFormat.read(new StringReader("{\"version\": 1, \"entry\": 0}"));
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testJsonRejectsBranchWithoutEdges() {
        String json = "{\"name\": \"bad\", \"version\": 1, \"entry\": 0, \"blocks\": ["
                + "{\"id\": 0, \"label\": \"ENTRY\", \"instructions\": [{\"id\": 0, \"type\": \"BRANCH\", \"guard\": \"(:x > 0)\"}]}"
                + "], \"edges\": []}";
        try {
            JsonIRFormat.read(new StringReader(json));
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testJsonRejectsWrongVersion() {
        JSONObject json = JsonIRFormat.toJSON(SamplePrograms.build(SamplePrograms.sign()));
        json.put("version", 99);
        try {
            JsonIRFormat.fromJSON(json);
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testReadProgram() {
        String json = "{\"name\": \"loop\", \"statements\": ["
                + "{\"kind\": \"assign\", \"target\": \":i\", \"value\": \"3\"},"
                + "{\"kind\": \"while\", \"guard\": \":i > 0\", \"body\": ["
                + "  {\"kind\": \"forward\", \"args\": [\":i * 10\"]},"
                + "  {\"kind\": \"assign\", \"target\": \":i\", \"value\": \":i - 1\"}]},"
                + "{\"kind\": \"if\", \"guard\": \":i == 0\", \"then\": [{\"kind\": \"penup\"}]},"
                + "{\"kind\": \"repeat\", \"count\": \"2\", \"body\": [{\"kind\": \"goto\", \"args\": [\"0\", \"0\"]}]}]}";
        JSONObject parsed = new JSONObject(json);
        assertTrue(JsonProgramReader.isProgram(parsed));
        Program p = JsonProgramReader.read(new StringReader(json));
        assertEquals("loop", p.getName());
        assertEquals(4, p.getStatements().size());
        assertEquals(StatementKind.WHILE, p.getStatements().get(1).getKind());
        assertEquals(TurtleOp.FORWARD, p.getStatements().get(1).getBody().get(0).getTurtleOp());
        assertTrue(p.getStatements().get(2).getElseBody().isEmpty());
        ControlFlowGraph cfg = new CFGBuilder().build(p);
        assertEquals(2, cfg.getLoopHeaders().size());
    }

    public static void testProgramWithUnknownStatement() {
        try {
            JsonProgramReader.read(new StringReader("{\"statements\": [{\"kind\": \"jump\"}]}"));
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testIRIsNotAProgram() {
        assertFalse(JsonProgramReader.isProgram(JsonIRFormat.toJSON(SamplePrograms.build(SamplePrograms.sign()))));
    }
}
