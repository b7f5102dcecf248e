package org.smartcalc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class VariableStoreTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream warnings = new ByteArrayOutputStream();
    private final PrintStream warn = new PrintStream(warnings, true, StandardCharsets.UTF_8);

    @Test
    void viewIsReadOnly() {
        VariableStore store = new VariableStore();
        store.assign("a", BigInteger.ONE);
        assertEquals(BigInteger.ONE, store.view().get("a"));
        assertThrows(UnsupportedOperationException.class, () -> store.view().put("b", BigInteger.TEN));
    }

    @Test
    void assignOverwrites() {
        VariableStore store = new VariableStore();
        store.assign("a", BigInteger.ONE);
        store.assign("a", BigInteger.TWO);
        assertEquals(1, store.size());
        assertEquals(BigInteger.TWO, store.view().get("a"));
    }

    @Test
    void assignRejectsBadNames() {
        assertThrows(IllegalArgumentException.class, () -> new VariableStore().assign("a_b", BigInteger.ONE));
    }

    @Test
    void missingFileLoadsNothing() {
        VariableStore store = new VariableStore();
        assertEquals(0, store.loadFrom(dir.resolve("none.json"), warn));
        assertEquals(0, store.size());
    }

    @Test
    void loadsNumbersAndDecimalStringsSkippingTheRest() throws IOException {
        Path file = dir.resolve("vars.json");
        Files.write(file, ("{"
                + "\"n\": 7,"
                + "\"huge\": 123456789012345678901234567890,"
                + "\"text\": \"-98765432109876543210\","
                + "\"bad_name\": 1,"
                + "\"f\": 1.5,"
                + "\"s\": \"abc\""
                + "}").getBytes(StandardCharsets.UTF_8));

        VariableStore store = new VariableStore();
        assertEquals(3, store.loadFrom(file, warn));
        assertEquals(BigInteger.valueOf(7), store.view().get("n"));
        assertEquals(new BigInteger("123456789012345678901234567890"), store.view().get("huge"));
        assertEquals(new BigInteger("-98765432109876543210"), store.view().get("text"));

        String w = warnings.toString(StandardCharsets.UTF_8);
        assertTrue(w.contains("'bad_name'"));
        assertTrue(w.contains("'f'"));
        assertTrue(w.contains("'s'"));
    }

    @Test
    void savesSortedJsonNumbers() throws IOException {
        Path file = dir.resolve("out.json");
        VariableStore store = new VariableStore();
        store.assign("zeta", BigInteger.valueOf(-1));
        store.assign("alpha", BigInteger.TEN.pow(40));
        store.saveTo(file);

        JsonNode root = JsonUtil.MAPPER.readTree(file.toFile());
        assertEquals("alpha", root.fieldNames().next());
        assertTrue(root.get("alpha").isIntegralNumber());
        assertEquals(BigInteger.TEN.pow(40), root.get("alpha").bigIntegerValue());
        assertEquals(-1, root.get("zeta").intValue());

        VariableStore reloaded = new VariableStore();
        assertEquals(2, reloaded.loadFrom(file, warn));
        assertEquals(store.view(), reloaded.view());
    }
}
