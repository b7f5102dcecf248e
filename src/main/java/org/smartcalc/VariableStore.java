package org.smartcalc;

import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Variables of one session. The expression engine only ever sees {@link #view()}.
 */
public final class VariableStore {
    static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z]+");
    private static final Pattern INTEGER = Pattern.compile("[-+]?[0-9]+");

    private final Map<String, BigInteger> values = new HashMap<>();
    private final Map<String, BigInteger> view = Collections.unmodifiableMap(values);

    public Map<String, BigInteger> view() {
        return view;
    }

    public void assign(String name, BigInteger value) {
        if (!IDENTIFIER.matcher(name).matches()) throw new IllegalArgumentException("bad identifier: " + name);
        values.put(name, Objects.requireNonNull(value, "value"));
    }

    public int size() {
        return values.size();
    }

    // ----- JSON persistence -----

    /**
     * Adds the entries of a {@code {"name": 123, ...}} file. Integers may also be given as
     * decimal strings. Bad entries are skipped with a warning. A missing file loads nothing.
     *
     * @return number of entries loaded
     */
    public int loadFrom(Path file, PrintStream warnings) {
        ObjectNode json = JsonUtil.readFileObject(file);
        if (json == null) return 0;

        int loaded = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            String name = e.getKey();
            if (!IDENTIFIER.matcher(name).matches()) {
                warnings.println("WARNING: " + file + " - skipping invalid identifier '" + name + "'");
                continue;
            }
            BigInteger value = toBigInteger(e.getValue());
            if (value == null) {
                warnings.println("WARNING: " + file + " - skipping '" + name + "', not an integer: " + e.getValue());
                continue;
            }
            values.put(name, value);
            loaded++;
        }
        return loaded;
    }

    /** Writes all entries, sorted by name, as a pretty-printed JSON object. */
    public void saveTo(Path file) {
        ObjectNode json = JsonUtil.MAPPER.createObjectNode();
        for (Map.Entry<String, BigInteger> e : new TreeMap<>(values).entrySet()) {
            json.put(e.getKey(), e.getValue());
        }
        JsonUtil.writeObject(file, json);
    }

    private static BigInteger toBigInteger(JsonNode node) {
        if (node == null) return null;
        if (node.isIntegralNumber()) return node.bigIntegerValue();
        if (node.isTextual()) {
            String t = node.asText().trim();
            if (INTEGER.matcher(t).matches()) return new BigInteger(t);
        }
        return null;
    }
}
