package org.smartcalc;

import java.nio.file.*;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Session settings read from {@code calculator.json}. Missing keys keep their defaults.
 */
public final class CalculatorConfig {
    static final String CONFIG_FILE = "calculator.json";
    static final List<String> DEFAULT_HELP = Collections.unmodifiableList(Arrays.asList(
            "This program is a smart calculator.",
            "You can use big integers, +, -, *, /, ^, parentheses and variables."
    ));
    static final String DEFAULT_VARIABLES_FILE = "variables.json";

    private final List<String> helpLines;
    private final Path variablesFile;
    private final boolean persistVariables;

    public CalculatorConfig(List<String> helpLines, Path variablesFile, boolean persistVariables) {
        this.helpLines = Collections.unmodifiableList(new ArrayList<>(helpLines));
        this.variablesFile = Objects.requireNonNull(variablesFile, "variablesFile");
        this.persistVariables = persistVariables;
    }

    public static CalculatorConfig defaults() {
        return new CalculatorConfig(DEFAULT_HELP, Paths.get(DEFAULT_VARIABLES_FILE), false);
    }

    /**
     * Classpath {@code /calculator.json} first, then {@code ./calculator.json}, then defaults.
     */
    public static CalculatorConfig load() {
        ObjectNode json = JsonUtil.readClasspathObject("/" + CONFIG_FILE);
        if (json == null) json = JsonUtil.readFileObject(Paths.get(CONFIG_FILE));
        return json == null ? defaults() : fromJson(json);
    }

    /** Loads an explicitly named file, which must exist. */
    public static CalculatorConfig load(Path file) {
        ObjectNode json = JsonUtil.readFileObject(file);
        if (json == null) throw new ConfigException("PARSE_ERROR: cannot find " + file);
        return fromJson(json);
    }

    static CalculatorConfig fromJson(ObjectNode json) {
        List<String> help = DEFAULT_HELP;
        JsonNode helpNode = json.get("helpLines");
        if (helpNode != null && !helpNode.isNull()) {
            if (!helpNode.isArray()) throw new ConfigException("PARSE_ERROR: 'helpLines' must be an array of strings");
            help = new ArrayList<>();
            for (JsonNode line : helpNode) help.add(line.asText());
        }

        Path vars = Paths.get(DEFAULT_VARIABLES_FILE);
        JsonNode varsNode = json.get("variablesFile");
        if (varsNode != null && varsNode.isTextual() && !varsNode.asText().trim().isEmpty()) {
            vars = Paths.get(varsNode.asText().trim());
        }

        JsonNode persistNode = json.get("persistVariables");
        boolean persist = persistNode != null && persistNode.asBoolean(false);

        return new CalculatorConfig(help, vars, persist);
    }

    public List<String> helpLines() { return helpLines; }
    public Path variablesFile() { return variablesFile; }
    public boolean persistVariables() { return persistVariables; }
}
