package org.smartcalc;

import java.io.*;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.regex.Pattern;

import org.smartcalc.expr.Calculator;
import org.smartcalc.expr.ErrorKind;
import org.smartcalc.expr.EvalException;

/**
 * Line-oriented session around the expression engine: commands, assignments and expressions.
 */
public final class SmartCalculator {

    // =========================================================
    // Entry
    // =========================================================
    public static void main(String[] args) {
        try {
            CalculatorConfig config = args.length > 0
                    ? CalculatorConfig.load(Paths.get(args[0]))
                    : CalculatorConfig.load();
            SmartCalculator session = new SmartCalculator(config, new VariableStore(), System.out, System.err);
            session.restoreVariables();
            session.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (ConfigException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace();
            System.exit(3);
        }
    }

    // =========================================================
    // Session
    // =========================================================
    private static final Pattern COMMAND = Pattern.compile("/.*");
    private static final Pattern ASSIGNMENT = Pattern.compile(".*=.*");
    private static final Pattern ASSIGNMENT_SPLIT = Pattern.compile("\\s*=\\s*");

    private final CalculatorConfig config;
    private final VariableStore variables;
    private final PrintStream out;
    private final PrintStream err;
    private boolean running = true;

    public SmartCalculator(CalculatorConfig config, VariableStore variables, PrintStream out, PrintStream err) {
        this.config = config;
        this.variables = variables;
        this.out = out;
        this.err = err;
    }

    /** Reads lines until {@code /exit} or end of input, then saves variables if configured. */
    public void run(BufferedReader in) throws IOException {
        String line;
        while (running && (line = in.readLine()) != null) {
            handle(line);
        }
        running = false;
        persistVariables();
    }

    /**
     * Processes one line. Every failure is printed as a single line and the session goes on.
     *
     * @return whether the session is still accepting input
     */
    public boolean handle(String line) {
        String input = line.trim();
        if (input.isEmpty()) return running;
        try {
            if (COMMAND.matcher(input).matches()) executeCommand(input);
            else if (ASSIGNMENT.matcher(input).matches()) executeAssignment(input);
            else showResult(input);
        } catch (EvalException e) {
            out.println(e.getMessage());
        }
        return running;
    }

    public boolean isRunning() {
        return running;
    }

    public VariableStore variables() {
        return variables;
    }

    private void executeCommand(String command) {
        switch (command) {
            case "/exit":
                out.println("Bye!");
                running = false;
                break;
            case "/help":
                for (String l : config.helpLines()) out.println(l);
                break;
            default:
                throw new EvalException(ErrorKind.UNKNOWN_COMMAND);
        }
    }

    private void executeAssignment(String assignment) {
        String[] parts = ASSIGNMENT_SPLIT.split(assignment, 2);
        String name = parts[0];
        String expression = parts.length > 1 ? parts[1] : "";
        if (!VariableStore.IDENTIFIER.matcher(name).matches()) throw new EvalException(ErrorKind.INVALID_IDENTIFIER);

        BigInteger value;
        try {
            value = Calculator.evaluate(expression, variables.view());
        } catch (EvalException e) {
            if (e.kind() == ErrorKind.UNKNOWN_VARIABLE) throw e;
            throw new EvalException(ErrorKind.INVALID_ASSIGNMENT, e);
        }
        variables.assign(name, value);
    }

    private void showResult(String expression) {
        out.println(Calculator.evaluate(expression, variables.view()));
    }

    // =========================================================
    // Persistence
    // =========================================================
    void restoreVariables() {
        if (!config.persistVariables()) return;
        int n = variables.loadFrom(config.variablesFile(), err);
        if (n > 0) err.println("Loaded " + n + " variable(s) from " + config.variablesFile());
    }

    private void persistVariables() {
        if (!config.persistVariables()) return;
        try {
            variables.saveTo(config.variablesFile());
        } catch (ConfigException e) {
            err.println("ERROR: " + e.getMessage());
        }
    }
}
