package main;

import ir.BasicBlock;
import ir.CFGBuilder;
import ir.ControlFlowGraph;
import ir.io.BinaryIRFormat;
import ir.io.JsonIRFormat;
import ir.io.JsonProgramReader;
import ir.io.ParseException;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import util.Deadline;
import util.print.CFGWriter;
import util.print.PrettyPrinter;
import analysis.coverage.CoverageOracle;
import analysis.coverage.CoverageResult;
import analysis.coverage.Spectrum;
import analysis.coverage.SuspiciousnessRanking;
import analysis.dataflow.AnalysisException;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointOptions;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.NonConvergenceException;
import analysis.dataflow.classic.AvailableExpressionsAnalysis;
import analysis.dataflow.classic.LiveVariableAnalysis;
import analysis.dataflow.classic.ReachingDefinitionsAnalysis;
import analysis.dataflow.numeric.ConstantPropagationDomain;
import analysis.dataflow.numeric.ConstantSetDomain;
import analysis.dataflow.numeric.IntervalDomain;
import analysis.dataflow.numeric.NumericAnalysis;
import analysis.dataflow.numeric.NumericDomain;
import analysis.dataflow.numeric.SignDomain;
import analysis.dataflow.util.AbstractState;
import analysis.dataflow.util.AbstractValue;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import analysis.interpreter.InterpreterOptions;
import analysis.optimizer.Optimizer;
import analysis.profile.PathInstrumenter;
import analysis.profile.PathProfiler;
import analysis.symbolic.ConstantSynthesizer;
import analysis.symbolic.ExplorationOptions;
import analysis.symbolic.ExplorationResult;
import analysis.symbolic.SolverResult;
import analysis.symbolic.SymbolicExecutor;
import analysis.symbolic.SynthesisExample;
import analysis.symbolic.TestCase;
import analysis.symbolic.Z3Solver;
import ast.Expr;
import ast.MalformedProgramException;
import ast.Program;

import com.beust.jcommander.ParameterException;

/**
 * Run the selected analyses on one Turtle program, see usage
 */
public class ChironMain {

    /**
     * Everything requested ran, possibly with incomplete results
     */
    public static final int EXIT_OK = 0;
    /**
     * The input file, the bindings or an auxiliary file could not be read
     */
    public static final int EXIT_PARSE_ERROR = 1;
    /**
     * The program could not be lowered to a CFG
     */
    public static final int EXIT_MALFORMED = 2;
    /**
     * Some analysis failed
     */
    public static final int EXIT_ENGINE_ERROR = 3;

    /**
     * Run the selected analyses
     *
     * @param args
     *            options and parameters see useage (pass in "-h") for details
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the selected analyses and compute the process exit code
     *
     * @param args
     *            options and parameters
     * @return exit code
     */
    public static int run(String[] args) {
        ChironOptions options;
        try {
            options = ChironOptions.getOptions(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(ChironOptions.getUseage());
            return EXIT_PARSE_ERROR;
        }
        if (options.shouldPrintUseage()) {
            System.err.println(ChironOptions.getUseage());
            return EXIT_OK;
        }

        int outputLevel = options.getOutputLevel();
        ControlFlowGraph cfg;
        Map<String, Long> bindings;
        try {
            cfg = loadGraph(options.getInputFile(), options.isBinaryInput(), outputLevel);
            bindings = parseBindings(options.getParams());
        } catch (ParseException | ParameterException e) {
            System.err.println("Could not read input: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IOException e) {
            System.err.println("Could not read " + options.getInputFile() + ": " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (MalformedProgramException e) {
            System.err.println("Malformed program: " + e.getMessage());
            return EXIT_MALFORMED;
        }

        List<Map<String, Long>> testInputs = new ArrayList<>();
        List<Map<String, Long>> testExpectations = new ArrayList<>();
        if (options.getTestsFile() != null) {
            try (Reader in = new BufferedReader(new FileReader(options.getTestsFile()))) {
                readTests(in, testInputs, testExpectations);
            } catch (ParseException e) {
                System.err.println("Could not read tests: " + e.getMessage());
                return EXIT_PARSE_ERROR;
            } catch (IOException e) {
                System.err.println("Could not read " + options.getTestsFile() + ": " + e.getMessage());
                return EXIT_PARSE_ERROR;
            }
        }

        boolean failed = false;
        if (options.shouldOptimize()) {
            try {
                cfg = runOptimizer(cfg, options);
            } catch (AnalysisException e) {
                System.err.println("Optimizer failed: " + e.getMessage());
                failed = true;
            }
        }
        writeGraph(cfg, options);

        InterpreterOptions interpreterOptions = new InterpreterOptions().setTurtleGuard(options.useTurtleGuard());
        if (options.shouldInterpret()) {
            runInterpreter(cfg, bindings, interpreterOptions, outputLevel);
        }
        if (options.shouldRunDataflow()) {
            failed |= !runDataflow(cfg, options);
        }
        if (options.shouldRunAbstractInterpretation()) {
            failed |= !runAbstractInterpretation(cfg, options);
        }
        if (options.shouldRunSymbolic()) {
            failed |= !runSymbolic(cfg, bindings, options);
        }
        if (options.shouldSynthesize()) {
            int code = runSynthesis(cfg, options);
            if (code == EXIT_PARSE_ERROR) {
                return code;
            }
            failed |= code != EXIT_OK;
        }
        List<Map<String, Long>> allInputs = new ArrayList<>();
        allInputs.add(bindings);
        allInputs.addAll(testInputs);
        if (options.shouldReportCoverage()) {
            runCoverage(cfg, allInputs, interpreterOptions);
        }
        if (options.shouldLocalizeFaults()) {
            if (options.getTestsFile() == null) {
                System.err.println("Fault localization needs a -tests file");
                return EXIT_PARSE_ERROR;
            }
            runFaultLocalization(cfg, testInputs, testExpectations, interpreterOptions);
        }
        if (options.shouldProfile()) {
            try {
                runProfiler(cfg, allInputs, interpreterOptions, outputLevel);
            } catch (AnalysisException e) {
                System.err.println("Path profiling failed: " + e.getMessage());
                failed = true;
            }
        }
        return failed ? EXIT_ENGINE_ERROR : EXIT_OK;
    }

    /**
     * Load a CFG from a JSON program, JSON IR or binary IR file
     *
     * @param fileName
     *            file to read
     * @param binary
     *            whether the file is binary IR
     * @param outputLevel
     *            logging level for the CFG builder
     * @return the graph
     * @throws IOException
     *             if the file cannot be read
     * @throws ParseException
     *             if the contents are not well-formed
     * @throws MalformedProgramException
     *             if a JSON program cannot be lowered
     */
    static ControlFlowGraph loadGraph(String fileName, boolean binary, int outputLevel) throws IOException {
        if (binary) {
            try (InputStream in = new BufferedInputStream(new FileInputStream(fileName))) {
                return BinaryIRFormat.read(in);
            }
        }
        JSONObject json;
        try (Reader in = new BufferedReader(new FileReader(fileName))) {
            json = new JSONObject(new JSONTokener(in));
        } catch (JSONException e) {
            throw new ParseException("Bad JSON in " + fileName + ": " + e.getMessage(), e);
        }
        if (JsonProgramReader.isProgram(json)) {
            Program program = JsonProgramReader.fromJSON(json);
            CFGBuilder builder = new CFGBuilder();
            builder.setOutputLevel(outputLevel);
            return builder.build(program);
        }
        return JsonIRFormat.fromJSON(json);
    }

    /**
     * Parse variable bindings written as a JSON object from names to integers
     *
     * @param text
     *            JSON text
     * @return bindings in the order written
     * @throws ParseException
     *             if the text is not an object of integers
     */
    static Map<String, Long> parseBindings(String text) {
        try {
            return bindings(new JSONObject(text));
        } catch (JSONException e) {
            throw new ParseException("Bad bindings " + text + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Long> bindings(JSONObject json) {
        Map<String, Long> result = new LinkedHashMap<>();
        Iterator<String> keys = json.keys();
        while (keys.hasNext()) {
            String var = keys.next();
            Object value = json.get(var);
            if (!(value instanceof Number)) {
                throw new ParseException("Binding for " + var + " is not an integer: " + value);
            }
            Number n = (Number) value;
            if (n.doubleValue() != n.longValue()) {
                throw new ParseException("Binding for " + var + " is not an integer: " + value);
            }
            result.put(var, n.longValue());
        }
        return result;
    }

    /**
     * Read a list of tests, each an object with "inputs" and "expected" bindings. "expected" may be omitted, a test
     * then passes when it does not fault.
     *
     * @param in
     *            source, not closed
     * @param inputs
     *            the inputs of each test are added here
     * @param expectations
     *            the expected final bindings of each test are added here
     * @throws ParseException
     *             if the input is not well-formed
     */
    static void readTests(Reader in, List<Map<String, Long>> inputs, List<Map<String, Long>> expectations) {
        try {
            JSONArray array = new JSONArray(new JSONTokener(in));
            for (int k = 0; k < array.length(); k++) {
                JSONObject test = array.getJSONObject(k);
                inputs.add(bindings(test.getJSONObject("inputs")));
                JSONObject expected = test.optJSONObject("expected");
                expectations.add(expected == null ? new LinkedHashMap<String, Long>() : bindings(expected));
            }
        } catch (JSONException e) {
            throw new ParseException("Bad tests: " + e.getMessage(), e);
        }
    }

    /**
     * Read synthesis examples, each an object with "inputs" and "outputs" bindings
     *
     * @param in
     *            source, not closed
     * @return the examples
     * @throws ParseException
     *             if the input is not well-formed
     */
    static List<SynthesisExample> readExamples(Reader in) {
        try {
            JSONArray array = new JSONArray(new JSONTokener(in));
            List<SynthesisExample> examples = new ArrayList<>();
            for (int k = 0; k < array.length(); k++) {
                JSONObject example = array.getJSONObject(k);
                examples.add(new SynthesisExample(bindings(example.getJSONObject("inputs")),
                                                  bindings(example.getJSONObject("outputs"))));
            }
            return examples;
        } catch (JSONException e) {
            throw new ParseException("Bad examples: " + e.getMessage(), e);
        }
    }

    /**
     * Whether a run passes a test: it must not fault and must bind every expected variable to its expected value
     *
     * @param run
     *            result of running the test inputs
     * @param expected
     *            expected final bindings
     * @return the verdict
     */
    static boolean passes(ExecutionResult run, Map<String, Long> expected) {
        if (run.isFault()) {
            return false;
        }
        for (Map.Entry<String, Long> e : expected.entrySet()) {
            if (!e.getValue().equals(run.getBindings().get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static FixpointEngine newEngine(ChironOptions options) {
        FixpointOptions fixpointOptions = new FixpointOptions().setWidening(options.useWidening())
                                                               .setCheckMonotonicity(options.shouldCheckMonotonicity())
                                                               .setDeadline(Deadline.afterMillis(options.getTimeoutMillis()));
        FixpointEngine engine = new FixpointEngine(fixpointOptions);
        engine.setOutputLevel(options.getOutputLevel());
        return engine;
    }

    private static ControlFlowGraph runOptimizer(ControlFlowGraph cfg, ChironOptions options) {
        Optimizer optimizer = new Optimizer(newEngine(options));
        optimizer.setOutputLevel(options.getOutputLevel());
        ControlFlowGraph optimized = optimizer.optimize(cfg);
        System.out.println("Optimized " + cfg.getName() + ": " + optimizer.getFoldedExpressions()
                + " expressions folded, " + optimizer.getFoldedBranches() + " branches folded, "
                + optimizer.getRemovedStores() + " dead stores removed, " + optimizer.getBypassedBlocks()
                + " blocks bypassed, " + cfg.getNumberOfBlocks() + " -> " + optimized.getNumberOfBlocks() + " blocks");
        if (options.getOutputLevel() >= 1) {
            System.out.println(PrettyPrinter.cfgString(optimized));
        }
        return optimized;
    }

    private static void writeGraph(ControlFlowGraph cfg, ChironOptions options) {
        if (options.getDotFile() != null) {
            CFGWriter.writeToFile(cfg, options.getDotFile());
        }
        if (options.getJsonOutFile() != null) {
            try (Writer out = new BufferedWriter(new FileWriter(options.getJsonOutFile()))) {
                JsonIRFormat.write(cfg, out);
                System.err.println("JSON IR written to: " + options.getJsonOutFile());
            } catch (IOException e) {
                System.err.println("Could not write JSON IR to file, " + options.getJsonOutFile() + ", "
                        + e.getMessage());
            }
        }
        if (options.getBinaryOutFile() != null) {
            try (OutputStream out = new BufferedOutputStream(new FileOutputStream(options.getBinaryOutFile()))) {
                BinaryIRFormat.write(cfg, out);
                System.err.println("Binary IR written to: " + options.getBinaryOutFile());
            } catch (IOException e) {
                System.err.println("Could not write binary IR to file, " + options.getBinaryOutFile() + ", "
                        + e.getMessage());
            }
        }
    }

    private static void runInterpreter(ControlFlowGraph cfg, Map<String, Long> bindings,
                                       InterpreterOptions interpreterOptions, int outputLevel) {
        ConcreteInterpreter interpreter = new ConcreteInterpreter(interpreterOptions);
        interpreter.setOutputLevel(outputLevel);
        ExecutionResult result = interpreter.run(cfg, bindings);
        System.out.println(result);
        if (outputLevel >= 1) {
            for (String line : result.getTurtleLog()) {
                System.out.println("\t" + line);
            }
        }
    }

    /**
     * @return false if some analysis failed
     */
    private static boolean runDataflow(ControlFlowGraph cfg, ChironOptions options) {
        boolean ok = true;
        FixpointEngine engine = newEngine(options);
        try {
            LiveVariableAnalysis live = new LiveVariableAnalysis(cfg.getVariables());
            printResult("Live variables", cfg, live.analyze(cfg, engine));
        } catch (NonConvergenceException e) {
            reportNonConvergence("Live variables", e);
        } catch (AnalysisException e) {
            System.err.println("Live variables failed: " + e.getMessage());
            ok = false;
        }
        try {
            ReachingDefinitionsAnalysis reaching = new ReachingDefinitionsAnalysis(cfg);
            printResult("Reaching definitions", cfg, reaching.analyze(cfg, engine));
        } catch (NonConvergenceException e) {
            reportNonConvergence("Reaching definitions", e);
        } catch (AnalysisException e) {
            System.err.println("Reaching definitions failed: " + e.getMessage());
            ok = false;
        }
        try {
            AvailableExpressionsAnalysis available = new AvailableExpressionsAnalysis();
            printResult("Available expressions", cfg, available.analyze(cfg, engine));
        } catch (NonConvergenceException e) {
            reportNonConvergence("Available expressions", e);
        } catch (AnalysisException e) {
            System.err.println("Available expressions failed: " + e.getMessage());
            ok = false;
        }
        return ok;
    }

    /**
     * @return false if the analysis failed
     */
    private static boolean runAbstractInterpretation(ControlFlowGraph cfg, ChironOptions options) {
        try {
            switch (options.getDomain()) {
            case "sign":
                runNumeric(cfg, new SignDomain(), options);
                break;
            case "constant":
                runNumeric(cfg, new ConstantPropagationDomain(), options);
                break;
            case "constset":
                runNumeric(cfg, new ConstantSetDomain(), options);
                break;
            default:
                runNumeric(cfg, new IntervalDomain(), options);
                break;
            }
            return true;
        } catch (NonConvergenceException e) {
            reportNonConvergence("Abstract interpretation", e);
            return true;
        } catch (AnalysisException e) {
            System.err.println("Abstract interpretation failed: " + e.getMessage());
            return false;
        }
    }

    private static <V extends AbstractValue<V>> void runNumeric(ControlFlowGraph cfg, NumericDomain<V> domain,
                                                                ChironOptions options) {
        NumericAnalysis<V> analysis = new NumericAnalysis<>(domain);
        FixpointResult<AbstractState<V>> result = analysis.analyze(cfg, newEngine(options));
        printResult("Abstract interpretation (" + domain.getName() + ")", cfg, result);
        System.out.println("At exit: " + analysis.getExitValues(cfg, result));
    }

    private static <S> void printResult(String name, ControlFlowGraph cfg, FixpointResult<S> result) {
        System.out.println(name + (result.isComplete() ? "" : " (INCOMPLETE, deadline passed)") + " after "
                + result.getIterations() + " iterations");
        for (BasicBlock bb : cfg.getReversePostorder()) {
            System.out.println("\t" + bb.getLabel() + " in: " + result.getInput(bb) + " out: " + result.getOutput(bb));
        }
    }

    private static void reportNonConvergence(String name, NonConvergenceException e) {
        System.out.println(name + " did not converge: " + e.getMessage());
        if (e.getPartialResult() != null) {
            System.out.println("\tpartial result after " + e.getPartialResult().getIterations() + " iterations");
        }
    }

    /**
     * @return false if the exploration failed
     */
    private static boolean runSymbolic(ControlFlowGraph cfg, Map<String, Long> bindings, ChironOptions options) {
        SymbolicExecutor executor = newExecutor(options);
        Map<String, Expr> initial = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : bindings.entrySet()) {
            initial.put(e.getKey(), Expr.constant(e.getValue()));
        }
        try {
            ExplorationResult result = executor.explore(cfg,
                                                        initial,
                                                        options.getPathBound(),
                                                        options.getTimeoutMillis(),
                                                        new Z3Solver());
            System.out.println("Symbolic execution" + (result.isIncomplete() ? " (INCOMPLETE)" : "") + ": "
                    + result.getStatistics());
            for (TestCase t : result.getTestCases()) {
                System.out.println("\t" + t);
            }
            return true;
        } catch (RuntimeException e) {
            System.err.println("Symbolic execution failed: " + e);
            return false;
        }
    }

    private static SymbolicExecutor newExecutor(ChironOptions options) {
        SymbolicExecutor executor = new SymbolicExecutor(new ExplorationOptions().setOrder(options.getSearchOrder()));
        executor.setOutputLevel(options.getOutputLevel());
        return executor;
    }

    /**
     * @return exit code for the synthesis step
     */
    private static int runSynthesis(ControlFlowGraph cfg, ChironOptions options) {
        List<SynthesisExample> examples;
        try (Reader in = new BufferedReader(new FileReader(options.getExamplesFile()))) {
            examples = readExamples(in);
        } catch (ParseException | ParameterException e) {
            System.err.println("Could not read examples: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IOException e) {
            System.err.println("Could not read " + options.getExamplesFile() + ": " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }
        Set<String> parameters = new LinkedHashSet<>(options.getConstParams());
        ConstantSynthesizer synthesizer = new ConstantSynthesizer(newExecutor(options),
                                                                  options.getPathBound(),
                                                                  options.getTimeoutMillis());
        synthesizer.setOutputLevel(options.getOutputLevel());
        try {
            SolverResult result = synthesizer.synthesize(cfg, parameters, examples, new Z3Solver());
            System.out.println("Synthesis: " + result);
            return EXIT_OK;
        } catch (RuntimeException e) {
            System.err.println("Synthesis failed: " + e);
            return EXIT_ENGINE_ERROR;
        }
    }

    private static void runCoverage(ControlFlowGraph cfg, List<Map<String, Long>> inputs,
                                    InterpreterOptions interpreterOptions) {
        CoverageOracle oracle = new CoverageOracle(cfg, new ConcreteInterpreter(interpreterOptions));
        for (Map<String, Long> input : inputs) {
            CoverageResult result = oracle.run(input);
            System.out.println("Coverage for " + input + ": " + result);
        }
        System.out.printf("Cumulative coverage: %d of %d blocks (%.1f%%)%n",
                          oracle.getCumulativeCoverage().size(),
                          cfg.getNumberOfBlocks(),
                          100 * oracle.getCoverageRatio());
    }

    private static void runFaultLocalization(ControlFlowGraph cfg, List<Map<String, Long>> inputs,
                                             List<Map<String, Long>> expectations,
                                             InterpreterOptions interpreterOptions) {
        CoverageOracle oracle = new CoverageOracle(cfg, new ConcreteInterpreter(interpreterOptions));
        Spectrum spectrum = new Spectrum(cfg);
        for (int k = 0; k < inputs.size(); k++) {
            CoverageResult run = oracle.run(inputs.get(k));
            spectrum.addTest(run, passes(run.getExecution(), expectations.get(k)));
        }
        System.out.println("Suspiciousness (" + spectrum.getFailedCount() + " of " + inputs.size()
                + " tests failed):");
        System.out.println(new SuspiciousnessRanking(spectrum));
    }

    private static void runProfiler(ControlFlowGraph cfg, List<Map<String, Long>> inputs,
                                    InterpreterOptions interpreterOptions, int outputLevel) {
        PathProfiler profiler = new PathProfiler(cfg);
        profiler.setOutputLevel(outputLevel);
        PathInstrumenter instrumenter = new PathInstrumenter(profiler.getNumbering());
        instrumenter.setOutputLevel(outputLevel);
        ControlFlowGraph instrumented = instrumenter.instrument();
        if (outputLevel >= 2) {
            System.out.println(instrumented);
        }
        ConcreteInterpreter interpreter = new ConcreteInterpreter(interpreterOptions);
        for (Map<String, Long> input : inputs) {
            interpreter.run(instrumented, input, profiler.recorder());
        }
        System.out.println(profiler.report());
    }
}
