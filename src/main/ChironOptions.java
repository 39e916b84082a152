package main;

import java.util.ArrayList;
import java.util.List;

import analysis.symbolic.ExplorationOptions.SearchOrder;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options for {@link ChironMain}. Analysis flags compose: every selected analysis is run, in a fixed
 * order, on the same program.
 */
public final class ChironOptions {

    /**
     * Default time budget in seconds for each analysis that honors one
     */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;

    /**
     * Program or IR file to analyze
     */
    @Parameter(description = "<program.json | ir.json | ir.bin>")
    private List<String> files = new ArrayList<>();

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * Whether the input is in the binary IR format
     */
    @Parameter(names = { "-bin" }, description = "If set, read the input file as binary IR rather than JSON")
    private boolean binaryInput = false;

    /**
     * Initial bindings as a JSON object
     */
    @Parameter(names = { "-d", "-params" }, description = "Initial variable bindings as a JSON object, e.g. {\":x\": 3}")
    private String params = "{}";

    /**
     * Time budget in seconds
     */
    @Parameter(names = { "-timeout" }, validateWith = ChironOptions.PositiveValidator.class, description = "Time budget in seconds for the fixpoint engine and the symbolic executor")
    private Integer timeout = DEFAULT_TIMEOUT_SECONDS;

    /**
     * Run the concrete interpreter
     */
    @Parameter(names = { "-interpret", "-run" }, description = "Run the program with the concrete interpreter on the initial bindings")
    private boolean interpret = false;

    /**
     * Run the optimizer
     */
    @Parameter(names = { "-optimize" }, description = "Optimize the CFG; later analyses run on the optimized graph")
    private boolean optimize = false;

    /**
     * Run the classic data-flow analyses
     */
    @Parameter(names = { "-dataflow" }, description = "Run live variables, reaching definitions and available expressions")
    private boolean dataflow = false;

    /**
     * Run numeric abstract interpretation
     */
    @Parameter(names = { "-ai" }, description = "Run numeric abstract interpretation, see -domain")
    private boolean abstractInterpretation = false;

    /**
     * Numeric domain for abstract interpretation
     */
    @Parameter(names = { "-domain" }, validateWith = ChironOptions.DomainValidator.class, description = "Numeric domain for -ai: interval, sign, constant or constset")
    private String domain = "interval";

    /**
     * Disable widening (only sensible for finite-height domains)
     */
    @Parameter(names = { "-noWidening" }, description = "If set, do not widen at loop heads")
    private boolean noWidening = false;

    /**
     * Check monotonicity of the transfer functions while iterating
     */
    @Parameter(names = { "-checkMonotone" }, description = "If set, check that every transfer function application is monotone")
    private boolean checkMonotone = false;

    /**
     * Run the symbolic executor
     */
    @Parameter(names = { "-symbolic" }, description = "Generate test cases by symbolic execution")
    private boolean symbolic = false;

    /**
     * Loop bound for symbolic execution
     */
    @Parameter(names = { "-bound" }, validateWith = ChironOptions.NonNegativeValidator.class, description = "Maximum number of iterations of each loop on one symbolic path")
    private Integer pathBound = 5;

    /**
     * Search order for symbolic execution
     */
    @Parameter(names = { "-order" }, validateWith = ChironOptions.OrderValidator.class, description = "Symbolic search order: dfs or bfs")
    private String order = "dfs";

    /**
     * Run constant synthesis
     */
    @Parameter(names = { "-synth" }, description = "Synthesize values for the -constparams variables from the -examples file")
    private boolean synthesize = false;

    /**
     * Input/output examples for synthesis
     */
    @Parameter(names = { "-examples" }, description = "JSON file with a list of {\"inputs\": {...}, \"outputs\": {...}} examples")
    private String examplesFile;

    /**
     * Variables to synthesize
     */
    @Parameter(names = { "-constparams" }, description = "Comma separated variables whose constant values are synthesized")
    private List<String> constParams = new ArrayList<>();

    /**
     * Run the coverage oracle
     */
    @Parameter(names = { "-fuzz" }, description = "Report block coverage for the initial bindings and every -tests input")
    private boolean coverage = false;

    /**
     * Run spectrum based fault localization
     */
    @Parameter(names = { "-sbfl" }, description = "Rank blocks by Ochiai suspiciousness using the -tests file")
    private boolean faultLocalization = false;

    /**
     * Tests for fault localization and coverage
     */
    @Parameter(names = { "-tests" }, description = "JSON file with a list of {\"inputs\": {...}, \"expected\": {...}} tests")
    private String testsFile;

    /**
     * Run Ball-Larus path profiling
     */
    @Parameter(names = { "-profile" }, description = "Profile the acyclic paths taken for the initial bindings and every -tests input")
    private boolean profile = false;

    /**
     * Disable the turtle canvas check
     */
    @Parameter(names = { "-noTurtleGuard" }, description = "If set, the interpreter does not fault when the turtle leaves the canvas")
    private boolean noTurtleGuard = false;

    /**
     * Graphviz output
     */
    @Parameter(names = { "-dot" }, description = "Write the (possibly optimized) CFG in graphviz dot format, .dot is appended to the name")
    private String dotFile;

    /**
     * JSON IR output
     */
    @Parameter(names = { "-saveJson" }, description = "Write the (possibly optimized) CFG to this file as JSON IR")
    private String jsonOutFile;

    /**
     * Binary IR output
     */
    @Parameter(names = { "-saveBin" }, description = "Write the (possibly optimized) CFG to this file as binary IR")
    private String binaryOutFile;

    private ChironOptions() {
        // Use getOptions
    }

    /**
     * Parse the command line
     *
     * @param args
     *            command line arguments
     * @return options, defaults where no argument was given
     * @throws ParameterException
     *             if an argument is not valid
     */
    public static ChironOptions getOptions(String[] args) {
        ChironOptions o = new ChironOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    /**
     * Print the parameter mapping for the main method
     *
     * @return String containing the documentation
     */
    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        ChironOptions o = new ChironOptions();
        JCommander jc = new JCommander(o);
        jc.setProgramName("chiron");
        jc.getUsageFormatter().usage(sb);
        return sb.toString() + "\n" + exitCodeUsage();
    }

    private static String exitCodeUsage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Exit codes:\n");
        sb.append("\t0 - success, including incomplete or non-converged results\n");
        sb.append("\t1 - the input file, bindings or examples could not be read\n");
        sb.append("\t2 - the program is malformed\n");
        sb.append("\t3 - an analysis failed\n");
        return sb.toString();
    }

    /**
     * Validate that an integer parameter is positive
     */
    public static class PositiveValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) <= 0) {
                throw new ParameterException(name + " must be positive, found " + value);
            }
        }
    }

    /**
     * Validate that an integer parameter is not negative
     */
    public static class NonNegativeValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) < 0) {
                throw new ParameterException(name + " must not be negative, found " + value);
            }
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterException(name + " must be an integer, found " + value);
        }
    }

    /**
     * Validate the requested numeric domain
     */
    public static class DomainValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            switch (value) {
            case "interval":
            case "sign":
            case "constant":
            case "constset":
                return;
            default:
                throw new ParameterException("Invalid domain: " + value + ", expected interval, sign, constant or constset");
            }
        }
    }

    /**
     * Validate the requested search order
     */
    public static class OrderValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (!value.equalsIgnoreCase("dfs") && !value.equalsIgnoreCase("bfs")) {
                throw new ParameterException("Invalid search order: " + value + ", expected dfs or bfs");
            }
        }
    }

    /**
     * Should we print the useage information
     *
     * @return true if the usage info should be printed
     */
    public boolean shouldPrintUseage() {
        return help;
    }

    /**
     * File to analyze
     *
     * @return name of the program or IR file
     */
    public String getInputFile() {
        if (files.size() != 1) {
            throw new ParameterException("Specify exactly one program or IR file, found " + files);
        }
        return files.get(0);
    }

    /**
     * Get the level of logging to the console
     *
     * @return level of logging, higher means more output
     */
    public Integer getOutputLevel() {
        return outputLevel;
    }

    public boolean isBinaryInput() {
        return binaryInput;
    }

    /**
     * Initial bindings as written on the command line
     *
     * @return JSON object text
     */
    public String getParams() {
        return params;
    }

    /**
     * Time budget for the engines that honor one
     *
     * @return budget in milliseconds
     */
    public long getTimeoutMillis() {
        return timeout * 1000L;
    }

    public boolean shouldInterpret() {
        return interpret;
    }

    public boolean shouldOptimize() {
        return optimize;
    }

    public boolean shouldRunDataflow() {
        return dataflow;
    }

    public boolean shouldRunAbstractInterpretation() {
        return abstractInterpretation;
    }

    public String getDomain() {
        return domain;
    }

    public boolean useWidening() {
        return !noWidening;
    }

    public boolean shouldCheckMonotonicity() {
        return checkMonotone;
    }

    public boolean shouldRunSymbolic() {
        return symbolic;
    }

    public Integer getPathBound() {
        return pathBound;
    }

    public SearchOrder getSearchOrder() {
        return SearchOrder.valueOf(order.toUpperCase());
    }

    public boolean shouldSynthesize() {
        return synthesize;
    }

    /**
     * Examples for synthesis
     *
     * @return name of the examples file
     */
    public String getExamplesFile() {
        if (examplesFile == null) {
            throw new ParameterException("Specify the synthesis examples with -examples");
        }
        return examplesFile;
    }

    public List<String> getConstParams() {
        return constParams;
    }

    public boolean shouldReportCoverage() {
        return coverage;
    }

    public boolean shouldLocalizeFaults() {
        return faultLocalization;
    }

    /**
     * Tests file, may be null unless fault localization is requested
     *
     * @return name of the tests file or null
     */
    public String getTestsFile() {
        return testsFile;
    }

    public boolean shouldProfile() {
        return profile;
    }

    public boolean useTurtleGuard() {
        return !noTurtleGuard;
    }

    public String getDotFile() {
        return dotFile;
    }

    public String getJsonOutFile() {
        return jsonOutFile;
    }

    public String getBinaryOutFile() {
        return binaryOutFile;
    }
}
