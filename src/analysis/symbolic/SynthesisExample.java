package analysis.symbolic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input/output example for {@link ConstantSynthesizer}
 */
public final class SynthesisExample {

    private final Map<String, Long> inputs;
    private final Map<String, Long> expectedOutputs;

    /**
     * @param inputs
     *            initial values of input variables
     * @param expectedOutputs
     *            values some variables must have when the program ends
     */
    public SynthesisExample(Map<String, Long> inputs, Map<String, Long> expectedOutputs) {
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.expectedOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(expectedOutputs));
    }

    public Map<String, Long> getInputs() {
        return inputs;
    }

    public Map<String, Long> getExpectedOutputs() {
        return expectedOutputs;
    }

    @Override
    public String toString() {
        return inputs + " => " + expectedOutputs;
    }
}
