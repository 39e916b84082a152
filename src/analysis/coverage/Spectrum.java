package analysis.coverage;

import ir.BasicBlock;
import ir.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Coverage matrix for fault localization: for each test, the blocks it covered and whether it passed
 */
public class Spectrum {

    /**
     * One row of the matrix
     */
    public static final class Row {
        private final Set<Integer> covered;
        private final boolean passed;

        Row(Set<Integer> covered, boolean passed) {
            this.covered = Collections.unmodifiableSet(new LinkedHashSet<>(covered));
            this.passed = passed;
        }

        public Set<Integer> getCovered() {
            return covered;
        }

        public boolean isPassed() {
            return passed;
        }
    }

    private final ControlFlowGraph cfg;
    private final List<Row> rows = new ArrayList<>();

    public Spectrum(ControlFlowGraph cfg) {
        this.cfg = cfg;
    }

    /**
     * Add a test
     *
     * @param coveredBlocks
     *            ids of the blocks the test visited
     * @param passed
     *            verdict of the test
     */
    public void addTest(Set<Integer> coveredBlocks, boolean passed) {
        for (Integer id : coveredBlocks) {
            if (cfg.getBlock(id) == null) {
                throw new IllegalArgumentException("No block " + id + " in " + cfg.getName());
            }
        }
        rows.add(new Row(coveredBlocks, passed));
    }

    /**
     * Add a test from a coverage oracle run
     *
     * @param run
     *            coverage of the test
     * @param passed
     *            verdict of the test
     */
    public void addTest(CoverageResult run, boolean passed) {
        addTest(run.getCoveredBlocks(), passed);
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int getFailedCount() {
        int failed = 0;
        for (Row r : rows) {
            if (!r.passed) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * @param bb
     *            block
     * @param passed
     *            verdict to count
     * @return number of tests with the given verdict that covered bb
     */
    public int countCovering(BasicBlock bb, boolean passed) {
        int count = 0;
        for (Row r : rows) {
            if (r.passed == passed && r.covered.contains(bb.getId())) {
                count++;
            }
        }
        return count;
    }

    public ControlFlowGraph getGraph() {
        return cfg;
    }
}
