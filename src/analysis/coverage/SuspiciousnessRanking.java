package analysis.coverage;

import ir.BasicBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks blocks by their Ochiai suspiciousness, failed(b) / sqrt(totalFailed * (failed(b) + passed(b))), where failed(b)
 * and passed(b) count the failing and passing tests covering b. Blocks no test covers, or any block when no test
 * failed, score 0.
 */
public class SuspiciousnessRanking {

    /**
     * Score of one block
     */
    public static final class Entry {
        private final BasicBlock block;
        private final double score;

        Entry(BasicBlock block, double score) {
            this.block = block;
            this.score = score;
        }

        public BasicBlock getBlock() {
            return block;
        }

        public double getScore() {
            return score;
        }

        @Override
        public String toString() {
            return block + ": " + String.format("%.4f", score);
        }
    }

    private final List<Entry> entries;

    /**
     * Compute the ranking
     *
     * @param spectrum
     *            coverage and verdicts of the tests
     */
    public SuspiciousnessRanking(Spectrum spectrum) {
        int totalFailed = spectrum.getFailedCount();
        List<Entry> scored = new ArrayList<>();
        for (BasicBlock bb : spectrum.getGraph()) {
            scored.add(new Entry(bb, ochiai(spectrum.countCovering(bb, false), spectrum.countCovering(bb, true),
                                            totalFailed)));
        }
        Collections.sort(scored, new Comparator<Entry>() {
            @Override
            public int compare(Entry o1, Entry o2) {
                int c = Double.compare(o2.score, o1.score);
                return c != 0 ? c : Integer.compare(o1.block.getId(), o2.block.getId());
            }
        });
        this.entries = Collections.unmodifiableList(scored);
    }

    /**
     * Ochiai coefficient
     *
     * @param failedCovering
     *            failing tests covering the block
     * @param passedCovering
     *            passing tests covering the block
     * @param totalFailed
     *            failing tests overall
     * @return suspiciousness in [0, 1]
     */
    public static double ochiai(int failedCovering, int passedCovering, int totalFailed) {
        double denominator = Math.sqrt((double) totalFailed * (failedCovering + passedCovering));
        return denominator == 0 ? 0 : failedCovering / denominator;
    }

    /**
     * @return every block of the graph, most suspicious first (ties by block id)
     */
    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * @param bb
     *            block
     * @return 1-based rank of bb
     */
    public int getRank(BasicBlock bb) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).block.equals(bb)) {
                return i + 1;
            }
        }
        throw new IllegalArgumentException(bb + " is not ranked");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry e : entries) {
            sb.append(e).append("\n");
        }
        return sb.toString();
    }
}
