package com.example.assoc.loadgen;

import com.example.assoc.btb.BranchType;
import com.example.assoc.btb.SimpleBtb;
import com.example.assoc.indexing.ThreadedAddress;
import com.example.assoc.replacement.ReplacementPolicies;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Replays synthetic branch streams against a BTB and prints the hit rate per
 * replacement policy.
 *
 * Usage: BranchTraceGenerator &lt;scenario&gt; [accesses] [entries] [associativity]
 * <ul>
 *   <li>A: Zipf-distributed branch sites, optionally mixed with a streaming scan</li>
 *   <li>D: a small hot loop interleaved with never-repeating branches (scan resistance)</li>
 * </ul>
 */
public class BranchTraceGenerator {

    static final long CODE_BASE = 0x400000L;
    static final long SCAN_BASE = 0x10000000L;
    static final int INST_BYTES = 4;
    // wide enough that code and scan regions never alias
    static final int TAG_BITS = 32;

    private static final int SEEDS = 5;

    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Usage: BranchTraceGenerator <scenario> [accesses] [entries] [associativity]");
            return;
        }

        String scenario = args[0];
        int accesses = args.length > 1 ? Integer.parseInt(args[1]) : 1_000_000;
        int entries = args.length > 2 ? Integer.parseInt(args[2]) : 1024;
        int associativity = args.length > 3 ? Integer.parseInt(args[3]) : 4;

        switch (scenario) {
            case "A":
                int universe = args.length > 4 ? Integer.parseInt(args[4]) : 20_000;
                double alpha = args.length > 5 ? Double.parseDouble(args[5]) : 0.9;
                double scanRatio = args.length > 6 ? Double.parseDouble(args[6]) : 0.0;
                System.out.println(String.format(
                    "Scenario A (Accesses=%d, Entries=%d, Ways=%d, Universe=%d, Alpha=%.2f, ScanRatio=%.2f)",
                    accesses, entries, associativity, universe, alpha, scanRatio));
                for (String policy : ReplacementPolicies.NAMES) {
                    DescriptiveStatistics stats = new DescriptiveStatistics();
                    for (long seed = 1; seed <= SEEDS; seed++) {
                        SimpleBtb btb = newBtb(entries, associativity, policy, seed);
                        stats.addValue(runZipf(btb, accesses, universe, alpha, scanRatio, seed));
                    }
                    report(policy, stats);
                }
                break;
            case "D":
                int hotBranches = args.length > 4 ? Integer.parseInt(args[4]) : entries / 2;
                System.out.println(String.format(
                    "Scenario D (Accesses=%d, Entries=%d, Ways=%d, HotBranches=%d)",
                    accesses, entries, associativity, hotBranches));
                for (String policy : ReplacementPolicies.NAMES) {
                    DescriptiveStatistics stats = new DescriptiveStatistics();
                    for (long seed = 1; seed <= SEEDS; seed++) {
                        SimpleBtb btb = newBtb(entries, associativity, policy, seed);
                        stats.addValue(runScan(btb, accesses, hotBranches, 0.9, seed));
                    }
                    report(policy, stats);
                }
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
    }

    /**
     * Zipf-distributed branch sites, with a fraction of accesses going to
     * unique branches that are never seen again.
     *
     * @return hit rate in [0, 1]
     */
    public static double runZipf(SimpleBtb btb, int accesses, int universe, double alpha, double scanRatio, long seed) {
        RandomGenerator random = new Well19937c(seed);
        ZipfDistribution zipf = new ZipfDistribution(random, universe, alpha);
        long scanIndex = 0;
        long hits = 0;

        for (int i = 0; i < accesses; i++) {
            long pc;
            if (scanRatio > 0 && random.nextDouble() < scanRatio) {
                pc = SCAN_BASE + (scanIndex++) * INST_BYTES;
            } else {
                pc = CODE_BASE + (long) zipf.sample() * INST_BYTES;
            }
            if (access(btb, pc)) {
                hits++;
            }
        }
        return accesses == 0 ? 0 : (double) hits / accesses;
    }

    /**
     * A uniform hot loop over {@code hotBranches} sites; the remaining
     * accesses are a streaming scan.
     *
     * @return hit rate in [0, 1]
     */
    public static double runScan(SimpleBtb btb, int accesses, int hotBranches, double hotRatio, long seed) {
        RandomGenerator random = new Well19937c(seed);
        long scanIndex = 0;
        long hits = 0;

        for (int i = 0; i < accesses; i++) {
            long pc;
            if (random.nextDouble() < hotRatio) {
                pc = CODE_BASE + (long) random.nextInt(hotBranches) * INST_BYTES;
            } else {
                pc = SCAN_BASE + (scanIndex++) * INST_BYTES;
            }
            if (access(btb, pc)) {
                hits++;
            }
        }
        return accesses == 0 ? 0 : (double) hits / accesses;
    }

    static SimpleBtb newBtb(int entries, int associativity, String policy, long seed) {
        return new SimpleBtb("trace-btb", entries, associativity, INST_BYTES, TAG_BITS, 1, 2, 1,
            ReplacementPolicies.create(policy, seed));
    }

    // Fetch-time lookup, then the update a resolved branch would cause on a miss
    private static boolean access(SimpleBtb btb, long pc) {
        ThreadedAddress key = new ThreadedAddress(pc, 0);
        if (btb.lookup(key, BranchType.DIRECT_UNCOND).isPresent()) {
            return true;
        }
        btb.update(key, pc + 64, BranchType.DIRECT_UNCOND, null);
        return false;
    }

    private static void report(String policy, DescriptiveStatistics stats) {
        System.out.println(String.format("  %-14s hit rate mean=%.4f stddev=%.4f min=%.4f max=%.4f",
            policy, stats.getMean(), stats.getStandardDeviation(), stats.getMin(), stats.getMax()));
    }
}
