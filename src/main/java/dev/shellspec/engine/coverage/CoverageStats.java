package dev.shellspec.engine.coverage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Line coverage of one file.
 *
 * @param executableLines line numbers the classifier counts
 * @param coveredLines executable line numbers seen by the trace hook
 */
public record CoverageStats(SortedSet<Integer> executableLines, SortedSet<Integer> coveredLines) {
    public static final CoverageStats EMPTY = new CoverageStats(new TreeSet<>(), new TreeSet<>());

    public CoverageStats {
        executableLines = Collections.unmodifiableSortedSet(new TreeSet<>(executableLines));
        coveredLines = Collections.unmodifiableSortedSet(new TreeSet<>(coveredLines));
    }

    /**
     * @param lines source lines, first element is line 1
     * @param traced line numbers recorded for the file, executable or not
     */
    public static CoverageStats of(List<String> lines, Set<Integer> traced) {
        SortedSet<Integer> executable = new TreeSet<>();
        for (int i = 0; i < lines.size(); i++) {
            if (LineClassifier.isExecutable(lines.get(i))) {
                executable.add(i + 1);
            }
        }
        SortedSet<Integer> covered = new TreeSet<>(traced);
        covered.retainAll(executable);
        return new CoverageStats(executable, covered);
    }

    public int executable() {
        return executableLines.size();
    }

    public int covered() {
        return coveredLines.size();
    }

    public double percent() {
        return percent(covered(), executable());
    }

    public boolean isCovered(int line) {
        return coveredLines.contains(line);
    }

    /**
     * {@code "<executable> <covered> <percent>"}, e.g. {@code "12 9 75.0"}; {@code "0 0 0"} without executable lines.
     */
    public String tokens() {
        if (executable() == 0) {
            return "0 0 0";
        }
        return executable() + " " + covered() + " " + formatPercent(percent());
    }

    static double percent(int covered, int executable) {
        if (executable == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(covered * 100L)
            .divide(BigDecimal.valueOf(executable), 1, RoundingMode.HALF_UP)
            .doubleValue();
    }

    static String formatPercent(double percent) {
        return BigDecimal.valueOf(percent).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
