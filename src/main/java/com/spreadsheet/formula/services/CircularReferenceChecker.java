package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether committing a formula to a cell would close a reference loop.
 * <p>
 * The references of a formula are the alphanumeric runs of its text that read
 * as cell addresses (this also picks up references the parser would ignore,
 * e.g. inside string literals) plus its parsed references and ranges.
 * A range is never expanded: it closes a loop when it covers the target, and
 * otherwise only the formula cells stored inside it are followed.
 * Over-reporting is accepted here; missing a loop is not.
 */
@Component
public class CircularReferenceChecker {

    private static final Logger log = LoggerFactory.getLogger(CircularReferenceChecker.class);

    private final int maxDepth;

    public CircularReferenceChecker(FormulaProperties properties) {
        this.maxDepth = properties.getMaxDepth();
    }

    /**
     * Every maximal run of ASCII letters and digits that parses as a cell
     * address, in order of appearance. Duplicates are kept.
     */
    public static List<CellAddress> extractReferences(String text) {
        List<CellAddress> references = new ArrayList<>();
        if (text == null) {
            return references;
        }
        int i = 0;
        int length = text.length();
        while (i < length) {
            if (!isAsciiAlphanumeric(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < length && isAsciiAlphanumeric(text.charAt(i))) {
                i++;
            }
            CellAddress.parse(text.substring(start, i)).ifPresent(references::add);
        }
        return references;
    }

    /**
     * True when the formula, stored in target, would make target depend on itself.
     * Text that does not start with '=' is never circular.
     */
    public boolean wouldCreateCircularReference(String formula, CellAddress target, Spreadsheet grid) {
        if (!FormulaEvaluator.isFormula(formula)) {
            return false;
        }
        return anyReaches(formula, target, grid, new HashSet<>(), 1);
    }

    /**
     * Throws CircularReferenceException when the formula would close a loop.
     */
    public void check(String formula, CellAddress target, Spreadsheet grid) {
        if (wouldCreateCircularReference(formula, target, grid)) {
            throw new CircularReferenceException("Circular reference: " + formula + " in " + target.getLabel());
        }
    }

    // path holds the cells on the current DFS branch only
    private boolean reaches(CellAddress current, CellAddress target, Spreadsheet grid,
                            Set<CellAddress> path, int depth) {
        if (current.equals(target)) {
            return true;
        }
        if (path.contains(current)) {
            return false;
        }
        if (depth > maxDepth) {
            log.warn("Reference chain from {} is deeper than {} cells, treating it as circular",
                    target.getLabel(), maxDepth);
            return true;
        }
        CellData cell = grid.getCell(current);
        if (!cell.hasFormula()) {
            return false;
        }
        path.add(current);
        try {
            return anyReaches(cell.getFormula(), target, grid, path, depth + 1);
        } finally {
            path.remove(current);
        }
    }

    private boolean anyReaches(String formula, CellAddress target, Spreadsheet grid,
                               Set<CellAddress> path, int depth) {
        for (CellRange range : rangesOf(formula)) {
            if (range.contains(target)) {
                return true;
            }
            for (CellAddress next : formulaCellsIn(range, grid)) {
                if (reaches(next, target, grid, path, depth)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Set<CellRange> rangesOf(String formula) {
        Set<CellRange> ranges = new LinkedHashSet<>();
        for (CellAddress reference : extractReferences(formula)) {
            ranges.add(CellRange.of(reference));
        }
        ranges.addAll(CellReferenceExtractor.ranges(formula));
        return ranges;
    }

    // Bounded by the cells actually stored, however large the range
    private static List<CellAddress> formulaCellsIn(CellRange range, Spreadsheet grid) {
        List<CellAddress> cells = new ArrayList<>();
        if (range.isSingleCell()) {
            cells.add(range.getStart());
            return cells;
        }
        for (Map.Entry<CellAddress, CellData> entry : grid.getCells().entrySet()) {
            if (entry.getValue().hasFormula() && range.contains(entry.getKey())) {
                cells.add(entry.getKey());
            }
        }
        return cells;
    }

    private static boolean isAsciiAlphanumeric(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
    }
}
