package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating sheets, setting cells, evaluating
 * formulas and rejecting circular references.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent DB
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FormulaEvaluator formulaEvaluator;
    private final CircularReferenceChecker circularReferenceChecker;
    private final FormulaProperties properties;

    public SheetService(FormulaEvaluator formulaEvaluator,
                        CircularReferenceChecker circularReferenceChecker,
                        FormulaProperties properties) {
        this.formulaEvaluator = formulaEvaluator;
        this.circularReferenceChecker = circularReferenceChecker;
        this.properties = properties;
    }

    /**
     * Creates a new Sheet and returns its ID.
     * Missing or non-positive dimensions fall back to the configured defaults.
     */
    public long createSheet(Integer rows, Integer cols) {
        int sheetRows = rows == null || rows <= 0 ? properties.getSheet().getDefaultRows() : rows;
        int sheetCols = cols == null || cols <= 0 ? properties.getSheet().getDefaultCols() : cols;
        Sheet sheet = new Sheet(sheetRows, sheetCols);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} with {} rows and {} columns", sheet.getId(), sheetRows, sheetCols);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's content with these steps:
     * 1) Resolve the reference against the sheet bounds.
     * 2) For a formula, reject it if it would close a reference loop;
     *    the cell then keeps its previous content.
     * 3) Evaluate the formula (#ERROR when it fails) and store both.
     * Plain text is stored as is; empty text clears the cell.
     *
     * @return the stored cell
     */
    public CellData setCellValue(long sheetId, String reference, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolve(sheet, reference);
        String text = rawValue == null ? "" : rawValue;

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            Spreadsheet grid = sheet.getGrid();
            CellData cell;
            if (FormulaEvaluator.isFormula(text)) {
                try {
                    circularReferenceChecker.check(text, address, grid);
                } catch (CircularReferenceException ex) {
                    log.warn("Rejected formula {} for {} in sheet {}: {}",
                            text, address.getLabel(), sheetId, ex.getMessage());
                    throw ex;
                }
                cell = CellData.ofFormula(formulaEvaluator.evaluateFormula(text, grid), text);
            } else {
                cell = CellData.ofValue(text);
            }
            grid.setCell(address, cell);
            return grid.getCell(address);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns reference -> display value for every non-empty cell, row by row.
     * Values are stored at set time, so nothing is re-evaluated here.
     */
    public Map<String, String> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, String> data = new LinkedHashMap<>();
            new TreeMap<>(sheet.getGrid().getCells())
                    .forEach((address, cell) -> data.put(address.getLabel(), cell.getValue()));
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellData getCell(long sheetId, String reference) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolve(sheet, reference);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getGrid().getCell(address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates formula text against the sheet without storing anything.
     * Text without a leading '=' is treated as a formula body.
     */
    public String evaluate(long sheetId, String formula) {
        Sheet sheet = getSheet(sheetId);
        String text = formula == null ? "" : formula.trim();
        if (!FormulaEvaluator.isFormula(text)) {
            text = "=" + text;
        }

        sheet.getLock().readLock().lock();
        try {
            return formulaEvaluator.evaluateFormula(text, sheet.getGrid());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Labels of the cells read by the formula stored in the given cell.
     */
    public List<String> getReferences(long sheetId, String reference) {
        CellData cell = getCell(sheetId, reference);
        List<String> labels = new ArrayList<>();
        List<CellAddress> references = CellReferenceExtractor.extract(
                cell.getFormula(), getSheet(sheetId).getGrid(), properties.getMaxRangeCells());
        for (CellAddress address : references) {
            labels.add(address.getLabel());
        }
        return labels;
    }

    /**
     * Copies a cell, shifting the relative references of its formula by the
     * distance between the two cells. The target goes through setCellValue,
     * so the copy is evaluated and checked for loops like any other write.
     */
    public CellData copyCell(long sheetId, String fromReference, String toReference) {
        Sheet sheet = getSheet(sheetId);
        CellAddress from = resolve(sheet, fromReference);
        CellAddress to = resolve(sheet, toReference);

        CellData source = getCell(sheetId, fromReference);
        String content = source.hasFormula()
                ? FormulaReferenceAdjuster.adjust(source.getFormula(),
                        to.getRow() - from.getRow(), to.getCol() - from.getCol())
                : source.getValue();
        return setCellValue(sheetId, to.getLabel(), content);
    }

    private CellAddress resolve(Sheet sheet, String reference) {
        CellAddress address = CellAddress.parse(reference == null ? null : reference.trim())
                .orElseThrow(() -> new InvalidCellReferenceException("Invalid cell reference: " + reference));
        if (!sheet.getGrid().contains(address)) {
            throw new InvalidCellReferenceException("Cell " + address.getLabel() + " is outside the sheet ("
                    + sheet.getGrid().getRows() + " rows, " + sheet.getGrid().getCols() + " columns)");
        }
        return address;
    }
}
