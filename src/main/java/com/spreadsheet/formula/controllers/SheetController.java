package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path; cells are addressed as "A1", "B12", ...
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "rows": 100, "cols": 26 }.
     * Creates an empty Sheet and returns its sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, Integer> request) {
        Map<String, Integer> size = request == null ? Collections.emptyMap() : request;
        long sheetId = sheetService.createSheet(size.get("rows"), size.get("cols"));
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{reference}
     * Body: plain text, or a formula starting with '='.
     * Returns the stored cell. A circular formula is rejected with a 400
     * by the GlobalExceptionHandler and the cell keeps its old content.
     */
    @PutMapping("/{sheetId}/cell/{reference}")
    public ResponseEntity<CellData> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String reference,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, reference, rawValue));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the display values of all non-empty cells,
     * e.g. { "A1": "10", "B1": "20", "C1": "30" }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @GetMapping("/{sheetId}/cell/{reference}")
    public ResponseEntity<CellData> getCell(@PathVariable long sheetId, @PathVariable String reference) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, reference));
    }

    /**
     * POST /sheet/{sheetId}/evaluate
     * Body: formula text. Evaluates it against the sheet without storing it.
     */
    @PostMapping("/{sheetId}/evaluate")
    public ResponseEntity<Map<String, String>> evaluate(@PathVariable long sheetId,
                                                        @RequestBody String formula) {
        return ResponseEntity.ok(Collections.singletonMap("value", sheetService.evaluate(sheetId, formula)));
    }

    /**
     * GET /sheet/{sheetId}/cell/{reference}/references
     * Lists the cells the stored formula reads, ranges expanded.
     */
    @GetMapping("/{sheetId}/cell/{reference}/references")
    public ResponseEntity<List<String>> getReferences(@PathVariable long sheetId,
                                                      @PathVariable String reference) {
        return ResponseEntity.ok(sheetService.getReferences(sheetId, reference));
    }

    /**
     * POST /sheet/{sheetId}/cell/{from}/copy/{to}
     * Copies a cell, shifting the references of its formula.
     */
    @PostMapping("/{sheetId}/cell/{from}/copy/{to}")
    public ResponseEntity<CellData> copyCell(@PathVariable long sheetId,
                                             @PathVariable String from,
                                             @PathVariable String to) {
        return ResponseEntity.ok(sheetService.copyCell(sheetId, from, to));
    }
}
