package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.FormulaEngineApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = FormulaEngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private long sheetId;

    @BeforeEach
    void createSheet() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>("{\"rows\": 20, \"cols\": 5}", headers);

        ResponseEntity<Long> createResponse = restTemplate.postForEntity(baseUrl(), request, Long.class);
        assertEquals(HttpStatus.OK, createResponse.getStatusCode());
        assertNotNull(createResponse.getBody());
        sheetId = createResponse.getBody();
    }

    @Test
    void testSetCellsAndReadSheet() {
        put("A1", "10");
        put("B1", "20");
        ResponseEntity<Map> cell = put("C1", "=A1+B1");
        assertEquals("30", cell.getBody().get("value"));
        assertEquals("=A1+B1", cell.getBody().get("formula"));

        ResponseEntity<Map> sheet = restTemplate.getForEntity(sheetUrl(), Map.class);
        assertEquals(HttpStatus.OK, sheet.getStatusCode());
        assertEquals("10", sheet.getBody().get("A1"));
        assertEquals("30", sheet.getBody().get("C1"));
    }

    @Test
    void testPlainCellOmitsFormula() {
        put("A1", "hello");
        ResponseEntity<Map> cell = restTemplate.getForEntity(sheetUrl() + "/cell/A1", Map.class);
        assertEquals("hello", cell.getBody().get("value"));
        assertFalse(cell.getBody().containsKey("formula"));
    }

    /**
     * A single-cell cycle is rejected with a 400 and the old value remains.
     */
    @Test
    void testCircularReferenceIsRejected() {
        put("A1", "hello");

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () -> put("A1", "=A1"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));

        ResponseEntity<Map> sheet = restTemplate.getForEntity(sheetUrl(), Map.class);
        assertEquals("hello", sheet.getBody().get("A1"));
    }

    @Test
    void testInvalidReferenceIsRejected() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () -> put("Z99", "x"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));
    }

    @Test
    void testUnknownSheet() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(baseUrl() + "/999999", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));
    }

    @Test
    void testEvaluate() {
        put("A1", "3");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);

        ResponseEntity<Map> response = restTemplate.postForEntity(sheetUrl() + "/evaluate",
                new HttpEntity<>("=UPPER(\"ab\") & A1 * 2", headers), Map.class);
        assertEquals("AB6", response.getBody().get("value"));

        ResponseEntity<Map> failed = restTemplate.postForEntity(sheetUrl() + "/evaluate",
                new HttpEntity<>("=1/0", headers), Map.class);
        assertEquals("#ERROR", failed.getBody().get("value"));
    }

    @Test
    void testReferencesAndCopy() {
        put("B4", "1");
        put("B5", "2");
        put("C4", "3");
        put("C5", "4");
        put("B6", "=SUM(B4:B5)");

        ResponseEntity<List> references =
                restTemplate.getForEntity(sheetUrl() + "/cell/B6/references", List.class);
        assertEquals(Arrays.asList("B4", "B5"), references.getBody());

        ResponseEntity<Map> copy = restTemplate.postForEntity(sheetUrl() + "/cell/B6/copy/C6", null, Map.class);
        assertEquals("=SUM(C4:C5)", copy.getBody().get("formula"));
        assertEquals("7", copy.getBody().get("value"));
    }

    private ResponseEntity<Map> put(String reference, String rawValue) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        return restTemplate.exchange(sheetUrl() + "/cell/" + reference, HttpMethod.PUT,
                new HttpEntity<>(rawValue, headers), Map.class);
    }

    private String baseUrl() {
        return "http://localhost:" + port + "/sheet";
    }

    private String sheetUrl() {
        return baseUrl() + "/" + sheetId;
    }
}
