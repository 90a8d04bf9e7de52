package com.spreadsheet.formula.models;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents a stored spreadsheet:
 * - Has a unique ID
 * - Owns one sparse cell grid
 * - A read/write lock so check-evaluate-commit runs as one step
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Spreadsheet grid;

    // Writers hold the write lock for the whole check-evaluate-commit sequence
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rows, int cols) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.grid = new Spreadsheet(rows, cols);
    }

    public long getId() {
        return id;
    }

    public Spreadsheet getGrid() {
        return grid;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
