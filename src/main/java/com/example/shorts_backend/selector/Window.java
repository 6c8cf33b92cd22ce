package com.example.shorts_backend.selector;

/**
 * Candidate clip span.
 *
 * @param startSec start offset in seconds (inclusive).
 * @param endSec   end offset in seconds (exclusive).
 */
public record Window(double startSec, double endSec) {
}
