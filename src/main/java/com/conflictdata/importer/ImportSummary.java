package com.conflictdata.importer;

public record ImportSummary(int imported, int updated, int skipped) {
}
