package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.metrics.RunInfo;
import org.gamma.imgbatch.table.ResultRow;

import java.util.List;

/**
 * Rows appended to the result table during this run, plus the run's accounting.
 */
public record BatchResult(List<ResultRow> rows, RunInfo runInfo) {
}
