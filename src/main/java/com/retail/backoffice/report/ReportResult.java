package com.retail.backoffice.report;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a report call. Both variants carry a report of the requested shape; a
 * degraded result holds the empty form of it together with the error that caused it.
 */
public final class ReportResult<T> {

    private final T report;
    private final ReportError error;

    private ReportResult(T report, ReportError error) {
        this.report = Objects.requireNonNull(report, "report");
        this.error = error;
    }

    public static <T> ReportResult<T> ok(T report) {
        return new ReportResult<>(report, null);
    }

    public static <T> ReportResult<T> degraded(T emptyReport, ReportError error) {
        return new ReportResult<>(emptyReport, Objects.requireNonNull(error, "error"));
    }

    public T getReport() {
        return report;
    }

    public Optional<ReportError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
