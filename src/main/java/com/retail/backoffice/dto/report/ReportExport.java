package com.retail.backoffice.dto.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.retail.backoffice.report.ExportFormat;
import com.retail.backoffice.report.ExportType;
import com.retail.backoffice.report.ReportError;

/**
 * A rendered export. {@code report} is the role-filtered report tree; {@code csv} is
 * only set for CSV exports. {@code error} is null unless the report was degraded.
 */
public record ReportExport(
        ExportType type,
        ExportFormat format,
        String fileName,
        JsonNode report,
        String csv,
        ReportError error) {

    public boolean isDegraded() {
        return error != null;
    }
}
