package com.retail.backoffice.report;

import com.retail.backoffice.model.SalesOrder;

import java.util.List;

public record ValidationResult(List<SalesOrder> validOrders, int invalidCount, List<ReportWarning> warnings) {
}
