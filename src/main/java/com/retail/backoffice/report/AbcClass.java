package com.retail.backoffice.report;

/**
 * Inventory tiers by cumulative share of retail value: A up to 80%, B up to 95%, C the rest.
 */
public enum AbcClass {
    A,
    B,
    C
}
