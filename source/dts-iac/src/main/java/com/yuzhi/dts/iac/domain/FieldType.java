package com.yuzhi.dts.iac.domain;

/**
 * Semantic type of a comparable field, drives how desired and live values are compared.
 */
public enum FieldType {
    SCALAR,
    NUMERIC,
    ORDERED_LIST,
    UNORDERED_LIST
}
