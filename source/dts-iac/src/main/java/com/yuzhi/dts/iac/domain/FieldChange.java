package com.yuzhi.dts.iac.domain;

/**
 * Field level difference between the live value and the desired value.
 */
public record FieldChange(String field, Object before, Object after) {
    public FieldChange {
        field = field == null ? "" : field.trim();
    }

    public String describe() {
        return field + ": '" + before + "' -> '" + after + "'";
    }
}
