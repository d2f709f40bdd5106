package com.yuzhi.dts.iac.domain;

public enum DiffAction {
    CREATE,
    UPDATE,
    DELETE
}
