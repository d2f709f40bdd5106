package com.yuzhi.dts.iac.domain;

import java.util.Locale;

public enum PrincipalType {
    GROUP,
    USER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
