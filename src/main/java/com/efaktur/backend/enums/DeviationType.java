package com.efaktur.backend.enums;

public enum DeviationType {
    MISMATCH("mismatch"),
    MISSING_IN_DOCUMENT("missing_in_pdf"),
    MISSING_IN_API("missing_in_api");

    private final String code;

    DeviationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
