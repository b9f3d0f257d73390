package com.efaktur.backend.enums;

public enum ValidationStatus {
    SUCCESS("validated_successfully"),
    SUCCESS_WITH_DEVIATIONS("validated_with_deviations"),
    ERROR("error");

    private final String code;

    ValidationStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
