package com.optionseller.model;

/**
 * Option contract side. Kite labels these CE and PE in the instrument dump.
 */
public enum OptionType {
    CALL("CE"),
    PUT("PE");

    private final String kiteCode;

    OptionType(String kiteCode) {
        this.kiteCode = kiteCode;
    }

    public String getKiteCode() {
        return kiteCode;
    }

    /**
     * @return the matching type, or null when the code is not an option type (FUT, EQ, ...)
     */
    public static OptionType fromKiteCode(String code) {
        for (OptionType type : values()) {
            if (type.kiteCode.equalsIgnoreCase(code)) {
                return type;
            }
        }
        return null;
    }
}
