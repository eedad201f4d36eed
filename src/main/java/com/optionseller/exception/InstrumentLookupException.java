package com.optionseller.exception;

import com.optionseller.model.OptionType;

/**
 * Thrown when a matched strike has no contract in the candidate set it came from.
 */
public class InstrumentLookupException extends RuntimeException {

    public InstrumentLookupException(double strike, OptionType optionType) {
        super("No " + optionType + " instrument with strike " + strike + " in candidate set");
    }
}
