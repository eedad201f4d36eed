package com.optionseller.service.market;

import com.optionseller.model.InstrumentUniverse;

/**
 * Loads the option contracts of one underlying at its nearest expiry.
 */
public interface InstrumentUniverseLoader {

    InstrumentUniverse loadInstrumentUniverse(String underlyingName);
}
