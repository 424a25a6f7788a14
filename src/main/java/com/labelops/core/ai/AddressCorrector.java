package com.labelops.core.ai;

import com.labelops.core.parse.AddressRecord;

import java.util.List;

/**
 * Source of field corrections for a parsed address.
 */
public interface AddressCorrector {

    List<Suggestion> suggest(AddressRecord record) throws CorrectorUnavailableException;
}
