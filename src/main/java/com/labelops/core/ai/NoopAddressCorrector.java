package com.labelops.core.ai;

import com.labelops.core.parse.AddressRecord;

import java.util.List;

/**
 * Corrector used when AI assistance is switched off.
 */
public final class NoopAddressCorrector implements AddressCorrector {
    public static final NoopAddressCorrector INSTANCE = new NoopAddressCorrector();

    private NoopAddressCorrector() {
    }

    @Override
    public List<Suggestion> suggest(AddressRecord record) {
        return List.of();
    }
}
