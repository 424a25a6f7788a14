package com.labelops.core.ai;

import com.labelops.config.ClientDefaults;
import com.labelops.config.MappingField;
import com.labelops.core.parse.AddressRecord;
import com.labelops.core.parse.RecordParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewHeuristicsTest {

    private static AddressRecord record(String postcode, String country, String town) {
        return new AddressRecord("Jane Doe", "10 Downing Street", "", town, "", postcode, country,
            "Tracked 48", 0.5, "", "", "", "", false);
    }

    @Test
    void cleanUkRecordNeedsNoReview() {
        assertFalse(ReviewHeuristics.needsReview(record("SW1A 2AA", "UNITED KINGDOM", "London")));
    }

    @Test
    void missingOrInvalidPostcodeNeedsReview() {
        assertTrue(ReviewHeuristics.needsReview(record("", "UNITED KINGDOM", "London")));
        assertTrue(ReviewHeuristics.needsReview(record("95014", "UNITED KINGDOM", "London")));
    }

    @Test
    void foreignPostcodesUseTheLooseFormat() {
        assertFalse(ReviewHeuristics.needsReview(record("95014", "UNITED STATES", "Cupertino")));
    }

    @Test
    void countryTypoNeedsReview() {
        assertTrue(ReviewHeuristics.needsReview(record("SW1A 2AA", "United Kingsom", "London")));
        assertTrue(ReviewHeuristics.needsReview(record("SW1A 2AA", "", "London")));
    }

    @Test
    void parsedRecordWithMisspeltCountryNeedsReview() {
        RecordParser parser = new RecordParser(new ClientDefaults("Tracked 48", 0.5, null, null), List.of());
        AddressRecord parsed = parser.parse("Jane Doe\n10 Downing Street\nLondon\nSW1A 2AA\nUnited Kingsom")
            .records().get(0);

        assertTrue(ReviewHeuristics.needsReview(parsed));
        assertFalse(ReviewHeuristics.needsReview(parsed.with(MappingField.COUNTRY, "UNITED KINGDOM")));
    }

    @Test
    void unknownMarkersNeedReview() {
        assertTrue(ReviewHeuristics.needsReview(record("SW1A 2AA", "UNITED KINGDOM", "Lond?n")));
        assertTrue(ReviewHeuristics.needsReview(record("SW1A 2AA", "UNITED KINGDOM", "unknown")));
    }
}
