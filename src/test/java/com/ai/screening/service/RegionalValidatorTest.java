package com.ai.screening.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegionalValidatorTest {

    private final RegionalValidator validator = new RegionalValidator(
            List.of("RS", "SC", "PR", "SP"), List.of("BA", " pe "));

    @Test
    void classifiesAgainstConfiguredSets() {
        assertEquals(RegionalValidator.Classification.ELIGIBLE, validator.classify("RS"));
        assertEquals(RegionalValidator.Classification.INTEREST, validator.classify("BA"));
        assertEquals(RegionalValidator.Classification.UNKNOWN, validator.classify("XX"));
    }

    @Test
    void comparisonIsCaseInsensitive() {
        assertEquals(RegionalValidator.Classification.ELIGIBLE, validator.classify("rs"));
        assertEquals(RegionalValidator.Classification.INTEREST, validator.classify("Pe"));
        assertTrue(validator.isEligible("sp"));
        assertTrue(validator.isInterest("ba"));
    }

    @Test
    void blankOrMissingCodeIsUnknown() {
        assertEquals(RegionalValidator.Classification.UNKNOWN, validator.classify(null));
        assertEquals(RegionalValidator.Classification.UNKNOWN, validator.classify(""));
        assertEquals(RegionalValidator.Classification.UNKNOWN, validator.classify("  "));
    }

    @Test
    void classificationIsStableAcrossCalls() {
        for (int i = 0; i < 3; i++) {
            assertEquals(RegionalValidator.Classification.ELIGIBLE, validator.classify("SC"));
        }
    }

    @Test
    void describesRegionsInPortuguese() {
        assertEquals("Elegível - Região Sul", validator.describe("rs"));
        assertEquals("Região em avaliação - Nordeste", validator.describe("BA"));
        assertEquals("Região XX desconhecida", validator.describe("xx"));
        assertEquals("Região não informada", validator.describe(null));
    }

    @Test
    void listsConfiguredRegionsWithMacroRegionNames() {
        List<Map<String, String>> eligible = validator.eligibleRegionsList();
        assertEquals(4, eligible.size());
        assertEquals(Map.of("code", "RS", "name", "Sul", "status", "available"), eligible.get(0));
        assertEquals("PE", validator.interestRegionsList().get(1).get("code"));
    }

    @Test
    void configuredSetsAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> validator.getEligibleRegions().add("BA"));
    }

    @Test
    void configuredCodesAreTrimmedUpperCasedAndKeepTheirOrder() {
        RegionalValidator fromCsv = new RegionalValidator(Arrays.asList(" sc", "RS", "", null, "sc", "pr "), List.of());

        assertEquals(List.of("SC", "RS", "PR"), new ArrayList<>(fromCsv.getEligibleRegions()));
        assertTrue(fromCsv.getInterestRegions().isEmpty());
    }
}
