package com.ai.screening.service;

import org.apache.commons.lang3.StringUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Classifies Brazilian state codes against the configured eligible and interest sets.
 * Immutable; built once from configuration by ScreeningConfig.
 */
public class RegionalValidator {

    public enum Classification {
        ELIGIBLE,
        INTEREST,
        UNKNOWN
    }

    private static final Map<String, String> MACRO_REGIONS = Map.ofEntries(
            Map.entry("RS", "sul"), Map.entry("SC", "sul"), Map.entry("PR", "sul"),
            Map.entry("SP", "sudeste"), Map.entry("RJ", "sudeste"), Map.entry("MG", "sudeste"), Map.entry("ES", "sudeste"),
            Map.entry("GO", "centro-oeste"), Map.entry("MT", "centro-oeste"), Map.entry("MS", "centro-oeste"),
            Map.entry("DF", "centro-oeste"),
            Map.entry("BA", "nordeste"), Map.entry("PE", "nordeste"), Map.entry("CE", "nordeste"),
            Map.entry("RN", "nordeste"), Map.entry("PB", "nordeste"), Map.entry("AL", "nordeste"),
            Map.entry("SE", "nordeste"), Map.entry("PI", "nordeste"), Map.entry("MA", "nordeste"),
            Map.entry("PA", "norte"), Map.entry("RO", "norte"),
            Map.entry("AP", "norte"), Map.entry("AM", "norte"), Map.entry("RR", "norte"),
            Map.entry("AC", "norte"), Map.entry("TO", "norte")
    );

    private final Set<String> eligibleRegions;
    private final Set<String> interestRegions;

    public RegionalValidator(Collection<String> eligibleRegions, Collection<String> interestRegions) {
        this.eligibleRegions = normalize(eligibleRegions);
        this.interestRegions = normalize(interestRegions);
    }

    public Classification classify(String regionCode) {
        if (StringUtils.isBlank(regionCode)) {
            return Classification.UNKNOWN;
        }
        String code = regionCode.trim().toUpperCase(Locale.ROOT);
        if (eligibleRegions.contains(code)) return Classification.ELIGIBLE;
        if (interestRegions.contains(code)) return Classification.INTEREST;
        return Classification.UNKNOWN;
    }

    public boolean isEligible(String regionCode) {
        return classify(regionCode) == Classification.ELIGIBLE;
    }

    public boolean isInterest(String regionCode) {
        return classify(regionCode) == Classification.INTEREST;
    }

    /** Portuguese description shown to operators and returned with eligibility checks. */
    public String describe(String regionCode) {
        if (StringUtils.isBlank(regionCode)) {
            return "Região não informada";
        }
        String code = regionCode.trim().toUpperCase(Locale.ROOT);
        switch (classify(code)) {
            case ELIGIBLE:
                return "Elegível - Região " + macroRegionName(code);
            case INTEREST:
                return "Região em avaliação - " + macroRegionName(code);
            default:
                return "Região " + code + " desconhecida";
        }
    }

    public String macroRegionName(String regionCode) {
        String name = MACRO_REGIONS.getOrDefault(regionCode.toUpperCase(Locale.ROOT), "desconhecida");
        return StringUtils.capitalize(name);
    }

    public List<Map<String, String>> eligibleRegionsList() {
        return asList(eligibleRegions, "available");
    }

    public List<Map<String, String>> interestRegionsList() {
        return asList(interestRegions, "interest");
    }

    public Set<String> getEligibleRegions() {
        return eligibleRegions;
    }

    public Set<String> getInterestRegions() {
        return interestRegions;
    }

    private List<Map<String, String>> asList(Set<String> codes, String status) {
        List<Map<String, String>> out = new ArrayList<>();
        for (String code : codes) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("code", code);
            entry.put("name", macroRegionName(code));
            entry.put("status", status);
            out.add(entry);
        }
        return out;
    }

    private static Set<String> normalize(Collection<String> codes) {
        if (codes == null) return Collections.emptySet();
        Set<String> normalized = codes.stream()
                .filter(StringUtils::isNotBlank)
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(normalized);
    }
}
