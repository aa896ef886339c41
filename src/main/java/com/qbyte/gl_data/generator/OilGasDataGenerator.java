package com.qbyte.gl_data.generator;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Oil and gas identifiers: wells, leases, properties, AFEs, JIBs, cost centers
 * and geography.
 *
 * Every method is a table-driven draw from the supplied source and always
 * succeeds.
 */
@Component
public class OilGasDataGenerator {

    static final List<String> BASINS = List.of(
        "Permian", "Eagle Ford", "Bakken", "Marcellus", "Haynesville", "Utica", "Anadarko", "DJ Basin");
    static final List<String> STATES = List.of("TX", "ND", "PA", "LA", "OK", "CO", "WY", "NM");
    static final List<String> COUNTIES = List.of(
        "Midland", "Reeves", "Ward", "Loving", "Karnes", "DeWitt", "Mountrail", "Williams");
    static final List<String> LEASE_PREFIXES = List.of(
        "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis");
    static final List<String> LEASE_SUFFIXES = List.of("Ranch", "Field", "Unit", "Lease", "Property", "Tract");
    static final List<String> COST_CENTER_REGIONS = List.of("NORTH", "SOUTH", "EAST", "WEST", "CENTRAL");

    private static final DateTimeFormatter JIB_PERIOD = DateTimeFormatter.ofPattern("yyyyMM");

    /**
     * Well ID as {@code BASIN-NNNN}, using the first four letters of the upper-cased basin.
     */
    public String generateWellId(LedgerRandom random) {
        String basin = random.choice(BASINS).toUpperCase(Locale.ROOT);
        int wellNumber = random.nextInt(1000, 9999);
        return basin.substring(0, Math.min(4, basin.length())) + "-" + wellNumber;
    }

    /**
     * Authorization for Expenditure number, e.g. {@code AFE-2023-4821}.
     */
    public String generateAfeNumber(LedgerRandom random) {
        int year = random.nextInt(2020, 2024);
        int sequence = random.nextInt(1000, 9999);
        return "AFE-" + year + "-" + sequence;
    }

    public String generateLeaseName(LedgerRandom random) {
        String prefix = random.choice(LEASE_PREFIXES);
        String suffix = random.choice(LEASE_SUFFIXES);
        return prefix + " " + suffix;
    }

    public String generatePropertyId(LedgerRandom random) {
        String state = random.choice(STATES);
        int number = random.nextInt(10000, 99999);
        return "PROP-" + state + "-" + number;
    }

    /**
     * Joint Interest Billing number tagged with the transaction's year and month,
     * e.g. {@code JIB-TX-4410-202511}.
     */
    public String generateJibNumber(LedgerRandom random, LocalDate transactionDate) {
        String state = random.choice(STATES);
        int number = random.nextInt(1000, 9999);
        return "JIB-" + state + "-" + number + "-" + transactionDate.format(JIB_PERIOD);
    }

    public String generateCostCenter(LedgerRandom random) {
        String region = random.choice(COST_CENTER_REGIONS);
        int unit = random.nextInt(1, 9);
        return "CC-" + region + "-" + unit;
    }

    public String generateBasin(LedgerRandom random) {
        return random.choice(BASINS);
    }

    public String generateState(LedgerRandom random) {
        return random.choice(STATES);
    }

    public String generateCounty(LedgerRandom random) {
        return random.choice(COUNTIES);
    }
}
