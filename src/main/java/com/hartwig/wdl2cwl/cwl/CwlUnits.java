package com.hartwig.wdl2cwl.cwl;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Conversion of WDL memory and disk units to the mebibytes CWL resource requirements are expressed in.
 */
final class CwlUnits {
    private static final BigDecimal MEBIBYTE = BigDecimal.valueOf(1024L * 1024L);

    private static final Map<String, BigDecimal> BYTES = Map.ofEntries(Map.entry("b", BigDecimal.ONE),
            Map.entry("k", BigDecimal.valueOf(1000L)),
            Map.entry("kb", BigDecimal.valueOf(1000L)),
            Map.entry("m", BigDecimal.valueOf(1000L * 1000L)),
            Map.entry("mb", BigDecimal.valueOf(1000L * 1000L)),
            Map.entry("g", BigDecimal.valueOf(1000L * 1000L * 1000L)),
            Map.entry("gb", BigDecimal.valueOf(1000L * 1000L * 1000L)),
            Map.entry("t", BigDecimal.valueOf(1000L * 1000L * 1000L * 1000L)),
            Map.entry("tb", BigDecimal.valueOf(1000L * 1000L * 1000L * 1000L)),
            Map.entry("ki", BigDecimal.valueOf(1024L)),
            Map.entry("kib", BigDecimal.valueOf(1024L)),
            Map.entry("mi", MEBIBYTE),
            Map.entry("mib", MEBIBYTE),
            Map.entry("gi", MEBIBYTE.multiply(BigDecimal.valueOf(1024L))),
            Map.entry("gib", MEBIBYTE.multiply(BigDecimal.valueOf(1024L))),
            Map.entry("ti", MEBIBYTE.multiply(BigDecimal.valueOf(1024L * 1024L))),
            Map.entry("tib", MEBIBYTE.multiply(BigDecimal.valueOf(1024L * 1024L))));

    private CwlUnits() {
    }

    /**
     * @return how many mebibytes one unit is, or empty for an unknown unit
     */
    static Optional<BigDecimal> mebibytesPer(String unit) {
        return Optional.ofNullable(BYTES.get(unit.toLowerCase(Locale.ROOT)))
                .map(bytes -> bytes.divide(MEBIBYTE, MathContext.DECIMAL64).stripTrailingZeros());
    }

    /**
     * Whole mebibytes needed for the amount, rounded up.
     */
    static long toMebibytes(BigDecimal amount, BigDecimal factor) {
        return amount.multiply(factor).setScale(0, RoundingMode.CEILING).longValueExact();
    }
}
