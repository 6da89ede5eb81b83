package com.daniel.eprec.eprecapi.aggregate;

// "YYYYMM" grouping key: year followed by month left-padded with '0' to width 2 characters (code points).
public final class PeriodKey {

    static final int MONTH_WIDTH = 2;

    private PeriodKey() {
    }

    /*
     * No validation: "2021" + "3" -> "202103", "2021" + "11" -> "202111",
     * "" + "" -> "00", "2021" + "123" -> "2021123" (already wider than 2, kept as is).
     * Lexicographic ordering of keys is only meaningful because of the padding.
     */
    public static String of(String year, String month) {
        String safeYear = year == null ? "" : year;
        String safeMonth = month == null ? "" : month;
        int missing = MONTH_WIDTH - safeMonth.codePointCount(0, safeMonth.length());
        return missing > 0
                ? safeYear + "0".repeat(missing) + safeMonth
                : safeYear + safeMonth;
    }
}
