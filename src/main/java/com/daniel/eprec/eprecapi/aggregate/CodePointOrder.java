package com.daniel.eprec.eprecapi.aggregate;

import java.util.Comparator;

/**
 * String order by Unicode code point, which is also the order of the UTF-8
 * bytes. {@link String#compareTo} compares UTF-16 units instead and puts
 * supplementary characters (U+10000 and up) before U+E000..U+FFFF.
 */
public final class CodePointOrder {

    public static final Comparator<String> INSTANCE = CodePointOrder::compare;

    private CodePointOrder() {
    }

    public static int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
