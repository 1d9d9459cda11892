package com.questrail.tds.protocol.model;

import java.util.Optional;

/**
 * TDS protocol revisions, keyed by the value the server reports in LOGINACK.
 *
 * <p>The negotiated revision changes the width of a few fields: DONE row
 * counts, column user types and INFO/ERROR line numbers all widen in 7.2.</p>
 */
public enum TdsVersion
{
    V7_0(0x70000000L, "7_0"),
    V7_1(0x71000001L, "7_1"),
    V7_2(0x72090002L, "7_2"),
    V7_3_A(0x730A0003L, "7_3_A"),
    V7_3_B(0x730B0003L, "7_3_B"),
    V7_4(0x74000004L, "7_4");

    private final long value;
    private final String label;

    TdsVersion(long value, String label)
    {
        this.value = value;
        this.label = label;
    }

    public long value()
    {
        return value;
    }

    public String label()
    {
        return label;
    }

    /**
     * @return true if this revision is 7.2 or later
     */
    public boolean atLeast72()
    {
        return compareTo(V7_2) >= 0;
    }

    public static Optional<TdsVersion> fromValue(long value)
    {
        for (TdsVersion version : values()) {
            if (version.value == value) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }
}
