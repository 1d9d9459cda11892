package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * LOGINACK token ($AD): the server's acceptance of a login request.
 */
public record LoginAckToken(
        String interfaceName,
        TdsVersion tdsVersion,
        String progName,
        ProgramVersion progVersion
) implements TdsToken
{
    /**
     * Server program version as four single-byte components.
     */
    public record ProgramVersion(int major, int minor, int buildNumHi, int buildNumLow)
    {
    }

    public LoginAckToken
    {
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(tdsVersion, "tdsVersion");
        Objects.requireNonNull(progName, "progName");
        Objects.requireNonNull(progVersion, "progVersion");
    }
}
