package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * INFO ($AB) and ERROR ($AA) tokens.
 *
 * <p>Both carry the same fields. Severity is reported in
 * {@link #messageClass()}; the parser does not act on it.</p>
 */
public record ServerMessageToken(
        Kind kind,
        long number,
        int state,
        int messageClass,
        String message,
        String serverName,
        String procName,
        long lineNumber
) implements TdsToken
{
    public enum Kind
    {
        INFO,
        ERROR
    }

    public ServerMessageToken
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(serverName, "serverName");
        Objects.requireNonNull(procName, "procName");
    }
}
