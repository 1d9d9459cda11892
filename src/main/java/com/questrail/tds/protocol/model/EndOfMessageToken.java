package com.questrail.tds.protocol.model;

/**
 * Sentinel token marking a transport-level message boundary.
 *
 * <p>Not derived from byte content. Emitted once for every end-of-message
 * marker the parser receives, regardless of parse state.</p>
 */
public record EndOfMessageToken() implements TdsToken
{
    public static final EndOfMessageToken INSTANCE = new EndOfMessageToken();
}
