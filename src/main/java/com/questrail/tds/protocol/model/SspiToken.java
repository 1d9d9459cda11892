package com.questrail.tds.protocol.model;

/**
 * SSPI token ($ED): an opaque integrated-authentication challenge.
 *
 * <p>The challenge bytes are handed to the authentication layer unparsed.</p>
 */
public record SspiToken(byte[] challenge) implements TdsToken
{
    public SspiToken
    {
        challenge = challenge.clone();
    }

    @Override
    public byte[] challenge()
    {
        return challenge.clone();
    }
}
