package com.questrail.tds.protocol.codec;

/**
 * Indicates that the token stream could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown token tag byte</li>
 *   <li>A length field outside the configured bound</li>
 *   <li>A field value that is structurally invalid for its token</li>
 * </ul>
 *
 * Running out of bytes is never reported this way; the parser suspends
 * instead.
 */
public class TdsDecodeException extends RuntimeException
{
    public TdsDecodeException(String message) {
        super(message);
    }

    public TdsDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
