package com.questrail.tds.protocol.model;

/**
 * Canonical representation of one decoded TDS token.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code TdsToken} is the closed set of values the token stream parser emits.
 * Every variant except {@link EndOfMessageToken} is produced from bytes that
 * followed a one-byte tag on the wire; the end-of-message sentinel is produced
 * from a transport boundary marker and carries no payload.
 * </p>
 *
 * <p>
 * Tokens are immutable once emitted and are owned by the consumer.
 * </p>
 */
public sealed interface TdsToken
        permits ColMetadataToken,
                DoneToken,
                EndOfMessageToken,
                EnvChangeToken,
                FeatureExtAckToken,
                FedAuthInfoToken,
                LoginAckToken,
                OrderToken,
                ReturnStatusToken,
                ReturnValueToken,
                RowToken,
                ServerMessageToken,
                SspiToken
{
}
