package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * ENVCHANGE token ($E3).
 *
 * <p>
 * Notification that a piece of session environment changed on the server.
 * The old/new values are typed per subtype; see {@link EnvChangeType#shape()}.
 * </p>
 */
public sealed interface EnvChangeToken extends TdsToken
{
    EnvChangeType type();

    /**
     * Database, language, charset or mirroring partner change.
     */
    record TextChange(EnvChangeType type, String oldValue, String newValue) implements EnvChangeToken
    {
        public TextChange
        {
            Objects.requireNonNull(type, "type");
            if (type.shape() != EnvChangeType.ValueShape.TEXT) {
                throw new IllegalArgumentException(type + " does not carry text values");
            }
        }
    }

    /**
     * Negotiated packet size change, in bytes.
     */
    record PacketSizeChange(int oldValue, int newValue) implements EnvChangeToken
    {
        @Override
        public EnvChangeType type()
        {
            return EnvChangeType.PACKET_SIZE;
        }
    }

    /**
     * Collation, transaction descriptor or reset-connection change.
     */
    record BinaryChange(EnvChangeType type, byte[] oldValue, byte[] newValue) implements EnvChangeToken
    {
        public BinaryChange
        {
            Objects.requireNonNull(type, "type");
            if (type.shape() != EnvChangeType.ValueShape.BINARY) {
                throw new IllegalArgumentException(type + " does not carry binary values");
            }
            oldValue = oldValue.clone();
            newValue = newValue.clone();
        }

        @Override
        public byte[] oldValue()
        {
            return oldValue.clone();
        }

        @Override
        public byte[] newValue()
        {
            return newValue.clone();
        }
    }

    /**
     * Redirect to another server. The old value is always empty on the wire.
     */
    record RoutingChange(int protocol, int port, String server) implements EnvChangeToken
    {
        public RoutingChange
        {
            Objects.requireNonNull(server, "server");
        }

        @Override
        public EnvChangeType type()
        {
            return EnvChangeType.ROUTING_CHANGE;
        }
    }
}
