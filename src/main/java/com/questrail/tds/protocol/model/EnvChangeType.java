package com.questrail.tds.protocol.model;

import java.util.Optional;

/**
 * ENVCHANGE subtypes and the shape of the values each one carries.
 */
public enum EnvChangeType
{
    DATABASE(1, ValueShape.TEXT),
    LANGUAGE(2, ValueShape.TEXT),
    CHARSET(3, ValueShape.TEXT),
    PACKET_SIZE(4, ValueShape.INTEGER),
    SQL_COLLATION(7, ValueShape.BINARY),
    BEGIN_TXN(8, ValueShape.BINARY),
    COMMIT_TXN(9, ValueShape.BINARY),
    ROLLBACK_TXN(10, ValueShape.BINARY),
    DATABASE_MIRRORING_PARTNER(13, ValueShape.TEXT),
    RESET_CONNECTION(18, ValueShape.BINARY),
    ROUTING_CHANGE(20, ValueShape.ROUTING);

    /**
     * How the old/new value pair of a subtype is encoded.
     */
    public enum ValueShape
    {
        TEXT,
        INTEGER,
        BINARY,
        ROUTING
    }

    private final int code;
    private final ValueShape shape;

    EnvChangeType(int code, ValueShape shape)
    {
        this.code = code;
        this.shape = shape;
    }

    public int code()
    {
        return code;
    }

    public ValueShape shape()
    {
        return shape;
    }

    public static Optional<EnvChangeType> fromCode(int code)
    {
        for (EnvChangeType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
