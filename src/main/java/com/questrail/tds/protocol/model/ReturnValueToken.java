package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * RETURNVALUE token ($AC): the value of an output parameter or of a
 * user-defined function's return.
 *
 * @param paramOrdinal position of the parameter in the RPC call
 * @param paramName    parameter name without the leading {@code @}
 * @param status       1 for an output parameter, 2 for a UDF return value
 * @param metadata     type and flags of the value
 * @param value        decoded value, {@code null} for SQL NULL
 */
public record ReturnValueToken(
        int paramOrdinal,
        String paramName,
        int status,
        ColumnMetadata metadata,
        Object value
) implements TdsToken
{
    public ReturnValueToken
    {
        Objects.requireNonNull(paramName, "paramName");
        Objects.requireNonNull(metadata, "metadata");
    }
}
