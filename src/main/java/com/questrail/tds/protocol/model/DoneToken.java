package com.questrail.tds.protocol.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * DONE, DONEPROC and DONEINPROC tokens ($FD, $FE, $FF).
 *
 * <p>
 * Marks completion of a SQL statement, a stored procedure, or a statement
 * inside a stored procedure. The three wire variants share one layout and
 * differ only in {@link Kind}.
 * </p>
 *
 * <p>
 * {@link #rowCount()} is present only when the server set the COUNT bit in
 * the status word.
 * </p>
 */
public record DoneToken(
        Kind kind,
        int status,
        int currentCommand,
        OptionalLong rowCount
) implements TdsToken
{
    public static final int STATUS_MORE = 0x0001;
    public static final int STATUS_ERROR = 0x0002;
    public static final int STATUS_INXACT = 0x0004;
    public static final int STATUS_COUNT = 0x0010;
    public static final int STATUS_ATTN = 0x0020;
    public static final int STATUS_SRVERROR = 0x0100;

    public enum Kind
    {
        DONE,
        DONEPROC,
        DONEINPROC
    }

    public DoneToken
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(rowCount, "rowCount");
    }

    /**
     * @return true if more results follow in the current response
     */
    public boolean more()
    {
        return (status & STATUS_MORE) != 0;
    }

    public boolean sqlError()
    {
        return (status & STATUS_ERROR) != 0;
    }

    public boolean inTransaction()
    {
        return (status & STATUS_INXACT) != 0;
    }

    /**
     * @return true if this token acknowledges an attention (cancel) request
     */
    public boolean attention()
    {
        return (status & STATUS_ATTN) != 0;
    }

    public boolean serverError()
    {
        return (status & STATUS_SRVERROR) != 0;
    }
}
