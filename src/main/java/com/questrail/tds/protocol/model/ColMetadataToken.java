package com.questrail.tds.protocol.model;

import java.util.List;

/**
 * COLMETADATA token ($81).
 *
 * <p>Describes the shape of the rows that follow. Completing one of these
 * replaces the parser's column-metadata context wholesale.</p>
 *
 * <p>An empty column list corresponds to the "no metadata" marker
 * ({@code 0xFFFF} column count).</p>
 */
public record ColMetadataToken(List<ColumnMetadata> columns) implements TdsToken
{
    public ColMetadataToken
    {
        columns = List.copyOf(columns);
    }
}
