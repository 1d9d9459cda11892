package com.questrail.tds.protocol.codec;

import com.questrail.tds.protocol.model.ColumnMetadata;

import java.util.List;

/**
 * ColumnMetadataContext
 * -----------------------------------------------------------------------------
 * The column shape that row-oriented token decoders interpret values against.
 *
 * <p>Instances are immutable. The parser replaces its current context with a
 * new instance each time a COLMETADATA token completes, so a decoder that
 * holds a context never sees it change underneath it.</p>
 */
public final class ColumnMetadataContext
{
    private static final ColumnMetadataContext EMPTY = new ColumnMetadataContext(List.of());

    private final List<ColumnMetadata> columns;

    private ColumnMetadataContext(List<ColumnMetadata> columns)
    {
        this.columns = columns;
    }

    public static ColumnMetadataContext empty()
    {
        return EMPTY;
    }

    public static ColumnMetadataContext of(List<ColumnMetadata> columns)
    {
        return columns.isEmpty() ? EMPTY : new ColumnMetadataContext(List.copyOf(columns));
    }

    public List<ColumnMetadata> columns()
    {
        return columns;
    }

    public int size()
    {
        return columns.size();
    }

    public ColumnMetadata column(int index)
    {
        return columns.get(index);
    }

    public boolean isEmpty()
    {
        return columns.isEmpty();
    }

    @Override
    public String toString()
    {
        return "ColumnMetadataContext[" + columns.size() + " columns]";
    }
}
