package com.questrail.tds.protocol.model;

import java.util.List;

/**
 * ORDER token ($A9): ordinals of the columns the result set is sorted by.
 */
public record OrderToken(List<Integer> orderColumns) implements TdsToken
{
    public OrderToken
    {
        orderColumns = List.copyOf(orderColumns);
    }
}
