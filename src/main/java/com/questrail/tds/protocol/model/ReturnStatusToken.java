package com.questrail.tds.protocol.model;

/**
 * RETURNSTATUS token ($79): the status value returned by a stored procedure.
 */
public record ReturnStatusToken(int value) implements TdsToken
{
}
