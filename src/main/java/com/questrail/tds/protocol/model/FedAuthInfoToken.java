package com.questrail.tds.protocol.model;

import java.util.Optional;

/**
 * FEDAUTHINFO token ($EE): where and for whom to obtain a federated
 * authentication token.
 */
public record FedAuthInfoToken(Optional<String> stsUrl, Optional<String> spn) implements TdsToken
{
    public static final int INFO_ID_STSURL = 0x01;
    public static final int INFO_ID_SPN = 0x02;
}
