package com.questrail.tds.protocol.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * FEATUREEXTACK token ($AE): acknowledgement data for each feature extension
 * the client requested at login, keyed by feature id.
 */
public record FeatureExtAckToken(Map<Integer, byte[]> features) implements TdsToken
{
    public static final int FEATURE_FEDAUTH = 0x02;

    public FeatureExtAckToken
    {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    /**
     * @return the federated authentication acknowledgement, if the server sent one
     */
    public Optional<byte[]> fedAuth()
    {
        byte[] data = features.get(FEATURE_FEDAUTH);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }
}
