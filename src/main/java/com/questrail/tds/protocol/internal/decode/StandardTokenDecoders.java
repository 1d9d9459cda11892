package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.TdsTokenDecoderRegistry;
import com.questrail.tds.protocol.model.DoneToken;
import com.questrail.tds.protocol.model.ServerMessageToken;
import com.questrail.tds.protocol.model.TdsTokenType;

/**
 * StandardTokenDecoders
 * ============================================================================
 * The registry of every token decoder this library ships.
 *
 * <p>Built once on first use and shared by all parsers.</p>
 */
public final class StandardTokenDecoders
{
    private static final TdsTokenDecoderRegistry REGISTRY = builder().build();

    private StandardTokenDecoders() {}

    public static TdsTokenDecoderRegistry registry()
    {
        return REGISTRY;
    }

    /**
     * Returns a builder pre-populated with the standard decoders, for callers
     * that want to add decoders for further tags.
     */
    public static TdsTokenDecoderRegistry.Builder builder()
    {
        return TdsTokenDecoderRegistry.builder()
                .register(TdsTokenType.COLMETADATA, new ColMetadataTokenDecoder())
                .register(TdsTokenType.DONE, new DoneTokenDecoder(DoneToken.Kind.DONE))
                .register(TdsTokenType.DONEINPROC, new DoneTokenDecoder(DoneToken.Kind.DONEINPROC))
                .register(TdsTokenType.DONEPROC, new DoneTokenDecoder(DoneToken.Kind.DONEPROC))
                .register(TdsTokenType.ENVCHANGE, new EnvChangeTokenDecoder())
                .register(TdsTokenType.ERROR, new ServerMessageTokenDecoder(ServerMessageToken.Kind.ERROR))
                .register(TdsTokenType.FEDAUTHINFO, new FedAuthInfoTokenDecoder())
                .register(TdsTokenType.FEATUREEXTACK, new FeatureExtAckTokenDecoder())
                .register(TdsTokenType.INFO, new ServerMessageTokenDecoder(ServerMessageToken.Kind.INFO))
                .register(TdsTokenType.LOGINACK, new LoginAckTokenDecoder())
                .register(TdsTokenType.ORDER, new OrderTokenDecoder())
                .register(TdsTokenType.RETURNSTATUS, new ReturnStatusTokenDecoder())
                .register(TdsTokenType.RETURNVALUE, new ReturnValueTokenDecoder())
                .register(TdsTokenType.ROW, new RowTokenDecoder())
                .register(TdsTokenType.NBCROW, new NbcRowTokenDecoder())
                .register(TdsTokenType.SSPI, new SspiTokenDecoder());
    }
}
