package com.questrail.tds.protocol.codec;

import com.questrail.tds.protocol.model.TdsTokenType;

import java.util.Arrays;
import java.util.Objects;

/**
 * TdsTokenDecoderRegistry
 * -----------------------------------------------------------------------------
 * Immutable table from one-byte token tag to {@link TdsTokenDecoder}.
 *
 * <p>Every one of the 256 slots holds a decoder. Slots without a registered
 * decoder hold one that raises {@link UnknownTokenTagException}, so the
 * dispatch loop never has to handle a missing entry itself.</p>
 *
 * <p>Built once through {@link Builder}; read-only thereafter and safe to
 * share between parser instances.</p>
 */
public final class TdsTokenDecoderRegistry
{
    private final TdsTokenDecoder[] decoders;
    private final boolean[] registered;

    private TdsTokenDecoderRegistry(TdsTokenDecoder[] decoders, boolean[] registered)
    {
        this.decoders = decoders;
        this.registered = registered;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Returns the decoder for {@code tag}. Never {@code null}.
     *
     * @param tag unsigned tag byte, 0-255
     */
    public TdsTokenDecoder decoderFor(int tag)
    {
        return decoders[tag & 0xFF];
    }

    public boolean isRegistered(int tag)
    {
        return registered[tag & 0xFF];
    }

    private static TdsTokenDecoder rejecting(int tag)
    {
        return (reader, columns, options, onComplete) -> {
            throw new UnknownTokenTagException(tag);
        };
    }

    public static final class Builder
    {
        private final TdsTokenDecoder[] decoders = new TdsTokenDecoder[256];

        private Builder() {}

        public Builder register(TdsTokenType type, TdsTokenDecoder decoder)
        {
            return register(type.tag(), decoder);
        }

        public Builder register(int tag, TdsTokenDecoder decoder)
        {
            Objects.requireNonNull(decoder, "decoder");
            if (tag < 0 || tag > 0xFF) {
                throw new IllegalArgumentException("Token tag must be in range 0-255 (was " + tag + ")");
            }
            if (decoders[tag] != null) {
                throw new IllegalStateException("Decoder already registered for tag 0x" + Integer.toHexString(tag));
            }
            decoders[tag] = decoder;
            return this;
        }

        public TdsTokenDecoderRegistry build()
        {
            TdsTokenDecoder[] table = Arrays.copyOf(decoders, decoders.length);
            boolean[] registered = new boolean[table.length];
            for (int tag = 0; tag < table.length; tag++) {
                registered[tag] = table[tag] != null;
                if (table[tag] == null) {
                    table[tag] = rejecting(tag);
                }
            }
            return new TdsTokenDecoderRegistry(table, registered);
        }
    }
}
