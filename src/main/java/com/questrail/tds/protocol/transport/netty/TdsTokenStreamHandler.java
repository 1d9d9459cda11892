package com.questrail.tds.protocol.transport.netty;

import com.questrail.tds.protocol.codec.TdsChunk;
import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenStreamListener;
import com.questrail.tds.protocol.codec.TdsTokenStreamParser;
import com.questrail.tds.protocol.codec.impl.DefaultTdsTokenStreamParser;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.observability.TdsObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * TdsTokenStreamHandler
 * =============================================================================
 * Netty inbound handler that turns token-stream bytes into {@link TdsToken}s.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong> around a
 * {@link TdsTokenStreamParser}. It sits after the handler that strips TDS
 * packet headers and expects, in arrival order:
 * <ul>
 *   <li>{@link ByteBuf} packet payloads, fed to the parser as byte chunks</li>
 *   <li>{@link TdsChunk.EndOfMessage} markers, fed through unchanged</li>
 * </ul>
 * Anything else is passed along the pipeline untouched.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code ChannelHandlerContext}, {@code ByteBuf}) MUST NOT
 * reach the parser. Payloads are copied into {@code byte[]} and released here.
 *
 * <h2>Outputs</h2>
 * Each decoded token is fired downstream with
 * {@link ChannelHandlerContext#fireChannelRead(Object)}. A fatal decode
 * failure is fired with {@link ChannelHandlerContext#fireExceptionCaught(Throwable)};
 * the parser drops all later input, so the channel is normally closed by a
 * later handler. A channel that goes inactive while a token is only partly
 * received is reported the same way, as a truncated stream.
 *
 * <p>One handler instance per channel; not {@code @Sharable}.</p>
 */
public final class TdsTokenStreamHandler extends ChannelInboundHandlerAdapter
{
    private static final Logger log = LoggerFactory.getLogger(TdsTokenStreamHandler.class);

    private final TdsTokenParserOptions options;
    private final TdsObservabilitySink sink;

    private TdsTokenStreamParser parser;
    private ChannelHandlerContext context;

    public TdsTokenStreamHandler(TdsTokenParserOptions options, TdsObservabilitySink sink)
    {
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx)
    {
        this.context = ctx;
        this.parser = DefaultTdsTokenStreamParser.builder()
                .withOptions(options)
                .withObservabilitySink(sink)
                .withListener(new ContextListener())
                .build();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (msg instanceof ByteBuf content) {
            final byte[] bytes;
            try {
                bytes = new byte[content.readableBytes()];
                content.readBytes(bytes);
            }
            finally {
                ReferenceCountUtil.release(content);
            }
            parser.write(TdsChunk.bytes(bytes));
        }
        else if (msg instanceof TdsChunk.EndOfMessage marker) {
            parser.write(marker);
        }
        else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        if (!parser.isFailed() && (parser.isSuspended() || parser.bufferedBytes() > 0)) {
            log.warn("Channel closed with {} unconsumed token-stream bytes", parser.bufferedBytes());
            ctx.fireExceptionCaught(new TdsDecodeException(
                    "Token stream truncated: " + parser.bufferedBytes() + " bytes of an incomplete token"));
        }
        ctx.fireChannelInactive();
    }

    /**
     * @return the parser behind this handler, for truncation checks at channel close
     */
    public TdsTokenStreamParser parser()
    {
        return parser;
    }

    /**
     * Forwards parser output into the pipeline.
     */
    private final class ContextListener implements TdsTokenStreamListener
    {
        @Override
        public void onToken(TdsToken token)
        {
            context.fireChannelRead(token);
        }

        @Override
        public void onError(TdsDecodeException cause)
        {
            context.fireExceptionCaught(cause);
        }
    }
}
