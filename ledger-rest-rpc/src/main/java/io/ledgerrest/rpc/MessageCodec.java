package io.ledgerrest.rpc;

import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.message.Message;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between length-delimited frame bodies and {@link Message}s.
 *
 * <p>
 * Sits above the length field codecs in the pipeline. A frame body that does
 * not decode is dropped with a warning; framing itself is intact, so the
 * connection stays usable and the request it answered simply times out.
 * Frames are hex-dumped at TRACE.
 */
final class MessageCodec extends MessageToMessageCodec<ByteBuf, Message> {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, List<Object> out) {
        final byte[] body = msg.encode();
        if (log.isTraceEnabled()) {
            log.trace("-> {} {}", msg, ByteBufUtil.hexDump(body));
        }
        out.add(Unpooled.wrappedBuffer(body));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        final byte[] body = ByteBufUtil.getBytes(frame);
        try {
            final Message msg = Message.decode(body);
            if (log.isTraceEnabled()) {
                log.trace("<- {} {}", msg, ByteBufUtil.hexDump(body));
            }
            out.add(msg);
        } catch (WireFormatException e) {
            log.warn("Dropping undecodable frame of {} bytes from {}: {}",
                    body.length, ctx.channel().remoteAddress(), e.getMessage());
        }
    }
}
