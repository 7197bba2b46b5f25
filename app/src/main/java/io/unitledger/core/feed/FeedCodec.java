package io.unitledger.core.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.CharsetUtil;

import java.util.List;
import java.util.Map;

/** 4-byte length prefix, UTF-8 JSON body. Shared by the feed server and client. */
final class FeedCodec extends MessageToMessageCodec<String, FeedMessage> {
    static final int MAX_FRAME_BYTES = 1 << 20;
    static final ObjectMapper MAPPER = new ObjectMapper();

    private FeedCodec() {
    }

    static void configure(ChannelPipeline pipeline) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new FeedCodec());
    }

    static Map<String, Object> toPayload(Object value) {
        return MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
    }

    static <T> T fromPayload(Map<String, Object> payload, Class<T> type) {
        return MAPPER.convertValue(payload, type);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, FeedMessage msg, List<Object> out) throws Exception {
        out.add(MAPPER.writeValueAsString(msg));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws Exception {
        out.add(MAPPER.readValue(msg, FeedMessage.class));
    }
}
