package org.routeflow.http.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.multipart.Attribute;
import io.netty.handler.codec.http.multipart.DefaultHttpDataFactory;
import io.netty.handler.codec.http.multipart.HttpPostRequestDecoder;
import io.netty.handler.codec.http.multipart.InterfaceHttpData;
import lombok.extern.slf4j.Slf4j;
import org.routeflow.exception.HandlerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Netty front for a {@link Router}: turns a request into the router's inputs and writes whatever the router
 * returned back as a response.
 */
@Slf4j
public class DispatcherHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final String JSON = "application/json; charset=UTF-8";
    private static final String TEXT = "text/plain; charset=UTF-8";

    private final Router router;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DispatcherHandler(Router router) {
        this.router = router;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String method = request.method().name();
        String uri = request.uri();

        FullHttpResponse response;
        try {
            Object result = router.handle(method, uri, formFields(request));
            response = render(result);
        } catch (HandlerException e) {
            log.error("Route handler misconfigured for {} {}: {}", method, uri, e.getMessage(), e);
            response = error(e);
        } catch (Exception e) {
            log.error("Route handler failed for {} {}", method, uri, e);
            response = error(e);
        }
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private FormFields formFields(FullHttpRequest request) {
        if (!HttpMethod.POST.equals(request.method()) || !isFormBody(request)) {
            return FormFields.none();
        }
        Map<String, String> fields = new HashMap<>();
        HttpPostRequestDecoder decoder = null;
        try {
            decoder = new HttpPostRequestDecoder(new DefaultHttpDataFactory(false), request);
            for (InterfaceHttpData data : decoder.getBodyHttpDatas()) {
                if (data instanceof Attribute attribute) {
                    fields.put(attribute.getName(), attribute.getValue());
                }
            }
        } catch (HttpPostRequestDecoder.ErrorDataDecoderException | IOException e) {
            log.warn("Cannot decode form body of {} {}, ignoring method override", request.method(), request.uri(), e);
            return FormFields.none();
        } finally {
            if (decoder != null) {
                decoder.destroy();
            }
        }
        return FormFields.of(fields);
    }

    private static boolean isFormBody(FullHttpRequest request) {
        String contentType = request.headers().get(HttpHeaderNames.CONTENT_TYPE);
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return normalized.startsWith(HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED.toString())
                || normalized.startsWith(HttpHeaderValues.MULTIPART_FORM_DATA.toString());
    }

    private FullHttpResponse render(Object result) throws Exception {
        if (result instanceof NotFoundResponse notFound) {
            return buildResponse(HttpResponseStatus.valueOf(notFound.status()), notFound.contentType(),
                    notFound.body().getBytes(StandardCharsets.UTF_8));
        }
        if (result instanceof CharSequence text) {
            return buildResponse(HttpResponseStatus.OK, TEXT, text.toString().getBytes(StandardCharsets.UTF_8));
        }
        return buildResponse(HttpResponseStatus.OK, JSON, objectMapper.writeValueAsBytes(result));
    }

    private FullHttpResponse error(Exception e) {
        try {
            byte[] body = objectMapper.writeValueAsBytes(Map.of("error", String.valueOf(e.getMessage())));
            return buildResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, JSON, body);
        } catch (Exception encodingFailure) {
            log.warn("Cannot encode error body", encodingFailure);
            return buildResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, TEXT,
                    "Internal error".getBytes(StandardCharsets.UTF_8));
        }
    }

    private FullHttpResponse buildResponse(HttpResponseStatus status, String contentType, byte[] body) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(body)
        );
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return response;
    }

}
