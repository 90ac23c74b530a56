package io.contractrpc.servlet;

import io.contractrpc.core.Issue;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.server.core.ContractRouter;
import io.contractrpc.server.core.ResponseBody;
import io.contractrpc.server.core.ServerRequest;
import io.contractrpc.server.core.ServerResponse;
import io.contractrpc.server.core.SseFrame;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Serves a {@link ContractRouter} from a Jakarta Servlet container.
 *
 * <p>Standard responses are written directly. Push-event and chunked-stream responses switch the request
 * to async mode and write each frame as it is published; a failed write or an async error/timeout cancels
 * the stream, which the router sees as a client disconnect. Message endpoints need a WebSocket
 * integration and are answered with 426 here.
 */
public final class ContractRpcServlet extends HttpServlet {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContractRpcServlet.class);

    private final transient ContractRouter router;

    public ContractRpcServlet(ContractRouter router) {
        this.router = router;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerResponse engineResp;
        try {
            engineResp = router.handle(toEngineRequest(req));
        } catch (URISyntaxException e) {
            engineResp = router.reject(new RequestValidationException(RequestValidationException.QUERY,
                    List.of(new Issue("invalid_query", List.of(), "Query string is not validly encoded"))));
        } catch (Exception e) {
            LOGGER.error("Failed to adapt {} {}", req.getMethod(), req.getRequestURI(), e);
            resp.setStatus(500);
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Empty) {
            return;
        }
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.getOutputStream().write(bytes.bytes());
            return;
        }
        if (body instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse.publisher(), SseFrame::render);
            return;
        }
        if (body instanceof ResponseBody.Ndjson ndjson) {
            stream(req, resp, ndjson.publisher(), line -> line + "\n");
        }
    }

    private static <T> void stream(HttpServletRequest req, HttpServletResponse resp, Flow.Publisher<T> pub,
                                   Function<T, String> render) throws IOException {
        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        resp.flushBuffer();

        OutputStream out = resp.getOutputStream();
        FrameWriter<T> writer = new FrameWriter<>(async, out, render);
        async.addListener(writer);
        pub.subscribe(writer);
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req) throws Exception {
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        InputStream body = req.getContentLengthLong() == 0 ? null : req.getInputStream();
        return new ServerRequest(req.getMethod(), uri, headers, body);
    }

    /**
     * Writes published frames to the async response and completes it once the stream ends.
     */
    private static final class FrameWriter<T> implements Flow.Subscriber<T>, AsyncListener {
        private final AsyncContext async;
        private final OutputStream out;
        private final Function<T, String> render;
        private final AtomicBoolean completed = new AtomicBoolean(false);
        private volatile Flow.Subscription subscription;

        FrameWriter(AsyncContext async, OutputStream out, Function<T, String> render) {
            this.async = async;
            this.out = out;
            this.render = render;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(T item) {
            try {
                out.write(render.apply(item).getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                LOGGER.debug("Client went away while streaming", e);
                disconnect();
            }
        }

        @Override
        public void onError(Throwable throwable) {
            complete();
        }

        @Override
        public void onComplete() {
            complete();
        }

        @Override
        public void onComplete(AsyncEvent event) {
            completed.set(true);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            disconnect();
        }

        @Override
        public void onError(AsyncEvent event) {
            disconnect();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // the listener stays registered for the lifetime of this async cycle
        }

        private void disconnect() {
            Flow.Subscription s = subscription;
            if (s != null) s.cancel();
            complete();
        }

        private void complete() {
            if (completed.compareAndSet(false, true)) {
                async.complete();
            }
        }
    }
}
