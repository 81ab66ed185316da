package net.spookly.gsdk.heartbeat;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport that records each request body and answers through a responder.
 */
public final class ScriptedTransport implements HeartbeatTransport {
    private final Responder responder;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public ScriptedTransport(Responder responder) {
        this.responder = responder;
    }

    public static ScriptedTransport replying(int status, String body) {
        return new ScriptedTransport(request -> new TransportResponse(status, body));
    }

    @Override
    public TransportResponse send(String requestBody) throws IOException {
        if (closed) {
            throw new IOException("closed");
        }
        requests.add(requestBody);
        return responder.respond(requestBody);
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> requests() {
        return requests;
    }

    public boolean closed() {
        return closed;
    }

    @FunctionalInterface
    public interface Responder {
        TransportResponse respond(String requestBody) throws IOException;
    }
}
