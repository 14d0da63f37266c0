package com.questrail.hexrot.test;

import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.codec.impl.HeaderCodec;
import com.questrail.hexrot.model.Command;
import com.questrail.hexrot.model.Header;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScriptedPeer
 * -----------------------------------------------------------------------------
 * A controller stand-in on a plain loopback socket. Tests write arbitrary
 * bytes to the connected link, including malformed streams the mock
 * controller never produces, and read the commands it sends.
 */
public final class ScriptedPeer implements AutoCloseable {

    private final ServerSocket listener;
    private final CompletableFuture<Socket> accepted = new CompletableFuture<>();

    public ScriptedPeer() throws IOException {
        listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(() -> {
            try {
                Socket s = listener.accept();
                s.setSoTimeout(2_000);
                accepted.complete(s);
            }
            catch (IOException e) {
                accepted.completeExceptionally(e);
            }
        }, "scripted-peer-accept");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public int port() {
        return listener.getLocalPort();
    }

    public void write(byte[]... parts) throws IOException {
        Socket s = socket();
        for (byte[] part : parts) {
            s.getOutputStream().write(part);
        }
        s.getOutputStream().flush();
    }

    public void writeFrame(Header header, byte[] payload) throws IOException {
        write(HeaderCodec.INSTANCE.encode(header), payload);
    }

    public Command readCommand() throws IOException {
        InputStream in = socket().getInputStream();
        byte[] bytes = in.readNBytes(CommandCodec.SIZE);
        if (bytes.length != CommandCodec.SIZE) {
            throw new IOException("stream ended after " + bytes.length + " bytes of a command");
        }
        return CommandCodec.INSTANCE.decode(bytes);
    }

    /** Closes the connection to the link but keeps listening. */
    public void hangUp() throws IOException {
        socket().close();
    }

    @Override
    public void close() throws IOException {
        listener.close();
        if (accepted.isDone() && !accepted.isCompletedExceptionally()) {
            accepted.join().close();
        }
    }

    private Socket socket() {
        try {
            return accepted.get(2, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for the link to connect", e);
        }
        catch (Exception e) {
            throw new UncheckedIOException(new IOException("link did not connect", e));
        }
    }
}
