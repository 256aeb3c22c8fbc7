package com.dimosr.metrics.carbon;

import com.dimosr.metrics.exceptions.SendFailedException;
import com.google.common.net.HostAndPort;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends batches of lines to a Carbon collector over a single persistent TCP connection
 *
 * The connection is opened lazily, on the first send. Any failure closes the connection,
 * so that the next send opens a fresh one. Failures are not retried here: they are surfaced
 * to the caller as a SendFailedException and it is up to the caller to decide when to send again.
 *
 * A sender is meant to be used by a single reporting thread. Sending and closing are
 * mutually exclusive, so closing from another thread waits for an in-flight send to complete.
 */
public class CarbonSender implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(CarbonSender.class);

    private final HostAndPort collector;
    private final SocketFactory socketFactory;
    private final Duration connectTimeout;
    private final Duration writeTimeout;
    private final ExecutorService writer;

    private Socket socket;
    private OutputStream output;
    private Throwable lastError;

    /**
     * @param collector the host and port of the Carbon collector
     * @param socketFactory the factory used to create a socket for each new connection
     * @param connectTimeout the maximum time to wait for a connection to be established
     * @param writeTimeout the maximum time to wait for a batch to be written and flushed
     */
    public CarbonSender(final HostAndPort collector,
                        final SocketFactory socketFactory,
                        final Duration connectTimeout,
                        final Duration writeTimeout) {
        this.collector = collector;
        this.socketFactory = socketFactory;
        this.connectTimeout = connectTimeout;
        this.writeTimeout = writeTimeout;
        this.writer = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("carbon-sender-" + collector + "-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Writes all the lines to the collector, connecting first if there is no open connection
     *
     * @param lines the lines of the batch
     * @throws SendFailedException if the connection could not be established, or the batch could not be written in time
     */
    public synchronized void send(final List<CarbonLine> lines) {
        if (lines.isEmpty()) {
            return;
        }

        final byte[] payload = encode(lines);
        try {
            connectIfNecessary();
            write(payload);
            lastError = null;
            log.debug("Sent {} lines to {}", lines.size(), collector);
        } catch (IOException | TimeoutException | RejectedExecutionException e) {
            throw fail(String.format("Failed to send %d lines to %s", lines.size(), collector), e);
        } catch (ExecutionException e) {
            throw fail(String.format("Failed to send %d lines to %s", lines.size(), collector), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(String.format("Interrupted while sending %d lines to %s", lines.size(), collector), e);
        }
    }

    public synchronized boolean isConnected() {
        return socket != null;
    }

    /**
     * @return the failure of the last send, if it failed
     */
    public synchronized Optional<Throwable> lastError() {
        return Optional.ofNullable(lastError);
    }

    public HostAndPort collector() {
        return collector;
    }

    @Override
    public synchronized void close() {
        disconnect();
        writer.shutdownNow();
    }

    private void connectIfNecessary() throws IOException {
        if (socket != null) {
            return;
        }

        final Socket newSocket = socketFactory.createSocket();
        boolean connected = false;
        try {
            newSocket.connect(new InetSocketAddress(collector.getHost(), collector.getPort()),
                    Ints.saturatedCast(connectTimeout.toMillis()));
            output = new BufferedOutputStream(newSocket.getOutputStream());
            connected = true;
        } finally {
            if (!connected) {
                closeSocket(newSocket);
            }
        }
        socket = newSocket;
        log.info("Connected to Carbon collector at {}", collector);
    }

    private void write(final byte[] payload) throws InterruptedException, ExecutionException, TimeoutException {
        final OutputStream stream = output;
        final Future<?> pendingWrite = writer.submit(() -> {
            stream.write(payload);
            stream.flush();
            return null;
        });

        try {
            pendingWrite.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pendingWrite.cancel(true);
            throw e;
        }
    }

    private SendFailedException fail(final String message, final Throwable cause) {
        lastError = cause;
        disconnect();
        return new SendFailedException(message, cause);
    }

    private void disconnect() {
        if (socket != null) {
            closeSocket(socket);
            log.info("Disconnected from Carbon collector at {}", collector);
        }
        socket = null;
        output = null;
    }

    private void closeSocket(final Socket toClose) {
        try {
            toClose.close();
        } catch (IOException e) {
            log.warn("Failed to close the connection to {}", collector, e);
        }
    }

    private static byte[] encode(final List<CarbonLine> lines) {
        final StringBuilder batch = new StringBuilder();
        for (CarbonLine line : lines) {
            batch.append(line.format());
        }
        return batch.toString().getBytes(StandardCharsets.UTF_8);
    }
}
