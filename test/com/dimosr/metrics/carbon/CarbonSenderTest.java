package com.dimosr.metrics.carbon;

import com.dimosr.metrics.exceptions.SendFailedException;
import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import javax.net.SocketFactory;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class CarbonSenderTest {

    private static final HostAndPort COLLECTOR = HostAndPort.fromParts("127.0.0.1", 2003);
    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final long TIMESTAMP = 1_577_836_800L;

    private static final List<CarbonLine> BATCH = ImmutableList.of(
            new CarbonLine("app.requests.count", 5, TIMESTAMP),
            new CarbonLine("app.requests.m1", 0.5, TIMESTAMP));

    @Mock
    private SocketFactory socketFactory;
    @Mock
    private Socket failingSocket;
    @Mock
    private Socket workingSocket;

    private CarbonSender sender;

    @Before
    public void setupSender() {
        sender = new CarbonSender(COLLECTOR, socketFactory, TIMEOUT, TIMEOUT);
    }

    @After
    public void closeSender() {
        sender.close();
    }

    @Test
    public void deliversLinesToTheCollector() throws Exception {
        try (ServerSocket collector = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            CarbonSender realSender = new CarbonSender(
                    HostAndPort.fromParts(collector.getInetAddress().getHostAddress(), collector.getLocalPort()),
                    SocketFactory.getDefault(), TIMEOUT, TIMEOUT);
            try {
                realSender.send(BATCH);
                assertThat(realSender.isConnected()).isTrue();

                try (Socket connection = collector.accept()) {
                    connection.setSoTimeout(5000);
                    BufferedReader reader = new BufferedReader(
                            new InputStreamReader(connection.getInputStream(), StandardCharsets.UTF_8));

                    assertThat(reader.readLine()).isEqualTo("app.requests.count 5 1577836800");
                    assertThat(reader.readLine()).isEqualTo("app.requests.m1 0.5 1577836800");
                }
            } finally {
                realSender.close();
            }
        }
    }

    @Test
    public void reusesTheConnectionAcrossBatches() throws Exception {
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        when(socketFactory.createSocket()).thenReturn(workingSocket);
        when(workingSocket.getOutputStream()).thenReturn(received);

        sender.send(BATCH);
        sender.send(BATCH);

        verify(socketFactory, times(1)).createSocket();
        verify(workingSocket).connect(any(SocketAddress.class), anyInt());
        assertThat(received.toString(StandardCharsets.UTF_8.name()).split("\n")).hasSize(4);
        assertThat(sender.lastError()).isEmpty();
    }

    @Test
    public void whenWriteFailsThenConnectionIsClosedAndNextSendReconnects() throws Exception {
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        when(socketFactory.createSocket()).thenReturn(failingSocket, workingSocket);
        when(failingSocket.getOutputStream()).thenReturn(new FailingOutputStream());
        when(workingSocket.getOutputStream()).thenReturn(received);

        assertThatThrownBy(() -> sender.send(BATCH))
                .isInstanceOf(SendFailedException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(sender.isConnected()).isFalse();
        assertThat(sender.lastError()).isPresent();
        verify(failingSocket).close();

        sender.send(BATCH);

        verify(socketFactory, times(2)).createSocket();
        assertThat(sender.isConnected()).isTrue();
        assertThat(sender.lastError()).isEmpty();
        assertThat(received.toString(StandardCharsets.UTF_8.name()))
                .isEqualTo("app.requests.count 5 1577836800\napp.requests.m1 0.5 1577836800\n");
    }

    @Test
    public void whenConnectFailsThenFailureIsSurfaced() throws Exception {
        when(socketFactory.createSocket()).thenReturn(failingSocket);
        doThrow(new ConnectException("Connection refused")).when(failingSocket).connect(any(SocketAddress.class), anyInt());

        assertThatThrownBy(() -> sender.send(BATCH))
                .isInstanceOf(SendFailedException.class)
                .hasCauseInstanceOf(ConnectException.class);

        assertThat(sender.isConnected()).isFalse();
        verify(failingSocket).close();
    }

    @Test
    public void whenWriteBlocksThenItTimesOut() throws Exception {
        CountDownLatch neverReleased = new CountDownLatch(1);
        sender.close();
        sender = new CarbonSender(COLLECTOR, socketFactory, TIMEOUT, Duration.ofMillis(100));
        when(socketFactory.createSocket()).thenReturn(failingSocket);
        when(failingSocket.getOutputStream()).thenReturn(new BlockingOutputStream(neverReleased));

        assertThatThrownBy(() -> sender.send(BATCH))
                .isInstanceOf(SendFailedException.class)
                .hasCauseInstanceOf(TimeoutException.class);

        assertThat(sender.isConnected()).isFalse();
        verify(failingSocket).close();
    }

    @Test
    public void emptyBatchesAreNotSent() throws Exception {
        sender.send(ImmutableList.of());

        verify(socketFactory, never()).createSocket();
        assertThat(sender.isConnected()).isFalse();
    }

    @Test
    public void connectTimeoutsLongerThanTheSocketLimitAreSaturated() throws Exception {
        sender.close();
        sender = new CarbonSender(COLLECTOR, socketFactory, Duration.ofDays(30), TIMEOUT);
        when(socketFactory.createSocket()).thenReturn(workingSocket);
        when(workingSocket.getOutputStream()).thenReturn(new ByteArrayOutputStream());

        sender.send(BATCH);

        verify(workingSocket).connect(any(SocketAddress.class), eq(Integer.MAX_VALUE));
        assertThat(sender.isConnected()).isTrue();
    }

    @Test
    public void closeWaitsForAnInFlightSendToComplete() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        sender.close();
        sender = new CarbonSender(COLLECTOR, socketFactory, TIMEOUT, Duration.ofSeconds(5));
        when(socketFactory.createSocket()).thenReturn(workingSocket);
        when(workingSocket.getOutputStream()).thenReturn(new BlockingOutputStream(release));

        ExecutorService threads = Executors.newFixedThreadPool(2);
        try {
            Future<?> sending = threads.submit(() -> sender.send(BATCH));
            verify(workingSocket, timeout(2000)).getOutputStream();
            Future<?> closing = threads.submit(sender::close);

            Thread.sleep(200);
            assertThat(closing.isDone()).isFalse();

            release.countDown();
            sending.get(5, TimeUnit.SECONDS);
            closing.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            threads.shutdown();
        }

        verify(workingSocket).close();
        assertThat(sender.isConnected()).isFalse();
    }

    private static class FailingOutputStream extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
        }
    }

    private static class BlockingOutputStream extends OutputStream {
        private final CountDownLatch latch;

        private BlockingOutputStream(final CountDownLatch latch) {
            this.latch = latch;
        }

        @Override
        public void write(int b) throws IOException {
            try {
                latch.await();
            } catch (InterruptedException e) {
                throw new InterruptedIOException("Write interrupted");
            }
        }
    }
}
