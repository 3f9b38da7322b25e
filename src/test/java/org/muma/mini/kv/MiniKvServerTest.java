package org.muma.mini.kv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.config.MiniKvConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 启动真实的 Netty 服务 (随机端口)，通过 TCP 发送 RESP 帧
 */
class MiniKvServerTest {

    private MiniKvServer server;
    private int port;

    @BeforeEach
    void setUp() throws InterruptedException {
        MiniKvConfig config = new MiniKvConfig();
        config.setPort(0);
        config.setWorkerThreads(2);
        config.setDir("/tmp/mini-kv");
        config.setDbFilename("dump.rdb");

        server = new MiniKvServer(config);
        server.start();
        port = server.getBoundPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static String frame(String... parts) {
        StringBuilder sb = new StringBuilder("*").append(parts.length).append("\r\n");
        for (String p : parts) {
            sb.append('$').append(p.getBytes(StandardCharsets.UTF_8).length).append("\r\n").append(p).append("\r\n");
        }
        return sb.toString();
    }

    private static class Client implements AutoCloseable {
        private final Socket socket;
        private final InputStream in;
        private final OutputStream out;

        Client(int port) throws IOException {
            socket = new Socket("127.0.0.1", port);
            socket.setSoTimeout(5000);
            in = socket.getInputStream();
            out = socket.getOutputStream();
        }

        // 发送一帧并读取与期望回复等长的字节
        String call(String frame, int replyLength) throws IOException {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return new String(in.readNBytes(replyLength), StandardCharsets.UTF_8);
        }

        String expect(String frame, String reply) throws IOException {
            return call(frame, reply.getBytes(StandardCharsets.UTF_8).length);
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    @Test
    void testScenarioOverTcp() throws IOException {
        try (Client client = new Client(port)) {
            assertEquals("+PONG\r\n", client.expect(frame("PING"), "+PONG\r\n"));
            assertEquals("+OK\r\n", client.expect(frame("SET", "foo", "bar"), "+OK\r\n"));
            assertEquals("$3\r\nbar\r\n", client.expect(frame("GET", "foo"), "$3\r\nbar\r\n"));
            assertEquals("$-1\r\n", client.expect(frame("GET", "missing"), "$-1\r\n"));
        }
    }

    @Test
    void testStartupDirAndDbfilenameVisibleThroughConfigGet() throws IOException {
        String expected = "*2\r\n$3\r\ndir\r\n$12\r\n/tmp/mini-kv\r\n";
        try (Client client = new Client(port)) {
            assertEquals(expected, client.expect(frame("CONFIG", "GET", "dir"), expected));
        }
    }

    @Test
    void testTtlOverTcp() throws Exception {
        try (Client client = new Client(port)) {
            client.expect(frame("SET", "temp", "v", "px", "50"), "+OK\r\n");
            assertEquals("$1\r\nv\r\n", client.expect(frame("GET", "temp"), "$1\r\nv\r\n"));
            Thread.sleep(100);
            assertEquals("$-1\r\n", client.expect(frame("GET", "temp"), "$-1\r\n"));
        }
    }

    @Test
    void testClosedClientDoesNotAffectOthers() throws IOException {
        try (Client survivor = new Client(port)) {
            Client leaving = new Client(port);
            leaving.expect(frame("SET", "k", "v"), "+OK\r\n");
            leaving.close();

            assertEquals("$1\r\nv\r\n", survivor.expect(frame("GET", "k"), "$1\r\nv\r\n"));
        }
    }

    @Test
    void testConcurrentSetsLeaveOneWholeValue() throws Exception {
        int rounds = 500;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> f1 = pool.submit(() -> writeRepeatedly("value-one", rounds, start));
            Future<?> f2 = pool.submit(() -> writeRepeatedly("value-two", rounds, start));
            start.countDown();
            f1.get(20, TimeUnit.SECONDS);
            f2.get(20, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        try (Client client = new Client(port)) {
            String reply = client.expect(frame("GET", "k"), "$9\r\nvalue-one\r\n");
            assertTrue(reply.equals("$9\r\nvalue-one\r\n") || reply.equals("$9\r\nvalue-two\r\n"),
                    "Unexpected reply: " + reply);
        }
    }

    private Void writeRepeatedly(String value, int rounds, CountDownLatch start) throws Exception {
        try (Client client = new Client(port)) {
            start.await();
            for (int i = 0; i < rounds; i++) {
                assertEquals("+OK\r\n", client.expect(frame("SET", "k", value), "+OK\r\n"));
            }
        }
        return null;
    }
}
