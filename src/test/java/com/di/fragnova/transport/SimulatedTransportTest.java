package com.di.fragnova.transport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SimulatedTransport Tests")
class SimulatedTransportTest {

    private static final long MIB = 1L << 20;

    private SimulatedTransport transport;

    private SimulatedTransport start(double failureRate, Duration baseLatency) {
        TransportProperties properties = new TransportProperties();
        properties.setFailureRate(failureRate);
        properties.setBaseLatency(baseLatency);
        transport = new SimulatedTransport(properties);
        return transport;
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.close();
        }
    }

    @Test
    @DisplayName("Same source and destination completes at once with zero latency")
    void noOpCompletesImmediately() throws Exception {
        start(1.0, Duration.ofMillis(2));
        CompletableFuture<TransferReceipt> future = transport.migrate(new TransferRequest("f", "0", "0", 4096, 1));

        assertTrue(future.isDone());
        assertEquals(0.0, future.get().latencySeconds());
    }

    @Test
    @DisplayName("Latency grows per whole MiB and is halved for priority zero")
    void latencyModel() {
        start(0.0, Duration.ofMillis(2));
        assertEquals(Duration.ofMillis(5), transport.latencyFor(new TransferRequest("f", "0", "1", 3 * MIB + 10, 1)));
        assertEquals(Duration.ofMillis(2).plusMillis(3).dividedBy(2),
                transport.latencyFor(new TransferRequest("f", "0", "1", 3 * MIB, 0)));
        assertEquals(Duration.ofMillis(2), transport.latencyFor(new TransferRequest("f", "0", "1", MIB - 1, 1)));
    }

    @Test
    @DisplayName("Successful transfer reports its destination and latency")
    void successfulTransfer() throws Exception {
        start(0.0, Duration.ofMillis(2));
        TransferReceipt receipt = transport.migrate(new TransferRequest("f", "0", "1", MIB, 1)).get(5, TimeUnit.SECONDS);

        assertEquals("f", receipt.fragmentId());
        assertEquals("1", receipt.destNode());
        assertEquals(0.003, receipt.latencySeconds(), 1e-9);
    }

    @Test
    @DisplayName("Failure rate of one fails every transfer with a TransportException")
    void alwaysFailing() {
        start(1.0, Duration.ofMillis(1));
        CompletableFuture<TransferReceipt> future = transport.migrate(new TransferRequest("f", "0", "1", 10, 0));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    @DisplayName("Closing fails outstanding transfers and rejects new ones")
    void closeFailsOutstanding() {
        start(0.0, Duration.ofSeconds(30));
        CompletableFuture<TransferReceipt> slow = transport.migrate(new TransferRequest("f", "0", "1", 10, 1));

        transport.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> slow.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
        assertTrue(transport.migrate(new TransferRequest("g", "0", "1", 10, 1)).isCompletedExceptionally());
    }

    @Test
    @DisplayName("A null request fails instead of throwing")
    void nullRequest() {
        start(0.0, Duration.ofMillis(1));
        assertTrue(transport.migrate(null).isCompletedExceptionally());
    }
}
