package com.skyrelay.bridge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import com.skyrelay.bridge.MutableClock;
import com.skyrelay.bridge.config.BridgeProperties;
import com.skyrelay.bridge.link.LinkConnection;
import com.skyrelay.bridge.link.LinkStatistics;
import com.skyrelay.bridge.link.TelemetryLinkFactory;
import com.skyrelay.bridge.model.TelemetrySnapshot;
import com.skyrelay.bridge.model.TelemetryUpdate;
import com.skyrelay.bridge.store.TelemetryStateStore;
import com.skyrelay.bridge.stream.BroadcastHub;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@ExtendWith(MockitoExtension.class)
class TelemetryStreamServiceTest {
  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private TelemetryLinkFactory linkFactory;

  private MutableClock clock;
  private BroadcastHub hub;
  private TelemetryQueryService queryService;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    BridgeProperties properties = new BridgeProperties();
    hub = new BroadcastHub(properties, meterRegistry);
    lenient().when(linkFactory.address()).thenReturn("sim:");
    queryService = new TelemetryQueryService(
        new TelemetryStateStore(clock),
        new LinkConnection(clock),
        new LinkStatistics(meterRegistry),
        linkFactory,
        hub,
        clock,
        properties,
        meterRegistry);
  }

  @AfterEach
  void tearDown() {
    hub.shutdown();
  }

  @Test
  void openStream_beforeTelemetrySendsUnavailableThenTelemetryEvents() {
    ScriptedEmitter emitter = ScriptedEmitter.healthy();
    TestTelemetryStreamService service =
        new TestTelemetryStreamService(hub, queryService, clock, emitter);

    service.openStream();
    await(() -> emitter.texts.size() >= 1);
    hub.publish(snapshot(1L));
    await(() -> emitter.texts.size() >= 2);

    assertTrue(emitter.texts.get(0).contains("event:unavailable"));
    assertTrue(emitter.texts.get(1).contains("event:telemetry"));
    assertTrue(emitter.texts.get(1).contains("id:1"));
    assertTrue(hub.subscriberCount() == 1);
    assertFalse(emitter.completeCalled);
  }

  @Test
  void unavailableEvent_isStampedWithServiceClock() {
    clock.advance(Duration.ofMinutes(5));
    ScriptedEmitter emitter = ScriptedEmitter.healthy();
    TestTelemetryStreamService service =
        new TestTelemetryStreamService(hub, queryService, clock, emitter);

    service.openStream();
    await(() -> emitter.payloads.size() >= 1);

    Map<?, ?> payload = assertInstanceOf(Map.class, emitter.payloads.get(0));
    assertEquals("unavailable", payload.get("error"));
    assertEquals("2026-03-01T12:05:00Z", payload.get("timestamp"));
  }

  @Test
  void openStream_afterTelemetryStartsWithCurrentSnapshot() {
    hub.publish(snapshot(7L));
    ScriptedEmitter emitter = ScriptedEmitter.healthy();
    TestTelemetryStreamService service =
        new TestTelemetryStreamService(hub, queryService, clock, emitter);

    service.openStream();
    await(() -> emitter.texts.size() >= 1);

    assertTrue(emitter.texts.get(0).contains("event:telemetry"));
    assertTrue(emitter.texts.get(0).contains("id:7"));
  }

  @Test
  void openStream_expectedDisconnectCleansEmitterWithoutErrorCompletion() {
    hub.publish(snapshot(1L));
    ScriptedEmitter emitter = ScriptedEmitter.failOnSend(1, new IOException("Broken pipe"));
    TestTelemetryStreamService service =
        new TestTelemetryStreamService(hub, queryService, clock, emitter);

    service.openStream();
    await(() -> emitter.completeCalled);

    assertFalse(emitter.completeWithErrorCalled);
    await(() -> hub.subscriberCount() == 0);
  }

  @Test
  void openStream_unexpectedFailureCompletesWithError() {
    hub.publish(snapshot(1L));
    IllegalStateException failure = new IllegalStateException("serialization failed");
    ScriptedEmitter emitter = ScriptedEmitter.failOnSend(1, failure);
    TestTelemetryStreamService service =
        new TestTelemetryStreamService(hub, queryService, clock, emitter);

    service.openStream();
    await(() -> emitter.completeWithErrorCalled);

    assertFalse(emitter.completeCalled);
    assertSame(failure, emitter.completeWithErrorThrowable);
    await(() -> hub.subscriberCount() == 0);
  }

  private static TelemetrySnapshot snapshot(long sequence) {
    return TelemetrySnapshot.merge(
        null, TelemetryUpdate.builder().position(33.7, -84.3, 100.0).build(), sequence, T0);
  }

  private static void await(BooleanSupplier condition) {
    long deadline = System.currentTimeMillis() + 2_000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("condition not met within 2s");
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new AssertionError("interrupted");
      }
    }
  }

  private static final class TestTelemetryStreamService extends TelemetryStreamService {
    private final SseEmitter emitter;

    private TestTelemetryStreamService(
        BroadcastHub hub, TelemetryQueryService queryService, Clock clock, SseEmitter emitter) {
      super(hub, queryService, clock);
      this.emitter = emitter;
    }

    @Override
    SseEmitter createEmitter() {
      return emitter;
    }
  }

  private static final class ScriptedEmitter extends SseEmitter {
    private final int failOnSend;
    private final IOException ioFailure;
    private final RuntimeException runtimeFailure;
    private final List<String> texts = new CopyOnWriteArrayList<>();
    private final List<Object> payloads = new CopyOnWriteArrayList<>();
    private volatile int sendCalls;
    private volatile boolean completeCalled;
    private volatile boolean completeWithErrorCalled;
    private volatile Throwable completeWithErrorThrowable;

    private ScriptedEmitter(int failOnSend, IOException ioFailure, RuntimeException runtimeFailure) {
      super(0L);
      this.failOnSend = failOnSend;
      this.ioFailure = ioFailure;
      this.runtimeFailure = runtimeFailure;
    }

    private static ScriptedEmitter healthy() {
      return new ScriptedEmitter(-1, null, null);
    }

    private static ScriptedEmitter failOnSend(int sendNumber, IOException failure) {
      return new ScriptedEmitter(sendNumber, failure, null);
    }

    private static ScriptedEmitter failOnSend(int sendNumber, RuntimeException failure) {
      return new ScriptedEmitter(sendNumber, null, failure);
    }

    @Override
    public synchronized void send(SseEventBuilder builder) throws IOException {
      sendCalls++;
      if (sendCalls == failOnSend) {
        if (ioFailure != null) {
          throw ioFailure;
        }
        if (runtimeFailure != null) {
          throw runtimeFailure;
        }
      }
      Set<ResponseBodyEmitter.DataWithMediaType> parts = builder.build();
      for (ResponseBodyEmitter.DataWithMediaType part : parts) {
        if (!(part.getData() instanceof String)) {
          payloads.add(part.getData());
        }
      }
      texts.add(render(parts));
    }

    @Override
    public synchronized void complete() {
      completeCalled = true;
    }

    @Override
    public synchronized void completeWithError(Throwable ex) {
      completeWithErrorCalled = true;
      completeWithErrorThrowable = ex;
    }

    private static String render(Set<ResponseBodyEmitter.DataWithMediaType> parts) {
      StringBuilder text = new StringBuilder();
      for (ResponseBodyEmitter.DataWithMediaType part : parts) {
        text.append(part.getData() instanceof String value ? value : "<json>");
      }
      return text.toString();
    }
  }
}
