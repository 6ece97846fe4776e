package processor;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;

import jetstream.ack.AckBridge;
import jetstream.ack.AckToken;
import jetstream.ack.BridgedMessage;
import jetstream.ack.InMemoryAckStore;
import jetstream.exceptions.BrokerException;
import jetstream.model.PulledMessage;

@ExtendWith(VertxExtension.class)
class MessageBatcherTest
{
  private final List<String> sent = new CopyOnWriteArrayList<>();

  private AckBridge                  bridge;
  private Function<String, AckToken> builder;

  @BeforeEach
  void setUp()
  {
    bridge  = new AckBridge( new InMemoryAckStore() );
    builder = bridge.builder( bridge.init( ( replyTo, action ) -> sent.add( action + ":" + replyTo ),
                                           Map.of( AckBridge.ON_FAILURE, "term" ) ) );
  }

  private BridgedMessage message( String payload, String replyTo )
  {
    return BridgedMessage.wrap( new PulledMessage( payload.getBytes( StandardCharsets.UTF_8 ), replyTo, Map.of() ), builder );
  }

  private static void waitUntil( BooleanSupplier condition ) throws InterruptedException
  {
    long deadline = System.currentTimeMillis() + 10_000;
    while( !condition.getAsBoolean() )
    {
      if( System.currentTimeMillis() > deadline )
        fail( "condition not reached within 10s" );
      Thread.sleep( 10 );
    }
  }

  @Test
  void fullBatchIsProcessedImmediately( Vertx vertx ) throws Exception
  {
    AtomicInteger  batches = new AtomicInteger();
    MessageBatcher batcher = new MessageBatcher( vertx, batch -> {
      batches.incrementAndGet();
      return new JsonPayloadProcessor().process( batch );
    }, 3, Duration.ofMinutes( 1 ) );
    batcher.start();

    batcher.add( message( "{}", "r1" ) );
    batcher.add( message( "{}", "r2" ) );
    assertEquals( 0, batches.get() );

    batcher.add( message( "{}", "r3" ) );
    waitUntil( () -> sent.size() == 3 );

    assertEquals( 1, batches.get() );
    assertTrue( sent.containsAll( List.of( "ACK:r1", "ACK:r2", "ACK:r3" ) ) );
    batcher.stop().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
  }

  @Test
  void partialBatchIsFlushedByAge( Vertx vertx ) throws Exception
  {
    MessageBatcher batcher = new MessageBatcher( vertx, new JsonPayloadProcessor(), 100, Duration.ofMillis( 50 ) );
    batcher.start();

    batcher.add( message( "{}", "r1" ) );
    batcher.add( message( "oops", "r2" ) );

    waitUntil( () -> sent.size() == 2 );
    assertTrue( sent.containsAll( List.of( "ACK:r1", "TERMINATE:r2" ) ) );
    batcher.stop().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
  }

  @Test
  void processorExceptionFailsTheWholeBatch( Vertx vertx ) throws Exception
  {
    MessageBatcher batcher = new MessageBatcher( vertx, batch -> {
      throw new IllegalStateException( "downstream unavailable" );
    }, 2, Duration.ofMinutes( 1 ) );
    batcher.start();

    batcher.add( message( "{}", "r1" ) );
    batcher.add( message( "{}", "r2" ) );

    waitUntil( () -> sent.size() == 2 );
    assertTrue( sent.containsAll( List.of( "TERMINATE:r1", "TERMINATE:r2" ) ) );
    batcher.stop().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
  }

  @Test
  void stopFlushesPendingAndDropsLaterMessages( Vertx vertx ) throws Exception
  {
    MessageBatcher batcher = new MessageBatcher( vertx, new JsonPayloadProcessor(), 100, Duration.ofMinutes( 1 ) );
    batcher.start();

    batcher.add( message( "{}", "r1" ) );
    batcher.stop().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );

    assertEquals( List.of( "ACK:r1" ), sent );
    assertEquals( 1, batcher.getBatchesProcessed() );

    batcher.add( message( "{}", "r2" ) );
    Thread.sleep( 100 );
    assertEquals( List.of( "ACK:r1" ), sent );
  }

  @Test
  void failedAcknowledgementsAreCounted( Vertx vertx ) throws Exception
  {
    AckBridge                  failing      = new AckBridge( new InMemoryAckStore() );
    Function<String, AckToken> failingBuild = failing.builder( failing.init( ( replyTo, action ) -> {
      throw new BrokerException( "publish to " + replyTo + " failed" );
    }));

    MessageBatcher batcher = new MessageBatcher( vertx, new JsonPayloadProcessor(), 1, Duration.ofMinutes( 1 ) );
    batcher.start();

    batcher.add( BridgedMessage.wrap( new PulledMessage( "{}".getBytes( StandardCharsets.UTF_8 ), "r1", Map.of() ), failingBuild ) );

    waitUntil( () -> batcher.getBatchesProcessed() == 1 );
    assertEquals( 1, batcher.getAckFailures() );
    batcher.stop().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
  }
}
