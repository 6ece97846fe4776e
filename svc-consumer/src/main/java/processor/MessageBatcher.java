package processor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

import jetstream.ack.AckBatchResult;
import jetstream.ack.AckRef;
import jetstream.ack.AckToken;
import jetstream.ack.BridgedMessage;

/**
 * Collects bridged messages into batches bounded by size and age, processes
 * each batch on a worker executor and reports the outcome through the
 * acknowledger that issued the messages' tokens.
 *
 * {@link #add} may be called from any thread.
 */
public class MessageBatcher
{
  private static final Logger LOGGER = LoggerFactory.getLogger( MessageBatcher.class );

  private static final int  WORKER_POOL_SIZE = 4;
  private static final long MAX_EXECUTE_MINS = 5;

  private final Vertx            vertx;
  private final BatchProcessorIF processor;
  private final int              batchSize;
  private final Duration         batchTimeout;
  private final WorkerExecutor   workerExecutor;

  private final Object               lock          = new Object();
  private List<BridgedMessage>       pending       = new ArrayList<>();
  private final List<Future<Void>>   inFlight      = new ArrayList<>();
  private long                       timerId       = -1;
  private boolean                    stopped       = false;

  private final AtomicLong batchesProcessed = new AtomicLong( 0 );
  private final AtomicLong ackFailures      = new AtomicLong( 0 );

  public MessageBatcher( Vertx vertx, BatchProcessorIF processor, int batchSize, Duration batchTimeout )
  {
    this.vertx          = vertx;
    this.processor      = processor;
    this.batchSize      = batchSize;
    this.batchTimeout   = batchTimeout;
    this.workerExecutor = vertx.createSharedWorkerExecutor( "batch-processor", WORKER_POOL_SIZE, MAX_EXECUTE_MINS, TimeUnit.MINUTES );
  }

  /**
   * Starts the age based flush.
   */
  public void start()
  {
    synchronized( lock )
    {
      timerId = vertx.setPeriodic( Math.max( 1, batchTimeout.toMillis() ), id -> flush() );
    }
    LOGGER.info( "MessageBatcher started - batchSize={} batchTimeout={}ms", batchSize, batchTimeout.toMillis() );
  }

  public void add( BridgedMessage message )
  {
    synchronized( lock )
    {
      if( stopped )
      {
        // Never acknowledged, so the broker redelivers it
        LOGGER.debug( "MessageBatcher stopped - dropping {}", message );
        return;
      }

      pending.add( message );
      if( pending.size() >= batchSize )
      {
        dispatchPending();
      }
    }
  }

  /**
   * Dispatches whatever is pending.
   *
   * @return completes once the dispatched batch is processed and acknowledged
   */
  public Future<Void> flush()
  {
    synchronized( lock )
    {
      return dispatchPending();
    }
  }

  /**
   * Stops the timer, flushes the pending batch and waits for every batch in flight.
   */
  public Future<Void> stop()
  {
    List<Future<Void>> outstanding;
    synchronized( lock )
    {
      if( timerId != -1 )
      {
        vertx.cancelTimer( timerId );
        timerId = -1;
      }

      dispatchPending();
      stopped     = true;
      outstanding = new ArrayList<>( inFlight );
    }

    return Future.join( outstanding )
                 .<Void>mapEmpty()
                 .recover( e -> Future.succeededFuture() )
                 .onComplete( v -> {
                   workerExecutor.close();
                   LOGGER.info( "MessageBatcher stopped - {} batch(es) processed, {} acknowledgement failure(s)",
                                batchesProcessed.get(), ackFailures.get() );
                 });
  }

  // Called with the lock held
  private Future<Void> dispatchPending()
  {
    if( pending.isEmpty() )
      return Future.succeededFuture();

    List<BridgedMessage> batch = pending;
    pending = new ArrayList<>();
    return dispatch( batch );
  }

  private Future<Void> dispatch( List<BridgedMessage> batch )
  {
    Future<Void> result = workerExecutor.executeBlocking( () -> processAndAcknowledge( batch ), false );

    synchronized( lock )
    {
      inFlight.add( result );
    }

    return result.onComplete( ar -> {
      synchronized( lock )
      {
        inFlight.remove( result );
      }
      if( ar.failed() )
      {
        LOGGER.error( "Batch of {} message(s) could not be acknowledged: {}", batch.size(), ar.cause().getMessage(), ar.cause() );
      }
    });
  }

  private Void processAndAcknowledge( List<BridgedMessage> batch )
  {
    BatchOutcome outcome;
    try
    {
      outcome = processor.process( batch );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Batch processor failed on {} message(s): {}", batch.size(), e.getMessage(), e );
      outcome = BatchOutcome.allFailed( batch );
    }

    // Each acknowledger session is settled with its own ref
    Map<AckRef, List<BridgedMessage>> successful = group( outcome.getSuccessful() );
    Map<AckRef, List<BridgedMessage>> failed     = group( outcome.getFailed() );

    Map<AckRef, AckToken> sessions = new LinkedHashMap<>();
    for( BridgedMessage message : batch )
    {
      sessions.putIfAbsent( message.getAckToken().getRef(), message.getAckToken() );
    }

    for( Map.Entry<AckRef, AckToken> session : sessions.entrySet() )
    {
      AckRef         ref    = session.getKey();
      AckBatchResult result = session.getValue().getBridge().ack( ref,
                                                                  successful.getOrDefault( ref, List.of() ),
                                                                  failed.getOrDefault( ref, List.of() ) );
      ackFailures.addAndGet( result.failures().size() );
      LOGGER.debug( "Batch settled for {} - sent={} failures={}", ref, result.totalSent(), result.failures().size() );
    }

    batchesProcessed.incrementAndGet();
    return null;
  }

  private static Map<AckRef, List<BridgedMessage>> group( List<BridgedMessage> messages )
  {
    Map<AckRef, List<BridgedMessage>> grouped = new LinkedHashMap<>();
    for( BridgedMessage message : messages )
    {
      grouped.computeIfAbsent( message.getAckToken().getRef(), k -> new ArrayList<>() ).add( message );
    }
    return grouped;
  }

  public long getBatchesProcessed() { return batchesProcessed.get(); }
  public long getAckFailures()      { return ackFailures.get();      }
}
