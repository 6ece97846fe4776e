package verticle;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import jetstream.ack.AckBridge;
import jetstream.ack.AckRef;
import jetstream.ack.BridgingPullHandler;
import jetstream.consumer.PullConsumer;
import jetstream.consumer.PullConsumerOptions;
import jetstream.nats.AckChannelIF;
import jetstream.nats.BrokerConnectorIF;

import processor.BatchProcessorIF;
import processor.MessageBatcher;
import utils.ConsumerServiceConfig;

/**
 * Batch Consumer Verticle - bridged pull consumer
 *
 * Pulls messages from the configured durable consumer, collects them into
 * batches and acknowledges each batch through the {@link AckBridge} once the
 * {@link BatchProcessorIF} has processed it.
 *
 * Deployment config: see {@link ConsumerServiceConfig#toJson()}.
 */
public class BatchConsumerVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( BatchConsumerVert.class );

  private final BrokerConnectorIF connector;
  private final BatchProcessorIF  processor;
  private final AckBridge         ackBridge;

  private final AtomicReference<PullConsumer<Long>> consumerRef = new AtomicReference<>();

  private MessageBatcher batcher = null;

  public BatchConsumerVert( BrokerConnectorIF connector, BatchProcessorIF processor, AckBridge ackBridge )
  {
    this.connector = connector;
    this.processor = processor;
    this.ackBridge = ackBridge;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    ConsumerServiceConfig svcConfig;
    PullConsumerOptions   options;
    try
    {
      svcConfig = ConsumerServiceConfig.fromJson( config() );
      options   = PullConsumerOptions.fromConfig( connector, config() );
    }
    catch( IllegalArgumentException e )
    {
      LOGGER.error( "❌ BatchConsumerVert configuration rejected: {}", e.getMessage() );
      startPromise.fail( e );
      return;
    }

    LOGGER.info( "╔═══════════════════════════════════════════════════════════════════╗" );
    LOGGER.info( "║ BatchConsumerVert initializing                                    ║" );
    LOGGER.info( "║ Service: {} ║", String.format( "%-56s", svcConfig.getServiceId() ) );
    LOGGER.info( "║ Stream: {} ║",  String.format( "%-57s", svcConfig.getStreamName() ) );
    LOGGER.info( "║ Consumer: {} ║", String.format( "%-55s", svcConfig.getConsumerName() ) );
    LOGGER.info( "╚═══════════════════════════════════════════════════════════════════╝" );

    try
    {
      // Acks go through whichever connection the session currently holds
      AckChannelIF channel = ( replyTo, action ) -> {
        PullConsumer<Long> consumer = consumerRef.get();
        if( consumer == null )
          throw new IllegalStateException( "Pull consumer not started" );
        consumer.acknowledge( replyTo, action );
      };

      AckRef ref = ackBridge.init( channel, svcConfig.ackOptions() );

      batcher = new MessageBatcher( vertx, processor, svcConfig.getBatchSize(), Duration.ofMillis( svcConfig.getBatchTimeoutMs() ) );
      batcher.start();

      BridgingPullHandler handler = new BridgingPullHandler( ackBridge, ref, batcher::add );

      PullConsumer.start( vertx, handler, null, options )
        .onSuccess( consumer -> {
          consumerRef.set( consumer );
          watch( consumer );
          LOGGER.info( "✅ BatchConsumerVert started - pull consumer {}", consumer.getKey() );
          startPromise.complete();
        })
        .onFailure( e -> {
          LOGGER.error( "❌ Failed to start BatchConsumerVert: {}", e.getMessage(), e );
          batcher.stop();
          startPromise.fail( e );
        });
    }
    catch( Exception e )
    {
      LOGGER.error( "❌ Exception during BatchConsumerVert initialization: {}", e.getMessage(), e );
      if( batcher != null )
        batcher.stop();
      startPromise.fail( e );
    }
  }

  private void watch( PullConsumer<Long> consumer )
  {
    consumer.ready()
      .onSuccess( v -> LOGGER.info( "🔗 Pull consumer {} subscribed", consumer.getKey() ) );

    consumer.termination()
      .onSuccess( v -> LOGGER.info( "Pull consumer {} stopped", consumer.getKey() ) )
      .onFailure( e -> LOGGER.error( "❌ Pull consumer {} terminated: {}", consumer.getKey(), e.getMessage() ) );
  }

  /**
   * Flushes the batcher while the session can still acknowledge, then closes it.
   * Messages pulled after the flush are left unacknowledged and redelivered.
   */
  @Override
  public void stop( Promise<Void> stopPromise )
  {
    LOGGER.info( "Stopping BatchConsumerVert" );

    Future<Void> flushed = batcher != null ? batcher.stop() : Future.succeededFuture();

    flushed.compose( v -> {
             PullConsumer<Long> consumer = consumerRef.get();
             return consumer != null ? consumer.close() : Future.<Void>succeededFuture();
           })
           .onComplete( ar -> {
             LOGGER.info( "✅ BatchConsumerVert cleanup completed" );
             stopPromise.complete();
           });
  }

  public PullConsumer<Long> getConsumer()
  {
    return consumerRef.get();
  }

  public MessageBatcher getBatcher()
  {
    return batcher;
  }
}
