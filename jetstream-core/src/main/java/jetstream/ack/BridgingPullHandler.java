package jetstream.ack;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jetstream.consumer.HandleResult;
import jetstream.consumer.InitResult;
import jetstream.consumer.PullConsumerHandlerIF;
import jetstream.model.PulledMessage;

/**
 * Pull consumer handler for the bridged path: every message gets a bridge
 * token and is handed to a downstream sink, and the consumer answers NOREPLY.
 * The sink acknowledges later through {@link AckBridge#ack}.
 */
public class BridgingPullHandler implements PullConsumerHandlerIF<Long>
{
  private static final Logger LOGGER = LoggerFactory.getLogger( BridgingPullHandler.class );

  private final Function<String, AckToken> tokenBuilder;
  private final Consumer<BridgedMessage>   sink;

  public BridgingPullHandler( AckBridge bridge, AckRef ref, Consumer<BridgedMessage> sink )
  {
    this.tokenBuilder = bridge.builder( ref );
    this.sink         = Objects.requireNonNull( sink, "sink" );
  }

  @Override
  public InitResult<Long> init( Object initArg )
  {
    return InitResult.ok( 0L );
  }

  /**
   * State is the count of messages forwarded so far.
   */
  @Override
  public HandleResult<Long> handleMessage( PulledMessage message, Long forwarded )
  {
    sink.accept( BridgedMessage.wrap( message, tokenBuilder ) );

    long count = forwarded + 1;
    if( count % 1000 == 0 )
    {
      LOGGER.info( "Forwarded {} messages to batching layer", count );
    }
    return HandleResult.noreply( count );
  }
}
