package jetstream.nats;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;

import jetstream.exceptions.BrokerException;
import jetstream.model.PulledMessage;

/**
 * Pulls one message per request from a bound JetStream pull subscription.
 */
public class NatsPullSubscription implements PullSubscriptionIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsPullSubscription.class );

  private final String                key;
  private final JetStreamSubscription subscription;

  public NatsPullSubscription( String key, JetStreamSubscription subscription )
  {
    this.key          = key;
    this.subscription = subscription;
  }

  @Override
  public PulledMessage pullNext( Duration maxWait ) throws BrokerException
  {
    if( !subscription.isActive() )
    {
      throw new BrokerException( "Subscription " + key + " is no longer active" );
    }

    try
    {
      List<Message> messages = subscription.fetch( 1, maxWait );
      if( messages.isEmpty() )
      {
        return null;
      }

      Message msg = messages.get( 0 );
      LOGGER.debug( "Fetched message for consumer {} subject={}", key, msg.getSubject() );
      return toPulledMessage( msg );
    }
    catch( IllegalStateException e )
    {
      throw new BrokerException( "Pull failed for consumer " + key + ": " + e.getMessage(), e );
    }
  }

  @Override
  public void unsubscribe()
  {
    try
    {
      subscription.unsubscribe();
      LOGGER.debug( "Unsubscribed pull consumer: {}", key );
    }
    catch( IllegalStateException e )
    {
      LOGGER.debug( "Unsubscribe failed for {}: {}", key, e.getMessage() );
    }
  }

  static PulledMessage toPulledMessage( Message msg )
  {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put( PulledMessage.META_SUBJECT, msg.getSubject() );

    if( msg.isJetStream() )
    {
      NatsJetStreamMetaData meta = msg.metaData();
      metadata.put( PulledMessage.META_STREAM,            meta.getStream() );
      metadata.put( PulledMessage.META_CONSUMER,          meta.getConsumer() );
      metadata.put( PulledMessage.META_STREAM_SEQUENCE,   String.valueOf( meta.streamSequence() ) );
      metadata.put( PulledMessage.META_CONSUMER_SEQUENCE, String.valueOf( meta.consumerSequence() ) );
      metadata.put( PulledMessage.META_DELIVERED,         String.valueOf( meta.deliveredCount() ) );
    }

    if( msg.hasHeaders() )
    {
      msg.getHeaders().entrySet().forEach( entry ->
        metadata.putIfAbsent( entry.getKey(), String.join( ",", entry.getValue() ) )
      );
    }

    return new PulledMessage( msg.getData(), msg.getReplyTo(), metadata );
  }
}
