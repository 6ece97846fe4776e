package jetstream.nats;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PullSubscribeOptions;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;

public class NatsBrokerConnection implements BrokerConnectionIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsBrokerConnection.class );

  private final Connection connection;
  private final boolean    owned;

  public NatsBrokerConnection( Connection connection, boolean owned )
  {
    this.connection = connection;
    this.owned      = owned;
  }

  @Override
  public PullSubscriptionIF subscribe( String streamName, String consumerName ) throws BrokerException
  {
    if( !isConnected() )
    {
      throw new BrokerException( "No NATS connection available for pull consumer binding" );
    }

    try
    {
      JetStream js = connection.jetStream();

      // Bind only; the durable is provisioned on the server side
      PullSubscribeOptions pullOpts = PullSubscribeOptions.builder()
        .stream( streamName )
        .durable( consumerName )
        .bind( true )
        .build();

      JetStreamSubscription subscription = js.subscribe( null, pullOpts );
      LOGGER.info( "Bound to pull consumer: stream={} durable={}", streamName, consumerName );

      return new NatsPullSubscription( streamName + ":" + consumerName, subscription );
    }
    catch( IOException | JetStreamApiException e )
    {
      throw new BrokerException( "Failed to bind pull consumer " + consumerName + " on " + streamName + ": " + e.getMessage(), e );
    }
    catch( IllegalArgumentException | IllegalStateException e )
    {
      throw new BrokerException( "Pull consumer binding rejected for " + consumerName + " on " + streamName + ": " + e.getMessage(), e );
    }
  }

  @Override
  public void acknowledge( String replyTo, AckAction action ) throws BrokerException
  {
    if( replyTo == null || replyTo.isEmpty() )
    {
      throw new BrokerException( "Cannot " + action.getConfigName() + " a message without a reply subject" );
    }

    try
    {
      connection.publish( replyTo, action.getBody() );
    }
    catch( IllegalStateException e )
    {
      throw new BrokerException( "Failed to " + action.getConfigName() + " " + replyTo + ": connection closed", e );
    }
  }

  @Override
  public boolean isConnected()
  {
    return connection.getStatus() == Connection.Status.CONNECTED;
  }

  @Override
  public void release()
  {
    if( !owned )
      return;

    try
    {
      connection.close();
      LOGGER.info( "Closed NATS connection identity={}", System.identityHashCode( connection ) );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.warn( "Interrupted while closing NATS connection identity={}", System.identityHashCode( connection ) );
    }
  }
}
