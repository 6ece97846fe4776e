package jetstream.nats;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;

import jetstream.exceptions.BrokerException;
import jetstream.exceptions.ConfigurationException;

/**
 * Connector for NATS JetStream.
 *
 * Two flavours:
 *  - dial: every connect() opens a new connection to the given servers; the
 *    session owns it and closes it on release.
 *  - shared: every connect() hands out an application-wide connection which
 *    must currently be CONNECTED; release leaves it open.
 */
public class NatsBrokerConnector implements BrokerConnectorIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsBrokerConnector.class );

  private final String     natsUrls;
  private final Duration   connectTimeout;
  private final Connection sharedConnection;

  private NatsBrokerConnector( String natsUrls, Duration connectTimeout, Connection sharedConnection )
  {
    this.natsUrls         = natsUrls;
    this.connectTimeout   = connectTimeout;
    this.sharedConnection = sharedConnection;
  }

  /**
   * @param natsUrls       comma separated server list
   * @param connectTimeout timeout of a single dial
   */
  public static NatsBrokerConnector dial( String natsUrls, Duration connectTimeout )
  {
    if( natsUrls == null || natsUrls.trim().isEmpty() )
    {
      throw new ConfigurationException( "NATS server list cannot be null or empty" );
    }
    return new NatsBrokerConnector( natsUrls.trim(), connectTimeout == null ? Duration.ofSeconds( 5 ) : connectTimeout, null );
  }

  public static NatsBrokerConnector shared( Connection connection )
  {
    if( connection == null )
    {
      throw new ConfigurationException( "Shared NATS connection cannot be null" );
    }
    return new NatsBrokerConnector( null, null, connection );
  }

  @Override
  public BrokerConnectionIF connect() throws BrokerException
  {
    if( sharedConnection != null )
    {
      if( sharedConnection.getStatus() != Connection.Status.CONNECTED )
      {
        throw new BrokerException( "No NATS connection available - status " + sharedConnection.getStatus() );
      }
      return new NatsBrokerConnection( sharedConnection, false );
    }

    Options options = new Options.Builder()
      .servers( natsUrls.split( "," ) )
      .connectionTimeout( connectTimeout )
      .reconnectWait( Duration.ofSeconds( 2 ) )
      .maxReconnects( -1 )
      .connectionListener( this::handleConnectionEvent )
      .errorListener( new ErrorListener()
      {
        @Override
        public void errorOccurred( Connection conn, String error )
        {
          LOGGER.warn( "NATS error: {}", error );
        }

        @Override
        public void exceptionOccurred( Connection conn, Exception exp )
        {
          LOGGER.error( "NATS exception: {}", exp == null ? "null" : exp.getMessage(), exp );
        }
      })
      .build();

    try
    {
      Connection conn = Nats.connect( options );
      LOGGER.info( "NATS connection established servers={} identity={}", natsUrls, System.identityHashCode( conn ) );
      return new NatsBrokerConnection( conn, true );
    }
    catch( IOException e )
    {
      throw new BrokerException( "Failed to connect to NATS at " + natsUrls + ": " + e.getMessage(), e );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      throw new BrokerException( "Interrupted while connecting to NATS at " + natsUrls, e );
    }
  }

  @Override
  public String describe()
  {
    return sharedConnection != null ? "shared:" + System.identityHashCode( sharedConnection ) : natsUrls;
  }

  private void handleConnectionEvent( Connection conn, ConnectionListener.Events type )
  {
    if( type == ConnectionListener.Events.DISCONNECTED || type == ConnectionListener.Events.CLOSED )
    {
      LOGGER.warn( "NATS connection event: {} connRef={}", type, System.identityHashCode( conn ) );
    }
    else
    {
      LOGGER.info( "NATS connection event: {} connRef={}", type, System.identityHashCode( conn ) );
    }
  }
}
