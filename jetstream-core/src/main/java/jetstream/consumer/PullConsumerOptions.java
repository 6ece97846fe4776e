package jetstream.consumer;

import java.time.Duration;

import io.vertx.core.json.JsonObject;

import jetstream.exceptions.ConfigurationException;
import jetstream.nats.BrokerConnectorIF;

/**
 * Immutable session configuration of a pull consumer.
 *
 * Required: connection, streamName, consumerName.
 * Optional: retryDelay (1000ms), maxRetries (10), fetchTimeout (1000ms).
 */
public final class PullConsumerOptions
{
  public static final String STREAM_NAME      = "streamName";
  public static final String CONSUMER_NAME    = "consumerName";
  public static final String RETRY_DELAY_MS   = "retryDelayMs";
  public static final String MAX_RETRIES      = "maxRetries";
  public static final String FETCH_TIMEOUT_MS = "fetchTimeoutMs";

  public static final Duration DEFAULT_RETRY_DELAY   = Duration.ofMillis( 1000 );
  public static final int      DEFAULT_MAX_RETRIES   = 10;
  public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofMillis( 1000 );

  private final BrokerConnectorIF connector;
  private final String            streamName;
  private final String            consumerName;
  private final Duration          retryDelay;
  private final int               maxRetries;
  private final Duration          fetchTimeout;

  private PullConsumerOptions( Builder builder )
  {
    this.connector    = builder.connector;
    this.streamName   = builder.streamName.trim();
    this.consumerName = builder.consumerName.trim();
    this.retryDelay   = builder.retryDelay;
    this.maxRetries   = builder.maxRetries;
    this.fetchTimeout = builder.fetchTimeout;
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * Reads streamName, consumerName, retryDelayMs, maxRetries and fetchTimeoutMs
   * from a verticle deployment config. Numbers may be given as JSON numbers or strings.
   */
  public static PullConsumerOptions fromConfig( BrokerConnectorIF connector, JsonObject config )
  {
    if( config == null )
    {
      throw new ConfigurationException( "Pull consumer config cannot be null" );
    }

    return builder().connection(   connector )
                    .streamName(   config.getString( STREAM_NAME ) )
                    .consumerName( config.getString( CONSUMER_NAME ) )
                    .retryDelay(   Duration.ofMillis( longValue( config, RETRY_DELAY_MS, DEFAULT_RETRY_DELAY.toMillis() ) ) )
                    .maxRetries(   intValue( config, MAX_RETRIES, DEFAULT_MAX_RETRIES ) )
                    .fetchTimeout( Duration.ofMillis( longValue( config, FETCH_TIMEOUT_MS, DEFAULT_FETCH_TIMEOUT.toMillis() ) ) )
                    .build();
  }

  private static int intValue( JsonObject config, String key, int def )
  {
    long value = longValue( config, key, def );
    try
    {
      return Math.toIntExact( value );
    }
    catch( ArithmeticException e )
    {
      throw new ConfigurationException( "Pull consumer option '" + key + "' is out of range, got: " + value );
    }
  }

  private static long longValue( JsonObject config, String key, long def )
  {
    Object value = config.getValue( key );
    if( value == null )
      return def;

    if( value instanceof Number )
      return ((Number) value).longValue();

    try
    {
      return Long.parseLong( value.toString().trim() );
    }
    catch( NumberFormatException e )
    {
      throw new ConfigurationException( "Pull consumer option '" + key + "' must be a number, got: " + value );
    }
  }

  public BrokerConnectorIF getConnector()    { return connector;    }
  public String            getStreamName()   { return streamName;   }
  public String            getConsumerName() { return consumerName; }
  public Duration          getRetryDelay()   { return retryDelay;   }
  public int               getMaxRetries()   { return maxRetries;   }
  public Duration          getFetchTimeout() { return fetchTimeout; }

  @Override
  public String toString()
  {
    return "PullConsumerOptions{connection=" + connector.describe() +
           ", stream=" + streamName + ", consumer=" + consumerName +
           ", retryDelay=" + retryDelay.toMillis() + "ms, maxRetries=" + maxRetries +
           ", fetchTimeout=" + fetchTimeout.toMillis() + "ms}";
  }

  public static final class Builder
  {
    private BrokerConnectorIF connector;
    private String            streamName;
    private String            consumerName;
    private Duration          retryDelay   = DEFAULT_RETRY_DELAY;
    private int               maxRetries   = DEFAULT_MAX_RETRIES;
    private Duration          fetchTimeout = DEFAULT_FETCH_TIMEOUT;

    private Builder()
    {
    }

    public Builder connection( BrokerConnectorIF connector )
    {
      this.connector = connector;
      return this;
    }

    public Builder streamName( String streamName )
    {
      this.streamName = streamName;
      return this;
    }

    public Builder consumerName( String consumerName )
    {
      this.consumerName = consumerName;
      return this;
    }

    public Builder retryDelay( Duration retryDelay )
    {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder maxRetries( int maxRetries )
    {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder fetchTimeout( Duration fetchTimeout )
    {
      this.fetchTimeout = fetchTimeout;
      return this;
    }

    /**
     * @throws ConfigurationException when a required option is missing or a value is out of range
     */
    public PullConsumerOptions build()
    {
      if( connector == null )
      {
        throw missing( "connection" );
      }
      if( streamName == null || streamName.trim().isEmpty() )
      {
        throw missing( STREAM_NAME );
      }
      if( consumerName == null || consumerName.trim().isEmpty() )
      {
        throw missing( CONSUMER_NAME );
      }
      if( retryDelay == null || retryDelay.isNegative() )
      {
        throw new ConfigurationException( "Pull consumer option '" + RETRY_DELAY_MS + "' must be zero or positive, got: " + retryDelay );
      }
      if( maxRetries < 0 )
      {
        throw new ConfigurationException( "Pull consumer option '" + MAX_RETRIES + "' must be zero or positive, got: " + maxRetries );
      }
      if( fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative() )
      {
        throw new ConfigurationException( "Pull consumer option '" + FETCH_TIMEOUT_MS + "' must be positive, got: " + fetchTimeout );
      }

      return new PullConsumerOptions( this );
    }

    private static ConfigurationException missing( String name )
    {
      return new ConfigurationException( "Required pull consumer option '" + name + "' is missing." );
    }
  }
}
