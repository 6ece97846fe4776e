package utils;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.json.JsonObject;

import jetstream.ack.AckBridge;
import jetstream.consumer.PullConsumerOptions;
import jetstream.exceptions.ConfigurationException;
import jetstream.model.AckAction;

/**
 * ConsumerServiceConfig
 *
 * serviceId natsURL
 *
 * streamName consumerName (REQUIRED - the durable pull consumer to bind)
 * retryDelayMs maxRetries fetchTimeoutMs
 *
 * batchSize batchTimeoutMs
 *
 * onSuccess onFailure (ack, nack or term)
 */
public class ConsumerServiceConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConsumerServiceConfig.class );

  public static final String SERVICE_ID       = "serviceId";
  public static final String NATS_URL         = "natsURL";
  public static final String BATCH_SIZE       = "batchSize";
  public static final String BATCH_TIMEOUT_MS = "batchTimeoutMs";
  public static final String ON_SUCCESS       = "onSuccess";
  public static final String ON_FAILURE       = "onFailure";

  // Service Identity
  private final String serviceId;

  // NATS Configuration
  private final String natsURL;

  // Pull Consumer
  private final String streamName;
  private final String consumerName;
  private final long   retryDelayMs;
  private final int    maxRetries;
  private final long   fetchTimeoutMs;

  // Batching
  private final int  batchSize;
  private final long batchTimeoutMs;

  // Acknowledgement
  private final AckAction onSuccess;
  private final AckAction onFailure;

  public ConsumerServiceConfig( Map<String, String> configData )
  {
    if( configData == null || configData.isEmpty() )
    {
      throw new ConfigurationException( "Configuration data cannot be null or empty" );
    }

    try
    {
      this.serviceId = getRequired( configData, SERVICE_ID, "consumer" );
      this.natsURL   = getRequired( configData, NATS_URL );

      this.streamName     = getRequired( configData, PullConsumerOptions.STREAM_NAME );
      this.consumerName   = getRequired( configData, PullConsumerOptions.CONSUMER_NAME );
      this.retryDelayMs   = getLong( configData, PullConsumerOptions.RETRY_DELAY_MS,   "1000" );
      this.maxRetries     = getInt( configData, PullConsumerOptions.MAX_RETRIES, "10" );
      this.fetchTimeoutMs = getLong( configData, PullConsumerOptions.FETCH_TIMEOUT_MS, "1000" );

      this.batchSize      = getInt( configData, BATCH_SIZE, "100" );
      this.batchTimeoutMs = getLong( configData, BATCH_TIMEOUT_MS, "500" );

      this.onSuccess = AckAction.parse( ON_SUCCESS, getRequired( configData, ON_SUCCESS, "ack" ) );
      this.onFailure = AckAction.parse( ON_FAILURE, getRequired( configData, ON_FAILURE, "nack" ) );

      if( batchSize < 1 )
        throw new ConfigurationException( "Config key " + BATCH_SIZE + " must be at least 1, got: " + batchSize );
      if( batchTimeoutMs < 1 )
        throw new ConfigurationException( "Config key " + BATCH_TIMEOUT_MS + " must be positive, got: " + batchTimeoutMs );

      logConfig();
    }
    catch( ConfigurationException e )
    {
      LOGGER.error( "Error initializing ConsumerServiceConfig: {}", e.getMessage() );
      throw e;
    }
  }

  /**
   * Rebuilds the config from a verticle deployment config produced by {@link #toJson()}.
   */
  public static ConsumerServiceConfig fromJson( JsonObject json )
  {
    Map<String, String> data = new HashMap<>();
    if( json != null )
    {
      json.forEach( entry -> {
        if( entry.getValue() != null )
          data.put( entry.getKey(), entry.getValue().toString() );
      });
    }
    return new ConsumerServiceConfig( data );
  }

  // ---------- Helpers ----------
  private String getRequired( Map<String, String> data, String key )
  {
    return getRequired( data, key, null );
  }

  private String getRequired( Map<String, String> data, String key, String def )
  {
    String v = data.get( key );
    if( v == null || v.trim().isEmpty() )
    {
      if( def != null )
      {
        LOGGER.debug( "Using default for {}: {}", key, def );
        return def;
      }
      throw new ConfigurationException( "Missing required config key: " + key );
    }
    return v.trim();
  }

  private int getInt( Map<String, String> data, String key, String def )
  {
    long v = getLong( data, key, def );
    try
    {
      return Math.toIntExact( v );
    }
    catch( ArithmeticException e )
    {
      throw new ConfigurationException( "Config key " + key + " is out of range, got: " + v );
    }
  }

  private long getLong( Map<String, String> data, String key, String def )
  {
    String v = getRequired( data, key, def );
    try
    {
      return Long.parseLong( v );
    }
    catch( NumberFormatException e )
    {
      throw new ConfigurationException( "Config key " + key + " must be a number, got: " + v );
    }
  }

  private void logConfig()
  {
    LOGGER.info( "Consumer Service Configuration:" );
    LOGGER.info( "  Service ID: {}", serviceId );
    LOGGER.info( "  NATS URL: {}", natsURL );
    LOGGER.info( "  Stream: {}", streamName );
    LOGGER.info( "  Consumer: {}", consumerName );
    LOGGER.info( "  Retry Delay: {} ms", retryDelayMs );
    LOGGER.info( "  Max Retries: {}", maxRetries );
    LOGGER.info( "  Fetch Timeout: {} ms", fetchTimeoutMs );
    LOGGER.info( "  Batch Size: {}", batchSize );
    LOGGER.info( "  Batch Timeout: {} ms", batchTimeoutMs );
    LOGGER.info( "  On Success: {}", onSuccess.getConfigName() );
    LOGGER.info( "  On Failure: {}", onFailure.getConfigName() );
  }

  /**
   * @return verticle deployment config; the pull consumer keys are read by
   *         {@link PullConsumerOptions#fromConfig}
   */
  public JsonObject toJson()
  {
    return new JsonObject()
      .put( SERVICE_ID,                            serviceId )
      .put( NATS_URL,                              natsURL )
      .put( PullConsumerOptions.STREAM_NAME,       streamName )
      .put( PullConsumerOptions.CONSUMER_NAME,     consumerName )
      .put( PullConsumerOptions.RETRY_DELAY_MS,    retryDelayMs )
      .put( PullConsumerOptions.MAX_RETRIES,       maxRetries )
      .put( PullConsumerOptions.FETCH_TIMEOUT_MS,  fetchTimeoutMs )
      .put( BATCH_SIZE,                            batchSize )
      .put( BATCH_TIMEOUT_MS,                      batchTimeoutMs )
      .put( ON_SUCCESS,                            onSuccess.getConfigName() )
      .put( ON_FAILURE,                            onFailure.getConfigName() );
  }

  /**
   * @return init options for {@link AckBridge#init}
   */
  public Map<String, Object> ackOptions()
  {
    return Map.of( AckBridge.ON_SUCCESS, onSuccess, AckBridge.ON_FAILURE, onFailure );
  }

  // ---------- Getters ----------
  public String    getServiceId()      { return serviceId;      }
  public String    getNatsURL()        { return natsURL;        }
  public String    getStreamName()     { return streamName;     }
  public String    getConsumerName()   { return consumerName;   }
  public long      getRetryDelayMs()   { return retryDelayMs;   }
  public int       getMaxRetries()     { return maxRetries;     }
  public long      getFetchTimeoutMs() { return fetchTimeoutMs; }
  public int       getBatchSize()      { return batchSize;      }
  public long      getBatchTimeoutMs() { return batchTimeoutMs; }
  public AckAction getOnSuccess()      { return onSuccess;      }
  public AckAction getOnFailure()      { return onFailure;      }
}
