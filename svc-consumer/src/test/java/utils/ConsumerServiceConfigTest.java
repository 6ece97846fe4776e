package utils;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonObject;

import jetstream.ack.AckBridge;
import jetstream.consumer.PullConsumerOptions;
import jetstream.exceptions.ConfigurationException;
import jetstream.exceptions.InvalidAckActionException;
import jetstream.model.AckAction;

class ConsumerServiceConfigTest
{
  private static Map<String, String> minimal()
  {
    Map<String, String> data = new HashMap<>();
    data.put( "natsURL",      "nats://nats.nats.svc:4222" );
    data.put( "streamName",   "ORDERS" );
    data.put( "consumerName", "order-batcher" );
    return data;
  }

  @Test
  void appliesDefaults()
  {
    ConsumerServiceConfig config = new ConsumerServiceConfig( minimal() );

    assertEquals( "consumer", config.getServiceId() );
    assertEquals( 1000, config.getRetryDelayMs() );
    assertEquals( 10, config.getMaxRetries() );
    assertEquals( 1000, config.getFetchTimeoutMs() );
    assertEquals( 100, config.getBatchSize() );
    assertEquals( 500, config.getBatchTimeoutMs() );
    assertEquals( AckAction.ACK,  config.getOnSuccess() );
    assertEquals( AckAction.NACK, config.getOnFailure() );
  }

  @Test
  void missingStreamIsRejected()
  {
    Map<String, String> data = minimal();
    data.remove( "streamName" );

    ConfigurationException error = assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( data ) );
    assertEquals( "Missing required config key: streamName", error.getMessage() );
  }

  @Test
  void emptyConfigIsRejected()
  {
    assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( Map.of() ) );
    assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( null ) );
  }

  @Test
  void nonNumericValueIsRejected()
  {
    Map<String, String> data = minimal();
    data.put( "batchSize", "lots" );

    assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( data ) );
  }

  @Test
  void valuesBeyondIntRangeAreRejected()
  {
    Map<String, String> batch = minimal();
    batch.put( "batchSize", "4294967306" );
    ConfigurationException batchError = assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( batch ) );
    assertEquals( "Config key batchSize is out of range, got: 4294967306", batchError.getMessage() );

    Map<String, String> retries = minimal();
    retries.put( PullConsumerOptions.MAX_RETRIES, "4294967306" );
    assertThrows( ConfigurationException.class, () -> new ConsumerServiceConfig( retries ) );
  }

  @Test
  void invalidAckActionIsRejected()
  {
    Map<String, String> data = minimal();
    data.put( "onFailure", "drop" );

    InvalidAckActionException error = assertThrows( InvalidAckActionException.class, () -> new ConsumerServiceConfig( data ) );
    assertEquals( "onFailure", error.getOption() );
  }

  @Test
  void jsonFeedsPullConsumerOptions()
  {
    Map<String, String> data = minimal();
    data.put( "maxRetries",     "3" );
    data.put( "fetchTimeoutMs", "250" );
    data.put( "onFailure",      "term" );

    ConsumerServiceConfig config = new ConsumerServiceConfig( data );
    JsonObject            json   = config.toJson();

    assertEquals( 3, json.getInteger( PullConsumerOptions.MAX_RETRIES ) );
    assertEquals( "term", json.getString( ConsumerServiceConfig.ON_FAILURE ) );

    ConsumerServiceConfig rebuilt = ConsumerServiceConfig.fromJson( json );
    assertEquals( 250, rebuilt.getFetchTimeoutMs() );
    assertEquals( AckAction.TERMINATE, rebuilt.getOnFailure() );

    assertEquals( AckAction.TERMINATE, config.ackOptions().get( AckBridge.ON_FAILURE ) );
  }
}
