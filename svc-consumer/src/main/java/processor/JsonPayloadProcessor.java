package processor;

import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import jetstream.ack.BridgedMessage;

/**
 * Decodes each payload as a JSON object and hands it to a sink.
 * Payloads that are not JSON objects, and payloads the sink rejects by
 * throwing, are reported as failed.
 */
public class JsonPayloadProcessor implements BatchProcessorIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( JsonPayloadProcessor.class );

  private final Consumer<JsonObject> sink;

  public JsonPayloadProcessor()
  {
    this( json -> LOGGER.debug( "Processed payload {}", json.encode() ) );
  }

  public JsonPayloadProcessor( Consumer<JsonObject> sink )
  {
    this.sink = sink;
  }

  @Override
  public BatchOutcome process( List<BridgedMessage> batch )
  {
    BatchOutcome outcome = new BatchOutcome();

    for( BridgedMessage message : batch )
    {
      byte[] payload = message.getPayload();
      if( payload == null || payload.length == 0 )
      {
        LOGGER.warn( "Empty payload on {}", message.getMessage().getSubject() );
        outcome.failed( message );
        continue;
      }

      try
      {
        sink.accept( new JsonObject( Buffer.buffer( payload ) ) );
        outcome.succeeded( message );
      }
      catch( DecodeException e )
      {
        LOGGER.warn( "Payload on {} is not a JSON object: {}", message.getMessage().getSubject(), e.getMessage() );
        outcome.failed( message );
      }
      catch( RuntimeException e )
      {
        LOGGER.warn( "Payload on {} rejected: {}", message.getMessage().getSubject(), e.getMessage() );
        outcome.failed( message );
      }
    }

    return outcome;
  }
}
