package processor;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonObject;

import jetstream.ack.AckBridge;
import jetstream.ack.AckToken;
import jetstream.ack.BridgedMessage;
import jetstream.ack.InMemoryAckStore;
import jetstream.model.PulledMessage;

class JsonPayloadProcessorTest
{
  private final AckBridge                  bridge  = new AckBridge( new InMemoryAckStore() );
  private final Function<String, AckToken> builder = bridge.builder( bridge.init( ( replyTo, action ) -> { } ) );

  private BridgedMessage message( String payload, String replyTo )
  {
    PulledMessage pulled = new PulledMessage( payload.getBytes( StandardCharsets.UTF_8 ), replyTo,
                                              Map.of( PulledMessage.META_SUBJECT, "orders.created" ) );
    return BridgedMessage.wrap( pulled, builder );
  }

  @Test
  void splitsBatchByPayloadValidity()
  {
    List<JsonObject>     decoded   = new ArrayList<>();
    JsonPayloadProcessor processor = new JsonPayloadProcessor( decoded::add );

    BridgedMessage good  = message( "{\"id\":1}", "r1" );
    BridgedMessage bad   = message( "not json", "r2" );
    BridgedMessage array = message( "[1,2]", "r3" );
    BridgedMessage empty = message( "", "r4" );

    BatchOutcome outcome = processor.process( List.of( good, bad, array, empty ) );

    assertEquals( List.of( good ), outcome.getSuccessful() );
    assertEquals( List.of( bad, array, empty ), outcome.getFailed() );
    assertEquals( 1, decoded.size() );
    assertEquals( 1, decoded.get( 0 ).getInteger( "id" ) );
  }

  @Test
  void sinkRejectionFailsOnlyThatMessage()
  {
    JsonPayloadProcessor processor = new JsonPayloadProcessor( json -> {
      if( json.getBoolean( "poison", false ) )
        throw new IllegalStateException( "poison message" );
    });

    BridgedMessage poison = message( "{\"poison\":true}", "r1" );
    BridgedMessage fine   = message( "{\"poison\":false}", "r2" );

    BatchOutcome outcome = processor.process( List.of( poison, fine ) );

    assertEquals( List.of( fine ),   outcome.getSuccessful() );
    assertEquals( List.of( poison ), outcome.getFailed() );
  }
}
