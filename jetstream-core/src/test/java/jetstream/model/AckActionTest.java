package jetstream.model;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import jetstream.exceptions.InvalidAckActionException;

class AckActionTest
{
  @Test
  void parsesConfiguredNames()
  {
    assertEquals( AckAction.ACK,       AckAction.parse( "on_success", "ack" ) );
    assertEquals( AckAction.NACK,      AckAction.parse( "on_success", "nack" ) );
    assertEquals( AckAction.TERMINATE, AckAction.parse( "on_failure", "term" ) );
    assertEquals( AckAction.NACK,      AckAction.parse( "on_failure", AckAction.NACK ) );
  }

  @Test
  void namesAreMatchedExactly()
  {
    for( String near : new String[] { "Ack", "TERM", " nack ", "terminate", "" } )
    {
      InvalidAckActionException error = assertThrows( InvalidAckActionException.class, () -> AckAction.parse( "on_failure", near ) );
      assertEquals( near, error.getValue() );
    }
  }

  @Test
  void rejectsAnythingElse()
  {
    InvalidAckActionException error = assertThrows( InvalidAckActionException.class, () -> AckAction.parse( "on_success", "ok" ) );
    assertEquals( "ok", error.getValue() );

    assertThrows( InvalidAckActionException.class, () -> AckAction.parse( "on_success", null ) );
    assertThrows( InvalidAckActionException.class, () -> AckAction.parse( "on_success", 1 ) );
  }

  @Test
  void bodiesMatchTheWireProtocol()
  {
    assertEquals( "+ACK",  new String( AckAction.ACK.getBody(),       StandardCharsets.US_ASCII ) );
    assertEquals( "-NAK",  new String( AckAction.NACK.getBody(),      StandardCharsets.US_ASCII ) );
    assertEquals( "+TERM", new String( AckAction.TERMINATE.getBody(), StandardCharsets.US_ASCII ) );
  }
}
