package jetstream.nats;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;

class BrokerConnectionIFTest
{
  @Test
  void shortcutsSendTheMatchingAction() throws Exception
  {
    FakeBrokerConnector connector  = new FakeBrokerConnector();
    BrokerConnectionIF  connection = connector.connect();

    connection.ack( "reply.1" );
    connection.nack( "reply.2" );
    connection.terminate( "reply.3" );

    assertEquals( 1, connector.count( AckAction.ACK,       "reply.1" ) );
    assertEquals( 1, connector.count( AckAction.NACK,      "reply.2" ) );
    assertEquals( 1, connector.count( AckAction.TERMINATE, "reply.3" ) );
  }

  @Test
  void releasedConnectionRejectsAcknowledgements() throws Exception
  {
    FakeBrokerConnector connector  = new FakeBrokerConnector();
    BrokerConnectionIF  connection = connector.connect();

    connection.release();

    assertFalse( connection.isConnected() );
    assertThrows( BrokerException.class, () -> connection.ack( "reply.1" ) );
    assertTrue( connector.getAcks().isEmpty() );
  }
}
