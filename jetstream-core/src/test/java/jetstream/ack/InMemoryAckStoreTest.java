package jetstream.ack;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import jetstream.model.AckAction;
import jetstream.nats.RecordingAckChannel;

class InMemoryAckStoreTest
{
  @Test
  void entriesAreWriteOnce()
  {
    InMemoryAckStore store  = new InMemoryAckStore();
    AckRef           ref    = new AckRef();
    AckConfig        config = new AckConfig( new RecordingAckChannel(), AckAction.ACK, AckAction.NACK );

    store.put( ref, config );

    assertThrows( IllegalStateException.class,
                  () -> store.put( ref, new AckConfig( new RecordingAckChannel(), AckAction.NACK, AckAction.TERMINATE ) ) );
    assertSame( config, store.get( ref ) );
    assertEquals( 1, store.size() );
  }

  @Test
  void missingRefReadsAsNull()
  {
    InMemoryAckStore store = new InMemoryAckStore();

    assertNull( store.get( new AckRef() ) );
    assertNull( store.get( null ) );
  }

  @Test
  void sharedStoreIsASingleton()
  {
    assertSame( InMemoryAckStore.shared(), InMemoryAckStore.shared() );
  }
}
