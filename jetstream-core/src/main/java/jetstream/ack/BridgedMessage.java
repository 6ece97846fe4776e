package jetstream.ack;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import jetstream.model.PulledMessage;

/**
 * A pulled message on its way through a batching layer, carrying the token
 * that tells the layer how to acknowledge it.
 */
public final class BridgedMessage
{
  private final PulledMessage message;
  private final AckToken      ackToken;

  public BridgedMessage( PulledMessage message, AckToken ackToken )
  {
    this.message  = Objects.requireNonNull( message,  "message"  );
    this.ackToken = Objects.requireNonNull( ackToken, "ackToken" );
  }

  public static BridgedMessage wrap( PulledMessage message, Function<String, AckToken> builder )
  {
    return new BridgedMessage( message, builder.apply( message.getReplyTo() ) );
  }

  public PulledMessage       getMessage()  { return message;                 }
  public AckToken            getAckToken() { return ackToken;                }
  public byte[]              getPayload()  { return message.getPayload();    }
  public Map<String, String> getMetadata() { return message.getMetadata();   }

  public BridgedMessage withAckToken( AckToken token )
  {
    return new BridgedMessage( message, token );
  }

  @Override
  public String toString()
  {
    return "BridgedMessage{" + message + ", ref=" + ackToken.getRef() + "}";
  }
}
