package jetstream.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message delivered by a pull subscription.
 *
 * The reply subject is the broker-supplied address acknowledgements for this
 * delivery are published to.
 */
public final class PulledMessage
{
  public static final String META_SUBJECT           = "subject";
  public static final String META_STREAM            = "stream";
  public static final String META_CONSUMER          = "consumer";
  public static final String META_STREAM_SEQUENCE   = "stream-sequence";
  public static final String META_CONSUMER_SEQUENCE = "consumer-sequence";
  public static final String META_DELIVERED         = "delivered-count";

  private final byte[]              payload;
  private final String              replyTo;
  private final Map<String, String> metadata;

  public PulledMessage( byte[] payload, String replyTo, Map<String, String> metadata )
  {
    this.payload  = payload == null ? new byte[0] : payload.clone();
    this.replyTo  = replyTo;
    this.metadata = metadata == null ? Collections.emptyMap()
                                     : Collections.unmodifiableMap( new LinkedHashMap<>( metadata ) );
  }

  public byte[]              getPayload()  { return payload.clone(); }
  public String              getReplyTo()  { return replyTo;         }
  public Map<String, String> getMetadata() { return metadata;        }

  public String getSubject()
  {
    return metadata.get( META_SUBJECT );
  }

  @Override
  public String toString()
  {
    return "PulledMessage{subject=" + getSubject() + ", replyTo=" + replyTo + ", bytes=" + payload.length + "}";
  }

  @Override
  public boolean equals( Object o )
  {
    if( this == o ) return true;
    if( !(o instanceof PulledMessage) ) return false;
    PulledMessage other = (PulledMessage) o;
    return Objects.equals( replyTo, other.replyTo ) && Arrays.equals( payload, other.payload );
  }

  @Override
  public int hashCode()
  {
    return Objects.hash( replyTo, Arrays.hashCode( payload ) );
  }
}
