package jetstream.ack;

import java.util.Objects;

/**
 * Attached to a bridged message: which bridge acknowledges it, under which
 * session ref, with which per-message data.
 */
public final class AckToken
{
  private final AckBridge bridge;
  private final AckRef    ref;
  private final AckData   data;

  AckToken( AckBridge bridge, AckRef ref, AckData data )
  {
    this.bridge = Objects.requireNonNull( bridge, "bridge" );
    this.ref    = Objects.requireNonNull( ref,    "ref"    );
    this.data   = Objects.requireNonNull( data,   "data"   );
  }

  public AckBridge getBridge() { return bridge; }
  public AckRef    getRef()    { return ref;    }
  public AckData   getData()   { return data;   }

  public AckToken withData( AckData newData )
  {
    return new AckToken( bridge, ref, newData );
  }
}
