package jetstream.ack;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque handle of one bridge session. Only {@link AckBridge#init} mints them;
 * equality is identity, so a ref cannot be rebuilt from its printed form.
 */
public final class AckRef
{
  private static final AtomicLong COUNTER = new AtomicLong( 0 );

  private final long   sequence;
  private final String nonce;

  AckRef()
  {
    this.sequence = COUNTER.incrementAndGet();
    this.nonce    = UUID.randomUUID().toString();
  }

  @Override
  public String toString()
  {
    return "AckRef[" + sequence + "-" + nonce.substring( 0, 8 ) + "]";
  }
}
