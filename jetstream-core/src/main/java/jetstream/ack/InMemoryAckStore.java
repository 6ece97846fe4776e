package jetstream.ack;

import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAckStore implements AckStoreIF
{
  private static final InMemoryAckStore SHARED = new InMemoryAckStore();

  private final ConcurrentHashMap<AckRef, AckConfig> configs = new ConcurrentHashMap<>();

  /**
   * Process-wide store for hosts that keep a single bridge registry.
   */
  public static InMemoryAckStore shared()
  {
    return SHARED;
  }

  @Override
  public void put( AckRef ref, AckConfig config )
  {
    AckConfig existing = configs.putIfAbsent( ref, config );
    if( existing != null )
    {
      throw new IllegalStateException( "Acknowledgement config already stored for " + ref );
    }
  }

  @Override
  public AckConfig get( AckRef ref )
  {
    return ref == null ? null : configs.get( ref );
  }

  @Override
  public int size()
  {
    return configs.size();
  }
}
