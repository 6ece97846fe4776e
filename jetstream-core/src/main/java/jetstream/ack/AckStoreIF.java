package jetstream.ack;

/**
 * Registry of bridge session configuration.
 *
 * Entries are written once, before their ref is handed out, and never
 * updated; implementations must allow lock-free concurrent reads.
 */
public interface AckStoreIF
{
  /**
   * @throws IllegalStateException when the ref already has an entry
   */
  void put( AckRef ref, AckConfig config );

  /**
   * @return the config, or null when the ref was never stored
   */
  AckConfig get( AckRef ref );

  int size();
}
