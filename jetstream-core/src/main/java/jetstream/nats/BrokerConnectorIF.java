package jetstream.nats;

import jetstream.exceptions.BrokerException;

/**
 * Dials (or validates) a broker connection for a consumer session. Called
 * again for every connect attempt the session makes.
 */
public interface BrokerConnectorIF
{
  BrokerConnectionIF connect() throws BrokerException;

  /**
   * @return short description used in log lines, e.g. the server list
   */
  String describe();
}
