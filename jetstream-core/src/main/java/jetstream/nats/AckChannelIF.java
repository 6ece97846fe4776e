package jetstream.nats;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;

/**
 * Anything an acknowledgement can be sent through: a broker connection, or a
 * consumer session that forwards to whichever connection it currently holds.
 */
public interface AckChannelIF
{
  /**
   * Publishes the body of the given action to the reply subject of a delivery.
   * Fire-and-forget: returns once the publish is handed to the client, not when
   * the broker has processed it.
   */
  void acknowledge( String replyTo, AckAction action ) throws BrokerException;
}
