package jetstream.nats;

import java.time.Duration;

import jetstream.exceptions.BrokerException;
import jetstream.model.PulledMessage;

public interface PullSubscriptionIF
{
  /**
   * Requests the next message and waits up to maxWait for it.
   *
   * @return the message, or null when none arrived in time
   * @throws BrokerException when the subscription or its connection is gone
   */
  PulledMessage pullNext( Duration maxWait ) throws BrokerException;

  void unsubscribe();
}
