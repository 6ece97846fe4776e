package jetstream.nats;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;

public interface BrokerConnectionIF extends AckChannelIF
{
  /**
   * Binds a pull subscription to an existing stream and durable consumer.
   */
  PullSubscriptionIF subscribe( String streamName, String consumerName ) throws BrokerException;

  default void ack( String replyTo ) throws BrokerException
  {
    acknowledge( replyTo, AckAction.ACK );
  }

  default void nack( String replyTo ) throws BrokerException
  {
    acknowledge( replyTo, AckAction.NACK );
  }

  default void terminate( String replyTo ) throws BrokerException
  {
    acknowledge( replyTo, AckAction.TERMINATE );
  }

  boolean isConnected();

  /**
   * Gives the connection back. Owned connections are closed, borrowed ones are left open.
   */
  void release();
}
