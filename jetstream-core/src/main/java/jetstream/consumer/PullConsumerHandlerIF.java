package jetstream.consumer;

import jetstream.model.PulledMessage;

/**
 * User logic of a pull consumer.
 *
 * Both methods run on a worker thread of the owning session, never
 * concurrently with each other for the same session.
 *
 * @param <S> user state threaded from one message to the next
 */
public interface PullConsumerHandlerIF<S>
{
  InitResult<S> init( Object initArg ) throws Exception;

  /**
   * Handles one message. The verdict decides what is sent back:
   * ACK acknowledges, NACK asks for redelivery, NOREPLY sends nothing and leaves
   * the acknowledgement to the caller (see {@link PullConsumer#ack}).
   *
   * An exception is not turned into a NACK; it ends the session.
   */
  HandleResult<S> handleMessage( PulledMessage message, S state ) throws Exception;
}
