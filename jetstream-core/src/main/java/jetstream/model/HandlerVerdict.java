package jetstream.model;

/**
 * What a pull consumer sends back for a handled message.
 * NOREPLY sends nothing; the caller acknowledges later on its own.
 */
public enum HandlerVerdict
{
  ACK,
  NACK,
  NOREPLY
}
