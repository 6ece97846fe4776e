package jetstream.model;

import java.nio.charset.StandardCharsets;

import jetstream.exceptions.InvalidAckActionException;

/**
 * Acknowledgement actions understood by JetStream.
 *
 * ACK       - the message was completely handled.
 * NACK      - the message will not be processed now and is redelivered.
 * TERMINATE - stop redelivery of the message without acknowledging it.
 */
public enum AckAction
{
  ACK(       "ack",  "+ACK"  ),
  NACK(      "nack", "-NAK"  ),
  TERMINATE( "term", "+TERM" );

  private final String configName;
  private final byte[] body;

  AckAction( String configName, String body )
  {
    this.configName = configName;
    this.body       = body.getBytes( StandardCharsets.US_ASCII );
  }

  public String getConfigName()
  {
    return configName;
  }

  /**
   * @return the payload published to a message's reply subject for this action
   */
  public byte[] getBody()
  {
    return body.clone();
  }

  /**
   * Accepts an AckAction or exactly one of the names ack, nack, term.
   *
   * @param option name of the option being validated, used in the error
   * @param value  candidate value
   * @throws InvalidAckActionException for null or any other value
   */
  public static AckAction parse( String option, Object value )
  {
    if( value instanceof AckAction )
      return (AckAction) value;

    if( value instanceof String )
    {
      switch( (String) value )
      {
        case "ack":  return ACK;
        case "nack": return NACK;
        case "term": return TERMINATE;
        default:     break;
      }
    }

    throw new InvalidAckActionException( option, value );
  }
}
