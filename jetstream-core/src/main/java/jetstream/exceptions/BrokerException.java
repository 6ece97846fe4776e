package jetstream.exceptions;

/**
 * Raised by the broker collaborators when a connect, subscribe, pull or
 * acknowledgement call cannot be completed.
 */
public class BrokerException extends Exception
{
  private static final long serialVersionUID = 3127840671139051184L;

  public BrokerException( String msg )
  {
    super( msg );
  }

  public BrokerException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
