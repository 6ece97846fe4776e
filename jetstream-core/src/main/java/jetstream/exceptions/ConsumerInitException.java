package jetstream.exceptions;

public class ConsumerInitException extends Exception
{
  private static final long serialVersionUID = 2293318846072230571L;

  private final Object reason;

  public ConsumerInitException( Object reason )
  {
    super( "Pull consumer init stopped: " + reason );
    this.reason = reason;
  }

  public ConsumerInitException( String msg, Throwable cause )
  {
    super( msg, cause );
    this.reason = cause;
  }

  public Object getReason()
  {
    return reason;
  }
}
