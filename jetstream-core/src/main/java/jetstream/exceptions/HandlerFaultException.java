package jetstream.exceptions;

/**
 * The message handler of a consumer session threw instead of returning a verdict.
 * The session is torn down; restarting it is up to the host.
 */
public class HandlerFaultException extends Exception
{
  private static final long serialVersionUID = 4021569818203375420L;

  public HandlerFaultException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
