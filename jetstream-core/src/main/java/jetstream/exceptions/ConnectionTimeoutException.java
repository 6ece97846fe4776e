package jetstream.exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Terminal outcome of a consumer session that could not connect and subscribe
 * within its retry budget.
 */
public class ConnectionTimeoutException extends TimeoutException
{
  private static final long serialVersionUID = 7705131869911320746L;

  private final int attempts;

  public ConnectionTimeoutException( String msg, int attempts, Throwable lastFailure )
  {
    super( msg );
    this.attempts = attempts;
    if( lastFailure != null )
    {
      initCause( lastFailure );
    }
  }

  /**
   * @return total connect attempts made, the first one included
   */
  public int getAttempts()
  {
    return attempts;
  }
}
