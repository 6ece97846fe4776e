package jetstream.consumer;

import java.time.Duration;

import jetstream.exceptions.ConfigurationException;

/**
 * Fixed-delay, hard-bounded connection retry. A session with a budget of N
 * retries makes at most N+1 connect attempts.
 */
public class RetryPolicy
{
  private final Duration delay;

  public RetryPolicy( Duration delay )
  {
    if( delay == null || delay.isNegative() )
    {
      throw new ConfigurationException( "Retry delay must be zero or positive, got: " + delay );
    }
    this.delay = delay;
  }

  /**
   * @param attemptsRemaining retries left in the session's budget
   */
  public RetryDecision decide( int attemptsRemaining )
  {
    if( attemptsRemaining > 0 )
    {
      return RetryDecision.retry( delay );
    }
    return RetryDecision.giveUp();
  }

  public Duration getDelay()
  {
    return delay;
  }
}
