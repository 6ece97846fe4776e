package jetstream.ack;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jetstream.model.AckAction;

/**
 * Outcome of one batched acknowledgement: how many of each action were sent
 * and which messages could not be acknowledged.
 */
public final class AckBatchResult
{
  private final Map<AckAction, Integer> sent;
  private final List<Failure>           failures;

  AckBatchResult( EnumMap<AckAction, Integer> sent, List<Failure> failures )
  {
    this.sent     = Collections.unmodifiableMap( new EnumMap<>( sent ) );
    this.failures = List.copyOf( failures );
  }

  public int sent( AckAction action )
  {
    return sent.getOrDefault( action, 0 );
  }

  public int totalSent()
  {
    return sent.values().stream().mapToInt( Integer::intValue ).sum();
  }

  public List<Failure> failures()
  {
    return failures;
  }

  public boolean isComplete()
  {
    return failures.isEmpty();
  }

  public static final class Failure
  {
    private final BridgedMessage message;
    private final AckAction      action;
    private final Exception      cause;

    Failure( BridgedMessage message, AckAction action, Exception cause )
    {
      this.message = message;
      this.action  = action;
      this.cause   = cause;
    }

    public BridgedMessage getMessage() { return message; }
    public AckAction      getAction()  { return action;  }
    public Exception      getCause()   { return cause;   }
  }
}
