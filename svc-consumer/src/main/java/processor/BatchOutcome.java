package processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jetstream.ack.BridgedMessage;

/**
 * Partition of a processed batch into successful and failed messages.
 */
public final class BatchOutcome
{
  private final List<BridgedMessage> successful = new ArrayList<>();
  private final List<BridgedMessage> failed     = new ArrayList<>();

  public static BatchOutcome allFailed( List<BridgedMessage> batch )
  {
    BatchOutcome outcome = new BatchOutcome();
    outcome.failed.addAll( batch );
    return outcome;
  }

  public BatchOutcome succeeded( BridgedMessage message )
  {
    successful.add( message );
    return this;
  }

  public BatchOutcome failed( BridgedMessage message )
  {
    failed.add( message );
    return this;
  }

  public List<BridgedMessage> getSuccessful() { return Collections.unmodifiableList( successful ); }
  public List<BridgedMessage> getFailed()     { return Collections.unmodifiableList( failed );     }

  public int size()
  {
    return successful.size() + failed.size();
  }
}
