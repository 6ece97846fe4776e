package jetstream.ack;

import java.util.Objects;

import jetstream.model.AckAction;
import jetstream.nats.AckChannelIF;

/**
 * How one bridge session acknowledges successful and failed messages.
 */
public final class AckConfig
{
  private final AckChannelIF channel;
  private final AckAction    onSuccess;
  private final AckAction    onFailure;

  public AckConfig( AckChannelIF channel, AckAction onSuccess, AckAction onFailure )
  {
    this.channel   = Objects.requireNonNull( channel,   "channel"   );
    this.onSuccess = Objects.requireNonNull( onSuccess, "onSuccess" );
    this.onFailure = Objects.requireNonNull( onFailure, "onFailure" );
  }

  public AckChannelIF getChannel()   { return channel;   }
  public AckAction    getOnSuccess() { return onSuccess; }
  public AckAction    getOnFailure() { return onFailure; }

  @Override
  public String toString()
  {
    return "AckConfig{onSuccess=" + onSuccess + ", onFailure=" + onFailure + "}";
  }
}
