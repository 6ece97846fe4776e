package jetstream.ack;

import java.util.Optional;

import jetstream.model.AckAction;

/**
 * Per-message bridge data: where to send the acknowledgement and, optionally,
 * actions that take precedence over the session's configuration.
 */
public final class AckData
{
  private final String    replyTo;
  private final AckAction onSuccess;
  private final AckAction onFailure;

  private AckData( String replyTo, AckAction onSuccess, AckAction onFailure )
  {
    this.replyTo   = replyTo;
    this.onSuccess = onSuccess;
    this.onFailure = onFailure;
  }

  public static AckData of( String replyTo )
  {
    return new AckData( replyTo, null, null );
  }

  public String getReplyTo()
  {
    return replyTo;
  }

  public Optional<AckAction> getOnSuccess()
  {
    return Optional.ofNullable( onSuccess );
  }

  public Optional<AckAction> getOnFailure()
  {
    return Optional.ofNullable( onFailure );
  }

  AckData withOverrides( AckAction success, AckAction failure )
  {
    return new AckData( replyTo,
                        success != null ? success : onSuccess,
                        failure != null ? failure : onFailure );
  }

  @Override
  public String toString()
  {
    return "AckData{replyTo=" + replyTo + ", onSuccess=" + onSuccess + ", onFailure=" + onFailure + "}";
  }
}
