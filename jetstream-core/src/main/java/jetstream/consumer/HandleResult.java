package jetstream.consumer;

import java.util.Objects;

import jetstream.model.HandlerVerdict;

public final class HandleResult<S>
{
  private final HandlerVerdict verdict;
  private final S              state;

  private HandleResult( HandlerVerdict verdict, S state )
  {
    this.verdict = Objects.requireNonNull( verdict, "verdict" );
    this.state   = state;
  }

  public static <S> HandleResult<S> of( HandlerVerdict verdict, S state )
  {
    return new HandleResult<>( verdict, state );
  }

  public static <S> HandleResult<S> ack( S state )
  {
    return new HandleResult<>( HandlerVerdict.ACK, state );
  }

  public static <S> HandleResult<S> nack( S state )
  {
    return new HandleResult<>( HandlerVerdict.NACK, state );
  }

  public static <S> HandleResult<S> noreply( S state )
  {
    return new HandleResult<>( HandlerVerdict.NOREPLY, state );
  }

  public HandlerVerdict getVerdict() { return verdict; }
  public S              getState()   { return state;   }
}
