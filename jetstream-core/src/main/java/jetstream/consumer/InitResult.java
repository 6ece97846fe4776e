package jetstream.consumer;

/**
 * Outcome of {@link PullConsumerHandlerIF#init(Object)}.
 */
public final class InitResult<S>
{
  public enum Type { OK, IGNORE, STOP }

  private final Type   type;
  private final S      state;
  private final Object reason;

  private InitResult( Type type, S state, Object reason )
  {
    this.type   = type;
    this.state  = state;
    this.reason = reason;
  }

  /** Start consuming with the given initial state. */
  public static <S> InitResult<S> ok( S state )
  {
    return new InitResult<>( Type.OK, state, null );
  }

  /** Do not start; the session ends STOPPED without connecting. */
  public static <S> InitResult<S> ignore()
  {
    return new InitResult<>( Type.IGNORE, null, null );
  }

  /** Refuse to start; the start call fails with the reason. */
  public static <S> InitResult<S> stop( Object reason )
  {
    return new InitResult<>( Type.STOP, null, reason );
  }

  public Type   getType()   { return type;   }
  public S      getState()  { return state;  }
  public Object getReason() { return reason; }
}
