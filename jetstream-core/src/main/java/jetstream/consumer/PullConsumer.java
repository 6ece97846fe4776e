package jetstream.consumer;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

import jetstream.exceptions.BrokerException;
import jetstream.exceptions.ConfigurationException;
import jetstream.exceptions.ConnectionTimeoutException;
import jetstream.exceptions.ConsumerInitException;
import jetstream.exceptions.HandlerFaultException;
import jetstream.model.AckAction;
import jetstream.model.ConsumerPhase;
import jetstream.model.HandlerVerdict;
import jetstream.model.PulledMessage;
import jetstream.nats.AckChannelIF;
import jetstream.nats.BrokerConnectionIF;
import jetstream.nats.PullSubscriptionIF;

/**
 * A managed JetStream pull consumer session.
 *
 * Lifecycle: CONNECTING -> READY -> CLOSING -> STOPPED, with FAILED reachable
 * from CONNECTING once the retry budget is spent.
 *
 * All state transitions run on the Vert.x context the session was started on.
 * Connecting, pulling, the user handler and teardown run on a single-thread
 * worker executor owned by the session, so at most one of them is in flight at
 * any time. close() may be called from any thread; it is applied on the context.
 * A pending retry delay is cancelled and a pending pull wait is cut short by
 * unsubscribing; an in-flight connect or handler call is allowed to finish.
 *
 * @param <S> user state
 */
public class PullConsumer<S> implements AckChannelIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( PullConsumer.class );

  private static final AtomicLong SESSION_COUNTER  = new AtomicLong( 0 );
  private static final long       MAX_EXECUTE_MINS = 10;

  private final Vertx                    vertx;
  private final Context                  context;
  private final WorkerExecutor           workerExecutor;
  private final PullConsumerHandlerIF<S> handler;
  private final PullConsumerOptions      options;
  private final RetryPolicy              retryPolicy;
  private final String                   key;

  // Session state, mutated on the context only
  private volatile ConsumerPhase phase = ConsumerPhase.CONNECTING;
  private S                      state;
  private int                    attemptsRemaining;
  private int                    attemptsMade      = 0;
  private boolean                ignored           = false;
  private boolean                closeRequested    = false;
  private boolean                operationInFlight = false;
  private boolean                pullInFlight      = false;
  private long                   retryTimerId      = -1;
  private Throwable              fault             = null;

  private volatile BrokerConnectionIF connection   = null;
  private PullSubscriptionIF          subscription = null;

  private final Promise<Void> readyPromise       = Promise.promise();
  private final Promise<Void> terminationPromise = Promise.promise();
  private final Promise<Void> closedPromise      = Promise.promise();

  private static final class Binding
  {
    final BrokerConnectionIF connection;
    final PullSubscriptionIF subscription;

    Binding( BrokerConnectionIF connection, PullSubscriptionIF subscription )
    {
      this.connection   = connection;
      this.subscription = subscription;
    }
  }

  private PullConsumer( Vertx vertx, PullConsumerHandlerIF<S> handler, PullConsumerOptions options )
  {
    this.vertx             = vertx;
    this.context           = vertx.getOrCreateContext();
    this.handler           = handler;
    this.options           = options;
    this.retryPolicy       = new RetryPolicy( options.getRetryDelay() );
    this.attemptsRemaining = options.getMaxRetries();
    this.key               = options.getStreamName() + ":" + options.getConsumerName();

    this.workerExecutor = vertx.createSharedWorkerExecutor( "jetstream-pull-" + key + "-" + SESSION_COUNTER.incrementAndGet(),
                                                            1, MAX_EXECUTE_MINS, TimeUnit.MINUTES );
  }

  /**
   * Starts a pull consumer session.
   *
   * The returned future completes once the handler's init has returned: with the
   * session (connecting in the background, or already STOPPED when init answered
   * ignore), or failed with a {@link ConsumerInitException} when init answered stop
   * or threw. Use {@link #ready()} to wait for the subscription.
   *
   * @throws ConfigurationException when vertx, handler or options are missing
   */
  public static <S> Future<PullConsumer<S>> start( Vertx vertx, PullConsumerHandlerIF<S> handler,
                                                   Object initArg, PullConsumerOptions options )
  {
    if( vertx == null )
      throw new ConfigurationException( "Vertx instance cannot be null" );
    if( handler == null )
      throw new ConfigurationException( "Pull consumer handler cannot be null" );
    if( options == null )
      throw new ConfigurationException( "Pull consumer options cannot be null" );

    PullConsumer<S>          consumer = new PullConsumer<>( vertx, handler, options );
    Promise<PullConsumer<S>> started  = Promise.promise();

    consumer.context.runOnContext( v -> consumer.initialize( initArg, started ) );

    return started.future();
  }

  private void initialize( Object initArg, Promise<PullConsumer<S>> started )
  {
    LOGGER.info( "Starting pull consumer {}", options );

    operationInFlight = true;
    workerExecutor.<InitResult<S>>executeBlocking( () -> handler.init( initArg ), false )
      .onComplete( ar -> {
        operationInFlight = false;

        if( ar.failed() || ar.result() == null )
        {
          Throwable cause = ar.failed() ? ar.cause() : new IllegalStateException( "init returned null" );
          ConsumerInitException error = new ConsumerInitException( "Pull consumer init failed for " + key, cause );
          LOGGER.error( "Pull consumer {} init failed: {}", key, cause.getMessage(), cause );
          finish( ConsumerPhase.STOPPED, error );
          started.fail( error );
          return;
        }

        InitResult<S> result = ar.result();
        switch( result.getType() )
        {
          case IGNORE:
            LOGGER.info( "Pull consumer {} init returned ignore - not connecting", key );
            ignored = true;
            finish( ConsumerPhase.STOPPED, null );
            started.complete( this );
            return;

          case STOP:
            ConsumerInitException error = new ConsumerInitException( result.getReason() );
            LOGGER.warn( "Pull consumer {} init returned stop: {}", key, result.getReason() );
            finish( ConsumerPhase.STOPPED, error );
            started.fail( error );
            return;

          default:
            state = result.getState();
            started.complete( this );
            attemptConnect();
        }
      });
  }

  private void attemptConnect()
  {
    if( closeRequested )
    {
      finish( ConsumerPhase.STOPPED, null );
      return;
    }

    attemptsMade++;
    LOGGER.debug( "Connect attempt {} for pull consumer {} via {}", attemptsMade, key, options.getConnector().describe() );

    operationInFlight = true;
    workerExecutor.executeBlocking( this::connectAndSubscribe, false )
      .onComplete( ar -> {
        operationInFlight = false;

        if( ar.failed() )
        {
          onConnectFailure( ar.cause() );
          return;
        }

        connection   = ar.result().connection;
        subscription = ar.result().subscription;

        if( closeRequested )
        {
          beginClosing();
          return;
        }

        phase             = ConsumerPhase.READY;
        attemptsRemaining = options.getMaxRetries();
        LOGGER.info( "Pull consumer {} ready after {} attempt(s)", key, attemptsMade );
        readyPromise.tryComplete();

        pullNext();
      });
  }

  private Binding connectAndSubscribe() throws Exception
  {
    BrokerConnectionIF conn = options.getConnector().connect();
    try
    {
      PullSubscriptionIF sub = conn.subscribe( options.getStreamName(), options.getConsumerName() );
      return new Binding( conn, sub );
    }
    catch( BrokerException | RuntimeException e )
    {
      conn.release();
      throw e;
    }
  }

  private void onConnectFailure( Throwable cause )
  {
    if( closeRequested )
    {
      finish( ConsumerPhase.STOPPED, null );
      return;
    }

    RetryDecision decision = retryPolicy.decide( attemptsRemaining );
    if( decision.isRetry() )
    {
      attemptsRemaining--;
      LOGGER.warn( "Pull consumer {} connect attempt {} failed: {} - retrying in {}ms ({} retries left)",
                   key, attemptsMade, cause.getMessage(), decision.getDelay().toMillis(), attemptsRemaining );

      retryTimerId = vertx.setTimer( Math.max( 1, decision.getDelay().toMillis() ), id -> {
        retryTimerId = -1;
        attemptConnect();
      });
      return;
    }

    LOGGER.error( "Pull consumer {} gave up after {} connect attempt(s): {}", key, attemptsMade, cause.getMessage() );
    finish( ConsumerPhase.FAILED,
            new ConnectionTimeoutException( "Pull consumer " + key + " could not connect after " + attemptsMade + " attempt(s)",
                                            attemptsMade, cause ) );
  }

  private void pullNext()
  {
    if( closeRequested )
    {
      beginClosing();
      return;
    }

    PullSubscriptionIF sub = subscription;

    operationInFlight = true;
    pullInFlight      = true;
    workerExecutor.executeBlocking( () -> sub.pullNext( options.getFetchTimeout() ), false )
      .onComplete( ar -> {
        operationInFlight = false;
        pullInFlight      = false;

        if( closeRequested )
        {
          // A message fetched here is not handled; the broker redelivers it
          beginClosing();
          return;
        }

        if( ar.failed() )
        {
          onPullFailure( ar.cause() );
          return;
        }

        if( ar.result() == null )
        {
          pullNext();
          return;
        }

        handleMessage( ar.result() );
      });
  }

  private void handleMessage( PulledMessage message )
  {
    S current = state;

    operationInFlight = true;
    workerExecutor.executeBlocking( () -> invokeHandler( message, current ), false )
      .onComplete( ar -> {
        operationInFlight = false;

        if( ar.failed() )
        {
          fault = new HandlerFaultException( "Message handler failed for pull consumer " + key + " on " + message, ar.cause() );
          LOGGER.error( "Pull consumer {} handler fault on {} - stopping session", key, message, ar.cause() );
          beginClosing();
          return;
        }

        state = ar.result().getState();
        pullNext();
      });
  }

  private HandleResult<S> invokeHandler( PulledMessage message, S current ) throws Exception
  {
    HandleResult<S> result = handler.handleMessage( message, current );
    if( result == null )
    {
      throw new IllegalStateException( "handleMessage returned null" );
    }

    dispatch( message, result.getVerdict() );
    return result;
  }

  private void dispatch( PulledMessage message, HandlerVerdict verdict )
  {
    AckAction action;
    switch( verdict )
    {
      case ACK:  action = AckAction.ACK;  break;
      case NACK: action = AckAction.NACK; break;
      default:
        LOGGER.debug( "No reply sent for {} on {}", message, key );
        return;
    }

    try
    {
      connection.acknowledge( message.getReplyTo(), action );
      LOGGER.debug( "Message {} for consumer {} {}", action.getConfigName(), key, message );
    }
    catch( BrokerException | RuntimeException e )
    {
      LOGGER.warn( "Failed to {} message {} for {}: {}", action.getConfigName(), message, key, e.getMessage() );
    }
  }

  private void onPullFailure( Throwable cause )
  {
    LOGGER.warn( "Pull failed for consumer {}: {} - reconnecting", key, cause.getMessage() );

    phase             = ConsumerPhase.CONNECTING;
    attemptsRemaining = options.getMaxRetries();

    BrokerConnectionIF conn = connection;
    PullSubscriptionIF sub  = subscription;
    connection   = null;
    subscription = null;

    operationInFlight = true;
    workerExecutor.executeBlocking( () -> releaseBinding( conn, sub ), false )
      .onComplete( ar -> {
        operationInFlight = false;
        attemptConnect();
      });
  }

  private void beginClosing()
  {
    phase = ConsumerPhase.CLOSING;
    LOGGER.info( "Closing pull consumer {}", key );

    BrokerConnectionIF conn = connection;
    PullSubscriptionIF sub  = subscription;
    connection   = null;
    subscription = null;

    operationInFlight = true;
    workerExecutor.executeBlocking( () -> releaseBinding( conn, sub ), false )
      .onComplete( ar -> {
        operationInFlight = false;
        finish( ConsumerPhase.STOPPED, fault );
      });
  }

  private Void releaseBinding( BrokerConnectionIF conn, PullSubscriptionIF sub )
  {
    if( sub != null )
    {
      try
      {
        sub.unsubscribe();
      }
      catch( RuntimeException e )
      {
        LOGGER.debug( "Unsubscribe failed for {}: {}", key, e.getMessage() );
      }
    }

    if( conn != null )
    {
      try
      {
        conn.release();
      }
      catch( RuntimeException e )
      {
        LOGGER.debug( "Connection release failed for {}: {}", key, e.getMessage() );
      }
    }
    return null;
  }

  private void finish( ConsumerPhase terminal, Throwable cause )
  {
    phase = terminal;

    if( cause == null )
    {
      readyPromise.tryFail( new IllegalStateException( "Pull consumer " + key + " stopped before becoming ready" ) );
      terminationPromise.tryComplete();
      LOGGER.info( "Pull consumer {} {}", key, terminal );
    }
    else
    {
      readyPromise.tryFail( cause );
      terminationPromise.tryFail( cause );
      LOGGER.info( "Pull consumer {} {} ({})", key, terminal, cause.getMessage() );
    }

    closedPromise.tryComplete();
    workerExecutor.close();
  }

  /**
   * Requests an orderly shutdown. Idempotent and safe in any phase; the returned
   * future always succeeds, once the session has reached STOPPED or FAILED.
   */
  public Future<Void> close()
  {
    context.runOnContext( v -> requestClose() );
    return closedPromise.future();
  }

  private void requestClose()
  {
    if( phase.isTerminal() || phase == ConsumerPhase.CLOSING || closeRequested )
      return;

    closeRequested = true;
    LOGGER.info( "Close requested for pull consumer {} in phase {}", key, phase );

    if( retryTimerId != -1 )
    {
      vertx.cancelTimer( retryTimerId );
      retryTimerId = -1;
      finish( ConsumerPhase.STOPPED, null );
      return;
    }

    if( phase == ConsumerPhase.READY && pullInFlight )
    {
      interruptPull();
      return;
    }

    // An in-flight init, connect or handler call observes the flag when it completes
    if( operationInFlight )
    {
      if( phase == ConsumerPhase.READY )
        phase = ConsumerPhase.CLOSING;
      return;
    }

    if( phase == ConsumerPhase.READY )
      beginClosing();
    else
      finish( ConsumerPhase.STOPPED, null );
  }

  /**
   * Ends a pending pull wait. The session executor is busy with the wait, so the
   * unsubscribe runs on the Vert.x worker pool; the pull then returns and the
   * session completes the teardown.
   */
  private void interruptPull()
  {
    phase = ConsumerPhase.CLOSING;

    PullSubscriptionIF sub = subscription;
    subscription = null;

    LOGGER.debug( "Interrupting pending pull for consumer {}", key );
    vertx.executeBlocking( () -> releaseBinding( null, sub ), false );
  }

  /**
   * Sends an acknowledgement through the session's current connection.
   *
   * @throws IllegalStateException when the session holds no connection
   */
  @Override
  public void acknowledge( String replyTo, AckAction action ) throws BrokerException
  {
    BrokerConnectionIF conn = connection;
    if( conn == null )
    {
      throw new IllegalStateException( "Pull consumer " + key + " has no live connection (phase " + phase + ")" );
    }
    conn.acknowledge( replyTo, action );
  }

  /** Acknowledges a message previously answered with NOREPLY. */
  public Future<Void> ack( PulledMessage message )
  {
    return acknowledgeLater( message, AckAction.ACK );
  }

  /** Negatively acknowledges a message previously answered with NOREPLY. */
  public Future<Void> nack( PulledMessage message )
  {
    return acknowledgeLater( message, AckAction.NACK );
  }

  /** Terminates redelivery of a message previously answered with NOREPLY. */
  public Future<Void> terminate( PulledMessage message )
  {
    return acknowledgeLater( message, AckAction.TERMINATE );
  }

  private Future<Void> acknowledgeLater( PulledMessage message, AckAction action )
  {
    try
    {
      acknowledge( message.getReplyTo(), action );
      return Future.succeededFuture();
    }
    catch( BrokerException | IllegalStateException e )
    {
      LOGGER.warn( "Late {} failed for {} on {}: {}", action.getConfigName(), message, key, e.getMessage() );
      return Future.failedFuture( e );
    }
  }

  public ConsumerPhase phase()
  {
    return phase;
  }

  /**
   * Succeeds the first time the session becomes READY; fails if it terminates before.
   */
  public Future<Void> ready()
  {
    return readyPromise.future();
  }

  /**
   * Succeeds on an orderly stop. Fails with {@link ConnectionTimeoutException} when
   * the retry budget ran out, or {@link HandlerFaultException} when the handler threw.
   */
  public Future<Void> termination()
  {
    return terminationPromise.future();
  }

  public boolean isIgnored()
  {
    return ignored;
  }

  public String getKey()
  {
    return key;
  }

  public PullConsumerOptions getOptions()
  {
    return options;
  }
}
