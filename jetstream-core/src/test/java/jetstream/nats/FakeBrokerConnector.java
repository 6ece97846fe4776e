package jetstream.nats;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;
import jetstream.model.PulledMessage;

/**
 * In-memory broker for consumer tests: scripted connect failures, a message
 * queue served to pull requests, and a log of every acknowledgement sent.
 */
public class FakeBrokerConnector implements BrokerConnectorIF
{
  private volatile int            failuresBeforeSuccess = 0;
  private volatile CountDownLatch connectGate           = null;

  private final AtomicInteger              connectAttempts = new AtomicInteger( 0 );
  private final List<Long>                 attemptNanos    = new CopyOnWriteArrayList<>();
  private final BlockingQueue<PulledMessage> messages      = new LinkedBlockingQueue<>();
  private final List<String>               acks            = new CopyOnWriteArrayList<>();
  private final Set<String>                failingReplies  = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean              failNextPull    = new AtomicBoolean( false );
  private final AtomicInteger              unsubscribes    = new AtomicInteger( 0 );
  private final AtomicInteger              releases        = new AtomicInteger( 0 );

  public static FakeBrokerConnector alwaysFailing()
  {
    FakeBrokerConnector connector = new FakeBrokerConnector();
    connector.failuresBeforeSuccess = Integer.MAX_VALUE;
    return connector;
  }

  public FakeBrokerConnector failFirst( int failures )
  {
    this.failuresBeforeSuccess = failures;
    return this;
  }

  /**
   * Makes connect() block until the gate is opened.
   */
  public FakeBrokerConnector blockConnectUntil( CountDownLatch gate )
  {
    this.connectGate = gate;
    return this;
  }

  public void offer( String payload, String replyTo )
  {
    messages.add( message( payload, replyTo ) );
  }

  public static PulledMessage message( String payload, String replyTo )
  {
    return new PulledMessage( payload.getBytes( StandardCharsets.UTF_8 ), replyTo, Map.of( PulledMessage.META_SUBJECT, "orders.created" ) );
  }

  public void failAcksFor( String replyTo )
  {
    failingReplies.add( replyTo );
  }

  public void failNextPull()
  {
    failNextPull.set( true );
  }

  @Override
  public BrokerConnectionIF connect() throws BrokerException
  {
    int attempt = connectAttempts.incrementAndGet();
    attemptNanos.add( System.nanoTime() );

    CountDownLatch gate = connectGate;
    if( gate != null )
    {
      try
      {
        gate.await();
      }
      catch( InterruptedException e )
      {
        Thread.currentThread().interrupt();
        throw new BrokerException( "interrupted", e );
      }
    }

    if( attempt <= failuresBeforeSuccess )
    {
      throw new BrokerException( "connection refused (attempt " + attempt + ")" );
    }
    return new FakeConnection();
  }

  @Override
  public String describe()
  {
    return "fake";
  }

  public int getConnectAttempts()
  {
    return connectAttempts.get();
  }

  public List<Long> getAttemptNanos()
  {
    return new ArrayList<>( attemptNanos );
  }

  public List<String> getAcks()
  {
    return Collections.unmodifiableList( acks );
  }

  public long count( AckAction action, String replyTo )
  {
    String entry = action + ":" + replyTo;
    return acks.stream().filter( entry::equals ).count();
  }

  public int getUnsubscribes() { return unsubscribes.get(); }
  public int getReleases()     { return releases.get();     }

  private class FakeConnection implements BrokerConnectionIF
  {
    private volatile boolean open = true;

    @Override
    public PullSubscriptionIF subscribe( String streamName, String consumerName )
    {
      return new FakeSubscription();
    }

    @Override
    public void acknowledge( String replyTo, AckAction action ) throws BrokerException
    {
      if( !open || failingReplies.contains( replyTo ) )
      {
        throw new BrokerException( "publish to " + replyTo + " failed" );
      }
      acks.add( action + ":" + replyTo );
    }

    @Override
    public boolean isConnected()
    {
      return open;
    }

    @Override
    public void release()
    {
      open = false;
      releases.incrementAndGet();
    }
  }

  private class FakeSubscription implements PullSubscriptionIF
  {
    private volatile boolean active = true;

    @Override
    public PulledMessage pullNext( Duration maxWait ) throws BrokerException
    {
      if( !active )
      {
        throw new BrokerException( "subscription closed" );
      }
      if( failNextPull.compareAndSet( true, false ) )
      {
        throw new BrokerException( "connection lost" );
      }

      // Polled in short slices so an unsubscribe ends the wait, as it does for a live fetch
      long deadline = System.nanoTime() + maxWait.toNanos();
      try
      {
        while( active )
        {
          long remaining = deadline - System.nanoTime();
          if( remaining <= 0 )
            return null;

          PulledMessage message = messages.poll( Math.min( remaining, TimeUnit.MILLISECONDS.toNanos( 10 ) ), TimeUnit.NANOSECONDS );
          if( message != null )
            return message;
        }
        throw new BrokerException( "subscription closed" );
      }
      catch( InterruptedException e )
      {
        Thread.currentThread().interrupt();
        throw new BrokerException( "interrupted", e );
      }
    }

    @Override
    public void unsubscribe()
    {
      active = false;
      unsubscribes.incrementAndGet();
    }
  }
}
