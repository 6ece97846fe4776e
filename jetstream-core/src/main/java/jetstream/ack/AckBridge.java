package jetstream.ack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jetstream.exceptions.BrokerException;
import jetstream.exceptions.ConfigurationException;
import jetstream.model.AckAction;
import jetstream.nats.AckChannelIF;

/**
 * Acknowledger for messages processed by a batching layer rather than one at
 * a time by a pull consumer handler.
 *
 * A session is created with {@link #init}, which stores its {@link AckConfig}
 * once and returns the {@link AckRef}. Messages leave the consumer with a token
 * from {@link #builder}; the batching layer later reports them through
 * {@link #ack}, from any number of threads.
 *
 * Options (init and configure):
 *  - on_success: action for successful messages, default ack
 *  - on_failure: action for failed messages, default nack
 */
public class AckBridge
{
  private static final Logger LOGGER = LoggerFactory.getLogger( AckBridge.class );

  public static final String ON_SUCCESS = "on_success";
  public static final String ON_FAILURE = "on_failure";

  private final AckStoreIF store;

  public AckBridge( AckStoreIF store )
  {
    this.store = Objects.requireNonNull( store, "store" );
  }

  public AckRef init( AckChannelIF channel )
  {
    return init( channel, Collections.emptyMap() );
  }

  /**
   * Validates the options, then stores the session config exactly once.
   *
   * @throws ConfigurationException on a null channel or an unsupported option;
   *         InvalidAckActionException on an action outside ack, nack, term.
   *         Nothing is stored in either case.
   */
  public AckRef init( AckChannelIF channel, Map<String, ?> options )
  {
    if( channel == null )
    {
      throw new ConfigurationException( "Required acknowledger option 'connection' is missing." );
    }

    Map<String, ?> opts = options == null ? Collections.emptyMap() : options;
    rejectUnknown( opts, "init" );

    AckAction onSuccess = opts.get( ON_SUCCESS ) == null ? AckAction.ACK  : AckAction.parse( ON_SUCCESS, opts.get( ON_SUCCESS ) );
    AckAction onFailure = opts.get( ON_FAILURE ) == null ? AckAction.NACK : AckAction.parse( ON_FAILURE, opts.get( ON_FAILURE ) );

    AckConfig config = new AckConfig( channel, onSuccess, onFailure );
    AckRef    ref    = new AckRef();
    store.put( ref, config );

    LOGGER.info( "Acknowledger initialized {} {}", ref, config );
    return ref;
  }

  /**
   * @return a function turning a reply subject into the token for one message.
   *         Does not consult the store.
   */
  public Function<String, AckToken> builder( AckRef ref )
  {
    Objects.requireNonNull( ref, "ref" );
    return replyTo -> new AckToken( this, ref, AckData.of( replyTo ) );
  }

  /**
   * Sends the configured action for every message. Messages carrying their own
   * override (see {@link #configure}) use it instead of the session's action.
   *
   * Every message is attempted. A failing network call is recorded in the result
   * and logged; it does not stop the rest of the batch. Nothing is retried.
   *
   * @throws IllegalStateException when no config was ever stored for the ref
   */
  public AckBatchResult ack( AckRef ref, List<BridgedMessage> successful, List<BridgedMessage> failed )
  {
    AckConfig config = store.get( ref );
    if( config == null )
    {
      throw new IllegalStateException( "No acknowledgement config registered for " + ref );
    }

    EnumMap<AckAction, Integer> sent     = new EnumMap<>( AckAction.class );
    List<AckBatchResult.Failure> failures = new ArrayList<>();

    if( successful != null )
    {
      for( BridgedMessage message : successful )
      {
        AckAction action = message.getAckToken().getData().getOnSuccess().orElse( config.getOnSuccess() );
        apply( ref, config.getChannel(), action, message, sent, failures );
      }
    }

    if( failed != null )
    {
      for( BridgedMessage message : failed )
      {
        AckAction action = message.getAckToken().getData().getOnFailure().orElse( config.getOnFailure() );
        apply( ref, config.getChannel(), action, message, sent, failures );
      }
    }

    if( !failures.isEmpty() )
    {
      LOGGER.warn( "Acknowledger {} could not acknowledge {} of {} message(s)", ref, failures.size(), failures.size() + sent.values().stream().mapToInt( Integer::intValue ).sum() );
    }

    return new AckBatchResult( sent, failures );
  }

  private void apply( AckRef ref, AckChannelIF channel, AckAction action, BridgedMessage message,
                      EnumMap<AckAction, Integer> sent, List<AckBatchResult.Failure> failures )
  {
    String replyTo = message.getAckToken().getData().getReplyTo();

    // Only the session that issued the token may settle the message
    AckRef issuer = message.getAckToken().getRef();
    if( !ref.equals( issuer ) )
    {
      LOGGER.warn( "Refusing to {} {} under {}; it was issued by {}", action.getConfigName(), replyTo, ref, issuer );
      failures.add( new AckBatchResult.Failure( message, action,
                                                new IllegalArgumentException( "Message was issued by " + issuer + ", not " + ref ) ) );
      return;
    }

    try
    {
      channel.acknowledge( replyTo, action );
      sent.merge( action, 1, Integer::sum );
    }
    catch( BrokerException | RuntimeException e )
    {
      LOGGER.warn( "Failed to {} {}: {}", action.getConfigName(), replyTo, e.getMessage() );
      failures.add( new AckBatchResult.Failure( message, action, e ) );
    }
  }

  /**
   * Merges per-message overrides into existing bridge data. All overrides are
   * validated before anything is merged; the given data is never modified.
   *
   * @throws ConfigurationException on an unsupported key;
   *         InvalidAckActionException on an invalid action
   */
  public AckData configure( AckRef ref, AckData data, Map<String, ?> overrides )
  {
    Objects.requireNonNull( data, "data" );
    if( overrides == null || overrides.isEmpty() )
      return data;

    rejectUnknown( overrides, "configure" );

    AckAction success = overrides.containsKey( ON_SUCCESS ) ? AckAction.parse( ON_SUCCESS, overrides.get( ON_SUCCESS ) ) : null;
    AckAction failure = overrides.containsKey( ON_FAILURE ) ? AckAction.parse( ON_FAILURE, overrides.get( ON_FAILURE ) ) : null;

    LOGGER.debug( "Configured {} for {}: onSuccess={} onFailure={}", data.getReplyTo(), ref, success, failure );
    return data.withOverrides( success, failure );
  }

  /**
   * {@link #configure} applied to the token of a bridged message.
   */
  public BridgedMessage configure( BridgedMessage message, Map<String, ?> overrides )
  {
    AckToken token = message.getAckToken();
    return message.withAckToken( token.withData( configure( token.getRef(), token.getData(), overrides ) ) );
  }

  private static void rejectUnknown( Map<String, ?> options, String operation )
  {
    for( String key : options.keySet() )
    {
      if( !ON_SUCCESS.equals( key ) && !ON_FAILURE.equals( key ) )
      {
        throw new ConfigurationException( "unsupported " + operation + " option '" + key + "'" );
      }
    }
  }
}
