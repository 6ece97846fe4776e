package jetstream.nats;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import jetstream.exceptions.BrokerException;
import jetstream.model.AckAction;

public class RecordingAckChannel implements AckChannelIF
{
  private final List<String> sent    = new CopyOnWriteArrayList<>();
  private final Set<String>  failing = ConcurrentHashMap.newKeySet();

  public RecordingAckChannel failFor( String replyTo )
  {
    failing.add( replyTo );
    return this;
  }

  @Override
  public void acknowledge( String replyTo, AckAction action ) throws BrokerException
  {
    if( failing.contains( replyTo ) )
    {
      throw new BrokerException( "publish to " + replyTo + " failed" );
    }
    sent.add( action + ":" + replyTo );
  }

  public List<String> getSent()
  {
    return sent;
  }

  public long count( AckAction action, String replyTo )
  {
    String entry = action + ":" + replyTo;
    return sent.stream().filter( entry::equals ).count();
  }
}
