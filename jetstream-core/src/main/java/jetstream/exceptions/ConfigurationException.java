package jetstream.exceptions;

/**
 * A required option is missing or an option carries a value outside its
 * accepted range. Always raised at the call that received the option.
 */
public class ConfigurationException extends IllegalArgumentException
{
  private static final long serialVersionUID = 6672013398527140977L;

  public ConfigurationException( String msg )
  {
    super( msg );
  }
}
