package jetstream.exceptions;

public class InvalidAckActionException extends ConfigurationException
{
  private static final long serialVersionUID = 1851730236690247301L;

  private final String option;
  private final Object value;

  public InvalidAckActionException( String option, Object value )
  {
    super( "expected " + option + " to be a valid acknowledgement option (ack, nack, term), got: " + value );
    this.option = option;
    this.value  = value;
  }

  public String getOption() { return option; }
  public Object getValue()  { return value;  }
}
