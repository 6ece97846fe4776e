package jetstream.model;

public enum ConsumerPhase
{
  CONNECTING,
  READY,
  CLOSING,
  STOPPED,
  FAILED;

  public boolean isTerminal()
  {
    return this == STOPPED || this == FAILED;
  }
}
