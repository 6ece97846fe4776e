package processor;

import java.util.List;

import jetstream.ack.BridgedMessage;

/**
 * Processes one batch of bridged messages. Runs on a worker thread; may block.
 * A thrown exception fails every message of the batch.
 */
public interface BatchProcessorIF
{
  BatchOutcome process( List<BridgedMessage> batch ) throws Exception;
}
