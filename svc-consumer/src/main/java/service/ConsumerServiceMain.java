package service;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import jetstream.ack.AckBridge;
import jetstream.ack.InMemoryAckStore;
import jetstream.nats.NatsBrokerConnector;

import processor.JsonPayloadProcessor;
import utils.ConfigReader;
import utils.ConsumerServiceConfig;
import verticle.BatchConsumerVert;

/**
 * Runs a bridged JetStream pull consumer inside a Kubernetes pod.
 *
 * The Deployment must provide:
 *    CONSUMER_CONFIG_MAP = name of the ConfigMap holding the service configuration
 *                          (defaults to consumer-config)
 */
public class ConsumerServiceMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConsumerServiceMain.class );

  private static final String CONFIG_MAP_ENV     = "CONSUMER_CONFIG_MAP";
  private static final String DEFAULT_CONFIG_MAP = "consumer-config";

  private final Vertx                 vertx;
  private final ConsumerServiceConfig svcConfig;

  private String deploymentId = null;

  public ConsumerServiceMain()
  {
    VertxOptions options = new VertxOptions()
        .setWorkerPoolSize( 20 )
        .setEventLoopPoolSize( 4 )
        .setMaxWorkerExecuteTime( 120L * 1000 * 1000000 ) // 120 seconds in nanoseconds
        .setMaxWorkerExecuteTimeUnit( TimeUnit.NANOSECONDS )
        .setMaxEventLoopExecuteTime( 10L * 1000 * 1000000 ) // 10 seconds in nanoseconds
        .setMaxEventLoopExecuteTimeUnit( TimeUnit.NANOSECONDS )
        .setBlockedThreadCheckInterval( 5000 )
        .setBlockedThreadCheckIntervalUnit( TimeUnit.MILLISECONDS );

    this.vertx = Vertx.vertx( options );

    ConfigReader reader = new ConfigReader();
    try
    {
      String configMapName = ConfigReader.getConfigMapNameFromEnv( CONFIG_MAP_ENV, DEFAULT_CONFIG_MAP );
      this.svcConfig = new ConsumerServiceConfig( reader.getConfigProperties( configMapName ) );
    }
    catch( RuntimeException e )
    {
      LOGGER.error( "Error initializing ConsumerServiceMain: {}", e.getMessage(), e );
      vertx.close();
      throw e;
    }
    finally
    {
      reader.close();
    }
  }

  public void start()
  {
    NatsBrokerConnector connector = NatsBrokerConnector.dial( svcConfig.getNatsURL(), null );
    AckBridge           ackBridge = new AckBridge( InMemoryAckStore.shared() );

    BatchConsumerVert consumerVert = new BatchConsumerVert( connector, new JsonPayloadProcessor(), ackBridge );
    DeploymentOptions options      = new DeploymentOptions().setConfig( svcConfig.toJson() );

    vertx.deployVerticle( consumerVert, options )
      .onSuccess( id -> {
        deploymentId = id;
        LOGGER.info( "BatchConsumerVert deployed successfully: {}", id );
      })
      .onFailure( e -> {
        LOGGER.error( "Failed to deploy BatchConsumerVert: {}", e.getMessage(), e );
        cleanupResources();
      });
  }

  private void cleanupResources()
  {
    LOGGER.info( "Starting cleanup of resources" );

    try
    {
      if( deploymentId != null )
      {
        vertx.undeploy( deploymentId ).toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
        LOGGER.info( "Successfully undeployed verticle: {}", deploymentId );
        deploymentId = null;
      }
    }
    catch( InterruptedException e )
    {
      LOGGER.warn( "Interrupted while undeploying verticle {}: {}", deploymentId, e.getMessage() );
      Thread.currentThread().interrupt();
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error while undeploying verticle {}: {}", deploymentId, e.getMessage(), e );
    }

    try
    {
      vertx.close().toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
      LOGGER.info( "Vertx instance closed" );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error while closing Vertx instance: {}", e.getMessage(), e );
    }
  }

  public static void main( String[] args )
  {
    LOGGER.info( "ConsumerServiceMain.main - Starting ConsumerService" );

    final ConsumerServiceMain consumerSvc = new ConsumerServiceMain();

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      consumerSvc.cleanupResources();
    }));

    consumerSvc.start();
  }
}
