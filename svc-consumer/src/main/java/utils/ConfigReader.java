package utils;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import jetstream.exceptions.ConfigurationException;

/**
 * Reads the service configuration from a Kubernetes ConfigMap.
 */
public class ConfigReader
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConfigReader.class );

  private final KubernetesClient kubeClient;
  private final String           nameSpace;

  public ConfigReader()
  {
    this.kubeClient = new KubernetesClientBuilder().build();
    this.nameSpace  = kubeClient.getNamespace();
  }

  public ConfigReader( KubernetesClient kubeClient, String nameSpace )
  {
    this.kubeClient = kubeClient;
    this.nameSpace  = nameSpace;
  }

  /**
   * @return the ConfigMap name held by the environment variable, or the default when unset
   */
  public static String getConfigMapNameFromEnv( String envVar, String def )
  {
    String name = System.getenv( envVar );
    return ( name == null || name.trim().isEmpty() ) ? def : name.trim();
  }

  public Map<String, String> getConfigProperties( String configMapName )
  {
    LOGGER.info( "Reading configuration from configMap: {} in namespace: {}", configMapName, nameSpace );

    ConfigMap configMap = kubeClient.configMaps().inNamespace( nameSpace ).withName( configMapName ).get();
    if( configMap == null || configMap.getData() == null )
    {
      throw new ConfigurationException( "ConfigMap not found: " + configMapName + " in namespace " + nameSpace );
    }

    return configMap.getData();
  }

  public void close()
  {
    kubeClient.close();
  }
}
