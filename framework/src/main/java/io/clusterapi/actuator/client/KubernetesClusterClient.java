// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.watcher.Subscription;
import io.clusterapi.actuator.watcher.SubscriptionException;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.common.KubernetesType;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.CoreV1EventList;
import io.kubernetes.client.openapi.models.V1ListMeta;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.Config;
import io.kubernetes.client.util.Watchable;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.options.DeleteOptions;
import io.kubernetes.client.util.generic.options.ListOptions;

import static io.clusterapi.actuator.ActuatorConstants.KUBECONFIG;

/** A {@link ClusterClient} over the Kubernetes Java client's generic API. */
public class KubernetesClusterClient implements ClusterClient {

  static final int WATCH_TIMEOUT_SECONDS = 300;
  private static final Duration REOPEN_DELAY = Duration.ofSeconds(1);

  private final ApiClient apiClient;
  private final LoggingFacade logger;
  private final Map<ResourceKind<?, ?>, GenericKubernetesApi<?, ?>> apis = new ConcurrentHashMap<>();

  public KubernetesClusterClient(ApiClient apiClient, LoggingFacade logger) {
    this.apiClient = apiClient;
    this.logger = logger;
  }

  /**
   * Creates a client for the cluster named by the KUBECONFIG setting, or found by the standard client
   * configuration rules when it is not set. Reads never time out, so that watches can block.
   *
   * @param logger the diagnostic sink
   * @return the client
   * @throws IOException if the client configuration cannot be read
   */
  public static KubernetesClusterClient create(LoggingFacade logger) throws IOException {
    ApiClient client = KUBECONFIG != null ? Config.fromConfig(KUBECONFIG) : ClientBuilder.standard().build();
    client.setHttpClient(client.getHttpClient().newBuilder().readTimeout(0, TimeUnit.SECONDS).build());
    return new KubernetesClusterClient(client, logger);
  }

  @SuppressWarnings("unchecked")
  private <T extends KubernetesObject, L extends KubernetesListObject> GenericKubernetesApi<T, L> api(
      ResourceKind<T, L> kind) {
    return (GenericKubernetesApi<T, L>) apis.computeIfAbsent(kind, k -> new GenericKubernetesApi<>(
        kind.getApiClass(), kind.getListClass(), kind.getGroup(), kind.getVersion(), kind.getPlural(), apiClient));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T extends KubernetesObject, L extends KubernetesListObject> List<T> list(
      ResourceKind<T, L> kind, String namespace, String labelSelector) throws ApiException {
    ListOptions options = new ListOptions();
    options.setLabelSelector(labelSelector);
    L list = getObject(kind.isNamespaced() && namespace != null
        ? api(kind).list(namespace, options)
        : api(kind).list(options));
    return (List<T>) list.getItems();
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T get(
      ResourceKind<T, L> kind, String namespace, String name) throws ApiException {
    return getObject(kind.isNamespaced() ? api(kind).get(namespace, name) : api(kind).get(name));
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T create(
      ResourceKind<T, L> kind, T object) throws ApiException {
    return getObject(api(kind).create(object));
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T update(
      ResourceKind<T, L> kind, T object) throws ApiException {
    return getObject(api(kind).update(object));
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> void delete(
      ResourceKind<T, L> kind, T object, String propagationPolicy) throws ApiException {
    DeleteOptions options = new DeleteOptions();
    options.setPropagationPolicy(propagationPolicy);
    V1ObjectMeta metadata = object.getMetadata();
    KubernetesApiResponse<T> response = kind.isNamespaced()
        ? api(kind).delete(metadata.getNamespace(), metadata.getName(), options)
        : api(kind).delete(metadata.getName(), options);
    checkSuccess(response);
  }

  @Override
  public Subscription openNotificationSubscription() throws SubscriptionException {
    return new EventSubscription(new EventApiWatchSource(api(ResourceKind.EVENT)), REOPEN_DELAY, logger).open();
  }

  private <R extends KubernetesType> R getObject(KubernetesApiResponse<R> response) throws ApiException {
    return checkSuccess(response).getObject();
  }

  private <R extends KubernetesType> KubernetesApiResponse<R> checkSuccess(KubernetesApiResponse<R> response)
      throws ApiException {
    if (!response.isSuccess()) {
      String message = Optional.ofNullable(response.getStatus()).map(V1Status::getMessage)
          .orElse("Request failed with status " + response.getHttpStatusCode());
      throw new ApiException(response.getHttpStatusCode(), message);
    }
    return response;
  }

  private class EventApiWatchSource implements EventSubscription.EventWatchSource {
    private final GenericKubernetesApi<CoreV1Event, CoreV1EventList> eventApi;

    EventApiWatchSource(GenericKubernetesApi<CoreV1Event, CoreV1EventList> eventApi) {
      this.eventApi = eventApi;
    }

    @Override
    public String currentResourceVersion() throws ApiException {
      ListOptions options = new ListOptions();
      options.setLimit(1);
      CoreV1EventList list = getObject(eventApi.list(options));
      return Optional.ofNullable(list.getMetadata()).map(V1ListMeta::getResourceVersion).orElse(null);
    }

    @Override
    public Watchable<CoreV1Event> watch(String resourceVersion) throws ApiException {
      ListOptions options = new ListOptions();
      options.setResourceVersion(resourceVersion);
      options.setTimeoutSeconds(WATCH_TIMEOUT_SECONDS);
      return eventApi.watch(options);
    }
  }
}
