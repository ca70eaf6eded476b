// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import io.clusterapi.actuator.watcher.StubSubscription;
import io.clusterapi.actuator.watcher.Subscription;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

import static java.net.HttpURLConnection.HTTP_CONFLICT;
import static java.net.HttpURLConnection.HTTP_NOT_FOUND;

/**
 * An in-memory cluster. Resources are stored as given, so tests may change them in place to simulate
 * controllers. Read failures may be queued per kind.
 */
public class FakeClusterClient implements ClusterClient {

  private final Map<ResourceKind<?, ?>, Map<String, KubernetesObject>> repositories = new ConcurrentHashMap<>();
  private final Map<ResourceKind<?, ?>, Deque<ApiException>> readFailures = new ConcurrentHashMap<>();
  private final List<String> deletions = new ArrayList<>();
  private final StubSubscription subscription = new StubSubscription();
  private final AtomicInteger generatedNames = new AtomicInteger();
  private final AtomicInteger resourceVersions = new AtomicInteger();

  /**
   * Adds resources directly, bypassing create checks.
   *
   * @param kind the kind
   * @param objects the resources
   * @param <T> the resource type
   * @return this client
   */
  @SafeVarargs
  public final <T extends KubernetesObject> FakeClusterClient define(ResourceKind<T, ?> kind, T... objects) {
    for (T object : objects) {
      assignUid(object);
      getRepository(kind).put(keyOf(kind, object.getMetadata()), object);
    }
    return this;
  }

  /**
   * Causes the next {@code count} reads of a kind to fail with the given HTTP status.
   *
   * @param kind the kind
   * @param count the number of failures
   * @param code the HTTP status
   * @return this client
   */
  public FakeClusterClient failReads(ResourceKind<?, ?> kind, int count, int code) {
    Deque<ApiException> failures = readFailures.computeIfAbsent(kind, k -> new ArrayDeque<>());
    synchronized (failures) {
      for (int i = 0; i < count; i++) {
        failures.add(new ApiException(code, "injected failure reading " + kind));
      }
    }
    return this;
  }

  public <T extends KubernetesObject> List<T> getResources(ResourceKind<T, ?> kind) {
    return getRepository(kind).values().stream().map(kind.getApiClass()::cast).collect(Collectors.toList());
  }

  public <T extends KubernetesObject> Optional<T> getResource(ResourceKind<T, ?> kind, String namespace,
                                                              String name) {
    return Optional.ofNullable(getRepository(kind).get(keyOf(kind, namespace, name))).map(kind.getApiClass()::cast);
  }

  /**
   * Returns the deleted resources as "kind namespace/name" strings, in deletion order.
   *
   * @return the deletions
   */
  public synchronized List<String> getDeletions() {
    return new ArrayList<>(deletions);
  }

  public StubSubscription getSubscription() {
    return subscription;
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> List<T> list(
      ResourceKind<T, L> kind, String namespace, String labelSelector) throws ApiException {
    checkReadFailure(kind);
    return getRepository(kind).values().stream()
        .map(kind.getApiClass()::cast)
        .filter(o -> !kind.isNamespaced() || namespace == null || namespace.equals(o.getMetadata().getNamespace()))
        .filter(o -> matchesSelector(o.getMetadata(), labelSelector))
        .collect(Collectors.toList());
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T get(
      ResourceKind<T, L> kind, String namespace, String name) throws ApiException {
    checkReadFailure(kind);
    return getResource(kind, namespace, name)
        .orElseThrow(() -> new ApiException(HTTP_NOT_FOUND, kind + " " + name + " not found"));
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T create(
      ResourceKind<T, L> kind, T object) throws ApiException {
    V1ObjectMeta metadata = object.getMetadata();
    if (metadata.getName() == null && metadata.getGenerateName() != null) {
      metadata.setName(metadata.getGenerateName() + generatedNames.incrementAndGet());
    }
    String key = keyOf(kind, metadata);
    if (getRepository(kind).containsKey(key)) {
      throw new ApiException(HTTP_CONFLICT, kind + " " + key + " already exists");
    }
    assignUid(object);
    getRepository(kind).put(key, object);
    return object;
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> T update(
      ResourceKind<T, L> kind, T object) throws ApiException {
    String key = keyOf(kind, object.getMetadata());
    if (!getRepository(kind).containsKey(key)) {
      throw new ApiException(HTTP_NOT_FOUND, kind + " " + key + " not found");
    }
    object.getMetadata().setResourceVersion(String.valueOf(resourceVersions.incrementAndGet()));
    getRepository(kind).put(key, object);
    return object;
  }

  @Override
  public <T extends KubernetesObject, L extends KubernetesListObject> void delete(
      ResourceKind<T, L> kind, T object, String propagationPolicy) throws ApiException {
    String key = keyOf(kind, object.getMetadata());
    if (getRepository(kind).remove(key) == null) {
      throw new ApiException(HTTP_NOT_FOUND, kind + " " + key + " not found");
    }
    synchronized (this) {
      deletions.add(kind + " " + key);
    }
  }

  @Override
  public Subscription openNotificationSubscription() {
    return subscription.openSubscription();
  }

  private Map<String, KubernetesObject> getRepository(ResourceKind<?, ?> kind) {
    return repositories.computeIfAbsent(kind, k -> new ConcurrentHashMap<>());
  }

  private void checkReadFailure(ResourceKind<?, ?> kind) throws ApiException {
    Deque<ApiException> failures = readFailures.get(kind);
    if (failures != null) {
      ApiException failure;
      synchronized (failures) {
        failure = failures.poll();
      }
      if (failure != null) {
        throw failure;
      }
    }
  }

  private void assignUid(KubernetesObject object) {
    if (object.getMetadata().getUid() == null) {
      object.getMetadata().setUid(UUID.randomUUID().toString());
    }
    object.getMetadata().setResourceVersion(String.valueOf(resourceVersions.incrementAndGet()));
  }

  private static String keyOf(ResourceKind<?, ?> kind, V1ObjectMeta metadata) {
    return keyOf(kind, metadata.getNamespace(), metadata.getName());
  }

  private static String keyOf(ResourceKind<?, ?> kind, String namespace, String name) {
    return kind.isNamespaced() ? namespace + "/" + name : name;
  }

  // supports comma-separated "key=value" and "key" terms
  private static boolean matchesSelector(V1ObjectMeta metadata, String labelSelector) {
    if (labelSelector == null || labelSelector.isEmpty()) {
      return true;
    }
    Map<String, String> labels = Optional.ofNullable(metadata.getLabels()).orElse(new HashMap<>());
    for (String term : labelSelector.split(",")) {
      int equals = term.indexOf('=');
      if (equals < 0) {
        if (!labels.containsKey(term.trim())) {
          return false;
        }
      } else if (!term.substring(equals + 1).trim().equals(labels.get(term.substring(0, equals).trim()))) {
        return false;
      }
    }
    return true;
  }
}
